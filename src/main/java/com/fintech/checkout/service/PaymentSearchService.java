package com.fintech.checkout.service;

import com.fintech.checkout.entity.Order;
import com.fintech.checkout.entity.PaymentRecord;
import com.fintech.checkout.entity.PaymentStatus;
import com.fintech.checkout.exception.InvalidPaymentRequestException;
import com.fintech.checkout.exception.PaymentNotFoundException;
import com.fintech.checkout.repository.OrderRepository;
import com.fintech.checkout.repository.PaymentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Back-office payment lookups.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentSearchService {

    private static final LocalDateTime EARLIEST = LocalDateTime.of(1970, 1, 1, 0, 0);
    private static final LocalDateTime LATEST = LocalDateTime.of(9999, 12, 31, 0, 0);

    private final PaymentRecordRepository paymentRecordRepository;
    private final OrderRepository orderRepository;

    /**
     * Lists payment records, newest first.
     *
     * @param status    only records in this status, or all when null
     * @param search    fragment of an order number or Razorpay order id, or an exact order id
     * @param startDate first creation day included, or unbounded when null
     * @param endDate   last creation day included, or unbounded when null
     */
    @Transactional(readOnly = true)
    public Page<PaymentRecord> search(PaymentStatus status, String search,
                                      LocalDate startDate, LocalDate endDate, Pageable pageable) {
        if (startDate != null && endDate != null && startDate.isAfter(endDate)) {
            throw new InvalidPaymentRequestException("startDate must not be after endDate");
        }
        LocalDateTime from = startDate == null ? EARLIEST : startDate.atStartOfDay();
        LocalDateTime to = endDate == null ? LATEST : endDate.plusDays(1).atStartOfDay();

        String pattern = "%";
        // IN () is not valid SQL, so an unused id list still carries one value
        Set<String> orderIds = new LinkedHashSet<>(List.of(""));
        if (StringUtils.hasText(search)) {
            String term = search.trim();
            pattern = "%" + escapeLike(term.toLowerCase()) + "%";
            orderIds.add(term);
            for (Order order : orderRepository.findByOrderNumberContainingIgnoreCase(term)) {
                orderIds.add(order.getId());
            }
        }
        log.debug("Payment search status={} search='{}' from={} to={} ({} order ids)",
                status, search, from, to, orderIds.size() - 1);
        return paymentRecordRepository.search(status, from, to, pattern, orderIds, pageable);
    }

    @Transactional(readOnly = true)
    public PaymentRecord getByRazorpayOrderId(String razorpayOrderId) {
        return paymentRecordRepository.findByRazorpayOrderId(razorpayOrderId)
                .orElseThrow(() -> new PaymentNotFoundException(razorpayOrderId));
    }

    static String escapeLike(String value) {
        return value.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}
