package com.fintech.checkout.controller;

import com.fintech.checkout.dto.ApiResult;
import com.fintech.checkout.dto.PaymentStats;
import com.fintech.checkout.entity.PaymentRecord;
import com.fintech.checkout.entity.PaymentStatus;
import com.fintech.checkout.exception.InvalidPaymentRequestException;
import com.fintech.checkout.service.PaymentReconciliationService;
import com.fintech.checkout.service.PaymentSearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Back-office view of payment records.
 */
@RestController
@RequestMapping("/api/admin/payments")
@RequiredArgsConstructor
@Tag(name = "Admin payments", description = "Payment record lookups")
public class AdminPaymentController {

    private static final int MAX_PAGE_SIZE = 100;

    private final PaymentSearchService paymentSearchService;
    private final PaymentReconciliationService reconciliationService;

    @Operation(summary = "List payments",
            description = "Newest first, filtered by status, creation date and an order number or Razorpay order id.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Page of payment records"),
            @ApiResponse(responseCode = "400", description = "Unknown status or inverted date range")
    })
    @GetMapping
    public ResponseEntity<ApiResult<Page<PaymentRecord>>> list(
            @Parameter(description = "pending, completed, failed, refunded or all") @RequestParam(required = false) String status,
            @Parameter(description = "Order number or Razorpay order id fragment") @RequestParam(required = false) String search,
            @Parameter(description = "First day, yyyy-MM-dd") @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @Parameter(description = "Last day, yyyy-MM-dd") @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        Pageable pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE),
                Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<PaymentRecord> records = paymentSearchService.search(parseStatus(status), search,
                startDate, endDate, pageable);
        return ResponseEntity.ok(ApiResult.ok(records));
    }

    @Operation(summary = "Payment counts by status")
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully")
    @GetMapping("/stats")
    public ResponseEntity<ApiResult<PaymentStats>> stats() {
        return ResponseEntity.ok(ApiResult.ok(reconciliationService.getStats()));
    }

    @Operation(summary = "Get payment by Razorpay order id")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment found"),
            @ApiResponse(responseCode = "404", description = "Payment not found")
    })
    @GetMapping("/{razorpayOrderId}")
    public ResponseEntity<ApiResult<PaymentRecord>> get(@PathVariable String razorpayOrderId) {
        return ResponseEntity.ok(ApiResult.ok(paymentSearchService.getByRazorpayOrderId(razorpayOrderId)));
    }

    private static PaymentStatus parseStatus(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("all")) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(PaymentStatus.values())
                .filter(status -> status.value().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidPaymentRequestException("Unknown payment status: " + value));
    }
}
