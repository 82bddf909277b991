package com.fintech.checkout.service;

import com.fintech.checkout.entity.Notification;
import com.fintech.checkout.entity.NotificationType;
import com.fintech.checkout.event.NotificationEvent;
import com.fintech.checkout.repository.NotificationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records admin notifications.
 * <p>
 * A notification raised inside a transaction is stored only after that transaction
 * commits, so a rolled-back or retried attempt leaves nothing behind. Outside a
 * transaction it is stored straight away. The write runs in its own transaction and
 * every failure is logged and swallowed: a notification never fails the payment
 * update that raised it.
 */
@Service
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate requiresNewTransaction;

    public NotificationService(NotificationRepository notificationRepository,
                               ApplicationEventPublisher eventPublisher,
                               PlatformTransactionManager transactionManager) {
        this.notificationRepository = notificationRepository;
        this.eventPublisher = eventPublisher;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void publish(NotificationType type, String message, Map<String, Object> data) {
        try {
            eventPublisher.publishEvent(new NotificationEvent(type, message,
                    data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data)));
        } catch (RuntimeException e) {
            log.error("Failed to raise {} notification '{}'", type, message, e);
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onNotification(NotificationEvent event) {
        try {
            requiresNewTransaction.executeWithoutResult(status -> notificationRepository.save(
                    Notification.builder()
                            .type(event.getType())
                            .message(event.getMessage())
                            .data(new LinkedHashMap<>(event.getData()))
                            .read(false)
                            .build()));
            log.debug("Recorded {} notification: {}", event.getType(), event.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to record {} notification '{}'", event.getType(), event.getMessage(), e);
        }
    }
}
