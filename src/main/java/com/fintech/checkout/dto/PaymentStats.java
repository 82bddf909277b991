package com.fintech.checkout.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PaymentStats {
    private long pendingCount;
    private long completedCount;
    private long failedCount;
    private long refundedCount;
}
