package com.fintech.checkout.dto;

import com.fintech.checkout.entity.PaymentMethod;
import com.fintech.checkout.entity.PaymentRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    private PaymentRecord payment;

    private PaymentMethod resolvedMethod;

    /**
     * True when the record was already completed before this call.
     */
    private boolean alreadyCompleted;

    public String getMessage() {
        return "Payment successful via " + resolvedMethod.value();
    }
}
