package com.fintech.checkout.dto;

/**
 * What a webhook-driven state change did.
 */
public enum ReconciliationOutcome {
    /**
     * Records were updated.
     */
    APPLIED,

    /**
     * Records already carried this state; nothing was written.
     */
    DUPLICATE,

    /**
     * The transition is not allowed from the current status; nothing was written.
     */
    IGNORED,

    /**
     * No order or payment record matches the event.
     */
    UNMATCHED
}
