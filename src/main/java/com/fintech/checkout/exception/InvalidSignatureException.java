package com.fintech.checkout.exception;

/**
 * Thrown when an HMAC signature does not match the payload it claims to sign.
 * Nothing is written once this has been raised.
 */
public class InvalidSignatureException extends PaymentException {

    public InvalidSignatureException(String message) {
        super(message);
    }
}
