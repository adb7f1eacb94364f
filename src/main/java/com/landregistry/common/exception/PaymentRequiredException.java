package com.landregistry.common.exception;

/**
 * Thrown when an application is approved before its fee has been paid
 * and the payment gate is enabled.
 */
public class PaymentRequiredException extends ConflictException {

    public PaymentRequiredException(String applicationId, String paymentStatus) {
        super(String.format("Payment is required to approve application %s (payment status %s)",
            applicationId, paymentStatus));
    }
}
