package com.landregistry.applications;

/**
 * Status of the application fee payment.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,

    /**
     * Fee returned after the application was rejected or cancelled.
     */
    REFUNDED;

    public boolean canTransitionTo(PaymentStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
            case FAILED:
                return target == PAID || target == FAILED;
            case PAID:
                return target == REFUNDED;
            default:
                return false;
        }
    }
}
