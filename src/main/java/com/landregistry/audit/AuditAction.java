package com.landregistry.audit;

/**
 * Closed vocabulary of state-changing actions recorded in the audit log.
 */
public enum AuditAction {
    PARCEL_CREATED,
    APPLICATION_CREATED,

    /**
     * Any status change of an application, including cancellation and approval.
     */
    APPLICATION_STATUS_CHANGED,

    CERTIFICATE_ISSUED,
    CERTIFICATE_REVOKED,
    PAYMENT_COMPLETED,
    PAYMENT_FAILED,
    PAYMENT_REFUNDED
}
