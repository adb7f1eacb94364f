package com.landregistry.common.exception;

/**
 * Thrown when an audit event cannot be persisted.
 * The enclosing unit of work is rolled back.
 */
public class AuditWriteException extends LandRegistryException {

    public AuditWriteException(String action, Throwable cause) {
        super("Failed to write audit event " + action, cause);
    }
}
