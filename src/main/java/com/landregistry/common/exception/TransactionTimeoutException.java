package com.landregistry.common.exception;

/**
 * Thrown when a unit of work could not obtain its locks or finish in time.
 * All of its effects have been rolled back; the caller may retry.
 */
public class TransactionTimeoutException extends LandRegistryException {

    public TransactionTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
