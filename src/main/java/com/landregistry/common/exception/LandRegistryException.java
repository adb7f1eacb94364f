package com.landregistry.common.exception;

/**
 * Base exception for all land registry exceptions.
 */
public class LandRegistryException extends RuntimeException {

    public LandRegistryException(String message) {
        super(message);
    }

    public LandRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
