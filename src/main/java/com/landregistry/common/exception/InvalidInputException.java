package com.landregistry.common.exception;

/**
 * Thrown when an operation is called with malformed input.
 */
public class InvalidInputException extends LandRegistryException {

    public InvalidInputException(String message) {
        super(message);
    }
}
