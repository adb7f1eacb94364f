package com.landregistry.common.exception;

/**
 * Thrown when a request collides with existing registry state.
 */
public abstract class ConflictException extends LandRegistryException {

    protected ConflictException(String message) {
        super(message);
    }
}
