package com.landregistry.common.exception;

/**
 * Thrown when an application is not found.
 */
public class ApplicationNotFoundException extends NotFoundException {

    public ApplicationNotFoundException(String applicationId) {
        super("Application", applicationId);
    }
}
