package com.landregistry.common.exception;

/**
 * Thrown when a referenced registry entity does not exist.
 */
public abstract class NotFoundException extends LandRegistryException {

    protected NotFoundException(String entity, String id) {
        super(entity + " not found: " + id);
    }
}
