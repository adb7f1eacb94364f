package com.landregistry.common.exception;

/**
 * Thrown when a requested status change is not allowed from the current status.
 */
public class InvalidTransitionException extends LandRegistryException {

    public InvalidTransitionException(String entity, String id, String currentStatus, String targetStatus) {
        super(String.format("Cannot move %s %s from %s to %s", entity, id, currentStatus, targetStatus));
    }
}
