package com.landregistry.common.exception;

/**
 * Thrown when an application is approved or rejected without a reviewer.
 */
public class ReviewerRequiredException extends InvalidInputException {

    public ReviewerRequiredException(String applicationId, String targetStatus) {
        super(String.format("A reviewer is required to move application %s to %s", applicationId, targetStatus));
    }
}
