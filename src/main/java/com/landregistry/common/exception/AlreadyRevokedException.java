package com.landregistry.common.exception;

/**
 * Thrown when revoking a certificate that is already revoked.
 */
public class AlreadyRevokedException extends ConflictException {

    public AlreadyRevokedException(String certificateNumber) {
        super("Certificate has already been revoked: " + certificateNumber);
    }
}
