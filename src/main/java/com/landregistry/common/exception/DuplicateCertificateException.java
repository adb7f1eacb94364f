package com.landregistry.common.exception;

/**
 * Thrown when a certificate has already been issued for an application.
 */
public class DuplicateCertificateException extends ConflictException {

    public DuplicateCertificateException(String applicationId) {
        super("A certificate has already been issued for application " + applicationId);
    }
}
