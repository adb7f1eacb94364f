package com.landregistry.common.exception;

/**
 * Thrown when a certificate is not found.
 */
public class CertificateNotFoundException extends NotFoundException {

    public CertificateNotFoundException(String certificateRef) {
        super("Certificate", certificateRef);
    }
}
