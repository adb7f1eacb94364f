package com.landregistry.certificates;

public enum CertificateStatus {
    ACTIVE,
    REVOKED,
    EXPIRED
}
