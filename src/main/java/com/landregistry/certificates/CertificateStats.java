package com.landregistry.certificates;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CertificateStats {
    long totalCertificates;
    long activeCertificates;
    long revokedCertificates;
    long expiredCertificates;
    long issuedLast30Days;
    long issuedLast7Days;
}
