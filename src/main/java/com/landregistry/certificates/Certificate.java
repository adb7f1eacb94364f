package com.landregistry.certificates;

import com.landregistry.common.exception.AlreadyRevokedException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Proof of registered ownership, bound one-to-one to the approved application it was issued for.
 *
 * Certificates are never deleted. The only mutation after issuance is {@link #revoke}.
 */
@Entity
@Table(name = "certificates",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_certificate_number", columnNames = "certificate_number"),
        @UniqueConstraint(name = "uk_certificate_verification_code", columnNames = "verification_code"),
        @UniqueConstraint(name = Certificate.APPLICATION_CONSTRAINT, columnNames = "application_id")
    },
    indexes = {
        @Index(name = "idx_certificate_parcel", columnList = "parcel_id"),
        @Index(name = "idx_certificate_status", columnList = "status")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Certificate {

    public static final String APPLICATION_CONSTRAINT = "uk_certificate_application";
    public static final int MAX_REASON_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "certificate_number", nullable = false, updatable = false, length = 100)
    private String certificateNumber;

    @Column(name = "parcel_id", nullable = false, updatable = false)
    private String parcelId;

    @Column(name = "application_id", nullable = false, updatable = false)
    private String applicationId;

    @Column(name = "issued_by", nullable = false, updatable = false)
    private String issuedBy;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", updatable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private CertificateStatus status;

    /**
     * SHA-256 over the canonical certificate content, lower-case hex.
     */
    @Column(name = "certificate_hash", nullable = false, updatable = false, length = 64)
    private String certificateHash;

    @Column(name = "verification_code", nullable = false, updatable = false, length = 64)
    private String verificationCode;

    @Column(name = "revocation_reason", length = MAX_REASON_LENGTH)
    private String revocationReason;

    @Column(name = "revoked_by")
    private String revokedBy;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Certificate(String certificateNumber, String parcelId, String applicationId, String issuedBy,
                       Instant issuedAt, Instant expiresAt, String verificationCode, String certificateHash) {
        if (expiresAt != null && !expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Certificate expiry must be after issuance");
        }
        this.certificateNumber = certificateNumber;
        this.parcelId = parcelId;
        this.applicationId = applicationId;
        this.issuedBy = issuedBy;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.verificationCode = verificationCode;
        this.certificateHash = certificateHash;
        this.status = CertificateStatus.ACTIVE;
        this.createdAt = issuedAt;
        this.updatedAt = issuedAt;
    }

    public void revoke(String revokedBy, String reason, Instant now) {
        if (status == CertificateStatus.REVOKED) {
            throw new AlreadyRevokedException(certificateNumber);
        }
        this.status = CertificateStatus.REVOKED;
        this.revokedBy = revokedBy;
        this.revokedAt = now;
        this.revocationReason = reason;
        this.updatedAt = now;
    }

    /**
     * Active and not past its expiry at {@code now}.
     */
    public boolean isValidAt(Instant now) {
        return status == CertificateStatus.ACTIVE && (expiresAt == null || expiresAt.isAfter(now));
    }
}
