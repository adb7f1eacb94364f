package com.landregistry.certificates;

import com.landregistry.applications.Application;
import com.landregistry.applications.ApplicationStatus;
import com.landregistry.audit.AuditAction;
import com.landregistry.audit.AuditEntry;
import com.landregistry.audit.AuditTrail;
import com.landregistry.common.DataIntegrityErrors;
import com.landregistry.common.exception.CertificateNotFoundException;
import com.landregistry.common.exception.DuplicateCertificateException;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.common.exception.InvalidTransitionException;
import com.landregistry.config.LandRegistryProperties;
import com.landregistry.parcels.Parcel;
import com.landregistry.transaction.TransactionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;

/**
 * Certificate issuer.
 *
 * Certificates are only ever issued from inside an approval unit of work; there is no standalone
 * issue operation. Revocation is a unit of work of its own and leaves the parcel registered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateService {

    private static final int MAX_CODE_ATTEMPTS = 10;

    private final CertificateRepository certificateRepository;
    private final CertificateHasher certificateHasher;
    private final TransactionCoordinator transactionCoordinator;
    private final LandRegistryProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Issue the certificate for an application that has just been approved, within the caller's
     * transaction. The caller must hold the parcel lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Certificate issueCertificate(Application application, Parcel parcel, String issuerId, AuditTrail audit) {
        if (application.getStatus() != ApplicationStatus.APPROVED) {
            throw new InvalidTransitionException("application", application.getId(),
                application.getStatus().name(), "certificate issuance");
        }
        if (certificateRepository.existsByApplicationId(application.getId())) {
            throw new DuplicateCertificateException(application.getId());
        }

        LandRegistryProperties.Certificates settings = properties.getCertificates();
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        Instant expiresAt = issuedAt.atOffset(ZoneOffset.UTC)
            .plusYears(settings.getValidityYears())
            .toInstant();
        String certificateNumber = settings.getNumberPrefix() + "-" + issuedAt.toEpochMilli()
            + "-" + parcel.getParcelNumber();
        String hash = certificateHasher.hash(
            certificateNumber, parcel.getId(), application.getId(), issuerId, issuedAt);

        Certificate certificate = new Certificate(certificateNumber, parcel.getId(), application.getId(),
            issuerId, issuedAt, expiresAt, newVerificationCode(), hash);
        try {
            certificateRepository.saveAndFlush(certificate);
        } catch (DataIntegrityViolationException e) {
            if (DataIntegrityErrors.violates(e, Certificate.APPLICATION_CONSTRAINT)) {
                throw new DuplicateCertificateException(application.getId());
            }
            throw e;
        }

        audit.record(AuditEntry.builder()
            .actorId(issuerId)
            .action(AuditAction.CERTIFICATE_ISSUED)
            .resourceType("certificate")
            .resourceId(certificate.getId())
            .details("Certificate " + certificateNumber + " issued for application " + application.getId())
            .attribute("certificateNumber", certificateNumber)
            .attribute("applicationId", application.getId())
            .attribute("parcelId", parcel.getId())
            .build());

        log.info("Issued certificate {} for application {} on parcel {}",
            certificateNumber, application.getId(), parcel.getParcelNumber());
        return certificate;
    }

    public Certificate revokeCertificate(String certificateId, String actorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new InvalidInputException("A revocation reason is required");
        }
        if (reason.trim().length() > Certificate.MAX_REASON_LENGTH) {
            throw new InvalidInputException("Revocation reason must be at most "
                + Certificate.MAX_REASON_LENGTH + " characters");
        }

        return transactionCoordinator.runInTransaction("revokeCertificate", audit -> {
            Certificate certificate = certificateRepository.findByIdForUpdate(certificateId)
                .orElseThrow(() -> new CertificateNotFoundException(certificateId));

            certificate.revoke(actorId, reason.trim(), clock.instant());
            certificateRepository.save(certificate);

            audit.record(AuditEntry.builder()
                .actorId(actorId)
                .action(AuditAction.CERTIFICATE_REVOKED)
                .resourceType("certificate")
                .resourceId(certificate.getId())
                .details("Certificate " + certificate.getCertificateNumber() + " revoked")
                .attribute("certificateNumber", certificate.getCertificateNumber())
                .attribute("reason", reason.trim())
                .build());

            log.info("Revoked certificate {} by {}", certificate.getCertificateNumber(), actorId);
            return certificate;
        });
    }

    /**
     * Public check of a certificate number against a supplied hash. Never throws for unknown
     * certificates.
     */
    @Transactional(readOnly = true)
    public VerificationResult verifyCertificate(String certificateNumber, String suppliedHash) {
        if (certificateNumber == null || certificateNumber.isBlank()) {
            return VerificationResult.invalid(VerificationResult.Reason.NOT_FOUND);
        }
        Certificate certificate = certificateRepository.findByCertificateNumber(certificateNumber.trim())
            .orElse(null);
        if (certificate == null) {
            return VerificationResult.invalid(VerificationResult.Reason.NOT_FOUND);
        }
        if (!certificate.isValidAt(clock.instant())) {
            return VerificationResult.invalid(VerificationResult.Reason.NOT_ACTIVE);
        }

        String recomputed = certificateHasher.hash(certificate);
        if (!certificateHasher.matches(certificate.getCertificateHash(), recomputed)) {
            log.warn("Stored hash of certificate {} does not match its content", certificate.getCertificateNumber());
            return VerificationResult.invalid(VerificationResult.Reason.HASH_MISMATCH);
        }
        if (!certificateHasher.matches(certificate.getCertificateHash(), suppliedHash)) {
            return VerificationResult.invalid(VerificationResult.Reason.HASH_MISMATCH);
        }
        return VerificationResult.valid();
    }

    @Transactional(readOnly = true)
    public Certificate getCertificate(String certificateId) {
        return certificateRepository.findById(certificateId)
            .orElseThrow(() -> new CertificateNotFoundException(certificateId));
    }

    @Transactional(readOnly = true)
    public Certificate getCertificateByNumber(String certificateNumber) {
        return certificateRepository.findByCertificateNumber(certificateNumber)
            .orElseThrow(() -> new CertificateNotFoundException(certificateNumber));
    }

    @Transactional(readOnly = true)
    public Certificate getCertificateByVerificationCode(String verificationCode) {
        return certificateRepository.findByVerificationCode(verificationCode)
            .orElseThrow(() -> new CertificateNotFoundException(verificationCode));
    }

    @Transactional(readOnly = true)
    public Certificate getCertificateForApplication(String applicationId) {
        return certificateRepository.findByApplicationId(applicationId)
            .orElseThrow(() -> new CertificateNotFoundException("application " + applicationId));
    }

    @Transactional(readOnly = true)
    public CertificateStats getCertificateStats() {
        Instant now = clock.instant();
        long active = certificateRepository.countByStatus(CertificateStatus.ACTIVE);
        long lapsed = certificateRepository.countByStatusAndExpiresAtBefore(CertificateStatus.ACTIVE, now);
        return CertificateStats.builder()
            .totalCertificates(certificateRepository.count())
            .activeCertificates(active - lapsed)
            .revokedCertificates(certificateRepository.countByStatus(CertificateStatus.REVOKED))
            .expiredCertificates(certificateRepository.countByStatus(CertificateStatus.EXPIRED) + lapsed)
            .issuedLast30Days(certificateRepository.countByIssuedAtAfter(now.minus(Duration.ofDays(30))))
            .issuedLast7Days(certificateRepository.countByIssuedAtAfter(now.minus(Duration.ofDays(7))))
            .build();
    }

    private String newVerificationCode() {
        int length = properties.getCertificates().getVerificationCodeLength();
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            byte[] bytes = new byte[(length + 1) / 2];
            secureRandom.nextBytes(bytes);
            String code = HexFormat.of().withUpperCase().formatHex(bytes).substring(0, length);
            if (!certificateRepository.existsByVerificationCode(code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a unique verification code after "
            + MAX_CODE_ATTEMPTS + " attempts");
    }
}
