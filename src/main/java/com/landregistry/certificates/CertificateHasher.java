package com.landregistry.certificates;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.HexFormat;

/**
 * Integrity hash over the canonical content of a certificate.
 *
 * <pre>
 * certificateNumber|parcelId|applicationId|issuedBy|issuedAt
 * </pre>
 *
 * {@code issuedAt} is written as an ISO-8601 UTC instant with exactly three fraction digits.
 */
@Component
public class CertificateHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final String SEPARATOR = "|";
    private static final DateTimeFormatter ISSUED_AT_FORMAT = new DateTimeFormatterBuilder()
        .appendInstant(3)
        .toFormatter();

    public String hash(Certificate certificate) {
        return hash(certificate.getCertificateNumber(), certificate.getParcelId(),
            certificate.getApplicationId(), certificate.getIssuedBy(), certificate.getIssuedAt());
    }

    public String hash(String certificateNumber, String parcelId, String applicationId,
                       String issuedBy, Instant issuedAt) {
        String canonical = String.join(SEPARATOR,
            certificateNumber, parcelId, applicationId, issuedBy, ISSUED_AT_FORMAT.format(issuedAt));
        return HexFormat.of().formatHex(digest().digest(canonical.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Constant-time comparison of two hex digests, ignoring case.
     */
    public boolean matches(String expected, String supplied) {
        if (expected == null || supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.toLowerCase().getBytes(StandardCharsets.US_ASCII),
            supplied.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII));
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
