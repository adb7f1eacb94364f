package com.landregistry.api.controller;

import com.landregistry.api.dto.RevokeCertificateRequest;
import com.landregistry.api.dto.VerifyCertificateRequest;
import com.landregistry.certificates.Certificate;
import com.landregistry.certificates.CertificateService;
import com.landregistry.certificates.CertificateStats;
import com.landregistry.certificates.VerificationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for certificates. Certificates are issued by approving an application, never directly.
 */
@RestController
@RequestMapping("/api/v1/certificates")
@RequiredArgsConstructor
@Tag(name = "Certificates", description = "Land certificate API")
public class CertificateController {

    private final CertificateService certificateService;

    @GetMapping("/{certificateId}")
    @Operation(summary = "Get certificate details")
    public ResponseEntity<Certificate> getCertificate(@PathVariable String certificateId) {
        return ResponseEntity.ok(certificateService.getCertificate(certificateId));
    }

    @GetMapping("/number/{certificateNumber}")
    @Operation(summary = "Get a certificate by its certificate number")
    public ResponseEntity<Certificate> getCertificateByNumber(@PathVariable String certificateNumber) {
        return ResponseEntity.ok(certificateService.getCertificateByNumber(certificateNumber));
    }

    @GetMapping("/verification-code/{verificationCode}")
    @Operation(summary = "Look up a certificate by its public verification code")
    public ResponseEntity<Certificate> getCertificateByVerificationCode(@PathVariable String verificationCode) {
        return ResponseEntity.ok(certificateService.getCertificateByVerificationCode(verificationCode));
    }

    @PostMapping("/{certificateId}/revoke")
    @Operation(summary = "Revoke a certificate")
    public ResponseEntity<Certificate> revokeCertificate(
            @PathVariable String certificateId,
            @Valid @RequestBody RevokeCertificateRequest request) {
        Certificate certificate = certificateService.revokeCertificate(
            certificateId, request.getActorId(), request.getReason());
        return ResponseEntity.ok(certificate);
    }

    @PostMapping("/verify")
    @Operation(summary = "Verify a certificate number against its integrity hash")
    public ResponseEntity<VerificationResult> verifyCertificate(@RequestBody VerifyCertificateRequest request) {
        return ResponseEntity.ok(
            certificateService.verifyCertificate(request.getCertificateNumber(), request.getHash()));
    }

    @GetMapping("/stats")
    @Operation(summary = "Certificate counts by status and recent issuance")
    public ResponseEntity<CertificateStats> getCertificateStats() {
        return ResponseEntity.ok(certificateService.getCertificateStats());
    }
}
