package com.landregistry.api.controller;

import com.landregistry.api.dto.CancelApplicationRequest;
import com.landregistry.api.dto.RecordPaymentRequest;
import com.landregistry.api.dto.SubmitApplicationRequest;
import com.landregistry.api.dto.TransitionApplicationRequest;
import com.landregistry.applications.Application;
import com.landregistry.applications.ApplicationService;
import com.landregistry.applications.ApplicationStats;
import com.landregistry.applications.SubmitApplicationCommand;
import com.landregistry.certificates.Certificate;
import com.landregistry.certificates.CertificateService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the application workflow.
 */
@RestController
@RequestMapping("/api/v1/applications")
@RequiredArgsConstructor
@Tag(name = "Applications", description = "Land application workflow API")
public class ApplicationController {

    private final ApplicationService applicationService;
    private final CertificateService certificateService;

    @PostMapping
    @Operation(summary = "Submit an application against a parcel")
    public ResponseEntity<Application> submitApplication(@Valid @RequestBody SubmitApplicationRequest request) {
        SubmitApplicationCommand command = SubmitApplicationCommand.builder()
            .applicantId(request.getApplicantId())
            .parcelId(request.getParcelId())
            .applicationType(request.getApplicationType())
            .priorityLevel(request.getPriorityLevel())
            .notes(request.getNotes())
            .build();
        Application application = applicationService.submitApplication(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(application);
    }

    @GetMapping("/{applicationId}")
    @Operation(summary = "Get application details")
    public ResponseEntity<Application> getApplication(@PathVariable String applicationId) {
        return ResponseEntity.ok(applicationService.getApplication(applicationId));
    }

    @GetMapping("/applicant/{applicantId}")
    @Operation(summary = "Get all applications of an applicant, newest first")
    public ResponseEntity<List<Application>> getApplicationsByApplicant(@PathVariable String applicantId) {
        return ResponseEntity.ok(applicationService.getApplicationsByApplicant(applicantId));
    }

    @PostMapping("/{applicationId}/transition")
    @Operation(summary = "Move an application to a new status; approval issues the certificate")
    public ResponseEntity<Application> transitionApplication(
            @PathVariable String applicationId,
            @Valid @RequestBody TransitionApplicationRequest request) {
        Application application = applicationService.transitionApplication(
            applicationId, request.getStatus(), request.getReviewerId(), request.getNotes());
        return ResponseEntity.ok(application);
    }

    @PostMapping("/{applicationId}/cancel")
    @Operation(summary = "Cancel an open application")
    public ResponseEntity<Application> cancelApplication(
            @PathVariable String applicationId,
            @Valid @RequestBody CancelApplicationRequest request) {
        return ResponseEntity.ok(applicationService.cancelApplication(applicationId, request.getActorId()));
    }

    @PostMapping("/{applicationId}/payment")
    @Operation(summary = "Record the outcome of the application fee payment")
    public ResponseEntity<Application> recordPayment(
            @PathVariable String applicationId,
            @Valid @RequestBody RecordPaymentRequest request) {
        Application application = applicationService.recordPayment(
            applicationId, request.getPaymentStatus(), request.getPaymentReference(), request.getActorId());
        return ResponseEntity.ok(application);
    }

    @GetMapping("/{applicationId}/certificate")
    @Operation(summary = "Get the certificate issued for an approved application")
    public ResponseEntity<Certificate> getCertificate(@PathVariable String applicationId) {
        return ResponseEntity.ok(certificateService.getCertificateForApplication(applicationId));
    }

    @GetMapping("/stats")
    @Operation(summary = "Application counts and fee totals")
    public ResponseEntity<ApplicationStats> getApplicationStats() {
        return ResponseEntity.ok(applicationService.getApplicationStats());
    }
}
