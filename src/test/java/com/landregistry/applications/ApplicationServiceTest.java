package com.landregistry.applications;

import com.landregistry.TestFixtures;
import com.landregistry.audit.AuditAction;
import com.landregistry.audit.AuditEventRepository;
import com.landregistry.certificates.Certificate;
import com.landregistry.certificates.CertificateRepository;
import com.landregistry.certificates.CertificateStatus;
import com.landregistry.common.Currency;
import com.landregistry.common.exception.ApplicationNotFoundException;
import com.landregistry.common.exception.DuplicatePendingApplicationException;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.common.exception.InvalidTransitionException;
import com.landregistry.common.exception.ParcelAlreadyRegisteredException;
import com.landregistry.common.exception.ParcelNotFoundException;
import com.landregistry.common.exception.PaymentRequiredException;
import com.landregistry.common.exception.ReviewerRequiredException;
import com.landregistry.config.LandRegistryProperties;
import com.landregistry.parcels.Parcel;
import com.landregistry.parcels.ParcelService;
import com.landregistry.parcels.ParcelStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the application workflow.
 */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationServiceTest {

    @Autowired
    private ApplicationService applicationService;

    @Autowired
    private ParcelService parcelService;

    @Autowired
    private ApplicationRepository applicationRepository;

    @Autowired
    private CertificateRepository certificateRepository;

    @Autowired
    private AuditEventRepository auditEventRepository;

    @Autowired
    private LandRegistryProperties properties;

    private Parcel parcel;
    private String applicantId;

    @BeforeEach
    void setUp() {
        parcel = parcelService.createParcel(
            TestFixtures.residentialParcel(TestFixtures.uniqueParcelNumber(), "2.5"), "operator-1");
        applicantId = TestFixtures.uniqueId("applicant");
    }

    @Test
    void testSubmitComputesFeeAndStartsPending() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        assertEquals(ApplicationStatus.PENDING, application.getStatus());
        assertEquals(PaymentStatus.PENDING, application.getPaymentStatus());
        assertEquals(Currency.XAF, application.getFee().getCurrency());
        assertEquals(0, new BigDecimal("52500").compareTo(application.getFee().getAmount()));
        assertEquals(1, application.getPriorityLevel());
        assertEquals(30, application.getEstimatedProcessingDays());
        assertEquals(1, countAudit(application, AuditAction.APPLICATION_CREATED));
    }

    @Test
    void testPriorityDefaultsToNormal() {
        SubmitApplicationCommand command = TestFixtures.registration(applicantId, parcel.getId());
        command.setPriorityLevel(null);

        Application application = applicationService.submitApplication(command);

        assertEquals(1, application.getPriorityLevel());
    }

    @Test
    void testSecondOpenApplicationForSameParcelRejected() {
        Application first = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        DuplicatePendingApplicationException e = assertThrows(DuplicatePendingApplicationException.class, () ->
            applicationService.submitApplication(TestFixtures.registration(applicantId, parcel.getId())));

        assertEquals(first.getId(), e.getExistingApplicationId());
        assertEquals(1, applicationService.getApplicationsByApplicant(applicantId).size());
    }

    @Test
    void testApplicantMayReapplyAfterCancelling() {
        Application first = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));
        applicationService.cancelApplication(first.getId(), applicantId);

        Application second = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        assertNotEquals(first.getId(), second.getId());
        List<Application> history = applicationService.getApplicationsByApplicant(applicantId);
        assertEquals(2, history.size());
    }

    @Test
    void testSubmitValidation() {
        assertThrows(ParcelNotFoundException.class, () ->
            applicationService.submitApplication(TestFixtures.registration(applicantId, "no-such-parcel")));

        SubmitApplicationCommand badPriority = TestFixtures.registration(applicantId, parcel.getId());
        badPriority.setPriorityLevel(6);
        assertThrows(InvalidInputException.class, () -> applicationService.submitApplication(badPriority));

        SubmitApplicationCommand noType = TestFixtures.registration(applicantId, parcel.getId());
        noType.setApplicationType(null);
        assertThrows(InvalidInputException.class, () -> applicationService.submitApplication(noType));

        assertTrue(applicationService.getApplicationsByApplicant(applicantId).isEmpty());
    }

    @Test
    void testApprovalRegistersParcelAndIssuesCertificate() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        Application approved = applicationService.transitionApplication(
            application.getId(), ApplicationStatus.APPROVED, "reviewer-1", "title documents verified");

        assertEquals(ApplicationStatus.APPROVED, approved.getStatus());
        assertEquals("reviewer-1", approved.getReviewedBy());
        assertNotNull(approved.getReviewedAt());
        assertEquals(0, approved.getActualProcessingDays());
        assertEquals(ParcelStatus.REGISTERED, parcelService.getParcel(parcel.getId()).getStatus());

        Certificate certificate = certificateRepository.findByApplicationId(application.getId()).orElseThrow();
        assertEquals(CertificateStatus.ACTIVE, certificate.getStatus());
        assertEquals(parcel.getId(), certificate.getParcelId());
        assertEquals("reviewer-1", certificate.getIssuedBy());

        assertEquals(1, countAudit(application, AuditAction.APPLICATION_STATUS_CHANGED));
        assertEquals(1, auditEventRepository.countByResourceTypeAndResourceIdAndAction(
            "certificate", certificate.getId(), AuditAction.CERTIFICATE_ISSUED));
    }

    @Test
    void testApprovalAfterLongReviewNotes() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));
        applicationService.transitionApplication(
            application.getId(), ApplicationStatus.UNDER_REVIEW, "reviewer-1", "n".repeat(Application.MAX_NOTE_LENGTH));

        Application approved = applicationService.transitionApplication(
            application.getId(), ApplicationStatus.APPROVED, "reviewer-1", "m".repeat(Application.MAX_NOTE_LENGTH));

        assertEquals(ApplicationStatus.APPROVED, approved.getStatus());
        assertEquals(2 * Application.MAX_NOTE_LENGTH + 1,
            applicationService.getApplication(application.getId()).getReviewNotes().length());
        assertTrue(certificateRepository.existsByApplicationId(application.getId()));
        assertEquals(ParcelStatus.REGISTERED, parcelService.getParcel(parcel.getId()).getStatus());
    }

    @Test
    void testOverlongNoteRejectedWithoutSideEffects() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        assertThrows(InvalidInputException.class, () ->
            applicationService.transitionApplication(application.getId(), ApplicationStatus.APPROVED,
                "reviewer-1", "m".repeat(Application.MAX_NOTE_LENGTH + 1)));

        assertEquals(ApplicationStatus.PENDING, applicationService.getApplication(application.getId()).getStatus());
        assertFalse(certificateRepository.existsByApplicationId(application.getId()));
        assertEquals(ParcelStatus.AVAILABLE, parcelService.getParcel(parcel.getId()).getStatus());
        assertEquals(0, countAudit(application, AuditAction.APPLICATION_STATUS_CHANGED));
    }

    @Test
    void testSecondApprovalOnRegisteredParcelRejected() {
        Application first = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));
        Application second = applicationService.submitApplication(
            TestFixtures.registration(TestFixtures.uniqueId("applicant"), parcel.getId()));
        applicationService.transitionApplication(first.getId(), ApplicationStatus.APPROVED, "reviewer-1", null);

        assertThrows(ParcelAlreadyRegisteredException.class, () ->
            applicationService.transitionApplication(second.getId(), ApplicationStatus.APPROVED, "reviewer-2", null));

        Application reloaded = applicationService.getApplication(second.getId());
        assertEquals(ApplicationStatus.PENDING, reloaded.getStatus());
        assertNull(reloaded.getReviewedBy());
        assertFalse(certificateRepository.existsByApplicationId(second.getId()));
        assertEquals(0, countAudit(second, AuditAction.APPLICATION_STATUS_CHANGED));
        assertEquals(1, applicationRepository.countByParcelIdAndStatus(parcel.getId(), ApplicationStatus.APPROVED));
    }

    @Test
    void testRejectionIsTerminal() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));
        applicationService.transitionApplication(
            application.getId(), ApplicationStatus.UNDER_REVIEW, "reviewer-1", null);

        Application rejected = applicationService.transitionApplication(
            application.getId(), ApplicationStatus.REJECTED, "reviewer-1", "survey plan missing");

        assertEquals("survey plan missing", rejected.getRejectionReason());
        assertEquals("reviewer-1", rejected.getReviewedBy());
        for (ApplicationStatus target : ApplicationStatus.values()) {
            assertThrows(InvalidTransitionException.class, () ->
                applicationService.transitionApplication(application.getId(), target, "reviewer-1", null));
        }
        assertEquals(ParcelStatus.AVAILABLE, parcelService.getParcel(parcel.getId()).getStatus());
        assertEquals(2, countAudit(application, AuditAction.APPLICATION_STATUS_CHANGED));
    }

    @Test
    void testUnderReviewKeepsReviewerUnset() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        Application underReview = applicationService.transitionApplication(
            application.getId(), ApplicationStatus.UNDER_REVIEW, "reviewer-1", "assigned");

        assertEquals(ApplicationStatus.UNDER_REVIEW, underReview.getStatus());
        assertNull(underReview.getReviewedBy());
        assertNull(underReview.getReviewedAt());
    }

    @Test
    void testDecisionRequiresReviewer() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        assertThrows(ReviewerRequiredException.class, () ->
            applicationService.transitionApplication(application.getId(), ApplicationStatus.APPROVED, null, null));

        assertEquals(ParcelStatus.AVAILABLE, parcelService.getParcel(parcel.getId()).getStatus());
        assertEquals(ApplicationStatus.PENDING, applicationService.getApplication(application.getId()).getStatus());
    }

    @Test
    void testCancel() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        Application cancelled = applicationService.cancelApplication(application.getId(), applicantId);

        assertEquals(ApplicationStatus.CANCELLED, cancelled.getStatus());
        assertNull(cancelled.getReviewedBy());
        assertEquals(0, cancelled.getActualProcessingDays());
        assertThrows(InvalidTransitionException.class, () ->
            applicationService.cancelApplication(application.getId(), applicantId));
    }

    @Test
    void testUnknownApplication() {
        assertThrows(ApplicationNotFoundException.class, () ->
            applicationService.transitionApplication("missing", ApplicationStatus.APPROVED, "reviewer-1", null));
        assertThrows(ApplicationNotFoundException.class, () -> applicationService.getApplication("missing"));
    }

    @Test
    void testPaymentRecorded() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));

        Application paid = applicationService.recordPayment(
            application.getId(), PaymentStatus.PAID, "MOMO-0042", "cashier-1");

        assertEquals(PaymentStatus.PAID, paid.getPaymentStatus());
        assertEquals("MOMO-0042", paid.getPaymentReference());
        assertNotNull(paid.getPaymentDate());
        assertEquals(1, countAudit(application, AuditAction.PAYMENT_COMPLETED));

        assertThrows(InvalidTransitionException.class, () ->
            applicationService.recordPayment(application.getId(), PaymentStatus.REFUNDED, null, "cashier-1"));
        assertEquals(0, countAudit(application, AuditAction.PAYMENT_REFUNDED));
    }

    @Test
    void testPaymentGateBlocksUnpaidApproval() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));
        properties.getWorkflow().setRequirePaymentForApproval(true);
        try {
            assertThrows(PaymentRequiredException.class, () ->
                applicationService.transitionApplication(
                    application.getId(), ApplicationStatus.APPROVED, "reviewer-1", null));

            applicationService.recordPayment(application.getId(), PaymentStatus.PAID, "BANK-17", "cashier-1");
            Application approved = applicationService.transitionApplication(
                application.getId(), ApplicationStatus.APPROVED, "reviewer-1", null);

            assertEquals(ApplicationStatus.APPROVED, approved.getStatus());
        } finally {
            properties.getWorkflow().setRequirePaymentForApproval(false);
        }
    }

    @Test
    void testApplicationStats() {
        Application application = applicationService.submitApplication(
            TestFixtures.registration(applicantId, parcel.getId()));
        applicationService.transitionApplication(application.getId(), ApplicationStatus.APPROVED, "reviewer-1", null);

        ApplicationStats stats = applicationService.getApplicationStats();

        assertTrue(stats.getApprovedApplications() >= 1);
        assertEquals(stats.getTotalApplications(), stats.getPendingApplications()
            + stats.getUnderReviewApplications() + stats.getApprovedApplications()
            + stats.getRejectedApplications() + stats.getCancelledApplications());
        assertTrue(stats.getTotalFees().compareTo(new BigDecimal("52500")) >= 0);
        assertTrue(stats.getAverageFee().signum() > 0);
    }

    private long countAudit(Application application, AuditAction action) {
        return auditEventRepository.countByResourceTypeAndResourceIdAndAction(
            "application", application.getId(), action);
    }
}
