package com.landregistry.applications;

import com.landregistry.audit.AuditAction;
import com.landregistry.audit.AuditEntry;
import com.landregistry.audit.AuditTrail;
import com.landregistry.certificates.Certificate;
import com.landregistry.certificates.CertificateService;
import com.landregistry.common.Money;
import com.landregistry.common.exception.ApplicationNotFoundException;
import com.landregistry.common.exception.DuplicatePendingApplicationException;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.common.exception.ParcelAlreadyRegisteredException;
import com.landregistry.common.exception.PaymentRequiredException;
import com.landregistry.config.LandRegistryProperties;
import com.landregistry.fees.FeeCalculator;
import com.landregistry.parcels.Parcel;
import com.landregistry.parcels.ParcelService;
import com.landregistry.transaction.TransactionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Application workflow.
 *
 * Every mutation runs as one unit of work through the {@link TransactionCoordinator}. Approval is
 * the only multi-entity write: it decides the application, issues its certificate and registers
 * the parcel under the parcel's row lock, so two approvals on one parcel are serialised and the
 * second one sees the first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationService {

    private static final int MAX_ID_LENGTH = 255;

    private final ApplicationRepository applicationRepository;
    private final ParcelService parcelService;
    private final FeeCalculator feeCalculator;
    private final CertificateService certificateService;
    private final TransactionCoordinator transactionCoordinator;
    private final LandRegistryProperties properties;
    private final Clock clock;

    public Application submitApplication(SubmitApplicationCommand command) {
        int priority = validate(command);

        return transactionCoordinator.runInTransaction("submitApplication", audit -> {
            // serialises submissions per parcel, so the open-application check below cannot race
            Parcel parcel = parcelService.lockParcel(command.getParcelId());

            Optional<Application> open = applicationRepository.findFirstByApplicantIdAndParcelIdAndStatusIn(
                command.getApplicantId(), parcel.getId(), ApplicationStatus.OPEN);
            if (open.isPresent()) {
                log.warn("Applicant {} already has open application {} on parcel {}",
                    command.getApplicantId(), open.get().getId(), parcel.getParcelNumber());
                throw new DuplicatePendingApplicationException(
                    command.getApplicantId(), parcel.getId(), open.get().getId());
            }

            Money fee = feeCalculator.computeFee(parcel, command.getApplicationType(), priority);
            Application application = new Application(
                command.getApplicantId(),
                parcel.getId(),
                command.getApplicationType(),
                fee,
                priority,
                command.getNotes(),
                clock.instant()
            );
            applicationRepository.save(application);

            audit.record(AuditEntry.builder()
                .actorId(command.getApplicantId())
                .action(AuditAction.APPLICATION_CREATED)
                .resourceType("application")
                .resourceId(application.getId())
                .details(command.getApplicationType() + " application submitted for parcel "
                    + parcel.getParcelNumber())
                .attribute("parcelId", parcel.getId())
                .attribute("applicationType", command.getApplicationType().name())
                .attribute("priorityLevel", priority)
                .attribute("fee", fee.getAmount().toPlainString())
                .attribute("currency", fee.getCurrency().name())
                .build());

            log.info("Submitted {} application {} by {} for parcel {} with fee {} {}",
                application.getApplicationType(), application.getId(), application.getApplicantId(),
                parcel.getParcelNumber(), fee.getAmount(), fee.getCurrency());
            return application;
        });
    }

    public Application transitionApplication(String applicationId, ApplicationStatus newStatus,
                                             String reviewerId, String notes) {
        return transition("transitionApplication", applicationId, newStatus, reviewerId, notes);
    }

    public Application cancelApplication(String applicationId, String actorId) {
        return transition("cancelApplication", applicationId, ApplicationStatus.CANCELLED, actorId, null);
    }

    public Application recordPayment(String applicationId, PaymentStatus outcome,
                                     String paymentReference, String actorId) {
        if (outcome == null) {
            throw new InvalidInputException("Payment outcome is required");
        }
        checkIdLength("Payment reference", paymentReference);

        return transactionCoordinator.runInTransaction("recordPayment", audit -> {
            Application application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
            PaymentStatus previous = application.getPaymentStatus();

            application.recordPayment(outcome, paymentReference, clock.instant());
            applicationRepository.save(application);

            audit.record(AuditEntry.builder()
                .actorId(actorId)
                .action(paymentAction(outcome))
                .resourceType("application")
                .resourceId(application.getId())
                .details("Payment " + previous + " -> " + outcome)
                .attribute("from", previous.name())
                .attribute("to", outcome.name())
                .attribute("paymentReference", paymentReference)
                .build());

            log.info("Payment of application {} moved {} -> {}", application.getId(), previous, outcome);
            return application;
        });
    }

    @Transactional(readOnly = true)
    public Application getApplication(String applicationId) {
        return applicationRepository.findById(applicationId)
            .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
    }

    @Transactional(readOnly = true)
    public List<Application> getApplicationsByApplicant(String applicantId) {
        return applicationRepository.findByApplicantIdOrderByCreatedAtDesc(applicantId);
    }

    @Transactional(readOnly = true)
    public ApplicationStats getApplicationStats() {
        Double averageFee = applicationRepository.averageFee();
        BigDecimal totalFees = applicationRepository.totalFees();
        int scale = properties.getFees().getCurrency().getMinorUnits();
        return ApplicationStats.builder()
            .totalApplications(applicationRepository.count())
            .pendingApplications(applicationRepository.countByStatus(ApplicationStatus.PENDING))
            .underReviewApplications(applicationRepository.countByStatus(ApplicationStatus.UNDER_REVIEW))
            .approvedApplications(applicationRepository.countByStatus(ApplicationStatus.APPROVED))
            .rejectedApplications(applicationRepository.countByStatus(ApplicationStatus.REJECTED))
            .cancelledApplications(applicationRepository.countByStatus(ApplicationStatus.CANCELLED))
            .paidApplications(applicationRepository.countByPaymentStatus(PaymentStatus.PAID))
            .paymentPending(applicationRepository.countByPaymentStatus(PaymentStatus.PENDING))
            .averageFee(averageFee == null
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(averageFee).setScale(scale, RoundingMode.HALF_UP))
            .totalFees(totalFees == null ? BigDecimal.ZERO : totalFees)
            .build();
    }

    private Application transition(String operation, String applicationId, ApplicationStatus newStatus,
                                   String reviewerId, String notes) {
        Application.checkNoteLength(notes);
        checkIdLength("Reviewer id", reviewerId);

        return transactionCoordinator.runInTransaction(operation, audit -> {
            Application application = applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
            ApplicationStatus previous = application.getStatus();
            application.assertCanTransitionTo(newStatus, reviewerId);

            Certificate certificate = null;
            if (newStatus == ApplicationStatus.APPROVED) {
                certificate = approve(application, reviewerId, notes, audit);
            } else {
                application.transitionTo(newStatus, reviewerId, notes, clock.instant());
                applicationRepository.save(application);
            }

            AuditEntry.AuditEntryBuilder entry = AuditEntry.builder()
                .actorId(reviewerId)
                .action(AuditAction.APPLICATION_STATUS_CHANGED)
                .resourceType("application")
                .resourceId(application.getId())
                .details("Application " + previous + " -> " + newStatus)
                .attribute("from", previous.name())
                .attribute("to", newStatus.name());
            if (notes != null && !notes.isBlank()) {
                entry.attribute("notes", notes);
            }
            if (certificate != null) {
                entry.attribute("certificateNumber", certificate.getCertificateNumber());
            }
            audit.record(entry.build());

            log.info("Application {} moved {} -> {} by {}", application.getId(), previous, newStatus, reviewerId);
            return application;
        });
    }

    /**
     * Approve under the parcel lock. The approved-application count is read before this
     * application is modified, so the query cannot see this application's own pending change.
     */
    private Certificate approve(Application application, String reviewerId, String notes,
                                AuditTrail audit) {
        if (properties.getWorkflow().isRequirePaymentForApproval()
                && application.getPaymentStatus() != PaymentStatus.PAID) {
            throw new PaymentRequiredException(application.getId(), application.getPaymentStatus().name());
        }

        Parcel parcel = parcelService.lockParcel(application.getParcelId());
        if (parcel.isRegistered() || parcelService.countApprovedApplications(parcel.getId()) > 0) {
            log.warn("Refusing approval of application {}: parcel {} is already registered",
                application.getId(), parcel.getParcelNumber());
            throw new ParcelAlreadyRegisteredException(parcel.getId());
        }

        application.transitionTo(ApplicationStatus.APPROVED, reviewerId, notes, clock.instant());
        // flush the decision ahead of the certificate insert
        applicationRepository.saveAndFlush(application);

        Certificate certificate = certificateService.issueCertificate(application, parcel, reviewerId, audit);
        parcelService.markRegistered(parcel);
        return certificate;
    }

    private static AuditAction paymentAction(PaymentStatus outcome) {
        switch (outcome) {
            case PAID:
                return AuditAction.PAYMENT_COMPLETED;
            case FAILED:
                return AuditAction.PAYMENT_FAILED;
            case REFUNDED:
                return AuditAction.PAYMENT_REFUNDED;
            default:
                throw new InvalidInputException("Not a payment outcome: " + outcome);
        }
    }

    private static void checkIdLength(String field, String value) {
        if (value != null && value.length() > MAX_ID_LENGTH) {
            throw new InvalidInputException(field + " must be at most " + MAX_ID_LENGTH + " characters");
        }
    }

    private int validate(SubmitApplicationCommand command) {
        if (command.getApplicantId() == null || command.getApplicantId().isBlank()) {
            throw new InvalidInputException("Applicant id is required");
        }
        if (command.getParcelId() == null || command.getParcelId().isBlank()) {
            throw new InvalidInputException("Parcel id is required");
        }
        if (command.getApplicationType() == null) {
            throw new InvalidInputException("Application type is required");
        }
        checkIdLength("Applicant id", command.getApplicantId());
        Application.checkNoteLength(command.getNotes());
        int priority = command.getPriorityLevel() == null ? FeeCalculator.MIN_PRIORITY : command.getPriorityLevel();
        if (priority < FeeCalculator.MIN_PRIORITY || priority > FeeCalculator.MAX_PRIORITY) {
            throw new InvalidInputException("Priority level must be between " + FeeCalculator.MIN_PRIORITY
                + " and " + FeeCalculator.MAX_PRIORITY + ": " + priority);
        }
        return priority;
    }
}
