package com.landregistry.applications;

import com.landregistry.common.Money;
import com.landregistry.common.exception.InvalidInputException;
import com.landregistry.common.exception.InvalidTransitionException;
import com.landregistry.common.exception.ReviewerRequiredException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.Length;

import java.time.Duration;
import java.time.Instant;

/**
 * A claim against exactly one parcel, submitted by exactly one applicant.
 *
 * State only changes through {@link #transitionTo} and {@link #recordPayment}; the fee is fixed
 * at submission. {@code reviewedBy}/{@code reviewedAt} are null while the application is open
 * and set together when a reviewer approves or rejects it.
 */
@Entity
@Table(name = "applications", indexes = {
    @Index(name = "idx_application_applicant_parcel", columnList = "applicant_id, parcel_id, status"),
    @Index(name = "idx_application_parcel_status", columnList = "parcel_id, status"),
    @Index(name = "idx_application_created_at", columnList = "created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Application {

    private static final long SECONDS_PER_DAY = 86_400L;

    public static final int MAX_NOTE_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /**
     * External applicant identity. Only the reference is held here.
     */
    @Column(name = "applicant_id", nullable = false)
    private String applicantId;

    @Column(name = "parcel_id", nullable = false)
    private String parcelId;

    @Enumerated(EnumType.STRING)
    @Column(name = "application_type", nullable = false, length = 20)
    private ApplicationType applicationType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ApplicationStatus status;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "amount", column = @Column(name = "fee_amount", nullable = false, updatable = false,
            precision = 15, scale = 2)),
        @AttributeOverride(name = "currency", column = @Column(name = "fee_currency", nullable = false, updatable = false))
    })
    private Money fee;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_reference")
    private String paymentReference;

    @Column(name = "payment_date")
    private Instant paymentDate;

    @Column(name = "priority_level", nullable = false)
    private int priorityLevel;

    @Column(name = "notes", length = MAX_NOTE_LENGTH)
    private String notes;

    /**
     * Notes of every transition, newline separated. Unbounded: each note is capped, the count is not.
     */
    @Column(name = "review_notes", length = Length.LONG32)
    private String reviewNotes;

    @Column(name = "rejection_reason", length = MAX_NOTE_LENGTH)
    private String rejectionReason;

    @Column(name = "reviewed_by")
    private String reviewedBy;

    @Column(name = "reviewed_at")
    private Instant reviewedAt;

    @Column(name = "estimated_processing_days")
    private Integer estimatedProcessingDays;

    @Column(name = "actual_processing_days")
    private Integer actualProcessingDays;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Application(String applicantId, String parcelId, ApplicationType applicationType, Money fee,
                       int priorityLevel, String notes, Instant now) {
        this.applicantId = applicantId;
        this.parcelId = parcelId;
        this.applicationType = applicationType;
        this.fee = fee;
        this.priorityLevel = priorityLevel;
        this.estimatedProcessingDays = applicationType.estimatedProcessingDays(priorityLevel);
        this.notes = notes;
        this.status = ApplicationStatus.PENDING;
        this.paymentStatus = PaymentStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }

    /**
     * Check that this application may move to {@code target}, without changing it.
     */
    public void assertCanTransitionTo(ApplicationStatus target, String reviewerId) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("application", id,
                status.name(), target == null ? "null" : target.name());
        }
        if (target.isDecision() && (reviewerId == null || reviewerId.isBlank())) {
            throw new ReviewerRequiredException(id, target.name());
        }
    }

    /**
     * Move to {@code target}. Decisions record the reviewer; entering any terminal state
     * fixes the actual processing time.
     */
    public void transitionTo(ApplicationStatus target, String reviewerId, String reviewNote, Instant now) {
        assertCanTransitionTo(target, reviewerId);
        checkNoteLength(reviewNote);

        if (target.isDecision()) {
            this.reviewedBy = reviewerId;
            this.reviewedAt = now;
        }
        if (target == ApplicationStatus.REJECTED && reviewNote != null && !reviewNote.isBlank()) {
            this.rejectionReason = reviewNote;
        }
        appendReviewNote(reviewNote);

        if (target.isTerminal()) {
            this.actualProcessingDays = elapsedDays(createdAt, now);
        }
        this.status = target;
        this.updatedAt = now;
    }

    public void recordPayment(PaymentStatus outcome, String reference, Instant now) {
        if (!paymentStatus.canTransitionTo(outcome) || !paymentAllowedInCurrentStatus(outcome)) {
            throw new InvalidTransitionException("payment of application", id,
                paymentStatus.name() + " (application " + status.name() + ")",
                outcome == null ? "null" : outcome.name());
        }
        this.paymentStatus = outcome;
        if (reference != null && !reference.isBlank()) {
            this.paymentReference = reference;
        }
        if (outcome == PaymentStatus.PAID) {
            this.paymentDate = now;
        }
        this.updatedAt = now;
    }

    public static void checkNoteLength(String note) {
        if (note != null && note.length() > MAX_NOTE_LENGTH) {
            throw new InvalidInputException("Notes must be at most " + MAX_NOTE_LENGTH + " characters");
        }
    }

    public boolean isOpen() {
        return !status.isTerminal();
    }

    /**
     * Whole days elapsed between two instants, fractional days truncated.
     */
    static int elapsedDays(Instant from, Instant to) {
        long seconds = Duration.between(from, to).getSeconds();
        return (int) Math.max(0, seconds / SECONDS_PER_DAY);
    }

    private boolean paymentAllowedInCurrentStatus(PaymentStatus outcome) {
        boolean withdrawn = status == ApplicationStatus.REJECTED || status == ApplicationStatus.CANCELLED;
        if (outcome == PaymentStatus.REFUNDED) {
            return withdrawn;
        }
        return !withdrawn;
    }

    private void appendReviewNote(String reviewNote) {
        if (reviewNote == null || reviewNote.isBlank()) {
            return;
        }
        this.reviewNotes = reviewNotes == null ? reviewNote : reviewNotes + "\n" + reviewNote;
    }
}
