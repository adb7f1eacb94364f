package com.landregistry.applications;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a land application.
 *
 * <pre>
 * PENDING ──► UNDER_REVIEW ──► APPROVED | REJECTED
 *    │              │
 *    │              └────────► CANCELLED
 *    ├───────────────────────► APPROVED | REJECTED   (review step is optional)
 *    └───────────────────────► CANCELLED
 * </pre>
 */
public enum ApplicationStatus {
    /**
     * Submitted and waiting for a reviewer.
     */
    PENDING,

    /**
     * Picked up by a reviewer.
     */
    UNDER_REVIEW,

    /**
     * Approved. A certificate was issued and the parcel is registered. Terminal.
     */
    APPROVED,

    /**
     * Rejected by a reviewer. Terminal.
     */
    REJECTED,

    /**
     * Withdrawn before a decision. Terminal.
     */
    CANCELLED;

    /**
     * Statuses that still count as an open claim on a parcel.
     */
    public static final Set<ApplicationStatus> OPEN =
        Collections.unmodifiableSet(EnumSet.of(PENDING, UNDER_REVIEW));

    public boolean isTerminal() {
        return !OPEN.contains(this);
    }

    /**
     * Whether entering this status records a reviewer decision.
     */
    public boolean isDecision() {
        return this == APPROVED || this == REJECTED;
    }

    public boolean canTransitionTo(ApplicationStatus target) {
        if (target == null) {
            return false;
        }
        switch (this) {
            case PENDING:
                return target != PENDING;
            case UNDER_REVIEW:
                return target == APPROVED || target == REJECTED || target == CANCELLED;
            default:
                return false;
        }
    }
}
