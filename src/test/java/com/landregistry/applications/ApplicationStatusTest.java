package com.landregistry.applications;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationStatusTest {

    @Test
    void testPendingTransitions() {
        assertTrue(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.UNDER_REVIEW));
        assertTrue(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.APPROVED));
        assertTrue(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.REJECTED));
        assertTrue(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.CANCELLED));
        assertFalse(ApplicationStatus.PENDING.canTransitionTo(ApplicationStatus.PENDING));
    }

    @Test
    void testUnderReviewTransitions() {
        assertTrue(ApplicationStatus.UNDER_REVIEW.canTransitionTo(ApplicationStatus.APPROVED));
        assertTrue(ApplicationStatus.UNDER_REVIEW.canTransitionTo(ApplicationStatus.REJECTED));
        assertTrue(ApplicationStatus.UNDER_REVIEW.canTransitionTo(ApplicationStatus.CANCELLED));
        assertFalse(ApplicationStatus.UNDER_REVIEW.canTransitionTo(ApplicationStatus.PENDING));
        assertFalse(ApplicationStatus.UNDER_REVIEW.canTransitionTo(ApplicationStatus.UNDER_REVIEW));
    }

    @Test
    void testTerminalStatusesGoNowhere() {
        for (ApplicationStatus terminal : new ApplicationStatus[] {
                ApplicationStatus.APPROVED, ApplicationStatus.REJECTED, ApplicationStatus.CANCELLED}) {
            assertTrue(terminal.isTerminal());
            for (ApplicationStatus target : ApplicationStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }

    @Test
    void testNullTargetRefused() {
        assertFalse(ApplicationStatus.PENDING.canTransitionTo(null));
    }
}
