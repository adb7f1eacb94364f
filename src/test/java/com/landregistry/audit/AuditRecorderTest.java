package com.landregistry.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.landregistry.common.exception.AuditWriteException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuditRecorder.
 *
 * The repository is mocked so storage failures can be simulated.
 */
@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

    private static final Instant NOW = Instant.parse("2025-06-01T08:00:00Z");

    @Mock
    private AuditEventRepository auditEventRepository;

    private AuditRecorder auditRecorder;

    @BeforeEach
    void setUp() {
        auditRecorder = new AuditRecorder(auditEventRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testRecordWritesEventWithJsonMetadata() {
        when(auditEventRepository.saveAndFlush(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        auditRecorder.record(AuditEntry.builder()
            .actorId("reviewer-1")
            .action(AuditAction.APPLICATION_STATUS_CHANGED)
            .resourceType("application")
            .resourceId("application-1")
            .details("Application PENDING -> APPROVED")
            .attribute("from", "PENDING")
            .attribute("to", "APPROVED")
            .build());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditEventRepository).saveAndFlush(captor.capture());
        AuditEvent event = captor.getValue();
        assertEquals("reviewer-1", event.getActorId());
        assertEquals(AuditAction.APPLICATION_STATUS_CHANGED, event.getAction());
        assertEquals("application-1", event.getResourceId());
        assertEquals(NOW, event.getOccurredAt());
        assertEquals("{\"from\":\"PENDING\",\"to\":\"APPROVED\"}", event.getMetadata());
    }

    @Test
    void testSystemActionWithoutMetadata() {
        when(auditEventRepository.saveAndFlush(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuditEvent event = auditRecorder.record(AuditEntry.builder()
            .action(AuditAction.PARCEL_CREATED)
            .resourceType("parcel")
            .resourceId("parcel-1")
            .build());

        assertNull(event.getActorId());
        assertNull(event.getMetadata());
    }

    @Test
    void testStorageFailureBecomesAuditWriteException() {
        when(auditEventRepository.saveAndFlush(any(AuditEvent.class)))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));

        AuditWriteException e = assertThrows(AuditWriteException.class, () ->
            auditRecorder.record(AuditEntry.builder()
                .actorId("reviewer-1")
                .action(AuditAction.CERTIFICATE_REVOKED)
                .resourceType("certificate")
                .resourceId("certificate-1")
                .build()));

        assertTrue(e.getMessage().contains("CERTIFICATE_REVOKED"));
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
    }

    @Test
    void testTrailRefusesEntryWithoutAction() {
        AuditTrail trail = new AuditTrail();

        assertThrows(IllegalArgumentException.class, () ->
            trail.record(AuditEntry.builder().resourceType("parcel").resourceId("parcel-1").build()));
        assertTrue(trail.isEmpty());
    }
}
