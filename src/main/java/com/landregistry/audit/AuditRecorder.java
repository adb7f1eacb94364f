package com.landregistry.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.landregistry.common.exception.AuditWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Appends audit events to the audit log.
 *
 * Writes only ever join an existing transaction: an audit event is committed together with
 * the state change it describes, or not at all. Any storage failure is raised as
 * {@link AuditWriteException}, which rolls the whole unit of work back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditRecorder {

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public AuditEvent record(AuditEntry entry) {
        AuditEvent event = new AuditEvent(
            entry.getActorId(),
            entry.getAction(),
            entry.getResourceType(),
            entry.getResourceId(),
            entry.getDetails(),
            serializeMetadata(entry),
            clock.instant()
        );

        try {
            auditEventRepository.saveAndFlush(event);
        } catch (DataAccessException e) {
            log.error("Failed to write audit event {} for {} {}",
                entry.getAction(), entry.getResourceType(), entry.getResourceId(), e);
            throw new AuditWriteException(entry.getAction().name(), e);
        }

        log.debug("Recorded audit event {} for {} {} by {}",
            entry.getAction(), entry.getResourceType(), entry.getResourceId(), entry.getActorId());
        return event;
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> getHistory(String resourceType, String resourceId) {
        return auditEventRepository.findByResourceTypeAndResourceIdOrderByOccurredAtDesc(resourceType, resourceId);
    }

    private String serializeMetadata(AuditEntry entry) {
        Map<String, Object> metadata = entry.getMetadata();
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new AuditWriteException(entry.getAction().name(), e);
        }
    }
}
