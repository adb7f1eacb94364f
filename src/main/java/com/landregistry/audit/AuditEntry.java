package com.landregistry.audit;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * An audit fact collected during a unit of work, persisted when the unit of work completes.
 */
@Value
@Builder
public class AuditEntry {

    /**
     * Acting user, or null for system actions.
     */
    String actorId;

    AuditAction action;

    String resourceType;

    String resourceId;

    String details;

    @Singular("attribute")
    Map<String, Object> metadata;
}
