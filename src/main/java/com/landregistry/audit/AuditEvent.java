package com.landregistry.audit;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.Length;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Persisted audit event.
 *
 * Audit events are append-only: they are written once inside the transaction of the
 * operation they describe and are never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "audit_events", indexes = {
    @Index(name = "idx_audit_resource", columnList = "resource_type, resource_id"),
    @Index(name = "idx_audit_action", columnList = "action"),
    @Index(name = "idx_audit_occurred_at", columnList = "occurred_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "actor_id", updatable = false)
    private String actorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action", nullable = false, updatable = false, length = 50)
    private AuditAction action;

    @Column(name = "resource_type", updatable = false, length = 50)
    private String resourceType;

    @Column(name = "resource_id", updatable = false)
    private String resourceId;

    @Column(name = "details", updatable = false, length = 2000)
    private String details;

    /**
     * Structured metadata serialised as JSON.
     */
    @Column(name = "metadata", updatable = false, length = Length.LONG32)
    private String metadata;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    public AuditEvent(String actorId, AuditAction action, String resourceType, String resourceId,
                      String details, String metadata, Instant occurredAt) {
        this.actorId = actorId;
        this.action = action;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.details = details;
        this.metadata = metadata;
        this.occurredAt = occurredAt;
    }
}
