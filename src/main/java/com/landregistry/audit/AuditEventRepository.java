package com.landregistry.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for audit events.
 */
@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, String> {

    List<AuditEvent> findByResourceTypeAndResourceIdOrderByOccurredAtDesc(String resourceType, String resourceId);

    long countByResourceTypeAndResourceIdAndAction(String resourceType, String resourceId, AuditAction action);
}
