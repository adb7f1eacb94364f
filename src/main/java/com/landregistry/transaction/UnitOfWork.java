package com.landregistry.transaction;

import com.landregistry.audit.AuditTrail;

/**
 * A mutating registry operation executed by the {@link TransactionCoordinator}.
 *
 * @param <T> result of the operation
 */
@FunctionalInterface
public interface UnitOfWork<T> {

    /**
     * Perform the operation's reads and writes, recording at least one audit entry on {@code audit}.
     */
    T execute(AuditTrail audit);
}
