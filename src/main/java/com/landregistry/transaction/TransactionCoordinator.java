package com.landregistry.transaction;

import com.landregistry.audit.AuditEntry;
import com.landregistry.audit.AuditRecorder;
import com.landregistry.audit.AuditTrail;
import com.landregistry.common.exception.TransactionTimeoutException;
import com.landregistry.config.LandRegistryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Unit-of-work boundary for every mutating registry operation.
 *
 * Each unit of work runs in a single READ_COMMITTED transaction. Cross-transaction invariants
 * (one approved application per parcel, one open application per applicant and parcel) are
 * protected by pessimistic row locks taken inside the work, so the isolation level only has to
 * guarantee that a re-check made after acquiring the lock sees committed rows.
 *
 * Audit entries collected on the {@link AuditTrail} are written inside the same transaction,
 * after the work returns. Work that records no audit entry is rolled back.
 */
@Component
@Slf4j
public class TransactionCoordinator {

    private final TransactionTemplate transactionTemplate;
    private final AuditRecorder auditRecorder;

    public TransactionCoordinator(PlatformTransactionManager transactionManager,
                                  AuditRecorder auditRecorder,
                                  LandRegistryProperties properties) {
        this.auditRecorder = auditRecorder;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.transactionTemplate.setTimeout(
            (int) properties.getWorkflow().getTransactionTimeout().toSeconds());
    }

    public <T> T runInTransaction(String operation, UnitOfWork<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                AuditTrail trail = new AuditTrail();
                T result = work.execute(trail);

                if (trail.isEmpty()) {
                    throw new IllegalStateException(
                        "Operation " + operation + " changed registry state without an audit entry");
                }
                for (AuditEntry entry : trail.getEntries()) {
                    auditRecorder.record(entry);
                }
                return result;
            });
        } catch (PessimisticLockingFailureException | QueryTimeoutException | TransactionTimedOutException e) {
            log.warn("Operation {} timed out waiting for the store and was rolled back: {}",
                operation, e.getMessage());
            throw new TransactionTimeoutException(
                "Operation " + operation + " timed out and was rolled back; retry the request", e);
        }
    }
}
