package com.landregistry.audit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Audit entries produced by one unit of work.
 *
 * A trail is handed to every {@link com.landregistry.transaction.UnitOfWork}; the
 * {@link com.landregistry.transaction.TransactionCoordinator} writes its entries in the same
 * transaction as the work and refuses to commit work that left the trail empty.
 */
public class AuditTrail {

    private final List<AuditEntry> entries = new ArrayList<>();

    public void record(AuditEntry entry) {
        if (entry.getAction() == null) {
            throw new IllegalArgumentException("Audit entry requires an action");
        }
        entries.add(entry);
    }

    public List<AuditEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
