package com.graphivault.domain.repository;

import com.graphivault.domain.model.AuditEvent;
import com.graphivault.domain.model.AuditSummary;

import java.time.Instant;
import java.util.List;

/**
 * Append-only ledger of security-relevant events.
 *
 * <p>This is the strict store primitive: a failed append throws. Business
 * code goes through {@link com.graphivault.infrastructure.audit.AuditService},
 * which never lets an audit failure reach the primary operation.
 */
public interface AuditLog {

    /**
     * @param details optional free text, may be null
     * @return id of the appended event
     * @throws com.graphivault.domain.exception.VaultStorageException if the store rejects the write
     */
    long append(String eventType, String status, String details);

    /**
     * Newest events first.
     */
    List<AuditEvent> recent(int limit);

    AuditSummary summarize(Instant since);
}
