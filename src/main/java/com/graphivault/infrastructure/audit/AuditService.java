package com.graphivault.infrastructure.audit;

import com.graphivault.domain.model.AuditEvent;

/**
 * Best-effort recording of security-relevant events.
 *
 * <p>Implementations never throw: an audit failure is logged and reported
 * through the return value, and the operation being audited proceeds.
 */
public interface AuditService {

    /**
     * @return true if the event reached the audit log
     */
    boolean record(String eventType, String status, String details);

    default boolean success(String eventType, String details) {
        return record(eventType, AuditEvent.STATUS_SUCCESS, details);
    }

    default boolean failure(String eventType, String details) {
        return record(eventType, AuditEvent.STATUS_FAILURE, details);
    }
}
