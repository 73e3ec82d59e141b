package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Write-once record of a security-relevant operation.
 *
 * <p>Rows are never updated or deleted; the {@code auth_logs} table rejects
 * both at the database level.
 */
@Value
@Builder
public class AuditEvent {

    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";

    long id;
    String eventType;
    Instant timestamp;
    String status;
    String details;
}
