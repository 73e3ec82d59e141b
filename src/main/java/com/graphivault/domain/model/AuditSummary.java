package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over the audit log for a time window.
 */
@Value
@Builder
public class AuditSummary {

    Instant since;
    long totalEvents;
    long failureEvents;
    Map<String, Long> eventTypes;
    Instant firstActivity;
    Instant lastActivity;
}
