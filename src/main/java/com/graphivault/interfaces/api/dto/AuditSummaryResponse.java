package com.graphivault.interfaces.api.dto;

import com.graphivault.domain.model.AuditSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditSummaryResponse {

    private Instant since;
    private Long totalEvents;
    private Long failureEvents;
    private Map<String, Long> eventTypes;
    private Instant firstActivity;
    private Instant lastActivity;

    public static AuditSummaryResponse from(AuditSummary summary) {
        return AuditSummaryResponse.builder()
            .since(summary.getSince())
            .totalEvents(summary.getTotalEvents())
            .failureEvents(summary.getFailureEvents())
            .eventTypes(summary.getEventTypes())
            .firstActivity(summary.getFirstActivity())
            .lastActivity(summary.getLastActivity())
            .build();
    }
}
