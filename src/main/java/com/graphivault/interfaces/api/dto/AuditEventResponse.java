package com.graphivault.interfaces.api.dto;

import com.graphivault.domain.model.AuditEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEventResponse {

    private Long id;
    private String eventType;
    private Instant timestamp;
    private String status;
    private String details;

    public static AuditEventResponse from(AuditEvent event) {
        return AuditEventResponse.builder()
            .id(event.getId())
            .eventType(event.getEventType())
            .timestamp(event.getTimestamp())
            .status(event.getStatus())
            .details(event.getDetails())
            .build();
    }
}
