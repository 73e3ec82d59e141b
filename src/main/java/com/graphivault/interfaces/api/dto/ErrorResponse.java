package com.graphivault.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body of the vault API.
 *
 * <p>{@code outcome} is present only when the encryption gateway is involved
 * ({@code FAILURE} or {@code TRANSPORT_ERROR}); {@code fieldErrors} only for
 * rejected request bodies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private Instant timestamp;
    private int status;
    private String error;
    private String message;
    private String path;
    private String outcome;
    private List<FieldViolation> fieldErrors;

    /**
     * One rejected request field. Secret values are never echoed back.
     */
    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class FieldViolation {
        String field;
        String message;
        Object rejectedValue;
    }
}
