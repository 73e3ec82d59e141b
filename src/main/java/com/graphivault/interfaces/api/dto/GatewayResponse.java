package com.graphivault.interfaces.api.dto;

import com.graphivault.infrastructure.crypto.GatewayResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Gateway result envelope: {@code success} with {@code data}, or {@code error}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayResponse {

    private Boolean success;
    private String outcome;
    private String data;
    private String error;

    public static GatewayResponse from(GatewayResult result) {
        return GatewayResponse.builder()
            .success(result.isSuccess())
            .outcome(result.getOutcome().name())
            .data(result.getOutputRef())
            .error(result.getReason())
            .build();
    }
}
