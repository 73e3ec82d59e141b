package com.graphivault.infrastructure.crypto;

import lombok.Value;

/**
 * Normalized outcome of a gateway call.
 *
 * <ul>
 *   <li>{@link Outcome#SUCCESS}: {@code outputRef} carries the produced path or payload, if any</li>
 *   <li>{@link Outcome#FAILURE}: the gateway ran and refused; {@code reason} is its message</li>
 *   <li>{@link Outcome#TRANSPORT_ERROR}: the gateway could not be reached or spoke garbage</li>
 * </ul>
 */
@Value
public class GatewayResult {

    public enum Outcome {
        SUCCESS,
        FAILURE,
        TRANSPORT_ERROR
    }

    Outcome outcome;
    String outputRef;
    String reason;

    public static GatewayResult success(String outputRef) {
        return new GatewayResult(Outcome.SUCCESS, outputRef, null);
    }

    public static GatewayResult failure(String reason) {
        return new GatewayResult(Outcome.FAILURE, null, reason);
    }

    public static GatewayResult transportError(String reason) {
        return new GatewayResult(Outcome.TRANSPORT_ERROR, null, reason);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
