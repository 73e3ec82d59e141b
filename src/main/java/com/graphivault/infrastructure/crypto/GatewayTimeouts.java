package com.graphivault.infrastructure.crypto;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Caller-side bound on how long to wait for a gateway result.
 */
public final class GatewayTimeouts {

    private GatewayTimeouts() {}

    /**
     * @param timeout null or non-positive for no bound
     * @return a future that completes with a transport error once {@code timeout} elapses
     */
    public static CompletableFuture<GatewayResult> bounded(CompletableFuture<GatewayResult> pending, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return pending;
        }
        return pending.completeOnTimeout(
            GatewayResult.transportError("Encryption gateway did not answer within " + timeout),
            timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
