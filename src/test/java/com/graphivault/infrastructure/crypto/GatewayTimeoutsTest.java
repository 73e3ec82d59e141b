package com.graphivault.infrastructure.crypto;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class GatewayTimeoutsTest {

    @Test
    void unanswered_call_becomes_transport_error() {
        CompletableFuture<GatewayResult> pending = new CompletableFuture<>();

        GatewayResult result = GatewayTimeouts.bounded(pending, Duration.ofMillis(50)).join();

        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR, result.getOutcome());
    }

    @Test
    void timely_answer_passes_through() {
        CompletableFuture<GatewayResult> done = CompletableFuture.completedFuture(GatewayResult.success("x"));

        assertEquals("x", GatewayTimeouts.bounded(done, Duration.ofSeconds(5)).join().getOutputRef());
    }

    @Test
    void no_timeout_leaves_future_unbounded() {
        CompletableFuture<GatewayResult> pending = new CompletableFuture<>();

        assertSame(pending, GatewayTimeouts.bounded(pending, null));
    }
}
