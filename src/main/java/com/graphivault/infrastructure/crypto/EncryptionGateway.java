package com.graphivault.infrastructure.crypto;

/**
 * Out-of-process collaborator that owns keys, ciphertext and vault lock state.
 *
 * <p>The store never sees key material. Implementations block until the
 * collaborator answers and never throw for collaborator-side problems:
 * those come back as {@link GatewayResult.Outcome#FAILURE} or
 * {@link GatewayResult.Outcome#TRANSPORT_ERROR}.
 *
 * @since 1.0.0
 */
public interface EncryptionGateway {

    /**
     * Execute one operation. Never retried.
     */
    GatewayResult execute(GatewayRequest request);
}
