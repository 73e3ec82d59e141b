package com.graphivault.infrastructure.crypto;

import lombok.Getter;

/**
 * Raised when a flow cannot continue because the encryption gateway did not succeed.
 */
@Getter
public class EncryptionGatewayException extends RuntimeException {

    private final GatewayResult result;

    public EncryptionGatewayException(GatewayResult result) {
        super("Encryption gateway " + result.getOutcome() + ": " + result.getReason());
        this.result = result;
    }
}
