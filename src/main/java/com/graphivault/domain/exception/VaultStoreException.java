package com.graphivault.domain.exception;

/**
 * Base type for typed failures raised by the vault store.
 */
public class VaultStoreException extends RuntimeException {

    public VaultStoreException(String message) {
        super(message);
    }

    public VaultStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
