package com.graphivault.domain.exception;

/**
 * The database file or vault directory could not be read or written.
 *
 * <p>Recoverable by retry outside of startup.
 */
public class VaultStorageException extends VaultStoreException {

    public VaultStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
