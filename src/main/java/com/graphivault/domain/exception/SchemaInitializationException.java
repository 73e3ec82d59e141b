package com.graphivault.domain.exception;

/**
 * Fatal failure while preparing the vault layout or schema. Aborts startup.
 */
public class SchemaInitializationException extends VaultStoreException {

    public SchemaInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
