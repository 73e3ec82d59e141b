package com.graphivault.domain.exception;

/**
 * Lookup miss surfaced at the API edge. Stores return {@code Optional.empty()} instead.
 */
public class AssetNotFoundException extends VaultStoreException {

    public AssetNotFoundException(String message) {
        super(message);
    }
}
