package com.graphivault.domain.exception;

import lombok.Getter;

/**
 * Raised when an asset with the same content hash is already catalogued.
 *
 * <p>The hash stays reserved after a soft delete, so this also fires for
 * content that was ingested and later deleted.
 */
@Getter
public class DuplicateAssetException extends VaultStoreException {

    private final String contentHash;

    public DuplicateAssetException(String contentHash) {
        super("Asset already exists for content hash " + contentHash);
        this.contentHash = contentHash;
    }

    public DuplicateAssetException(String contentHash, Throwable cause) {
        super("Asset already exists for content hash " + contentHash, cause);
        this.contentHash = contentHash;
    }
}
