package com.graphivault.domain.exception;

import lombok.Getter;

/**
 * Raised when a tag or annotation names an asset id with no physical row.
 */
@Getter
public class AssetReferenceException extends VaultStoreException {

    private final long assetId;

    public AssetReferenceException(long assetId, Throwable cause) {
        super("No asset row exists for id " + assetId, cause);
        this.assetId = assetId;
    }
}
