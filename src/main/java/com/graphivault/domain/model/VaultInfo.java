package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only composite view of the vault.
 *
 * <p>{@code totalActiveAssets} is computed from the live catalog on every read,
 * never stored.
 */
@Value
@Builder
public class VaultInfo {

    public static final String STATUS_ACTIVE = "active";

    String vaultId;
    String createdAt;
    String schemaVersion;
    long totalActiveAssets;
    String status;
}
