package com.graphivault.domain.model;

import java.time.Instant;

/**
 * Typed view of the reserved metadata keys seeded at first initialization.
 *
 * @param vaultId unique identifier generated on first run
 * @param createdAt vault creation time
 * @param schemaVersion schema version the vault was created with
 */
public record VaultIdentity(String vaultId, Instant createdAt, int schemaVersion) {
}
