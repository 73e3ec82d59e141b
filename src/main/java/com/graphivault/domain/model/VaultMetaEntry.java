package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One row of the vault-wide key/value configuration.
 */
@Value
@Builder
public class VaultMetaEntry {

    public static final String SCHEMA_VERSION = "schema_version";
    public static final String VAULT_ID = "vault_id";
    public static final String CREATED_AT = "created_at";

    String key;
    String value;
    Instant lastUpdated;
}
