package com.graphivault.domain.repository;

import com.graphivault.domain.model.VaultMetaEntry;

import java.util.List;
import java.util.Optional;

/**
 * Open string-keyed settings map.
 *
 * <p>No key is protected at this layer; reserved keys are only guarded by
 * the schema manager's seed-once policy.
 */
public interface VaultMetaStore {

    /**
     * Insert or overwrite a value, refreshing its {@code last_updated}.
     */
    void set(String key, String value);

    Optional<String> get(String key);

    Optional<VaultMetaEntry> find(String key);

    /**
     * All entries ordered by key.
     */
    List<VaultMetaEntry> findAll();
}
