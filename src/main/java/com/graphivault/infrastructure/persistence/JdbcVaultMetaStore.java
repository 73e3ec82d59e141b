package com.graphivault.infrastructure.persistence;

import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.VaultMetaEntry;
import com.graphivault.domain.repository.VaultMetaStore;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Component
public class JdbcVaultMetaStore implements VaultMetaStore {

    private static final String UPSERT_SQL = """
        INSERT INTO vault_meta (key, value, last_updated) VALUES (?, ?, ?)
        ON CONFLICT(key) DO UPDATE SET value = excluded.value, last_updated = excluded.last_updated""";

    private static final RowMapper<VaultMetaEntry> ENTRY_ROW_MAPPER = (rs, rowNum) -> VaultMetaEntry.builder()
        .key(rs.getString("key"))
        .value(rs.getString("value"))
        .lastUpdated(VaultTimestamps.parse(rs.getString("last_updated")))
        .build();

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcVaultMetaStore(VaultDatabase database, Clock clock) {
        this.jdbc = database.getJdbcTemplate();
        this.clock = clock;
    }

    @Override
    public void set(String key, String value) {
        try {
            jdbc.update(UPSERT_SQL, key, value, VaultTimestamps.now(clock));
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to store setting " + key, e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        return find(key).map(VaultMetaEntry::getValue);
    }

    @Override
    public Optional<VaultMetaEntry> find(String key) {
        try {
            return jdbc.query("SELECT key, value, last_updated FROM vault_meta WHERE key = ?", ENTRY_ROW_MAPPER, key)
                .stream()
                .findFirst();
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to read setting " + key, e);
        }
    }

    @Override
    public List<VaultMetaEntry> findAll() {
        try {
            return jdbc.query("SELECT key, value, last_updated FROM vault_meta ORDER BY key", ENTRY_ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to read settings", e);
        }
    }
}
