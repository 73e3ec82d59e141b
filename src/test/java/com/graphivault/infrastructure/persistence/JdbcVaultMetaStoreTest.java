package com.graphivault.infrastructure.persistence;

import com.graphivault.config.VaultProperties;
import com.graphivault.domain.model.VaultMetaEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcVaultMetaStoreTest {

    @TempDir
    Path vaultRoot;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T08:00:00Z");
    private VaultDatabase database;
    private JdbcVaultMetaStore metaStore;

    @BeforeEach
    void openVault() {
        database = new SchemaManager(new VaultProperties.Database(), clock).initialize(vaultRoot);
        metaStore = new JdbcVaultMetaStore(database, clock);
    }

    @AfterEach
    void closeVault() {
        database.close();
    }

    @Test
    void set_inserts_then_overwrites_and_refreshes_timestamp() {
        metaStore.set("theme", "dark");
        clock.advance(Duration.ofHours(1));
        metaStore.set("theme", "light");

        VaultMetaEntry entry = metaStore.find("theme").orElseThrow();
        assertEquals("light", entry.getValue());
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), entry.getLastUpdated());
    }

    @Test
    void unknown_key_is_absent() {
        assertTrue(metaStore.get("missing").isEmpty());
    }

    @Test
    void reserved_keys_are_readable_and_not_protected() {
        assertEquals("1", metaStore.get(VaultMetaEntry.SCHEMA_VERSION).orElseThrow());

        metaStore.set(VaultMetaEntry.SCHEMA_VERSION, "2");

        assertEquals("2", metaStore.get(VaultMetaEntry.SCHEMA_VERSION).orElseThrow());
    }

    @Test
    void find_all_is_ordered_by_key() {
        metaStore.set("zeta", "z");
        metaStore.set("alpha", "a");

        List<String> keys = metaStore.findAll().stream().map(VaultMetaEntry::getKey).collect(Collectors.toList());

        assertEquals(List.of("alpha", "created_at", "schema_version", "vault_id", "zeta"), keys);
    }
}
