package com.graphivault.infrastructure.persistence;

import com.graphivault.config.VaultProperties;
import com.graphivault.domain.exception.SchemaInitializationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SchemaManagerTest {

    private static final List<String> EXPECTED_INDEXES = List.of(
        "idx_images_file_hash", "idx_images_created_at", "idx_images_updated_at", "idx_images_storage_path",
        "idx_tags_image_id", "idx_tags_created_at", "idx_annotations_image_id",
        "idx_auth_logs_timestamp", "idx_auth_logs_event_type");

    @TempDir
    Path tempDir;

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:15:30.123456Z");
    private final SchemaManager schemaManager = new SchemaManager(new VaultProperties.Database(), clock);
    private VaultDatabase database;

    @AfterEach
    void closeDatabase() {
        if (database != null) {
            database.close();
        }
    }

    @Test
    void fresh_vault_gets_directories_and_one_time_identity() {
        Path root = tempDir.resolve("vault");
        database = schemaManager.initialize(root);

        for (String dir : List.of("data", "encrypted", "thumbnails", "temp", "backups")) {
            assertTrue(Files.isDirectory(root.resolve(dir)), dir + " should exist");
        }
        assertTrue(Files.exists(root.resolve("data").resolve("graphivault.db")));

        List<Map<String, Object>> rows = database.getJdbcTemplate()
            .queryForList("SELECT key, value, last_updated FROM vault_meta ORDER BY key");
        assertEquals(3, rows.size());

        Map<String, String> values = new java.util.HashMap<>();
        Set<Object> stamps = new HashSet<>();
        for (Map<String, Object> row : rows) {
            values.put((String) row.get("key"), (String) row.get("value"));
            stamps.add(row.get("last_updated"));
        }
        assertEquals("1", values.get("schema_version"));
        assertEquals("2024-03-01T10:15:30.123456Z", values.get("created_at"));
        assertDoesNotThrow(() -> UUID.fromString(values.get("vault_id")));
        assertEquals(Set.of("2024-03-01T10:15:30.123456Z"), stamps, "all seed rows share one timestamp");
    }

    @Test
    void concurrent_first_launches_seed_exactly_once() throws Exception {
        Path root = tempDir.resolve("shared-vault");
        int launches = 4;
        ExecutorService pool = Executors.newFixedThreadPool(launches);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<VaultDatabase>> opened = new ArrayList<>();
        List<VaultDatabase> databases = new ArrayList<>();
        try {
            for (int i = 0; i < launches; i++) {
                opened.add(pool.submit(() -> {
                    start.await();
                    return new SchemaManager(new VaultProperties.Database(), clock).initialize(root);
                }));
            }
            start.countDown();
            for (Future<VaultDatabase> future : opened) {
                databases.add(future.get(30, TimeUnit.SECONDS));
            }

            JdbcTemplate jdbc = databases.get(0).getJdbcTemplate();
            for (String key : List.of("schema_version", "vault_id", "created_at")) {
                assertEquals(1, jdbc.queryForObject(
                    "SELECT COUNT(*) FROM vault_meta WHERE key = ?", Integer.class, key), key);
            }
            assertEquals(3, jdbc.queryForObject("SELECT COUNT(*) FROM vault_meta", Integer.class));

            String vaultId = vaultId(jdbc);
            for (VaultDatabase opener : databases) {
                assertEquals(vaultId, vaultId(opener.getJdbcTemplate()), "every launch sees the same identity");
            }
        } finally {
            pool.shutdownNow();
            databases.forEach(VaultDatabase::close);
        }
    }

    @Test
    void reopening_is_idempotent_and_preserves_identity() {
        Path root = tempDir.resolve("vault");
        database = schemaManager.initialize(root);
        String vaultId = vaultId(database.getJdbcTemplate());
        long objects = schemaObjectCount(database.getJdbcTemplate());
        database.close();

        clock.advance(java.time.Duration.ofDays(3));
        database = schemaManager.initialize(root);
        database.close();
        database = schemaManager.initialize(root);

        JdbcTemplate jdbc = database.getJdbcTemplate();
        assertEquals(vaultId, vaultId(jdbc));
        assertEquals("2024-03-01T10:15:30.123456Z",
            jdbc.queryForObject("SELECT value FROM vault_meta WHERE key = 'created_at'", String.class));
        assertEquals(3, jdbc.queryForObject("SELECT COUNT(*) FROM vault_meta", Integer.class));
        assertEquals(objects, schemaObjectCount(jdbc), "no duplicate tables, triggers or indexes");
    }

    @Test
    void creates_tables_triggers_and_all_indexes() {
        database = schemaManager.initialize(tempDir);
        JdbcTemplate jdbc = database.getJdbcTemplate();

        List<String> tables = jdbc.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%' ORDER BY name", String.class);
        assertEquals(List.of("annotations", "auth_logs", "images", "tags", "vault_meta"), tables);

        List<String> indexes = jdbc.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'index' AND name LIKE 'idx_%'", String.class);
        assertEquals(new HashSet<>(EXPECTED_INDEXES), new HashSet<>(indexes));

        List<String> triggers = jdbc.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'trigger'", String.class);
        assertEquals(3, triggers.size());
    }

    @Test
    void every_connection_carries_the_vault_pragmas() {
        database = schemaManager.initialize(tempDir);
        JdbcTemplate jdbc = database.getJdbcTemplate();

        assertEquals("wal", jdbc.queryForObject("PRAGMA journal_mode", String.class).toLowerCase());
        assertEquals(1, jdbc.queryForObject("PRAGMA foreign_keys", Integer.class));
        assertEquals(1, jdbc.queryForObject("PRAGMA secure_delete", Integer.class));
        assertEquals(2, jdbc.queryForObject("PRAGMA auto_vacuum", Integer.class), "2 = incremental");
        assertEquals(1, jdbc.queryForObject("PRAGMA synchronous", Integer.class), "1 = normal");
        assertEquals(4096, jdbc.queryForObject("PRAGMA page_size", Integer.class));
    }

    @Test
    void content_hash_cannot_be_rewritten() {
        database = schemaManager.initialize(tempDir);
        JdbcTemplate jdbc = database.getJdbcTemplate();
        jdbc.update("INSERT INTO images (file_hash, file_name, storage_path, created_at, updated_at, file_size)"
            + " VALUES ('h1', 'enc', 'encrypted/enc', 'x', 'x', 1)");

        assertThrows(DataAccessException.class,
            () -> jdbc.update("UPDATE images SET file_hash = 'h2' WHERE file_hash = 'h1'"));
        assertEquals(1, jdbc.update("UPDATE images SET file_name = 'enc2' WHERE file_hash = 'h1'"),
            "other columns stay writable");
    }

    @Test
    void audit_rows_cannot_be_changed_or_removed() {
        database = schemaManager.initialize(tempDir);
        JdbcTemplate jdbc = database.getJdbcTemplate();
        jdbc.update("INSERT INTO auth_logs (event_type, timestamp, status) VALUES ('vault_unlocked', 'x', 'success')");

        assertThrows(DataAccessException.class, () -> jdbc.update("UPDATE auth_logs SET status = 'failure'"));
        assertThrows(DataAccessException.class, () -> jdbc.update("DELETE FROM auth_logs"));
        assertEquals(1, jdbc.queryForObject("SELECT COUNT(*) FROM auth_logs", Integer.class));
    }

    @Test
    void unusable_root_fails_initialization() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("not-a-directory"), "x");

        assertThrows(SchemaInitializationException.class, () -> schemaManager.initialize(blocker));
    }

    @Test
    void close_releases_the_pool() {
        database = schemaManager.initialize(tempDir);
        assertTrue(database.isOpen());

        database.close();

        assertFalse(database.isOpen());
        assertDoesNotThrow(database::close, "closing twice is harmless");
    }

    private static String vaultId(JdbcTemplate jdbc) {
        return jdbc.queryForObject("SELECT value FROM vault_meta WHERE key = 'vault_id'", String.class);
    }

    private static long schemaObjectCount(JdbcTemplate jdbc) {
        return jdbc.queryForObject("SELECT COUNT(*) FROM sqlite_master", Long.class);
    }
}
