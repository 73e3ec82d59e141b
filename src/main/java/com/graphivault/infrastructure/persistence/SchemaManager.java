package com.graphivault.infrastructure.persistence;

import com.graphivault.config.VaultProperties;
import com.graphivault.domain.exception.SchemaInitializationException;
import com.graphivault.domain.model.VaultMetaEntry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Brings a vault store from nothing, or from any earlier state, to a ready state.
 *
 * <p>Every step is idempotent: tables, triggers and indexes use {@code IF NOT EXISTS},
 * and the reserved metadata keys are seeded in one transaction gated on the
 * {@code schema_version} row, so concurrent first launches produce exactly one seed.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaManager {

    public static final String SCHEMA_VERSION = "1";

    static final String POOL_NAME = "vault-store";

    private static final List<String> TABLES = List.of(
        """
        CREATE TABLE IF NOT EXISTS images (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            file_hash TEXT NOT NULL UNIQUE,
            file_name TEXT NOT NULL,
            storage_path TEXT NOT NULL,
            created_at TEXT NOT NULL,
            updated_at TEXT NOT NULL,
            file_size INTEGER NOT NULL CHECK (file_size >= 0),
            is_deleted INTEGER NOT NULL DEFAULT 0 CHECK (is_deleted IN (0, 1))
        )""",
        """
        CREATE TABLE IF NOT EXISTS tags (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            image_id INTEGER NOT NULL REFERENCES images(id) ON DELETE CASCADE,
            tag_name TEXT NOT NULL,
            tag_type TEXT,
            created_at TEXT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS annotations (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            image_id INTEGER NOT NULL REFERENCES images(id) ON DELETE CASCADE,
            note TEXT NOT NULL,
            created_at TEXT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS vault_meta (
            key TEXT PRIMARY KEY,
            value TEXT NOT NULL,
            last_updated TEXT NOT NULL
        )""",
        """
        CREATE TABLE IF NOT EXISTS auth_logs (
            id INTEGER PRIMARY KEY AUTOINCREMENT,
            event_type TEXT NOT NULL,
            timestamp TEXT NOT NULL,
            status TEXT NOT NULL,
            details TEXT
        )"""
    );

    private static final List<String> TRIGGERS = List.of(
        """
        CREATE TRIGGER IF NOT EXISTS images_file_hash_immutable
        BEFORE UPDATE OF file_hash ON images
        WHEN NEW.file_hash IS NOT OLD.file_hash
        BEGIN
            SELECT RAISE(ABORT, 'file_hash is immutable');
        END""",
        """
        CREATE TRIGGER IF NOT EXISTS auth_logs_no_update
        BEFORE UPDATE ON auth_logs
        BEGIN
            SELECT RAISE(ABORT, 'auth_logs is append-only');
        END""",
        """
        CREATE TRIGGER IF NOT EXISTS auth_logs_no_delete
        BEFORE DELETE ON auth_logs
        BEGIN
            SELECT RAISE(ABORT, 'auth_logs is append-only');
        END"""
    );

    private static final List<String> INDEXES = List.of(
        "CREATE INDEX IF NOT EXISTS idx_images_file_hash ON images(file_hash)",
        "CREATE INDEX IF NOT EXISTS idx_images_created_at ON images(created_at)",
        "CREATE INDEX IF NOT EXISTS idx_images_updated_at ON images(updated_at)",
        "CREATE INDEX IF NOT EXISTS idx_images_storage_path ON images(storage_path)",
        "CREATE INDEX IF NOT EXISTS idx_tags_image_id ON tags(image_id)",
        "CREATE INDEX IF NOT EXISTS idx_tags_created_at ON tags(created_at)",
        "CREATE INDEX IF NOT EXISTS idx_annotations_image_id ON annotations(image_id)",
        "CREATE INDEX IF NOT EXISTS idx_auth_logs_timestamp ON auth_logs(timestamp)",
        "CREATE INDEX IF NOT EXISTS idx_auth_logs_event_type ON auth_logs(event_type)"
    );

    private static final String SEED_META =
        "INSERT OR IGNORE INTO vault_meta (key, value, last_updated) VALUES (?, ?, ?)";

    private final VaultProperties.Database settings;
    private final Clock clock;

    /**
     * Open (creating if needed) the vault store rooted at {@code vaultRoot}.
     *
     * @return a ready store; the caller owns it and must close it
     * @throws SchemaInitializationException if any step fails; nothing stays open in that case
     */
    public VaultDatabase initialize(Path vaultRoot) {
        VaultLayout layout = VaultLayout.of(vaultRoot);
        try {
            layout.createDirectories();
        } catch (IOException e) {
            throw new SchemaInitializationException("Cannot create vault directories under " + layout.getRoot(), e);
        }

        Path databaseFile = layout.databaseFile(settings.getFileName());
        HikariDataSource pool;
        try {
            pool = openPool(databaseFile);
        } catch (RuntimeException e) {
            throw new SchemaInitializationException("Cannot open vault database " + databaseFile, e);
        }

        VaultDatabase database = new VaultDatabase(layout, databaseFile, pool);
        try {
            applySchema(database.getJdbcTemplate());
            boolean seeded = seedMetadata(database);
            log.info("Vault store ready at {} (schema version {}, {})",
                databaseFile, SCHEMA_VERSION, seeded ? "new vault" : "existing vault");
            return database;
        } catch (RuntimeException e) {
            database.close();
            throw new SchemaInitializationException("Failed to initialize vault schema at " + databaseFile, e);
        }
    }

    private HikariDataSource openPool(Path databaseFile) {
        SQLiteDataSource sqlite = new SQLiteDataSource();
        sqlite.setUrl("jdbc:sqlite:" + databaseFile);

        HikariConfig config = new HikariConfig();
        config.setPoolName(POOL_NAME);
        config.setDataSource(new SqlitePragmaDataSource(sqlite, SqlitePragmaDataSource.vaultPragmas(settings)));
        config.setMaximumPoolSize(settings.getPoolSize());
        config.setMinimumIdle(1);
        config.setAutoCommit(true);
        return new HikariDataSource(config);
    }

    private void applySchema(JdbcTemplate jdbc) {
        TABLES.forEach(jdbc::execute);
        TRIGGERS.forEach(jdbc::execute);
        INDEXES.forEach(jdbc::execute);
        log.debug("Applied {} tables, {} triggers, {} indexes", TABLES.size(), TRIGGERS.size(), INDEXES.size());
    }

    /**
     * @return true if this call seeded the reserved keys
     */
    private boolean seedMetadata(VaultDatabase database) {
        JdbcTemplate jdbc = database.getJdbcTemplate();
        String now = VaultTimestamps.now(clock);
        Boolean seeded = database.getTransactionTemplate().execute(status -> {
            int claimed = jdbc.update(SEED_META, VaultMetaEntry.SCHEMA_VERSION, SCHEMA_VERSION, now);
            if (claimed == 0) {
                return false;
            }
            jdbc.update(SEED_META, VaultMetaEntry.VAULT_ID, UUID.randomUUID().toString(), now);
            jdbc.update(SEED_META, VaultMetaEntry.CREATED_AT, now, now);
            return true;
        });
        return Boolean.TRUE.equals(seeded);
    }
}
