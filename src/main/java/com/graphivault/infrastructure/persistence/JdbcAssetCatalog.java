package com.graphivault.infrastructure.persistence;

import com.graphivault.domain.exception.DuplicateAssetException;
import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.Asset;
import com.graphivault.domain.repository.AssetCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * {@link AssetCatalog} over the {@code images} table.
 */
@Slf4j
@Component
public class JdbcAssetCatalog implements AssetCatalog {

    private static final String COLUMNS =
        "id, file_hash, file_name, storage_path, created_at, updated_at, file_size, is_deleted";

    private static final String INSERT_SQL = """
        INSERT INTO images (file_hash, file_name, storage_path, created_at, updated_at, file_size, is_deleted)
        VALUES (?, ?, ?, ?, ?, ?, 0)
        RETURNING id""";

    private static final String LIST_ACTIVE_SQL =
        "SELECT " + COLUMNS + " FROM images WHERE is_deleted = 0 ORDER BY created_at DESC, id DESC";

    private static final String LIST_ACTIVE_BY_TAG_SQL = "SELECT " + COLUMNS + " FROM images"
        + " WHERE is_deleted = 0 AND id IN (SELECT image_id FROM tags WHERE tag_name = ?)"
        + " ORDER BY created_at DESC, id DESC";

    private static final String FIND_BY_ID_SQL =
        "SELECT " + COLUMNS + " FROM images WHERE id = ? AND is_deleted = 0";

    private static final String FIND_BY_HASH_SQL =
        "SELECT " + COLUMNS + " FROM images WHERE file_hash = ? AND is_deleted = 0";

    private static final String SOFT_DELETE_SQL =
        "UPDATE images SET is_deleted = 1, updated_at = ? WHERE id = ? AND is_deleted = 0";

    private static final RowMapper<Asset> ASSET_ROW_MAPPER = (rs, rowNum) -> Asset.builder()
        .id(rs.getLong("id"))
        .contentHash(rs.getString("file_hash"))
        .encryptedName(rs.getString("file_name"))
        .storagePath(rs.getString("storage_path"))
        .createdAt(VaultTimestamps.parse(rs.getString("created_at")))
        .updatedAt(VaultTimestamps.parse(rs.getString("updated_at")))
        .sizeBytes(rs.getLong("file_size"))
        .deleted(rs.getInt("is_deleted") != 0)
        .build();

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcAssetCatalog(VaultDatabase database, Clock clock) {
        this.jdbc = database.getJdbcTemplate();
        this.clock = clock;
    }

    @Override
    public long insert(String contentHash, String encryptedName, String storagePath, long sizeBytes) {
        String now = VaultTimestamps.now(clock);
        try {
            Long id = jdbc.queryForObject(INSERT_SQL, Long.class,
                contentHash, encryptedName, storagePath, now, now, sizeBytes);
            if (id == null) {
                throw new VaultStorageException("Insert returned no id for asset " + contentHash, null);
            }
            log.debug("Catalogued asset id={} path={}", id, storagePath);
            return id;
        } catch (DataAccessException e) {
            if (SqliteErrors.isUniqueViolation(e)) {
                throw new DuplicateAssetException(contentHash, e);
            }
            throw new VaultStorageException("Failed to insert asset " + contentHash, e);
        }
    }

    @Override
    public List<Asset> listActive() {
        try {
            return jdbc.query(LIST_ACTIVE_SQL, ASSET_ROW_MAPPER);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to list assets", e);
        }
    }

    @Override
    public List<Asset> listActiveByTag(String tagName) {
        try {
            return jdbc.query(LIST_ACTIVE_BY_TAG_SQL, ASSET_ROW_MAPPER, tagName);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to list assets tagged " + tagName, e);
        }
    }

    @Override
    public long countActive() {
        try {
            Long count = jdbc.queryForObject("SELECT COUNT(*) FROM images WHERE is_deleted = 0", Long.class);
            return count == null ? 0L : count;
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to count assets", e);
        }
    }

    @Override
    public Optional<Asset> findById(long id) {
        try {
            return jdbc.query(FIND_BY_ID_SQL, ASSET_ROW_MAPPER, id).stream().findFirst();
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to load asset " + id, e);
        }
    }

    @Override
    public Optional<Asset> findByHash(String contentHash) {
        try {
            return jdbc.query(FIND_BY_HASH_SQL, ASSET_ROW_MAPPER, contentHash).stream().findFirst();
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to look up asset by hash", e);
        }
    }

    @Override
    public boolean hashExists(String contentHash) {
        try {
            Boolean exists = jdbc.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM images WHERE file_hash = ?)", Boolean.class, contentHash);
            return Boolean.TRUE.equals(exists);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to look up asset by hash", e);
        }
    }

    @Override
    public boolean softDelete(long id) {
        try {
            int updated = jdbc.update(SOFT_DELETE_SQL, VaultTimestamps.now(clock), id);
            return updated > 0;
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to delete asset " + id, e);
        }
    }

    @Override
    public boolean purge(long id) {
        try {
            int removed = jdbc.update("DELETE FROM images WHERE id = ?", id);
            if (removed > 0) {
                log.info("Purged asset id={} with its tags and annotations", id);
            }
            return removed > 0;
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to purge asset " + id, e);
        }
    }
}
