package com.graphivault.infrastructure.persistence;

import com.graphivault.domain.exception.AssetReferenceException;
import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.Tag;
import com.graphivault.domain.repository.TagStore;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class JdbcTagStore implements TagStore {

    private static final String INSERT_SQL =
        "INSERT INTO tags (image_id, tag_name, tag_type, created_at) VALUES (?, ?, ?, ?) RETURNING id";

    private static final String LIST_SQL =
        "SELECT id, image_id, tag_name, tag_type, created_at FROM tags WHERE image_id = ? ORDER BY created_at ASC, id ASC";

    private static final RowMapper<Tag> TAG_ROW_MAPPER = (rs, rowNum) -> Tag.builder()
        .id(rs.getLong("id"))
        .assetId(rs.getLong("image_id"))
        .name(rs.getString("tag_name"))
        .kind(rs.getString("tag_type"))
        .createdAt(VaultTimestamps.parse(rs.getString("created_at")))
        .build();

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcTagStore(VaultDatabase database, Clock clock) {
        this.jdbc = database.getJdbcTemplate();
        this.clock = clock;
    }

    @Override
    public long addTag(long assetId, String name, String kind) {
        try {
            Long id = jdbc.queryForObject(INSERT_SQL, Long.class, assetId, name, kind, VaultTimestamps.now(clock));
            if (id == null) {
                throw new VaultStorageException("Insert returned no id for tag on asset " + assetId, null);
            }
            return id;
        } catch (DataAccessException e) {
            if (SqliteErrors.isForeignKeyViolation(e)) {
                throw new AssetReferenceException(assetId, e);
            }
            throw new VaultStorageException("Failed to tag asset " + assetId, e);
        }
    }

    @Override
    public List<Tag> listTags(long assetId) {
        try {
            return jdbc.query(LIST_SQL, TAG_ROW_MAPPER, assetId);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to list tags of asset " + assetId, e);
        }
    }
}
