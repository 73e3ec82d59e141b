package com.graphivault.infrastructure.persistence;

import com.graphivault.domain.exception.AssetReferenceException;
import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.Annotation;
import com.graphivault.domain.repository.AnnotationStore;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class JdbcAnnotationStore implements AnnotationStore {

    private static final String INSERT_SQL =
        "INSERT INTO annotations (image_id, note, created_at) VALUES (?, ?, ?) RETURNING id";

    private static final String LIST_SQL =
        "SELECT id, image_id, note, created_at FROM annotations WHERE image_id = ? ORDER BY created_at ASC, id ASC";

    private static final RowMapper<Annotation> ANNOTATION_ROW_MAPPER = (rs, rowNum) -> Annotation.builder()
        .id(rs.getLong("id"))
        .assetId(rs.getLong("image_id"))
        .note(rs.getString("note"))
        .createdAt(VaultTimestamps.parse(rs.getString("created_at")))
        .build();

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcAnnotationStore(VaultDatabase database, Clock clock) {
        this.jdbc = database.getJdbcTemplate();
        this.clock = clock;
    }

    @Override
    public long addAnnotation(long assetId, String note) {
        try {
            Long id = jdbc.queryForObject(INSERT_SQL, Long.class, assetId, note, VaultTimestamps.now(clock));
            if (id == null) {
                throw new VaultStorageException("Insert returned no id for annotation on asset " + assetId, null);
            }
            return id;
        } catch (DataAccessException e) {
            if (SqliteErrors.isForeignKeyViolation(e)) {
                throw new AssetReferenceException(assetId, e);
            }
            throw new VaultStorageException("Failed to annotate asset " + assetId, e);
        }
    }

    @Override
    public List<Annotation> listAnnotations(long assetId) {
        try {
            return jdbc.query(LIST_SQL, ANNOTATION_ROW_MAPPER, assetId);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to list annotations of asset " + assetId, e);
        }
    }
}
