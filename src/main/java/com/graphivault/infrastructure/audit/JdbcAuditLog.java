package com.graphivault.infrastructure.audit;

import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.AuditEvent;
import com.graphivault.domain.model.AuditSummary;
import com.graphivault.domain.repository.AuditLog;
import com.graphivault.infrastructure.persistence.VaultDatabase;
import com.graphivault.infrastructure.persistence.VaultTimestamps;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link AuditLog} over the append-only {@code auth_logs} table.
 */
@Component
public class JdbcAuditLog implements AuditLog {

    private static final String INSERT_SQL =
        "INSERT INTO auth_logs (event_type, timestamp, status, details) VALUES (?, ?, ?, ?) RETURNING id";

    private static final String RECENT_SQL = """
        SELECT id, event_type, timestamp, status, details FROM auth_logs
        ORDER BY timestamp DESC, id DESC
        LIMIT ?""";

    private static final String TOTALS_SQL = """
        SELECT COUNT(*) AS total,
               COALESCE(SUM(CASE WHEN status = ? THEN 1 ELSE 0 END), 0) AS failures,
               MIN(timestamp) AS first_activity,
               MAX(timestamp) AS last_activity
        FROM auth_logs WHERE timestamp >= ?""";

    private static final String BY_TYPE_SQL = """
        SELECT event_type, COUNT(*) AS occurrences FROM auth_logs
        WHERE timestamp >= ?
        GROUP BY event_type
        ORDER BY occurrences DESC, event_type""";

    private static final RowMapper<AuditEvent> EVENT_ROW_MAPPER = (rs, rowNum) -> AuditEvent.builder()
        .id(rs.getLong("id"))
        .eventType(rs.getString("event_type"))
        .timestamp(VaultTimestamps.parse(rs.getString("timestamp")))
        .status(rs.getString("status"))
        .details(rs.getString("details"))
        .build();

    private final JdbcTemplate jdbc;
    private final Clock clock;

    public JdbcAuditLog(VaultDatabase database, Clock clock) {
        this.jdbc = database.getJdbcTemplate();
        this.clock = clock;
    }

    @Override
    public long append(String eventType, String status, String details) {
        try {
            Long id = jdbc.queryForObject(INSERT_SQL, Long.class,
                eventType, VaultTimestamps.now(clock), status, details);
            if (id == null) {
                throw new VaultStorageException("Insert returned no id for audit event " + eventType, null);
            }
            return id;
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to append audit event " + eventType, e);
        }
    }

    @Override
    public List<AuditEvent> recent(int limit) {
        try {
            return jdbc.query(RECENT_SQL, EVENT_ROW_MAPPER, limit);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to read audit log", e);
        }
    }

    @Override
    public AuditSummary summarize(Instant since) {
        String lowerBound = VaultTimestamps.format(since);
        try {
            Map<String, Long> eventTypes = new LinkedHashMap<>();
            jdbc.query(BY_TYPE_SQL,
                (RowCallbackHandler) rs -> eventTypes.put(rs.getString("event_type"), rs.getLong("occurrences")),
                lowerBound);

            return jdbc.queryForObject(TOTALS_SQL, (rs, rowNum) -> AuditSummary.builder()
                    .since(since)
                    .totalEvents(rs.getLong("total"))
                    .failureEvents(rs.getLong("failures"))
                    .eventTypes(eventTypes)
                    .firstActivity(VaultTimestamps.parse(rs.getString("first_activity")))
                    .lastActivity(VaultTimestamps.parse(rs.getString("last_activity")))
                    .build(),
                AuditEvent.STATUS_FAILURE, lowerBound);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to summarize audit log", e);
        }
    }
}
