package com.graphivault.infrastructure.audit;

import com.graphivault.config.VaultProperties;
import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.AuditEvent;
import com.graphivault.domain.model.AuditSummary;
import com.graphivault.infrastructure.persistence.MutableClock;
import com.graphivault.infrastructure.persistence.SchemaManager;
import com.graphivault.infrastructure.persistence.VaultDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAuditLogTest {

    @TempDir
    Path vaultRoot;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T08:00:00Z");
    private VaultDatabase database;
    private JdbcAuditLog auditLog;

    @BeforeEach
    void openVault() {
        database = new SchemaManager(new VaultProperties.Database(), clock).initialize(vaultRoot);
        auditLog = new JdbcAuditLog(database, clock);
    }

    @AfterEach
    void closeVault() {
        database.close();
    }

    @Test
    void recent_returns_newest_first_up_to_limit() {
        auditLog.append("vault_unlocked", AuditEvent.STATUS_SUCCESS, null);
        clock.advance(Duration.ofMinutes(1));
        auditLog.append("image_added", AuditEvent.STATUS_SUCCESS, "Image ID: 1");
        clock.advance(Duration.ofMinutes(1));
        auditLog.append("vault_locked", AuditEvent.STATUS_SUCCESS, null);

        List<AuditEvent> events = auditLog.recent(2);

        assertEquals(List.of("vault_locked", "image_added"),
            events.stream().map(AuditEvent::getEventType).collect(Collectors.toList()));
        assertEquals("Image ID: 1", events.get(1).getDetails());
        assertEquals(Instant.parse("2024-05-01T08:01:00Z"), events.get(1).getTimestamp());
    }

    @Test
    void summary_counts_events_since_instant() {
        auditLog.append("vault_unlocked", AuditEvent.STATUS_FAILURE, "bad password");
        clock.advance(Duration.ofHours(2));
        Instant windowStart = clock.instant();
        auditLog.append("vault_unlocked", AuditEvent.STATUS_FAILURE, "bad password");
        auditLog.append("vault_unlocked", AuditEvent.STATUS_SUCCESS, null);
        clock.advance(Duration.ofMinutes(5));
        auditLog.append("image_added", AuditEvent.STATUS_SUCCESS, "Image ID: 1");

        AuditSummary summary = auditLog.summarize(windowStart);

        assertEquals(3L, summary.getTotalEvents());
        assertEquals(1L, summary.getFailureEvents());
        assertEquals(Map.of("vault_unlocked", 2L, "image_added", 1L), summary.getEventTypes());
        assertEquals(windowStart, summary.getFirstActivity());
        assertEquals(windowStart.plus(Duration.ofMinutes(5)), summary.getLastActivity());
    }

    @Test
    void summary_of_empty_window_is_zeroed() {
        AuditSummary summary = auditLog.summarize(Instant.parse("2030-01-01T00:00:00Z"));

        assertEquals(0L, summary.getTotalEvents());
        assertEquals(0L, summary.getFailureEvents());
        assertTrue(summary.getEventTypes().isEmpty());
        assertNull(summary.getFirstActivity());
    }

    @Test
    void append_surfaces_store_failures() {
        database.getJdbcTemplate().execute(
            "CREATE TRIGGER block_audit BEFORE INSERT ON auth_logs BEGIN SELECT RAISE(ABORT, 'audit disabled'); END");

        assertThrows(VaultStorageException.class,
            () -> auditLog.append("image_added", AuditEvent.STATUS_SUCCESS, null));
    }
}
