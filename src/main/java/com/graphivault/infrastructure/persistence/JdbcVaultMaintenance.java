package com.graphivault.infrastructure.persistence;

import com.graphivault.domain.exception.VaultStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Whole-database operations: online snapshot and free-page reclamation.
 */
@Slf4j
@Component
public class JdbcVaultMaintenance {

    private final JdbcTemplate jdbc;

    public JdbcVaultMaintenance(VaultDatabase database) {
        this.jdbc = database.getJdbcTemplate();
    }

    /**
     * Write a consistent, compacted copy of the live database to {@code target}.
     * Safe while other connections read and write.
     *
     * @throws VaultStorageException if {@code target} exists or the copy fails
     */
    public void snapshotTo(Path target) {
        if (Files.exists(target)) {
            throw new VaultStorageException("Backup target already exists: " + target, null);
        }
        try {
            jdbc.update("VACUUM INTO ?", target.toString());
            log.info("Wrote vault snapshot to {}", target);
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to write vault snapshot to " + target, e);
        }
    }

    /**
     * Return free pages to the filesystem. Freed content is already zeroed by {@code secure_delete}.
     *
     * @return free pages left after the pass
     */
    public long reclaimFreePages() {
        try {
            long before = freelistCount();
            long remaining = before;
            // the pragma frees one page per result step, and a driver may step it only once
            while (remaining > 0) {
                jdbc.execute("PRAGMA incremental_vacuum(" + remaining + ")");
                long after = freelistCount();
                if (after >= remaining) {
                    break;
                }
                remaining = after;
            }
            log.info("Incremental vacuum reclaimed {} pages, {} free pages remaining", before - remaining, remaining);
            return remaining;
        } catch (DataAccessException e) {
            throw new VaultStorageException("Failed to reclaim free pages", e);
        }
    }

    private long freelistCount() {
        Long count = jdbc.queryForObject("PRAGMA freelist_count", Long.class);
        return count == null ? 0L : count;
    }
}
