package com.graphivault.application;

import com.graphivault.config.AsyncConfiguration;
import com.graphivault.config.PerformanceConfiguration.VaultMetrics;
import com.graphivault.domain.model.AuditEvent;
import com.graphivault.domain.model.AuditEventTypes;
import com.graphivault.domain.model.AuditSummary;
import com.graphivault.domain.repository.AssetCatalog;
import com.graphivault.domain.repository.AuditLog;
import com.graphivault.infrastructure.audit.AuditService;
import com.graphivault.infrastructure.persistence.JdbcVaultMaintenance;
import com.graphivault.infrastructure.persistence.VaultLayout;
import com.graphivault.infrastructure.persistence.VaultTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Maintenance and audit-review operations. Not part of the routine catalog surface.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultMaintenanceService {

    static final String BACKUP_PREFIX = "graphivault-";
    static final String BACKUP_SUFFIX = ".db";

    private final JdbcVaultMaintenance vaultMaintenance;
    private final AssetCatalog assetCatalog;
    private final AuditLog auditLog;
    private final AuditService auditService;
    private final VaultLayout vaultLayout;
    private final VaultMetrics vaultMetrics;
    private final Clock clock;

    /**
     * Snapshot the database into {@code backups/}.
     *
     * @return path of the new backup file
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Path> backup() {
        Path target = vaultLayout.getBackups()
            .resolve(BACKUP_PREFIX + VaultTimestamps.forFileName(clock.instant()) + BACKUP_SUFFIX);
        vaultMaintenance.snapshotTo(target);
        audit(AuditEventTypes.BACKUP_CREATED, "Backup: " + vaultLayout.relativize(target));
        return CompletableFuture.completedFuture(target);
    }

    /**
     * Irreversibly remove an asset row with its tags and annotations.
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Boolean> purgeAsset(long id) {
        boolean purged = assetCatalog.purge(id);
        if (purged) {
            vaultMetrics.recordAssetRemoved("purge");
            audit(AuditEventTypes.IMAGE_PURGED, "Image ID: " + id);
        }
        return CompletableFuture.completedFuture(purged);
    }

    /**
     * @return free pages left after reclamation
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Long> reclaimSpace() {
        return CompletableFuture.completedFuture(vaultMaintenance.reclaimFreePages());
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<List<AuditEvent>> recentAuditEvents(int limit) {
        return CompletableFuture.completedFuture(auditLog.recent(limit));
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<AuditSummary> auditSummary(Instant since) {
        return CompletableFuture.completedFuture(auditLog.summarize(since));
    }

    private void audit(String eventType, String details) {
        if (!auditService.success(eventType, details)) {
            vaultMetrics.recordAuditWriteFailure(eventType);
        }
    }
}
