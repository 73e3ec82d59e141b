package com.graphivault.interfaces.api;

import com.graphivault.application.VaultMaintenanceService;
import com.graphivault.interfaces.api.dto.MaintenanceResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

/**
 * Maintenance endpoints. Kept apart from the catalog surface; purge is irreversible.
 */
@RestController
@RequestMapping("/api/v1/vault/maintenance")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Maintenance", description = "Backup, space reclamation and hard deletion")
public class MaintenanceRestController {

    private final VaultMaintenanceService maintenanceService;

    @PostMapping(value = "/backup", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Back up database", description = "Consistent online snapshot into the backups directory")
    public CompletableFuture<MaintenanceResponse> backup() {
        return maintenanceService.backup()
            .thenApply(path -> MaintenanceResponse.builder()
                .operation("backup")
                .backupPath(path.toString())
                .build());
    }

    @PostMapping(value = "/reclaim", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Reclaim free pages")
    public CompletableFuture<MaintenanceResponse> reclaim() {
        return maintenanceService.reclaimSpace()
            .thenApply(freePages -> MaintenanceResponse.builder()
                .operation("reclaim")
                .freePages(freePages)
                .build());
    }

    @DeleteMapping(value = "/assets/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Purge asset", description = "Removes the row with its tags and annotations")
    public CompletableFuture<MaintenanceResponse> purge(@PathVariable long id) {
        if (log.isWarnEnabled()) {
            log.warn("Purging asset: id={}", id);
        }

        return maintenanceService.purgeAsset(id)
            .thenApply(removed -> MaintenanceResponse.builder()
                .operation("purge")
                .removed(removed)
                .build());
    }
}
