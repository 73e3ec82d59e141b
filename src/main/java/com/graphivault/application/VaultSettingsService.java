package com.graphivault.application;

import com.graphivault.config.AsyncConfiguration;
import com.graphivault.domain.model.VaultIdentity;
import com.graphivault.domain.model.VaultInfo;
import com.graphivault.domain.model.VaultMetaEntry;
import com.graphivault.domain.repository.AssetCatalog;
import com.graphivault.domain.repository.VaultMetaStore;
import com.graphivault.infrastructure.persistence.VaultTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Vault settings and identity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultSettingsService {

    private final VaultMetaStore vaultMetaStore;
    private final AssetCatalog assetCatalog;

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Optional<VaultMetaEntry>> getSetting(String key) {
        return CompletableFuture.completedFuture(vaultMetaStore.find(key));
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<List<VaultMetaEntry>> listSettings() {
        return CompletableFuture.completedFuture(vaultMetaStore.findAll());
    }

    /**
     * Any key may be written, reserved keys included.
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<VaultMetaEntry> setSetting(String key, String value) {
        vaultMetaStore.set(key, value);
        log.info("Setting updated: key={}", key);
        return CompletableFuture.completedFuture(vaultMetaStore.find(key)
            .orElseThrow(() -> new IllegalStateException("Setting vanished after write: " + key)));
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<VaultIdentity> identity() {
        String vaultId = reserved(VaultMetaEntry.VAULT_ID);
        String createdAt = reserved(VaultMetaEntry.CREATED_AT);
        String schemaVersion = reserved(VaultMetaEntry.SCHEMA_VERSION);
        return CompletableFuture.completedFuture(new VaultIdentity(
            vaultId, VaultTimestamps.parse(createdAt), Integer.parseInt(schemaVersion)));
    }

    /**
     * Identity plus the live asset count, read fresh on every call.
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<VaultInfo> vaultInfo() {
        VaultInfo info = VaultInfo.builder()
            .vaultId(vaultMetaStore.get(VaultMetaEntry.VAULT_ID).orElse(null))
            .createdAt(vaultMetaStore.get(VaultMetaEntry.CREATED_AT).orElse(null))
            .schemaVersion(vaultMetaStore.get(VaultMetaEntry.SCHEMA_VERSION).orElse(null))
            .totalActiveAssets(assetCatalog.countActive())
            .status(VaultInfo.STATUS_ACTIVE)
            .build();
        return CompletableFuture.completedFuture(info);
    }

    private String reserved(String key) {
        return vaultMetaStore.get(key)
            .orElseThrow(() -> new IllegalStateException("Vault metadata is missing reserved key " + key));
    }
}
