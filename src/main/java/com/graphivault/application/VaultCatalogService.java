package com.graphivault.application;

import com.graphivault.config.AsyncConfiguration;
import com.graphivault.config.PerformanceConfiguration.VaultMetrics;
import com.graphivault.domain.exception.AssetNotFoundException;
import com.graphivault.domain.exception.DuplicateAssetException;
import com.graphivault.domain.model.Annotation;
import com.graphivault.domain.model.Asset;
import com.graphivault.domain.model.AuditEventTypes;
import com.graphivault.domain.model.Tag;
import com.graphivault.domain.repository.AnnotationStore;
import com.graphivault.domain.repository.AssetCatalog;
import com.graphivault.domain.repository.TagStore;
import com.graphivault.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Catalog commands: assets, tags and annotations.
 *
 * Every command runs on the store executor and completes its future with the
 * result or with the store's typed failure. Mutations are audited best-effort
 * after the primary write has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultCatalogService {

    private final AssetCatalog assetCatalog;
    private final TagStore tagStore;
    private final AnnotationStore annotationStore;
    private final AuditService auditService;
    private final VaultMetrics vaultMetrics;

    /**
     * Catalog an already-encrypted file.
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Long> addAsset(String contentHash, String encryptedName, String storagePath, long sizeBytes) {
        log.info("Adding asset: hash={} path={}", maskHash(contentHash), storagePath);

        long id;
        try {
            id = assetCatalog.insert(contentHash, encryptedName, storagePath, sizeBytes);
        } catch (DuplicateAssetException e) {
            vaultMetrics.recordDuplicateRejected();
            throw e;
        }

        vaultMetrics.recordAssetAdded();
        audit(AuditEventTypes.IMAGE_ADDED, "Image ID: " + id);
        log.info("Asset added: id={}", id);
        return CompletableFuture.completedFuture(id);
    }

    /**
     * @param tag when non-null, only assets carrying a tag with exactly this name
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<List<Asset>> listAssets(String tag) {
        List<Asset> assets = tag == null ? assetCatalog.listActive() : assetCatalog.listActiveByTag(tag);
        return CompletableFuture.completedFuture(assets);
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Asset> getAsset(long id) {
        Asset asset = assetCatalog.findById(id)
            .orElseThrow(() -> new AssetNotFoundException("Asset not found: " + id));
        return CompletableFuture.completedFuture(asset);
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Asset> getAssetByHash(String contentHash) {
        Asset asset = assetCatalog.findByHash(contentHash)
            .orElseThrow(() -> new AssetNotFoundException("No asset for hash " + maskHash(contentHash)));
        return CompletableFuture.completedFuture(asset);
    }

    /**
     * Soft delete. Idempotent; only a call that actually hides a live asset is audited.
     *
     * @return true if this call hid the asset
     */
    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Boolean> deleteAsset(long id) {
        boolean deleted = assetCatalog.softDelete(id);
        if (deleted) {
            vaultMetrics.recordAssetRemoved("soft");
            audit(AuditEventTypes.IMAGE_DELETED, "Image ID: " + id);
            log.info("Asset soft-deleted: id={}", id);
        } else {
            log.debug("Soft delete of id={} changed nothing", id);
        }
        return CompletableFuture.completedFuture(deleted);
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Long> addTag(long assetId, String name, String kind) {
        long id = tagStore.addTag(assetId, name, kind);
        log.debug("Tagged asset {} with tag id={}", assetId, id);
        return CompletableFuture.completedFuture(id);
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<List<Tag>> listTags(long assetId) {
        return CompletableFuture.completedFuture(tagStore.listTags(assetId));
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<Long> addAnnotation(long assetId, String note) {
        long id = annotationStore.addAnnotation(assetId, note);
        log.debug("Annotated asset {} with annotation id={}", assetId, id);
        return CompletableFuture.completedFuture(id);
    }

    @Async(AsyncConfiguration.STORE_EXECUTOR)
    public CompletableFuture<List<Annotation>> listAnnotations(long assetId) {
        return CompletableFuture.completedFuture(annotationStore.listAnnotations(assetId));
    }

    private void audit(String eventType, String details) {
        if (!auditService.success(eventType, details)) {
            vaultMetrics.recordAuditWriteFailure(eventType);
        }
    }

    static String maskHash(String contentHash) {
        if (contentHash == null || contentHash.length() <= 8) {
            return "***";
        }
        return contentHash.substring(0, 8) + "...";
    }
}
