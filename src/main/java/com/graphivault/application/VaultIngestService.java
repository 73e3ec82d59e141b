package com.graphivault.application;

import com.graphivault.config.AsyncConfiguration;
import com.graphivault.config.PerformanceConfiguration.VaultMetrics;
import com.graphivault.domain.exception.DuplicateAssetException;
import com.graphivault.domain.exception.VaultStorageException;
import com.graphivault.domain.model.Asset;
import com.graphivault.domain.model.AuditEventTypes;
import com.graphivault.domain.repository.AssetCatalog;
import com.graphivault.infrastructure.audit.AuditService;
import com.graphivault.infrastructure.crypto.ContentHasher;
import com.graphivault.infrastructure.crypto.EncryptionGateway;
import com.graphivault.infrastructure.crypto.EncryptionGatewayException;
import com.graphivault.infrastructure.crypto.GatewayRequest;
import com.graphivault.infrastructure.crypto.GatewayResult;
import com.graphivault.infrastructure.persistence.VaultLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * End-to-end ingest of a plaintext file: hash, deduplicate, encrypt, catalog.
 *
 * Duplicates are refused before the gateway is called, so no ciphertext is
 * produced for content the vault already holds, live or soft-deleted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultIngestService {

    private final ContentHasher contentHasher;
    private final AssetCatalog assetCatalog;
    private final EncryptionGateway encryptionGateway;
    private final VaultLayout vaultLayout;
    private final AuditService auditService;
    private final VaultMetrics vaultMetrics;

    @Async(AsyncConfiguration.GATEWAY_EXECUTOR)
    public CompletableFuture<Asset> ingest(String filePath, String password) {
        Path source = Path.of(filePath);
        if (!Files.isRegularFile(source)) {
            throw new IllegalArgumentException("Not a regular file: " + filePath);
        }

        String contentHash;
        long sizeBytes;
        try {
            contentHash = contentHasher.sha256Hex(source);
            sizeBytes = Files.size(source);
        } catch (IOException e) {
            throw new VaultStorageException("Failed to read " + filePath, e);
        }

        if (assetCatalog.hashExists(contentHash)) {
            vaultMetrics.recordDuplicateRejected();
            log.info("Ingest refused, content already catalogued: hash={}", VaultCatalogService.maskHash(contentHash));
            throw new DuplicateAssetException(contentHash);
        }

        GatewayResult encrypted = encryptionGateway.execute(
            GatewayRequest.encrypt(vaultLayout.getRoot(), source, password));
        if (!encrypted.isSuccess()) {
            audit(AuditEventTypes.FILE_ENCRYPTED, false, encrypted.getOutcome() + ": " + encrypted.getReason());
            throw new EncryptionGatewayException(encrypted);
        }
        audit(AuditEventTypes.FILE_ENCRYPTED, true, null);

        Path artifact = vaultLayout.resolve(encrypted.getOutputRef());
        String storagePath = vaultLayout.relativize(artifact);
        String encryptedName = artifact.getFileName().toString();

        long id;
        try {
            id = assetCatalog.insert(contentHash, encryptedName, storagePath, sizeBytes);
        } catch (DuplicateAssetException e) {
            // lost a race with a concurrent ingest of the same content
            vaultMetrics.recordDuplicateRejected();
            discardArtifact(artifact);
            throw e;
        }

        vaultMetrics.recordAssetAdded();
        audit(AuditEventTypes.IMAGE_ADDED, true, "Image ID: " + id);
        log.info("Ingested asset id={} path={}", id, storagePath);

        Asset asset = assetCatalog.findById(id)
            .orElseThrow(() -> new VaultStorageException("Ingested asset " + id + " is not readable", null));
        return CompletableFuture.completedFuture(asset);
    }

    private void discardArtifact(Path artifact) {
        try {
            Files.deleteIfExists(artifact);
        } catch (IOException e) {
            log.warn("Could not remove orphaned artifact {}: {}", artifact, e.getMessage());
        }
    }

    private void audit(String eventType, boolean success, String details) {
        boolean written = success
            ? auditService.success(eventType, details)
            : auditService.failure(eventType, details);
        if (!written) {
            vaultMetrics.recordAuditWriteFailure(eventType);
        }
    }
}
