package com.graphivault.application;

import com.graphivault.config.AsyncConfiguration;
import com.graphivault.config.PerformanceConfiguration.VaultMetrics;
import com.graphivault.domain.model.AuditEventTypes;
import com.graphivault.infrastructure.audit.AuditService;
import com.graphivault.infrastructure.crypto.EncryptionGateway;
import com.graphivault.infrastructure.crypto.GatewayOperation;
import com.graphivault.infrastructure.crypto.GatewayRequest;
import com.graphivault.infrastructure.crypto.GatewayResult;
import com.graphivault.infrastructure.persistence.VaultLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards encryption and vault lifecycle commands to the encryption gateway.
 *
 * Results come back normalized; nothing here throws for a gateway-side problem.
 * Every call is audited with its outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultGatewayService {

    private final EncryptionGateway encryptionGateway;
    private final VaultLayout vaultLayout;
    private final AuditService auditService;
    private final VaultMetrics vaultMetrics;

    @Async(AsyncConfiguration.GATEWAY_EXECUTOR)
    public CompletableFuture<GatewayResult> encryptFile(String filePath, String password) {
        GatewayResult result = encryptionGateway.execute(
            GatewayRequest.encrypt(vaultLayout.getRoot(), Path.of(filePath), password));
        audit(AuditEventTypes.FILE_ENCRYPTED, result);
        return CompletableFuture.completedFuture(result);
    }

    /**
     * @param encryptedPath absolute, or relative to the vault root
     * @param outputPath where to write the plaintext; a fresh file under {@code temp/} when null
     */
    @Async(AsyncConfiguration.GATEWAY_EXECUTOR)
    public CompletableFuture<GatewayResult> decryptFile(String encryptedPath, String password, String outputPath) {
        Path source = vaultLayout.resolve(encryptedPath);
        Path target = outputPath == null || outputPath.isBlank()
            ? vaultLayout.getTemp().resolve(UUID.randomUUID() + "-" + source.getFileName())
            : Path.of(outputPath);
        GatewayResult result = encryptionGateway.execute(
            GatewayRequest.decrypt(vaultLayout.getRoot(), source, target, password));
        audit(AuditEventTypes.FILE_DECRYPTED, result);
        return CompletableFuture.completedFuture(result);
    }

    @Async(AsyncConfiguration.GATEWAY_EXECUTOR)
    public CompletableFuture<GatewayResult> initializeVault(String password) {
        return lifecycle(GatewayOperation.INITIALIZE, AuditEventTypes.VAULT_INITIALIZED, password);
    }

    @Async(AsyncConfiguration.GATEWAY_EXECUTOR)
    public CompletableFuture<GatewayResult> unlockVault(String password) {
        return lifecycle(GatewayOperation.UNLOCK, AuditEventTypes.VAULT_UNLOCKED, password);
    }

    @Async(AsyncConfiguration.GATEWAY_EXECUTOR)
    public CompletableFuture<GatewayResult> lockVault() {
        return lifecycle(GatewayOperation.LOCK, AuditEventTypes.VAULT_LOCKED, null);
    }

    private CompletableFuture<GatewayResult> lifecycle(GatewayOperation operation, String eventType, String password) {
        log.info("Vault lifecycle command: {}", operation);
        GatewayResult result = encryptionGateway.execute(
            GatewayRequest.lifecycle(operation, vaultLayout.getRoot(), password));
        audit(eventType, result);
        return CompletableFuture.completedFuture(result);
    }

    private void audit(String eventType, GatewayResult result) {
        boolean written = result.isSuccess()
            ? auditService.success(eventType, null)
            : auditService.failure(eventType, result.getOutcome() + ": " + result.getReason());
        if (!written) {
            vaultMetrics.recordAuditWriteFailure(eventType);
        }
    }
}
