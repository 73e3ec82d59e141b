package com.graphivault.interfaces.api;

import com.graphivault.application.VaultGatewayService;
import com.graphivault.application.VaultMaintenanceService;
import com.graphivault.application.VaultSettingsService;
import com.graphivault.config.VaultProperties;
import com.graphivault.domain.model.VaultIdentity;
import com.graphivault.infrastructure.crypto.GatewayResult;
import com.graphivault.infrastructure.crypto.GatewayTimeouts;
import com.graphivault.interfaces.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * REST controller for vault-level operations.
 *
 * Provides endpoints for:
 * - Vault identity, summary and settings
 * - Encryption, decryption and lock lifecycle, forwarded to the encryption gateway
 * - Audit log review
 *
 * Gateway endpoints answer 200 on success, 422 when the gateway refused
 * and 502 when it could not be reached, with the same envelope body.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/vault")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Vault", description = "Vault identity, settings, encryption gateway and audit")
public class VaultRestController {

    static final Duration DEFAULT_SUMMARY_WINDOW = Duration.ofHours(24);

    private final VaultSettingsService settingsService;
    private final VaultGatewayService gatewayService;
    private final VaultMaintenanceService maintenanceService;
    private final VaultProperties vaultProperties;
    private final Clock clock;

    @GetMapping(value = "/info", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Vault summary", description = "Identity plus the current live asset count")
    public CompletableFuture<VaultInfoResponse> info() {
        return settingsService.vaultInfo().thenApply(VaultInfoResponse::from);
    }

    @GetMapping(value = "/identity", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Vault identity", description = "Seeded once, on the vault's first launch")
    public CompletableFuture<VaultIdentity> identity() {
        return settingsService.identity();
    }

    @GetMapping(value = "/settings", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List settings")
    public CompletableFuture<List<SettingResponse>> listSettings() {
        return settingsService.listSettings()
            .thenApply(entries -> entries.stream().map(SettingResponse::from).collect(Collectors.toList()));
    }

    @GetMapping(value = "/settings/{key}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get setting")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Setting found",
            content = @Content(schema = @Schema(implementation = SettingResponse.class))
        ),
        @ApiResponse(responseCode = "404", description = "No such setting")
    })
    public CompletableFuture<ResponseEntity<SettingResponse>> getSetting(@PathVariable String key) {
        return settingsService.getSetting(key)
            .thenApply(entry -> entry
                .map(found -> ResponseEntity.ok(SettingResponse.from(found)))
                .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PutMapping(
        value = "/settings/{key}",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Set setting", description = "Inserts or overwrites; no key is protected")
    public CompletableFuture<SettingResponse> setSetting(
            @PathVariable String key,
            @Valid @RequestBody SettingRequest request) {

        return settingsService.setSetting(key, request.getValue()).thenApply(SettingResponse::from);
    }

    @PostMapping(
        value = "/encrypt",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Encrypt file", description = "Returns the encrypted artifact path in data")
    public CompletableFuture<ResponseEntity<GatewayResponse>> encrypt(@Valid @RequestBody EncryptFileRequest request) {
        return respond(gatewayService.encryptFile(request.getFilePath(), request.getPassword()));
    }

    @PostMapping(
        value = "/decrypt",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Decrypt file", description = "Returns the plaintext output path in data")
    public CompletableFuture<ResponseEntity<GatewayResponse>> decrypt(@Valid @RequestBody DecryptFileRequest request) {
        return respond(gatewayService.decryptFile(
            request.getEncryptedPath(), request.getPassword(), request.getOutputPath()));
    }

    @PostMapping(
        value = "/initialize",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Initialize vault keys")
    public CompletableFuture<ResponseEntity<GatewayResponse>> initialize(@Valid @RequestBody PasswordRequest request) {
        return respond(gatewayService.initializeVault(request.getPassword()));
    }

    @PostMapping(
        value = "/unlock",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Unlock vault")
    public CompletableFuture<ResponseEntity<GatewayResponse>> unlock(@Valid @RequestBody PasswordRequest request) {
        return respond(gatewayService.unlockVault(request.getPassword()));
    }

    @PostMapping(value = "/lock", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Lock vault")
    public CompletableFuture<ResponseEntity<GatewayResponse>> lock() {
        return respond(gatewayService.lockVault());
    }

    @GetMapping(value = "/audit", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Recent audit events", description = "Newest first")
    public CompletableFuture<List<AuditEventResponse>> recentAudit(
            @RequestParam(defaultValue = "50") int limit) {

        if (limit < 1 || limit > 1000) {
            throw new IllegalArgumentException("limit must be between 1 and 1000");
        }
        return maintenanceService.recentAuditEvents(limit)
            .thenApply(events -> events.stream().map(AuditEventResponse::from).collect(Collectors.toList()));
    }

    @GetMapping(value = "/audit/summary", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Audit summary", description = "Counts per event type since the given instant, default last 24 hours")
    public CompletableFuture<AuditSummaryResponse> auditSummary(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {

        Instant from = since != null ? since : clock.instant().minus(DEFAULT_SUMMARY_WINDOW);
        return maintenanceService.auditSummary(from).thenApply(AuditSummaryResponse::from);
    }

    private CompletableFuture<ResponseEntity<GatewayResponse>> respond(CompletableFuture<GatewayResult> pending) {
        return GatewayTimeouts.bounded(pending, vaultProperties.getGateway().getCallerTimeout())
            .thenApply(result -> ResponseEntity.status(statusOf(result)).body(GatewayResponse.from(result)));
    }

    static HttpStatus statusOf(GatewayResult result) {
        switch (result.getOutcome()) {
            case SUCCESS:
                return HttpStatus.OK;
            case FAILURE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.BAD_GATEWAY;
        }
    }
}
