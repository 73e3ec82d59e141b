package com.graphivault.interfaces.api;

import com.graphivault.application.VaultCatalogService;
import com.graphivault.application.VaultIngestService;
import com.graphivault.interfaces.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * REST controller for catalog operations.
 *
 * Provides endpoints for:
 * - Cataloguing encrypted files, or ingesting plaintext files end to end
 * - Listing and looking up live assets
 * - Soft-deleting assets
 * - Tagging and annotating assets
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/assets")
@RequiredArgsConstructor
@Slf4j
@io.swagger.v3.oas.annotations.tags.Tag(name = "Assets", description = "Catalog of encrypted files")
public class AssetRestController {

    private final VaultCatalogService catalogService;
    private final VaultIngestService ingestService;

    /**
     * Catalog a file the gateway has already encrypted.
     */
    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Add asset",
        description = "Records an encrypted file; the content hash must not already be catalogued"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Asset catalogued",
            content = @Content(schema = @Schema(implementation = CreatedResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Content already catalogued, live or soft-deleted",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public CompletableFuture<ResponseEntity<CreatedResponse>> addAsset(
            @Valid @RequestBody CreateAssetRequest request) {

        if (log.isInfoEnabled()) {
            log.info("Adding asset at {}", request.getStoragePath());
        }

        return catalogService.addAsset(request.getContentHash(), request.getEncryptedName(),
                request.getStoragePath(), request.getSizeBytes())
            .thenApply(id -> ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(id)));
    }

    /**
     * Hash, encrypt and catalog a plaintext file in one step.
     */
    @PostMapping(
        value = "/ingest",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Ingest file",
        description = "Deduplicates by SHA-256, encrypts through the gateway, then catalogs the result"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "File ingested",
            content = @Content(schema = @Schema(implementation = AssetResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Content already catalogued",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "422",
            description = "Encryption gateway refused the file",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "502",
            description = "Encryption gateway unreachable",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public CompletableFuture<ResponseEntity<AssetResponse>> ingest(@Valid @RequestBody IngestRequest request) {
        return ingestService.ingest(request.getFilePath(), request.getPassword())
            .thenApply(asset -> ResponseEntity.status(HttpStatus.CREATED).body(AssetResponse.from(asset)));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "List assets",
        description = "Live assets, most recent first; optionally only those carrying a tag"
    )
    public CompletableFuture<List<AssetResponse>> listAssets(@RequestParam(required = false) String tag) {
        return catalogService.listAssets(tag)
            .thenApply(assets -> assets.stream().map(AssetResponse::from).collect(Collectors.toList()));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get asset by ID")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Asset found",
            content = @Content(schema = @Schema(implementation = AssetResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Asset absent or soft-deleted",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public CompletableFuture<AssetResponse> getAsset(@PathVariable long id) {
        return catalogService.getAsset(id).thenApply(AssetResponse::from);
    }

    @GetMapping(value = "/by-hash/{contentHash}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get asset by content hash")
    public CompletableFuture<AssetResponse> getAssetByHash(@PathVariable String contentHash) {
        return catalogService.getAssetByHash(contentHash).thenApply(AssetResponse::from);
    }

    /**
     * Soft delete. Repeating it is harmless; {@code removed} tells whether this call hid the asset.
     */
    @DeleteMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Delete asset",
        description = "Hides the asset from all reads; its content hash stays reserved"
    )
    public CompletableFuture<MaintenanceResponse> deleteAsset(@PathVariable long id) {
        if (log.isInfoEnabled()) {
            log.info("Deleting asset: id={}", id);
        }

        return catalogService.deleteAsset(id)
            .thenApply(removed -> MaintenanceResponse.builder()
                .operation("soft_delete")
                .removed(removed)
                .build());
    }

    @PostMapping(
        value = "/{id}/tags",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Tag asset")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "Tag added"),
        @ApiResponse(
            responseCode = "422",
            description = "No asset with this id",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public CompletableFuture<ResponseEntity<CreatedResponse>> addTag(
            @PathVariable long id,
            @Valid @RequestBody CreateTagRequest request) {

        return catalogService.addTag(id, request.getName(), request.getKind())
            .thenApply(tagId -> ResponseEntity.status(HttpStatus.CREATED).body(new CreatedResponse(tagId)));
    }

    @GetMapping(value = "/{id}/tags", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List tags of asset", description = "Oldest first")
    public CompletableFuture<List<TagResponse>> listTags(@PathVariable long id) {
        return catalogService.listTags(id)
            .thenApply(tags -> tags.stream().map(TagResponse::from).collect(Collectors.toList()));
    }

    @PostMapping(
        value = "/{id}/annotations",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Annotate asset")
    public CompletableFuture<ResponseEntity<CreatedResponse>> addAnnotation(
            @PathVariable long id,
            @Valid @RequestBody CreateAnnotationRequest request) {

        return catalogService.addAnnotation(id, request.getNote())
            .thenApply(annotationId -> ResponseEntity.status(HttpStatus.CREATED)
                .body(new CreatedResponse(annotationId)));
    }

    @GetMapping(value = "/{id}/annotations", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List annotations of asset", description = "Oldest first")
    public CompletableFuture<List<AnnotationResponse>> listAnnotations(@PathVariable long id) {
        return catalogService.listAnnotations(id)
            .thenApply(notes -> notes.stream().map(AnnotationResponse::from).collect(Collectors.toList()));
    }
}
