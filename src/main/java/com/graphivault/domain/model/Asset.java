package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One ingested file tracked by the catalog.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code contentHash} is unique across live and soft-deleted rows and never changes</li>
 *   <li>{@code encryptedName} is opaque; the true filename is never stored in clear</li>
 *   <li>{@code storagePath} is relative to the vault root</li>
 *   <li>{@code updatedAt} advances on every mutation, soft delete included</li>
 * </ul>
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Asset {

    long id;
    String contentHash;
    String encryptedName;
    String storagePath;
    Instant createdAt;
    Instant updatedAt;
    long sizeBytes;
    boolean deleted;
}
