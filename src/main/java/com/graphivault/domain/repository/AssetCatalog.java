package com.graphivault.domain.repository;

import com.graphivault.domain.model.Asset;

import java.util.List;
import java.util.Optional;

/**
 * Catalog of ingested files.
 *
 * <p>Implementations must enforce:
 * <ul>
 *   <li>Global uniqueness of the content hash, soft-deleted rows included</li>
 *   <li>Soft-deleted rows are invisible to every read on this interface</li>
 *   <li>Recency-first ordering of listings</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface AssetCatalog {

    /**
     * Record a newly ingested file.
     *
     * @param contentHash opaque content hash used for deduplication
     * @param encryptedName opaque encrypted filename
     * @param storagePath location of the encrypted artifact, relative to the vault root
     * @param sizeBytes original file size
     * @return newly assigned asset id
     * @throws com.graphivault.domain.exception.DuplicateAssetException if the hash is already catalogued
     */
    long insert(String contentHash, String encryptedName, String storagePath, long sizeBytes);

    /**
     * All live assets, most recently created first.
     */
    List<Asset> listActive();

    /**
     * Live assets carrying at least one tag with exactly this name, most recent first.
     */
    List<Asset> listActiveByTag(String tagName);

    /**
     * Number of live assets.
     */
    long countActive();

    /**
     * @return the asset, or empty if absent or soft-deleted
     */
    Optional<Asset> findById(long id);

    /**
     * Deduplication lookup.
     *
     * @return the asset, or empty if absent or soft-deleted
     */
    Optional<Asset> findByHash(String contentHash);

    /**
     * @return true if any row, live or soft-deleted, holds this hash
     */
    boolean hashExists(String contentHash);

    /**
     * Hide an asset from normal reads. Idempotent.
     *
     * @return true if a live row was marked deleted by this call
     */
    boolean softDelete(long id);

    /**
     * Physically remove the asset row, cascading to its tags and annotations.
     *
     * <p>Irreversible maintenance operation; not part of the routine command surface.
     *
     * @return true if a row was removed
     */
    boolean purge(long id);
}
