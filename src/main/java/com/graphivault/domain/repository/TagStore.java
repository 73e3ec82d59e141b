package com.graphivault.domain.repository;

import com.graphivault.domain.model.Tag;

import java.util.List;

/**
 * Tags keyed by asset. Rows cascade away with a hard delete of their asset.
 */
public interface TagStore {

    /**
     * @param kind optional classifier, may be null
     * @return newly assigned tag id
     * @throws com.graphivault.domain.exception.AssetReferenceException if no asset row has this id
     */
    long addTag(long assetId, String name, String kind);

    /**
     * Tags of one asset, oldest first.
     */
    List<Tag> listTags(long assetId);
}
