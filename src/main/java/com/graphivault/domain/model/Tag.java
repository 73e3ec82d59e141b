package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Label attached to exactly one asset. Name and kind are opaque to the store.
 */
@Value
@Builder
public class Tag {

    long id;
    long assetId;
    String name;
    String kind;
    Instant createdAt;
}
