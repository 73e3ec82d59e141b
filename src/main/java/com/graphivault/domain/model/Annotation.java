package com.graphivault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Annotation {

    long id;
    long assetId;
    String note;
    Instant createdAt;
}
