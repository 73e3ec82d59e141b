package com.graphivault.interfaces.api.dto;

import com.graphivault.domain.model.Tag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagResponse {

    private Long id;
    private Long assetId;
    private String name;
    private String kind;
    private Instant createdAt;

    public static TagResponse from(Tag tag) {
        return TagResponse.builder()
            .id(tag.getId())
            .assetId(tag.getAssetId())
            .name(tag.getName())
            .kind(tag.getKind())
            .createdAt(tag.getCreatedAt())
            .build();
    }
}
