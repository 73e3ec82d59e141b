package com.graphivault.interfaces.api.dto;

import com.graphivault.domain.model.Annotation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnotationResponse {

    private Long id;
    private Long assetId;
    private String note;
    private Instant createdAt;

    public static AnnotationResponse from(Annotation annotation) {
        return AnnotationResponse.builder()
            .id(annotation.getId())
            .assetId(annotation.getAssetId())
            .note(annotation.getNote())
            .createdAt(annotation.getCreatedAt())
            .build();
    }
}
