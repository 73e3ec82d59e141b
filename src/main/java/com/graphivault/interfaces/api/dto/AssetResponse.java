package com.graphivault.interfaces.api.dto;

import com.graphivault.domain.model.Asset;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssetResponse {

    private Long id;
    private String contentHash;
    private String encryptedName;
    private String storagePath;
    private Instant createdAt;
    private Instant updatedAt;
    private Long sizeBytes;

    public static AssetResponse from(Asset asset) {
        return AssetResponse.builder()
            .id(asset.getId())
            .contentHash(asset.getContentHash())
            .encryptedName(asset.getEncryptedName())
            .storagePath(asset.getStoragePath())
            .createdAt(asset.getCreatedAt())
            .updatedAt(asset.getUpdatedAt())
            .sizeBytes(asset.getSizeBytes())
            .build();
    }
}
