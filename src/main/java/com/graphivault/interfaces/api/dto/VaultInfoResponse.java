package com.graphivault.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.graphivault.domain.model.VaultInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vault summary, in the field naming the desktop shell reads.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultInfoResponse {

    @JsonProperty("vault_id")
    private String vaultId;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("schema_version")
    private String schemaVersion;

    @JsonProperty("total_images")
    private Long totalImages;

    private String status;

    public static VaultInfoResponse from(VaultInfo info) {
        return VaultInfoResponse.builder()
            .vaultId(info.getVaultId())
            .createdAt(info.getCreatedAt())
            .schemaVersion(info.getSchemaVersion())
            .totalImages(info.getTotalActiveAssets())
            .status(info.getStatus())
            .build();
    }
}
