package com.graphivault.interfaces.api.dto;

import com.graphivault.domain.model.VaultMetaEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingResponse {

    private String key;
    private String value;
    private Instant lastUpdated;

    public static SettingResponse from(VaultMetaEntry entry) {
        return SettingResponse.builder()
            .key(entry.getKey())
            .value(entry.getValue())
            .lastUpdated(entry.getLastUpdated())
            .build();
    }
}
