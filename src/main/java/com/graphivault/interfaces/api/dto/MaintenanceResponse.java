package com.graphivault.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a maintenance operation. Only the fields the operation produces are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceResponse {

    private String operation;
    private String backupPath;
    private Long freePages;
    private Boolean removed;
}
