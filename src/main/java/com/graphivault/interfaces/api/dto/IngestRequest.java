package com.graphivault.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for hashing, encrypting and cataloguing a plaintext file in one step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    @NotBlank(message = "File path is required")
    private String filePath;

    @NotBlank(message = "Password is required")
    @ToString.Exclude
    private String password;
}
