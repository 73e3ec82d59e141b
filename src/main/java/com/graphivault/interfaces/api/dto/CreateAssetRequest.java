package com.graphivault.interfaces.api.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for cataloguing an already-encrypted file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAssetRequest {

    @NotBlank(message = "Content hash is required")
    @Size(max = 128, message = "Content hash must not exceed 128 characters")
    private String contentHash;

    @NotBlank(message = "Encrypted name is required")
    @Size(max = 255, message = "Encrypted name must not exceed 255 characters")
    private String encryptedName;

    @NotBlank(message = "Storage path is required")
    @Size(max = 1024, message = "Storage path must not exceed 1024 characters")
    private String storagePath;

    @NotNull(message = "Size is required")
    @PositiveOrZero(message = "Size must not be negative")
    private Long sizeBytes;
}
