package com.graphivault.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecryptFileRequest {

    /** Absolute, or relative to the vault root. */
    @NotBlank(message = "Encrypted path is required")
    private String encryptedPath;

    @NotBlank(message = "Password is required")
    @ToString.Exclude
    private String password;

    /** Optional; a fresh file under the vault's temp directory when omitted. */
    private String outputPath;
}
