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
public class EncryptFileRequest {

    @NotBlank(message = "File path is required")
    private String filePath;

    @NotBlank(message = "Password is required")
    @ToString.Exclude
    private String password;
}
