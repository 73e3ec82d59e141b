package com.graphivault.interfaces.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateAnnotationRequest {

    @NotNull(message = "Note is required")
    @Size(max = 10000, message = "Note must not exceed 10000 characters")
    private String note;
}
