package com.graphivault.interfaces.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Id of a newly created row.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreatedResponse {

    private Long id;
}
