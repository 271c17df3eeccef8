package com.cdm.modelgraph.dto;

import com.cdm.modelgraph.model.DriverResolutionPolicy;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileRequest {

    @NotBlank
    private String entityId;

    @NotBlank
    private String entityKind;

    /** Driver string, null clears every driver edge of the entity */
    private String driver;

    private DriverResolutionPolicy policy;
}
