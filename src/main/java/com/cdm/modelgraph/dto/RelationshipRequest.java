package com.cdm.modelgraph.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipRequest {

    @NotBlank
    private String targetId;

    @NotBlank
    private String role;

    private String type;
    private String frequency;
}
