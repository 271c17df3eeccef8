package com.cdm.modelgraph.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkRelationshipUpdateRequest {

    @NotEmpty
    @Builder.Default
    private List<String> targetIds = new ArrayList<>();

    private String type;
    private String frequency;
}
