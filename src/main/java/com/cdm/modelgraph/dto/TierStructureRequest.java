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
public class TierStructureRequest {

    @NotEmpty
    @Builder.Default
    private List<String> tierNames = new ArrayList<>();
}
