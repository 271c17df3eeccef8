package com.cdm.modelgraph.dto;

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
public class RelationshipUpdateResult {

    private String sourceId;
    private int updated;
    private int deleted;

    /** Default-role edges that matched the request and were left as they are */
    private int protectedDefaults;

    @Builder.Default
    private List<String> targetIds = new ArrayList<>();
}
