package com.cdm.modelgraph.config;

import com.cdm.modelgraph.model.DriverResolutionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "cdm.reconcile")
public class ReconciliationProperties {
    private String defaultFrequency = "Possible";
    private DriverResolutionPolicy defaultPolicy = DriverResolutionPolicy.UPSERT;
    private int maxTierDepth = 10;
    private int sweepChunkSize = 50;
    private long lockTimeoutMs = 5000;
    private boolean pruneNonDefaultRoles = false;
}
