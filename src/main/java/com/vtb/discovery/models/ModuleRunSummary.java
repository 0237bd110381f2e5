package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class ModuleRunSummary {
    String moduleName;
    DiscoveryMethod method;
    ModuleStatus status;
    int observationCount;
    Duration duration;
    boolean truncated;
    String reason;

    public static ModuleRunSummary skipped(String moduleName, DiscoveryMethod method, String reason) {
        return ModuleRunSummary.builder()
            .moduleName(moduleName)
            .method(method)
            .status(ModuleStatus.SKIPPED)
            .observationCount(0)
            .duration(Duration.ZERO)
            .truncated(false)
            .reason(reason)
            .build();
    }
}
