package com.vtb.discovery.core;

import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.ModuleRunSummary;
import com.vtb.discovery.models.RunIssue;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Результат фазы обнаружения и сверки
 */
@Value
@Builder
public class DiscoveryRun {
    Instant startedAt;
    Instant finishedAt;
    @Singular
    List<DiscoveredAsset> assets;
    @Singular
    List<ModuleRunSummary> moduleRuns;
    @Singular
    List<RunIssue> issues;
    int observationCount;
    boolean truncated;
    boolean budgetExceeded;
}
