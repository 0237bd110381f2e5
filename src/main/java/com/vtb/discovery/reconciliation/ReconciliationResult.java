package com.vtb.discovery.reconciliation;

import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.RunIssue;
import lombok.Value;

import java.util.List;

@Value
public class ReconciliationResult {
    /** Упорядочены по assetId */
    List<DiscoveredAsset> assets;
    List<RunIssue> issues;
    int observationCount;
}
