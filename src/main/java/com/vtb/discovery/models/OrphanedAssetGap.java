package com.vtb.discovery.models;

import java.time.Instant;
import java.util.List;

/**
 * Актив без владельца и без ссылки в документации
 */
public class OrphanedAssetGap extends Gap {

    public OrphanedAssetGap(String assetId, Instant detectedAt, List<String> evidence, GapSeverity severity) {
        super(GapType.ORPHANED_ASSET, "orphaned", requireAsset(assetId), detectedAt, evidence, severity,
            "Актив не имеет владельца и не упомянут в документации");
    }

    private static String requireAsset(String assetId) {
        if (assetId == null) {
            throw new IllegalArgumentException("OrphanedAssetGap всегда относится к конкретному активу");
        }
        return assetId;
    }
}
