package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Сводная статистика прогона для отчета
 */
@Value
@Builder
public class DiscoveryStatistics {
    int totalAssets;
    int totalObservations;
    Map<AssetType, Integer> assetsByType;
    Map<DiscoveryMethod, Integer> assetsByMethod;
    Map<ConfidenceLevel, Integer> confidenceDistribution;
    Map<GapType, Integer> gapsByType;
    Map<GapSeverity, Integer> gapsBySeverity;
    Map<PriorityLevel, Integer> gapsByPriority;
    int credentialExposures;
    int insecureConnections;
    /** Активы, доступность которых удалось проверить */
    int validatedAssets;
    /** Проверенные активы, оказавшиеся недоступными (висячие ссылки на файлы) */
    int inaccessibleAssets;
    long durationMs;
}
