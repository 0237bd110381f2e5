package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Неизменяемый снимок результата прогона.
 * Не модифицируется после создания; новый прогон дает новый отчет.
 */
@Value
@Builder
public class DiscoveryReport {
    String reportId;
    Instant startedAt;
    Instant finishedAt;
    boolean truncated;
    @Singular("moduleExecuted")
    List<String> modulesExecuted;
    /** Имя модуля -> причина пропуска */
    @Singular("moduleSkipped")
    Map<String, String> modulesSkipped;
    @Singular
    List<ModuleRunSummary> moduleRuns;
    @Singular
    List<DiscoveredAsset> assets;
    @Singular
    List<Gap> gaps;
    @Singular
    List<GapPriorityScore> prioritizedGaps;
    @Singular
    List<RunIssue> issues;
    /** Правила, которые не удалось вычислить (неизвестный тип предиката) */
    @Singular
    List<SkippedRule> skippedRules;
    DiscoveryStatistics statistics;
}
