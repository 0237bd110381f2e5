package com.vtb.discovery.reports;

import com.vtb.discovery.analysis.GapAnalysisResult;
import com.vtb.discovery.core.DiscoveryRun;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.ConfidenceLevel;
import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.models.DiscoveryReport;
import com.vtb.discovery.models.DiscoveryStatistics;
import com.vtb.discovery.models.Gap;
import com.vtb.discovery.models.GapPriorityScore;
import com.vtb.discovery.models.GapSeverity;
import com.vtb.discovery.models.GapType;
import com.vtb.discovery.models.ModuleRunSummary;
import com.vtb.discovery.models.PriorityLevel;
import com.vtb.discovery.models.RunIssue;
import com.vtb.discovery.modules.SecurityScanDiscoveryModule;
import com.vtb.discovery.reconciliation.AssetValidator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Сборка неизменяемого отчета из результатов всех фаз и передача его генератору
 */
@Slf4j
public class ReportAssembler {

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    public DiscoveryReport assemble(DiscoveryRun run,
                                    GapAnalysisResult gapResult,
                                    List<GapPriorityScore> prioritized,
                                    List<RunIssue> extraIssues) {
        if (run == null) {
            throw new IllegalArgumentException("DiscoveryRun не может быть null");
        }
        List<Gap> gaps = gapResult != null ? gapResult.getGaps() : List.of();
        List<GapPriorityScore> priorities = prioritized != null ? prioritized : List.of();

        DiscoveryReport.DiscoveryReportBuilder builder = DiscoveryReport.builder()
            .reportId(UUID.randomUUID().toString())
            .startedAt(run.getStartedAt())
            .finishedAt(run.getFinishedAt())
            .truncated(run.isTruncated())
            .moduleRuns(run.getModuleRuns())
            .assets(run.getAssets())
            .gaps(gaps)
            .prioritizedGaps(priorities)
            .issues(run.getIssues());

        for (ModuleRunSummary summary : run.getModuleRuns()) {
            if (summary.getStatus().isExecuted()) {
                builder.moduleExecuted(summary.getModuleName());
            } else {
                builder.moduleSkipped(summary.getModuleName(),
                    summary.getReason() != null ? summary.getReason() : summary.getStatus().name());
            }
        }
        if (gapResult != null) {
            builder.issues(gapResult.getIssues());
            builder.skippedRules(gapResult.getSkippedRules());
        }
        if (extraIssues != null) {
            builder.issues(extraIssues);
        }
        builder.statistics(statistics(run, gaps, priorities));

        DiscoveryReport report = builder.build();
        log.info("Отчет {} собран: {} активов, {} пробелов, {} записей об ошибках",
            report.getReportId(), report.getAssets().size(), report.getGaps().size(), report.getIssues().size());
        return report;
    }

    /**
     * Записать отчет через генератор в каталог вывода
     *
     * @return путь к созданному файлу
     */
    public Path write(DiscoveryReport report, ReportGenerator generator, Path outputDirectory, String fileNamePrefix)
        throws IOException {
        String stamp = FILE_STAMP.format(report.getFinishedAt() != null ? report.getFinishedAt() : report.getStartedAt());
        Path target = outputDirectory.resolve(fileNamePrefix + "-" + stamp + "." + generator.getFileExtension());
        generator.generate(report, target);
        return target;
    }

    DiscoveryStatistics statistics(DiscoveryRun run, List<Gap> gaps, List<GapPriorityScore> priorities) {
        Map<AssetType, Integer> byType = new EnumMap<>(AssetType.class);
        Map<DiscoveryMethod, Integer> byMethod = new EnumMap<>(DiscoveryMethod.class);
        Map<ConfidenceLevel, Integer> byConfidence = new EnumMap<>(ConfidenceLevel.class);
        int credentialExposures = 0;
        int insecureConnections = 0;
        int validated = 0;
        int inaccessible = 0;
        for (DiscoveredAsset asset : run.getAssets()) {
            byType.merge(asset.getAssetType(), 1, Integer::sum);
            byConfidence.merge(asset.getConfidenceLevel(), 1, Integer::sum);
            for (DiscoveryMethod method : asset.getSupportingMethods()) {
                byMethod.merge(method, 1, Integer::sum);
            }
            if ("true".equalsIgnoreCase(asset.getAttribute(SecurityScanDiscoveryModule.CREDENTIAL_EXPOSED))) {
                credentialExposures++;
            }
            if ("true".equalsIgnoreCase(asset.getAttribute(SecurityScanDiscoveryModule.SSL_DISABLED))) {
                insecureConnections++;
            }
            if ("true".equals(asset.getAttribute(AssetValidator.VALIDATED))) {
                validated++;
                if ("false".equals(asset.getAttribute(AssetValidator.ACCESSIBLE))) {
                    inaccessible++;
                }
            }
        }
        Map<GapType, Integer> byGapType = new EnumMap<>(GapType.class);
        Map<GapSeverity, Integer> bySeverity = new EnumMap<>(GapSeverity.class);
        for (Gap gap : gaps) {
            byGapType.merge(gap.getGapType(), 1, Integer::sum);
            bySeverity.merge(gap.getSeverity(), 1, Integer::sum);
        }
        Map<PriorityLevel, Integer> byPriority = new EnumMap<>(PriorityLevel.class);
        for (GapPriorityScore score : priorities) {
            byPriority.merge(score.getPriorityLevel(), 1, Integer::sum);
        }
        long durationMs = run.getStartedAt() != null && run.getFinishedAt() != null
            ? Duration.between(run.getStartedAt(), run.getFinishedAt()).toMillis()
            : 0L;
        return DiscoveryStatistics.builder()
            .totalAssets(run.getAssets().size())
            .totalObservations(run.getObservationCount())
            .assetsByType(Collections.unmodifiableMap(byType))
            .assetsByMethod(Collections.unmodifiableMap(byMethod))
            .confidenceDistribution(Collections.unmodifiableMap(byConfidence))
            .gapsByType(Collections.unmodifiableMap(byGapType))
            .gapsBySeverity(Collections.unmodifiableMap(bySeverity))
            .gapsByPriority(Collections.unmodifiableMap(byPriority))
            .credentialExposures(credentialExposures)
            .insecureConnections(insecureConnections)
            .validatedAssets(validated)
            .inaccessibleAssets(inaccessible)
            .durationMs(durationMs)
            .build();
    }
}
