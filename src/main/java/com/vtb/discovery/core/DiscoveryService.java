package com.vtb.discovery.core;

import com.vtb.discovery.analysis.ComplianceRuleSetLoader;
import com.vtb.discovery.analysis.DocumentationIndex;
import com.vtb.discovery.analysis.DocumentationIndexLoader;
import com.vtb.discovery.analysis.GapAnalysisEngine;
import com.vtb.discovery.analysis.GapAnalysisResult;
import com.vtb.discovery.analysis.LoadResult;
import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.ComplianceRuleSet;
import com.vtb.discovery.models.DiscoveryReport;
import com.vtb.discovery.models.GapPriorityScore;
import com.vtb.discovery.models.RunIssue;
import com.vtb.discovery.modules.CodeAnalysisDiscoveryModule;
import com.vtb.discovery.modules.ContainerDiscoveryModule;
import com.vtb.discovery.modules.DiscoveryModule;
import com.vtb.discovery.modules.FilesystemDiscoveryModule;
import com.vtb.discovery.modules.NetworkDiscoveryModule;
import com.vtb.discovery.modules.SecurityScanDiscoveryModule;
import com.vtb.discovery.prioritization.GapPrioritizer;
import com.vtb.discovery.reconciliation.ReconciliationEngine;
import com.vtb.discovery.reports.ReportAssembler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Полный конвейер: обнаружение, сверка, анализ пробелов, приоритизация, отчет
 */
@Slf4j
public class DiscoveryService {

    private final DiscoveryConfig config;
    private final List<DiscoveryModule> modules;
    private final DocumentationIndexLoader documentationLoader = new DocumentationIndexLoader();
    private final ComplianceRuleSetLoader rulesLoader = new ComplianceRuleSetLoader();
    private final ReportAssembler assembler = new ReportAssembler();

    public DiscoveryService(DiscoveryConfig config) {
        this(config, defaultModules());
    }

    public DiscoveryService(DiscoveryConfig config, List<DiscoveryModule> modules) {
        this.config = config != null ? config : DiscoveryConfig.loadDefaults();
        this.config.ensureDefaults();
        this.modules = List.copyOf(modules);
    }

    /**
     * Стандартный набор модулей обнаружения
     */
    public static List<DiscoveryModule> defaultModules() {
        return List.of(
            new ContainerDiscoveryModule(),
            new NetworkDiscoveryModule(),
            new FilesystemDiscoveryModule(),
            new CodeAnalysisDiscoveryModule(),
            new SecurityScanDiscoveryModule()
        );
    }

    /**
     * Выполнить весь конвейер.
     *
     * @param documentationPath индекс документации (может быть null)
     * @param rulesPath         набор правил соответствия (может быть null)
     * @throws IOException если файл документации или правил не читается
     */
    public DiscoveryReport run(Path documentationPath, Path rulesPath) throws IOException {
        List<RunIssue> loadIssues = new ArrayList<>();

        DocumentationIndex documentation = DocumentationIndex.empty();
        if (documentationPath != null) {
            log.info("Загрузка индекса документации: {}", documentationPath);
            LoadResult<DocumentationIndex> loaded = documentationLoader.load(documentationPath);
            documentation = loaded.getValue();
            loadIssues.addAll(loaded.getIssues());
        }

        ComplianceRuleSet rules = ComplianceRuleSet.empty();
        if (rulesPath != null) {
            log.info("Загрузка правил соответствия: {}", rulesPath);
            LoadResult<ComplianceRuleSet> loaded = rulesLoader.load(rulesPath);
            rules = loaded.getValue();
            loadIssues.addAll(loaded.getIssues());
        }

        return run(documentation, rules, loadIssues);
    }

    public DiscoveryReport run(DocumentationIndex documentation, ComplianceRuleSet rules, List<RunIssue> loadIssues) {
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config, modules, new ReconciliationEngine());
        DiscoveryRun discoveryRun = orchestrator.run();

        GapAnalysisEngine gapEngine = new GapAnalysisEngine(config.getGapAnalysis());
        GapAnalysisResult gapResult = gapEngine.analyze(discoveryRun.getAssets(), documentation, rules, Instant.now());
        log.info("Анализ пробелов: {} пробелов, {} правил пропущено",
            gapResult.getGaps().size(), gapResult.getSkippedRules().size());

        GapPrioritizer prioritizer = new GapPrioritizer(config.getPrioritization().getWeights());
        List<GapPriorityScore> prioritized = prioritizer.prioritize(gapResult.getGaps(), discoveryRun.getAssets());

        return assembler.assemble(discoveryRun, gapResult, prioritized, loadIssues);
    }

    public DiscoveryConfig getConfig() {
        return config;
    }
}
