package com.vtb.discovery.analysis;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.ComplianceGap;
import com.vtb.discovery.models.ComplianceRule;
import com.vtb.discovery.models.ComplianceRuleSet;
import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.DocumentationGap;
import com.vtb.discovery.models.DocumentationIssue;
import com.vtb.discovery.models.ErrorKind;
import com.vtb.discovery.models.Gap;
import com.vtb.discovery.models.GapSeverity;
import com.vtb.discovery.models.OrphanedAssetGap;
import com.vtb.discovery.models.RuleScope;
import com.vtb.discovery.models.RunIssue;
import com.vtb.discovery.models.SkippedRule;
import com.vtb.discovery.modules.SecurityScanDiscoveryModule;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Анализ пробелов инвентаря: бесхозные активы, документация, соответствие.
 * Не хранит состояния между вызовами: результат зависит только от аргументов.
 */
@Slf4j
public class GapAnalysisEngine {

    private final List<String> ownerAttributes;
    private final double completenessThreshold;
    private final Duration stalenessWindow;
    private final String criticalityAttribute;

    public GapAnalysisEngine(DiscoveryConfig.GapAnalysis settings) {
        DiscoveryConfig.GapAnalysis effective = settings != null ? settings : DiscoveryConfig.defaults().getGapAnalysis();
        this.ownerAttributes = List.copyOf(effective.getOwnerAttributes());
        this.completenessThreshold = effective.getCompletenessThreshold();
        this.stalenessWindow = Duration.ofDays(effective.getStalenessDays());
        this.criticalityAttribute = effective.getCriticalityAttribute();
    }

    public GapAnalysisEngine() {
        this(null);
    }

    public GapAnalysisResult analyze(List<DiscoveredAsset> inventory,
                                     DocumentationIndex documentation,
                                     ComplianceRuleSet rules,
                                     Instant asOf) {
        List<DiscoveredAsset> assets = new ArrayList<>(inventory != null ? inventory : List.of());
        assets.sort(Comparator.comparing(DiscoveredAsset::getAssetId));
        DocumentationIndex docs = documentation != null ? documentation : DocumentationIndex.empty();
        ComplianceRuleSet ruleSet = rules != null ? rules : ComplianceRuleSet.empty();
        Instant now = asOf != null ? asOf : Instant.now();

        List<Gap> gaps = new ArrayList<>();
        List<RunIssue> issues = new ArrayList<>();
        List<SkippedRule> skipped = new ArrayList<>();

        for (DiscoveredAsset asset : assets) {
            Optional<DocumentationEntry> entry = docs.find(asset);
            analyzeOwnershipAndDocs(asset, entry.orElse(null), now, gaps);
        }

        for (ComplianceRule rule : ruleSet.getRules()) {
            if (!RulePredicates.isKnown(rule.getPredicateType())) {
                String reason = "Неизвестный тип предиката: " + rule.getPredicateType();
                log.warn("Правило {} пропущено: {}", rule.getRuleId(), reason);
                skipped.add(new SkippedRule(rule.getRuleId(), rule.getFramework(), reason));
                continue;
            }
            List<Gap> ruleGaps = new ArrayList<>();
            try {
                if (rule.getScope() == RuleScope.ENVIRONMENT) {
                    evaluateEnvironmentRule(rule, ruleSet, assets, docs, now, ruleGaps);
                } else {
                    for (DiscoveredAsset asset : assets) {
                        evaluateAssetRule(rule, ruleSet, asset, now, ruleGaps);
                    }
                }
                gaps.addAll(ruleGaps);
            } catch (RuntimeException e) {
                log.warn("Правило {} не вычислено: {}", rule.getRuleId(), e.getMessage());
                issues.add(RunIssue.of(ErrorKind.INVALID_RULE_DEFINITION, rule.getRuleId(),
                    "Ошибка вычисления правила: " + e.getMessage()));
            }
        }

        log.info("Анализ пробелов: {} активов, {} пробелов, пропущено правил: {}",
            assets.size(), gaps.size(), skipped.size());
        return new GapAnalysisResult(List.copyOf(gaps), List.copyOf(issues), List.copyOf(skipped));
    }

    public boolean hasOwner(DiscoveredAsset asset) {
        for (String attribute : ownerAttributes) {
            if (asset.hasAttribute(attribute)) {
                return true;
            }
        }
        return false;
    }

    private void analyzeOwnershipAndDocs(DiscoveredAsset asset,
                                         DocumentationEntry entry,
                                         Instant now,
                                         List<Gap> gaps) {
        GapSeverity severity = severityOf(asset);
        boolean owned = hasOwner(asset);

        if (entry == null) {
            if (!owned) {
                gaps.add(new OrphanedAssetGap(asset.getAssetId(), now, List.of(
                    "Нет записи в индексе документации",
                    "Нет атрибутов владельца " + ownerAttributes,
                    "Локаторы: " + asset.getLocators()), severity));
            } else {
                gaps.add(new DocumentationGap(asset.getAssetId(), now, List.of(
                    "Владелец: " + ownerOf(asset),
                    "Нет записи в индексе документации"), severity, null, null,
                    EnumSet.of(DocumentationIssue.MISSING)));
            }
            return;
        }

        Set<DocumentationIssue> problems = EnumSet.noneOf(DocumentationIssue.class);
        List<String> evidence = new ArrayList<>();
        if (entry.getCompletenessScore() != null && entry.getCompletenessScore() < completenessThreshold) {
            problems.add(DocumentationIssue.INCOMPLETE);
            evidence.add(String.format(Locale.ROOT, "Полнота %.2f ниже порога %.2f",
                entry.getCompletenessScore(), completenessThreshold));
        }
        if (entry.getLastUpdated() != null && entry.getLastUpdated().isBefore(now.minus(stalenessWindow))) {
            problems.add(DocumentationIssue.STALE);
            evidence.add("Последнее обновление " + entry.getLastUpdated()
                + ", старше " + stalenessWindow.toDays() + " дней");
        }
        if (!problems.isEmpty()) {
            if (entry.getLocation() != null) {
                evidence.add("Документ: " + entry.getLocation());
            }
            gaps.add(new DocumentationGap(asset.getAssetId(), now, evidence, severity,
                entry.getCompletenessScore(), entry.getLastUpdated(), problems));
        }
    }

    private void evaluateAssetRule(ComplianceRule rule,
                                   ComplianceRuleSet ruleSet,
                                   DiscoveredAsset asset,
                                   Instant now,
                                   List<Gap> gaps) {
        if (!rule.appliesTo(asset.getAssetType())) {
            return;
        }
        Optional<Boolean> passed = RulePredicates.evaluate(rule, asset.getAttributes(), asset.getConfidenceScore());
        if (passed.isPresent() && !passed.get()) {
            GapSeverity severity = rule.getSeverity() != null ? rule.getSeverity() : severityOf(asset);
            gaps.add(ComplianceGap.forRule(ruleSet, rule.getRuleId(), asset.getAssetId(), now, List.of(
                "Не выполнено: " + RulePredicates.describe(rule),
                "Тип актива: " + asset.getAssetType(),
                "Локаторы: " + asset.getLocators()), severity));
        }
    }

    private void evaluateEnvironmentRule(ComplianceRule rule,
                                         ComplianceRuleSet ruleSet,
                                         List<DiscoveredAsset> assets,
                                         DocumentationIndex docs,
                                         Instant now,
                                         List<Gap> gaps) {
        Map<String, String> facts = environmentFacts(assets, docs, rule);
        double minConfidence = Double.parseDouble(facts.get("min_confidence"));
        Optional<Boolean> passed = RulePredicates.evaluate(rule, facts, minConfidence);
        if (passed.isPresent() && !passed.get()) {
            GapSeverity severity = rule.getSeverity() != null ? rule.getSeverity() : GapSeverity.MEDIUM;
            gaps.add(ComplianceGap.forRule(ruleSet, rule.getRuleId(), null, now, List.of(
                "Не выполнено для окружения: " + RulePredicates.describe(rule),
                "Факты инвентаря: " + facts), severity));
        }
    }

    /**
     * Сводные факты инвентаря для правил уровня окружения.
     * Фильтр assetTypes правила сужает множество активов.
     */
    Map<String, String> environmentFacts(List<DiscoveredAsset> assets, DocumentationIndex docs, ComplianceRule rule) {
        int total = 0;
        int credentialExposed = 0;
        int sslDisabled = 0;
        int unowned = 0;
        int undocumented = 0;
        double minConfidence = 1.0;
        Map<String, String> facts = new TreeMap<>();
        Map<AssetType, Integer> byType = new TreeMap<>();
        for (DiscoveredAsset asset : assets) {
            if (!rule.appliesTo(asset.getAssetType())) {
                continue;
            }
            total++;
            byType.merge(asset.getAssetType(), 1, Integer::sum);
            if ("true".equalsIgnoreCase(asset.getAttribute(SecurityScanDiscoveryModule.CREDENTIAL_EXPOSED))) {
                credentialExposed++;
            }
            if ("true".equalsIgnoreCase(asset.getAttribute(SecurityScanDiscoveryModule.SSL_DISABLED))) {
                sslDisabled++;
            }
            if (!hasOwner(asset)) {
                unowned++;
            }
            if (docs.find(asset).isEmpty()) {
                undocumented++;
            }
            minConfidence = Math.min(minConfidence, asset.getConfidenceScore());
        }
        facts.put("asset_count", String.valueOf(total));
        facts.put("credential_exposed_count", String.valueOf(credentialExposed));
        facts.put("ssl_disabled_count", String.valueOf(sslDisabled));
        facts.put("unowned_count", String.valueOf(unowned));
        facts.put("undocumented_count", String.valueOf(undocumented));
        facts.put("min_confidence", String.valueOf(minConfidence));
        for (Map.Entry<AssetType, Integer> entry : byType.entrySet()) {
            facts.put("count_" + entry.getKey().name().toLowerCase(Locale.ROOT), String.valueOf(entry.getValue()));
        }
        return facts;
    }

    private GapSeverity severityOf(DiscoveredAsset asset) {
        return GapSeverity.fromCriticality(asset.getAttribute(criticalityAttribute));
    }

    private String ownerOf(DiscoveredAsset asset) {
        for (String attribute : ownerAttributes) {
            if (asset.hasAttribute(attribute)) {
                return asset.getAttribute(attribute);
            }
        }
        return null;
    }
}
