package com.vtb.discovery.prioritization;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.ComplianceFramework;
import com.vtb.discovery.models.ComplianceGap;
import com.vtb.discovery.models.ComplianceRule;
import com.vtb.discovery.models.ComplianceRuleSet;
import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.models.DocumentationGap;
import com.vtb.discovery.models.DocumentationIssue;
import com.vtb.discovery.models.Gap;
import com.vtb.discovery.models.GapPriorityScore;
import com.vtb.discovery.models.GapSeverity;
import com.vtb.discovery.models.GapType;
import com.vtb.discovery.models.OrphanedAssetGap;
import com.vtb.discovery.models.PriorityLevel;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GapPrioritizerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final GapPrioritizer prioritizer = new GapPrioritizer();

    @Test
    void criticalComplianceGapRanksAboveLowOrphan() {
        DiscoveredAsset postgres = asset("asset-pg", AssetType.POSTGRESQL, 0.95);
        DiscoveredAsset sqlite = asset("asset-lite", AssetType.SQLITE, 0.95);
        ComplianceRuleSet rules = ComplianceRuleSet.of(List.of(ComplianceRule.builder()
            .framework(ComplianceFramework.PCI_DSS)
            .ruleId("PCI-3.4")
            .predicateType("attribute_present")
            .parameter("attribute", "encryption")
            .build()));
        Gap compliance = ComplianceGap.forRule(rules, "PCI-3.4", "asset-pg", NOW, List.of("e"), GapSeverity.CRITICAL);
        Gap orphan = new OrphanedAssetGap("asset-lite", NOW, List.of("e"), GapSeverity.LOW);

        List<GapPriorityScore> ranked = prioritizer.prioritize(List.of(orphan, compliance), List.of(postgres, sqlite));

        assertEquals(compliance.getGapId(), ranked.get(0).getGapId());
        assertEquals((1.0 + 0.92 + 1.0) / 3.0, ranked.get(0).getCompositeScore(), 1e-9);
        assertEquals(PriorityLevel.CRITICAL, ranked.get(0).getPriorityLevel());
        assertEquals((0.3 + 0.4 + 0.8) / 3.0, ranked.get(1).getCompositeScore(), 1e-9);
        assertEquals(Set.of("severity", "regulatory", "exposure"), ranked.get(1).getContributingFactors().keySet());
    }

    @Test
    void scoresStayWithinUnitInterval() {
        DiscoveredAsset asset = asset("asset-a", AssetType.OTHER, 0.1);
        GapPriorityScore score = prioritizer.score(
            new OrphanedAssetGap("asset-a", NOW, List.of(), GapSeverity.CRITICAL), asset);
        assertTrue(score.getCompositeScore() >= 0.0 && score.getCompositeScore() <= 1.0);
        for (double factor : score.getContributingFactors().values()) {
            assertTrue(factor >= 0.0 && factor <= 1.0);
        }
    }

    @Test
    void missingAssetUsesSystemicExposure() {
        GapPriorityScore score = prioritizer.score(
            new OrphanedAssetGap("asset-gone", NOW, List.of(), GapSeverity.MEDIUM), null);
        assertEquals(0.5, score.getContributingFactors().get("exposure"), 1e-9);
    }

    @Test
    void orderIsTotalAndIndependentOfInput() {
        List<DiscoveredAsset> inventory = new ArrayList<>();
        List<Gap> gaps = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            DiscoveredAsset asset = asset("asset-" + i, i % 2 == 0 ? AssetType.POSTGRESQL : AssetType.SQLITE, 0.9);
            inventory.add(asset);
            gaps.add(new OrphanedAssetGap(asset.getAssetId(), NOW, List.of(), GapSeverity.HIGH));
        }

        List<String> first = ids(prioritizer.prioritize(gaps, inventory));
        List<Gap> shuffled = new ArrayList<>(gaps);
        Collections.shuffle(shuffled, new Random(7));
        List<String> second = ids(prioritizer.prioritize(shuffled, inventory));

        assertEquals(100, first.size());
        assertEquals(first, second);
        List<GapPriorityScore> ranked = prioritizer.prioritize(gaps, inventory);
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(GapPrioritizer.PRIORITY_ORDER.compare(ranked.get(i - 1), ranked.get(i)) < 0,
                "Порядок должен быть строгим");
        }
    }

    @Test
    void mixedGapTypesRankedInStrictStableOrder() {
        GapSeverity[] severities = {GapSeverity.LOW, GapSeverity.MEDIUM, GapSeverity.HIGH, GapSeverity.CRITICAL};
        ComplianceRuleSet rules = ComplianceRuleSet.of(List.of(ComplianceRule.builder()
            .framework(ComplianceFramework.PCI_DSS)
            .ruleId("PCI-3.4")
            .predicateType("attribute_present")
            .parameter("attribute", "encryption")
            .build()));
        List<DiscoveredAsset> inventory = new ArrayList<>();
        List<Gap> gaps = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            DiscoveredAsset asset = asset("asset-" + i, i % 3 == 0 ? AssetType.POSTGRESQL : AssetType.SQLITE, 0.5 + (i % 5) / 10.0);
            inventory.add(asset);
            GapSeverity severity = severities[i % 4];
            if (i < 33) {
                gaps.add(new OrphanedAssetGap(asset.getAssetId(), NOW, List.of(), severity));
            } else if (i < 66) {
                gaps.add(new DocumentationGap(asset.getAssetId(), NOW, List.of(), severity, 0.2, NOW,
                    EnumSet.of(DocumentationIssue.INCOMPLETE)));
            } else {
                gaps.add(ComplianceGap.forRule(rules, "PCI-3.4", asset.getAssetId(), NOW, List.of(), severity));
            }
        }

        List<GapPriorityScore> ranked = prioritizer.prioritize(gaps, inventory);

        assertEquals(100, ranked.size());
        assertEquals(100, new HashSet<>(ids(ranked)).size(), "Идентификаторы пробелов уникальны");
        Map<GapType, Long> byType = ranked.stream()
            .collect(Collectors.groupingBy(score -> score.getGap().getGapType(), Collectors.counting()));
        assertEquals(Long.valueOf(33), byType.get(GapType.ORPHANED_ASSET));
        assertEquals(Long.valueOf(33), byType.get(GapType.DOCUMENTATION));
        assertEquals(Long.valueOf(34), byType.get(GapType.COMPLIANCE));
        assertEquals(GapType.COMPLIANCE, ranked.get(0).getGap().getGapType(),
            "Критичное нарушение PCI DSS на PostgreSQL должно быть первым");
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(GapPrioritizer.PRIORITY_ORDER.compare(ranked.get(i - 1), ranked.get(i)) < 0,
                "Порядок должен быть строгим на позиции " + i);
            assertTrue(ranked.get(i - 1).getCompositeScore() >= ranked.get(i).getCompositeScore());
        }

        for (long seed = 1; seed <= 5; seed++) {
            List<Gap> shuffled = new ArrayList<>(gaps);
            Collections.shuffle(shuffled, new Random(seed));
            List<DiscoveredAsset> shuffledInventory = new ArrayList<>(inventory);
            Collections.shuffle(shuffledInventory, new Random(seed * 31));
            assertEquals(ids(ranked), ids(prioritizer.prioritize(shuffled, shuffledInventory)));
        }

        Map<String, GapPriorityScore> byId = ranked.stream()
            .collect(Collectors.toMap(GapPriorityScore::getGapId, Function.identity()));
        for (int i = 0; i < 33; i++) {
            GapPriorityScore orphan = byId.get(gaps.get(i).getGapId());
            GapPriorityScore compliance = byId.get(gaps.get(i + 66).getGapId());
            if (gaps.get(i).getSeverity() == gaps.get(i + 66).getSeverity()) {
                assertTrue(compliance.getContributingFactors().get(GapPrioritizer.FACTOR_REGULATORY)
                    > orphan.getContributingFactors().get(GapPrioritizer.FACTOR_REGULATORY));
            }
        }
    }

    @Test
    void customWeightsAreNormalized() {
        DiscoveryConfig.Weights weights = new DiscoveryConfig.Weights();
        weights.setSeverity(2.0);
        weights.setRegulatory(0.0);
        weights.setExposure(0.0);
        GapPrioritizer severityOnly = new GapPrioritizer(weights);

        GapPriorityScore score = severityOnly.score(
            new OrphanedAssetGap("asset-a", NOW, List.of(), GapSeverity.HIGH), asset("asset-a", AssetType.OTHER, 0.3));

        assertEquals(0.8, score.getCompositeScore(), 1e-9);
    }

    private static List<String> ids(List<GapPriorityScore> scores) {
        return scores.stream().map(GapPriorityScore::getGapId).collect(Collectors.toList());
    }

    private static DiscoveredAsset asset(String id, AssetType type, double confidence) {
        return DiscoveredAsset.builder()
            .assetId(id)
            .assetType(type)
            .locators(Set.of(id))
            .supportingMethods(Set.of(DiscoveryMethod.NETWORK))
            .confidenceScore(confidence)
            .attributes(Map.of())
            .observationCount(1)
            .build();
    }
}
