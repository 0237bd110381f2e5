package com.vtb.discovery.prioritization;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.ComplianceGap;
import com.vtb.discovery.models.ConfidenceLevel;
import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.Gap;
import com.vtb.discovery.models.GapPriorityScore;
import com.vtb.discovery.models.PriorityLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ранжирование пробелов по составной оценке:
 * w1 * severity + w2 * regulatory + w3 * exposure, все факторы в [0,1].
 * Порядок полный: оценка по убыванию, при равенстве gapId по возрастанию.
 */
@Slf4j
public class GapPrioritizer {

    public static final String FACTOR_SEVERITY = "severity";
    public static final String FACTOR_REGULATORY = "regulatory";
    public static final String FACTOR_EXPOSURE = "exposure";

    /** Регуляторный вес для пробелов вне фреймворков */
    static final double NON_COMPLIANCE_REGULATORY_WEIGHT = 0.4;
    /** Экспозиция системного пробела (без актива) */
    static final double SYSTEMIC_EXPOSURE = 0.5;

    public static final Comparator<GapPriorityScore> PRIORITY_ORDER =
        Comparator.comparingDouble(GapPriorityScore::getCompositeScore).reversed()
            .thenComparing(GapPriorityScore::getGapId);

    private final double severityWeight;
    private final double regulatoryWeight;
    private final double exposureWeight;

    public GapPrioritizer(DiscoveryConfig.Weights weights) {
        DiscoveryConfig.Weights effective = weights != null ? weights : DiscoveryConfig.defaults().getPrioritization().getWeights();
        double sum = effective.sum();
        if (sum <= 0.0) {
            throw new IllegalArgumentException("Сумма весов приоритизации должна быть > 0");
        }
        this.severityWeight = effective.getSeverity() / sum;
        this.regulatoryWeight = effective.getRegulatory() / sum;
        this.exposureWeight = effective.getExposure() / sum;
    }

    public GapPrioritizer() {
        this(null);
    }

    public List<GapPriorityScore> prioritize(Collection<Gap> gaps, Collection<DiscoveredAsset> inventory) {
        Map<String, DiscoveredAsset> assetsById = new HashMap<>();
        if (inventory != null) {
            for (DiscoveredAsset asset : inventory) {
                assetsById.put(asset.getAssetId(), asset);
            }
        }
        List<GapPriorityScore> scores = new ArrayList<>();
        if (gaps != null) {
            for (Gap gap : gaps) {
                scores.add(score(gap, gap.getAssetId() != null ? assetsById.get(gap.getAssetId()) : null));
            }
        }
        scores.sort(PRIORITY_ORDER);
        log.debug("Приоритизировано пробелов: {}", scores.size());
        return scores;
    }

    public GapPriorityScore score(Gap gap, DiscoveredAsset asset) {
        double severity = gap.getSeverity().getWeight();
        double regulatory = gap instanceof ComplianceGap
            ? ((ComplianceGap) gap).getFramework().getRegulatoryWeight()
            : NON_COMPLIANCE_REGULATORY_WEIGHT;
        double exposure = asset != null
            ? confidenceFactor(asset.getConfidenceLevel()) * typeFactor(asset.getAssetType())
            : SYSTEMIC_EXPOSURE;

        double composite = severityWeight * severity + regulatoryWeight * regulatory + exposureWeight * exposure;
        composite = Math.max(0.0, Math.min(1.0, composite));

        return GapPriorityScore.builder()
            .gap(gap)
            .compositeScore(composite)
            .contributingFactor(FACTOR_SEVERITY, severity)
            .contributingFactor(FACTOR_REGULATORY, regulatory)
            .contributingFactor(FACTOR_EXPOSURE, exposure)
            .priorityLevel(PriorityLevel.fromScore(composite))
            .build();
    }

    static double confidenceFactor(ConfidenceLevel level) {
        if (level == null) {
            return 0.25;
        }
        return switch (level) {
            case HIGH -> 1.0;
            case MEDIUM -> 0.75;
            case LOW -> 0.5;
            case VERY_LOW -> 0.25;
        };
    }

    static double typeFactor(AssetType type) {
        if (type == null) {
            return 0.5;
        }
        return switch (type) {
            case POSTGRESQL -> 1.0;
            case SQLITE, DUCKDB -> 0.8;
            case FILE_STORAGE -> 0.6;
            case OTHER -> 0.5;
        };
    }
}
