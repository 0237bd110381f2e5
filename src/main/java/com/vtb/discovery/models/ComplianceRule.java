package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Правило регуляторного набора. Семантику предиката задает внешний поставщик,
 * движок проверяет только структурный контракт.
 */
@Value
@Builder
public class ComplianceRule {
    ComplianceFramework framework;
    String ruleId;
    String description;
    String predicateType;
    @Singular
    Map<String, String> parameters;
    /** Допустимые значения для attribute_in */
    @Singular
    List<String> values;
    /** Явная серьезность нарушения; null - по критичности актива */
    GapSeverity severity;
    @Builder.Default
    RuleScope scope = RuleScope.ASSET;
    /** Пустое множество - правило применимо ко всем типам */
    @Singular
    Set<AssetType> assetTypes;

    public boolean appliesTo(AssetType type) {
        return assetTypes == null || assetTypes.isEmpty() || assetTypes.contains(type);
    }

    public String getParameter(String name) {
        return parameters != null ? parameters.get(name) : null;
    }
}
