package com.vtb.discovery.models;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Нарушение конкретного правила регуляторного фреймворка.
 * Создается только для правил из переданного набора.
 */
@Getter
public class ComplianceGap extends Gap {

    private final ComplianceFramework framework;
    private final String violatedRule;

    private ComplianceGap(ComplianceRule rule,
                          String assetId,
                          Instant detectedAt,
                          List<String> evidence,
                          GapSeverity severity) {
        super(GapType.COMPLIANCE, rule.getFramework().name() + ":" + rule.getRuleId(),
            assetId, detectedAt, evidence, severity,
            rule.getDescription() != null ? rule.getDescription() : "Нарушено правило " + rule.getRuleId());
        this.framework = rule.getFramework();
        this.violatedRule = rule.getRuleId();
    }

    /**
     * @throws IllegalArgumentException если правило не входит в набор
     */
    public static ComplianceGap forRule(ComplianceRuleSet ruleSet,
                                        String ruleId,
                                        String assetId,
                                        Instant detectedAt,
                                        List<String> evidence,
                                        GapSeverity severity) {
        if (ruleSet == null) {
            throw new IllegalArgumentException("Набор правил не может быть null");
        }
        ComplianceRule rule = ruleSet.find(ruleId)
            .orElseThrow(() -> new IllegalArgumentException("Неизвестное правило: " + ruleId));
        return new ComplianceGap(rule, assetId, detectedAt, evidence, severity);
    }
}
