package com.vtb.discovery.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Упорядоченный набор правил с уникальными идентификаторами
 */
public final class ComplianceRuleSet {

    private final Map<String, ComplianceRule> rules;

    private ComplianceRuleSet(Map<String, ComplianceRule> rules) {
        this.rules = rules;
    }

    /**
     * @throws IllegalArgumentException при повторяющемся ruleId
     */
    public static ComplianceRuleSet of(List<ComplianceRule> rules) {
        Map<String, ComplianceRule> byId = new LinkedHashMap<>();
        if (rules != null) {
            for (ComplianceRule rule : rules) {
                if (rule == null || rule.getRuleId() == null) {
                    throw new IllegalArgumentException("Правило без идентификатора");
                }
                if (byId.putIfAbsent(rule.getRuleId(), rule) != null) {
                    throw new IllegalArgumentException("Повторяющийся ruleId: " + rule.getRuleId());
                }
            }
        }
        return new ComplianceRuleSet(Collections.unmodifiableMap(byId));
    }

    public static ComplianceRuleSet empty() {
        return new ComplianceRuleSet(Map.of());
    }

    public List<ComplianceRule> getRules() {
        return List.copyOf(rules.values());
    }

    public boolean contains(String ruleId) {
        return ruleId != null && rules.containsKey(ruleId);
    }

    public Optional<ComplianceRule> find(String ruleId) {
        return ruleId == null ? Optional.empty() : Optional.ofNullable(rules.get(ruleId));
    }

    public int size() {
        return rules.size();
    }
}
