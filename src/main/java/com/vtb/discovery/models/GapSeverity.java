package com.vtb.discovery.models;

import java.util.Locale;

/**
 * Критичность пробела. Выводится из атрибута criticality актива.
 */
public enum GapSeverity {
    CRITICAL(1.0),
    HIGH(0.8),
    MEDIUM(0.6),
    LOW(0.3);

    private final double weight;

    GapSeverity(double weight) {
        this.weight = weight;
    }

    /**
     * Нормированный вес критичности (0..1)
     */
    public double getWeight() {
        return weight;
    }

    public static GapSeverity fromCriticality(String criticality) {
        if (criticality == null || criticality.isBlank()) {
            return MEDIUM;
        }
        return switch (criticality.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "tier0", "tier-0" -> CRITICAL;
            case "high", "tier1", "tier-1" -> HIGH;
            case "low", "tier3", "tier-3" -> LOW;
            default -> MEDIUM;
        };
    }
}
