package com.vtb.discovery.models;

import java.util.Locale;

/**
 * Поддерживаемые регуляторные фреймворки и их регуляторный вес (0..1)
 */
public enum ComplianceFramework {
    GDPR(1.0),
    SOC2(0.8),
    NIST(0.8),
    HIPAA(1.0),
    PCI_DSS(0.92);

    private final double regulatoryWeight;

    ComplianceFramework(double regulatoryWeight) {
        this.regulatoryWeight = regulatoryWeight;
    }

    public double getRegulatoryWeight() {
        return regulatoryWeight;
    }

    /**
     * @return фреймворк или null, если имя не распознано
     */
    public static ComplianceFramework parse(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (normalized.equals("PCI") || normalized.equals("PCIDSS")) {
            return PCI_DSS;
        }
        for (ComplianceFramework framework : values()) {
            if (framework.name().equals(normalized)) {
                return framework;
            }
        }
        return null;
    }
}
