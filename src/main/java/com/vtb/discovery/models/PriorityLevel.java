package com.vtb.discovery.models;

/**
 * Уровень приоритета устранения пробела
 */
public enum PriorityLevel {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static PriorityLevel fromScore(double composite) {
        if (composite >= 0.8) {
            return CRITICAL;
        }
        if (composite >= 0.6) {
            return HIGH;
        }
        if (composite >= 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
