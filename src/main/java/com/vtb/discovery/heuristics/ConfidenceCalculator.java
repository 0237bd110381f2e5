package com.vtb.discovery.heuristics;

import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.ConfidenceLevel;

import java.util.Collection;

/**
 * Комбинированная уверенность по независимым подтверждениям (noisy-OR):
 * score = 1 - П(1 - c_i).
 * Добавление подтверждения никогда не уменьшает оценку, результат всегда в [0,1].
 */
public final class ConfidenceCalculator {

    private ConfidenceCalculator() {
    }

    public static double combine(Collection<CandidateObservation> observations) {
        if (observations == null || observations.isEmpty()) {
            return 0.0;
        }
        double[] confidences = new double[observations.size()];
        int i = 0;
        for (CandidateObservation observation : observations) {
            confidences[i++] = observation.getMethodConfidence();
        }
        return combine(confidences);
    }

    public static double combine(double... confidences) {
        if (confidences == null || confidences.length == 0) {
            return 0.0;
        }
        double missProbability = 1.0;
        for (double confidence : confidences) {
            missProbability *= 1.0 - clamp(confidence);
        }
        return clamp(1.0 - missProbability);
    }

    public static ConfidenceLevel level(double score) {
        return ConfidenceLevel.fromScore(score);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
