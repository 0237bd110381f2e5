package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Производное представление: оценка приоритета пробела.
 * Пересчитывается при каждом проходе, нигде не хранится.
 */
@Value
@Builder
public class GapPriorityScore {
    Gap gap;
    double compositeScore;
    /** Нормализованные факторы, из которых сложилась оценка */
    @Singular
    Map<String, Double> contributingFactors;
    PriorityLevel priorityLevel;

    public String getGapId() {
        return gap.getGapId();
    }
}
