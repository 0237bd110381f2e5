package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Одно непроверенное наблюдение возможного актива.
 * Создается ровно одним модулем, неизменяемо, потребляется сверкой один раз.
 */
@Value
public class CandidateObservation {

    DiscoveryMethod method;
    String locator;
    Map<String, String> attributes;
    double methodConfidence;

    /** Тип движка, который вывел модуль (может быть null) */
    AssetType assetType;

    /** Локаторы, которые модуль явно связывает с этим же активом */
    Set<String> links;

    @Builder(toBuilder = true)
    private CandidateObservation(DiscoveryMethod method,
                                 String locator,
                                 @Singular Map<String, String> attributes,
                                 double methodConfidence,
                                 AssetType assetType,
                                 @Singular Set<String> links) {
        if (method == null) {
            throw new IllegalArgumentException("method не может быть null");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator не может быть пустым");
        }
        if (Double.isNaN(methodConfidence) || methodConfidence < 0.0 || methodConfidence > 1.0) {
            throw new IllegalArgumentException("methodConfidence вне диапазона [0,1]: " + methodConfidence);
        }
        this.method = method;
        this.locator = locator.trim();
        this.attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(attributes));
        this.methodConfidence = methodConfidence;
        this.assetType = assetType;
        this.links = links == null
            ? Set.of()
            : Collections.unmodifiableSet(new TreeSet<>(links));
    }
}
