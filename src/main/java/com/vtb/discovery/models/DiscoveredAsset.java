package com.vtb.discovery.models;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Сверенное представление одного реального актива.
 * Не изменяется после завершения прогона; следующий прогон создает новый экземпляр
 * с тем же assetId.
 */
@Value
public class DiscoveredAsset {

    String assetId;
    AssetType assetType;
    SortedSet<String> locators;
    SortedSet<String> identityKeys;
    Set<DiscoveryMethod> supportingMethods;
    double confidenceScore;
    ConfidenceLevel confidenceLevel;
    SortedMap<String, String> attributes;
    int observationCount;

    @Builder(toBuilder = true)
    private DiscoveredAsset(String assetId,
                            AssetType assetType,
                            Set<String> locators,
                            Set<String> identityKeys,
                            Set<DiscoveryMethod> supportingMethods,
                            double confidenceScore,
                            Map<String, String> attributes,
                            int observationCount) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("assetId не может быть пустым");
        }
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore вне диапазона [0,1]: " + confidenceScore);
        }
        this.assetId = assetId;
        this.assetType = assetType != null ? assetType : AssetType.OTHER;
        this.locators = Collections.unmodifiableSortedSet(
            locators != null ? new TreeSet<>(locators) : new TreeSet<>());
        this.identityKeys = Collections.unmodifiableSortedSet(
            identityKeys != null ? new TreeSet<>(identityKeys) : new TreeSet<>());
        this.supportingMethods = Collections.unmodifiableSet(
            supportingMethods == null || supportingMethods.isEmpty()
                ? EnumSet.noneOf(DiscoveryMethod.class)
                : EnumSet.copyOf(supportingMethods));
        this.confidenceScore = confidenceScore;
        this.confidenceLevel = ConfidenceLevel.fromScore(confidenceScore);
        this.attributes = Collections.unmodifiableSortedMap(
            attributes != null ? new TreeMap<>(attributes) : new TreeMap<>());
        this.observationCount = observationCount;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        String value = attributes.get(key);
        return value != null && !value.isBlank();
    }
}
