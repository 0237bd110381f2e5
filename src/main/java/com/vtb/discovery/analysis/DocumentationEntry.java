package com.vtb.discovery.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Запись внешнего индекса документации.
 * assetRef - assetId актива или любой из его локаторов.
 */
@Value
@Builder
public class DocumentationEntry {
    String assetRef;
    String title;
    String location;
    String owner;
    /** Полнота документации в [0,1]; null - не оценивалась */
    Double completenessScore;
    Instant lastUpdated;
}
