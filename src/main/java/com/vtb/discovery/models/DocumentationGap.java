package com.vtb.discovery.models;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Документация отсутствует, неполна или устарела
 */
@Getter
public class DocumentationGap extends Gap {

    private final Double completenessScore;
    private final Instant lastUpdated;
    private final Set<DocumentationIssue> issues;

    public DocumentationGap(String assetId,
                            Instant detectedAt,
                            List<String> evidence,
                            GapSeverity severity,
                            Double completenessScore,
                            Instant lastUpdated,
                            Set<DocumentationIssue> issues) {
        super(GapType.DOCUMENTATION, "documentation", assetId, detectedAt, evidence, severity, describe(issues));
        this.completenessScore = completenessScore;
        this.lastUpdated = lastUpdated;
        this.issues = Collections.unmodifiableSet(
            issues == null || issues.isEmpty() ? EnumSet.noneOf(DocumentationIssue.class) : EnumSet.copyOf(issues));
    }

    private static String describe(Set<DocumentationIssue> issues) {
        if (issues == null || issues.isEmpty()) {
            return "Проблема с документацией";
        }
        if (issues.contains(DocumentationIssue.MISSING)) {
            return "Документация отсутствует";
        }
        if (issues.contains(DocumentationIssue.INCOMPLETE) && issues.contains(DocumentationIssue.STALE)) {
            return "Документация неполная и устаревшая";
        }
        return issues.contains(DocumentationIssue.STALE) ? "Документация устарела" : "Документация неполная";
    }
}
