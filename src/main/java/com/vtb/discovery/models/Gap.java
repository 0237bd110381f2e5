package com.vtb.discovery.models;

import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Общая оболочка обнаруженного пробела.
 * assetId == null означает системный пробел (относится к окружению целиком).
 */
@Getter
public abstract class Gap {

    private final GapType gapType;
    private final String gapId;
    private final String assetId;
    private final Instant detectedAt;
    private final List<String> evidence;
    private final GapSeverity severity;
    private final String description;

    protected Gap(GapType gapType,
                  String discriminator,
                  String assetId,
                  Instant detectedAt,
                  List<String> evidence,
                  GapSeverity severity,
                  String description) {
        this.gapType = Objects.requireNonNull(gapType, "gapType");
        this.gapId = buildId(gapType, assetId, discriminator);
        this.assetId = assetId;
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt");
        this.evidence = evidence != null ? List.copyOf(evidence) : List.of();
        this.severity = severity != null ? severity : GapSeverity.MEDIUM;
        this.description = description;
    }

    public boolean isSystemic() {
        return assetId == null;
    }

    /**
     * Детерминированный идентификатор: одинаковые входы дают одинаковый gapId
     * от прогона к прогону.
     */
    static String buildId(GapType type, String assetId, String discriminator) {
        String raw = type.name() + "|" + (assetId != null ? assetId : "*") + "|"
            + (discriminator != null ? discriminator : "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(raw.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder("gap-");
            for (int i = 0; i < 8; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 недоступен", e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + gapId + ", asset=" + assetId + ", severity=" + severity + "}";
    }
}
