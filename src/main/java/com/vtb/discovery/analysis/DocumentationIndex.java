package com.vtb.discovery.analysis;

import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.reconciliation.IdentityKeys;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Индекс документации: поиск записи по assetId, локатору или ключу идентичности.
 * Записи, указывающие на один актив разными ссылками, считаются одной документацией.
 */
@Slf4j
public final class DocumentationIndex {

    private final List<DocumentationEntry> entries;
    private final Map<String, DocumentationEntry> byRef;

    private DocumentationIndex(List<DocumentationEntry> entries) {
        this.entries = Collections.unmodifiableList(entries);
        Map<String, DocumentationEntry> index = new LinkedHashMap<>();
        for (DocumentationEntry entry : entries) {
            String ref = entry.getAssetRef().trim();
            index.putIfAbsent(ref, entry);
            index.putIfAbsent(IdentityKeys.sanitize(ref), entry);
            String key = identityKeyOf(ref);
            if (key != null) {
                index.putIfAbsent(key, entry);
            }
        }
        this.byRef = index;
    }

    public static DocumentationIndex of(List<DocumentationEntry> entries) {
        List<DocumentationEntry> valid = new ArrayList<>();
        if (entries != null) {
            for (DocumentationEntry entry : entries) {
                if (entry != null && entry.getAssetRef() != null && !entry.getAssetRef().isBlank()) {
                    valid.add(entry);
                }
            }
        }
        return new DocumentationIndex(valid);
    }

    public static DocumentationIndex empty() {
        return new DocumentationIndex(List.of());
    }

    /**
     * Найти документацию актива
     */
    public Optional<DocumentationEntry> find(DiscoveredAsset asset) {
        DocumentationEntry entry = byRef.get(asset.getAssetId());
        if (entry != null) {
            return Optional.of(entry);
        }
        for (String locator : asset.getLocators()) {
            entry = byRef.get(locator);
            if (entry != null) {
                return Optional.of(entry);
            }
        }
        for (String key : asset.getIdentityKeys()) {
            entry = byRef.get(key);
            if (entry != null) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public List<DocumentationEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    private static String identityKeyOf(String ref) {
        if (ref.startsWith("asset-")) {
            return null;
        }
        try {
            return IdentityKeys.of(ref).asString();
        } catch (IllegalArgumentException e) {
            log.debug("Ссылка документации {} не является локатором: {}", ref, e.getMessage());
            return null;
        }
    }
}
