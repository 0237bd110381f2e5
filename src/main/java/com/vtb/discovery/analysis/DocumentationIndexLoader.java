package com.vtb.discovery.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.discovery.models.ErrorKind;
import com.vtb.discovery.models.RunIssue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка индекса документации из YAML/JSON.
 * Некорректная запись отклоняется с записью INVALID_DOCUMENTATION_ENTRY,
 * остальные записи загружаются.
 */
@Slf4j
public class DocumentationIndexLoader {

    static final String SOURCE = "documentation-index";

    public LoadResult<DocumentationIndex> load(Path path) throws IOException {
        log.info("Загрузка индекса документации: {}", path);
        return fromTree(ExternalDataReader.readTree(path));
    }

    public LoadResult<DocumentationIndex> fromTree(JsonNode root) {
        List<DocumentationEntry> entries = new ArrayList<>();
        List<RunIssue> issues = new ArrayList<>();
        JsonNode items = ExternalDataReader.items(root, "entries", "documentation", "assets");
        if (items == null) {
            if (root != null && !root.isMissingNode() && !root.isNull()) {
                issues.add(RunIssue.of(ErrorKind.INVALID_DOCUMENTATION_ENTRY, SOURCE,
                    "Ожидался список записей или поле entries"));
            }
            return new LoadResult<>(DocumentationIndex.empty(), issues);
        }
        int index = 0;
        for (JsonNode item : items) {
            index++;
            try {
                entries.add(parseEntry(item));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.warn("Запись документации #{} отклонена: {}", index, e.getMessage());
                issues.add(RunIssue.of(ErrorKind.INVALID_DOCUMENTATION_ENTRY, SOURCE + "#" + index, e.getMessage()));
            }
        }
        log.info("Индекс документации: {} записей, отклонено {}", entries.size(), issues.size());
        return new LoadResult<>(DocumentationIndex.of(entries), issues);
    }

    DocumentationEntry parseEntry(JsonNode item) {
        if (item == null || !item.isObject()) {
            throw new IllegalArgumentException("Запись должна быть объектом");
        }
        String assetRef = ExternalDataReader.text(item, "assetRef", "asset_ref", "assetId", "asset_id", "locator");
        if (assetRef == null) {
            throw new IllegalArgumentException("Не указана ссылка на актив (assetRef/assetId/locator)");
        }
        Double completeness = null;
        JsonNode completenessNode = firstPresent(item, "completenessScore", "completeness_score", "completeness");
        if (completenessNode != null) {
            if (!completenessNode.isNumber()) {
                throw new IllegalArgumentException("completeness должен быть числом: " + completenessNode);
            }
            completeness = completenessNode.asDouble();
            if (completeness < 0.0 || completeness > 1.0) {
                throw new IllegalArgumentException("completeness вне диапазона [0,1]: " + completeness);
            }
        }
        Instant lastUpdated = null;
        String updated = ExternalDataReader.text(item, "lastUpdated", "last_updated", "updatedAt");
        if (updated != null) {
            lastUpdated = ExternalDataReader.parseInstant(updated);
        }
        return DocumentationEntry.builder()
            .assetRef(assetRef)
            .title(ExternalDataReader.text(item, "title", "name"))
            .location(ExternalDataReader.text(item, "location", "url", "path"))
            .owner(ExternalDataReader.text(item, "owner", "team"))
            .completenessScore(completeness)
            .lastUpdated(lastUpdated)
            .build();
    }

    private static JsonNode firstPresent(JsonNode item, String... names) {
        for (String name : names) {
            JsonNode node = item.path(name);
            if (!node.isMissingNode() && !node.isNull()) {
                return node;
            }
        }
        return null;
    }
}
