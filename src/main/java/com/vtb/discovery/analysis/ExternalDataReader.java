package com.vtb.discovery.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Чтение внешних YAML/JSON файлов в дерево Jackson и общие конвертеры полей
 */
final class ExternalDataReader {

    private static final List<Function<String, Instant>> INSTANT_PARSERS = List.of(
        Instant::parse,
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private ExternalDataReader() {
    }

    static JsonNode readTree(Path path) throws IOException {
        String name = path.getFileName() != null ? path.getFileName().toString().toLowerCase(Locale.ROOT) : "";
        ObjectMapper mapper = name.endsWith(".json") ? new ObjectMapper() : new ObjectMapper(new YAMLFactory());
        try (InputStream in = Files.newInputStream(path)) {
            return mapper.readTree(in);
        }
    }

    /**
     * Элементы списка: корень-массив или массив в одном из полей-контейнеров
     */
    static JsonNode items(JsonNode root, String... containerFields) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        for (String field : containerFields) {
            JsonNode node = root.path(field);
            if (node.isArray()) {
                return node;
            }
        }
        return null;
    }

    static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.path(name);
            if (!value.isMissingNode() && !value.isNull() && !value.isContainerNode()) {
                String text = value.asText().trim();
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    /**
     * ISO-8601 instant, дата-время со смещением, локальное дата-время (UTC) или дата
     *
     * @throws DateTimeParseException если строка не распознана
     */
    static Instant parseInstant(String value) {
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : INSTANT_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        throw last;
    }
}
