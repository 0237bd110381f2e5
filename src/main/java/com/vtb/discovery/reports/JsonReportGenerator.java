package com.vtb.discovery.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.discovery.models.DiscoveryReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    @Override
    public void generate(DiscoveryReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (report == null) {
            throw new IllegalArgumentException("DiscoveryReport не может быть null");
        }

        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(report));

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    public String toJson(DiscoveryReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    @Override
    public String getFileExtension() {
        return "json";
    }
}
