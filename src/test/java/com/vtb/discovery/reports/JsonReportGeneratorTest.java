package com.vtb.discovery.reports;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.discovery.models.ComplianceFramework;
import com.vtb.discovery.models.ComplianceGap;
import com.vtb.discovery.models.ComplianceRule;
import com.vtb.discovery.models.ComplianceRuleSet;
import com.vtb.discovery.models.DiscoveryReport;
import com.vtb.discovery.models.GapSeverity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportGeneratorTest {

    @Test
    void serializesGapsWithTypeAndFramework() throws IOException {
        ComplianceRuleSet rules = ComplianceRuleSet.of(List.of(ComplianceRule.builder()
            .framework(ComplianceFramework.GDPR)
            .ruleId("GDPR-32")
            .predicateType("attribute_present")
            .parameter("attribute", "encryption")
            .build()));
        DiscoveryReport report = DiscoveryReport.builder()
            .reportId("r-1")
            .startedAt(Instant.parse("2024-01-01T00:00:00Z"))
            .finishedAt(Instant.parse("2024-01-01T00:00:01Z"))
            .gap(ComplianceGap.forRule(rules, "GDPR-32", null, Instant.parse("2024-01-01T00:00:01Z"),
                List.of("нет шифрования"), GapSeverity.HIGH))
            .build();

        JsonReportGenerator generator = new JsonReportGenerator();
        JsonNode root = new ObjectMapper().readTree(generator.toJson(report));

        JsonNode gap = root.path("gaps").get(0);
        assertEquals("COMPLIANCE", gap.path("gapType").asText());
        assertEquals("GDPR", gap.path("framework").asText());
        assertEquals("GDPR-32", gap.path("violatedRule").asText());
        assertTrue(gap.path("systemic").asBoolean());
        assertEquals("json", generator.getFileExtension());
    }

    @Test
    void createsParentDirectories(@TempDir Path tempDir) throws IOException {
        Path target = tempDir.resolve("nested/dir/report.json");
        new JsonReportGenerator().generate(DiscoveryReport.builder().reportId("r-2").build(), target);
        assertTrue(target.toFile().isFile());
    }
}
