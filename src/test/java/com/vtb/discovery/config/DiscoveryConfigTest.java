package com.vtb.discovery.config;

import com.vtb.discovery.models.DiscoveryMethod;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryConfigTest {

    @Test
    void defaultsFromClasspath() {
        DiscoveryConfig config = DiscoveryConfig.loadDefaults();

        assertNotNull(config.getPerformance().getMaxWorkers());
        assertTrue(config.getPerformance().getMaxExecutionTimeSeconds() > 0);
        assertTrue(config.getScope().getFileExtensions().contains(".db"));
        assertEquals(1.0, config.getPrioritization().getWeights().sum(), 1e-9);
        assertTrue(config.isModuleEnabled(DiscoveryMethod.NETWORK));
        assertTrue(config.getContainer().getInspectRunning());
        assertEquals(Integer.valueOf(2000), config.getContainer().getApiTimeoutMs());
        assertNull(config.getContainer().getDockerHost(), "По умолчанию DOCKER_HOST или стандартный сокет");
    }

    @Test
    void partialFileKeepsDefaultsForMissingFields(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, String.join("\n",
            "modules:",
            "  network: false",
            "performance:",
            "  maxWorkers: 2",
            "scope:",
            "  fileExtensions: [DB, sqlite]",
            "unknownSection:",
            "  foo: bar",
            ""));

        DiscoveryConfig config = DiscoveryConfig.load(file);

        assertEquals(Integer.valueOf(2), config.getPerformance().getMaxWorkers());
        assertEquals(Integer.valueOf(120), config.getPerformance().getModuleTimeoutSeconds());
        assertFalse(config.isModuleEnabled(DiscoveryMethod.NETWORK));
        assertTrue(config.isModuleEnabled(DiscoveryMethod.FILESYSTEM));
        assertEquals(List.of(".db", ".sqlite"), config.getScope().getFileExtensions(),
            "Расширения приводятся к нижнему регистру с точкой");
        assertEquals("discovery-report", config.getOutput().getFileNamePrefix());
    }

    @Test
    void emptyFileGivesDefaults(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        DiscoveryConfig config = DiscoveryConfig.load(file);

        assertEquals(Integer.valueOf(4), config.getPerformance().getMaxWorkers());
        assertEquals(List.of("owner", "team", "maintainer"), config.getGapAnalysis().getOwnerAttributes());
    }

    @Test
    void missingFileRejected(@TempDir Path tempDir) {
        assertThrows(InvalidDiscoveryConfigurationException.class,
            () -> DiscoveryConfig.load(tempDir.resolve("absent.yaml")));
    }

    @Test
    void malformedYamlRejected(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "performance:\n  maxWorkers: [1, 2\n");

        assertThrows(InvalidDiscoveryConfigurationException.class, () -> DiscoveryConfig.load(file));
    }

    @Test
    void validateCollectsAllErrors() {
        DiscoveryConfig config = DiscoveryConfig.defaults();
        config.getPerformance().setMaxWorkers(0);
        config.getGapAnalysis().setCompletenessThreshold(1.5);

        InvalidDiscoveryConfigurationException e =
            assertThrows(InvalidDiscoveryConfigurationException.class, config::validate);
        assertTrue(e.getMessage().contains("maxWorkers"));
        assertTrue(e.getMessage().contains("completenessThreshold"));
    }

    @Test
    void zeroWeightsRejected() {
        DiscoveryConfig config = DiscoveryConfig.defaults();
        DiscoveryConfig.Weights weights = config.getPrioritization().getWeights();
        weights.setSeverity(0.0);
        weights.setRegulatory(0.0);
        weights.setExposure(0.0);

        assertThrows(InvalidDiscoveryConfigurationException.class, config::validate);
    }

    @Test
    void validateWithoutDefaultsRejected() {
        assertThrows(InvalidDiscoveryConfigurationException.class, () -> new DiscoveryConfig().validate());
    }
}
