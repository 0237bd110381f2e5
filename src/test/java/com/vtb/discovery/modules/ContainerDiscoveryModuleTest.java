package com.vtb.discovery.modules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ContainerDiscoveryModuleTest {

    @TempDir
    Path tempDir;

    private final ContainerDiscoveryModule module = new ContainerDiscoveryModule(config -> {
        throw new ModuleUnavailableException("Docker daemon не отвечает");
    });

    @Test
    void detectsDatabaseServicesInCompose() throws IOException {
        Path root = tempDir.toRealPath();
        Files.writeString(root.resolve("docker-compose.yml"), String.join("\n",
            "services:",
            "  db:",
            "    image: postgres:15",
            "    ports:",
            "      - \"5433:5432\"",
            "    labels:",
            "      com.example.team: payments",
            "      criticality: high",
            "  cache:",
            "    image: redis:7",
            "  web:",
            "    image: nginx:latest",
            "    ports:",
            "      - \"8080:80\"",
            ""));

        List<CandidateObservation> observations = ModuleTestSupport.drain(
            module.discover(ModuleTestSupport.configFor(root), DiscoveryDeadline.unbounded()));

        assertEquals(2, observations.size(), "nginx не является хранилищем");
        CandidateObservation db = observations.stream()
            .filter(o -> "db".equals(o.getAttributes().get("service")))
            .findFirst()
            .orElseThrow();
        assertEquals(AssetType.POSTGRESQL, db.getAssetType());
        assertEquals(0.9, db.getMethodConfidence(), 1e-9);
        assertEquals("compose://" + root.resolve("docker-compose.yml") + "#db", db.getLocator());
        assertTrue(db.getLinks().contains("localhost:5433"));
        assertEquals("payments", db.getAttributes().get("team"));
        assertEquals("high", db.getAttributes().get("criticality"));
        assertEquals("5433", db.getAttributes().get("published_ports"));
    }

    @Test
    void environmentIndicatorWithoutKnownImage() throws IOException {
        Path compose = tempDir.resolve("compose.yaml");
        Files.writeString(compose, String.join("\n",
            "services:",
            "  store:",
            "    image: internal/registry-store:1.2",
            "    environment:",
            "      - POSTGRES_DB=orders",
            ""));

        List<CandidateObservation> observations = module.analyzeComposeFile(compose);

        assertEquals(1, observations.size());
        assertEquals(0.6, observations.get(0).getMethodConfidence(), 1e-9);
        assertEquals(AssetType.POSTGRESQL, observations.get(0).getAssetType());
    }

    @Test
    void malformedComposeYieldsNothing() throws IOException {
        Path compose = tempDir.resolve("docker-compose.yml");
        Files.writeString(compose, "services: [unclosed");
        assertTrue(module.analyzeComposeFile(compose).isEmpty());
    }

    @Test
    void parsesShortAndLongPortSyntax() throws IOException {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        List<int[]> ports = ContainerDiscoveryModule.parsePorts(yaml.readTree(String.join("\n",
            "- \"127.0.0.1:5433:5432/tcp\"",
            "- 6379",
            "- target: 9000",
            "  published: 19000",
            "")));

        assertEquals(3, ports.size());
        assertArrayEquals(new int[]{5433, 5432}, ports.get(0));
        assertArrayEquals(new int[]{0, 6379}, ports.get(1));
        assertArrayEquals(new int[]{19000, 9000}, ports.get(2));
    }

    @Test
    void runningContainersInspectedAndLinkedToCompose() throws IOException {
        Path root = tempDir.toRealPath();
        Path composeFile = root.resolve("docker-compose.yml");
        Files.writeString(composeFile, String.join("\n",
            "services:",
            "  db:",
            "    image: postgres:16",
            ""));
        RunningContainer postgres = RunningContainer.builder()
            .id("3f4e1c2b9a8d7e6f5a4b3c2d1e0f")
            .name("shop-db-1")
            .image("postgres:16")
            .port(new int[]{5434, 5432})
            .label("com.docker.compose.service", "db")
            .label("com.docker.compose.project.config_files", composeFile.toString())
            .label("org.example.owner", "dba-team")
            .environmentKey("POSTGRES_PASSWORD")
            .mount("/var/lib/postgresql/data")
            .build();
        RunningContainer web = RunningContainer.builder()
            .id("aa11")
            .name("shop-web-1")
            .image("nginx:1.25")
            .port(new int[]{8080, 80})
            .build();
        StubRuntime runtime = new StubRuntime(List.of(postgres, web));
        ContainerDiscoveryModule inspecting = new ContainerDiscoveryModule(config -> runtime);

        List<CandidateObservation> observations = ModuleTestSupport.drain(
            inspecting.discover(ModuleTestSupport.configFor(root), DiscoveryDeadline.unbounded()));

        assertEquals(2, observations.size(), "Контейнер и compose сервис, nginx пропущен");
        CandidateObservation running = observations.stream()
            .filter(o -> o.getLocator().startsWith("docker://"))
            .findFirst()
            .orElseThrow();
        assertEquals("docker://shop-db-1", running.getLocator());
        assertEquals(AssetType.POSTGRESQL, running.getAssetType());
        assertEquals("3f4e1c2b9a8d", running.getAttributes().get("container_id"));
        assertEquals("5434", running.getAttributes().get("published_ports"));
        assertEquals("/var/lib/postgresql/data", running.getAttributes().get("volumes"));
        assertEquals("dba-team", running.getAttributes().get("owner"));
        assertFalse(running.getAttributes().containsValue("POSTGRES_PASSWORD"), "Переменные окружения не попадают в атрибуты");
        assertTrue(running.getLinks().contains("localhost:5434"));
        assertTrue(running.getLinks().contains("compose://" + composeFile + "#db"), "Связь с объявленным сервисом");
        assertTrue(runtime.closed.get(), "Клиент среды закрывается вместе с потоком");
    }

    @Test
    void environmentKeysClassifyUnknownImage() {
        RunningContainer custom = RunningContainer.builder()
            .id("bb22")
            .name("storage")
            .image("registry.local/blob:3")
            .environmentKey("MINIO_ROOT_USER")
            .labels(Map.of())
            .build();

        CandidateObservation observation = module.analyzeRunningContainer(custom);

        assertNotNull(observation);
        assertEquals(AssetType.FILE_STORAGE, observation.getAssetType());
        assertEquals(0.6, observation.getMethodConfidence(), 1e-9);
        assertNull(observation.getAttributes().get("service"));
    }

    @Test
    void unreachableDaemonFallsBackToComposeFiles() throws IOException {
        Path root = tempDir.toRealPath();
        Files.writeString(root.resolve("compose.yml"), String.join("\n",
            "services:",
            "  cache:",
            "    image: redis:7",
            ""));

        List<CandidateObservation> observations = ModuleTestSupport.drain(
            module.discover(ModuleTestSupport.configFor(root), DiscoveryDeadline.unbounded()));

        assertEquals(1, observations.size());
        assertTrue(observations.get(0).getLocator().startsWith("compose://"));
    }

    @Test
    void unreachableDaemonWithoutScanRootsIsUnavailable() {
        DiscoveryConfig config = DiscoveryConfig.defaults();
        config.getScope().setScanPaths(List.of(tempDir.resolve("absent").toString()));

        assertTrue(module.checkAvailability(config).isAvailable(), "Docker еще может ответить");
        assertThrows(ModuleUnavailableException.class,
            () -> module.discover(config, DiscoveryDeadline.unbounded()));
    }

    @Test
    void inspectionDisabledSkipsRuntime() throws IOException {
        AtomicBoolean called = new AtomicBoolean();
        ContainerDiscoveryModule guarded = new ContainerDiscoveryModule(config -> {
            called.set(true);
            return new StubRuntime(List.of());
        });
        DiscoveryConfig config = ModuleTestSupport.configFor(tempDir);
        config.getContainer().setInspectRunning(false);

        assertTrue(ModuleTestSupport.drain(guarded.discover(config, DiscoveryDeadline.unbounded())).isEmpty());
        assertFalse(called.get());
    }

    private static final class StubRuntime implements ContainerRuntime {

        private final List<RunningContainer> containers;
        private final AtomicBoolean closed = new AtomicBoolean();

        private StubRuntime(List<RunningContainer> containers) {
            this.containers = containers;
        }

        @Override
        public List<RunningContainer> listRunningContainers() {
            return containers;
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
