package com.vtb.discovery.cli;

import com.vtb.discovery.config.DiscoveryConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MainCommandTest {

    @Test
    void optionsOverrideConfig() {
        MainCommand command = new MainCommand();
        new CommandLine(command).parseArgs("-o", "out-dir", "--timeout", "30", "--workers", "2",
            "-p", "/srv/a", "-p", "/srv/b");

        DiscoveryConfig config = command.buildConfig();

        assertEquals("out-dir", config.getOutput().getDirectory());
        assertEquals(Integer.valueOf(30), config.getPerformance().getMaxExecutionTimeSeconds());
        assertEquals(Integer.valueOf(2), config.getPerformance().getMaxWorkers());
        assertEquals(List.of("/srv/a", "/srv/b"), config.getScope().getScanPaths());
    }

    @Test
    void invalidOverrideGivesConfigExitCode() {
        int exitCode = new CommandLine(new MainCommand()).execute("--workers", "0");
        assertEquals(MainCommand.EXIT_INVALID_CONFIG, exitCode);
    }

    @Test
    void missingConfigFileGivesConfigExitCode(@TempDir Path tempDir) {
        int exitCode = new CommandLine(new MainCommand())
            .execute("-c", tempDir.resolve("absent.yaml").toString());
        assertEquals(MainCommand.EXIT_INVALID_CONFIG, exitCode);
    }

    @Test
    void runWritesReport(@TempDir Path tempDir) throws IOException {
        Path workspace = Files.createDirectories(tempDir.resolve("workspace"));
        Files.write(workspace.resolve("app.db"), new byte[]{'S', 'Q', 'L'});
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, String.join("\n",
            "modules:",
            "  container: false",
            "  network: false",
            "performance:",
            "  maxExecutionTimeSeconds: 30",
            ""));
        Path output = tempDir.resolve("reports");

        int exitCode = new CommandLine(new MainCommand()).execute(
            "-c", config.toString(), "-p", workspace.toString(), "-o", output.toString());

        assertEquals(MainCommand.EXIT_OK, exitCode);
        List<Path> reports;
        try (Stream<Path> files = Files.list(output)) {
            reports = files.collect(Collectors.toList());
        }
        assertEquals(1, reports.size(), "Должен быть создан один отчет");
        String json = Files.readString(reports.get(0));
        assertTrue(json.contains("app.db"));
    }
}
