package com.vtb.discovery.modules;

import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeAnalysisDiscoveryModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void findsConnectionAndPathLiterals() throws IOException {
        Path root = tempDir.toRealPath();
        Files.writeString(root.resolve("app.py"), String.join("\n",
            "import sqlalchemy",
            "engine = create_engine(\"postgresql://svc:pw@localhost:5432/orders\")",
            "DB_PATH = \"data/local.db\"",
            "memory = \"sqlite:///:memory:\"",
            ""));
        Files.writeString(root.resolve("README.md"), "postgresql://ignored:5432/x");

        List<CandidateObservation> observations = ModuleTestSupport.drain(new CodeAnalysisDiscoveryModule()
            .discover(ModuleTestSupport.configFor(root), DiscoveryDeadline.unbounded()));

        assertEquals(2, observations.size(), "In-memory и не-кодовые файлы не учитываются");

        CandidateObservation connection = observations.get(0);
        assertEquals("postgresql://localhost:5432/orders", connection.getLocator());
        assertEquals(AssetType.POSTGRESQL, connection.getAssetType());
        assertEquals("orders", connection.getAttributes().get("database"));
        assertEquals("app.py", connection.getAttributes().get("source_file"));
        assertEquals("2", connection.getAttributes().get("line"));
        assertFalse(connection.getLocator().contains("pw"));

        CandidateObservation path = observations.get(1);
        assertEquals(root.resolve("data/local.db").toString(), path.getLocator());
        assertEquals(AssetType.SQLITE, path.getAssetType());
        assertEquals("data/local.db", path.getAttributes().get("path_literal"));
    }
}
