package com.vtb.discovery.reconciliation;

import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveredAsset;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.models.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationEngineTest {

    private final ReconciliationEngine engine = new ReconciliationEngine();

    @Test
    void mergesObservationsWithSameEndpoint() {
        CandidateObservation network = CandidateObservation.builder()
            .method(DiscoveryMethod.NETWORK)
            .locator("127.0.0.1:5432")
            .methodConfidence(0.9)
            .assetType(AssetType.POSTGRESQL)
            .attribute("banner", "PostgreSQL")
            .build();
        CandidateObservation code = CandidateObservation.builder()
            .method(DiscoveryMethod.CODE_ANALYSIS)
            .locator("postgresql://app:pw@localhost:5432/orders")
            .methodConfidence(0.8)
            .assetType(AssetType.POSTGRESQL)
            .attribute("source_file", "src/db.py")
            .build();

        ReconciliationResult result = engine.reconcile(List.of(network, code));

        assertEquals(1, result.getAssets().size(), "Один endpoint должен дать один актив");
        DiscoveredAsset asset = result.getAssets().get(0);
        assertEquals(AssetType.POSTGRESQL, asset.getAssetType());
        assertEquals(2, asset.getSupportingMethods().size());
        assertEquals(0.98, asset.getConfidenceScore(), 1e-9);
        assertEquals("src/db.py", asset.getAttribute("source_file"));
        assertTrue(asset.getLocators().stream().noneMatch(l -> l.contains("pw")), "Пароль не должен попасть в локаторы");
        assertTrue(result.getIssues().isEmpty());
    }

    @Test
    void explicitLinkJoinsDifferentLocators() {
        CandidateObservation container = CandidateObservation.builder()
            .method(DiscoveryMethod.CONTAINER)
            .locator("compose:///srv/docker-compose.yml#db")
            .methodConfidence(0.9)
            .assetType(AssetType.POSTGRESQL)
            .link("localhost:5433")
            .build();
        CandidateObservation network = CandidateObservation.builder()
            .method(DiscoveryMethod.NETWORK)
            .locator("localhost:5433")
            .methodConfidence(0.6)
            .assetType(AssetType.POSTGRESQL)
            .build();
        CandidateObservation unrelated = CandidateObservation.builder()
            .method(DiscoveryMethod.NETWORK)
            .locator("localhost:6379")
            .methodConfidence(0.9)
            .assetType(AssetType.OTHER)
            .build();

        ReconciliationResult result = engine.reconcile(List.of(container, network, unrelated));

        assertEquals(2, result.getAssets().size());
        assertEquals(3, result.getObservationCount());
    }

    @Test
    void typeConflictRecordedAndResolvedByPrecedence() {
        CandidateObservation byFile = CandidateObservation.builder()
            .method(DiscoveryMethod.FILESYSTEM)
            .locator("/data/store.db")
            .methodConfidence(0.5)
            .assetType(AssetType.DUCKDB)
            .build();
        CandidateObservation byCode = CandidateObservation.builder()
            .method(DiscoveryMethod.CODE_ANALYSIS)
            .locator("/data/store.db")
            .methodConfidence(0.8)
            .assetType(AssetType.SQLITE)
            .build();

        ReconciliationResult result = engine.reconcile(List.of(byFile, byCode));

        assertEquals(1, result.getAssets().size());
        assertEquals(AssetType.SQLITE, result.getAssets().get(0).getAssetType(),
            "При равенстве голосов побеждает метод с большим приоритетом");
        assertEquals(1, result.getIssues().size());
        assertEquals(ErrorKind.RECONCILIATION_CONFLICT, result.getIssues().get(0).getKind());
    }

    @Test
    void resultDoesNotDependOnInputOrder() {
        List<CandidateObservation> observations = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            observations.add(CandidateObservation.builder()
                .method(i % 2 == 0 ? DiscoveryMethod.NETWORK : DiscoveryMethod.CODE_ANALYSIS)
                .locator("localhost:" + (5000 + i % 7))
                .methodConfidence(0.5 + (i % 5) / 10.0)
                .assetType(AssetType.POSTGRESQL)
                .attribute("index", String.valueOf(i % 3))
                .build());
        }
        ReconciliationResult first = engine.reconcile(observations);

        List<CandidateObservation> shuffled = new ArrayList<>(observations);
        Collections.shuffle(shuffled, new Random(42));
        ReconciliationResult second = engine.reconcile(shuffled);

        assertEquals(first.getAssets(), second.getAssets());
        assertEquals(7, first.getAssets().size());
    }

    @Test
    void emptyInputGivesEmptyInventory() {
        ReconciliationResult result = engine.reconcile(List.of());
        assertTrue(result.getAssets().isEmpty());
        assertEquals(0, result.getObservationCount());
    }

    @Test
    void existingFileMarkedAccessible(@TempDir Path dir) throws IOException {
        Path db = Files.write(dir.resolve("app.db"), new byte[] {1, 2, 3});
        CandidateObservation observation = CandidateObservation.builder()
            .method(DiscoveryMethod.FILESYSTEM)
            .locator(db.toString())
            .methodConfidence(0.7)
            .assetType(AssetType.SQLITE)
            .build();

        DiscoveredAsset asset = engine.reconcile(List.of(observation)).getAssets().get(0);

        assertEquals("true", asset.getAttribute(AssetValidator.VALIDATED));
        assertEquals("true", asset.getAttribute(AssetValidator.ACCESSIBLE));
        assertNull(asset.getAttribute(AssetValidator.VALIDATION_ERRORS));
    }

    @Test
    void danglingFileReferenceMarkedInaccessible() {
        CandidateObservation code = CandidateObservation.builder()
            .method(DiscoveryMethod.CODE_ANALYSIS)
            .locator("sqlite:////nonexistent/discovery/x.db")
            .methodConfidence(0.8)
            .assetType(AssetType.SQLITE)
            .build();

        DiscoveredAsset asset = engine.reconcile(List.of(code)).getAssets().get(0);

        assertEquals("true", asset.getAttribute(AssetValidator.VALIDATED));
        assertEquals("false", asset.getAttribute(AssetValidator.ACCESSIBLE), "Файла нет на диске");
        assertTrue(asset.getAttribute(AssetValidator.VALIDATION_ERRORS).contains("Файл не найден"));
    }

    @Test
    void endpointValidatedOnlyWhenNetworkAnswered() {
        CandidateObservation network = CandidateObservation.builder()
            .method(DiscoveryMethod.NETWORK)
            .locator("localhost:5432")
            .methodConfidence(0.9)
            .assetType(AssetType.POSTGRESQL)
            .build();
        CandidateObservation config = CandidateObservation.builder()
            .method(DiscoveryMethod.CODE_ANALYSIS)
            .locator("db.internal:3306")
            .methodConfidence(0.7)
            .assetType(AssetType.OTHER)
            .build();

        List<DiscoveredAsset> assets = engine.reconcile(List.of(network, config)).getAssets();

        DiscoveredAsset answered = assets.stream().filter(a -> a.getAssetType() == AssetType.POSTGRESQL).findFirst().orElseThrow();
        DiscoveredAsset declared = assets.stream().filter(a -> a.getAssetType() == AssetType.OTHER).findFirst().orElseThrow();
        assertEquals("true", answered.getAttribute(AssetValidator.ACCESSIBLE));
        assertNull(declared.getAttribute(AssetValidator.VALIDATED), "Без сетевого ответа endpoint не проверен");
    }

    @Test
    void confidenceNeverDecreasesAsObservationsAccumulate() {
        DiscoveryMethod[] methods = {
            DiscoveryMethod.CODE_ANALYSIS, DiscoveryMethod.FILESYSTEM, DiscoveryMethod.NETWORK,
            DiscoveryMethod.CONTAINER, DiscoveryMethod.CODE_ANALYSIS, DiscoveryMethod.NETWORK
        };
        double[] confidences = {0.4, 0.3, 0.9, 0.2, 0.8, 0.1};
        List<CandidateObservation> observations = new ArrayList<>();
        double previous = 0.0;
        for (int i = 0; i < methods.length; i++) {
            observations.add(CandidateObservation.builder()
                .method(methods[i])
                .locator("localhost:5432")
                .methodConfidence(confidences[i])
                .assetType(AssetType.POSTGRESQL)
                .build());

            List<DiscoveredAsset> assets = engine.reconcile(observations).getAssets();
            assertEquals(1, assets.size());
            double current = assets.get(0).getConfidenceScore();
            assertTrue(current >= previous, "Уверенность упала после наблюдения " + i + ": " + previous + " -> " + current);
            assertTrue(current <= 1.0);
            previous = current;
        }
    }
}
