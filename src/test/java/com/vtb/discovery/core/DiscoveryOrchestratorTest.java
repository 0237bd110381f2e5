package com.vtb.discovery.core;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.config.InvalidDiscoveryConfigurationException;
import com.vtb.discovery.models.AssetType;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.DiscoveryMethod;
import com.vtb.discovery.models.ErrorKind;
import com.vtb.discovery.models.ModuleRunSummary;
import com.vtb.discovery.models.ModuleStatus;
import com.vtb.discovery.modules.AbstractObservationStream;
import com.vtb.discovery.modules.DiscoveryDeadline;
import com.vtb.discovery.modules.DiscoveryModule;
import com.vtb.discovery.modules.ModuleAvailability;
import com.vtb.discovery.modules.ModuleUnavailableException;
import com.vtb.discovery.modules.ObservationStream;
import com.vtb.discovery.reconciliation.ReconciliationEngine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryOrchestratorTest {

    private static DiscoveryConfig config() {
        DiscoveryConfig config = DiscoveryConfig.defaults();
        config.getPerformance().setMaxExecutionTimeSeconds(10);
        config.getPerformance().setModuleTimeoutSeconds(10);
        config.getPerformance().setCancellationGraceMs(200L);
        return config;
    }

    @Test
    void collectsAndReconcilesObservationsFromAllModules() {
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config(), List.of(
            new StubModule("ports", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 2, "localhost:5432", -1)),
            new StubModule("code", DiscoveryMethod.CODE_ANALYSIS,
                (cfg, deadline) -> counting(deadline, 1, "postgresql://localhost:5432/app", -1))
        ), new ReconciliationEngine());

        DiscoveryRun run = orchestrator.run();

        assertEquals(3, run.getObservationCount());
        assertEquals(1, run.getAssets().size(), "Наблюдения одного endpoint должны слиться");
        assertFalse(run.isTruncated());
        assertTrue(run.getModuleRuns().stream().allMatch(s -> s.getStatus() == ModuleStatus.COMPLETED));
        assertTrue(run.getIssues().isEmpty());
    }

    @Test
    void deadlineMidStreamKeepsEmittedObservations() {
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config(), List.of(
            new StubModule("slow", DiscoveryMethod.FILESYSTEM, (cfg, deadline) -> counting(deadline, 10, "/data/f", 3))
        ), new ReconciliationEngine());

        DiscoveryRun run = orchestrator.run();

        ModuleRunSummary summary = run.getModuleRuns().get(0);
        assertEquals(ModuleStatus.PARTIAL, summary.getStatus());
        assertEquals(3, summary.getObservationCount());
        assertEquals(3, run.getObservationCount(), "Выданные до дедлайна наблюдения должны сохраниться");
        assertTrue(run.isTruncated());
        assertTrue(run.getIssues().stream().anyMatch(i -> i.getKind() == ErrorKind.MODULE_TIMEOUT));
    }

    @Test
    void failingModuleDoesNotAbortRun() {
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config(), List.of(
            new StubModule("broken", DiscoveryMethod.CONTAINER, (cfg, deadline) -> {
                throw new IllegalStateException("boom");
            }),
            new StubModule("missing", DiscoveryMethod.SECURITY_SCAN, (cfg, deadline) -> {
                throw new ModuleUnavailableException("нет исходников");
            }),
            new StubModule("ok", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 1, "localhost:6379", -1))
        ), new ReconciliationEngine());

        DiscoveryRun run = orchestrator.run();

        assertEquals(1, run.getAssets().size());
        assertEquals(ModuleStatus.FAILED, status(run, "broken"));
        assertEquals(ModuleStatus.SKIPPED, status(run, "missing"));
        assertEquals(ModuleStatus.COMPLETED, status(run, "ok"));
        assertTrue(run.getIssues().stream().anyMatch(i -> i.getKind() == ErrorKind.MODULE_FAILED));
        assertTrue(run.getIssues().stream().anyMatch(i -> i.getKind() == ErrorKind.MODULE_UNAVAILABLE));
    }

    @Test
    void unavailableModuleIsSkipped() {
        StubModule unavailable = new StubModule("docker", DiscoveryMethod.CONTAINER,
            (cfg, deadline) -> counting(deadline, 1, "localhost:1", -1));
        unavailable.availability = ModuleAvailability.unavailable("compose-файлы не найдены");

        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config(), List.of(unavailable,
            new StubModule("ok", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 1, "localhost:2", -1))
        ), new ReconciliationEngine());

        DiscoveryRun run = orchestrator.run();

        assertEquals(ModuleStatus.SKIPPED, status(run, "docker"));
        assertEquals(1, run.getObservationCount());
    }

    @Test
    void writableModuleRejectedAtRegistration() {
        StubModule writer = new StubModule("writer", DiscoveryMethod.NETWORK,
            (cfg, deadline) -> counting(deadline, 1, "localhost:1", -1));
        writer.readOnly = false;
        StubModule reader = new StubModule("reader", DiscoveryMethod.FILESYSTEM,
            (cfg, deadline) -> counting(deadline, 1, "/a.db", -1));

        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config(), List.of(writer, reader),
            new ReconciliationEngine());

        assertEquals(1, orchestrator.getAcceptedModules().size());
        DiscoveryRun run = orchestrator.run();
        assertEquals(ModuleStatus.SKIPPED, status(run, "writer"));
        assertEquals(1, run.getObservationCount());
    }

    @Test
    void noAcceptedModulesIsConfigurationError() {
        assertThrows(InvalidDiscoveryConfigurationException.class,
            () -> new DiscoveryOrchestrator(config(), List.of(), new ReconciliationEngine()));

        StubModule writer = new StubModule("writer", DiscoveryMethod.NETWORK,
            (cfg, deadline) -> counting(deadline, 1, "localhost:1", -1));
        writer.readOnly = false;
        assertThrows(InvalidDiscoveryConfigurationException.class,
            () -> new DiscoveryOrchestrator(config(), List.of(writer), new ReconciliationEngine()));
    }

    @Test
    void disabledModuleIsNotRun() {
        DiscoveryConfig config = config();
        config.getModules().setNetwork(false);
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config, List.of(
            new StubModule("net", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 1, "localhost:1", -1)),
            new StubModule("fs", DiscoveryMethod.FILESYSTEM, (cfg, deadline) -> counting(deadline, 1, "/a.db", -1))
        ), new ReconciliationEngine());

        DiscoveryRun run = orchestrator.run();

        assertEquals(ModuleStatus.SKIPPED, status(run, "net"));
        assertEquals(1, run.getObservationCount());
    }

    @Test
    void observationBudgetTruncatesRun() {
        DiscoveryConfig config = config();
        config.getPerformance().setMaxObservations(5);
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config, List.of(
            new StubModule("flood", DiscoveryMethod.FILESYSTEM, (cfg, deadline) -> counting(deadline, 50, "/f", -1))
        ), new ReconciliationEngine());

        DiscoveryRun run = orchestrator.run();

        assertTrue(run.isTruncated());
        assertTrue(run.isBudgetExceeded());
        assertEquals(5, run.getObservationCount());
        assertTrue(run.getIssues().stream().anyMatch(i -> i.getKind() == ErrorKind.BUDGET_EXCEEDED));
    }

    @Test
    void hungModuleIsAbandonedAfterGracePeriod() throws InterruptedException {
        DiscoveryConfig config = config();
        config.getPerformance().setMaxExecutionTimeSeconds(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config, List.of(
                new StubModule("hung", DiscoveryMethod.CONTAINER, (cfg, deadline) -> new HungStream(release)),
                new StubModule("fast", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 2, "localhost:9", -1))
            ), new ReconciliationEngine());

            DiscoveryRun run = orchestrator.run();

            assertEquals(ModuleStatus.ABANDONED, status(run, "hung"));
            assertEquals(ModuleStatus.COMPLETED, status(run, "fast"));
            assertEquals(2, run.getObservationCount(), "Вывод брошенного модуля не должен попасть в инвентарь");
            assertTrue(run.isTruncated());
        } finally {
            release.countDown();
        }
    }

    @Test
    void queuedModuleNotStartedBeforeTimeoutIsSkipped() {
        DiscoveryConfig config = config();
        config.getPerformance().setMaxExecutionTimeSeconds(1);
        config.getPerformance().setMaxWorkers(1);
        config.getPerformance().setCancellationGraceMs(3_000L);
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config, List.of(
            new StubModule("busy", DiscoveryMethod.FILESYSTEM, (cfg, deadline) -> new UntilInterruptedStream()),
            new StubModule("queued", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 2, "localhost:9", -1))
        ), new ReconciliationEngine());

        long started = System.nanoTime();
        DiscoveryRun run = orchestrator.run();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(ModuleStatus.PARTIAL, status(run, "busy"));
        ModuleRunSummary queued = run.getModuleRuns().stream()
            .filter(s -> s.getModuleName().equals("queued"))
            .findFirst()
            .orElseThrow();
        assertEquals(ModuleStatus.SKIPPED, queued.getStatus(), "Незапущенный модуль не может быть брошенным");
        assertTrue(queued.getReason().contains("до запуска"));
        assertEquals(0, run.getObservationCount());
        assertTrue(run.isTruncated());
        assertTrue(elapsedMs < 3_000, "Период отмены не должен ждать незапущенные задачи: " + elapsedMs + " мс");
    }

    @Test
    void runModuleReportsPartialOnCancelledDeadline() {
        DiscoveryConfig config = config();
        StubModule module = new StubModule("m", DiscoveryMethod.NETWORK, (cfg, deadline) -> counting(deadline, 4, "h:1", -1));
        DiscoveryOrchestrator orchestrator = new DiscoveryOrchestrator(config, List.of(module), new ReconciliationEngine());
        DiscoveryDeadline cancelled = DiscoveryDeadline.unbounded();
        cancelled.cancel();

        ObservationCollector collector = new ObservationCollector(100, 1024);
        DiscoveryOrchestrator.ModuleOutcome outcome = orchestrator.runModule(module, cancelled, collector.openSink("m"));

        assertEquals(ModuleStatus.PARTIAL, outcome.getSummary().getStatus());
        assertEquals(0, outcome.getSummary().getObservationCount());
        assertEquals(1, outcome.getIssues().size());
    }

    private static ModuleStatus status(DiscoveryRun run, String name) {
        return run.getModuleRuns().stream()
            .filter(s -> s.getModuleName().equals(name))
            .findFirst()
            .map(ModuleRunSummary::getStatus)
            .orElseThrow();
    }

    /**
     * Поток из total наблюдений; после cancelAfter-го отменяет свой дедлайн
     */
    private static ObservationStream counting(DiscoveryDeadline deadline, int total, String locatorPrefix, int cancelAfter) {
        return new AbstractObservationStream(deadline) {
            private int emitted;

            @Override
            protected CandidateObservation computeNext() {
                if (emitted >= total) {
                    return null;
                }
                emitted++;
                if (emitted == cancelAfter) {
                    deadline.cancel();
                }
                String locator = total == 1 || locatorPrefix.contains("//") || locatorPrefix.contains(":")
                    ? locatorPrefix
                    : locatorPrefix + emitted + ".db";
                return CandidateObservation.builder()
                    .method(DiscoveryMethod.NETWORK)
                    .locator(locator)
                    .methodConfidence(0.6)
                    .assetType(AssetType.POSTGRESQL)
                    .attribute("seq", String.valueOf(emitted))
                    .build();
            }
        };
    }

    private static final class HungStream extends AbstractObservationStream {
        private final CountDownLatch release;

        HungStream(CountDownLatch release) {
            super(DiscoveryDeadline.unbounded());
            this.release = release;
        }

        @Override
        protected CandidateObservation computeNext() {
            // Игнорирует отмену и прерывания до конца теста
            while (release.getCount() > 0) {
                try {
                    release.await(50, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.interrupted();
                }
            }
            return null;
        }
    }

    /**
     * Ничего не выдает, работает до прерывания потока
     */
    private static final class UntilInterruptedStream extends AbstractObservationStream {

        UntilInterruptedStream() {
            super(DiscoveryDeadline.unbounded());
        }

        @Override
        protected CandidateObservation computeNext() {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            deadlineReached();
            return null;
        }
    }

    private static final class StubModule implements DiscoveryModule {
        private final String name;
        private final DiscoveryMethod method;
        private final BiFunction<DiscoveryConfig, DiscoveryDeadline, ObservationStream> body;
        private boolean readOnly = true;
        private ModuleAvailability availability = ModuleAvailability.available();

        StubModule(String name, DiscoveryMethod method,
                   BiFunction<DiscoveryConfig, DiscoveryDeadline, ObservationStream> body) {
            this.name = name;
            this.method = method;
            this.body = body;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public DiscoveryMethod getMethod() {
            return method;
        }

        @Override
        public boolean isReadOnly() {
            return readOnly;
        }

        @Override
        public ModuleAvailability checkAvailability(DiscoveryConfig config) {
            return availability;
        }

        @Override
        public ObservationStream discover(DiscoveryConfig config, DiscoveryDeadline deadline) {
            return body.apply(config, deadline);
        }
    }
}
