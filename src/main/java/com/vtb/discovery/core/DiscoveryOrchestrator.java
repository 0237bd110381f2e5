package com.vtb.discovery.core;

import com.vtb.discovery.config.DiscoveryConfig;
import com.vtb.discovery.config.InvalidDiscoveryConfigurationException;
import com.vtb.discovery.models.CandidateObservation;
import com.vtb.discovery.models.ErrorKind;
import com.vtb.discovery.models.ModuleRunSummary;
import com.vtb.discovery.models.ModuleStatus;
import com.vtb.discovery.models.RunIssue;
import com.vtb.discovery.modules.DiscoveryDeadline;
import com.vtb.discovery.modules.DiscoveryModule;
import com.vtb.discovery.modules.ModuleAvailability;
import com.vtb.discovery.modules.ModuleUnavailableException;
import com.vtb.discovery.modules.ObservationStream;
import com.vtb.discovery.reconciliation.ReconciliationEngine;
import com.vtb.discovery.reconciliation.ReconciliationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Параллельный запуск модулей обнаружения в общем бюджете времени и памяти
 * с последующей сверкой наблюдений.
 * Модули передаются явно: глобального реестра нет.
 */
@Slf4j
public class DiscoveryOrchestrator {

    private final DiscoveryConfig config;
    private final ReconciliationEngine reconciliationEngine;
    private final List<DiscoveryModule> accepted = new ArrayList<>();
    private final List<ModuleRunSummary> rejected = new ArrayList<>();
    private final List<RunIssue> registrationIssues = new ArrayList<>();

    /**
     * @throws InvalidDiscoveryConfigurationException если конфигурация некорректна
     *                                                или не осталось ни одного модуля
     */
    public DiscoveryOrchestrator(DiscoveryConfig config,
                                 List<DiscoveryModule> modules,
                                 ReconciliationEngine reconciliationEngine) {
        if (config == null) {
            throw new InvalidDiscoveryConfigurationException("Конфигурация не задана");
        }
        config.validate();
        if (modules == null || modules.isEmpty()) {
            throw new InvalidDiscoveryConfigurationException("Не задано ни одного модуля обнаружения");
        }
        this.config = config;
        this.reconciliationEngine = reconciliationEngine != null ? reconciliationEngine : new ReconciliationEngine();
        register(modules);
        if (accepted.isEmpty()) {
            throw new InvalidDiscoveryConfigurationException(
                "Ни один модуль не принят к выполнению (отклонено: " + rejected.size() + ")");
        }
        log.info("Зарегистрировано модулей: {} (отклонено: {})", accepted.size(), rejected.size());
    }

    private void register(List<DiscoveryModule> modules) {
        Set<String> names = new HashSet<>();
        for (DiscoveryModule module : modules) {
            if (module == null) {
                continue;
            }
            String name = module.getName();
            if (!module.isReadOnly()) {
                String reason = "Модуль не гарантирует режим только чтения";
                log.warn("Модуль {} отклонен: {}", name, reason);
                rejected.add(ModuleRunSummary.skipped(name, module.getMethod(), reason));
                registrationIssues.add(RunIssue.of(ErrorKind.MODULE_UNAVAILABLE, name, reason));
                continue;
            }
            if (!config.isModuleEnabled(module.getMethod())) {
                log.info("Модуль {} отключен в конфигурации", name);
                rejected.add(ModuleRunSummary.skipped(name, module.getMethod(), "Отключен в конфигурации"));
                continue;
            }
            if (!names.add(name)) {
                String reason = "Повторяющееся имя модуля";
                log.warn("Модуль {} отклонен: {}", name, reason);
                rejected.add(ModuleRunSummary.skipped(name, module.getMethod(), reason));
                registrationIssues.add(RunIssue.of(ErrorKind.MODULE_UNAVAILABLE, name, reason));
                continue;
            }
            accepted.add(module);
        }
    }

    /**
     * Выполнить прогон. Не бросает исключений из-за отдельных модулей:
     * сбои, таймауты и недоступность попадают в issues.
     */
    public DiscoveryRun run() {
        Instant startedAt = Instant.now();
        log.info("=== Начало обнаружения: {} модулей ===", accepted.size());

        DiscoveryConfig.Performance performance = config.getPerformance();
        DiscoveryDeadline globalDeadline = DiscoveryDeadline.after(
            Duration.ofSeconds(performance.getMaxExecutionTimeSeconds()));
        Duration moduleTimeout = Duration.ofSeconds(performance.getModuleTimeoutSeconds());

        ObservationCollector collector = new ObservationCollector(
            performance.getMaxObservations(), performance.getMaxMemoryUsageMb());
        collector.setOnBudgetExceeded(globalDeadline::cancel);

        Map<String, ModuleRunSummary> summaries = new LinkedHashMap<>();
        List<RunIssue> issues = new ArrayList<>(registrationIssues);
        for (ModuleRunSummary summary : rejected) {
            summaries.put(summary.getModuleName(), summary);
        }

        List<DiscoveryModule> runnable = new ArrayList<>();
        for (DiscoveryModule module : accepted) {
            ModuleAvailability availability = safeAvailability(module);
            if (availability.isAvailable()) {
                runnable.add(module);
            } else {
                log.warn("Модуль {} недоступен: {}", module.getName(), availability.getReason());
                summaries.put(module.getName(),
                    ModuleRunSummary.skipped(module.getName(), module.getMethod(), availability.getReason()));
                issues.add(RunIssue.of(ErrorKind.MODULE_UNAVAILABLE, module.getName(), availability.getReason()));
            }
        }

        boolean truncated = false;
        if (!runnable.isEmpty()) {
            truncated = execute(runnable, globalDeadline, moduleTimeout, collector, summaries, issues);
        }
        if (collector.isBudgetExceeded()) {
            truncated = true;
            issues.add(RunIssue.of(ErrorKind.BUDGET_EXCEEDED, "orchestrator",
                "Превышен бюджет наблюдений или памяти, прогон усечен"));
        }

        List<CandidateObservation> observations = collector.snapshot();
        observations.sort(ReconciliationEngine.OBSERVATION_ORDER);
        ReconciliationResult reconciliation = reconciliationEngine.reconcile(observations);
        issues.addAll(reconciliation.getIssues());

        List<ModuleRunSummary> ordered = new ArrayList<>();
        for (DiscoveryModule module : accepted) {
            ModuleRunSummary summary = summaries.get(module.getName());
            if (summary != null) {
                ordered.add(summary);
            }
        }
        for (ModuleRunSummary summary : rejected) {
            ordered.add(summary);
        }

        Instant finishedAt = Instant.now();
        log.info("=== Обнаружение завершено за {} мс: {} наблюдений, {} активов{} ===",
            Duration.between(startedAt, finishedAt).toMillis(), observations.size(),
            reconciliation.getAssets().size(), truncated ? " (УСЕЧЕНО)" : "");

        return DiscoveryRun.builder()
            .startedAt(startedAt)
            .finishedAt(finishedAt)
            .assets(reconciliation.getAssets())
            .moduleRuns(ordered)
            .issues(issues)
            .observationCount(observations.size())
            .truncated(truncated)
            .budgetExceeded(collector.isBudgetExceeded())
            .build();
    }

    private boolean execute(List<DiscoveryModule> runnable,
                            DiscoveryDeadline globalDeadline,
                            Duration moduleTimeout,
                            ObservationCollector collector,
                            Map<String, ModuleRunSummary> summaries,
                            List<RunIssue> issues) {
        int workers = Math.min(runnable.size(), config.getPerformance().getMaxWorkers());
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreadFactory());
        CountDownLatch latch = new CountDownLatch(runnable.size());
        List<Future<?>> futures = new ArrayList<>();
        Map<String, ModuleSink> sinks = new LinkedHashMap<>();
        Map<String, ModuleOutcome> outcomes = new ConcurrentHashMap<>();
        Map<String, AtomicBoolean> claims = new LinkedHashMap<>();
        Set<String> neverStarted = new HashSet<>();
        boolean truncated = false;

        try {
            for (DiscoveryModule module : runnable) {
                ModuleSink sink = collector.openSink(module.getName());
                AtomicBoolean claim = new AtomicBoolean(false);
                sinks.put(module.getName(), sink);
                claims.put(module.getName(), claim);
                futures.add(executor.submit(() -> {
                    if (!claim.compareAndSet(false, true)) {
                        // Оркестратор уже снял задачу до запуска
                        return;
                    }
                    try {
                        outcomes.put(module.getName(), runModule(module, globalDeadline.child(moduleTimeout), sink));
                    } finally {
                        latch.countDown();
                    }
                }));
            }

            boolean completed = awaitQuietly(latch, globalDeadline.remaining());
            if (!completed) {
                truncated = true;
                log.error("TIMEOUT: модули не завершились за {} с, отменяем зависшие задачи",
                    config.getPerformance().getMaxExecutionTimeSeconds());
                globalDeadline.cancel();
                // Сначала снять незапущенные задачи, затем прерывать работающие
                for (int i = 0; i < runnable.size(); i++) {
                    String name = runnable.get(i).getName();
                    if (claims.get(name).compareAndSet(false, true)) {
                        neverStarted.add(name);
                        futures.get(i).cancel(false);
                        latch.countDown();
                    }
                }
                for (int i = 0; i < runnable.size(); i++) {
                    Future<?> future = futures.get(i);
                    if (!neverStarted.contains(runnable.get(i).getName()) && !future.isDone()) {
                        future.cancel(true);
                    }
                }
                awaitQuietly(latch, Duration.ofMillis(config.getPerformance().getCancellationGraceMs()));
            }

            for (DiscoveryModule module : runnable) {
                ModuleOutcome outcome = neverStarted.contains(module.getName())
                    ? ModuleOutcome.notStarted(module, sinks.get(module.getName()))
                    : collectOutcome(module, outcomes, sinks.get(module.getName()));
                summaries.put(module.getName(), outcome.summary);
                issues.addAll(outcome.issues);
                if (outcome.summary.isTruncated()) {
                    truncated = true;
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return truncated;
    }

    /**
     * Выполнение одного модуля в рабочем потоке
     */
    ModuleOutcome runModule(DiscoveryModule module, DiscoveryDeadline deadline, ModuleSink sink) {
        long started = System.nanoTime();
        String name = module.getName();
        log.debug("Запуск модуля: {}", name);
        try (ObservationStream stream = module.discover(config, deadline)) {
            boolean stoppedByBudget = false;
            while (stream.hasNext()) {
                if (!sink.offer(stream.next())) {
                    stoppedByBudget = true;
                    break;
                }
            }
            boolean partial = stream.isPartial() || stoppedByBudget;
            if (!sink.publish()) {
                // Запечатан оркестратором: результат уже учтен как ABANDONED
                return ModuleOutcome.abandoned(module, elapsed(started));
            }
            ModuleRunSummary summary = ModuleRunSummary.builder()
                .moduleName(name)
                .method(module.getMethod())
                .status(partial ? ModuleStatus.PARTIAL : ModuleStatus.COMPLETED)
                .observationCount(sink.size())
                .duration(elapsed(started))
                .truncated(partial)
                .reason(partial ? (stoppedByBudget ? "Бюджет прогона исчерпан" : "Истек дедлайн модуля") : null)
                .build();
            List<RunIssue> issues = new ArrayList<>();
            if (partial && !stoppedByBudget) {
                log.warn("Модуль {} остановлен по дедлайну, сохранено {} наблюдений", name, sink.size());
                issues.add(RunIssue.of(ErrorKind.MODULE_TIMEOUT, name,
                    "Дедлайн истек, результат частичный (" + sink.size() + " наблюдений)"));
            } else {
                log.debug("{} завершен. Найдено: {}", name, sink.size());
            }
            return new ModuleOutcome(summary, issues);
        } catch (ModuleUnavailableException e) {
            log.warn("Модуль {} недоступен: {}", name, e.getMessage());
            sink.sealIfUnpublished();
            return new ModuleOutcome(
                ModuleRunSummary.skipped(name, module.getMethod(), e.getMessage()),
                List.of(RunIssue.of(ErrorKind.MODULE_UNAVAILABLE, name, e.getMessage())));
        } catch (RuntimeException e) {
            log.error("Ошибка в модуле {}: {}", name, e.getMessage(), e);
            sink.sealIfUnpublished();
            ModuleRunSummary summary = ModuleRunSummary.builder()
                .moduleName(name)
                .method(module.getMethod())
                .status(ModuleStatus.FAILED)
                .observationCount(0)
                .duration(elapsed(started))
                .truncated(false)
                .reason(e.getClass().getSimpleName() + ": " + e.getMessage())
                .build();
            return new ModuleOutcome(summary,
                List.of(RunIssue.of(ErrorKind.MODULE_FAILED, name, String.valueOf(e.getMessage()))));
        }
    }

    private ModuleOutcome collectOutcome(DiscoveryModule module,
                                         Map<String, ModuleOutcome> outcomes,
                                         ModuleSink sink) {
        ModuleOutcome outcome = outcomes.get(module.getName());
        if (outcome != null) {
            return outcome;
        }
        if (sink.sealIfUnpublished()) {
            log.error("Модуль {} не завершился за период отмены, вывод отброшен", module.getName());
            return ModuleOutcome.abandoned(module, null);
        }
        // Буфер опубликован, но модуль еще не вернул итог
        outcome = outcomes.get(module.getName());
        if (outcome != null) {
            return outcome;
        }
        ModuleRunSummary summary = ModuleRunSummary.builder()
            .moduleName(module.getName())
            .method(module.getMethod())
            .status(ModuleStatus.PARTIAL)
            .observationCount(sink.size())
            .truncated(true)
            .reason("Итог модуля не получен до окончания периода отмены")
            .build();
        return new ModuleOutcome(summary, List.of(RunIssue.of(ErrorKind.MODULE_TIMEOUT, module.getName(),
            summary.getReason())));
    }

    private ModuleAvailability safeAvailability(DiscoveryModule module) {
        try {
            ModuleAvailability availability = module.checkAvailability(config);
            return availability != null ? availability : ModuleAvailability.available();
        } catch (RuntimeException e) {
            log.warn("Проверка доступности {} упала: {}", module.getName(), e.getMessage());
            return ModuleAvailability.unavailable("Проверка доступности завершилась ошибкой: " + e.getMessage());
        }
    }

    private static boolean awaitQuietly(CountDownLatch latch, Duration timeout) {
        try {
            return latch.await(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return latch.getCount() == 0;
        }
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "discovery-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public List<DiscoveryModule> getAcceptedModules() {
        return List.copyOf(accepted);
    }

    static final class ModuleOutcome {
        private final ModuleRunSummary summary;
        private final List<RunIssue> issues;

        ModuleOutcome(ModuleRunSummary summary, List<RunIssue> issues) {
            this.summary = summary;
            this.issues = issues;
        }

        static ModuleOutcome notStarted(DiscoveryModule module, ModuleSink sink) {
            sink.sealIfUnpublished();
            String reason = "Бюджет прогона исчерпан до запуска модуля";
            log.warn("Модуль {} не запускался: {}", module.getName(), reason);
            return new ModuleOutcome(
                ModuleRunSummary.skipped(module.getName(), module.getMethod(), reason),
                List.of(RunIssue.of(ErrorKind.MODULE_TIMEOUT, module.getName(), reason)));
        }

        static ModuleOutcome abandoned(DiscoveryModule module, Duration duration) {
            String reason = "Не завершился за период отмены, вывод отброшен";
            ModuleRunSummary summary = ModuleRunSummary.builder()
                .moduleName(module.getName())
                .method(module.getMethod())
                .status(ModuleStatus.ABANDONED)
                .observationCount(0)
                .duration(duration)
                .truncated(true)
                .reason(reason)
                .build();
            return new ModuleOutcome(summary, List.of(RunIssue.of(ErrorKind.MODULE_TIMEOUT, module.getName(), reason)));
        }

        List<RunIssue> getIssues() {
            return issues;
        }

        ModuleRunSummary getSummary() {
            return summary;
        }
    }
}
