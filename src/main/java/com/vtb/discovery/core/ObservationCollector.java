package com.vtb.discovery.core;

import com.vtb.discovery.models.CandidateObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Общий append-only приемник наблюдений прогона.
 * Модули пишут в собственные буферы ({@link ModuleSink}), в коллектор буфер
 * публикуется целиком по завершении модуля. Здесь же учитывается глобальный
 * лимит наблюдений и памяти.
 */
@Slf4j
public class ObservationCollector {

    private static final int MEMORY_CHECK_INTERVAL = 1000;

    private final ConcurrentLinkedQueue<CandidateObservation> published = new ConcurrentLinkedQueue<>();
    private final AtomicInteger buffered = new AtomicInteger();
    private final AtomicBoolean budgetExceeded = new AtomicBoolean(false);
    private final int maxObservations;
    private final long maxMemoryBytes;
    private final long baselineHeapBytes;
    private volatile Runnable onBudgetExceeded = () -> { };

    public ObservationCollector(int maxObservations, int maxMemoryUsageMb) {
        this.maxObservations = maxObservations;
        this.maxMemoryBytes = maxMemoryUsageMb * 1024L * 1024L;
        this.baselineHeapBytes = usedHeap();
    }

    public ModuleSink openSink(String moduleName) {
        return new ModuleSink(moduleName, this);
    }

    void setOnBudgetExceeded(Runnable callback) {
        this.onBudgetExceeded = callback != null ? callback : () -> { };
    }

    /**
     * Зарезервировать место под одно наблюдение. false - бюджет исчерпан.
     */
    boolean reserve(String moduleName) {
        if (budgetExceeded.get()) {
            return false;
        }
        int count = buffered.incrementAndGet();
        if (count > maxObservations) {
            buffered.decrementAndGet();
            exceed("лимит наблюдений " + maxObservations + " достигнут модулем " + moduleName);
            return false;
        }
        if (count % MEMORY_CHECK_INTERVAL == 0 && usedHeap() - baselineHeapBytes > maxMemoryBytes) {
            exceed("лимит памяти " + (maxMemoryBytes / (1024 * 1024)) + " МБ превышен");
            return false;
        }
        return true;
    }

    void release(int count) {
        buffered.addAndGet(-count);
    }

    void publish(List<CandidateObservation> observations) {
        published.addAll(observations);
    }

    public boolean isBudgetExceeded() {
        return budgetExceeded.get();
    }

    /**
     * Снимок опубликованных наблюдений
     */
    public List<CandidateObservation> snapshot() {
        return new ArrayList<>(published);
    }

    public int size() {
        return published.size();
    }

    private void exceed(String reason) {
        if (budgetExceeded.compareAndSet(false, true)) {
            log.warn("Бюджет прогона исчерпан: {}. Отменяем модули", reason);
            onBudgetExceeded.run();
        }
    }

    private static long usedHeap() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }
}
