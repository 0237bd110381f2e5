package com.vtb.discovery.core;

import com.vtb.discovery.models.CandidateObservation;

import java.util.ArrayList;
import java.util.List;

/**
 * Локальный буфер одного модуля. После seal() все новые наблюдения
 * отбрасываются, а накопленные никогда не попадут в коллектор.
 */
public final class ModuleSink {

    private final String moduleName;
    private final ObservationCollector collector;
    private final List<CandidateObservation> buffer = new ArrayList<>();
    private boolean sealed;
    private boolean published;
    private boolean budgetHit;

    ModuleSink(String moduleName, ObservationCollector collector) {
        this.moduleName = moduleName;
        this.collector = collector;
    }

    /**
     * @return false, если приемник закрыт или бюджет исчерпан; модуль должен остановиться
     */
    public synchronized boolean offer(CandidateObservation observation) {
        if (sealed || published) {
            return false;
        }
        if (!collector.reserve(moduleName)) {
            budgetHit = true;
            return false;
        }
        buffer.add(observation);
        return true;
    }

    /**
     * Опубликовать буфер. false - приемник уже запечатан, вывод отброшен.
     */
    public synchronized boolean publish() {
        if (sealed) {
            return false;
        }
        if (!published) {
            published = true;
            collector.publish(buffer);
        }
        return true;
    }

    /**
     * Запечатать неопубликованный буфер.
     *
     * @return true, если буфер был отброшен; false, если модуль уже успел опубликовать результат
     */
    public synchronized boolean sealIfUnpublished() {
        if (published) {
            return false;
        }
        if (!sealed) {
            sealed = true;
            collector.release(buffer.size());
            buffer.clear();
        }
        return true;
    }

    public synchronized int size() {
        return buffer.size();
    }

    public synchronized boolean isBudgetHit() {
        return budgetHit;
    }

    public String getModuleName() {
        return moduleName;
    }
}
