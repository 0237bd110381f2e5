package com.vtb.discovery.modules;

import com.vtb.discovery.models.CandidateObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.NoSuchElementException;

/**
 * Базовый ленивый поток наблюдений.
 * Перед каждым шагом проверяет дедлайн; при истечении поток завершается
 * как частичный, уже выданные наблюдения остаются у потребителя.
 */
@Slf4j
public abstract class AbstractObservationStream implements ObservationStream {

    protected final DiscoveryDeadline deadline;

    private CandidateObservation next;
    private boolean finished;
    private boolean partial;
    private boolean closed;

    protected AbstractObservationStream(DiscoveryDeadline deadline) {
        this.deadline = deadline != null ? deadline : DiscoveryDeadline.unbounded();
    }

    /**
     * Вычислить следующее наблюдение или null, если источник исчерпан.
     * Длинные циклы внутри реализации должны вызывать {@link #deadlineReached()}.
     */
    protected abstract CandidateObservation computeNext();

    /**
     * Освободить ресурсы источника
     */
    protected void release() {
    }

    /**
     * Проверка дедлайна внутри computeNext(). При истечении помечает поток частичным.
     */
    protected final boolean deadlineReached() {
        if (deadline.isExpired() || Thread.currentThread().isInterrupted()) {
            partial = true;
            return true;
        }
        return false;
    }

    @Override
    public final boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }
        if (deadlineReached()) {
            finish();
            return false;
        }
        CandidateObservation computed = computeNext();
        if (computed == null) {
            finish();
            return false;
        }
        next = computed;
        return true;
    }

    @Override
    public final CandidateObservation next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        CandidateObservation result = next;
        next = null;
        return result;
    }

    @Override
    public final boolean isPartial() {
        return partial;
    }

    @Override
    public final void close() {
        if (!closed) {
            closed = true;
            finished = true;
            try {
                release();
            } catch (RuntimeException e) {
                log.warn("Ошибка освобождения ресурсов потока {}: {}", getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void finish() {
        finished = true;
        close();
    }
}
