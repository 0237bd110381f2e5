package com.vtb.discovery.modules;

import com.vtb.discovery.models.CandidateObservation;

import java.util.Iterator;

/**
 * Ленивая конечная последовательность наблюдений одного вызова discover().
 * Повторно не запускается.
 */
public interface ObservationStream extends Iterator<CandidateObservation>, AutoCloseable {

    /**
     * true, если поток остановлен по дедлайну или отмене до естественного конца
     */
    boolean isPartial();

    @Override
    void close();
}
