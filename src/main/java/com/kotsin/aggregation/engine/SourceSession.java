package com.kotsin.aggregation.engine;

import com.kotsin.aggregation.batch.RecordBatcher;
import com.kotsin.aggregation.exception.ResourceCleanupException;
import com.kotsin.aggregation.source.RecordSource;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Transient state of one source while it is processed: its batcher, its
 * source handle and progress counters. Never shared between sources.
 */
@Slf4j
@Getter
class SourceSession {

    enum State { ACTIVE, COMPLETED, FAILED }

    private final String id;
    private final RecordSource source;
    private final RecordBatcher batcher;
    private final long startedAt;
    private final AtomicLong recordsProcessed = new AtomicLong(0);
    private final AtomicReference<State> state = new AtomicReference<>(State.ACTIVE);

    SourceSession(String id, RecordSource source, RecordBatcher batcher, long startedAt) {
        this.id = id;
        this.source = source;
        this.batcher = batcher;
        this.startedAt = startedAt;
        batcher.track(source);
    }

    long recordProcessed() {
        return recordsProcessed.incrementAndGet();
    }

    /**
     * End-of-input reached: close the source, detach it from the batcher, then release the batcher.
     */
    void complete() {
        if (state.compareAndSet(State.ACTIVE, State.COMPLETED)) {
            batcher.untrack(source);
            closeSource();
            batcher.release();
        }
    }

    /**
     * Tears the session down after a fatal error. Buffered records are dropped.
     */
    void abort(Throwable cause) {
        if (state.compareAndSet(State.ACTIVE, State.FAILED)) {
            log.warn("[{}] Tearing down session after failure: {}", id, cause.getMessage());
            batcher.release();
        }
    }

    private void closeSource() {
        try {
            source.close();
        } catch (Exception e) {
            log.warn("[{}] Failed to close source", id, new ResourceCleanupException("Source close failed", e));
        }
    }
}
