package com.kotsin.aggregation.batch;

import com.kotsin.aggregation.config.ProcessingOptions;
import com.kotsin.aggregation.event.Subscription;
import com.kotsin.aggregation.exception.BatchingException;
import com.kotsin.aggregation.exception.RecordValidationException;
import com.kotsin.aggregation.exception.ResourceCleanupException;
import com.kotsin.aggregation.exception.TransientProcessingException;
import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.RecordBatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a stream of single records into bounded, stamped batches.
 *
 * Flow:
 * 1. {@link #accept} buffers the record; reaching the flush threshold starts a flush cycle
 * 2. A cycle drains up to {@code batchSize} records and splits them into {@code fanOut} sub-chunks
 * 3. Sub-chunks are stamped concurrently on the chunk executor
 * 4. The combined batch is handed to every subscribed {@link BatchListener}
 *
 * Only one cycle runs at a time per instance, on the producing thread, so a slow
 * listener slows its producer. Another producer arriving while a cycle is in
 * flight leaves its record buffered for the next cycle. Once the buffer backed up
 * behind the in-flight cycle reaches {@code highWaterMark}, that producer waits
 * for the cycle to finish and then flushes itself.
 *
 * Order is preserved inside a sub-chunk; sub-chunks are appended as they complete.
 */
@Slf4j
public class RecordBatcher implements AutoCloseable {

    private final String name;
    private final ProcessingOptions options;
    private final Executor chunkExecutor;
    private final Clock clock;
    private final RecordStamper stamper;
    private final BackpressureMonitor backpressure;

    // guarded by itself
    private final Deque<DataRecord> buffer = new ArrayDeque<>();

    private final Semaphore flushPermit = new Semaphore(1);
    private volatile Thread flushingThread;

    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<AutoCloseable> trackedHandles = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean released = new AtomicBoolean(false);

    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicLong recordsEmitted = new AtomicLong(0);
    private final AtomicLong chunkFailures = new AtomicLong(0);

    public RecordBatcher(String name, ProcessingOptions options, Executor chunkExecutor) {
        this(name, options, chunkExecutor, Clock.systemUTC(), RecordStamper.TIMESTAMP);
    }

    public RecordBatcher(String name, ProcessingOptions options, Executor chunkExecutor,
                         Clock clock, RecordStamper stamper) {
        this.name = name;
        this.options = options;
        this.chunkExecutor = chunkExecutor;
        this.clock = clock;
        this.stamper = stamper;
        this.backpressure = new BackpressureMonitor(options.getHighWaterMark());
    }

    /**
     * Buffers a record and triggers a flush cycle once the threshold is reached.
     *
     * @throws RecordValidationException if {@code record} is null
     * @throws BatchingException if the batcher was released or a listener failed
     */
    public void accept(DataRecord record) {
        ensureOpen();
        if (record == null) {
            throw new RecordValidationException("Batcher '" + name + "' received a null record");
        }

        int depth;
        synchronized (buffer) {
            buffer.addLast(record);
            depth = buffer.size();
        }

        if (depth >= flushThreshold() && !tryFlush() && backpressure.shouldApplyBackpressure(bufferedCount())) {
            flushBlocking();
        }
    }

    /**
     * Drains the whole buffer, one cycle at a time, including a final partial batch.
     */
    public void flushAll() {
        if (Thread.currentThread() == flushingThread) {
            // called from a listener; the running cycle loop drains the rest
            return;
        }
        while (!released.get() && bufferedCount() > 0) {
            acquirePermit();
            flushingThread = Thread.currentThread();
            try {
                flushCycle();
            } finally {
                flushingThread = null;
                flushPermit.release();
            }
        }
    }

    public Subscription subscribe(BatchListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Registers an upstream handle that is closed when this batcher is released.
     */
    public void track(AutoCloseable handle) {
        ensureOpen();
        trackedHandles.add(handle);
    }

    public void untrack(AutoCloseable handle) {
        trackedHandles.remove(handle);
    }

    /**
     * Closes tracked handles, drops buffered records and detaches all listeners.
     * Idempotent.
     */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }

        int dropped;
        synchronized (buffer) {
            dropped = buffer.size();
            buffer.clear();
        }

        for (AutoCloseable handle : trackedHandles) {
            try {
                handle.close();
            } catch (Exception e) {
                log.warn("[{}] Failed to close tracked handle {}", name, handle,
                        new ResourceCleanupException("Handle close failed", e));
            }
        }
        trackedHandles.clear();
        listeners.clear();
        backpressure.shouldApplyBackpressure(0);

        log.info("[{}] Batcher released: droppedRecords={}, batchesEmitted={}, {}",
                name, dropped, sequence.get(), backpressure.getBackpressureStats());
    }

    @Override
    public void close() {
        release();
    }

    public int bufferedCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    public long getBatchesEmitted() {
        return sequence.get();
    }

    public long getRecordsEmitted() {
        return recordsEmitted.get();
    }

    public long getChunkFailures() {
        return chunkFailures.get();
    }

    public boolean isReleased() {
        return released.get();
    }

    public BackpressureMonitor getBackpressure() {
        return backpressure;
    }

    public String getName() {
        return name;
    }

    /**
     * Splits {@code records} into {@code min(fanOut, size)} contiguous chunks whose
     * sizes differ by at most one.
     */
    static <T> List<List<T>> partition(List<T> records, int fanOut) {
        int chunkCount = Math.min(fanOut, records.size());
        List<List<T>> chunks = new ArrayList<>(chunkCount);
        if (chunkCount == 0) {
            return chunks;
        }
        int base = records.size() / chunkCount;
        int remainder = records.size() % chunkCount;
        int from = 0;
        for (int i = 0; i < chunkCount; i++) {
            int to = from + base + (i < remainder ? 1 : 0);
            chunks.add(records.subList(from, to));
            from = to;
        }
        return chunks;
    }

    private int flushThreshold() {
        return Math.min(options.getBatchSize(), options.getHighWaterMark());
    }

    /**
     * @return {@code false} if another cycle was in flight and nothing was flushed
     */
    private boolean tryFlush() {
        if (Thread.currentThread() == flushingThread || !flushPermit.tryAcquire()) {
            log.debug("[{}] Flush in progress, deferring {} buffered records", name, bufferedCount());
            return false;
        }
        runFlushCycles();
        return true;
    }

    private void flushBlocking() {
        if (Thread.currentThread() == flushingThread) {
            return;
        }
        acquirePermit();
        runFlushCycles();
    }

    /** Caller must hold the flush permit. */
    private void runFlushCycles() {
        flushingThread = Thread.currentThread();
        try {
            do {
                flushCycle();
            } while (!released.get() && bufferedCount() >= flushThreshold());
        } finally {
            flushingThread = null;
            flushPermit.release();
        }
    }

    private void acquirePermit() {
        try {
            flushPermit.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchingException("Interrupted while waiting for in-flight flush on '" + name + "'", e);
        }
    }

    private void flushCycle() {
        List<DataRecord> drained = drain(options.getBatchSize());
        backpressure.shouldApplyBackpressure(bufferedCount());
        if (drained.isEmpty()) {
            return;
        }

        long batchSequence = sequence.get() + 1;
        List<List<DataRecord>> chunks = partition(drained, options.getFanOut());
        List<DataRecord> processed = Collections.synchronizedList(new ArrayList<>(drained.size()));
        AtomicInteger failed = new AtomicInteger(0);

        List<CompletableFuture<Void>> pending = new ArrayList<>(chunks.size());
        for (List<DataRecord> chunk : chunks) {
            try {
                pending.add(CompletableFuture
                        .supplyAsync(() -> processChunk(chunk), chunkExecutor)
                        .thenAccept(processed::addAll)
                        .exceptionally(ex -> {
                            failed.incrementAndGet();
                            chunkFailures.incrementAndGet();
                            log.error("[{}] Sub-chunk of {} records failed in batch {}, continuing with the rest",
                                    name, chunk.size(), batchSequence,
                                    new TransientProcessingException("Sub-chunk processing failed", ex));
                            return null;
                        }));
            } catch (RejectedExecutionException e) {
                throw new BatchingException("Chunk executor rejected work for '" + name + "'", e);
            }
        }
        CompletableFuture.allOf(pending.toArray(new CompletableFuture[0])).join();

        if (processed.isEmpty()) {
            log.warn("[{}] All {} sub-chunks of batch {} failed, nothing emitted", name, chunks.size(), batchSequence);
            return;
        }

        RecordBatch batch = RecordBatch.builder()
                .sequence(sequence.incrementAndGet())
                .records(new ArrayList<>(processed))
                .chunkCount(chunks.size())
                .failedChunks(failed.get())
                .emittedAt(clock.millis())
                .build();
        recordsEmitted.addAndGet(batch.size());
        backpressure.recordProcessed(batch.size());

        log.debug("[{}] Emitting batch {}: records={}, chunks={}, failedChunks={}",
                name, batch.getSequence(), batch.size(), batch.getChunkCount(), batch.getFailedChunks());
        emit(batch);
    }

    private List<DataRecord> processChunk(List<DataRecord> chunk) {
        List<DataRecord> stamped = new ArrayList<>(chunk.size());
        for (DataRecord record : chunk) {
            stamped.add(stamper.stamp(record, clock.millis()));
        }
        return stamped;
    }

    private List<DataRecord> drain(int max) {
        synchronized (buffer) {
            int n = Math.min(max, buffer.size());
            List<DataRecord> drained = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                drained.add(buffer.pollFirst());
            }
            return drained;
        }
    }

    private void emit(RecordBatch batch) {
        for (BatchListener listener : listeners) {
            try {
                listener.onBatch(batch);
            } catch (RuntimeException e) {
                throw new BatchingException("Downstream consumer of '" + name + "' failed on batch " + batch.getSequence(), e);
            }
        }
    }

    private void ensureOpen() {
        if (released.get()) {
            throw new BatchingException("Batcher '" + name + "' has been released");
        }
    }
}
