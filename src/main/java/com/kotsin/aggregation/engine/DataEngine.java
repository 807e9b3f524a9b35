package com.kotsin.aggregation.engine;

import com.kotsin.aggregation.batch.BatchListener;
import com.kotsin.aggregation.batch.RecordBatcher;
import com.kotsin.aggregation.batch.RecordStamper;
import com.kotsin.aggregation.config.ProcessingConstants;
import com.kotsin.aggregation.config.ProcessingOptions;
import com.kotsin.aggregation.event.Subscription;
import com.kotsin.aggregation.exception.SourceDecodeException;
import com.kotsin.aggregation.metrics.StreamMetrics;
import com.kotsin.aggregation.model.AggregationResult;
import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.EngineStatus;
import com.kotsin.aggregation.model.RecordBatch;
import com.kotsin.aggregation.model.SourceReport;
import com.kotsin.aggregation.source.RecordSource;
import com.kotsin.aggregation.util.RecordValidator;
import com.kotsin.aggregation.window.SlidingWindowAggregator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wires record sources into a per-source {@link RecordBatcher} and the shared
 * {@link SlidingWindowAggregator}, and keeps an ordered log of every aggregation result.
 *
 * Sources are processed concurrently, each in its own session. A failing source
 * tears down only its own session; its earlier records stay in the shared windows
 * and results already logged are kept. Callers inspect each
 * {@link #processSource} future independently.
 */
@Slf4j
public class DataEngine implements AutoCloseable {

    private final ProcessingOptions options;
    private final SlidingWindowAggregator aggregator;
    private final Executor sourceExecutor;
    private final Executor chunkExecutor;
    private final Clock clock;
    private final List<ExecutorService> ownedExecutors;

    private final StreamMetrics metrics = new StreamMetrics();
    private final List<AggregationResult> results = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, SourceSession> sessions = new ConcurrentHashMap<>();
    private final List<BatchListener> batchListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sessionCounter = new AtomicLong(0);
    private final AtomicBoolean cleanedUp = new AtomicBoolean(false);
    private final Subscription resultSubscription;

    /**
     * Self-contained engine: owns its executors and starts the aggregation tick.
     */
    public DataEngine(ProcessingOptions options) {
        this(options, Clock.systemUTC(),
                Executors.newCachedThreadPool(daemonThreads("source-worker-")),
                Executors.newFixedThreadPool(options.getFanOut(), daemonThreads("chunk-worker-")));
    }

    private DataEngine(ProcessingOptions options, Clock clock, ExecutorService sourcePool, ExecutorService chunkPool) {
        this(options, new SlidingWindowAggregator(options, clock), sourcePool, chunkPool, clock,
                List.of(sourcePool, chunkPool));
        aggregator.start();
    }

    /**
     * Engine over caller-supplied collaborators. The caller owns the executors and
     * decides when the aggregator's tick is started.
     */
    public DataEngine(ProcessingOptions options, SlidingWindowAggregator aggregator,
                      Executor sourceExecutor, Executor chunkExecutor, Clock clock) {
        this(options, aggregator, sourceExecutor, chunkExecutor, clock, List.of());
    }

    private DataEngine(ProcessingOptions options, SlidingWindowAggregator aggregator,
                       Executor sourceExecutor, Executor chunkExecutor, Clock clock,
                       List<ExecutorService> ownedExecutors) {
        this.options = Objects.requireNonNull(options, "options");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.sourceExecutor = Objects.requireNonNull(sourceExecutor, "sourceExecutor");
        this.chunkExecutor = Objects.requireNonNull(chunkExecutor, "chunkExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ownedExecutors = ownedExecutors;
        this.resultSubscription = aggregator.subscribe(this::handleAggregationResult);
        log.info("DataEngine initialized: {}", options);
    }

    /**
     * Processes one source asynchronously.
     *
     * The future completes with a {@link SourceReport} at end-of-input, or exceptionally
     * with the fatal cause: {@link SourceDecodeException} (including a source that
     * produced no records), {@link com.kotsin.aggregation.exception.RecordValidationException}
     * or {@link com.kotsin.aggregation.exception.BatchingException}.
     */
    public CompletableFuture<SourceReport> processSource(RecordSource source) {
        Objects.requireNonNull(source, "source");
        if (cleanedUp.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Engine has been cleaned up"));
        }

        String sessionId = source.getName() + "#" + sessionCounter.incrementAndGet();
        RecordBatcher batcher = new RecordBatcher(sessionId, options, chunkExecutor, clock, RecordStamper.TIMESTAMP);
        batcher.subscribe(this::dispatchBatch);
        SourceSession session = new SourceSession(sessionId, source, batcher, clock.millis());
        sessions.put(sessionId, session);

        CompletableFuture<SourceReport> completion;
        try {
            completion = CompletableFuture.supplyAsync(() -> runSession(session), sourceExecutor);
        } catch (RejectedExecutionException e) {
            session.abort(e);
            sessions.remove(sessionId);
            return CompletableFuture.failedFuture(e);
        }

        return completion.whenComplete((report, error) -> {
            sessions.remove(sessionId);
            if (error != null) {
                metrics.incSourceFailed();
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                log.warn("❌ Source '{}' failed after {} records: {}",
                        sessionId, session.getRecordsProcessed().get(), cause.getMessage());
            } else {
                metrics.incSourceSucceeded();
                log.info("✅ Source '{}' completed: records={}, batches={}, duration={}ms",
                        sessionId, report.getRecordsProcessed(), report.getBatchesEmitted(), report.getDurationMs());
            }
        });
    }

    /**
     * Ordered snapshot of every aggregation result emitted so far.
     */
    public List<AggregationResult> getResults() {
        synchronized (results) {
            return List.copyOf(results);
        }
    }

    /**
     * Observes batches emitted by any session. A listener that throws fails the
     * session whose batch it was handed.
     */
    public Subscription subscribeBatches(BatchListener listener) {
        batchListeners.add(listener);
        return () -> batchListeners.remove(listener);
    }

    /**
     * Full shutdown: releases every session's buffered state, stops the aggregator
     * (discarding all windows) and clears the result log.
     */
    public void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            results.clear();
            return;
        }
        IllegalStateException reason = new IllegalStateException("Engine cleanup");
        sessions.values().forEach(session -> session.abort(reason));
        resultSubscription.unsubscribe();
        aggregator.stop();
        results.clear();
        log.info("DataEngine cleaned up: {}", metrics.getMetrics());
    }

    /**
     * {@link #cleanup()} plus shutdown of the executors this engine created itself.
     */
    @Override
    public void close() {
        cleanup();
        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(ProcessingConstants.SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public EngineStatus getStatus() {
        return EngineStatus.builder()
                .status(cleanedUp.get() ? "stopped" : "operational")
                .timestamp(clock.millis())
                .aggregationCount(results.size())
                .activeSessions(sessions.size())
                .trackedWindows(aggregator.getWindowCount())
                .metrics(metrics.getMetrics())
                .build();
    }

    public StreamMetrics getMetrics() {
        return metrics;
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public ProcessingOptions getOptions() {
        return options;
    }

    public boolean isCleanedUp() {
        return cleanedUp.get();
    }

    private SourceReport runSession(SourceSession session) {
        RecordSource source = session.getSource();
        RecordBatcher batcher = session.getBatcher();
        try {
            while (source.hasNext()) {
                DataRecord record = RecordValidator.toRecord(source.next());
                batcher.accept(record);
                aggregator.addRecord(record);
                session.recordProcessed();
                metrics.incRecordsIngested();
            }

            if (session.getRecordsProcessed().get() == 0) {
                throw new SourceDecodeException("Source '" + source.getName() + "' produced no records");
            }

            batcher.flushAll();
            long batches = batcher.getBatchesEmitted();
            session.complete();

            return SourceReport.builder()
                    .sourceName(source.getName())
                    .recordsProcessed(session.getRecordsProcessed().get())
                    .batchesEmitted(batches)
                    .durationMs(clock.millis() - session.getStartedAt())
                    .build();
        } catch (RuntimeException e) {
            session.abort(e);
            throw e;
        }
    }

    private void dispatchBatch(RecordBatch batch) {
        metrics.incBatchEmit(batch.size(), batch.getFailedChunks());
        for (BatchListener listener : batchListeners) {
            listener.onBatch(batch);
        }
    }

    private void handleAggregationResult(AggregationResult result) {
        results.add(result);
        metrics.incAggregationEmit();
        log.debug("Aggregation result: {}", result);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
