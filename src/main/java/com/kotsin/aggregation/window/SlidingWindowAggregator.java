package com.kotsin.aggregation.window;

import com.kotsin.aggregation.config.ProcessingOptions;
import com.kotsin.aggregation.event.Subscription;
import com.kotsin.aggregation.exception.TransientProcessingException;
import com.kotsin.aggregation.model.AggregationResult;
import com.kotsin.aggregation.model.DataRecord;
import com.kotsin.aggregation.model.GroupStatistics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maintains overlapping time windows and periodically emits grouped statistics.
 *
 * Windows start at multiples of the sliding interval and span {@code windowSize}.
 * Every record is copied into each window whose span {@code [start, start + windowSize)}
 * covers the current instant. Every sliding interval the tick re-aggregates each
 * window at least one interval old and emits a growing snapshot until the window
 * ages out and is evicted.
 *
 * Lifecycle: {@link #start()} schedules the tick, {@link #stop()} cancels it, discards
 * all windows and detaches subscribers. Nothing is emitted once {@code stop()} returns.
 */
@Slf4j
public class SlidingWindowAggregator implements AutoCloseable {

    private final long windowSize;
    private final long slidingInterval;
    private final int maxWindows;
    private final Clock clock;

    // guarded by itself
    private final NavigableMap<Long, TimeWindow> windows = new TreeMap<>();
    private long lastCleanup;

    private final AtomicBoolean processing = new AtomicBoolean(false);
    private final ReentrantLock tickLock = new ReentrantLock();
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final List<AggregationListener> listeners = new CopyOnWriteArrayList<>();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> timer;

    private final AtomicLong emittedResults = new AtomicLong(0);
    private final AtomicLong evictedWindows = new AtomicLong(0);

    public SlidingWindowAggregator(ProcessingOptions options) {
        this(options, Clock.systemUTC());
    }

    public SlidingWindowAggregator(ProcessingOptions options, Clock clock) {
        this.windowSize = options.windowSizeMs();
        this.slidingInterval = options.slidingIntervalMs();
        this.maxWindows = options.maxWindows();
        this.clock = clock;
        this.lastCleanup = clock.millis();
    }

    /**
     * Schedules the aggregation tick every sliding interval. No-op if already started.
     */
    public synchronized void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Aggregator has been stopped");
        }
        if (timer != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "window-aggregator-tick");
            t.setDaemon(true);
            return t;
        });
        timer = scheduler.scheduleAtFixedRate(this::processWindows,
                slidingInterval, slidingInterval, TimeUnit.MILLISECONDS);
        log.info("Window aggregator started: windowSize={}ms, slidingInterval={}ms, maxWindows={}",
                windowSize, slidingInterval, maxWindows);
    }

    /**
     * Copies {@code record} into every window covering the current instant.
     */
    public void addRecord(DataRecord record) {
        Objects.requireNonNull(record, "record");
        if (stopped.get()) {
            throw new IllegalStateException("Aggregator has been stopped");
        }

        long now = clock.millis();
        long windowStart = alignToInterval(now);

        synchronized (windows) {
            for (int i = 0; i < maxWindows; i++) {
                long windowTime = windowStart - i * slidingInterval;
                if (now - windowTime < windowSize) {
                    windows.computeIfAbsent(windowTime, TimeWindow::new).add(record.copy());
                }
            }
            evictIfDue(now);
        }
    }

    /**
     * One aggregation tick. Skipped entirely if the previous tick is still running.
     */
    public void processWindows() {
        if (stopped.get() || !processing.compareAndSet(false, true)) {
            return;
        }

        tickLock.lock();
        try {
            long now = clock.millis();
            List<TimeWindow> due = new ArrayList<>();
            List<List<DataRecord>> snapshots = new ArrayList<>();

            synchronized (windows) {
                evictIfDue(now);
                for (TimeWindow window : windows.descendingMap().values()) {
                    long age = window.ageAt(now);
                    if (age >= slidingInterval && age <= windowSize) {
                        due.add(window);
                        snapshots.add(window.snapshot());
                    }
                }
            }

            for (int i = 0; i < due.size(); i++) {
                if (stopped.get()) {
                    break;
                }
                processWindow(due.get(i).getStartTime(), snapshots.get(i));
            }
        } finally {
            tickLock.unlock();
            processing.set(false);
        }
    }

    public Subscription subscribe(AggregationListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Cancels the tick, discards every window and detaches all subscribers. Idempotent.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        synchronized (this) {
            if (timer != null) {
                timer.cancel(false);
                timer = null;
            }
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }

        // wait for an in-flight tick so nothing is emitted after we return
        tickLock.lock();
        try {
            synchronized (windows) {
                windows.clear();
            }
            listeners.clear();
        } finally {
            tickLock.unlock();
        }
        log.info("Window aggregator stopped: emittedResults={}, evictedWindows={}",
                emittedResults.get(), evictedWindows.get());
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public int getWindowCount() {
        synchronized (windows) {
            return windows.size();
        }
    }

    /**
     * Start times of the tracked windows, ascending.
     */
    public List<Long> getWindowStartTimes() {
        synchronized (windows) {
            return new ArrayList<>(windows.keySet());
        }
    }

    /**
     * Records currently held by the window starting at {@code startTime}; empty if none.
     */
    public List<DataRecord> getWindowRecords(long startTime) {
        synchronized (windows) {
            TimeWindow window = windows.get(startTime);
            return window == null ? List.of() : window.snapshot();
        }
    }

    public long getEvictedWindows() {
        return evictedWindows.get();
    }

    long alignToInterval(long timestamp) {
        return Math.floorDiv(timestamp, slidingInterval) * slidingInterval;
    }

    private void processWindow(long startTime, List<DataRecord> records) {
        if (records.isEmpty()) {
            return;
        }

        AggregationResult result;
        try {
            Map<String, GroupStatistics> groups = GroupStatisticsCalculator.aggregate(records);
            result = new AggregationResult(startTime, records.size(), groups);
        } catch (RuntimeException e) {
            log.error("Error processing window {}", startTime,
                    new TransientProcessingException("Window aggregation failed", e));
            return;
        }

        log.debug("Aggregation result: window={}, count={}, groups={}",
                startTime, result.getCount(), result.getData().size());
        emittedResults.incrementAndGet();
        for (AggregationListener listener : listeners) {
            try {
                listener.onAggregation(result);
            } catch (RuntimeException e) {
                log.error("Aggregation listener failed for window {}", startTime,
                        new TransientProcessingException("Listener failed", e));
            }
        }
    }

    /** Caller must hold the windows lock. */
    private void evictIfDue(long now) {
        if (now - lastCleanup <= windowSize) {
            return;
        }
        long cutoff = now - windowSize;
        NavigableMap<Long, TimeWindow> expired = windows.headMap(cutoff, false);
        int removed = expired.size();
        expired.clear();
        lastCleanup = now;

        if (removed > 0) {
            evictedWindows.addAndGet(removed);
            log.debug("Evicted {} windows older than {}", removed, cutoff);
        }
    }
}
