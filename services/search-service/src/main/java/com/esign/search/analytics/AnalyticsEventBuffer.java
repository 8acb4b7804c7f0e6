package com.esign.search.analytics;

import com.esign.search.model.SearchAnalyticsEvent;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Buffers search events in memory and writes them to the {@link AnalyticsStore} in batches,
 * either when the batch size is reached or on the flush interval. Flushing swaps the buffer
 * under the lock, so an event is written by exactly one flush. A failed batch is put back in
 * front of newer events, and until a flush succeeds again only the timer retries.
 */
@Component
public class AnalyticsEventBuffer {
    private static final Logger log = LoggerFactory.getLogger(AnalyticsEventBuffer.class);
    private static final Duration PURGE_INTERVAL = Duration.ofHours(1);

    private final AnalyticsStore store;
    private final AnalyticsProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final ThreadPoolTaskScheduler scheduler;
    private final Object lock = new Object();
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    private List<SearchAnalyticsEvent> buffer = new ArrayList<>();
    private boolean running;
    private volatile boolean lastFlushFailed;

    public AnalyticsEventBuffer(
        AnalyticsStore store,
        AnalyticsProperties properties,
        MeterRegistry meterRegistry,
        Clock clock,
        @Qualifier("analyticsTaskScheduler") ThreadPoolTaskScheduler scheduler
    ) {
        this.store = store;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.scheduler = scheduler;
        meterRegistry.gauge("search_analytics_buffered_events", this, AnalyticsEventBuffer::size);
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            Duration interval = properties.getFlushInterval().toMillis() < 1
                ? Duration.ofMillis(1)
                : properties.getFlushInterval();
            Instant now = scheduler.getClock().instant();
            timers.add(scheduler.scheduleWithFixedDelay(this::flush, now.plus(interval), interval));
            timers.add(scheduler.scheduleWithFixedDelay(this::purgeExpired, now.plus(PURGE_INTERVAL), PURGE_INTERVAL));
            running = true;
        }
        log.info("analytics buffer started batchSize={} flushIntervalMs={}",
            properties.getBatchSize(), properties.getFlushInterval().toMillis());
    }

    /**
     * Cancels the timers and makes one last flush attempt, waiting at most the shutdown timeout.
     */
    public void stop() {
        boolean wasRunning;
        synchronized (lock) {
            wasRunning = running;
            running = false;
            timers.forEach(timer -> timer.cancel(false));
            timers.clear();
        }
        if (!wasRunning) {
            flush();
            return;
        }
        Future<?> finalFlush;
        try {
            finalFlush = scheduler.submit(this::flush);
        } catch (RejectedExecutionException e) {
            flush();
            log.info("analytics buffer stopped");
            return;
        }
        try {
            finalFlush.get(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("analytics final flush timed out pending={}", size());
            finalFlush.cancel(true);
        } catch (ExecutionException e) {
            log.warn("analytics final flush failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("analytics buffer stopped");
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    public void append(SearchAnalyticsEvent event) {
        boolean full;
        synchronized (lock) {
            buffer.add(event);
            full = buffer.size() >= Math.max(1, properties.getBatchSize());
        }
        if (full && !lastFlushFailed) {
            requestFlush();
        }
    }

    /**
     * Runs analytics side work off the caller's thread while the buffer is running, inline
     * otherwise.
     */
    public void runInBackground(String taskName, Runnable task) {
        if (!isRunning()) {
            task.run();
            return;
        }
        try {
            scheduler.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("analytics background task failed task={}", taskName, e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("analytics background task rejected task={}", taskName);
        }
    }

    public Optional<SearchAnalyticsEvent> findBuffered(String eventId) {
        synchronized (lock) {
            return buffer.stream().filter(event -> event.getId().equals(eventId)).findFirst();
        }
    }

    public int size() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    /**
     * Returns the number of events written.
     */
    public int flush() {
        List<SearchAnalyticsEvent> batch;
        synchronized (lock) {
            if (buffer.isEmpty()) {
                return 0;
            }
            batch = buffer;
            buffer = new ArrayList<>();
        }
        try {
            store.saveEvents(batch);
        } catch (RuntimeException e) {
            synchronized (lock) {
                List<SearchAnalyticsEvent> requeued = new ArrayList<>(batch);
                requeued.addAll(buffer);
                buffer = requeued;
            }
            lastFlushFailed = true;
            meterRegistry.counter("search_analytics_flush_total", "result", "failure").increment();
            log.warn("analytics flush failed, batch requeued size={}", batch.size(), e);
            return 0;
        }
        lastFlushFailed = false;
        meterRegistry.counter("search_analytics_flush_total", "result", "success").increment();
        log.debug("analytics flush events={}", batch.size());
        return batch.size();
    }

    private void requestFlush() {
        if (!isRunning()) {
            flush();
            return;
        }
        try {
            scheduler.execute(this::flush);
        } catch (RejectedExecutionException e) {
            log.warn("analytics flush rejected, events stay buffered pending={}", size());
        }
    }

    private void purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(properties.getRetentionDays()));
        try {
            int removed = store.deleteBefore(cutoff);
            if (removed > 0) {
                log.info("analytics retention purge removed={} cutoff={}", removed, cutoff);
            }
        } catch (RuntimeException e) {
            log.warn("analytics retention purge failed", e);
        }
    }
}
