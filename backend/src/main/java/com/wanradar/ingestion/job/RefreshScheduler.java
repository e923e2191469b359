package com.wanradar.ingestion.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.wanradar.cache.EntityCache;
import com.wanradar.cache.FreshnessSummary;
import com.wanradar.common.RateLimitStatus;
import com.wanradar.common.RateLimiter;
import com.wanradar.ingestion.adapter.ApiCallResult;
import com.wanradar.ingestion.adapter.SnapshotSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Keeps one telemetry category's cache current. A worker loop on the refresh executor repeats:
 * quota check, snapshot fetch with every batch persisted as it arrives, cache write, then sleeps out the rest
 * of {@code minDelay}.
 * <p>
 * A rate-limited quota (seen on the shared limiter or reported by the fetch) puts the worker in
 * {@link RefreshState#RATE_LIMITED_WAIT}; any other failure is logged and followed by a short backoff.
 * stop() is cooperative: the in-flight request is never aborted, but every sleep polls the stop flag.
 * At most one worker loop exists per scheduler; start() is refused while a stopped worker is still finishing.
 */
@Slf4j
public class RefreshScheduler {

    private final SnapshotSource source;
    private final EntityCache cache;
    private final RateLimiter rateLimiter;
    private final Supplier<Set<String>> knownEntityIds;
    private final RefreshSettings settings;
    private final Clock clock;
    private final RefreshListener listener;
    private final Executor executor;

    private volatile Worker worker;
    private volatile RefreshState state = RefreshState.IDLE;
    private volatile boolean initialCoverageComplete;
    private volatile Instant lastCycleCompletedAt;

    private final AtomicLong cyclesRun = new AtomicLong();
    private final AtomicLong totalEntitiesRefreshed = new AtomicLong();
    private final AtomicInteger coverageTransitions = new AtomicInteger();

    /** Stop token and completion signal of one worker loop. */
    private static final class Worker {

        private volatile boolean active;
        private final CountDownLatch done = new CountDownLatch(1);

        private Worker(boolean active) {
            this.active = active;
        }

        boolean isFinished() {
            return done.getCount() == 0;
        }
    }

    public RefreshScheduler(
            SnapshotSource source,
            EntityCache cache,
            RateLimiter rateLimiter,
            Supplier<Set<String>> knownEntityIds,
            RefreshSettings settings,
            Clock clock,
            RefreshListener listener,
            Executor executor
    ) {
        this.source = source;
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.knownEntityIds = knownEntityIds;
        this.settings = settings;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.listener = listener != null ? listener : RefreshListener.NONE;
        this.executor = executor;
    }

    public String category() {
        return source.category();
    }

    public synchronized void start() {
        Worker previous = worker;
        if (previous != null && previous.active) {
            log.warn("Refresh scheduler {} already running", category());
            return;
        }
        if (previous != null && !previous.isFinished()) {
            log.warn("Refresh scheduler {} not started: the previous worker is still finishing an upstream call",
                    category());
            return;
        }
        Worker next = new Worker(true);
        worker = next;
        state = RefreshState.IDLE;
        try {
            executor.execute(() -> runLoop(next));
        } catch (RejectedExecutionException e) {
            next.active = false;
            next.done.countDown();
            state = RefreshState.STOPPED;
            throw new IllegalStateException("Refresh executor rejected the " + category() + " worker", e);
        }
        log.info("Refresh scheduler {} started (min delay {}s, max age {}s)",
                category(), settings.minDelay().toSeconds(), settings.maxAge().toSeconds());
    }

    /**
     * Signals the worker and waits up to the configured stop timeout for it to finish its current step.
     */
    public synchronized void stop() {
        Worker current = worker;
        if (current == null || !current.active) {
            return;
        }
        current.active = false;
        try {
            if (!current.done.await(settings.stopTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Refresh scheduler {} still finishing an upstream call after {}s",
                        category(), settings.stopTimeout().toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        state = RefreshState.STOPPED;
        log.info("Refresh scheduler {} stopped (cycles: {}, entities refreshed: {})",
                category(), cyclesRun.get(), totalEntitiesRefreshed.get());
    }

    public boolean isRunning() {
        Worker current = worker;
        return current != null && current.active;
    }

    public RefreshSchedulerStatus getStatus() {
        RateLimitStatus quota = rateLimiter.getStatus();
        return new RefreshSchedulerStatus(
                category(),
                isRunning(),
                state,
                initialCoverageComplete ? RefreshMode.HEARTBEAT : RefreshMode.PROGRESS,
                cyclesRun.get(),
                totalEntitiesRefreshed.get(),
                initialCoverageComplete,
                quota.limited(),
                quota,
                source.progress(),
                lastCycleCompletedAt);
    }

    /** Times the initial-coverage milestone has fired; at most 1. */
    int coverageTransitions() {
        return coverageTransitions.get();
    }

    private void runLoop(Worker self) {
        try {
            while (self.active && !Thread.currentThread().isInterrupted()) {
                try {
                    runCycle(self);
                } catch (RuntimeException e) {
                    log.error("Refresh cycle for {} failed", category(), e);
                    state = RefreshState.IDLE;
                    sleepWhileActive(self, settings.errorBackoff());
                }
            }
            state = RefreshState.STOPPED;
        } finally {
            self.done.countDown();
        }
    }

    /**
     * One pass of the loop with no worker behind it: every sleep returns at once. Lets tests drive cycles directly.
     */
    void runCycle() {
        runCycle(new Worker(false));
    }

    private void runCycle(Worker self) {
        long cycleStart = System.nanoTime();

        if (rateLimiter.checkAndClear()) {
            waitForQuota(self, rateLimiter.timeUntilReset().orElse(Duration.ZERO).plusSeconds(1));
            return;
        }

        state = RefreshState.FETCHING;
        Set<String> ids = knownEntityIds.get();
        FreshnessSummary before = cache.summarize(ids, settings.maxAge());
        checkInitialCoverage(ids, before);

        SnapshotSession session = SnapshotSession.open(cache, source, settings, clock);
        ApiCallResult<List<JsonNode>> result = source.fetchSnapshot(session.resumeCursor(), session);
        switch (result.getStatus()) {
            case RATE_LIMITED -> {
                session.suspend(result.getStatus());
                waitForQuota(self, result.getRetryAfter());
                return;
            }
            case TRANSIENT, FATAL -> {
                log.error("Snapshot fetch for {} failed ({}): {}", category(), result.getStatus(),
                        result.getCause() != null ? result.getCause().getMessage() : "unknown");
                session.suspend(result.getStatus());
                state = RefreshState.IDLE;
                sleepWhileActive(self, settings.errorBackoff());
                return;
            }
            case OK -> cacheSnapshot(ids, result.getValue(), session, cycleStart);
        }

        state = RefreshState.IDLE;
        Duration elapsed = Duration.ofNanos(System.nanoTime() - cycleStart);
        Duration remaining = settings.minDelay().minus(elapsed);
        if (!remaining.isNegative() && !remaining.isZero()) {
            sleepWhileActive(self, remaining);
        }
    }

    private void cacheSnapshot(Set<String> ids, List<JsonNode> records, SnapshotSession session, long cycleStart) {
        state = RefreshState.CACHING;
        int written = session.complete(records);
        totalEntitiesRefreshed.addAndGet(written);
        Instant now = clock.instant();
        cache.markCollected(now);
        lastCycleCompletedAt = now;
        long cycle = cyclesRun.incrementAndGet();

        if (!records.isEmpty()) {
            try {
                listener.onDataUpdated(category(), records);
            } catch (RuntimeException e) {
                log.warn("Data-updated callback for {} failed: {}", category(), e.getMessage());
            }
        } else if (!session.isResumed()) {
            log.warn("Snapshot for {} returned no records", category());
        }

        FreshnessSummary after = cache.summarize(ids, settings.maxAge());
        boolean wasComplete = initialCoverageComplete;
        checkInitialCoverage(ids, after);
        logCycle(cycle, written, records.size(), after, Duration.ofNanos(System.nanoTime() - cycleStart), wasComplete);
    }

    private void logCycle(long cycle, int written, int recordCount, FreshnessSummary summary, Duration took,
                          boolean wasComplete) {
        if (!wasComplete) {
            log.info("Refresh {} cycle {}: {} records, {} entities cached in {} ms (fresh {}, stale {}, missing {})",
                    category(), cycle, recordCount, written, took.toMillis(),
                    summary.fresh(), summary.stale(), summary.missing());
        } else if (cycle % settings.heartbeatEvery() == 0) {
            log.info("Refresh {} heartbeat: {} cycles, {} entities refreshed, {} fresh / {} total",
                    category(), cycle, totalEntitiesRefreshed.get(), summary.fresh(), summary.total());
        }
    }

    private void checkInitialCoverage(Set<String> ids, FreshnessSummary summary) {
        if (initialCoverageComplete || ids.isEmpty() || summary.missing() > 0) {
            return;
        }
        initialCoverageComplete = true;
        coverageTransitions.incrementAndGet();
        log.info("Refresh {} initial coverage complete: all {} entities cached; switching to heartbeat logging",
                category(), ids.size());
        try {
            listener.onInitialCoverageComplete(category(), ids.size());
        } catch (RuntimeException e) {
            log.warn("Initial-coverage callback for {} failed: {}", category(), e.getMessage());
        }
    }

    private void waitForQuota(Worker self, Duration wait) {
        Duration bounded = wait == null || wait.compareTo(settings.maxRateLimitWait()) > 0
                ? settings.maxRateLimitWait()
                : wait;
        state = RefreshState.RATE_LIMITED_WAIT;
        log.info("Refresh {} rate limited; waiting {}s", category(), bounded.toSeconds());
        sleepWhileActive(self, bounded);
        state = RefreshState.IDLE;
    }

    /**
     * Sleeps in poll-interval steps, returning early once the worker has been stopped.
     */
    private void sleepWhileActive(Worker self, Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        long pollMillis = settings.pollInterval().toMillis();
        while (self.active) {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                return;
            }
            long step = Math.max(1L, Math.min(pollMillis, TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
            try {
                Thread.sleep(step);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
