package fr.lapetina.inference.gateway.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-client sliding-window rate limiter.
 *
 * <p>Each bucket key owns a {@link RateWindow}. The purge / compare / append sequence runs
 * inside {@link ConcurrentHashMap#compute}, so it is atomic with respect to other requests
 * for the same key while different keys proceed in parallel. No lock is ever held across
 * the backend call.
 *
 * <p>Buckets idle for more than {@code evictAfterWindows} windows are removed, both by a
 * sweep piggy-backed on {@link #tryAcquire} and by an optional background sweeper, so the
 * store stays bounded under client churn.
 */
public final class SlidingWindowRateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    public static final int DEFAULT_EVICT_AFTER_WINDOWS = 5;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

    private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int evictAfterWindows;
    private final Duration sweepInterval;
    private final AtomicLong lastSweepMillis;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService sweeper;

    public SlidingWindowRateLimiter(Clock clock, int evictAfterWindows, Duration sweepInterval) {
        if (evictAfterWindows <= 0) {
            throw new IllegalArgumentException("evictAfterWindows must be > 0");
        }
        this.clock = clock;
        this.evictAfterWindows = evictAfterWindows;
        this.sweepInterval = sweepInterval;
        this.lastSweepMillis = new AtomicLong(clock.millis());
        log.info("SlidingWindowRateLimiter initialized: evictAfterWindows={}, sweepInterval={}",
                evictAfterWindows, sweepInterval);
    }

    public SlidingWindowRateLimiter() {
        this(Clock.systemUTC(), DEFAULT_EVICT_AFTER_WINDOWS, DEFAULT_SWEEP_INTERVAL);
    }

    /**
     * Checks and records one request for the bucket.
     *
     * @param key    bucket key (operation and client identity)
     * @param policy limit applied to this bucket
     * @return the decision; a rejected attempt is not recorded
     */
    public RateLimitDecision tryAcquire(String key, RateLimitPolicy policy) {
        RateLimitDecision[] decision = new RateLimitDecision[1];
        long[] now = new long[1];

        // Clock read under the per-key lock keeps each bucket ordered by arrival
        windows.compute(key, (k, existing) -> {
            RateWindow window = existing != null ? existing : new RateWindow();
            now[0] = clock.millis();
            decision[0] = window.tryRecord(now[0], policy);
            return window;
        });

        maybeSweep(now[0]);

        if (decision[0].allowed()) {
            log.debug("Rate limit check passed: key={}, count={}/{}",
                    key, decision[0].count(), decision[0].limit());
        }
        return decision[0];
    }

    private void maybeSweep(long now) {
        long last = lastSweepMillis.get();
        if (now - last >= sweepInterval.toMillis() && lastSweepMillis.compareAndSet(last, now)) {
            sweep(now);
        }
    }

    /**
     * Removes idle buckets. Each removal is atomic with respect to concurrent access to the same key.
     *
     * @return number of buckets evicted
     */
    public int sweep() {
        return sweep(clock.millis());
    }

    private int sweep(long now) {
        int before = windows.size();
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, window) ->
                    window.isIdle(now, evictAfterWindows) ? null : window);
        }
        int evicted = Math.max(0, before - windows.size());
        if (evicted > 0) {
            log.debug("Evicted idle rate windows: evicted={}, remaining={}", evicted, windows.size());
        }
        return evicted;
    }

    /**
     * Starts the background sweeper.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "rate-window-sweeper");
                t.setDaemon(true);
                return t;
            });
            sweeper.scheduleWithFixedDelay(
                    this::sweepSafely,
                    sweepInterval.toMillis(),
                    sweepInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Rate window sweeper started with interval: {}", sweepInterval);
        }
    }

    private void sweepSafely() {
        try {
            lastSweepMillis.set(clock.millis());
            sweep();
        } catch (RuntimeException e) {
            log.error("Error sweeping rate windows", e);
        }
    }

    /**
     * Returns the number of client buckets currently held.
     */
    public int trackedKeys() {
        return windows.size();
    }

    /**
     * Returns the number of requests currently counted for a bucket, without recording one.
     */
    public int currentCount(String key) {
        int[] count = new int[1];
        windows.computeIfPresent(key, (k, window) -> {
            count[0] = window.size();
            return window;
        });
        return count[0];
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            sweeper.shutdown();
            try {
                sweeper.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("Rate window sweeper stopped");
        }
    }
}
