package fr.lapetina.inference.gateway.ratelimit;

import java.time.Duration;
import java.util.ArrayDeque;

/**
 * Exact sliding window log for one client bucket.
 *
 * <p>Not thread-safe on its own: {@link SlidingWindowRateLimiter} only touches a window
 * inside {@code ConcurrentHashMap.compute}, which serializes access per key.
 */
final class RateWindow {

    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();
    private long lastAccessMillis;
    private long windowMillis;

    /**
     * Purges expired entries, then records {@code nowMillis} if the bucket has room.
     * A rejected attempt is not recorded.
     */
    RateLimitDecision tryRecord(long nowMillis, RateLimitPolicy policy) {
        windowMillis = policy.window().toMillis();
        lastAccessMillis = nowMillis;
        purge(nowMillis);

        if (timestamps.size() >= policy.maxRequests()) {
            long oldest = timestamps.peekFirst();
            Duration retryAfter = Duration.ofMillis(Math.max(0, oldest + windowMillis - nowMillis));
            return RateLimitDecision.reject(timestamps.size(), policy.maxRequests(), retryAfter);
        }

        timestamps.addLast(nowMillis);
        return RateLimitDecision.allow(timestamps.size(), policy.maxRequests());
    }

    /**
     * Entries at or before {@code now - window} fall out of the window.
     */
    private void purge(long nowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.removeFirst();
        }
    }

    boolean isIdle(long nowMillis, int evictAfterWindows) {
        return nowMillis - lastAccessMillis > windowMillis * evictAfterWindows;
    }

    int size() {
        return timestamps.size();
    }
}
