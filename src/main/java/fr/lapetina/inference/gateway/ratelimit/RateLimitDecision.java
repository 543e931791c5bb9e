package fr.lapetina.inference.gateway.ratelimit;

import java.time.Duration;

/**
 * Outcome of a rate-limit check.
 *
 * @param allowed    whether the request was admitted and recorded
 * @param count      requests in the window after the decision
 * @param limit      configured maximum
 * @param retryAfter time until the oldest entry leaves the window; zero when allowed
 */
public record RateLimitDecision(boolean allowed, int count, int limit, Duration retryAfter) {

    public static RateLimitDecision allow(int count, int limit) {
        return new RateLimitDecision(true, count, limit, Duration.ZERO);
    }

    public static RateLimitDecision reject(int count, int limit, Duration retryAfter) {
        return new RateLimitDecision(false, count, limit, retryAfter);
    }

    public int remaining() {
        return Math.max(0, limit - count);
    }
}
