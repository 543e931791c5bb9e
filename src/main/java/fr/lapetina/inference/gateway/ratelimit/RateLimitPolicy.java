package fr.lapetina.inference.gateway.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Maximum number of requests a client may issue within a trailing window.
 */
public record RateLimitPolicy(int maxRequests, Duration window) {

    public static final int DEFAULT_MAX_REQUESTS = 60;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    public RateLimitPolicy {
        Objects.requireNonNull(window, "Window is required");
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be > 0");
        }
    }

    public static RateLimitPolicy defaults() {
        return new RateLimitPolicy(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW);
    }

    public static RateLimitPolicy of(int maxRequests, long windowSeconds) {
        return new RateLimitPolicy(maxRequests, Duration.ofSeconds(windowSeconds));
    }
}
