package fr.lapetina.inference.gateway.pipeline.stages;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.pipeline.ErrorTaxonomy;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;
import fr.lapetina.inference.gateway.ratelimit.RateLimitDecision;
import fr.lapetina.inference.gateway.ratelimit.RateLimitPolicy;
import fr.lapetina.inference.gateway.ratelimit.SlidingWindowRateLimiter;

/**
 * Rejects abusive clients before any parsing. Buckets are keyed by operation and client,
 * so each operation keeps its own window.
 *
 * <p>The 429 is rendered here directly instead of being thrown to the catch-all.
 */
public final class RateLimitStage implements Stage {

    private final SlidingWindowRateLimiter rateLimiter;
    private final ErrorTaxonomy taxonomy;
    private final MetricsRegistry metricsRegistry;

    public RateLimitStage(
            SlidingWindowRateLimiter rateLimiter,
            ErrorTaxonomy taxonomy,
            MetricsRegistry metricsRegistry
    ) {
        this.rateLimiter = rateLimiter;
        this.taxonomy = taxonomy;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        RateLimitPolicy policy = context.operation().rateLimit();
        if (policy == null) {
            return next.proceed(context);
        }

        RateLimitDecision decision = rateLimiter.tryAcquire(bucketKey(context), policy);
        if (!decision.allowed()) {
            metricsRegistry.incrementRateLimited(context.operationName());
            return taxonomy.rateLimited(
                    context.operationName(),
                    context.clientId(),
                    policy.maxRequests(),
                    policy.window(),
                    decision.retryAfter()
            );
        }
        return next.proceed(context);
    }

    static String bucketKey(RequestContext context) {
        return context.operationName() + ":" + context.clientId();
    }

    @Override
    public String getName() {
        return "rate-limit";
    }
}
