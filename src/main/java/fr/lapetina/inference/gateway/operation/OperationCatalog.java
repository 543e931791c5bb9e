package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.pipeline.OperationPolicy;
import fr.lapetina.inference.gateway.ratelimit.RateLimitPolicy;

import java.util.List;

/**
 * The policies of every operation the gateway exposes, with configuration overrides applied.
 */
public final class OperationCatalog {

    public static final String CHAT = "chat";
    public static final String COMPLETION = "completion";
    public static final String EMBEDDING = "embedding";
    public static final String MODELS = "models";
    public static final String HEALTH = "health";
    public static final String METRICS = "metrics";

    private final GatewayConfig config;

    public OperationCatalog(GatewayConfig config) {
        this.config = config;
    }

    public OperationPolicy chat() {
        return build(OperationPolicy.builder(CHAT)
                .path("/v1/chat/completions")
                .rateLimit(RateLimitPolicy.of(30, 60))
                .requiredFields("messages"));
    }

    public OperationPolicy completion() {
        return build(OperationPolicy.builder(COMPLETION)
                .path("/v1/completions")
                .rateLimit(RateLimitPolicy.of(60, 60))
                .requiredFields("prompt"));
    }

    public OperationPolicy embedding() {
        return build(OperationPolicy.builder(EMBEDDING)
                .path("/v1/embeddings")
                .rateLimit(RateLimitPolicy.of(60, 60))
                .requiredFields("input"));
    }

    public OperationPolicy models() {
        return build(OperationPolicy.builder(MODELS)
                .method("GET")
                .path("/v1/models")
                .rateLimit(defaultRateLimit())
                .expectsBody(false)
                .requiresAdmission(false));
    }

    public OperationPolicy health() {
        return build(OperationPolicy.builder(HEALTH)
                .method("GET")
                .path("/health")
                .unlimited()
                .expectsBody(false)
                .requiresAdmission(false));
    }

    public OperationPolicy metrics() {
        return build(OperationPolicy.builder(METRICS)
                .method("GET")
                .path("/metrics")
                .unlimited()
                .expectsBody(false)
                .requiresAdmission(false));
    }

    public List<OperationPolicy> all() {
        return List.of(chat(), completion(), embedding(), models(), health(), metrics());
    }

    private RateLimitPolicy defaultRateLimit() {
        GatewayConfig.RateLimitConfig rateLimit = config.getRateLimit();
        return RateLimitPolicy.of(rateLimit.getMaxRequests(), rateLimit.getWindowSeconds());
    }

    private OperationPolicy build(OperationPolicy.Builder builder) {
        OperationPolicy defaults = builder.maxBodyBytes(config.getLimits().getMaxBodyBytes()).build();
        GatewayConfig.OperationConfig override = config.operation(defaults.name());

        if (Boolean.TRUE.equals(override.getUnlimited())) {
            builder.unlimited();
        } else if (override.getMaxRequests() != null || override.getWindowSeconds() != null) {
            RateLimitPolicy base = defaults.rateLimit() != null ? defaults.rateLimit() : defaultRateLimit();
            builder.rateLimit(RateLimitPolicy.of(
                    override.getMaxRequests() != null ? override.getMaxRequests() : base.maxRequests(),
                    override.getWindowSeconds() != null ? override.getWindowSeconds() : base.window().toSeconds()
            ));
        }
        if (override.getMaxBodyBytes() != null) {
            builder.maxBodyBytes(override.getMaxBodyBytes());
        }
        if (override.getRequiredFields() != null) {
            builder.requiredFields(override.getRequiredFields());
        }
        if (override.getRequireApiKey() != null) {
            builder.requireApiKey(override.getRequireApiKey());
        }
        return builder.build();
    }
}
