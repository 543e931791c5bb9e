package fr.lapetina.inference.gateway.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.admission.ResourceAdmission;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.pipeline.stages.AdmissionStage;
import fr.lapetina.inference.gateway.pipeline.stages.AuthenticationStage;
import fr.lapetina.inference.gateway.pipeline.stages.ErrorTranslationStage;
import fr.lapetina.inference.gateway.pipeline.stages.RateLimitStage;
import fr.lapetina.inference.gateway.pipeline.stages.RequestLoggingStage;
import fr.lapetina.inference.gateway.pipeline.stages.SchemaValidationStage;
import fr.lapetina.inference.gateway.pipeline.stages.SecurityValidationStage;
import fr.lapetina.inference.gateway.ratelimit.SlidingWindowRateLimiter;
import fr.lapetina.inference.gateway.security.SecurityValidator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * The admission pipeline every operation goes through.
 *
 * <p>Stage order is fixed:
 * <ol>
 *   <li>request logging</li>
 *   <li>error translation (catch-all)</li>
 *   <li>rate limiting</li>
 *   <li>authentication</li>
 *   <li>schema validation</li>
 *   <li>security validation</li>
 *   <li>resource admission</li>
 * </ol>
 * A cheaper check always runs before a more expensive one, and admission capacity is only
 * reserved for requests that passed every other check.
 */
public final class GatewayPipeline {

    private final MiddlewareChain chain;

    private GatewayPipeline(Builder builder) {
        ErrorTaxonomy taxonomy = builder.taxonomy != null ? builder.taxonomy : new ErrorTaxonomy();
        this.chain = new MiddlewareChain(List.of(
                new RequestLoggingStage(builder.metricsRegistry),
                new ErrorTranslationStage(taxonomy, builder.metricsRegistry),
                new RateLimitStage(builder.rateLimiter, taxonomy, builder.metricsRegistry),
                new AuthenticationStage(),
                new SchemaValidationStage(builder.objectMapper),
                new SecurityValidationStage(builder.securityValidator),
                new AdmissionStage(builder.admission, builder.slowRequestThreshold)
        ));
    }

    /**
     * Runs a request through every stage and the handler.
     * Never throws for failures raised by stages or the handler.
     */
    public GatewayResponse handle(RequestContext context, OperationHandler handler) {
        return chain.execute(context, handler);
    }

    public List<String> stageNames() {
        return chain.stageNames();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ObjectMapper objectMapper;
        private SecurityValidator securityValidator;
        private SlidingWindowRateLimiter rateLimiter;
        private ResourceAdmission admission;
        private MetricsRegistry metricsRegistry;
        private ErrorTaxonomy taxonomy;
        private Duration slowRequestThreshold = AdmissionStage.DEFAULT_SLOW_REQUEST_THRESHOLD;

        private Builder() {
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder securityValidator(SecurityValidator securityValidator) {
            this.securityValidator = securityValidator;
            return this;
        }

        public Builder rateLimiter(SlidingWindowRateLimiter rateLimiter) {
            this.rateLimiter = rateLimiter;
            return this;
        }

        public Builder admission(ResourceAdmission admission) {
            this.admission = admission;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder taxonomy(ErrorTaxonomy taxonomy) {
            this.taxonomy = taxonomy;
            return this;
        }

        public Builder slowRequestThreshold(Duration slowRequestThreshold) {
            this.slowRequestThreshold = slowRequestThreshold;
            return this;
        }

        public GatewayPipeline build() {
            Objects.requireNonNull(objectMapper, "ObjectMapper is required");
            Objects.requireNonNull(securityValidator, "SecurityValidator is required");
            Objects.requireNonNull(rateLimiter, "Rate limiter is required");
            Objects.requireNonNull(admission, "ResourceAdmission is required");
            Objects.requireNonNull(metricsRegistry, "MetricsRegistry is required");
            return new GatewayPipeline(this);
        }
    }
}
