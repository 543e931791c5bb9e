package fr.lapetina.inference.gateway.pipeline.stages;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.pipeline.ErrorTaxonomy;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;

/**
 * Catch-all around every later stage and the handler.
 *
 * <p>The only place a raised failure becomes a client response, so every stage reports
 * failures the same way regardless of where they happen.
 */
public final class ErrorTranslationStage implements Stage {

    private final ErrorTaxonomy taxonomy;
    private final MetricsRegistry metricsRegistry;

    public ErrorTranslationStage(ErrorTaxonomy taxonomy, MetricsRegistry metricsRegistry) {
        this.taxonomy = taxonomy;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        try {
            return next.proceed(context);
        } catch (RuntimeException e) {
            metricsRegistry.incrementErrorCount(context.operationName(), ErrorTaxonomy.classify(e).kind());
            return taxonomy.toResponse(context.operationName(), e);
        }
    }

    @Override
    public String getName() {
        return "error-translation";
    }
}
