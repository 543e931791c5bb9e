package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.pipeline.OperationHandler;

import java.util.Map;

/**
 * {@code GET /metrics}: Prometheus text exposition.
 */
public final class MetricsOperation implements OperationHandler {

    public static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final MetricsRegistry metricsRegistry;

    public MetricsOperation(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public Object handle(Map<String, Object> payload) {
        return GatewayResponse.ok(metricsRegistry.scrape())
                .withHeader("Content-Type", PROMETHEUS_CONTENT_TYPE);
    }
}
