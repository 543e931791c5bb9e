package fr.lapetina.inference.gateway.pipeline.stages;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Outermost stage: start and end log lines, duration and request metrics.
 */
public final class RequestLoggingStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingStage.class);

    private final MetricsRegistry metricsRegistry;

    public RequestLoggingStage(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        long start = System.nanoTime();
        log.info("Request started: requestId={}, method={}, path={}, operation={}, clientId={}",
                context.requestId(), context.method(), context.path(),
                context.operationName(), context.clientId());

        try {
            GatewayResponse response = next.proceed(context);
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsRegistry.recordRequest(context.operationName(), response.status(), duration);

            log.info("Request completed: requestId={}, method={}, path={}, status={}, durationMs={}",
                    context.requestId(), context.method(), context.path(),
                    response.status(), duration.toMillis());
            return response;

        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            log.error("Request failed: requestId={}, method={}, path={}, durationMs={}, error={}",
                    context.requestId(), context.method(), context.path(),
                    duration.toMillis(), e.toString());
            throw e;
        }
    }

    @Override
    public String getName() {
        return "request-logging";
    }
}
