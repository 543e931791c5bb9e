package fr.lapetina.inference.gateway.pipeline.stages;

import fr.lapetina.inference.gateway.admission.AdmissionToken;
import fr.lapetina.inference.gateway.admission.ResourceAdmission;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runs the handler while holding one unit of admission capacity.
 *
 * <p>The token is released on every exit path, including handler failures.
 */
public final class AdmissionStage implements Stage {

    private static final Logger log = LoggerFactory.getLogger(AdmissionStage.class);

    public static final Duration DEFAULT_SLOW_REQUEST_THRESHOLD = Duration.ofSeconds(30);

    private final ResourceAdmission admission;
    private final Duration slowRequestThreshold;

    public AdmissionStage(ResourceAdmission admission, Duration slowRequestThreshold) {
        this.admission = admission;
        this.slowRequestThreshold = slowRequestThreshold;
    }

    public AdmissionStage(ResourceAdmission admission) {
        this(admission, DEFAULT_SLOW_REQUEST_THRESHOLD);
    }

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        if (!context.operation().requiresAdmission()) {
            return next.proceed(context);
        }

        long start = System.nanoTime();
        try (AdmissionToken ignored = admission.acquire()) {
            return next.proceed(context);
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (elapsed.compareTo(slowRequestThreshold) > 0) {
                log.warn("Slow request: requestId={}, operation={}, durationMs={}",
                        context.requestId(), context.operationName(), elapsed.toMillis());
            }
        }
    }

    @Override
    public String getName() {
        return "admission";
    }
}
