package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.admission.ResourceAdmission;
import fr.lapetina.inference.gateway.admission.ResourceStatus;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.pipeline.OperationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code GET /health}.
 *
 * <p>Reads the admission ledger without touching it, so health stays answerable while the
 * gateway is at capacity. Status is {@code healthy}, {@code degraded} when the backend is
 * not ready, or {@code busy} when at capacity (busy wins when both apply).
 */
public final class HealthOperation implements OperationHandler {

    private static final Logger log = LoggerFactory.getLogger(HealthOperation.class);

    private final ResourceAdmission admission;
    private final InferenceBackend backend;
    private final Clock clock;

    public HealthOperation(ResourceAdmission admission, InferenceBackend backend, Clock clock) {
        this.admission = admission;
        this.backend = backend;
        this.clock = clock;
    }

    @Override
    public Object handle(Map<String, Object> payload) {
        long timestamp = clock.millis() / 1000;
        try {
            ResourceStatus status = admission.status();
            boolean ready = backend.isReady();

            Map<String, Object> body = new LinkedHashMap<>(status.toMap());
            body.put("status", "healthy");
            body.put("timestamp", timestamp);
            body.put("model_loaded", ready);
            body.put("backend", backend.name());

            List<String> issues = new ArrayList<>();
            if (!ready) {
                body.put("status", "degraded");
                issues.add("Model not loaded");
            }
            if (status.atCapacity()) {
                body.put("status", "busy");
                issues.add("At capacity");
            }
            if (!issues.isEmpty()) {
                body.put("issues", issues);
            }
            return body;

        } catch (RuntimeException e) {
            log.error("Health check failed: error={}", e.getMessage(), e);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "unhealthy");
            body.put("timestamp", timestamp);
            return GatewayResponse.of(503, body);
        }
    }
}
