package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.api.dto.ModelListResponse;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.pipeline.OperationHandler;

import java.time.Clock;
import java.util.Map;

/**
 * {@code GET /v1/models}: the models served by the backend.
 */
public final class ModelListOperation implements OperationHandler {

    private final InferenceBackend backend;
    private final long startedAtSeconds;

    public ModelListOperation(InferenceBackend backend, Clock clock) {
        this.backend = backend;
        this.startedAtSeconds = clock.millis() / 1000;
    }

    @Override
    public Object handle(Map<String, Object> payload) {
        return new ModelListResponse("list", backend.models().stream()
                .map(id -> new ModelListResponse.Entry(id, "model", startedAtSeconds, "local"))
                .toList());
    }
}
