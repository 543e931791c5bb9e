package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.api.dto.CompletionResponse;
import fr.lapetina.inference.gateway.api.dto.Usage;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;
import fr.lapetina.inference.gateway.domain.model.GenerationResult;
import fr.lapetina.inference.gateway.pipeline.OperationHandler;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * {@code POST /v1/completions}.
 */
public final class CompletionOperation implements OperationHandler {

    private final InferenceBackend backend;
    private final Clock clock;

    public CompletionOperation(InferenceBackend backend, Clock clock) {
        this.backend = backend;
        this.clock = clock;
    }

    @Override
    public Object handle(Map<String, Object> payload) {
        if (!(payload.get("prompt") instanceof String prompt)) {
            throw new ValidationFailure("Prompt must be a string", "prompt");
        }
        GenerationOptions options = ParameterRules.generationOptions(payload);
        String model = ParameterRules.resolveModel(payload, backend);

        GenerationResult result = backend.complete(model, prompt, options);
        long nowMillis = clock.millis();

        return new CompletionResponse(
                "cmpl-" + nowMillis,
                CompletionResponse.OBJECT,
                nowMillis / 1000,
                result.model(),
                List.of(new CompletionResponse.Choice(result.text(), 0, result.finishReason())),
                Usage.of(result.promptTokens(), result.completionTokens())
        );
    }
}
