package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.api.dto.EmbeddingResponse;
import fr.lapetina.inference.gateway.api.dto.Usage;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.EmbeddingResult;
import fr.lapetina.inference.gateway.pipeline.OperationHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@code POST /v1/embeddings}. Accepts a single string or a non-empty list of strings.
 */
public final class EmbeddingOperation implements OperationHandler {

    private final InferenceBackend backend;

    public EmbeddingOperation(InferenceBackend backend) {
        this.backend = backend;
    }

    @Override
    public Object handle(Map<String, Object> payload) {
        List<String> inputs = parseInputs(payload.get("input"));
        String model = ParameterRules.resolveModel(payload, backend);

        EmbeddingResult result = backend.embed(model, inputs);

        List<EmbeddingResponse.Item> data = new ArrayList<>(result.vectors().size());
        for (int i = 0; i < result.vectors().size(); i++) {
            data.add(EmbeddingResponse.Item.of(result.vectors().get(i), i));
        }
        return new EmbeddingResponse("list", data, result.model(), Usage.of(result.promptTokens(), 0));
    }

    static List<String> parseInputs(Object raw) {
        if (raw instanceof String single) {
            return List.of(single);
        }
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new ValidationFailure("Input must be a string or a non-empty list of strings", "input");
        }
        List<String> inputs = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof String text)) {
                throw new ValidationFailure("Input must be a string", "input[" + i + "]");
            }
            inputs.add(text);
        }
        return inputs;
    }
}
