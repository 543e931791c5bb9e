package fr.lapetina.inference.gateway.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * One vector per input, in input order.
 */
public record EmbeddingResult(
        List<List<Double>> vectors,
        String model,
        int promptTokens
) {
    public EmbeddingResult {
        Objects.requireNonNull(model, "Model is required");
        vectors = vectors != null ? List.copyOf(vectors) : List.of();
    }
}
