package fr.lapetina.inference.gateway.domain.model;

import java.util.Objects;

/**
 * Text produced by the backend for a chat or completion call.
 *
 * @param text             generated text
 * @param model            model that produced it
 * @param promptTokens     tokens consumed by the prompt
 * @param completionTokens tokens generated
 * @param finishReason     why generation stopped ({@code stop} or {@code length})
 */
public record GenerationResult(
        String text,
        String model,
        int promptTokens,
        int completionTokens,
        String finishReason
) {
    public GenerationResult {
        Objects.requireNonNull(text, "Text is required");
        Objects.requireNonNull(model, "Model is required");
        if (finishReason == null) {
            finishReason = "stop";
        }
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
