package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenAI-compatible {@code text_completion} body.
 */
public record CompletionResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage
) {
    public static final String OBJECT = "text_completion";

    public record Choice(
            String text,
            int index,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }
}
