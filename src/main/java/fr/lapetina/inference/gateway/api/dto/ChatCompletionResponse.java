package fr.lapetina.inference.gateway.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.inference.gateway.domain.model.ChatMessage;

import java.util.List;

/**
 * OpenAI-compatible {@code chat.completion} body.
 */
public record ChatCompletionResponse(
        String id,
        String object,
        long created,
        String model,
        @JsonProperty("system_fingerprint") String systemFingerprint,
        List<Choice> choices,
        Usage usage
) {
    public static final String OBJECT = "chat.completion";

    public record Choice(
            int index,
            ChatMessage message,
            @JsonProperty("finish_reason") String finishReason
    ) {
    }
}
