package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.api.dto.ChatCompletionResponse;
import fr.lapetina.inference.gateway.api.dto.Usage;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.ChatMessage;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;
import fr.lapetina.inference.gateway.domain.model.GenerationResult;
import fr.lapetina.inference.gateway.pipeline.OperationHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code POST /v1/chat/completions}.
 */
public final class ChatCompletionOperation implements OperationHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionOperation.class);

    public static final int MAX_CONTENT_LENGTH = 8000;
    static final Set<String> ROLES = Set.of("system", "user", "assistant");
    static final String SYSTEM_FINGERPRINT = "inference-gateway";

    private final InferenceBackend backend;
    private final Clock clock;

    public ChatCompletionOperation(InferenceBackend backend, Clock clock) {
        this.backend = backend;
        this.clock = clock;
    }

    @Override
    public Object handle(Map<String, Object> payload) {
        List<ChatMessage> messages = parseMessages(payload.get("messages"));
        GenerationOptions options = ParameterRules.generationOptions(payload);
        String model = ParameterRules.resolveModel(payload, backend);

        log.debug("Chat completion: model={}, messages={}, maxTokens={}, temperature={}",
                model, messages.size(), options.maxTokens(), options.temperature());

        GenerationResult result = backend.chat(model, messages, options);
        long nowMillis = clock.millis();

        return new ChatCompletionResponse(
                "chatcmpl-" + nowMillis,
                ChatCompletionResponse.OBJECT,
                nowMillis / 1000,
                result.model(),
                SYSTEM_FINGERPRINT,
                List.of(new ChatCompletionResponse.Choice(
                        0, new ChatMessage("assistant", result.text()), result.finishReason())),
                Usage.of(result.promptTokens(), result.completionTokens())
        );
    }

    static List<ChatMessage> parseMessages(Object raw) {
        if (!(raw instanceof List<?> list) || list.isEmpty()) {
            throw new ValidationFailure("Messages must be a non-empty list", "messages");
        }

        List<ChatMessage> messages = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            String field = "messages[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> message)
                    || !message.containsKey("role") || !message.containsKey("content")) {
                throw new ValidationFailure("Each message must be an object with role and content", field);
            }

            Object role = message.get("role");
            if (!(role instanceof String roleName) || !ROLES.contains(roleName)) {
                throw new ValidationFailure("Role must be one of: assistant, system, user", field + ".role");
            }

            Object content = message.get("content");
            if (!(content instanceof String text)) {
                throw new ValidationFailure("Content must be a string", field + ".content");
            }
            if (text.length() > MAX_CONTENT_LENGTH) {
                throw new ValidationFailure(
                        "Message content too long (max " + MAX_CONTENT_LENGTH + " characters)", field + ".content");
            }
            messages.add(new ChatMessage(roleName, text));
        }
        return messages;
    }
}
