package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.api.dto.ChatCompletionResponse;
import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.ChatMessage;
import fr.lapetina.inference.gateway.support.ManualClock;
import fr.lapetina.inference.gateway.support.StubBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatCompletionOperationTest {

    private StubBackend backend;
    private ChatCompletionOperation operation;

    @BeforeEach
    void setUp() {
        backend = new StubBackend();
        operation = new ChatCompletionOperation(backend, new ManualClock());
    }

    private static Map<String, Object> payload(Object messages) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("messages", messages);
        return payload;
    }

    private static Map<String, Object> userMessage(String content) {
        return Map.of("role", "user", "content", content);
    }

    @Test
    @DisplayName("should return a chat.completion with the backend's answer")
    void shouldReturnChatCompletion() {
        ChatCompletionResponse response = (ChatCompletionResponse) operation.handle(
                payload(List.of(Map.of("role", "system", "content", "Be brief."), userMessage("Hello"))));

        assertThat(response.object()).isEqualTo("chat.completion");
        assertThat(response.id()).startsWith("chatcmpl-");
        assertThat(response.created()).isEqualTo(1_704_067_200L);
        assertThat(response.model()).isEqualTo(StubBackend.MODEL);
        assertThat(response.choices()).hasSize(1);
        assertThat(response.choices().get(0).message()).isEqualTo(new ChatMessage("assistant", "echo: Hello"));
        assertThat(response.choices().get(0).finishReason()).isEqualTo("stop");
        assertThat(response.usage().totalTokens()).isEqualTo(8);
        assertThat(backend.lastMessages()).hasSize(2);
    }

    @Test
    @DisplayName("should apply default generation options")
    void shouldApplyDefaults() {
        operation.handle(payload(List.of(userMessage("Hi"))));

        assertThat(backend.lastOptions().maxTokens()).isEqualTo(1024);
        assertThat(backend.lastOptions().temperature()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("should fail with a model resource failure when the backend is not ready")
    void shouldFailWhenNotReady() {
        backend.setReady(false);

        assertThatThrownBy(() -> operation.handle(payload(List.of(userMessage("Hi")))))
                .isInstanceOf(ResourceFailure.class)
                .hasMessage("Model not loaded")
                .satisfies(e -> assertThat(((ResourceFailure) e).resourceType()).isEqualTo("model"));
        assertThat(backend.calls()).isZero();
    }

    @Nested
    @DisplayName("parameter validation")
    class ParameterValidation {

        @Test
        @DisplayName("should reject an empty message list")
        void shouldRejectEmptyMessages() {
            assertThatThrownBy(() -> operation.handle(payload(List.of())))
                    .isInstanceOf(ValidationFailure.class)
                    .satisfies(e -> assertThat(((ValidationFailure) e).field()).isEqualTo("messages"));
        }

        @Test
        @DisplayName("should reject max_tokens outside 1..4096")
        void shouldRejectMaxTokens() {
            Map<String, Object> request = payload(List.of(userMessage("Hi")));
            request.put("max_tokens", 5000);

            assertThatThrownBy(() -> operation.handle(request))
                    .isInstanceOf(ValidationFailure.class)
                    .hasMessage("max_tokens must be between 1 and 4096");
        }

        @Test
        @DisplayName("should reject temperature outside 0..2")
        void shouldRejectTemperature() {
            Map<String, Object> request = payload(List.of(userMessage("Hi")));
            request.put("temperature", 2.5);

            assertThatThrownBy(() -> operation.handle(request))
                    .isInstanceOf(ValidationFailure.class)
                    .satisfies(e -> assertThat(((ValidationFailure) e).field()).isEqualTo("temperature"));
        }

        @Test
        @DisplayName("should point at the offending message role")
        void shouldRejectUnknownRole() {
            List<Object> messages = List.of(userMessage("Hi"), Map.of("role", "robot", "content", "beep"));

            assertThatThrownBy(() -> operation.handle(payload(messages)))
                    .isInstanceOf(ValidationFailure.class)
                    .satisfies(e -> assertThat(((ValidationFailure) e).field()).isEqualTo("messages[1].role"));
        }

        @Test
        @DisplayName("should reject a message without content")
        void shouldRejectMissingContent() {
            assertThatThrownBy(() -> operation.handle(payload(List.of(Map.of("role", "user")))))
                    .isInstanceOf(ValidationFailure.class)
                    .satisfies(e -> assertThat(((ValidationFailure) e).field()).isEqualTo("messages[0]"));
        }

        @Test
        @DisplayName("should reject content longer than 8000 characters")
        void shouldRejectLongContent() {
            List<Object> messages = List.of(userMessage("x".repeat(8001)));

            assertThatThrownBy(() -> operation.handle(payload(messages)))
                    .isInstanceOf(ValidationFailure.class)
                    .satisfies(e -> assertThat(((ValidationFailure) e).field()).isEqualTo("messages[0].content"));
        }

        @Test
        @DisplayName("should reject a model the backend does not serve")
        void shouldRejectUnknownModel() {
            Map<String, Object> request = payload(List.of(userMessage("Hi")));
            request.put("model", "gpt-99");

            assertThatThrownBy(() -> operation.handle(request))
                    .isInstanceOf(ValidationFailure.class)
                    .hasMessage("Model not found: gpt-99");
        }
    }
}
