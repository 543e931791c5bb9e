package fr.lapetina.inference.gateway.infrastructure.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.ChatMessage;
import fr.lapetina.inference.gateway.domain.model.EmbeddingResult;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;
import fr.lapetina.inference.gateway.domain.model.GenerationResult;
import fr.lapetina.inference.gateway.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaBackendTest {

    private CircuitBreaker circuitBreaker;
    private ScriptedBackend backend;

    @BeforeEach
    void setUp() {
        circuitBreaker = new CircuitBreaker("ollama", 2, Duration.ofSeconds(30), 1, new ManualClock());
        backend = new ScriptedBackend(circuitBreaker);
    }

    @Test
    @DisplayName("should post chat messages to /api/chat and read the answer")
    void shouldChat() {
        backend.respond(200, "{\"message\":{\"role\":\"assistant\",\"content\":\"Hello!\"},"
                + "\"prompt_eval_count\":7,\"eval_count\":2,\"done_reason\":\"stop\"}");

        GenerationResult result = backend.chat("llama3.2",
                List.of(new ChatMessage("user", "Hi")), new GenerationOptions(64, 0.2));

        assertThat(result.text()).isEqualTo("Hello!");
        assertThat(result.promptTokens()).isEqualTo(7);
        assertThat(result.completionTokens()).isEqualTo(2);
        assertThat(backend.requests.get(0).uri().getPath()).isEqualTo("/api/chat");
        assertThat(backend.requests.get(0).method()).isEqualTo("POST");
    }

    @Test
    @DisplayName("should report a length finish reason")
    void shouldReportLengthFinish() {
        backend.respond(200, "{\"response\":\"partial\",\"done_reason\":\"length\"}");

        GenerationResult result = backend.complete("llama3.2", "Tell me", GenerationOptions.defaults());

        assertThat(result.finishReason()).isEqualTo("length");
        assertThat(backend.requests.get(0).uri().getPath()).isEqualTo("/api/generate");
    }

    @Test
    @DisplayName("should read one vector per input")
    void shouldEmbed() {
        backend.respond(200, "{\"embeddings\":[[0.1,0.2],[0.3,0.4]],\"prompt_eval_count\":4}");

        EmbeddingResult result = backend.embed("nomic", List.of("a", "b"));

        assertThat(result.vectors()).containsExactly(List.of(0.1, 0.2), List.of(0.3, 0.4));
        assertThat(result.promptTokens()).isEqualTo(4);
    }

    @Test
    @DisplayName("should map an upstream 4xx to a validation failure on the model field")
    void shouldMapClientError() {
        backend.respond(404, "{\"error\":\"model 'x' not found\"}");

        assertThatThrownBy(() -> backend.complete("x", "Hi", GenerationOptions.defaults()))
                .isInstanceOf(ValidationFailure.class)
                .hasMessage("model 'x' not found")
                .satisfies(e -> assertThat(((ValidationFailure) e).field()).isEqualTo("model"));
        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("should not blame the model field for other upstream rejections")
    void shouldLeaveFieldUnsetForOtherClientErrors() {
        backend.respond(400, "{\"error\":\"invalid options: num_ctx must be positive\"}");

        assertThatThrownBy(() -> backend.chat("llama3.2",
                List.of(new ChatMessage("user", "Hi")), GenerationOptions.defaults()))
                .isInstanceOf(ValidationFailure.class)
                .hasMessage("invalid options: num_ctx must be positive")
                .satisfies(e -> assertThat(((ValidationFailure) e).field()).isNull());
    }

    @Test
    @DisplayName("should map upstream 5xx and connection errors to backend resource failures and open the circuit")
    void shouldOpenCircuitOnFailures() {
        backend.respond(500, "oops");
        backend.failWith(new ConnectException("refused"));

        assertThatThrownBy(() -> backend.complete("m", "Hi", GenerationOptions.defaults()))
                .isInstanceOf(ResourceFailure.class)
                .satisfies(e -> assertThat(((ResourceFailure) e).resourceType()).isEqualTo("backend"));
        assertThatThrownBy(() -> backend.complete("m", "Hi", GenerationOptions.defaults()))
                .isInstanceOf(ResourceFailure.class)
                .hasMessage("Backend unavailable");

        assertThat(circuitBreaker.currentState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(backend.isReady()).isFalse();

        assertThatThrownBy(() -> backend.complete("m", "Hi", GenerationOptions.defaults()))
                .isInstanceOf(ResourceFailure.class)
                .hasMessage("Backend temporarily unavailable");
        assertThat(backend.requests).hasSize(2);
    }

    /**
     * Backend whose HTTP exchange is scripted instead of going over the network.
     */
    private static final class ScriptedBackend extends OllamaBackend {
        private final List<Object> script = new ArrayList<>();
        private final List<HttpRequest> requests = new ArrayList<>();

        ScriptedBackend(CircuitBreaker circuitBreaker) {
            super(URI.create("http://ollama.test:11434"), List.of("llama3.2", "nomic"),
                    Duration.ofSeconds(1), Duration.ofSeconds(5), circuitBreaker, new ObjectMapper());
        }

        void respond(int status, String body) {
            script.add(Map.entry(status, body));
        }

        void failWith(IOException e) {
            script.add(e);
        }

        @Override
        protected HttpResponse<String> send(HttpRequest request) throws IOException {
            requests.add(request);
            Object next = script.remove(0);
            if (next instanceof IOException e) {
                throw e;
            }
            @SuppressWarnings("unchecked")
            Map.Entry<Integer, String> response = (Map.Entry<Integer, String>) next;
            return new StubResponse(request, response.getKey(), response.getValue());
        }
    }

    private record StubResponse(HttpRequest request, int statusCode, String body) implements HttpResponse<String> {

        @Override
        public Optional<HttpResponse<String>> previousResponse() {
            return Optional.empty();
        }

        @Override
        public HttpHeaders headers() {
            return HttpHeaders.of(Map.of(), (name, value) -> true);
        }

        @Override
        public Optional<SSLSession> sslSession() {
            return Optional.empty();
        }

        @Override
        public URI uri() {
            return request.uri();
        }

        @Override
        public HttpClient.Version version() {
            return HttpClient.Version.HTTP_1_1;
        }
    }
}
