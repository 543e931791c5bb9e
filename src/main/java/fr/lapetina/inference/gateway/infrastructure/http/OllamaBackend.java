package fr.lapetina.inference.gateway.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.ChatMessage;
import fr.lapetina.inference.gateway.domain.model.EmbeddingResult;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;
import fr.lapetina.inference.gateway.domain.model.GenerationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Forwards generation calls to an Ollama-compatible server.
 *
 * <p>Calls are synchronous: the request thread blocks on the upstream while holding its
 * admission. A circuit breaker short-circuits calls after repeated upstream failures.
 */
public class OllamaBackend implements InferenceBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaBackend.class);

    public static final String NAME = "ollama";

    private final URI baseUri;
    private final List<String> models;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;

    public OllamaBackend(
            URI baseUri,
            List<String> models,
            Duration connectTimeout,
            Duration requestTimeout,
            CircuitBreaker circuitBreaker,
            ObjectMapper objectMapper
    ) {
        String base = baseUri.toString();
        this.baseUri = URI.create(base.endsWith("/") ? base : base + "/");
        this.models = List.copyOf(models);
        this.requestTimeout = requestTimeout;
        this.circuitBreaker = circuitBreaker;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        log.info("OllamaBackend initialized: baseUri={}, models={}, requestTimeoutMs={}",
                this.baseUri, this.models, requestTimeout.toMillis());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isReady() {
        return !models.isEmpty() && circuitBreaker.currentState() != CircuitBreaker.State.OPEN;
    }

    @Override
    public List<String> models() {
        return models;
    }

    @Override
    public GenerationResult chat(String model, List<ChatMessage> messages, GenerationOptions options) {
        List<Map<String, String>> wireMessages = messages.stream()
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", wireMessages);
        body.put("stream", false);
        body.put("options", wireOptions(options));

        JsonNode response = post("api/chat", model, body);
        return new GenerationResult(
                response.path("message").path("content").asText(""),
                model,
                response.path("prompt_eval_count").asInt(0),
                response.path("eval_count").asInt(0),
                finishReason(response)
        );
    }

    @Override
    public GenerationResult complete(String model, String prompt, GenerationOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", wireOptions(options));

        JsonNode response = post("api/generate", model, body);
        return new GenerationResult(
                response.path("response").asText(""),
                model,
                response.path("prompt_eval_count").asInt(0),
                response.path("eval_count").asInt(0),
                finishReason(response)
        );
    }

    @Override
    public EmbeddingResult embed(String model, List<String> inputs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", inputs);

        JsonNode response = post("api/embed", model, body);
        List<List<Double>> vectors = new ArrayList<>();
        for (JsonNode embedding : response.path("embeddings")) {
            List<Double> vector = new ArrayList<>(embedding.size());
            embedding.forEach(v -> vector.add(v.asDouble()));
            vectors.add(vector);
        }
        return new EmbeddingResult(vectors, model, response.path("prompt_eval_count").asInt(0));
    }

    private static Map<String, Object> wireOptions(GenerationOptions options) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("num_predict", options.maxTokens());
        wire.put("temperature", options.temperature());
        return wire;
    }

    private static String finishReason(JsonNode response) {
        return "length".equals(response.path("done_reason").asText()) ? "length" : "stop";
    }

    private JsonNode post(String endpoint, String model, Map<String, Object> body) {
        if (!circuitBreaker.allowRequest()) {
            log.warn("Call blocked by circuit breaker: endpoint={}, model={}", endpoint, model);
            throw new ResourceFailure("Backend temporarily unavailable", ResourceFailure.BACKEND);
        }

        HttpRequest request = buildRequest(endpoint, body);
        long start = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = send(request);
        } catch (IOException e) {
            circuitBreaker.recordFailure();
            log.error("Backend connection error: endpoint={}, model={}, errorType={}, error={}",
                    endpoint, model, e.getClass().getSimpleName(), e.getMessage());
            throw new ResourceFailure("Backend unavailable", ResourceFailure.BACKEND, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResourceFailure("Backend call interrupted", ResourceFailure.BACKEND, e);
        }

        long latencyMs = Duration.ofNanos(System.nanoTime() - start).toMillis();
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            circuitBreaker.recordSuccess();
            log.info("Backend call successful: endpoint={}, model={}, status={}, latencyMs={}",
                    endpoint, model, status, latencyMs);
            return readTree(response.body(), endpoint);
        }

        String upstreamMessage = errorMessage(response);
        if (status >= 400 && status < 500) {
            // The upstream rejected what we sent; its health is not in question
            circuitBreaker.recordSuccess();
            log.warn("Backend rejected call: endpoint={}, model={}, status={}, error={}",
                    endpoint, model, status, upstreamMessage);
            throw new ValidationFailure(upstreamMessage, blamedField(upstreamMessage));
        }

        circuitBreaker.recordFailure();
        log.error("Backend call failed: endpoint={}, model={}, status={}, latencyMs={}, error={}",
                endpoint, model, status, latencyMs, upstreamMessage);
        throw new ResourceFailure("Backend error: HTTP " + status, ResourceFailure.BACKEND);
    }

    /**
     * Performs the HTTP exchange. Overridden in tests.
     */
    protected HttpResponse<String> send(HttpRequest request) throws IOException, InterruptedException {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest buildRequest(String endpoint, Map<String, Object> body) {
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize backend request", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(baseUri.resolve(endpoint))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        String requestId = MDC.get("requestId");
        if (requestId != null) {
            builder.header("X-Request-ID", requestId);
        }
        return builder.build();
    }

    private JsonNode readTree(String body, String endpoint) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Unparseable backend response: endpoint={}", endpoint, e);
            throw new ResourceFailure("Invalid backend response", ResourceFailure.BACKEND, e);
        }
    }

    /**
     * Upstream errors are free text. Only a message naming the model is pinned to a field.
     */
    private static String blamedField(String upstreamMessage) {
        return upstreamMessage.toLowerCase(Locale.ROOT).contains("model") ? "model" : null;
    }

    private String errorMessage(HttpResponse<String> response) {
        String fallback = "HTTP " + response.statusCode();
        try {
            JsonNode error = objectMapper.readTree(response.body()).path("error");
            return error.isTextual() ? error.asText() : fallback;
        } catch (JsonProcessingException e) {
            log.debug("Backend error body is not JSON: status={}", response.statusCode());
            return fallback;
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
