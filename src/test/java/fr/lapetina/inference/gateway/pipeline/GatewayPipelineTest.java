package fr.lapetina.inference.gateway.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.inference.gateway.admission.AdmissionToken;
import fr.lapetina.inference.gateway.admission.ResourceAdmission;
import fr.lapetina.inference.gateway.api.dto.ErrorResponse;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.ratelimit.RateLimitPolicy;
import fr.lapetina.inference.gateway.ratelimit.SlidingWindowRateLimiter;
import fr.lapetina.inference.gateway.security.SecurityValidator;
import fr.lapetina.inference.gateway.support.ManualClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayPipelineTest {

    private static final OperationPolicy CHAT = OperationPolicy.builder("chat")
            .path("/v1/chat/completions")
            .rateLimit(RateLimitPolicy.of(2, 60))
            .requiredFields("messages")
            .build();

    private static final OperationPolicy HEALTH = OperationPolicy.builder("health")
            .method("GET")
            .path("/health")
            .unlimited()
            .expectsBody(false)
            .requiresAdmission(false)
            .build();

    private ManualClock clock;
    private SlidingWindowRateLimiter rateLimiter;
    private ResourceAdmission admission;
    private MetricsRegistry metricsRegistry;
    private GatewayPipeline pipeline;
    private AtomicInteger handlerCalls;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        rateLimiter = new SlidingWindowRateLimiter(clock, 5, Duration.ofHours(1));
        admission = new ResourceAdmission(1);
        metricsRegistry = new MetricsRegistry("test");
        handlerCalls = new AtomicInteger();
        pipeline = GatewayPipeline.builder()
                .objectMapper(new ObjectMapper())
                .securityValidator(SecurityValidator.withDefaults())
                .rateLimiter(rateLimiter)
                .admission(admission)
                .metricsRegistry(metricsRegistry)
                .build();
    }

    @AfterEach
    void tearDown() {
        rateLimiter.close();
        metricsRegistry.close();
    }

    private static RequestContext request(OperationPolicy policy, String json) {
        RequestContext.Builder builder = RequestContext.builder(policy).clientId("10.0.0.1");
        if (json != null) {
            builder.header("Content-Type", "application/json")
                    .body(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
        }
        return builder.build();
    }

    private OperationHandler echo() {
        return payload -> {
            handlerCalls.incrementAndGet();
            return Map.of("received", payload);
        };
    }

    private static String errorType(GatewayResponse response) {
        return ((ErrorResponse) response.body()).getError().getType();
    }

    @Test
    @DisplayName("should order stages from cheapest to most expensive")
    void shouldOrderStages() {
        assertThat(pipeline.stageNames()).containsExactly(
                "request-logging",
                "error-translation",
                "rate-limit",
                "authentication",
                "schema-validation",
                "security-validation",
                "admission"
        );
    }

    @Test
    @DisplayName("should hand the parsed payload to the handler")
    void shouldReachHandler() {
        GatewayResponse response = pipeline.handle(
                request(CHAT, "{\"messages\":[{\"role\":\"user\",\"content\":\"Hi\"}]}"), echo());

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.body()).isInstanceOf(Map.class);
        assertThat(handlerCalls).hasValue(1);
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should reject over the rate limit before parsing the body")
    void shouldRateLimitBeforeParsing() {
        String valid = "{\"messages\":[]}";
        pipeline.handle(request(CHAT, valid), echo());
        pipeline.handle(request(CHAT, valid), echo());

        GatewayResponse response = pipeline.handle(request(CHAT, "{not json"), echo());

        assertThat(response.status()).isEqualTo(429);
        assertThat(response.headers()).containsEntry("Retry-After", "60");
        assertThat(handlerCalls).hasValue(2);
    }

    @Test
    @DisplayName("should reject invalid JSON as a bad request")
    void shouldRejectInvalidJson() {
        GatewayResponse response = pipeline.handle(request(CHAT, "{\"messages\": [1,"), echo());

        assertThat(response.status()).isEqualTo(400);
        assertThat(errorType(response)).isEqualTo("bad_request");
        assertThat(handlerCalls).hasValue(0);
    }

    @Test
    @DisplayName("should stop a dangerous payload before admission and the handler")
    void shouldStopDangerousPayload() {
        AtomicReference<Integer> activeDuringCheck = new AtomicReference<>();
        GatewayResponse response = pipeline.handle(
                request(CHAT, "{\"messages\":[{\"role\":\"user\",\"content\":\"<script>x\"}]}"),
                payload -> {
                    activeDuringCheck.set(admission.getActiveRequests());
                    return Map.of();
                });

        assertThat(response.status()).isEqualTo(403);
        assertThat(errorType(response)).isEqualTo("security_error");
        assertThat(activeDuringCheck.get()).isNull();
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should hold admission while the handler runs and release it after a failure")
    void shouldReleaseAdmissionOnHandlerFailure() {
        AtomicReference<Integer> activeInside = new AtomicReference<>();
        GatewayResponse response = pipeline.handle(
                request(CHAT, "{\"messages\":[]}"),
                payload -> {
                    activeInside.set(admission.getActiveRequests());
                    throw new ValidationFailure("Messages must be a non-empty list", "messages");
                });

        assertThat(activeInside.get()).isEqualTo(1);
        assertThat(response.status()).isEqualTo(400);
        assertThat(((ErrorResponse) response.body()).getError().getField()).isEqualTo("messages");
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should turn an unexpected handler exception into a generic 500")
    void shouldTranslateUnexpectedFailure() {
        GatewayResponse response = pipeline.handle(
                request(CHAT, "{\"messages\":[]}"),
                payload -> {
                    throw new IllegalStateException("secret detail");
                });

        assertThat(response.status()).isEqualTo(500);
        assertThat(((ErrorResponse) response.body()).getError().getMessage())
                .isEqualTo(ErrorTaxonomy.INTERNAL_MESSAGE);
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should reject with a compute failure at capacity but still serve operations without admission")
    void shouldRejectAtCapacity() {
        try (AdmissionToken ignored = admission.acquire()) {
            GatewayResponse busy = pipeline.handle(request(CHAT, "{\"messages\":[]}"), echo());
            GatewayResponse health = pipeline.handle(request(HEALTH, null), payload -> Map.of("status", "busy"));

            assertThat(busy.status()).isEqualTo(503);
            assertThat(((ErrorResponse) busy.body()).getError().getResourceType()).isEqualTo("compute");
            assertThat(health.status()).isEqualTo(200);
        }
        assertThat(handlerCalls).hasValue(0);
        assertThat(admission.getActiveRequests()).isZero();
    }

    @Test
    @DisplayName("should require a well-formed bearer token only where configured")
    void shouldCheckBearerToken() {
        OperationPolicy protectedChat = OperationPolicy.builder("protected")
                .requireApiKey(true)
                .unlimited()
                .build();

        GatewayResponse missing = pipeline.handle(request(protectedChat, "{}"), echo());
        GatewayResponse tooShort = pipeline.handle(RequestContext.builder(protectedChat)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer abc")
                .body(new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)))
                .build(), echo());
        GatewayResponse accepted = pipeline.handle(RequestContext.builder(protectedChat)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer abcdefghijkl")
                .body(new ByteArrayInputStream("{}".getBytes(StandardCharsets.UTF_8)))
                .build(), echo());

        assertThat(missing.status()).isEqualTo(401);
        assertThat(((ErrorResponse) missing.body()).getError().getMessage())
                .isEqualTo("Missing or invalid Authorization header");
        assertThat(tooShort.status()).isEqualTo(401);
        assertThat(((ErrorResponse) tooShort.body()).getError().getMessage()).isEqualTo("Invalid API key format");
        assertThat(accepted.status()).isEqualTo(200);
    }

    @Test
    @DisplayName("should pass a handler's own response through unchanged")
    void shouldPassThroughHandlerResponse() {
        GatewayResponse custom = GatewayResponse.of(202, Map.of("queued", true)).withHeader("X-Test", "1");

        GatewayResponse response = pipeline.handle(request(HEALTH, null), payload -> custom);

        assertThat(response).isSameAs(custom);
    }

    @Test
    @DisplayName("should count requests and errors in the metrics registry")
    void shouldRecordMetrics() {
        pipeline.handle(request(CHAT, "{\"messages\":[]}"), echo());
        pipeline.handle(request(CHAT, "{}"), echo());

        String scrape = metricsRegistry.scrape();
        assertThat(scrape).contains("test_requests_total");
        assertThat(scrape).contains("test_errors_total");
        assertThat(scrape).contains("type=\"validation_error\"");
    }

    @Test
    @DisplayName("should let key names that merely contain denylisted words reach the handler")
    void shouldAllowOrdinaryKeyNames() {
        GatewayResponse nestedKey = pipeline.handle(request(CHAT,
                "{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}],\"metadata\":{\"profile\":\"x\"}}"), echo());
        GatewayResponse topLevelKey = pipeline.handle(request(CHAT,
                "{\"messages\":[{\"role\":\"user\",\"content\":\"hi\"}],\"open_id\":\"x\"}"), echo());

        assertThat(nestedKey.status()).isEqualTo(200);
        assertThat(topLevelKey.status()).isEqualTo(200);
        assertThat(handlerCalls).hasValue(2);
    }

    @Test
    @DisplayName("should answer a nesting attack past the parser limit with a security error")
    void shouldRejectParserDepthAttackAsSecurity() {
        String body = "{\"messages\":" + "[".repeat(1500) + "]".repeat(1500) + "}";

        GatewayResponse response = pipeline.handle(request(CHAT, body), echo());

        assertThat(response.status()).isEqualTo(403);
        assertThat(errorType(response)).isEqualTo("security_error");
        assertThat(((ErrorResponse) response.body()).getError().getCode()).isEqualTo("DEPTH_EXCEEDED");
        assertThat(handlerCalls).hasValue(0);
    }
}
