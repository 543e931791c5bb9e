package fr.lapetina.inference.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.inference.gateway.admission.AcceleratorProbe;
import fr.lapetina.inference.gateway.admission.ResourceAdmission;
import fr.lapetina.inference.gateway.api.HttpServer;
import fr.lapetina.inference.gateway.api.Route;
import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.backend.UnloadedBackend;
import fr.lapetina.inference.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.inference.gateway.infrastructure.http.CircuitBreaker;
import fr.lapetina.inference.gateway.infrastructure.http.OllamaBackend;
import fr.lapetina.inference.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.gateway.operation.ChatCompletionOperation;
import fr.lapetina.inference.gateway.operation.CompletionOperation;
import fr.lapetina.inference.gateway.operation.EmbeddingOperation;
import fr.lapetina.inference.gateway.operation.HealthOperation;
import fr.lapetina.inference.gateway.operation.MetricsOperation;
import fr.lapetina.inference.gateway.operation.ModelListOperation;
import fr.lapetina.inference.gateway.operation.OperationCatalog;
import fr.lapetina.inference.gateway.pipeline.ErrorTaxonomy;
import fr.lapetina.inference.gateway.pipeline.GatewayPipeline;
import fr.lapetina.inference.gateway.ratelimit.SlidingWindowRateLimiter;
import fr.lapetina.inference.gateway.security.SecurityValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the fully-wired gateway from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (GatewayFactory factory = GatewayFactory.create("gateway.yaml").start();
 *      HttpServer server = factory.createServer()) {
 *     server.start();
 * }
 * }</pre>
 */
public class GatewayFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GatewayFactory.class);

    public static final String DEFAULT_CONFIG_PATH = "gateway.yaml";

    private final GatewayConfig config;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final MetricsRegistry metricsRegistry;
    private final SlidingWindowRateLimiter rateLimiter;
    private final ResourceAdmission admission;
    private final ErrorTaxonomy taxonomy;
    private final InferenceBackend backend;
    private final GatewayPipeline pipeline;
    private final List<Route> routes;

    protected GatewayFactory(GatewayConfig config, InferenceBackend backendOverride, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.objectMapper = createObjectMapper();
        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
        this.taxonomy = new ErrorTaxonomy();

        GatewayConfig.RateLimitConfig rateLimitConfig = config.getRateLimit();
        this.rateLimiter = new SlidingWindowRateLimiter(
                clock,
                rateLimitConfig.getEvictAfterWindows(),
                Duration.ofSeconds(rateLimitConfig.getSweepIntervalSeconds())
        );

        GatewayConfig.AdmissionConfig admissionConfig = config.getAdmission();
        this.admission = new ResourceAdmission(
                admissionConfig.getMaxConcurrent(),
                admissionConfig.getGpuMemoryThreshold(),
                AcceleratorProbe.NONE,
                metricsRegistry::cpuUsagePercent
        );

        GatewayConfig.LimitsConfig limits = config.getLimits();
        SecurityValidator securityValidator = SecurityValidator.withLimits(
                limits.getMaxDepth(), limits.getMaxStringLength(), limits.getMaxArrayLength());

        this.backend = backendOverride != null ? backendOverride : createBackend();

        this.pipeline = GatewayPipeline.builder()
                .objectMapper(objectMapper)
                .securityValidator(securityValidator)
                .rateLimiter(rateLimiter)
                .admission(admission)
                .metricsRegistry(metricsRegistry)
                .taxonomy(taxonomy)
                .slowRequestThreshold(Duration.ofMillis(admissionConfig.getSlowRequestWarningMs()))
                .build();

        this.routes = createRoutes();

        metricsRegistry.registerAdmission(admission::getActiveRequests, admission.getMaxConcurrent());
        metricsRegistry.registerRateWindows(rateLimiter::trackedKeys);

        log.info("GatewayFactory initialized: backend={}, routes={}, stages={}",
                backend.name(), routes.size(), pipeline.stageNames());
    }

    public static GatewayFactory create(String configPath) {
        log.info("Initializing GatewayFactory from config: {}", configPath);
        return new GatewayFactory(new ConfigLoader(configPath).load(), null, Clock.systemUTC());
    }

    public static GatewayFactory create() {
        return create(DEFAULT_CONFIG_PATH);
    }

    /**
     * Starts background housekeeping.
     */
    public GatewayFactory start() {
        rateLimiter.start();
        return this;
    }

    /**
     * Creates an HTTP server bound to the configured address, not yet started.
     */
    public HttpServer createServer() throws IOException {
        GatewayConfig.ServerConfig server = config.getServer();
        return new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getWorkerThreads(),
                pipeline,
                routes,
                taxonomy,
                objectMapper
        );
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private InferenceBackend createBackend() {
        GatewayConfig.BackendConfig backendConfig = config.getBackend();
        String type = backendConfig.getType() != null
                ? backendConfig.getType().toLowerCase(Locale.ROOT)
                : UnloadedBackend.NAME;

        if (OllamaBackend.NAME.equals(type)) {
            CircuitBreaker breaker = new CircuitBreaker(
                    OllamaBackend.NAME,
                    backendConfig.getFailureThreshold(),
                    Duration.ofMillis(backendConfig.getRecoveryTimeoutMs())
            );
            return new OllamaBackend(
                    URI.create(backendConfig.getUrl()),
                    backendConfig.getModels(),
                    Duration.ofMillis(backendConfig.getConnectTimeoutMs()),
                    Duration.ofMillis(backendConfig.getRequestTimeoutMs()),
                    breaker,
                    objectMapper
            );
        }
        if (!UnloadedBackend.NAME.equals(type)) {
            log.warn("Unknown backend type, no model will be served: type={}", type);
        }
        return new UnloadedBackend();
    }

    private List<Route> createRoutes() {
        OperationCatalog catalog = new OperationCatalog(config);
        List<Route> result = new ArrayList<>();
        result.add(new Route(catalog.chat(), new ChatCompletionOperation(backend, clock)));
        result.add(new Route(catalog.completion(), new CompletionOperation(backend, clock)));
        result.add(new Route(catalog.embedding(), new EmbeddingOperation(backend)));
        result.add(new Route(catalog.models(), new ModelListOperation(backend, clock)));
        result.add(new Route(catalog.health(), new HealthOperation(admission, backend, clock)));
        if (config.getMetrics().isEnabled()) {
            result.add(new Route(catalog.metrics(), new MetricsOperation(metricsRegistry)));
        }
        return List.copyOf(result);
    }

    public GatewayConfig getConfig() {
        return config;
    }

    public GatewayPipeline getPipeline() {
        return pipeline;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public ResourceAdmission getAdmission() {
        return admission;
    }

    public SlidingWindowRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public InferenceBackend getBackend() {
        return backend;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        log.info("Shutting down GatewayFactory...");

        try {
            rateLimiter.close();
        } catch (Exception e) {
            log.warn("Error closing rate limiter", e);
        }

        try {
            backend.close();
        } catch (Exception e) {
            log.warn("Error closing backend", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("GatewayFactory shut down");
    }
}
