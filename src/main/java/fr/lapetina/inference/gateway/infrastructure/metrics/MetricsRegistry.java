package fr.lapetina.inference.gateway.infrastructure.metrics;

import fr.lapetina.inference.gateway.domain.failure.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Request counters and latency per operation and status
 * - Error counters by taxonomy type
 * - Rate-limit rejection counters
 * - Admission and rate-window gauges
 * - JVM and processor metrics (the latter also backs the CPU figure of the health surface)
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private static final String SYSTEM_CPU_USAGE = "system.cpu.usage";

    private final PrometheusMeterRegistry registry;
    private final String prefix;
    private final JvmGcMetrics gcMetrics;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> rateLimitCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        // Register JVM metrics
        new JvmMemoryMetrics().bindTo(registry);
        this.gcMetrics = new JvmGcMetrics();
        gcMetrics.bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("inference_gateway");
    }

    /**
     * Counts a finished request and records its latency.
     */
    public void recordRequest(String operation, int status, Duration latency) {
        String statusTag = Integer.toString(status);
        requestCounters.computeIfAbsent(operation + ":" + statusTag, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("operation", operation)
                        .tag("status", statusTag)
                        .register(registry)
        ).increment();

        latencyTimers.computeIfAbsent(operation, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("operation", operation)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Increments error counter.
     */
    public void incrementErrorCount(String operation, ErrorKind kind) {
        errorCounters.computeIfAbsent(operation + ":" + kind.name(), k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("operation", operation)
                        .tag("type", kind.type())
                        .register(registry)
        ).increment();
    }

    /**
     * Increments the rate-limit rejection counter.
     */
    public void incrementRateLimited(String operation) {
        rateLimitCounters.computeIfAbsent(operation, k ->
                Counter.builder(prefix + "_rate_limited_total")
                        .description("Requests rejected by the rate limiter")
                        .tag("operation", operation)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers gauges for the admission ledger.
     */
    public void registerAdmission(Supplier<Number> activeRequests, int maxConcurrent) {
        Gauge.builder(prefix + "_active_requests", activeRequests, s -> s.get().doubleValue())
                .description("Requests currently holding an admission")
                .register(registry);
        Gauge.builder(prefix + "_max_concurrent_requests", () -> maxConcurrent)
                .description("Admission capacity")
                .register(registry);
    }

    /**
     * Registers a gauge for the number of tracked rate-limit buckets.
     */
    public void registerRateWindows(Supplier<Number> trackedKeys) {
        Gauge.builder(prefix + "_rate_windows", trackedKeys, s -> s.get().doubleValue())
                .description("Client buckets held by the rate limiter")
                .register(registry);
    }

    /**
     * Returns system CPU usage in percent, or 0 when the platform does not report it.
     */
    public double cpuUsagePercent() {
        Gauge gauge = registry.find(SYSTEM_CPU_USAGE).gauge();
        if (gauge == null) {
            return 0.0;
        }
        double value = gauge.value();
        return Double.isNaN(value) || value < 0 ? 0.0 : value * 100.0;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        gcMetrics.close();
        registry.close();
    }
}
