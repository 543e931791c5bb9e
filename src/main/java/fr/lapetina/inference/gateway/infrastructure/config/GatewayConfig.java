package fr.lapetina.inference.gateway.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML.
 */
public class GatewayConfig {

    private ServerConfig server = new ServerConfig();
    private LimitsConfig limits = new LimitsConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private AdmissionConfig admission = new AdmissionConfig();
    private Map<String, OperationConfig> operations = new LinkedHashMap<>();
    private BackendConfig backend = new BackendConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public LimitsConfig getLimits() { return limits; }
    public void setLimits(LimitsConfig limits) { this.limits = limits; }

    public RateLimitConfig getRateLimit() { return rateLimit; }
    public void setRateLimit(RateLimitConfig rateLimit) { this.rateLimit = rateLimit; }

    public AdmissionConfig getAdmission() { return admission; }
    public void setAdmission(AdmissionConfig admission) { this.admission = admission; }

    public Map<String, OperationConfig> getOperations() { return operations; }
    public void setOperations(Map<String, OperationConfig> operations) { this.operations = operations; }

    public BackendConfig getBackend() { return backend; }
    public void setBackend(BackendConfig backend) { this.backend = backend; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Returns the overrides for an operation, or an empty override set.
     */
    public OperationConfig operation(String name) {
        OperationConfig config = operations != null ? operations.get(name) : null;
        return config != null ? config : new OperationConfig();
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 32;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Payload size and shape limits.
     */
    public static class LimitsConfig {
        private int maxBodyBytes = 1024 * 1024;
        private int maxDepth = 10;
        private int maxStringLength = 10_000;
        private int maxArrayLength = 1000;

        public int getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public int getMaxStringLength() { return maxStringLength; }
        public void setMaxStringLength(int maxStringLength) { this.maxStringLength = maxStringLength; }

        public int getMaxArrayLength() { return maxArrayLength; }
        public void setMaxArrayLength(int maxArrayLength) { this.maxArrayLength = maxArrayLength; }
    }

    /**
     * Default sliding-window limit and bucket housekeeping.
     */
    public static class RateLimitConfig {
        private int maxRequests = 60;
        private int windowSeconds = 60;
        private int evictAfterWindows = 5;
        private int sweepIntervalSeconds = 60;

        public int getMaxRequests() { return maxRequests; }
        public void setMaxRequests(int maxRequests) { this.maxRequests = maxRequests; }

        public int getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(int windowSeconds) { this.windowSeconds = windowSeconds; }

        public int getEvictAfterWindows() { return evictAfterWindows; }
        public void setEvictAfterWindows(int evictAfterWindows) { this.evictAfterWindows = evictAfterWindows; }

        public int getSweepIntervalSeconds() { return sweepIntervalSeconds; }
        public void setSweepIntervalSeconds(int sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }
    }

    /**
     * Concurrency admission settings.
     */
    public static class AdmissionConfig {
        private int maxConcurrent = 10;
        private double gpuMemoryThreshold = 0.9;
        private long slowRequestWarningMs = 30_000;

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public double getGpuMemoryThreshold() { return gpuMemoryThreshold; }
        public void setGpuMemoryThreshold(double gpuMemoryThreshold) { this.gpuMemoryThreshold = gpuMemoryThreshold; }

        public long getSlowRequestWarningMs() { return slowRequestWarningMs; }
        public void setSlowRequestWarningMs(long slowRequestWarningMs) { this.slowRequestWarningMs = slowRequestWarningMs; }
    }

    /**
     * Per-operation overrides. Unset fields keep the operation's built-in value.
     */
    public static class OperationConfig {
        private Integer maxRequests;
        private Integer windowSeconds;
        private Boolean unlimited;
        private Integer maxBodyBytes;
        private List<String> requiredFields;
        private Boolean requireApiKey;

        public Integer getMaxRequests() { return maxRequests; }
        public void setMaxRequests(Integer maxRequests) { this.maxRequests = maxRequests; }

        public Integer getWindowSeconds() { return windowSeconds; }
        public void setWindowSeconds(Integer windowSeconds) { this.windowSeconds = windowSeconds; }

        public Boolean getUnlimited() { return unlimited; }
        public void setUnlimited(Boolean unlimited) { this.unlimited = unlimited; }

        public Integer getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(Integer maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }

        public List<String> getRequiredFields() { return requiredFields; }
        public void setRequiredFields(List<String> requiredFields) { this.requiredFields = requiredFields; }

        public Boolean getRequireApiKey() { return requireApiKey; }
        public void setRequireApiKey(Boolean requireApiKey) { this.requireApiKey = requireApiKey; }
    }

    /**
     * Model executor configuration.
     */
    public static class BackendConfig {
        private String type = "none";
        private String url = "http://localhost:11434";
        private List<String> models = new ArrayList<>();
        private long connectTimeoutMs = 5_000;
        private long requestTimeoutMs = 120_000;
        private int failureThreshold = 5;
        private long recoveryTimeoutMs = 30_000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public List<String> getModels() { return models; }
        public void setModels(List<String> models) { this.models = models; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public long getRecoveryTimeoutMs() { return recoveryTimeoutMs; }
        public void setRecoveryTimeoutMs(long recoveryTimeoutMs) { this.recoveryTimeoutMs = recoveryTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "inference_gateway";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
