package fr.lapetina.inference.gateway.pipeline;

import fr.lapetina.inference.gateway.ratelimit.RateLimitPolicy;

import java.util.List;
import java.util.Objects;

/**
 * Per-operation settings read by the pipeline stages.
 *
 * @param name              operation name used in logs, metrics and rate-limit bucket keys
 * @param method            HTTP method the operation answers to
 * @param path              request path
 * @param rateLimit         sliding-window limit, or {@code null} for an unlimited operation
 * @param requireApiKey     whether the bearer credential format is checked
 * @param expectsBody       whether a JSON object body is parsed and validated
 * @param maxBodyBytes      body size ceiling
 * @param requiredFields    top-level fields that must be present and non-null
 * @param requiresAdmission whether the handler runs under a concurrency admission
 */
public record OperationPolicy(
        String name,
        String method,
        String path,
        RateLimitPolicy rateLimit,
        boolean requireApiKey,
        boolean expectsBody,
        int maxBodyBytes,
        List<String> requiredFields,
        boolean requiresAdmission
) {
    public static final int DEFAULT_MAX_BODY_BYTES = 1024 * 1024;

    public OperationPolicy {
        Objects.requireNonNull(name, "Name is required");
        Objects.requireNonNull(method, "Method is required");
        Objects.requireNonNull(path, "Path is required");
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be > 0");
        }
        requiredFields = requiredFields != null ? List.copyOf(requiredFields) : List.of();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String method = "POST";
        private String path;
        private RateLimitPolicy rateLimit = RateLimitPolicy.defaults();
        private boolean requireApiKey;
        private boolean expectsBody = true;
        private int maxBodyBytes = DEFAULT_MAX_BODY_BYTES;
        private List<String> requiredFields = List.of();
        private boolean requiresAdmission = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder rateLimit(RateLimitPolicy rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder unlimited() {
            this.rateLimit = null;
            return this;
        }

        public Builder requireApiKey(boolean requireApiKey) {
            this.requireApiKey = requireApiKey;
            return this;
        }

        public Builder expectsBody(boolean expectsBody) {
            this.expectsBody = expectsBody;
            return this;
        }

        public Builder maxBodyBytes(int maxBodyBytes) {
            this.maxBodyBytes = maxBodyBytes;
            return this;
        }

        public Builder requiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
            return this;
        }

        public Builder requiredFields(String... requiredFields) {
            this.requiredFields = List.of(requiredFields);
            return this;
        }

        public Builder requiresAdmission(boolean requiresAdmission) {
            this.requiresAdmission = requiresAdmission;
            return this;
        }

        public OperationPolicy build() {
            return new OperationPolicy(
                    name, method, path != null ? path : "/" + name, rateLimit, requireApiKey,
                    expectsBody, maxBodyBytes, requiredFields, requiresAdmission
            );
        }
    }
}
