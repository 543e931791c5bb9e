package fr.lapetina.inference.gateway.pipeline;

import java.io.InputStream;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-request state carried through the stages.
 *
 * <p>Confined to the thread handling the request. The only mutable part is the parsed
 * payload, set once by the schema stage.
 */
public final class RequestContext {

    private final String requestId;
    private final OperationPolicy operation;
    private final String method;
    private final String path;
    private final Map<String, String> headers;
    private final String clientId;
    private final InputStream body;
    private final Instant receivedAt;

    private Map<String, Object> payload;

    private RequestContext(Builder builder) {
        this.requestId = builder.requestId != null ? builder.requestId : UUID.randomUUID().toString();
        this.operation = Objects.requireNonNull(builder.operation, "Operation is required");
        this.method = builder.method != null ? builder.method : builder.operation.method();
        this.path = builder.path != null ? builder.path : builder.operation.path();
        this.headers = Map.copyOf(builder.headers);
        this.clientId = builder.clientId != null ? builder.clientId : "unknown";
        this.body = builder.body != null ? builder.body : InputStream.nullInputStream();
        this.receivedAt = builder.receivedAt != null ? builder.receivedAt : Instant.now();
    }

    public String requestId() {
        return requestId;
    }

    public OperationPolicy operation() {
        return operation;
    }

    public String operationName() {
        return operation.name();
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    /**
     * Returns the first value of a header, matched case-insensitively, or {@code null}.
     */
    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String clientId() {
        return clientId;
    }

    public InputStream body() {
        return body;
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    /**
     * Parsed payload, or {@code null} before the schema stage ran.
     */
    public Map<String, Object> payload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        if (this.payload != null) {
            throw new IllegalStateException("Payload already set for request " + requestId);
        }
        this.payload = payload;
    }

    public static Builder builder(OperationPolicy operation) {
        return new Builder(operation);
    }

    public static final class Builder {
        private final OperationPolicy operation;
        private final Map<String, String> headers = new HashMap<>();
        private String requestId;
        private String method;
        private String path;
        private String clientId;
        private InputStream body;
        private Instant receivedAt;

        private Builder(OperationPolicy operation) {
            this.operation = operation;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                this.headers.put(name.toLowerCase(Locale.ROOT), value);
            }
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder body(InputStream body) {
            this.body = body;
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public RequestContext build() {
            return new RequestContext(this);
        }
    }
}
