package fr.lapetina.inference.gateway.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Response produced by the pipeline, before it is written to the wire.
 * Immutable; the body is serialized as JSON unless it is a plain {@code String}.
 */
public record GatewayResponse(
        int status,
        Object body,
        Map<String, String> headers
) {
    public static final String JSON = "application/json";

    public GatewayResponse {
        Objects.requireNonNull(body, "Body is required");
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static GatewayResponse ok(Object body) {
        return new GatewayResponse(200, body, null);
    }

    public static GatewayResponse of(int status, Object body) {
        return new GatewayResponse(status, body, null);
    }

    public GatewayResponse withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new GatewayResponse(status, body, copy);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public String contentType() {
        return headers.getOrDefault("Content-Type", JSON);
    }
}
