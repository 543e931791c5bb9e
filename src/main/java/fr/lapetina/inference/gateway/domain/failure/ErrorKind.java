package fr.lapetina.inference.gateway.domain.failure;

/**
 * Error taxonomy for gateway requests.
 * Each kind carries the HTTP status, the client-visible {@code type} and the default {@code code}.
 */
public enum ErrorKind {
    /** Client sent structurally wrong or out-of-range input */
    VALIDATION(400, "validation_error", "VALIDATION_FAILED"),

    /** Payload matched a disallowed construct */
    SECURITY(403, "security_error", "SECURITY_ERROR"),

    /** Capacity exhausted, backend not ready or backend call failed */
    RESOURCE(503, "resource_error", "RESOURCE_UNAVAILABLE"),

    /** Body could not be parsed into the expected shape */
    BAD_REQUEST(400, "bad_request", "INVALID_REQUEST"),

    /** Missing or malformed bearer credential */
    AUTHENTICATION(401, "authentication_error", "UNAUTHORIZED"),

    /** Per-client sliding window exhausted */
    RATE_LIMIT(429, "rate_limit_error", "RATE_LIMIT_EXCEEDED"),

    /** No operation registered for the path */
    NOT_FOUND(404, "not_found", "NOT_FOUND"),

    /** Operation exists but not for this method */
    METHOD_NOT_ALLOWED(405, "method_not_allowed", "METHOD_NOT_ALLOWED"),

    /** Anything not anticipated */
    INTERNAL(500, "internal_error", "INTERNAL_SERVER_ERROR");

    private final int status;
    private final String type;
    private final String defaultCode;

    ErrorKind(int status, String type, String defaultCode) {
        this.status = status;
        this.type = type;
        this.defaultCode = defaultCode;
    }

    public int status() {
        return status;
    }

    public String type() {
        return type;
    }

    public String defaultCode() {
        return defaultCode;
    }

    public boolean isServerError() {
        return status >= 500;
    }
}
