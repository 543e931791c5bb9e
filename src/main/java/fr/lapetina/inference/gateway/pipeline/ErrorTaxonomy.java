package fr.lapetina.inference.gateway.pipeline;

import fr.lapetina.inference.gateway.api.dto.ErrorResponse;
import fr.lapetina.inference.gateway.domain.failure.ErrorKind;
import fr.lapetina.inference.gateway.domain.failure.GatewayFailure;
import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import fr.lapetina.inference.gateway.domain.failure.SecurityFailure;
import fr.lapetina.inference.gateway.domain.failure.UnhandledFailure;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Canonical mapping from failures to HTTP responses.
 *
 * <p>Every mapping logs once: WARN for 4xx, ERROR with the stack trace for 5xx.
 * Security and internal failures are returned with a generic message; their detail
 * only reaches the server log.
 */
public final class ErrorTaxonomy {

    private static final Logger log = LoggerFactory.getLogger(ErrorTaxonomy.class);

    public static final String SECURITY_MESSAGE = "Security violation detected";
    public static final String INTERNAL_MESSAGE = "An unexpected error occurred";

    /**
     * Converts any throwable raised by a stage or handler into a response.
     *
     * @param operation name of the operation that failed, for logging
     * @param thrown    the raised failure
     */
    public GatewayResponse toResponse(String operation, Throwable thrown) {
        GatewayFailure failure = classify(thrown);
        ErrorKind kind = failure.kind();

        ErrorResponse body;
        if (failure instanceof ValidationFailure validation) {
            log.warn("Validation error: operation={}, field={}, message={}",
                    operation, validation.field(), validation.getMessage());
            body = ErrorResponse.of(kind, validation.getMessage()).withField(validation.field());

        } else if (failure instanceof SecurityFailure) {
            log.warn("Security error: operation={}, code={}, detail={}",
                    operation, failure.code(), failure.getMessage());
            body = ErrorResponse.of(kind, failure.code(), SECURITY_MESSAGE);

        } else if (failure instanceof ResourceFailure resource) {
            log.error("Resource error: operation={}, resourceType={}, message={}",
                    operation, resource.resourceType(), resource.getMessage(), resource);
            body = ErrorResponse.of(kind, resource.getMessage()).withResourceType(resource.resourceType());

        } else if (failure instanceof UnhandledFailure) {
            Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
            log.error("Unexpected error: operation={}, errorType={}, error={}",
                    operation, cause.getClass().getSimpleName(), failure.getMessage(), cause);
            body = ErrorResponse.of(kind, INTERNAL_MESSAGE);

        } else if (kind.isServerError()) {
            log.error("Request failed: operation={}, type={}, message={}",
                    operation, kind.type(), failure.getMessage(), failure);
            body = ErrorResponse.of(kind, failure.code(), INTERNAL_MESSAGE);

        } else {
            log.warn("Request rejected: operation={}, type={}, message={}",
                    operation, kind.type(), failure.getMessage());
            body = ErrorResponse.of(kind, failure.code(), failure.getMessage());
        }

        return GatewayResponse.of(kind.status(), body);
    }

    /**
     * Builds the 429 response. The attempt that produced it is not counted by the limiter.
     */
    public GatewayResponse rateLimited(
            String operation,
            String clientId,
            int maxRequests,
            Duration window,
            Duration retryAfter
    ) {
        log.warn("Rate limit exceeded: operation={}, clientId={}, limit={}, windowSeconds={}",
                operation, clientId, maxRequests, window.toSeconds());

        String message = "Rate limit exceeded: " + maxRequests + " requests per "
                + window.toSeconds() + " seconds";
        long retrySeconds = Math.max(1, (retryAfter.toMillis() + 999) / 1000);

        return GatewayResponse.of(ErrorKind.RATE_LIMIT.status(), ErrorResponse.of(ErrorKind.RATE_LIMIT, message))
                .withHeader("Retry-After", Long.toString(retrySeconds));
    }

    public GatewayResponse notFound(String method, String path) {
        log.warn("No operation registered: method={}, path={}", method, path);
        return GatewayResponse.of(ErrorKind.NOT_FOUND.status(),
                ErrorResponse.of(ErrorKind.NOT_FOUND, "Not Found: " + path));
    }

    public GatewayResponse methodNotAllowed(String method, String path, String allowed) {
        log.warn("Method not allowed: method={}, path={}, allowed={}", method, path, allowed);
        return GatewayResponse.of(ErrorKind.METHOD_NOT_ALLOWED.status(),
                        ErrorResponse.of(ErrorKind.METHOD_NOT_ALLOWED, "Method Not Allowed"))
                .withHeader("Allow", allowed);
    }

    /**
     * Resolves the failure kind of a throwable, unwrapping async wrappers.
     */
    public static GatewayFailure classify(Throwable thrown) {
        Throwable current = thrown;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof GatewayFailure failure) {
            return failure;
        }
        return UnhandledFailure.wrap(current);
    }
}
