package fr.lapetina.inference.gateway.domain.failure;

/**
 * Root of the typed failures raised by pipeline stages and operation handlers.
 *
 * <p>Subclasses carry the structured data needed to render the error body, so the
 * response never has to be re-derived from a generic exception message.
 */
public abstract class GatewayFailure extends RuntimeException {

    protected GatewayFailure(String message) {
        super(message);
    }

    protected GatewayFailure(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();

    /**
     * Machine-readable code placed in {@code error.code}.
     */
    public String code() {
        return kind().defaultCode();
    }
}
