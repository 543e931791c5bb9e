package fr.lapetina.inference.gateway.domain.failure;

/**
 * Wraps any throwable that is not a {@link GatewayFailure}.
 * The original detail is kept as the cause for logging only.
 */
public final class UnhandledFailure extends GatewayFailure {

    public UnhandledFailure(String message, Throwable cause) {
        super(message, cause);
    }

    public static UnhandledFailure wrap(Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new UnhandledFailure(detail, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
