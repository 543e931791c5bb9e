package fr.lapetina.inference.gateway.domain.failure;

/**
 * Client input is structurally wrong or out of range. Rendered as 400 {@code validation_error}.
 */
public final class ValidationFailure extends GatewayFailure {

    private final String field;

    public ValidationFailure(String message) {
        this(message, null);
    }

    public ValidationFailure(String message, String field) {
        super(message);
        this.field = field;
    }

    /**
     * Offending field path, or {@code null} when the failure is not tied to one field.
     */
    public String field() {
        return field;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.VALIDATION;
    }
}
