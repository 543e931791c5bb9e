package fr.lapetina.inference.gateway.domain.failure;

/**
 * Payload contains a disallowed construct.
 *
 * <p>The message names the matched rule and is only ever logged; the client sees a generic text.
 */
public final class SecurityFailure extends GatewayFailure {

    public static final String DEPTH_EXCEEDED = "DEPTH_EXCEEDED";
    public static final String DANGEROUS_PATTERN = "DANGEROUS_PATTERN";
    public static final String STRING_TOO_LONG = "STRING_TOO_LONG";
    public static final String ARRAY_TOO_LARGE = "ARRAY_TOO_LARGE";
    public static final String DANGEROUS_KEY = "DANGEROUS_KEY";
    public static final String INVALID_KEY = "INVALID_KEY";

    private final String code;

    public SecurityFailure(String message) {
        this(message, ErrorKind.SECURITY.defaultCode());
    }

    public SecurityFailure(String message, String code) {
        super(message);
        this.code = code != null ? code : ErrorKind.SECURITY.defaultCode();
    }

    @Override
    public String code() {
        return code;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SECURITY;
    }
}
