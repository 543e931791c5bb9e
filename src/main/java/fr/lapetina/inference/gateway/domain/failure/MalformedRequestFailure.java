package fr.lapetina.inference.gateway.domain.failure;

/**
 * Body could not be parsed into the expected tree shape, before any validation ran.
 */
public final class MalformedRequestFailure extends GatewayFailure {

    public MalformedRequestFailure(String message) {
        super(message);
    }

    public MalformedRequestFailure(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.BAD_REQUEST;
    }
}
