package fr.lapetina.inference.gateway.domain.failure;

/**
 * Bearer credential is missing or has an invalid format.
 * Only the format is checked; no credential store is consulted.
 */
public final class AuthenticationFailure extends GatewayFailure {

    public AuthenticationFailure(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.AUTHENTICATION;
    }
}
