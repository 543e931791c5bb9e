package fr.lapetina.inference.gateway.pipeline.stages;

import fr.lapetina.inference.gateway.domain.failure.AuthenticationFailure;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;

/**
 * Bearer credential format check for operations configured with {@code requireApiKey}.
 *
 * <p>This is a format stub only: presence of {@code Authorization: Bearer <token>} and a
 * minimum token length. No credential store is consulted and any well-formed token passes.
 */
public final class AuthenticationStage implements Stage {

    private static final String BEARER_PREFIX = "Bearer ";
    public static final int MIN_TOKEN_LENGTH = 10;

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        if (!context.operation().requireApiKey()) {
            return next.proceed(context);
        }

        String authorization = context.header("Authorization");
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            throw new AuthenticationFailure("Missing or invalid Authorization header");
        }

        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        if (token.length() < MIN_TOKEN_LENGTH) {
            throw new AuthenticationFailure("Invalid API key format");
        }
        return next.proceed(context);
    }

    @Override
    public String getName() {
        return "authentication";
    }
}
