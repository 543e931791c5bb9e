package fr.lapetina.inference.gateway.pipeline;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;

/**
 * One link of the middleware chain: either short-circuits by returning or throwing,
 * or calls {@code next} to run the rest of the chain.
 */
public interface Stage {

    GatewayResponse apply(RequestContext context, Next next);

    /**
     * Returns the stage name used in logs.
     */
    String getName();

    /**
     * Continuation running the remaining stages and the handler.
     */
    @FunctionalInterface
    interface Next {
        GatewayResponse proceed(RequestContext context);
    }
}
