package fr.lapetina.inference.gateway.api;

import fr.lapetina.inference.gateway.pipeline.OperationHandler;
import fr.lapetina.inference.gateway.pipeline.OperationPolicy;

import java.util.Objects;

/**
 * Binds an operation's policy to the handler that serves it.
 */
public record Route(OperationPolicy policy, OperationHandler handler) {

    public Route {
        Objects.requireNonNull(policy, "Policy is required");
        Objects.requireNonNull(handler, "Handler is required");
    }
}
