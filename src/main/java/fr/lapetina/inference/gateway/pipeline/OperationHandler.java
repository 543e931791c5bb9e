package fr.lapetina.inference.gateway.pipeline;

import java.util.Map;

/**
 * Business handler wrapped by the pipeline.
 *
 * <p>Receives the validated, security-cleared payload. Returns an opaque success body
 * (serialized as JSON with status 200) or a
 * {@link fr.lapetina.inference.gateway.domain.model.GatewayResponse} for full control.
 * Failures are signalled by throwing a
 * {@link fr.lapetina.inference.gateway.domain.failure.GatewayFailure}; anything else
 * thrown is reported as an internal error.
 */
@FunctionalInterface
public interface OperationHandler {

    Object handle(Map<String, Object> payload);
}
