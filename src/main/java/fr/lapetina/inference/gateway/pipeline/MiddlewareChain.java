package fr.lapetina.inference.gateway.pipeline;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;

import java.util.List;

/**
 * Ordered list of stages wrapped around a handler.
 *
 * <p>Stage {@code i} runs inside stage {@code i - 1}, so a stage that does not call its
 * continuation stops every later stage and the handler. The chain holds no request state.
 */
public final class MiddlewareChain {

    private final List<Stage> stages;

    public MiddlewareChain(List<Stage> stages) {
        this.stages = List.copyOf(stages);
    }

    public GatewayResponse execute(RequestContext context, OperationHandler handler) {
        return proceed(0, context, handler);
    }

    private GatewayResponse proceed(int index, RequestContext context, OperationHandler handler) {
        if (index == stages.size()) {
            return invoke(context, handler);
        }
        return stages.get(index).apply(context, next -> proceed(index + 1, next, handler));
    }

    private static GatewayResponse invoke(RequestContext context, OperationHandler handler) {
        Object result = handler.handle(context.payload());
        if (result instanceof GatewayResponse response) {
            return response;
        }
        return GatewayResponse.ok(result);
    }

    public List<String> stageNames() {
        return stages.stream().map(Stage::getName).toList();
    }
}
