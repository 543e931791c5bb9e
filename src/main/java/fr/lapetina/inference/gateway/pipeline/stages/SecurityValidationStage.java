package fr.lapetina.inference.gateway.pipeline.stages;

import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import fr.lapetina.inference.gateway.pipeline.Stage;
import fr.lapetina.inference.gateway.security.SecurityValidator;

public final class SecurityValidationStage implements Stage {

    private final SecurityValidator validator;

    public SecurityValidationStage(SecurityValidator validator) {
        this.validator = validator;
    }

    @Override
    public GatewayResponse apply(RequestContext context, Next next) {
        if (context.payload() != null && !context.payload().isEmpty()) {
            validator.validate(context.payload());
        }
        return next.proceed(context);
    }

    @Override
    public String getName() {
        return "security-validation";
    }
}
