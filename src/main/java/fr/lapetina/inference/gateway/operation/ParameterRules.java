package fr.lapetina.inference.gateway.operation;

import fr.lapetina.inference.gateway.domain.backend.InferenceBackend;
import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import fr.lapetina.inference.gateway.domain.failure.ValidationFailure;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;

import java.util.Map;

/**
 * Shared parameter checks for the generation operations.
 */
final class ParameterRules {

    static final int MIN_MAX_TOKENS = 1;
    static final int MAX_MAX_TOKENS = 4096;
    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;

    private ParameterRules() {
    }

    static GenerationOptions generationOptions(Map<String, Object> payload) {
        return new GenerationOptions(
                intInRange(payload, "max_tokens", MIN_MAX_TOKENS, MAX_MAX_TOKENS,
                        GenerationOptions.DEFAULT_MAX_TOKENS),
                doubleInRange(payload, "temperature", MIN_TEMPERATURE, MAX_TEMPERATURE,
                        GenerationOptions.DEFAULT_TEMPERATURE)
        );
    }

    static int intInRange(Map<String, Object> payload, String field, int min, int max, int defaultValue) {
        Object value = payload.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Integer || value instanceof Long)) {
            throw new ValidationFailure(field + " must be an integer", field);
        }
        long number = ((Number) value).longValue();
        if (number < min || number > max) {
            throw new ValidationFailure(field + " must be between " + min + " and " + max, field);
        }
        return (int) number;
    }

    static double doubleInRange(Map<String, Object> payload, String field, double min, double max,
                                double defaultValue) {
        Object value = payload.get(field);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number)) {
            throw new ValidationFailure(field + " must be a number", field);
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || d < min || d > max) {
            throw new ValidationFailure(field + " must be between " + min + " and " + max, field);
        }
        return d;
    }

    /**
     * Picks the model for a call: the requested one if the backend serves it, else the default.
     *
     * @throws ResourceFailure   when the backend has nothing loaded
     * @throws ValidationFailure when the requested model is not served
     */
    static String resolveModel(Map<String, Object> payload, InferenceBackend backend) {
        if (!backend.isReady()) {
            throw new ResourceFailure("Model not loaded", ResourceFailure.MODEL);
        }
        Object requested = payload.get("model");
        if (requested == null) {
            return backend.defaultModel();
        }
        if (!(requested instanceof String name)) {
            throw new ValidationFailure("model must be a string", "model");
        }
        if (!backend.models().contains(name)) {
            throw new ValidationFailure("Model not found: " + name, "model");
        }
        return name;
    }
}
