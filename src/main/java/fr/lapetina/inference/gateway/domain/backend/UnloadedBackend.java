package fr.lapetina.inference.gateway.domain.backend;

import fr.lapetina.inference.gateway.domain.failure.ResourceFailure;
import fr.lapetina.inference.gateway.domain.model.ChatMessage;
import fr.lapetina.inference.gateway.domain.model.EmbeddingResult;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;
import fr.lapetina.inference.gateway.domain.model.GenerationResult;

import java.util.List;

/**
 * Backend used when none is configured. Never ready; every call fails with a
 * {@code model} resource failure.
 */
public final class UnloadedBackend implements InferenceBackend {

    public static final String NAME = "none";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isReady() {
        return false;
    }

    @Override
    public List<String> models() {
        return List.of();
    }

    @Override
    public GenerationResult chat(String model, List<ChatMessage> messages, GenerationOptions options) {
        throw notLoaded();
    }

    @Override
    public GenerationResult complete(String model, String prompt, GenerationOptions options) {
        throw notLoaded();
    }

    @Override
    public EmbeddingResult embed(String model, List<String> inputs) {
        throw notLoaded();
    }

    private static ResourceFailure notLoaded() {
        return new ResourceFailure("Model not loaded", ResourceFailure.MODEL);
    }
}
