package fr.lapetina.inference.gateway.domain.backend;

import fr.lapetina.inference.gateway.domain.model.ChatMessage;
import fr.lapetina.inference.gateway.domain.model.EmbeddingResult;
import fr.lapetina.inference.gateway.domain.model.GenerationOptions;
import fr.lapetina.inference.gateway.domain.model.GenerationResult;

import java.util.List;

/**
 * The model executor behind the gateway.
 *
 * <p>Built once at start-up and shared by every operation handler. Calls are blocking and
 * run on the request thread while it holds an admission. Implementations report failures
 * as {@link fr.lapetina.inference.gateway.domain.failure.GatewayFailure}s.
 */
public interface InferenceBackend extends AutoCloseable {

    /**
     * Short backend type name, reported by the health operation.
     */
    String name();

    /**
     * Whether the backend can currently serve generation calls.
     */
    boolean isReady();

    /**
     * Model names this backend serves. The first one is the default.
     */
    List<String> models();

    GenerationResult chat(String model, List<ChatMessage> messages, GenerationOptions options);

    GenerationResult complete(String model, String prompt, GenerationOptions options);

    EmbeddingResult embed(String model, List<String> inputs);

    default String defaultModel() {
        List<String> models = models();
        return models.isEmpty() ? null : models.get(0);
    }

    @Override
    default void close() {
    }
}
