package fr.lapetina.inference.gateway;

import fr.lapetina.inference.gateway.integration.TestGatewayFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class InferenceGatewayApplicationTest {

    @Test
    @DisplayName("should bind an ephemeral port and release waiters on close")
    void shouldReleaseWaitersOnClose() throws Exception {
        InferenceGatewayApplication app = new InferenceGatewayApplication(TestGatewayFactory.create());
        app.start();
        assertThat(app.getPort()).isPositive();

        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try {
                app.awaitShutdown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        app.close();

        waiter.get(5, TimeUnit.SECONDS);
        assertThat(waiter).isDone();
    }

    @Test
    @DisplayName("should tolerate close from both the shutdown hook and the main thread")
    void shouldCloseOnce() throws Exception {
        InferenceGatewayApplication app = new InferenceGatewayApplication(TestGatewayFactory.create());
        app.start();

        app.close();

        assertThatCode(app::close).doesNotThrowAnyException();
    }
}
