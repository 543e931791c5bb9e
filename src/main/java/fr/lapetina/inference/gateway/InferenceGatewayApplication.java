package fr.lapetina.inference.gateway;

import fr.lapetina.inference.gateway.api.HttpServer;
import fr.lapetina.inference.gateway.api.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Runs the gateway: one {@link GatewayFactory} and the HTTP server in front of it.
 *
 * <p>Lifecycle is construct, {@link #start()}, then {@link #close()}. Closing stops the
 * listener before the factory so no request reaches a closed backend. {@code close()} may
 * be called from both the shutdown hook and the main thread.
 *
 * <p>Usage: {@code java -jar inference-gateway.jar [config.yaml]}
 */
public class InferenceGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InferenceGatewayApplication.class);

    private final GatewayFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean();

    public InferenceGatewayApplication(GatewayFactory factory) throws IOException {
        this.factory = factory.start();
        this.httpServer = factory.createServer();
    }

    public InferenceGatewayApplication(String configPath) throws IOException {
        this(GatewayFactory.create(configPath));
    }

    public void start() {
        httpServer.start();
        String routes = factory.getRoutes().stream()
                .map(Route::policy)
                .map(p -> p.method() + " " + p.path())
                .collect(Collectors.joining(", "));
        log.info("Gateway listening: port={}, backend={}, backendReady={}, maxConcurrent={}, routes=[{}]",
                httpServer.getPort(),
                factory.getBackend().name(),
                factory.getBackend().isReady(),
                factory.getAdmission().getMaxConcurrent(),
                routes);
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return httpServer.getPort();
    }

    /**
     * Blocks the calling thread until {@link #requestShutdown()}.
     */
    public void awaitShutdown() throws InterruptedException {
        stopped.await();
    }

    public void requestShutdown() {
        stopped.countDown();
    }

    public GatewayFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int inFlight = factory.getAdmission().getActiveRequests();
        log.info("Gateway stopping: port={}, inFlight={}", httpServer.getPort(), inFlight);

        try {
            httpServer.close();
        } catch (RuntimeException e) {
            log.warn("HTTP listener did not stop cleanly: error={}", e.getMessage(), e);
        }
        factory.close();
        requestShutdown();

        log.info("Gateway stopped");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : GatewayFactory.DEFAULT_CONFIG_PATH;

        InferenceGatewayApplication app;
        try {
            app = new InferenceGatewayApplication(configPath);
        } catch (IOException | RuntimeException e) {
            log.error("Gateway failed to start: config={}", configPath, e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(app::close, "gateway-shutdown"));
        app.start();

        try {
            app.awaitShutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            app.close();
        }
    }
}
