package fr.lapetina.inference.gateway.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.inference.gateway.domain.model.GatewayResponse;
import fr.lapetina.inference.gateway.pipeline.ErrorTaxonomy;
import fr.lapetina.inference.gateway.pipeline.GatewayPipeline;
import fr.lapetina.inference.gateway.pipeline.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * <p>Every request is matched against the registered {@link Route}s by exact path and
 * method, then run through the {@link GatewayPipeline}. Unknown paths get a 404 and known
 * paths with the wrong method a 405, both in the standard error body.
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final GatewayPipeline pipeline;
    private final ErrorTaxonomy taxonomy;
    private final Map<String, List<Route>> routesByPath = new LinkedHashMap<>();

    public HttpServer(
            String host,
            int port,
            int backlog,
            int workerThreads,
            GatewayPipeline pipeline,
            List<Route> routes,
            ErrorTaxonomy taxonomy,
            ObjectMapper objectMapper
    ) throws IOException {
        this.pipeline = pipeline;
        this.taxonomy = taxonomy;
        this.objectMapper = objectMapper;
        for (Route route : routes) {
            routesByPath.computeIfAbsent(route.policy().path(), p -> new ArrayList<>()).add(route);
        }

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "gateway-http-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.createContext("/", new GatewayHandler());

        log.info("HTTP server configured: host={}, port={}, workerThreads={}, routes={}",
                host, port, workerThreads, routesByPath.keySet());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Returns the bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    private class GatewayHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String incoming = exchange.getRequestHeaders().getFirst(REQUEST_ID_HEADER);
            String requestId = incoming != null && !incoming.isBlank() ? incoming : UUID.randomUUID().toString();
            MDC.put("requestId", requestId);

            try {
                GatewayResponse response = dispatch(exchange, requestId);
                send(exchange, response.withHeader(REQUEST_ID_HEADER, requestId));
            } catch (IOException e) {
                log.warn("Failed to write response: requestId={}, error={}", requestId, e.getMessage());
            } finally {
                MDC.clear();
                exchange.close();
            }
        }

        private GatewayResponse dispatch(HttpExchange exchange, String requestId) {
            String method = exchange.getRequestMethod();
            String path = exchange.getRequestURI().getPath();

            List<Route> candidates = routesByPath.get(path);
            if (candidates == null) {
                return taxonomy.notFound(method, path);
            }

            Route route = candidates.stream()
                    .filter(r -> r.policy().method().equalsIgnoreCase(method))
                    .findFirst()
                    .orElse(null);
            if (route == null) {
                String allowed = candidates.stream()
                        .map(r -> r.policy().method())
                        .collect(Collectors.joining(", "));
                return taxonomy.methodNotAllowed(method, path, allowed);
            }

            RequestContext.Builder context = RequestContext.builder(route.policy())
                    .requestId(requestId)
                    .method(method)
                    .path(path)
                    .clientId(ClientIdentity.resolve(
                            exchange.getRequestHeaders().getFirst(ClientIdentity.FORWARDED_FOR),
                            exchange.getRemoteAddress()))
                    .body(exchange.getRequestBody());
            exchange.getRequestHeaders().forEach((name, values) -> {
                if (!values.isEmpty()) {
                    context.header(name, values.get(0));
                }
            });

            return pipeline.handle(context.build(), route.handler());
        }
    }

    private void send(HttpExchange exchange, GatewayResponse response) throws IOException {
        byte[] bytes;
        GatewayResponse toSend = response;
        try {
            bytes = encode(response);
        } catch (JsonProcessingException e) {
            toSend = taxonomy.toResponse("serialization", e);
            bytes = objectMapper.writeValueAsBytes(toSend.body());
        }

        toSend.headers().forEach((name, value) -> exchange.getResponseHeaders().set(name, value));
        exchange.getResponseHeaders().set("Content-Type", toSend.contentType());
        // -1 means no body; 0 would switch the exchange to chunked encoding
        exchange.sendResponseHeaders(toSend.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private byte[] encode(GatewayResponse response) throws JsonProcessingException {
        if (response.body() instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        return objectMapper.writeValueAsBytes(response.body());
    }
}
