package com.flightsentinel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flightsentinel.core.ingest.EngineStats;
import com.flightsentinel.core.ingest.LoopState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lightweight HTTP server exposing the detector's health.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200 OK} with {@code status} and the
 * current {@link EngineStats}; {@code status} is {@code DOWN} once the loop
 * has stopped</li>
 * <li>{@code GET /readiness} – {@code 200} once the model is trained,
 * {@code 503} before</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);

    private final Supplier<EngineStats> statsSupplier;
    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param statsSupplier source of engine snapshots; must not be {@code null}
     */
    public HealthServer(Supplier<EngineStats> statsSupplier) {
        this.statsSupplier = Objects.requireNonNull(statsSupplier, "statsSupplier must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealth);
            server.createContext("/readiness", this::handleReadiness);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start health server on port {}: {}", port, e.getMessage(), e);
        }
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not started
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        EngineStats stats = statsSupplier.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", stats.getState() == LoopState.STOPPED ? "DOWN" : "UP");
        body.put("engine", stats);
        respond(exchange, 200, mapper.writeValueAsBytes(body));
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        boolean trained = statsSupplier.get().isTrained();
        Map<String, Object> body = Map.of("status", trained ? "READY" : "TRAINING");
        respond(exchange, trained ? 200 : 503, mapper.writeValueAsBytes(body));
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
