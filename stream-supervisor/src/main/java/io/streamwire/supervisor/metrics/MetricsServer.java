package io.streamwire.supervisor.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.streamwire.supervisor.config.SupervisorConfig;
import io.streamwire.supervisor.core.StreamSupervisor;
import io.streamwire.websocket.WebSocketManager;
import io.streamwire.websocket.model.ConnectionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, health, status, and config endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final SupervisorConfig config;
    private final StreamSupervisor supervisor;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    /**
     * @param port Port to bind, 0 for an ephemeral port
     */
    public MetricsServer(int port, StreamMetrics metrics, SupervisorConfig config, StreamSupervisor supervisor) {
        this.port = port;
        this.config = config;
        this.supervisor = supervisor;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/config", handleConfig());

        server.setExecutor(null);
        server.start();

        int bound = getPort();
        LOGGER.info("HTTP server started on port {}", bound);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", bound);
        LOGGER.info("  Health:     http://localhost:{}/health", bound);
        LOGGER.info("  API Status: http://localhost:{}/api/status", bound);
        LOGGER.info("  API Config: http://localhost:{}/api/config", bound);
    }

    /**
     * Returns the bound port, or the configured one before {@link #start()}.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                WebSocketManager manager = supervisor.current();
                boolean healthy = manager != null && manager.isConnected();
                String message = healthy
                    ? "Connected"
                    : (manager == null ? "Not started" : config.streamName() + " is " + manager.state());

                HealthResponse health = new HealthResponse(healthy, message);
                sendJson(exchange, healthy ? 200 : 503, objectMapper.writeValueAsString(health));
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error handling health request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                WebSocketManager manager = supervisor.current();
                StatusResponse status;
                if (manager == null) {
                    status = new StatusResponse(config.streamName(), config.url(), "NOT_STARTED", false,
                        List.of(), null, supervisor.getRestartCount(), 0, System.currentTimeMillis() - startTime);
                } else {
                    status = new StatusResponse(
                        manager.name(),
                        manager.url(),
                        manager.state().name(),
                        manager.isShutdown(),
                        List.copyOf(manager.subscriptions()),
                        StatsInfo.of(manager.stats()),
                        supervisor.getRestartCount(),
                        manager.connectionDuration().toMillis(),
                        System.currentTimeMillis() - startTime
                    );
                }
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(status);
                sendJson(exchange, 200, response);
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error handling status request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                ConfigInfo configInfo = new ConfigInfo(
                    config.streamName(),
                    config.url(),
                    config.channels(),
                    config.healthCheckMs(),
                    config.maxRestarts(),
                    config.metricsPort(),
                    config.webSocketConfig().toString()
                );
                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo);
                sendJson(exchange, 200, response);
            } catch (IOException | RuntimeException e) {
                LOGGER.error("Error handling config request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private void sendJson(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        send(exchange, statusCode, "application/json", response);
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String response)
        throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    private record HealthResponse(boolean healthy, String message) {}

    private record StatusResponse(String name, String url, String state, boolean shutdown, List<String> subscriptions,
                                  StatsInfo stats, int restarts, long connectedMs, long uptimeMs) {}

    private record StatsInfo(long connects, long disconnects, long proactiveDisconnects, long reactiveDisconnects,
                             long messagesReceived, long bytesReceived, long messagesSent, long bytesSent) {
        static StatsInfo of(ConnectionStats stats) {
            return new StatsInfo(
                stats.getConnects(),
                stats.getDisconnects(),
                stats.getProactiveDisconnects(),
                stats.getReactiveDisconnects(),
                stats.getMessagesReceived(),
                stats.getBytesReceived(),
                stats.getMessagesSent(),
                stats.getBytesSent()
            );
        }
    }

    private record ConfigInfo(String streamName, String url, List<String> channels, int healthCheckMs,
                              int maxRestarts, int metricsPort, String websocket) {}
}
