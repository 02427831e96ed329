package io.streamwire.supervisor.config;

import io.streamwire.websocket.config.WebSocketConfig;
import io.streamwire.websocket.config.WebSocketLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Configuration for the stream relay.
 *
 * @param streamName    Name of the supervised stream, used in logs, metrics and the manager name
 * @param url           WebSocket endpoint
 * @param channels      Channels subscribed on every (re)connect
 * @param healthCheckMs Supervisor poll interval in milliseconds
 * @param maxRestarts   Manager rebuilds allowed, 0 for unlimited
 * @param metricsPort   Port for the Prometheus metrics HTTP server, 0 for an ephemeral port
 * @param websocket     {@code websocket.*} settings handed to {@link WebSocketConfig}
 */
public record SupervisorConfig(
    String streamName,
    String url,
    List<String> channels,
    int healthCheckMs,
    int maxRestarts,
    int metricsPort,
    Map<String, Object> websocket
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(SupervisorConfig.class);

    private static final String DEFAULT_STREAM_NAME = "stream-0";
    private static final String DEFAULT_URL = "wss://stream.binance.com:9443/ws";
    private static final int DEFAULT_HEALTH_CHECK_MS = 5000;
    private static final int DEFAULT_MAX_RESTARTS = 0;
    private static final int DEFAULT_METRICS_PORT = 9090;

    /** Environment variables folded into the {@code websocket.*} mapping. */
    private static final Map<String, String> WEBSOCKET_ENV = Map.of(
        "WS_PING_INTERVAL", WebSocketLimits.PING_INTERVAL_KEY,
        "WS_PING_TIMEOUT", WebSocketLimits.PING_TIMEOUT_KEY,
        "WS_RECONNECT_DELAY", WebSocketLimits.RECONNECT_DELAY_KEY,
        "WS_RECONNECT_MAX_ATTEMPTS", WebSocketLimits.MAX_RECONNECT_ATTEMPTS_KEY,
        "WS_QUEUE_SIZE", WebSocketLimits.QUEUE_SIZE_KEY
    );

    public SupervisorConfig {
        if (streamName == null || streamName.isEmpty()) {
            throw new IllegalArgumentException("streamName cannot be null or empty");
        }
        if (url == null || !(url.startsWith("ws://") || url.startsWith("wss://"))) {
            throw new IllegalArgumentException("url must be a ws:// or wss:// URL: " + url);
        }
        if (healthCheckMs <= 0) {
            throw new IllegalArgumentException("healthCheckMs must be positive");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts cannot be negative");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort must be between 0 and 65535");
        }
        channels = channels == null ? List.of() : List.copyOf(channels);
        websocket = websocket == null ? Map.of() : Map.copyOf(websocket);
    }

    /**
     * Builds the manager settings: stream name plus the {@code websocket.*} mapping,
     * clamped by {@link WebSocketLimits}.
     */
    public WebSocketConfig webSocketConfig() {
        return WebSocketConfig.builder()
            .name(streamName)
            .config(websocket)
            .build();
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - STREAM_NAME: Stream name (default: "stream-0")
     * - STREAM_URL: WebSocket endpoint (default: "wss://stream.binance.com:9443/ws")
     * - CHANNELS: Comma separated channels (e.g., "btcusdt@trade,ethusdt@trade")
     * - HEALTH_CHECK_MS: Supervisor poll interval (default: 5000)
     * - MAX_RESTARTS: Manager rebuilds allowed, 0 for unlimited (default: 0)
     * - METRICS_PORT: Metrics HTTP port (default: 9090)
     * - WS_PING_INTERVAL, WS_PING_TIMEOUT, WS_RECONNECT_DELAY (seconds),
     *   WS_RECONNECT_MAX_ATTEMPTS, WS_QUEUE_SIZE: connection settings
     */
    public static SupervisorConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * Loads configuration from an environment-style mapping.
     */
    public static SupervisorConfig fromMap(Map<String, String> env) {
        Builder builder = builder()
            .streamName(stringValue(env, "STREAM_NAME", DEFAULT_STREAM_NAME))
            .url(stringValue(env, "STREAM_URL", DEFAULT_URL))
            .healthCheckMs(parseInt(env, "HEALTH_CHECK_MS", DEFAULT_HEALTH_CHECK_MS))
            .maxRestarts(parseInt(env, "MAX_RESTARTS", DEFAULT_MAX_RESTARTS))
            .metricsPort(parseInt(env, "METRICS_PORT", DEFAULT_METRICS_PORT));

        String channels = env.get("CHANNELS");
        if (channels != null && !channels.isEmpty()) {
            builder.channels(Arrays.stream(channels.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList()));
        }

        for (Map.Entry<String, String> entry : WEBSOCKET_ENV.entrySet()) {
            String value = env.get(entry.getKey());
            if (value != null && !value.isEmpty()) {
                // validated and clamped by WebSocketLimits
                builder.websocketSetting(entry.getValue(), value.trim());
            }
        }
        return builder.build();
    }

    private static String stringValue(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for SupervisorConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SupervisorConfig.
     */
    public static class Builder {
        private String streamName = DEFAULT_STREAM_NAME;
        private String url = DEFAULT_URL;
        private final List<String> channels = new ArrayList<>();
        private int healthCheckMs = DEFAULT_HEALTH_CHECK_MS;
        private int maxRestarts = DEFAULT_MAX_RESTARTS;
        private int metricsPort = DEFAULT_METRICS_PORT;
        private final Map<String, Object> websocket = new HashMap<>();

        public Builder streamName(String streamName) {
            this.streamName = streamName;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder channels(List<String> channels) {
            this.channels.addAll(channels);
            return this;
        }

        public Builder addChannel(String channel) {
            this.channels.add(channel);
            return this;
        }

        public Builder healthCheckMs(int healthCheckMs) {
            this.healthCheckMs = healthCheckMs;
            return this;
        }

        public Builder maxRestarts(int maxRestarts) {
            this.maxRestarts = maxRestarts;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        /**
         * Sets one {@code websocket.*} setting by its dotted key.
         */
        public Builder websocketSetting(String key, Object value) {
            this.websocket.put(key, value);
            return this;
        }

        public SupervisorConfig build() {
            return new SupervisorConfig(
                streamName,
                url,
                channels,
                healthCheckMs,
                maxRestarts,
                metricsPort,
                websocket
            );
        }
    }
}
