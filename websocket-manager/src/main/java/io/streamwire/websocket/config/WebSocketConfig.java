package io.streamwire.websocket.config;

import io.streamwire.websocket.model.ReconnectStrategy;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for one connection manager.
 *
 * <p>Built with the precedence explicit builder value, then configuration mapping
 * (clamped by {@link WebSocketLimits}), then built-in default.
 *
 * @param name                   Name used in log lines, {@code null} to derive it from the URL host
 * @param pingInterval           Interval between keepalive pings
 * @param pingTimeout            Time to wait for a pong before declaring the connection dead
 * @param connectionTimeout      Bound on a single connection attempt
 * @param reconnectStrategy      How the wait between reconnect attempts is chosen
 * @param reconnectDelay         Base reconnect delay
 * @param maxReconnectDelay      Cap for the exponential backoff
 * @param maxReconnectAttempts   Consecutive failed attempts before giving up
 * @param reconnectJitter        Fraction (0..1) of each backoff delay that may be randomly shaved off
 * @param reconnectCheckInterval Poll interval for callback-controlled reconnects
 * @param autoReconnect          Whether reactive disconnects start the reconnect loop
 * @param queueSize              Inbound queue capacity, 0 for unbounded
 */
public record WebSocketConfig(
    String name,
    Duration pingInterval,
    Duration pingTimeout,
    Duration connectionTimeout,
    ReconnectStrategy reconnectStrategy,
    Duration reconnectDelay,
    Duration maxReconnectDelay,
    int maxReconnectAttempts,
    double reconnectJitter,
    Duration reconnectCheckInterval,
    boolean autoReconnect,
    int queueSize
) {
    public static final ReconnectStrategy DEFAULT_RECONNECT_STRATEGY = ReconnectStrategy.EXPONENTIAL_BACKOFF;

    public WebSocketConfig {
        requirePositive(pingInterval, "pingInterval");
        requirePositive(pingTimeout, "pingTimeout");
        requirePositive(connectionTimeout, "connectionTimeout");
        requirePositive(reconnectCheckInterval, "reconnectCheckInterval");
        Objects.requireNonNull(reconnectStrategy, "reconnectStrategy");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(maxReconnectDelay, "maxReconnectDelay");
        if (reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay cannot be negative");
        }
        if (maxReconnectDelay.isNegative()) {
            throw new IllegalArgumentException("maxReconnectDelay cannot be negative");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("maxReconnectAttempts cannot be negative");
        }
        if (reconnectJitter < 0 || reconnectJitter > 1) {
            throw new IllegalArgumentException("reconnectJitter must be between 0 and 1");
        }
        if (queueSize < 0) {
            throw new IllegalArgumentException("queueSize cannot be negative");
        }
    }

    private static void requirePositive(Duration value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }

    /**
     * Returns a config with every setting at its default.
     */
    public static WebSocketConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for WebSocketConfig. Unset values come from the mapping, then from defaults.
     */
    public static class Builder {
        private Map<String, ?> config = Map.of();
        private String name;
        private Duration pingInterval;
        private Duration pingTimeout;
        private Duration connectionTimeout;
        private ReconnectStrategy reconnectStrategy = DEFAULT_RECONNECT_STRATEGY;
        private Duration reconnectDelay;
        private Duration maxReconnectDelay;
        private Integer maxReconnectAttempts;
        private double reconnectJitter;
        private Duration reconnectCheckInterval;
        private boolean autoReconnect = true;
        private Integer queueSize;

        /**
         * Sets the configuration mapping consulted for values not set explicitly.
         */
        public Builder config(Map<String, ?> config) {
            this.config = config == null ? Map.of() : config;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder pingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder reconnectStrategy(ReconnectStrategy reconnectStrategy) {
            this.reconnectStrategy = reconnectStrategy;
            return this;
        }

        public Builder reconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder maxReconnectDelay(Duration maxReconnectDelay) {
            this.maxReconnectDelay = maxReconnectDelay;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder reconnectJitter(double reconnectJitter) {
            this.reconnectJitter = reconnectJitter;
            return this;
        }

        public Builder reconnectCheckInterval(Duration reconnectCheckInterval) {
            this.reconnectCheckInterval = reconnectCheckInterval;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder queueSize(int queueSize) {
            this.queueSize = queueSize;
            return this;
        }

        public WebSocketConfig build() {
            WebSocketLimits limits = WebSocketLimits.fromConfig(config);
            return new WebSocketConfig(
                name,
                pingInterval != null ? pingInterval : limits.pingInterval(),
                pingTimeout != null ? pingTimeout : limits.pingTimeout(),
                connectionTimeout != null ? connectionTimeout : limits.connectionTimeout(),
                reconnectStrategy,
                reconnectDelay != null ? reconnectDelay : limits.reconnectDelay(),
                maxReconnectDelay != null ? maxReconnectDelay : limits.maxReconnectDelay(),
                maxReconnectAttempts != null ? maxReconnectAttempts : limits.maxReconnectAttempts(),
                reconnectJitter,
                reconnectCheckInterval != null ? reconnectCheckInterval : limits.reconnectCheckInterval(),
                autoReconnect,
                queueSize != null ? queueSize : limits.queueSize()
            );
        }
    }
}
