package io.streamwire.websocket.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings read from a configuration mapping and clamped to hard bounds.
 *
 * <p>Keys are looked up under {@code websocket.*}, either as dotted keys
 * ({@code "websocket.ping.interval"}) or as nested maps. Durations are in seconds.
 * Missing or unparseable values fall back to the default; out-of-range values are clamped.
 *
 * @param pingInterval           Interval between keepalive pings
 * @param pingTimeout            Time to wait for a pong
 * @param connectionTimeout      Bound on a single connection attempt
 * @param reconnectDelay         Base reconnect delay
 * @param maxReconnectDelay      Cap for the exponential backoff
 * @param maxReconnectAttempts   Consecutive failed attempts before giving up
 * @param queueSize              Inbound queue capacity, 0 for unbounded
 * @param reconnectCheckInterval Poll interval for callback-controlled reconnects
 */
public record WebSocketLimits(
    Duration pingInterval,
    Duration pingTimeout,
    Duration connectionTimeout,
    Duration reconnectDelay,
    Duration maxReconnectDelay,
    int maxReconnectAttempts,
    int queueSize,
    Duration reconnectCheckInterval
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketLimits.class);

    public static final String PING_INTERVAL_KEY = "websocket.ping.interval";
    public static final String PING_TIMEOUT_KEY = "websocket.ping.timeout";
    public static final String CONNECTION_TIMEOUT_KEY = "websocket.connection.timeout";
    public static final String RECONNECT_DELAY_KEY = "websocket.reconnect.delay";
    public static final String MAX_RECONNECT_DELAY_KEY = "websocket.reconnect.max_delay";
    public static final String MAX_RECONNECT_ATTEMPTS_KEY = "websocket.reconnect.max_attempts";
    public static final String QUEUE_SIZE_KEY = "websocket.queue.size";
    public static final String RECONNECT_CHECK_INTERVAL_KEY = "websocket.proactive.reconnect_check_interval";

    static final Bound PING_INTERVAL = new Bound(20, 5, 60);
    static final Bound PING_TIMEOUT = new Bound(10, 5, 30);
    static final Bound CONNECTION_TIMEOUT = new Bound(30, 5, 120);
    static final Bound RECONNECT_DELAY = new Bound(1, 0, 300);
    static final Bound MAX_RECONNECT_DELAY = new Bound(60, 1, 600);
    static final Bound MAX_RECONNECT_ATTEMPTS = new Bound(10, 0, 100);
    static final Bound QUEUE_SIZE = new Bound(1000, 0, 10000);
    static final Bound RECONNECT_CHECK_INTERVAL = new Bound(5, 0.5, 60);

    /**
     * Returns the built-in defaults.
     */
    public static WebSocketLimits defaults() {
        return fromConfig(Map.of());
    }

    /**
     * Resolves every setting from the given mapping.
     */
    public static WebSocketLimits fromConfig(Map<String, ?> config) {
        return new WebSocketLimits(
            seconds(PING_INTERVAL.resolve(config, PING_INTERVAL_KEY)),
            seconds(PING_TIMEOUT.resolve(config, PING_TIMEOUT_KEY)),
            seconds(CONNECTION_TIMEOUT.resolve(config, CONNECTION_TIMEOUT_KEY)),
            seconds(RECONNECT_DELAY.resolve(config, RECONNECT_DELAY_KEY)),
            seconds(MAX_RECONNECT_DELAY.resolve(config, MAX_RECONNECT_DELAY_KEY)),
            (int) MAX_RECONNECT_ATTEMPTS.resolve(config, MAX_RECONNECT_ATTEMPTS_KEY),
            (int) QUEUE_SIZE.resolve(config, QUEUE_SIZE_KEY),
            seconds(RECONNECT_CHECK_INTERVAL.resolve(config, RECONNECT_CHECK_INTERVAL_KEY))
        );
    }

    private static Duration seconds(double value) {
        return Duration.ofMillis(Math.round(value * 1000));
    }

    /**
     * Finds a value by dotted key, first as a flat entry, then by walking nested maps.
     */
    static Object lookup(Map<String, ?> config, String dottedKey) {
        if (config == null) {
            return null;
        }
        if (config.containsKey(dottedKey)) {
            return config.get(dottedKey);
        }
        Object current = config;
        for (String part : dottedKey.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    /**
     * Default value plus inclusive hard bounds for one setting.
     */
    record Bound(double defaultValue, double min, double max) {

        double resolve(Map<String, ?> config, String key) {
            Object raw = lookup(config, key);
            if (raw == null) {
                return defaultValue;
            }
            Double parsed = parse(raw);
            if (parsed == null) {
                LOGGER.warn("Invalid value for {}: {}, using default: {}", key, raw, defaultValue);
                return defaultValue;
            }
            return clamp(parsed);
        }

        double clamp(double value) {
            if (value < min) {
                LOGGER.debug("Clamping {} up to {}", value, min);
                return min;
            }
            if (value > max) {
                LOGGER.debug("Clamping {} down to {}", value, max);
                return max;
            }
            return value;
        }

        private static Double parse(Object raw) {
            double value;
            if (raw instanceof Number number) {
                value = number.doubleValue();
            } else if (raw instanceof String text) {
                try {
                    value = Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                return null;
            }
            return Double.isFinite(value) ? value : null;
        }
    }
}
