package io.streamwire.websocket.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WebSocketLimits.
 *
 * Tests:
 * - Built-in defaults
 * - Dotted and nested key lookup
 * - Clamping to the hard bounds
 * - Fallback to defaults for unparseable values
 */
class WebSocketLimitsTest {

    @Test
    void testDefaults() {
        WebSocketLimits limits = WebSocketLimits.defaults();

        assertEquals(Duration.ofSeconds(20), limits.pingInterval());
        assertEquals(Duration.ofSeconds(10), limits.pingTimeout());
        assertEquals(Duration.ofSeconds(30), limits.connectionTimeout());
        assertEquals(Duration.ofSeconds(1), limits.reconnectDelay());
        assertEquals(Duration.ofSeconds(60), limits.maxReconnectDelay());
        assertEquals(10, limits.maxReconnectAttempts());
        assertEquals(1000, limits.queueSize());
        assertEquals(Duration.ofSeconds(5), limits.reconnectCheckInterval());
    }

    @Test
    void testDottedKeys() {
        WebSocketLimits limits = WebSocketLimits.fromConfig(Map.of(
            WebSocketLimits.PING_INTERVAL_KEY, 30,
            WebSocketLimits.QUEUE_SIZE_KEY, "250",
            WebSocketLimits.RECONNECT_CHECK_INTERVAL_KEY, 1.5
        ));

        assertEquals(Duration.ofSeconds(30), limits.pingInterval());
        assertEquals(250, limits.queueSize());
        assertEquals(Duration.ofMillis(1500), limits.reconnectCheckInterval());
    }

    @Test
    void testNestedKeys() {
        Map<String, Object> config = Map.of(
            "websocket", Map.of(
                "ping", Map.of("interval", 15, "timeout", 7),
                "reconnect", Map.of("max_attempts", 3)
            )
        );

        WebSocketLimits limits = WebSocketLimits.fromConfig(config);

        assertEquals(Duration.ofSeconds(15), limits.pingInterval());
        assertEquals(Duration.ofSeconds(7), limits.pingTimeout());
        assertEquals(3, limits.maxReconnectAttempts());
        assertEquals(Duration.ofSeconds(30), limits.connectionTimeout());
    }

    @Test
    void testDottedKeyWinsOverNested() {
        Map<String, Object> config = Map.of(
            WebSocketLimits.PING_INTERVAL_KEY, 40,
            "websocket", Map.of("ping", Map.of("interval", 15))
        );

        assertEquals(Duration.ofSeconds(40), WebSocketLimits.fromConfig(config).pingInterval());
    }

    @Test
    void testValuesAreClamped() {
        WebSocketLimits limits = WebSocketLimits.fromConfig(Map.of(
            WebSocketLimits.PING_INTERVAL_KEY, 1,
            WebSocketLimits.PING_TIMEOUT_KEY, 999,
            WebSocketLimits.MAX_RECONNECT_ATTEMPTS_KEY, -4,
            WebSocketLimits.QUEUE_SIZE_KEY, 1_000_000,
            WebSocketLimits.RECONNECT_CHECK_INTERVAL_KEY, 0.1
        ));

        assertEquals(Duration.ofSeconds(5), limits.pingInterval());
        assertEquals(Duration.ofSeconds(30), limits.pingTimeout());
        assertEquals(0, limits.maxReconnectAttempts());
        assertEquals(10000, limits.queueSize());
        assertEquals(Duration.ofMillis(500), limits.reconnectCheckInterval());
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        WebSocketLimits limits = WebSocketLimits.fromConfig(Map.of(
            WebSocketLimits.PING_INTERVAL_KEY, "soon",
            WebSocketLimits.PING_TIMEOUT_KEY, Double.NaN,
            WebSocketLimits.QUEUE_SIZE_KEY, Map.of("nested", 1)
        ));

        assertEquals(Duration.ofSeconds(20), limits.pingInterval());
        assertEquals(Duration.ofSeconds(10), limits.pingTimeout());
        assertEquals(1000, limits.queueSize());
    }

    @Test
    void testNullConfigUsesDefaults() {
        assertEquals(WebSocketLimits.defaults(), WebSocketLimits.fromConfig(null));
    }
}
