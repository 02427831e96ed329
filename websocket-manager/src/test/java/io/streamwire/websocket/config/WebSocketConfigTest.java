package io.streamwire.websocket.config;

import io.streamwire.websocket.model.ReconnectStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WebSocketConfig.
 *
 * Tests:
 * - Defaults
 * - Precedence: explicit value, then mapping, then default
 * - Validation in the canonical constructor
 */
class WebSocketConfigTest {

    @Test
    void testDefaults() {
        WebSocketConfig config = WebSocketConfig.defaults();

        assertNull(config.name());
        assertEquals(Duration.ofSeconds(20), config.pingInterval());
        assertEquals(ReconnectStrategy.EXPONENTIAL_BACKOFF, config.reconnectStrategy());
        assertEquals(10, config.maxReconnectAttempts());
        assertEquals(0.0, config.reconnectJitter());
        assertTrue(config.autoReconnect());
        assertEquals(1000, config.queueSize());
    }

    @Test
    void testMappingOverridesDefault() {
        WebSocketConfig config = WebSocketConfig.builder()
            .config(Map.of(WebSocketLimits.PING_INTERVAL_KEY, 45, WebSocketLimits.QUEUE_SIZE_KEY, 0))
            .build();

        assertEquals(Duration.ofSeconds(45), config.pingInterval());
        assertEquals(0, config.queueSize());
        assertEquals(Duration.ofSeconds(10), config.pingTimeout());
    }

    @Test
    void testExplicitValueOverridesMapping() {
        WebSocketConfig config = WebSocketConfig.builder()
            .config(Map.of(WebSocketLimits.PING_INTERVAL_KEY, 45))
            .pingInterval(Duration.ofSeconds(12))
            .build();

        assertEquals(Duration.ofSeconds(12), config.pingInterval());
    }

    @Test
    void testExplicitValuesAreNotClamped() {
        WebSocketConfig config = WebSocketConfig.builder()
            .pingInterval(Duration.ofMillis(50))
            .build();

        assertEquals(Duration.ofMillis(50), config.pingInterval());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> WebSocketConfig.builder().pingInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> WebSocketConfig.builder().reconnectDelay(Duration.ofSeconds(-1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> WebSocketConfig.builder().maxReconnectAttempts(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> WebSocketConfig.builder().reconnectJitter(1.5).build());
        assertThrows(IllegalArgumentException.class,
            () -> WebSocketConfig.builder().queueSize(-1).build());
    }
}
