package io.streamwire.supervisor.config;

import io.streamwire.websocket.config.WebSocketConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SupervisorConfig.
 *
 * Tests:
 * - Defaults from an empty environment
 * - Parsing of stream, channel and connection variables
 * - Invalid numbers fall back to defaults
 * - Validation
 */
class SupervisorConfigTest {

    @Test
    void testDefaults() {
        SupervisorConfig config = SupervisorConfig.fromMap(Map.of());

        assertEquals("stream-0", config.streamName());
        assertEquals("wss://stream.binance.com:9443/ws", config.url());
        assertEquals(List.of(), config.channels());
        assertEquals(5000, config.healthCheckMs());
        assertEquals(0, config.maxRestarts());
        assertEquals(9090, config.metricsPort());
        assertEquals(WebSocketConfig.builder().name("stream-0").build(), config.webSocketConfig());
    }

    @Test
    void testFromMap() {
        SupervisorConfig config = SupervisorConfig.fromMap(Map.of(
            "STREAM_NAME", "trades",
            "STREAM_URL", "ws://localhost:8080/ws",
            "CHANNELS", "btcusdt@trade, ethusdt@trade,,",
            "HEALTH_CHECK_MS", "1000",
            "MAX_RESTARTS", "3",
            "METRICS_PORT", "9191"
        ));

        assertEquals("trades", config.streamName());
        assertEquals("ws://localhost:8080/ws", config.url());
        assertEquals(List.of("btcusdt@trade", "ethusdt@trade"), config.channels());
        assertEquals(1000, config.healthCheckMs());
        assertEquals(3, config.maxRestarts());
        assertEquals(9191, config.metricsPort());
    }

    @Test
    void testWebSocketVariablesAreClamped() {
        SupervisorConfig config = SupervisorConfig.fromMap(Map.of(
            "WS_PING_INTERVAL", "30",
            "WS_PING_TIMEOUT", "1",
            "WS_RECONNECT_DELAY", "2.5",
            "WS_RECONNECT_MAX_ATTEMPTS", "500",
            "WS_QUEUE_SIZE", "abc"
        ));

        WebSocketConfig webSocket = config.webSocketConfig();
        assertEquals("stream-0", webSocket.name());
        assertEquals(Duration.ofSeconds(30), webSocket.pingInterval());
        assertEquals(Duration.ofSeconds(5), webSocket.pingTimeout());
        assertEquals(Duration.ofMillis(2500), webSocket.reconnectDelay());
        assertEquals(100, webSocket.maxReconnectAttempts());
        assertEquals(1000, webSocket.queueSize());
    }

    @Test
    void testInvalidNumbersUseDefaults() {
        SupervisorConfig config = SupervisorConfig.fromMap(Map.of(
            "HEALTH_CHECK_MS", "often",
            "METRICS_PORT", "http"
        ));

        assertEquals(5000, config.healthCheckMs());
        assertEquals(9090, config.metricsPort());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> SupervisorConfig.builder().url("http://example.com").build());
        assertThrows(IllegalArgumentException.class,
            () -> SupervisorConfig.builder().streamName("").build());
        assertThrows(IllegalArgumentException.class,
            () -> SupervisorConfig.builder().healthCheckMs(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> SupervisorConfig.builder().maxRestarts(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> SupervisorConfig.builder().metricsPort(70000).build());
    }

    @Test
    void testBuilder() {
        SupervisorConfig config = SupervisorConfig.builder()
            .streamName("book")
            .addChannel("btcusdt@depth")
            .websocketSetting("websocket.queue.size", 50)
            .build();

        assertEquals(List.of("btcusdt@depth"), config.channels());
        assertEquals(50, config.webSocketConfig().queueSize());
    }
}
