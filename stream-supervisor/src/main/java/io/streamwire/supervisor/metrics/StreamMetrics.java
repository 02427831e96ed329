package io.streamwire.supervisor.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.hotspot.DefaultExports;
import io.streamwire.websocket.ConnectionHooks;
import io.streamwire.websocket.model.DisconnectReason;
import io.streamwire.websocket.model.WebSocketMessage;

import java.util.Map;

/**
 * Prometheus metrics for one supervised stream.
 *
 * Tracks:
 * - Connects and disconnects (by reason and proactive/reactive kind)
 * - Received messages and their sizes
 * - Supervisor restarts and manager alerts
 * - Connection status and active subscriptions
 */
public class StreamMetrics {

    private final String stream;
    private final CollectorRegistry registry;

    // Counters
    private final Counter connects;
    private final Counter disconnects;
    private final Counter messagesReceived;
    private final Counter restarts;
    private final Counter alerts;

    // Gauges
    private final Gauge connectionStatus;
    private final Gauge activeSubscriptions;

    // Histogram (message size distribution)
    private final Histogram messageSize;

    /**
     * Registers on the default registry, along with the JVM metrics (GC, memory, threads, etc.).
     */
    public StreamMetrics(String stream) {
        this(stream, CollectorRegistry.defaultRegistry);
        DefaultExports.initialize();
    }

    public StreamMetrics(String stream, CollectorRegistry registry) {
        this.stream = stream;
        this.registry = registry;

        this.connects = Counter.build()
            .name("stream_connects_total")
            .help("Total number of established connections")
            .labelNames("stream")
            .register(registry);

        this.disconnects = Counter.build()
            .name("stream_disconnects_total")
            .help("Total number of ended connections")
            .labelNames("stream", "reason", "kind")
            .register(registry);

        this.messagesReceived = Counter.build()
            .name("stream_messages_received_total")
            .help("Total number of messages received")
            .labelNames("stream")
            .register(registry);

        this.restarts = Counter.build()
            .name("stream_restarts_total")
            .help("Total number of managers rebuilt by the supervisor")
            .labelNames("stream")
            .register(registry);

        this.alerts = Counter.build()
            .name("stream_alerts_total")
            .help("Total number of alerts raised by managers")
            .labelNames("stream", "channel")
            .register(registry);

        // 1 = connected, 0 = disconnected
        this.connectionStatus = Gauge.build()
            .name("stream_connection_status")
            .help("Connection status (1 = connected, 0 = disconnected)")
            .labelNames("stream")
            .register(registry);

        this.activeSubscriptions = Gauge.build()
            .name("stream_active_subscriptions")
            .help("Number of subscribed channels")
            .labelNames("stream")
            .register(registry);

        this.messageSize = Histogram.build()
            .name("stream_message_size_bytes")
            .help("Message size distribution in bytes")
            .labelNames("stream")
            .buckets(100, 500, 1000, 5000, 10000)
            .register(registry);
    }

    /**
     * Returns hooks that feed these metrics from a manager's lifecycle events.
     */
    public ConnectionHooks hooks() {
        return ConnectionHooks.builder()
            .onConnect(this::recordConnect)
            .onDisconnect(this::recordDisconnect)
            .onMessage(this::recordMessage)
            .onAlert(this::recordAlert)
            .build();
    }

    public void recordConnect() {
        connects.labels(stream).inc();
        connectionStatus.labels(stream).set(1);
    }

    public void recordDisconnect(DisconnectReason reason) {
        String kind = reason.isProactive() ? "proactive" : "reactive";
        disconnects.labels(stream, reason.name(), kind).inc();
        connectionStatus.labels(stream).set(0);
    }

    public void recordMessage(WebSocketMessage message) {
        messagesReceived.labels(stream).inc();
        messageSize.labels(stream).observe(message.sizeBytes());
    }

    public void recordRestart() {
        restarts.labels(stream).inc();
    }

    public void recordAlert(String channel, String message, Map<String, Object> context) {
        alerts.labels(stream, channel).inc();
    }

    public void setActiveSubscriptions(int count) {
        activeSubscriptions.labels(stream).set(count);
    }

    /**
     * Returns the CollectorRegistry for HTTP server.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    public double getAlerts(String channel) {
        return alerts.labels(stream, channel).get();
    }

    public double getConnects() {
        return connects.labels(stream).get();
    }

    public double getDisconnects(DisconnectReason reason) {
        String kind = reason.isProactive() ? "proactive" : "reactive";
        return disconnects.labels(stream, reason.name(), kind).get();
    }

    public double getMessagesReceived() {
        return messagesReceived.labels(stream).get();
    }

    public double getRestarts() {
        return restarts.labels(stream).get();
    }

    public boolean isConnected() {
        return connectionStatus.labels(stream).get() == 1;
    }

    public double getActiveSubscriptions() {
        return activeSubscriptions.labels(stream).get();
    }
}
