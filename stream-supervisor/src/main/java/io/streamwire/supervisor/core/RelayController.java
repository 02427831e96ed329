package io.streamwire.supervisor.core;

import io.streamwire.supervisor.config.SupervisorConfig;
import io.streamwire.supervisor.metrics.MetricsServer;
import io.streamwire.supervisor.metrics.StreamMetrics;
import io.streamwire.websocket.ConnectionHooks;
import io.streamwire.websocket.WebSocketManager;
import io.streamwire.websocket.config.WebSocketConfig;
import io.streamwire.websocket.model.WebSocketMessage;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Main controller for the stream relay.
 * Wires the supervisor, metrics and HTTP server, and drains the current manager's stream.
 */
public class RelayController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RelayController.class);

    private static final long IDLE_WAIT_MS = 100;

    private final SupervisorConfig config;
    private final StreamMetrics metrics;
    private final StreamSupervisor supervisor;
    private final MetricsServer metricsServer;
    private final ShutdownSignalBarrier shutdownBarrier;
    private final Consumer<WebSocketMessage> sink;
    private final AtomicLong relayed = new AtomicLong();
    private final Thread consumer;

    private volatile boolean running = false;

    public RelayController(SupervisorConfig config) {
        this(config, new StreamMetrics(config.streamName()), null, message -> { });
    }

    /**
     * Creates a controller.
     *
     * @param factory builds managers, or null to build Netty-backed managers from the config
     * @param sink    receives every relayed message on the consumer thread
     */
    public RelayController(
        SupervisorConfig config,
        StreamMetrics metrics,
        Supplier<WebSocketManager> factory,
        Consumer<WebSocketMessage> sink
    ) {
        this.config = config;
        this.metrics = metrics;
        this.sink = sink;
        this.supervisor = new StreamSupervisor(
            config.streamName(),
            factory != null ? factory : defaultFactory(config, metrics.hooks()),
            config.healthCheckMs(),
            config.maxRestarts()
        );
        this.supervisor.setRestartListener((replacement, count) -> {
            metrics.recordRestart();
            metrics.setActiveSubscriptions(replacement.subscriptions().size());
        });
        this.metricsServer = new MetricsServer(config.metricsPort(), metrics, config, supervisor);
        this.shutdownBarrier = new ShutdownSignalBarrier();
        this.consumer = new Thread(this::relayLoop, config.streamName() + "-consumer");
        this.consumer.setDaemon(true);

        LOGGER.info("Relay controller initialized: {}", config.streamName());
    }

    private static Supplier<WebSocketManager> defaultFactory(SupervisorConfig config, ConnectionHooks hooks) {
        WebSocketConfig webSocketConfig = config.webSocketConfig();
        return () -> {
            WebSocketManager manager = new WebSocketManager(config.url(), webSocketConfig, hooks);
            if (!config.channels().isEmpty()) {
                manager.subscribe(config.channels().toArray(new String[0]));
            }
            return manager;
        };
    }

    /**
     * Starts the supervisor, the metrics server and the consumer thread.
     */
    public void start() throws IOException {
        LOGGER.info("Starting stream relay...");
        running = true;

        metricsServer.start();
        supervisor.start();
        WebSocketManager manager = supervisor.current();
        if (manager != null) {
            metrics.setActiveSubscriptions(manager.subscriptions().size());
        }
        consumer.start();

        LOGGER.info("Stream relay started: {} -> {}", config.streamName(), config.url());
    }

    /**
     * Drains the current manager's stream. A stream ends when its manager closes; the
     * messages it left queued are relayed before the loop picks up the replacement.
     */
    private void relayLoop() {
        WebSocketManager drained = null;
        while (running) {
            WebSocketManager manager = supervisor.current();
            if (manager == null || manager == drained) {
                if (!sleepIdle()) {
                    return;
                }
                continue;
            }
            LOGGER.debug("{}: Relaying from {}", config.streamName(), manager);
            manager.stream().forEach(this::relay);
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            try {
                manager.drainRemaining().forEach(this::relay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            drained = manager;
        }
    }

    private void relay(WebSocketMessage message) {
        relayed.incrementAndGet();
        LOGGER.debug("{}: {}", config.streamName(), message);
        try {
            sink.accept(message);
        } catch (RuntimeException e) {
            LOGGER.error("{}: Error in message sink", config.streamName(), e);
        }
    }

    private static boolean sleepIdle() {
        try {
            Thread.sleep(IDLE_WAIT_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Relay running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the relay gracefully.
     */
    public void shutdown() {
        LOGGER.info("Shutting down stream relay...");
        running = false;

        supervisor.shutdown();
        consumer.interrupt();
        try {
            consumer.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        CloseHelper.close(metricsServer);

        LOGGER.info("Stream relay shutdown complete ({} messages relayed, {} restarts)",
            relayed.get(), supervisor.getRestartCount());
    }

    @Override
    public void close() {
        shutdown();
    }

    public StreamSupervisor getSupervisor() {
        return supervisor;
    }

    public long getRelayedCount() {
        return relayed.get();
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }
}
