package io.streamwire.websocket;

import io.streamwire.websocket.model.DisconnectReason;
import io.streamwire.websocket.transport.TransportConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keepalive for one live connection at a time.
 *
 * <p>Every {@code pingInterval} the monitor first asks the listener whether a planned
 * disconnect is due, then pings and waits up to {@code pingTimeout} for the pong.
 * A missing pong is reported as {@link DisconnectReason#PING_TIMEOUT}, a failed ping as
 * {@link DisconnectReason#NETWORK_ERROR}.
 */
class KeepaliveMonitor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeepaliveMonitor.class);

    /**
     * Receives keepalive decisions and failures.
     */
    interface Listener {

        /** Returns true when the connection should be recycled proactively. */
        boolean shouldDisconnect();

        void onDisconnectRequested(TransportConnection watched);

        void onKeepaliveFailure(TransportConnection watched, DisconnectReason reason, Throwable cause);
    }

    private final String name;
    private final Duration pingInterval;
    private final Duration pingTimeout;
    private final Listener listener;
    private final ScheduledExecutorService scheduler;

    private volatile TransportConnection watched;
    private ScheduledFuture<?> task;

    KeepaliveMonitor(String name, Duration pingInterval, Duration pingTimeout, Listener listener) {
        this.name = name;
        this.pingInterval = pingInterval;
        this.pingTimeout = pingTimeout;
        this.listener = listener;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-keepalive");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Starts watching a connection, replacing any connection watched before.
     */
    synchronized void start(TransportConnection connection) {
        if (scheduler.isShutdown()) {
            return;
        }
        cancelTask();
        watched = connection;
        long intervalNanos = pingInterval.toNanos();
        task = scheduler.scheduleWithFixedDelay(
            () -> tick(connection),
            intervalNanos,
            intervalNanos,
            TimeUnit.NANOSECONDS
        );
        LOGGER.debug("{}: Keepalive started (interval: {} ms, timeout: {} ms)",
            name, pingInterval.toMillis(), pingTimeout.toMillis());
    }

    /**
     * Stops watching. Safe to call from the keepalive thread itself.
     */
    synchronized void stop() {
        cancelTask();
        watched = null;
    }

    boolean isWatching(TransportConnection connection) {
        return watched == connection;
    }

    private void cancelTask() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
    }

    private void tick(TransportConnection connection) {
        if (watched != connection) {
            return;
        }
        if (listener.shouldDisconnect()) {
            LOGGER.info("{}: Disconnect policy requested a reconnect", name);
            listener.onDisconnectRequested(connection);
            return;
        }

        CompletableFuture<Void> pong = connection.ping();
        try {
            pong.get(pingTimeout.toNanos(), TimeUnit.NANOSECONDS);
            LOGGER.trace("{}: Pong received", name);
        } catch (TimeoutException e) {
            LOGGER.warn("{}: No pong within {} ms", name, pingTimeout.toMillis());
            listener.onKeepaliveFailure(connection, DisconnectReason.PING_TIMEOUT, e);
        } catch (ExecutionException e) {
            LOGGER.warn("{}: Ping failed: {}", name, e.getCause().getMessage());
            listener.onKeepaliveFailure(connection, DisconnectReason.NETWORK_ERROR, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }
}
