package io.streamwire.supervisor.core;

import io.streamwire.websocket.WebSocketManager;
import io.streamwire.websocket.exception.WebSocketException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Watchdog for one stream.
 *
 * <p>Polls the current manager every {@code checkIntervalMs}. A manager that is dead
 * (its own reconnect loop gave up, or it was killed) but not shut down is retired with
 * {@link WebSocketManager#forceClose()} and replaced by a fresh one from the factory,
 * carrying over its subscriptions. A manager that was shut down is never replaced.
 */
public class StreamSupervisor implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamSupervisor.class);

    private final String name;
    private final Supplier<WebSocketManager> factory;
    private final long checkIntervalMs;
    private final int maxRestarts;
    private final ScheduledExecutorService scheduler;

    private volatile WebSocketManager current;
    private volatile boolean running = false;
    private volatile int restartCount = 0;
    private volatile RestartListener restartListener;
    private boolean exhaustedLogged;

    /**
     * Creates a supervisor.
     *
     * @param name            Stream name for logging
     * @param factory         Builds a new, unconnected manager
     * @param checkIntervalMs Poll interval in milliseconds
     * @param maxRestarts     Rebuilds allowed, 0 for unlimited
     */
    public StreamSupervisor(String name, Supplier<WebSocketManager> factory, long checkIntervalMs, int maxRestarts) {
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be positive");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts cannot be negative");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.checkIntervalMs = checkIntervalMs;
        this.maxRestarts = maxRestarts;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-supervisor");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Registers a listener notified after each rebuild.
     */
    public void setRestartListener(RestartListener restartListener) {
        this.restartListener = restartListener;
    }

    /**
     * Builds and connects the first manager and starts polling.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        current = factory.get();
        connect(current);

        scheduler.scheduleAtFixedRate(
            this::performHealthCheck,
            checkIntervalMs,
            checkIntervalMs,
            TimeUnit.MILLISECONDS
        );
        LOGGER.info("{}: Supervisor started (interval: {} ms, max restarts: {})",
            name, checkIntervalMs, maxRestarts == 0 ? "unlimited" : maxRestarts);
    }

    /**
     * Checks the current manager and replaces it when it is dead.
     * Runs on the supervisor thread; exposed for deterministic tests.
     */
    void performHealthCheck() {
        WebSocketManager replacement;
        int restarts;
        synchronized (this) {
            WebSocketManager manager = current;
            if (!running || manager == null || !manager.isDead()) {
                return;
            }
            if (manager.isShutdown()) {
                LOGGER.debug("{}: Manager was shut down, not restarting", name);
                return;
            }
            if (maxRestarts > 0 && restartCount >= maxRestarts) {
                if (!exhaustedLogged) {
                    exhaustedLogged = true;
                    LOGGER.error("{}: Manager is dead and max restarts ({}) reached", name, maxRestarts);
                }
                return;
            }

            LOGGER.warn("{}: Manager is dead ({}), rebuilding", name, manager.state());
            Set<String> channels = manager.subscriptions();
            // queued messages stay available through drainRemaining()
            manager.forceClose();
            try {
                replacement = factory.get();
            } catch (RuntimeException e) {
                LOGGER.error("{}: Failed to build replacement manager", name, e);
                return;
            }
            if (!channels.isEmpty()) {
                replacement.subscribe(channels.toArray(new String[0]));
            }
            current = replacement;
            restarts = ++restartCount;
        }

        LOGGER.info("{}: Restart #{}", name, restarts);
        RestartListener listener = restartListener;
        if (listener != null) {
            try {
                listener.onRestart(replacement, restarts);
            } catch (RuntimeException e) {
                LOGGER.error("{}: Error in restart listener", name, e);
            }
        }
        connect(replacement);
    }

    private void connect(WebSocketManager manager) {
        try {
            manager.connect();
        } catch (WebSocketException e) {
            // left dead, the next health check rebuilds it
            LOGGER.error("{}: Connect failed: {}", name, e.getMessage());
        }
    }

    /**
     * Returns the manager currently supervised, null before {@link #start()}.
     */
    public WebSocketManager current() {
        return current;
    }

    public int getRestartCount() {
        return restartCount;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Stops polling and shuts the current manager down for good.
     */
    public void shutdown() {
        synchronized (this) {
            if (!running && scheduler.isShutdown()) {
                return;
            }
            running = false;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        WebSocketManager manager = current;
        if (manager != null) {
            manager.shutdown();
        }
        LOGGER.info("{}: Supervisor stopped after {} restart(s)", name, restartCount);
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Notified after a dead manager has been replaced, before the replacement connects.
     */
    public interface RestartListener {
        void onRestart(WebSocketManager replacement, int restartCount);
    }
}
