package io.streamwire.websocket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs reconnect attempts on a dedicated daemon thread, one pending attempt at a time.
 */
class ReconnectScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconnectScheduler.class);

    private final String name;
    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> pending;

    ReconnectScheduler(String name) {
        this.name = name;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, name + "-reconnect-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules an attempt, replacing any attempt still waiting.
     */
    synchronized void schedule(Duration delay, Runnable attempt) {
        if (scheduler.isShutdown()) {
            LOGGER.debug("{}: Reconnect scheduler closed, attempt dropped", name);
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        pending = scheduler.schedule(() -> {
            try {
                attempt.run();
            } catch (RuntimeException e) {
                LOGGER.error("{}: Reconnect attempt failed unexpectedly", name, e);
            }
        }, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Cancels the attempt waiting to run, if any. A running attempt is left to finish.
     */
    synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
    }

    synchronized boolean hasPending() {
        return pending != null && !pending.isDone();
    }

    @Override
    public void close() {
        cancel();
        scheduler.shutdownNow();
        LOGGER.debug("{}: Reconnect scheduler stopped", name);
    }
}
