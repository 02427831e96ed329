package io.streamwire.websocket;

import io.streamwire.websocket.config.WebSocketConfig;
import io.streamwire.websocket.model.ReconnectStrategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Attempt counting and delay calculation for the reconnect loop.
 *
 * <p>Exponential backoff waits {@code baseDelay * 2^(attempt - 1)} before attempt {@code attempt},
 * capped at {@code maxDelay}. With jitter {@code j}, each delay is drawn from
 * {@code [d * (1 - j), d]}.
 */
public class ReconnectDelayPolicy {

    private final ReconnectStrategy strategy;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final int maxAttempts;
    private final double jitter;
    private final DoubleSupplier random;

    private int failedAttempts;

    public ReconnectDelayPolicy(WebSocketConfig config) {
        this(
            config.reconnectStrategy(),
            config.reconnectDelay(),
            config.maxReconnectDelay(),
            config.maxReconnectAttempts(),
            config.reconnectJitter(),
            () -> ThreadLocalRandom.current().nextDouble()
        );
    }

    ReconnectDelayPolicy(
        ReconnectStrategy strategy,
        Duration baseDelay,
        Duration maxDelay,
        int maxAttempts,
        double jitter,
        DoubleSupplier random
    ) {
        this.strategy = strategy;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
        this.random = random;
    }

    /**
     * Returns whether another attempt is allowed.
     */
    public synchronized boolean shouldRetry() {
        return failedAttempts < maxAttempts;
    }

    /**
     * Returns the wait before the next attempt.
     */
    public synchronized Duration nextDelay() {
        return delayForAttempt(failedAttempts + 1);
    }

    /**
     * Returns the wait before the given attempt (1-based).
     */
    public Duration delayForAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1");
        }
        return switch (strategy) {
            case IMMEDIATE, CALLBACK_CONTROLLED -> Duration.ZERO;
            case FIXED_DELAY -> baseDelay;
            case EXPONENTIAL_BACKOFF -> applyJitter(exponential(attempt));
        };
    }

    private Duration exponential(int attempt) {
        long baseMillis = baseDelay.toMillis();
        long capMillis = maxDelay.toMillis();
        double scaled = baseMillis * Math.pow(2, attempt - 1);
        return Duration.ofMillis((long) Math.min(scaled, capMillis));
    }

    private Duration applyJitter(Duration delay) {
        if (jitter <= 0) {
            return delay;
        }
        double factor = 1 - jitter * random.getAsDouble();
        return Duration.ofMillis(Math.round(delay.toMillis() * factor));
    }

    public synchronized void recordFailure() {
        failedAttempts++;
    }

    /**
     * Resets the attempt counter (called on successful connection).
     */
    public synchronized void recordSuccess() {
        failedAttempts = 0;
    }

    /**
     * Returns the number of failed attempts since the last success.
     */
    public synchronized int getFailedAttempts() {
        return failedAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
