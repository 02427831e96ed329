package io.streamwire.websocket.model;

/**
 * How the wait before each reconnect attempt is chosen.
 */
public enum ReconnectStrategy {
    /** Retry without waiting. */
    IMMEDIATE,
    /** Wait {@code reconnectDelay} before every attempt. */
    FIXED_DELAY,
    /** Double the wait after each failure, starting at {@code reconnectDelay}, capped at {@code maxReconnectDelay}. */
    EXPONENTIAL_BACKOFF,
    /** Wait until the {@code shouldReconnect} hook reports true. */
    CALLBACK_CONTROLLED
}
