package io.streamwire.websocket;

import java.time.Duration;

/**
 * Answer of a {@code shouldReconnect} hook.
 *
 * @param allowed whether to reconnect at all
 * @param delay   wait before the attempt, or null to use the configured backoff
 */
public record ReconnectDecision(boolean allowed, Duration delay) {

    private static final ReconnectDecision PROCEED = new ReconnectDecision(true, null);
    private static final ReconnectDecision DECLINE = new ReconnectDecision(false, null);

    public ReconnectDecision {
        if (delay != null && delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (!allowed && delay != null) {
            throw new IllegalArgumentException("a declined reconnect has no delay");
        }
    }

    /** Reconnect using the configured backoff. */
    public static ReconnectDecision proceed() {
        return PROCEED;
    }

    /** Reconnect after the given wait instead of the configured backoff. */
    public static ReconnectDecision after(Duration delay) {
        return new ReconnectDecision(true, delay);
    }

    public static ReconnectDecision decline() {
        return DECLINE;
    }

    static ReconnectDecision of(boolean allowed) {
        return allowed ? PROCEED : DECLINE;
    }
}
