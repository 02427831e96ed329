package io.streamwire.websocket.model;

/**
 * Why a live connection ended. Passed to the disconnect hook exactly once per teardown.
 */
public enum DisconnectReason {
    /** Caller closed the manager with {@code forceClose()} / {@code close()}. */
    NORMAL_CLOSE(true),
    /** Remote peer sent a close frame. */
    SERVER_CLOSE(false),
    /** I/O failure or a drop without a close frame. */
    NETWORK_ERROR(false),
    /** Keepalive ping was not acknowledged in time. */
    PING_TIMEOUT(false),
    /** Forced teardown through {@code kill()}. */
    KILLED(false),
    /** Planned reconnect requested by the caller or the disconnect policy. */
    PROACTIVE_RECONNECT(true),
    /** Manager retired through {@code shutdown()}. */
    SHUTDOWN(true);

    private final boolean proactive;

    DisconnectReason(boolean proactive) {
        this.proactive = proactive;
    }

    public boolean isProactive() {
        return proactive;
    }

    public boolean isReactive() {
        return !proactive;
    }
}
