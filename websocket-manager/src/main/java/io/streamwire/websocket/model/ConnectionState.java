package io.streamwire.websocket.model;

/**
 * Lifecycle states of a {@link io.streamwire.websocket.WebSocketManager}.
 * {@link #CLOSED} is terminal; a manager never leaves it.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    CLOSED;

    /**
     * Returns whether the manager may still (re)connect from this state.
     */
    public boolean canConnect() {
        return this != CLOSED;
    }

    /**
     * Returns whether outbound messages are accepted in this state.
     */
    public boolean canSend() {
        return this == CONNECTED;
    }

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
