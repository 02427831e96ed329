package io.streamwire.websocket;

import io.streamwire.websocket.model.DisconnectReason;
import io.streamwire.websocket.model.WebSocketMessage;

import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Optional callbacks a manager consults or notifies. Every hook may be {@code null}.
 *
 * @param shouldDisconnect Polled on the keepalive cadence; true starts a proactive reconnect
 * @param shouldReconnect  Consulted before each reconnect attempt; may decline or override the wait
 * @param onConnect        Invoked after each successful (re)connect
 * @param onDisconnect     Invoked once per torn-down connection with the reason
 * @param onMessage        Invoked for each inbound message before it is queued
 * @param onAlert          Invoked when the manager stops reconnecting on its own
 */
public record ConnectionHooks(
    BooleanSupplier shouldDisconnect,
    Supplier<ReconnectDecision> shouldReconnect,
    Runnable onConnect,
    Consumer<DisconnectReason> onDisconnect,
    Consumer<WebSocketMessage> onMessage,
    AlertHandler onAlert
) {
    private static final ConnectionHooks NONE = new ConnectionHooks(null, null, null, null, null, null);

    public static ConnectionHooks none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private BooleanSupplier shouldDisconnect;
        private Supplier<ReconnectDecision> shouldReconnect;
        private Runnable onConnect;
        private Consumer<DisconnectReason> onDisconnect;
        private Consumer<WebSocketMessage> onMessage;
        private AlertHandler onAlert;

        public Builder shouldDisconnect(BooleanSupplier shouldDisconnect) {
            this.shouldDisconnect = shouldDisconnect;
            return this;
        }

        /**
         * Yes/no reconnect gate; an allowed reconnect waits for the configured backoff.
         */
        public Builder shouldReconnect(BooleanSupplier shouldReconnect) {
            this.shouldReconnect = shouldReconnect == null
                ? null
                : () -> ReconnectDecision.of(shouldReconnect.getAsBoolean());
            return this;
        }

        /**
         * Reconnect gate that may also choose the wait before the attempt.
         */
        public Builder reconnectDecision(Supplier<ReconnectDecision> shouldReconnect) {
            this.shouldReconnect = shouldReconnect;
            return this;
        }

        public Builder onConnect(Runnable onConnect) {
            this.onConnect = onConnect;
            return this;
        }

        public Builder onDisconnect(Consumer<DisconnectReason> onDisconnect) {
            this.onDisconnect = onDisconnect;
            return this;
        }

        public Builder onMessage(Consumer<WebSocketMessage> onMessage) {
            this.onMessage = onMessage;
            return this;
        }

        public Builder onAlert(AlertHandler onAlert) {
            this.onAlert = onAlert;
            return this;
        }

        public ConnectionHooks build() {
            return new ConnectionHooks(shouldDisconnect, shouldReconnect, onConnect, onDisconnect, onMessage, onAlert);
        }
    }
}
