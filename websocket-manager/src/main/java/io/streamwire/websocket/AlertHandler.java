package io.streamwire.websocket;

import java.util.Map;

/**
 * Receives operational alerts raised by a manager, for delivery to mail, chat or paging.
 */
@FunctionalInterface
public interface AlertHandler {

    /** Alert channel used by {@link WebSocketManager}. */
    String WEBSOCKET_CHANNEL = "websocket";

    /**
     * @param channel Alert source
     * @param message Human-readable summary
     * @param context Details such as the manager name, url, reason and attempt count
     */
    void onAlert(String channel, String message, Map<String, Object> context);
}
