package io.streamwire.websocket.transport;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Opens WebSocket connections.
 */
public interface WebSocketTransport {

    /**
     * Opens a connection and completes the opening handshake.
     *
     * @param uri     ws:// or wss:// endpoint
     * @param timeout bound on TCP connect plus handshake
     * @return an open connection
     * @throws IOException if the connection could not be established in time
     */
    TransportConnection open(URI uri, Duration timeout) throws IOException;
}
