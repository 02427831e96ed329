package io.streamwire.websocket.transport;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * One open duplex WebSocket connection. Framing, masking and TLS are the implementation's concern.
 */
public interface TransportConnection {

    /**
     * Sends a text frame.
     *
     * @throws IOException if the frame could not be written
     */
    void sendText(String text) throws IOException;

    /**
     * Sends a binary frame.
     *
     * @throws IOException if the frame could not be written
     */
    void sendBinary(byte[] data) throws IOException;

    /**
     * Sends a ping. The returned future completes when the matching pong arrives
     * and fails if the connection closes first.
     */
    CompletableFuture<Void> ping();

    /**
     * Blocks until the next data frame arrives.
     *
     * @throws TransportClosedException once the connection is closed, by either side
     * @throws IOException              on any other read failure
     * @throws InterruptedException     if the calling thread is interrupted
     */
    InboundFrame receive() throws IOException, InterruptedException;

    /**
     * Closes the connection with the given close code. Idempotent.
     */
    void close(int code, String reason);

    boolean isOpen();
}
