package io.streamwire.websocket.transport;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A complete data frame as delivered by a transport: either text or binary.
 *
 * @param binary whether this is a binary frame
 * @param text   payload of a text frame, {@code null} for binary frames
 * @param data   payload of a binary frame, {@code null} for text frames
 */
public record InboundFrame(boolean binary, String text, byte[] data) {

    public InboundFrame {
        if (binary) {
            Objects.requireNonNull(data, "data");
        } else {
            Objects.requireNonNull(text, "text");
        }
    }

    public static InboundFrame text(String text) {
        return new InboundFrame(false, text, null);
    }

    public static InboundFrame binary(byte[] data) {
        return new InboundFrame(true, null, data);
    }

    /**
     * Payload size in bytes.
     */
    public int sizeBytes() {
        return binary ? data.length : text.getBytes(StandardCharsets.UTF_8).length;
    }
}
