package io.streamwire.websocket.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.streamwire.websocket.model.WebSocketMessage;
import io.streamwire.websocket.transport.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * JSON codec for WebSocket payloads.
 * Inbound frames are decoded as JSON when possible and kept raw otherwise.
 * Outbound objects are written with a space after each {@code :} and {@code ,}.
 * Thread-safe and reusable.
 */
public final class JsonMessageCodec {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonMessageCodec.class);

    private static final JsonMessageCodec INSTANCE = new JsonMessageCodec();

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;

    private JsonMessageCodec() {
        // "42 is the answer" is text, not the number 42
        this.objectMapper = new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.writer = objectMapper.writer(new SpacedPrettyPrinter());
    }

    /**
     * Gets the singleton instance.
     */
    public static JsonMessageCodec getInstance() {
        return INSTANCE;
    }

    /**
     * Returns the shared mapper, for callers building {@link JsonNode} payloads.
     */
    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Decodes a frame: JSON first, raw text or bytes as the fallback.
     */
    public WebSocketMessage decode(InboundFrame frame) {
        int size = frame.sizeBytes();
        if (frame.binary()) {
            JsonNode node = tryParse(frame.data());
            return node != null ? WebSocketMessage.json(node, size) : WebSocketMessage.binary(frame.data());
        }
        JsonNode node = tryParse(frame.text());
        return node != null ? WebSocketMessage.json(node, size) : WebSocketMessage.text(frame.text());
    }

    /**
     * Encodes an outbound payload as text. Strings pass through unchanged.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized
     */
    public String encode(Object payload) {
        if (payload instanceof String text) {
            return text;
        }
        try {
            return writer.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode payload to JSON: {}", e.getMessage(), e);
            throw new IllegalArgumentException("Failed to encode payload to JSON", e);
        }
    }

    private JsonNode tryParse(String text) {
        try {
            return validTree(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private JsonNode tryParse(byte[] data) {
        try {
            return validTree(objectMapper.readTree(data));
        } catch (IOException e) {
            return null;
        }
    }

    private static JsonNode validTree(JsonNode node) {
        return node == null || node.isMissingNode() ? null : node;
    }

    /**
     * Compact output with {@code ": "} and {@code ", "} separators.
     */
    private static final class SpacedPrettyPrinter extends MinimalPrettyPrinter {

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
