package io.streamwire.websocket.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One inbound message after best-effort decoding.
 * JSON payloads are exposed as a {@link JsonNode}; anything else keeps its raw form.
 */
public final class WebSocketMessage {

    /**
     * Payload form of a message.
     */
    public enum Kind {
        JSON,
        TEXT,
        BINARY
    }

    private final Kind kind;
    private final JsonNode json;
    private final String text;
    private final byte[] binary;
    private final int sizeBytes;

    private WebSocketMessage(Kind kind, JsonNode json, String text, byte[] binary, int sizeBytes) {
        this.kind = kind;
        this.json = json;
        this.text = text;
        this.binary = binary;
        this.sizeBytes = sizeBytes;
    }

    public static WebSocketMessage json(JsonNode node, int sizeBytes) {
        return new WebSocketMessage(Kind.JSON, Objects.requireNonNull(node, "node"), null, null, sizeBytes);
    }

    public static WebSocketMessage json(JsonNode node) {
        return json(node, node.toString().getBytes(StandardCharsets.UTF_8).length);
    }

    public static WebSocketMessage text(String text) {
        Objects.requireNonNull(text, "text");
        return new WebSocketMessage(Kind.TEXT, null, text, null, text.getBytes(StandardCharsets.UTF_8).length);
    }

    public static WebSocketMessage binary(byte[] data) {
        Objects.requireNonNull(data, "data");
        return new WebSocketMessage(Kind.BINARY, null, null, data.clone(), data.length);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isJson() {
        return kind == Kind.JSON;
    }

    /**
     * Returns the decoded JSON tree.
     *
     * @throws IllegalStateException if this message is not JSON
     */
    public JsonNode json() {
        if (kind != Kind.JSON) {
            throw new IllegalStateException("Message is " + kind + ", not JSON");
        }
        return json;
    }

    /**
     * Returns the payload as text. JSON payloads are rendered compactly, binary payloads as UTF-8.
     */
    public String text() {
        return switch (kind) {
            case JSON -> json.toString();
            case TEXT -> text;
            case BINARY -> new String(binary, StandardCharsets.UTF_8);
        };
    }

    /**
     * Returns a copy of the raw bytes.
     *
     * @throws IllegalStateException if this message is not binary
     */
    public byte[] binary() {
        if (kind != Kind.BINARY) {
            throw new IllegalStateException("Message is " + kind + ", not BINARY");
        }
        return binary.clone();
    }

    /** Size of the frame this message was decoded from. */
    public int sizeBytes() {
        return sizeBytes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebSocketMessage other)) {
            return false;
        }
        return kind == other.kind
            && Objects.equals(json, other.json)
            && Objects.equals(text, other.text)
            && Arrays.equals(binary, other.binary);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(kind, json, text);
        return 31 * result + Arrays.hashCode(binary);
    }

    @Override
    public String toString() {
        return "WebSocketMessage{" + kind + ": " + (kind == Kind.BINARY ? binary.length + " bytes" : text()) + '}';
    }
}
