package io.streamwire.websocket.codec;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Method/params/id subscription requests, e.g.
 * {@code {"method": "SUBSCRIBE", "params": ["btcusdt@trade"], "id": 1}}.
 */
public class JsonSubscriptionProtocol implements SubscriptionProtocol {

    private final JsonMessageCodec codec = JsonMessageCodec.getInstance();
    private final AtomicLong requestId = new AtomicLong();

    @Override
    public String subscribeMessage(String channel) {
        return request("SUBSCRIBE", channel);
    }

    @Override
    public String unsubscribeMessage(String channel) {
        return request("UNSUBSCRIBE", channel);
    }

    private String request(String method, String channel) {
        ObjectNode node = codec.objectMapper().createObjectNode();
        node.put("method", method);
        node.putArray("params").add(channel);
        node.put("id", requestId.incrementAndGet());
        return codec.encode(node);
    }
}
