package io.streamwire.websocket.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonSubscriptionProtocolTest {

    @Test
    void testRequestsCarryIncreasingIds() {
        JsonSubscriptionProtocol protocol = new JsonSubscriptionProtocol();

        assertEquals("{\"method\": \"SUBSCRIBE\", \"params\": [\"btcusdt@trade\"], \"id\": 1}",
            protocol.subscribeMessage("btcusdt@trade"));
        assertEquals("{\"method\": \"UNSUBSCRIBE\", \"params\": [\"btcusdt@trade\"], \"id\": 2}",
            protocol.unsubscribeMessage("btcusdt@trade"));
    }

    @Test
    void testIdsArePerInstance() {
        new JsonSubscriptionProtocol().subscribeMessage("a");

        assertTrue(new JsonSubscriptionProtocol().subscribeMessage("b").endsWith("\"id\": 1}"));
    }
}
