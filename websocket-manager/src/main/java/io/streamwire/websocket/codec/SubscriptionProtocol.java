package io.streamwire.websocket.codec;

/**
 * Builds the wire messages that add or remove a channel subscription.
 */
public interface SubscriptionProtocol {

    /**
     * Returns the message that subscribes to one channel.
     */
    String subscribeMessage(String channel);

    /**
     * Returns the message that unsubscribes from one channel.
     */
    String unsubscribeMessage(String channel);
}
