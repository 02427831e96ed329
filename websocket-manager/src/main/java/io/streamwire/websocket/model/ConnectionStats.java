package io.streamwire.websocket.model;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection counters for a single manager.
 * Written only by the owning manager; safe to read from any thread.
 */
public class ConnectionStats {

    private final AtomicLong connects = new AtomicLong();
    private final AtomicLong disconnects = new AtomicLong();
    private final AtomicLong proactiveDisconnects = new AtomicLong();
    private final AtomicLong reactiveDisconnects = new AtomicLong();
    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong bytesSent = new AtomicLong();

    private volatile long lastConnectTime;
    private volatile long lastDisconnectTime;
    private volatile long lastMessageTime;
    private volatile long createdTime = System.currentTimeMillis();

    public void recordConnect() {
        connects.incrementAndGet();
        lastConnectTime = System.currentTimeMillis();
    }

    /**
     * Records the end of a live connection.
     *
     * @param proactive true when the disconnect was planned by the caller
     */
    public void recordDisconnect(boolean proactive) {
        disconnects.incrementAndGet();
        if (proactive) {
            proactiveDisconnects.incrementAndGet();
        } else {
            reactiveDisconnects.incrementAndGet();
        }
        lastDisconnectTime = System.currentTimeMillis();
    }

    public void recordMessageReceived(long bytes) {
        messagesReceived.incrementAndGet();
        bytesReceived.addAndGet(bytes);
        lastMessageTime = System.currentTimeMillis();
    }

    public void recordMessageSent(long bytes) {
        messagesSent.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    /**
     * Zeroes every counter and timestamp and restarts the uptime clock.
     */
    public void reset() {
        connects.set(0);
        disconnects.set(0);
        proactiveDisconnects.set(0);
        reactiveDisconnects.set(0);
        messagesReceived.set(0);
        bytesReceived.set(0);
        messagesSent.set(0);
        bytesSent.set(0);
        lastConnectTime = 0;
        lastDisconnectTime = 0;
        lastMessageTime = 0;
        createdTime = System.currentTimeMillis();
    }

    public long getConnects() {
        return connects.get();
    }

    public long getDisconnects() {
        return disconnects.get();
    }

    public long getProactiveDisconnects() {
        return proactiveDisconnects.get();
    }

    public long getReactiveDisconnects() {
        return reactiveDisconnects.get();
    }

    public long getMessagesReceived() {
        return messagesReceived.get();
    }

    public long getBytesReceived() {
        return bytesReceived.get();
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public long getBytesSent() {
        return bytesSent.get();
    }

    /** Epoch millis of the last connect, 0 if never connected. */
    public long getLastConnectTime() {
        return lastConnectTime;
    }

    /** Epoch millis of the last disconnect, 0 if never disconnected. */
    public long getLastDisconnectTime() {
        return lastDisconnectTime;
    }

    /** Epoch millis of the last received message, 0 if none. */
    public long getLastMessageTime() {
        return lastMessageTime;
    }

    /**
     * Time since these stats were created or last reset.
     */
    public Duration uptime() {
        return Duration.ofMillis(System.currentTimeMillis() - createdTime);
    }

    /**
     * Time since the last connect, zero if never connected.
     */
    public Duration connectionTime() {
        long connectedAt = lastConnectTime;
        if (connectedAt == 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(System.currentTimeMillis() - connectedAt);
    }

    @Override
    public String toString() {
        return "ConnectionStats{" +
            "connects=" + connects.get() +
            ", disconnects=" + disconnects.get() +
            ", proactiveDisconnects=" + proactiveDisconnects.get() +
            ", reactiveDisconnects=" + reactiveDisconnects.get() +
            ", messagesReceived=" + messagesReceived.get() +
            ", bytesReceived=" + bytesReceived.get() +
            ", messagesSent=" + messagesSent.get() +
            ", bytesSent=" + bytesSent.get() +
            '}';
    }
}
