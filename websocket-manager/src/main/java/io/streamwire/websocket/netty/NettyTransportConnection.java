package io.streamwire.websocket.netty;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.EventLoopGroup;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.streamwire.websocket.transport.InboundFrame;
import io.streamwire.websocket.transport.TransportClosedException;
import io.streamwire.websocket.transport.TransportConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A Netty channel exposed as a {@link TransportConnection}.
 *
 * <p>Inbound frames are buffered until {@link #receive()} takes them. Socket reads are
 * paused once {@code highWaterMark} frames are buffered and resumed when the buffer
 * drains to half of that, so a slow consumer pushes back on the peer through TCP.
 */
class NettyTransportConnection implements TransportConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyTransportConnection.class);

    private static final Object CLOSED_MARKER = new Object();
    private static final byte[] PING_PAYLOAD = "keepalive".getBytes(StandardCharsets.US_ASCII);

    private final String name;
    private final EventLoopGroup eventLoopGroup;
    private final int highWaterMark;
    private final int lowWaterMark;
    private final LinkedBlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final Queue<CompletableFuture<Void>> pendingPings = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private volatile Channel channel;
    private volatile TransportClosedException closeCause;

    NettyTransportConnection(String name, EventLoopGroup eventLoopGroup, int highWaterMark) {
        this.name = name;
        this.eventLoopGroup = eventLoopGroup;
        this.highWaterMark = highWaterMark;
        this.lowWaterMark = Math.max(1, highWaterMark / 2);
    }

    String name() {
        return name;
    }

    void attach(Channel channel) {
        this.channel = channel;
    }

    void onFrame(InboundFrame frame) {
        inbound.add(frame);
        Channel ch = channel;
        if (ch != null && inbound.size() >= highWaterMark && ch.config().isAutoRead()) {
            LOGGER.debug("{}: Inbound buffer full ({} frames), pausing reads", name, inbound.size());
            ch.config().setAutoRead(false);
        }
    }

    void onPong() {
        CompletableFuture<Void> pending;
        while ((pending = pendingPings.poll()) != null) {
            pending.complete(null);
        }
    }

    void onRemoteClose(int code, String reason) {
        markClosed(new TransportClosedException(code, reason, true));
    }

    void onError(Throwable cause) {
        markClosed(new TransportClosedException(
            TransportClosedException.ABNORMAL_CLOSURE, String.valueOf(cause.getMessage()), false, cause));
    }

    void onInactive() {
        markClosed(new TransportClosedException(TransportClosedException.ABNORMAL_CLOSURE, "connection lost", false));
        eventLoopGroup.shutdownGracefully();
    }

    @Override
    public void sendText(String text) throws IOException {
        awaitWrite(requireOpen().writeAndFlush(new TextWebSocketFrame(text)));
    }

    @Override
    public void sendBinary(byte[] data) throws IOException {
        awaitWrite(requireOpen().writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(data))));
    }

    @Override
    public CompletableFuture<Void> ping() {
        CompletableFuture<Void> pong = new CompletableFuture<>();
        Channel ch;
        try {
            ch = requireOpen();
        } catch (TransportClosedException e) {
            pong.completeExceptionally(e);
            return pong;
        }
        pendingPings.add(pong);
        if (closed.get() && pendingPings.remove(pong)) {
            // closed after requireOpen(), the drain in markClosed may have missed it
            TransportClosedException cause = closeCause;
            pong.completeExceptionally(cause != null
                ? cause
                : new TransportClosedException(TransportClosedException.ABNORMAL_CLOSURE, "closed", false));
            return pong;
        }
        ch.writeAndFlush(new PingWebSocketFrame(Unpooled.wrappedBuffer(PING_PAYLOAD)))
            .addListener(future -> {
                if (!future.isSuccess()) {
                    pong.completeExceptionally(future.cause());
                }
            });
        return pong;
    }

    @Override
    public InboundFrame receive() throws IOException, InterruptedException {
        Object item = inbound.take();
        if (item == CLOSED_MARKER) {
            // leave the marker for any later caller
            inbound.add(CLOSED_MARKER);
            throw closeCause;
        }
        Channel ch = channel;
        if (ch != null && !ch.config().isAutoRead() && inbound.size() <= lowWaterMark) {
            LOGGER.debug("{}: Inbound buffer drained, resuming reads", name);
            ch.config().setAutoRead(true);
        }
        return (InboundFrame) item;
    }

    @Override
    public void close(int code, String reason) {
        if (!markClosed(new TransportClosedException(code, reason, false))) {
            return;
        }
        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame(sendableCode(code), reason))
                .addListener(ChannelFutureListener.CLOSE);
        }
        eventLoopGroup.shutdownGracefully();
    }

    /**
     * Tears the channel down without a close handshake.
     */
    void abort() {
        markClosed(new TransportClosedException(TransportClosedException.ABNORMAL_CLOSURE, "aborted", false));
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        eventLoopGroup.shutdownGracefully();
    }

    @Override
    public boolean isOpen() {
        Channel ch = channel;
        return !closed.get() && ch != null && ch.isActive();
    }

    private boolean markClosed(TransportClosedException cause) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        closeCause = cause;
        inbound.add(CLOSED_MARKER);
        CompletableFuture<Void> pending;
        while ((pending = pendingPings.poll()) != null) {
            pending.completeExceptionally(cause);
        }
        return true;
    }

    private Channel requireOpen() throws TransportClosedException {
        Channel ch = channel;
        if (closed.get() || ch == null || !ch.isActive()) {
            TransportClosedException cause = closeCause;
            throw cause != null
                ? cause
                : new TransportClosedException(TransportClosedException.ABNORMAL_CLOSURE, "not open", false);
        }
        return ch;
    }

    private void awaitWrite(ChannelFuture future) throws IOException {
        future.awaitUninterruptibly();
        if (!future.isSuccess()) {
            throw new IOException(name + ": write failed", future.cause());
        }
    }

    /** Codes 1005, 1006 and 1015 must never appear in a close frame. */
    private static int sendableCode(int code) {
        boolean reserved = code == 1005 || code == 1006 || code == 1015;
        return code < 1000 || code > 4999 || reserved ? TransportClosedException.NORMAL_CLOSURE : code;
    }
}
