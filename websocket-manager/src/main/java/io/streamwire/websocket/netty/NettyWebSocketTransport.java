package io.streamwire.websocket.netty;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketClientCompressionHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.SslProvider;
import io.streamwire.websocket.transport.TransportConnection;
import io.streamwire.websocket.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLParameters;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Netty-based {@link WebSocketTransport}. Each connection gets its own single-threaded
 * event loop group, released when the connection closes.
 * Supports both epoll (Linux) and NIO (universal) event loop groups.
 */
public class NettyWebSocketTransport implements WebSocketTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    public static final int DEFAULT_MAX_FRAME_PAYLOAD = 10 * 1024 * 1024;
    public static final int DEFAULT_INBOUND_HIGH_WATER_MARK = 1024;

    private static final int HANDSHAKE_MAX_CONTENT = 8192;

    private final boolean enableCompression;
    private final int maxFramePayloadLength;
    private final int inboundHighWaterMark;

    /**
     * Creates a transport with compression enabled and default limits.
     */
    public NettyWebSocketTransport() {
        this(true, DEFAULT_MAX_FRAME_PAYLOAD, DEFAULT_INBOUND_HIGH_WATER_MARK);
    }

    /**
     * Creates a transport.
     *
     * @param enableCompression     Whether to negotiate permessage-deflate (some servers have non-standard implementations)
     * @param maxFramePayloadLength Largest accepted frame payload, in bytes
     * @param inboundHighWaterMark  Buffered frames at which socket reads pause
     */
    public NettyWebSocketTransport(boolean enableCompression, int maxFramePayloadLength, int inboundHighWaterMark) {
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
        if (inboundHighWaterMark <= 0) {
            throw new IllegalArgumentException("inboundHighWaterMark must be positive");
        }
        this.enableCompression = enableCompression;
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.inboundHighWaterMark = inboundHighWaterMark;
    }

    @Override
    public TransportConnection open(URI uri, Duration timeout) throws IOException {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("Unsupported scheme: " + uri);
        }
        boolean secure = scheme.equals("wss");
        String host = uri.getHost();
        int port = uri.getPort() > 0 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslContext = secure ? buildSslContext() : null;

        EventLoopGroup eventLoopGroup = NettyEventLoopFactory.createEventLoopGroup(1, host);
        NettyTransportConnection connection = new NettyTransportConnection(host, eventLoopGroup, inboundHighWaterMark);
        WebSocketClientHandler handler = new WebSocketClientHandler(uri, maxFramePayloadLength, connection);

        Bootstrap bootstrap = new Bootstrap()
            .group(eventLoopGroup)
            .channel(NettyEventLoopFactory.getClientChannelClass())
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE))
            .option(ChannelOption.TCP_NODELAY, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    if (sslContext != null) {
                        pipeline.addLast(newSslHandler(sslContext, ch, host, port));
                    }
                    pipeline.addLast(new HttpClientCodec());
                    pipeline.addLast(new HttpObjectAggregator(HANDSHAKE_MAX_CONTENT));
                    if (enableCompression) {
                        pipeline.addLast(WebSocketClientCompressionHandler.INSTANCE);
                    }
                    pipeline.addLast(new WebSocketFrameAggregator(maxFramePayloadLength));
                    pipeline.addLast(handler);
                }
            });

        long deadline = System.nanoTime() + timeout.toNanos();
        LOGGER.info("{}: Connecting to {}:{}...", host, host, port);
        try {
            ChannelFuture connectFuture = bootstrap.connect(host, port);
            awaitStep(connectFuture, remainingMillis(deadline), "connect to " + host + ":" + port);
            awaitStep(handler.handshakeFuture(), remainingMillis(deadline), "handshake with " + uri);
            LOGGER.info("{}: Connected", host);
            return connection;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.abort();
            throw new InterruptedIOException("Interrupted while connecting to " + uri);
        } catch (IOException | RuntimeException e) {
            connection.abort();
            throw e;
        }
    }

    private static void awaitStep(ChannelFuture future, long timeoutMs, String step)
        throws IOException, InterruptedException {
        if (!future.await(timeoutMs, TimeUnit.MILLISECONDS)) {
            throw new IOException("Timed out waiting to " + step);
        }
        if (!future.isSuccess()) {
            throw new IOException("Failed to " + step, future.cause());
        }
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }

    private static SslContext buildSslContext() throws IOException {
        return SslContextBuilder.forClient()
            .protocols("TLSv1.3", "TLSv1.2")
            .sslProvider(SslProvider.JDK)
            .build();
    }

    private static SslHandler newSslHandler(SslContext sslContext, SocketChannel ch, String host, int port) {
        SslHandler sslHandler = sslContext.newHandler(ch.alloc(), host, port);
        SSLEngine engine = sslHandler.engine();
        SSLParameters parameters = engine.getSSLParameters();
        parameters.setEndpointIdentificationAlgorithm("HTTPS");
        engine.setSSLParameters(parameters);
        return sslHandler;
    }
}
