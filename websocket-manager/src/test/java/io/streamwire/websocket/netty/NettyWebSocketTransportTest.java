package io.streamwire.websocket.netty;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.streamwire.websocket.transport.InboundFrame;
import io.streamwire.websocket.transport.TransportClosedException;
import io.streamwire.websocket.transport.TransportConnection;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback tests for NettyWebSocketTransport against an embedded Netty echo server.
 *
 * Tests:
 * - Handshake, text and binary echo
 * - Ping answered by pong
 * - Server close frame surfaces as a remote close
 * - Local close and refused connections
 */
class NettyWebSocketTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static EventLoopGroup serverGroup;
    private static Channel serverChannel;
    private static int port;

    private final NettyWebSocketTransport transport = new NettyWebSocketTransport();
    private TransportConnection connection;

    @BeforeAll
    static void startServer() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
            .group(serverGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(new HttpServerCodec());
                    ch.pipeline().addLast(new HttpObjectAggregator(65536));
                    ch.pipeline().addLast(new WebSocketServerCompressionHandler());
                    ch.pipeline().addLast(new WebSocketServerProtocolHandler("/ws", null, true));
                    ch.pipeline().addLast(new EchoHandler());
                }
            })
            .bind("127.0.0.1", 0)
            .sync()
            .channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    @AfterAll
    static void stopServer() throws InterruptedException {
        serverChannel.close().sync();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    @AfterEach
    void closeConnection() {
        if (connection != null) {
            connection.close(TransportClosedException.NORMAL_CLOSURE, "test done");
        }
    }

    private TransportConnection open() throws IOException {
        connection = transport.open(URI.create("ws://127.0.0.1:" + port + "/ws"), TIMEOUT);
        return connection;
    }

    @Test
    void testTextEcho() throws Exception {
        open();
        assertTrue(connection.isOpen());

        connection.sendText("{\"hello\": \"world\"}");

        InboundFrame frame = connection.receive();
        assertFalse(frame.binary());
        assertEquals("{\"hello\": \"world\"}", frame.text());
    }

    @Test
    void testBinaryEcho() throws Exception {
        open();

        connection.sendBinary(new byte[]{1, 2, 3});

        InboundFrame frame = connection.receive();
        assertTrue(frame.binary());
        assertArrayEquals(new byte[]{1, 2, 3}, frame.data());
    }

    @Test
    void testPingIsAnswered() throws Exception {
        open();

        assertDoesNotThrow(() -> connection.ping().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testServerCloseIsRemote() throws Exception {
        open();

        connection.sendText("close");

        TransportClosedException closed = assertThrows(TransportClosedException.class, connection::receive);
        assertTrue(closed.isRemote());
        assertEquals(4000, closed.getCode());
        assertEquals("bye", closed.getReason());
        assertThrows(TransportClosedException.class, connection::receive, "Closed stays closed");
    }

    @Test
    void testLocalClose() throws Exception {
        open();

        connection.close(TransportClosedException.NORMAL_CLOSURE, "done");

        assertFalse(connection.isOpen());
        TransportClosedException closed = assertThrows(TransportClosedException.class, connection::receive);
        assertFalse(closed.isRemote());
        assertThrows(IOException.class, () -> connection.sendText("late"));
    }

    @Test
    void testConnectionRefused() throws Exception {
        int unused;
        try (ServerSocket socket = new ServerSocket(0)) {
            unused = socket.getLocalPort();
        }

        assertThrows(IOException.class,
            () -> transport.open(URI.create("ws://127.0.0.1:" + unused + "/ws"), Duration.ofSeconds(2)));
    }

    @Test
    void testUnsupportedScheme() {
        assertThrows(IllegalArgumentException.class,
            () -> transport.open(URI.create("http://127.0.0.1:" + port + "/ws"), TIMEOUT));
    }

    /**
     * Echoes data frames; the text {@code close} makes the server close with 4000 "bye".
     */
    private static class EchoHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
            if (frame instanceof TextWebSocketFrame text) {
                if ("close".equals(text.text())) {
                    ctx.writeAndFlush(new CloseWebSocketFrame(4000, "bye"));
                } else {
                    ctx.writeAndFlush(new TextWebSocketFrame(text.text()));
                }
            } else if (frame instanceof BinaryWebSocketFrame binary) {
                ctx.writeAndFlush(new BinaryWebSocketFrame(binary.content().retain()));
            }
        }
    }
}
