package io.streamwire.websocket.netty;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.streamwire.websocket.transport.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * Netty handler for one WebSocket client connection.
 * Performs the opening handshake and forwards frames and lifecycle events to the connection.
 */
class WebSocketClientHandler extends SimpleChannelInboundHandler<Object> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketClientHandler.class);

    /** Close code reported when a close frame carries no status. */
    private static final int NO_STATUS_RECEIVED = 1005;

    private final WebSocketClientHandshaker handshaker;
    private final NettyTransportConnection connection;
    private volatile ChannelPromise handshakeFuture;

    WebSocketClientHandler(URI uri, int maxFramePayloadLength, NettyTransportConnection connection) {
        this.handshaker = WebSocketClientHandshakerFactory.newHandshaker(
            uri,
            WebSocketVersion.V13,
            null,
            true,
            new DefaultHttpHeaders(),
            maxFramePayloadLength
        );
        this.connection = connection;
    }

    /**
     * Completes when the opening handshake succeeds, fails if it does not.
     */
    ChannelFuture handshakeFuture() {
        return handshakeFuture;
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        handshakeFuture = ctx.newPromise();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        connection.attach(ctx.channel());
        handshaker.handshake(ctx.channel());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        LOGGER.debug("{}: Channel inactive", connection.name());
        handshakeFuture.tryFailure(new IOException("Connection closed before handshake completed"));
        connection.onInactive();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (!handshaker.isHandshakeComplete()) {
            try {
                handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                LOGGER.debug("{}: Handshake complete", connection.name());
                handshakeFuture.trySuccess();
            } catch (Exception e) {
                LOGGER.error("{}: Handshake failed", connection.name(), e);
                handshakeFuture.tryFailure(e);
                ctx.close();
            }
            return;
        }

        if (msg instanceof FullHttpResponse response) {
            throw new IllegalStateException(
                "Unexpected FullHttpResponse (status=" + response.status() + ")"
            );
        }

        WebSocketFrame frame = (WebSocketFrame) msg;

        if (frame instanceof TextWebSocketFrame textFrame) {
            connection.onFrame(InboundFrame.text(textFrame.text()));
            return;
        }

        if (frame instanceof BinaryWebSocketFrame binaryFrame) {
            connection.onFrame(InboundFrame.binary(ByteBufUtil.getBytes(binaryFrame.content())));
            return;
        }

        if (frame instanceof PingWebSocketFrame ping) {
            ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            return;
        }

        if (frame instanceof PongWebSocketFrame) {
            connection.onPong();
            return;
        }

        if (frame instanceof CloseWebSocketFrame closeFrame) {
            int code = closeFrame.statusCode() < 0 ? NO_STATUS_RECEIVED : closeFrame.statusCode();
            LOGGER.debug("{}: Received close frame (code={})", connection.name(), code);
            connection.onRemoteClose(code, closeFrame.reasonText());
            ctx.close();
            return;
        }

        LOGGER.warn("{}: Unsupported frame type: {}", connection.name(), frame.getClass().getName());
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("{}: WebSocket exception", connection.name(), cause);
        handshakeFuture.tryFailure(cause);
        connection.onError(cause);
        ctx.close();
    }
}
