package com.questrail.simplerpc.transport.websocket.netty;

import com.questrail.simplerpc.transport.MessageEndpoint;
import com.questrail.simplerpc.transport.MessageEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.*;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketEndpoint
 * =============================================================================
 * Netty-backed WebSocket client implementation of the {@link MessageEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * envelopes, route, correlate replies, or reconnect.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound text frames are delivered as
 * {@code String}, binary frames are copied into {@code byte[]}, and all
 * reference-counted buffers are released internally.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects asynchronously; the listener sees
 *       {@code onTransportUp()} once the WebSocket handshake completes.</li>
 *   <li>{@link #stop()} sends a close frame, closes the channel and shuts down
 *       the event loop group. An endpoint is single-use.</li>
 * </ul>
 *
 * <p>All listener callbacks except the one issued by {@link #stop()} run on the
 * channel's event loop.</p>
 */
public final class NettyWebSocketEndpoint implements MessageEndpoint
{
    /** Largest accepted frame (after aggregation of continuation frames). */
    static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final URI uri;
    private final EventLoopGroup group;

    private final AtomicBoolean up = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile MessageEndpointListener listener;
    private volatile Channel channel;

    /**
     * @param uri {@code ws://} or {@code wss://} target, including any query
     */
    public NettyWebSocketEndpoint(URI uri)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Unsupported WebSocket scheme: " + scheme);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("WebSocket URI has no host: " + uri);
        }
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public void setListener(MessageEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        MessageEndpointListener l = requireListener();

        boolean secure = "wss".equalsIgnoreCase(uri.getScheme());
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);

        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            l.onTransportDown(e);
            return;
        }

        // A fresh handshaker per connection; it tracks handshake state internally.
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_BYTES);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), uri.getHost(), port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_FRAME_BYTES));
                        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_BYTES));
                        p.addLast(new InboundHandler(handshaker));
                    }
                });

        // Connect asynchronously; a connect failure is reported as transport down.
        ChannelFuture f = bootstrap.connect(uri.getHost(), port);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
            }
            else {
                notifyDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel;
        if (ch != null && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        }
        group.shutdownGracefully();

        notifyDown(null);
    }

    @Override
    public boolean isOpen()
    {
        Channel ch = channel;
        return up.get() && ch != null && ch.isActive();
    }

    @Override
    public void sendText(String frame)
    {
        Objects.requireNonNull(frame, "frame");
        Channel ch = channel;
        if (!isOpen()) {
            return;
        }
        ch.writeAndFlush(new TextWebSocketFrame(frame));
    }

    @Override
    public void sendBinary(byte[] frame)
    {
        Objects.requireNonNull(frame, "frame");
        Channel ch = channel;
        if (!isOpen()) {
            return;
        }
        ch.writeAndFlush(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(frame)));
    }

    private MessageEndpointListener requireListener()
    {
        MessageEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before start()");
        }
        return l;
    }

    private void notifyUp()
    {
        MessageEndpointListener l = listener;
        if (up.compareAndSet(false, true) && l != null) {
            l.onTransportUp();
        }
    }

    // At most once per up transition; a failure before "up" is always reported.
    private void notifyDown(Throwable cause)
    {
        MessageEndpointListener l = listener;
        boolean wasUp = up.getAndSet(false);
        if (l != null && (wasUp || cause != null)) {
            l.onTransportDown(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Completes the client handshake, then forwards complete text and binary
     * frames to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;

        private InboundHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            channel = ctx.channel();
            handshaker.handshake(ctx.channel());
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse) {
                    handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                    notifyUp();
                }
                return;
            }

            MessageEndpointListener l = listener;
            if (l == null) {
                return;
            }

            if (msg instanceof TextWebSocketFrame) {
                l.onTextFrame(((TextWebSocketFrame) msg).text());
            }
            else if (msg instanceof BinaryWebSocketFrame) {
                // Copy the payload into a plain byte[] (Netty containment rule).
                ByteBuf content = ((BinaryWebSocketFrame) msg).content();
                byte[] bytes = new byte[content.readableBytes()];
                content.getBytes(content.readerIndex(), bytes);
                l.onBinaryFrame(bytes);
            }
            else if (msg instanceof PingWebSocketFrame) {
                ctx.writeAndFlush(new PongWebSocketFrame(((PingWebSocketFrame) msg).content().retain()));
            }
            else if (msg instanceof CloseWebSocketFrame) {
                ctx.close();
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            notifyDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            notifyDown(cause);
            ctx.close();
        }
    }

    @Override
    public String toString()
    {
        return "NettyWebSocketEndpoint[" + uri.getScheme() + "://" + uri.getHost() +
                (uri.getPort() != -1 ? ":" + uri.getPort() : "") +
                uri.getRawPath() + "]";
    }
}
