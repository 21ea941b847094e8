package com.questrail.tracker.protocol.suntech.transport.tcp.netty;

import com.questrail.tracker.protocol.suntech.transport.StreamEndpoint;
import com.questrail.tracker.protocol.suntech.transport.StreamEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It does not decode
 * Suntech frames and does not touch session state.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound bytes are copied into {@code byte[]}
 * and all reference-counted buffers are released internally.
 *
 * <h2>Framing</h2>
 * Each accepted channel uses a {@link FixedRecvByteBufAllocator} of the
 * configured read size, so one socket read produces one buffer and that buffer
 * is delivered as one frame. Bytes are never reassembled across reads.
 *
 * <h2>Connections</h2>
 * <ul>
 *   <li>Every frame is echoed back verbatim after the listener returns.</li>
 *   <li>A connection with no traffic in either direction for the idle timeout
 *       is closed.</li>
 *   <li>An I/O failure closes only the affected connection.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds synchronously so the bound port is known on return.
 * - {@link #stop()} closes the server channel and shuts the event loop groups
 *   down gracefully.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpStreamEndpoint.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final InetSocketAddress bindAddress;
    private final Duration idleTimeout;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile StreamEndpointListener listener;
    private volatile Channel serverChannel;

    public NettyTcpStreamEndpoint(InetSocketAddress bindAddress, Duration idleTimeout, int readBufferSize)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (readBufferSize <= 0) {
            throw new IllegalArgumentException("readBufferSize must be > 0");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(readBufferSize))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new IdleStateHandler(0, 0,
                                NettyTcpStreamEndpoint.this.idleTimeout.toMillis(), TimeUnit.MILLISECONDS));
                        p.addLast(new ConnectionHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            l.onTransportDown(f.cause());
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new IllegalStateException("Cannot bind " + bindAddress, f.cause());
        }

        Channel ch = f.channel();
        serverChannel = ch;
        l.onTransportUp(ch.localAddress());
    }

    @Override
    public void stop()
    {
        StreamEndpointListener l = listener;

        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }

        // Graceful shutdown lets in-flight frames finish before the loops exit.
        bossGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).awaitUninterruptibly();
        workerGroup.shutdownGracefully(0, SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).awaitUninterruptibly();

        if (l != null) {
            l.onTransportDown(null);
        }
    }

    @Override
    public Optional<SocketAddress> localAddress()
    {
        Channel ch = serverChannel;
        return (ch == null) ? Optional.empty() : Optional.ofNullable(ch.localAddress());
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    /**
     * ConnectionHandler
     * -------------------------------------------------------------------------
     * One instance per accepted connection. Forwards each read to the port
     * listener and echoes it back.
     */
    private final class ConnectionHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        private Throwable failure;

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onConnectionOpened(ctx.channel().remoteAddress());
            }
            ctx.fireChannelActive();
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            if (!content.isReadable()) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            SocketAddress remote = ctx.channel().remoteAddress();
            StreamEndpointListener l = listener;
            try {
                if (l != null) {
                    l.onFrame(remote, bytes.clone());
                }
            }
            catch (RuntimeException e) {
                log.error("Listener failed for frame from {} ({} bytes)", remote, bytes.length, e);
            }
            finally {
                ctx.writeAndFlush(Unpooled.wrappedBuffer(bytes));
            }
        }

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof IdleStateEvent event && event.state() == IdleState.ALL_IDLE) {
                StreamEndpointListener l = listener;
                if (l != null) {
                    l.onConnectionIdle(ctx.channel().remoteAddress());
                }
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            StreamEndpointListener l = listener;
            if (l != null) {
                l.onConnectionClosed(ctx.channel().remoteAddress(), failure);
            }
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            failure = cause;
            ctx.close();
        }
    }
}
