package com.questrail.echoprobe.transport.tcp.netty;

import com.questrail.echoprobe.transport.BoundListener;
import com.questrail.echoprobe.transport.ConnectionListener;
import com.questrail.echoprobe.transport.TcpListenerBinder;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.GlobalEventExecutor;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * NettyTcpListenerBinder
 * =============================================================================
 * Netty-backed implementation of the {@link TcpListenerBinder} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It binds server
 * sockets, applies the inactivity timeout, and drives one
 * {@link ConnectionListener} per accepted connection. It does not decide what
 * to log or whether to scan.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>One boss event loop accepts for every bound port.</li>
 *   <li>Accepted connections are spread over the worker group; each connection
 *       stays on one event loop, so its callbacks are serialized.</li>
 * </ul>
 *
 * <h2>Per-connection pipeline</h2>
 * <pre>
 *   IdleStateHandler(reader idle = connection timeout)
 *     → NettyConnectionAdapter(ConnectionListener)
 * </pre>
 * Auto-read is disabled and reads are capped at {@value #READ_BUFFER_SIZE}
 * bytes; the adapter requests each read explicitly.
 *
 * <h2>Lifecycle</h2>
 * - {@link #bind} binds synchronously and returns a handle per port.
 * - {@link #shutdown()} tells every connection that is still open that the
 *   transport is going away, closes it, then shuts down both event loop
 *   groups.
 */
public final class NettyTcpListenerBinder implements TcpListenerBinder
{
    /** Size of each read from a connection. */
    static final int READ_BUFFER_SIZE = 1024;

    private final Duration idleTimeout;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ChannelGroup connections = new DefaultChannelGroup("echoprobe-connections", GlobalEventExecutor.INSTANCE);

    public NettyTcpListenerBinder(Duration idleTimeout)
    {
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (idleTimeout.isZero() || idleTimeout.isNegative()) {
            throw new IllegalArgumentException("idleTimeout must be positive");
        }

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    @Override
    public BoundListener bind(int port, Supplier<ConnectionListener> listeners) throws IOException
    {
        Objects.requireNonNull(listeners, "listeners");

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(READ_BUFFER_SIZE))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        connections.add(ch);
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new IdleStateHandler(idleTimeout.toNanos(), 0, 0, TimeUnit.NANOSECONDS));
                        p.addLast(new NettyConnectionAdapter(listeners.get()));
                    }
                });

        ChannelFuture f = bootstrap.bind(new InetSocketAddress(port)).awaitUninterruptibly();
        if (!f.isSuccess()) {
            Throwable cause = f.cause();
            throw new IOException("Failed to bind port " + port + ": " + cause.getMessage(), cause);
        }
        return new NettyBoundListener(f.channel());
    }

    @Override
    public void shutdown()
    {
        // Both tasks queue on each channel's own event loop, so the notice
        // is handled before the close.
        for (Channel ch : connections) {
            ch.pipeline().fireUserEventTriggered(TransportShutdownEvent.INSTANCE);
        }
        connections.close().awaitUninterruptibly(2, TimeUnit.SECONDS);

        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    /**
     * BoundListener over a Netty server channel.
     */
    private static final class NettyBoundListener implements BoundListener
    {
        private final Channel channel;
        private final int localPort;

        private NettyBoundListener(Channel channel)
        {
            this.channel = channel;
            this.localPort = ((InetSocketAddress) channel.localAddress()).getPort();
        }

        @Override
        public int localPort()
        {
            return localPort;
        }

        @Override
        public boolean isOpen()
        {
            return channel.isOpen();
        }

        @Override
        public void close()
        {
            ChannelFuture f = channel.close();
            // Waiting on the channel's own event loop would deadlock.
            if (!channel.eventLoop().inEventLoop()) {
                f.awaitUninterruptibly();
            }
        }
    }
}
