package com.questrail.echoprobe.transport.tcp.netty;

import com.questrail.echoprobe.scan.PortProber;
import com.questrail.echoprobe.scan.ProbeResult;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.netty.util.concurrent.Promise;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyPortProber
 * =============================================================================
 * Netty-backed implementation of the {@link PortProber} port.
 *
 * <h2>Probe sequence</h2>
 * <ol>
 *   <li>Connect with {@code CONNECT_TIMEOUT_MILLIS} set to the connect bound.</li>
 *   <li>On success, wait up to the read bound for the first inbound chunk
 *       (at most {@value #BANNER_LIMIT} bytes). Nothing is sent.</li>
 *   <li>Close the channel.</li>
 * </ol>
 *
 * <p>{@link #probe} blocks the calling thread; it must not be called from one
 * of this prober's event loops.</p>
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package; callers see only
 * {@link ProbeResult}.
 */
public final class NettyPortProber implements PortProber, AutoCloseable
{
    /** Largest banner captured from an open port. */
    static final int BANNER_LIMIT = 1024;

    private static final byte[] NO_DATA = new byte[0];

    private final EventLoopGroup group;

    public NettyPortProber()
    {
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public ProbeResult probe(String host, int port, Duration connectTimeout, Duration readTimeout)
    {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");

        Promise<byte[]> firstChunk = GlobalEventExecutor.INSTANCE.newPromise();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .option(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(BANNER_LIMIT))
                .handler(new BannerCapture(firstChunk));

        final ChannelFuture connect;
        try {
            connect = bootstrap.connect(host, port).awaitUninterruptibly();
        } catch (RuntimeException e) {
            return new ProbeResult.ConnectFailed(describe(e));
        }

        if (!connect.isSuccess()) {
            return new ProbeResult.ConnectFailed(describe(connect.cause()));
        }

        try {
            byte[] banner = NO_DATA;
            if (firstChunk.awaitUninterruptibly(readTimeout.toNanos(), TimeUnit.NANOSECONDS) && firstChunk.isSuccess()) {
                banner = firstChunk.getNow();
            }
            return new ProbeResult.Open(banner);
        } finally {
            connect.channel().close();
        }
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private static String describe(Throwable cause)
    {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Completes the promise with the first chunk read, or with no data if the
     * peer closes first.
     */
    private static final class BannerCapture extends ChannelInboundHandlerAdapter
    {
        private final Promise<byte[]> firstChunk;

        private BannerCapture(Promise<byte[]> firstChunk)
        {
            this.firstChunk = firstChunk;
        }

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg)
        {
            try {
                ByteBuf buf = (ByteBuf) msg;
                byte[] bytes = new byte[Math.min(buf.readableBytes(), BANNER_LIMIT)];
                buf.readBytes(bytes);
                firstChunk.trySuccess(bytes);
            } finally {
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            firstChunk.trySuccess(NO_DATA);
            ctx.fireChannelInactive();
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            firstChunk.tryFailure(cause);
            ctx.close();
        }
    }
}
