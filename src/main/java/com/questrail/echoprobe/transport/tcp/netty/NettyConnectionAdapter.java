package com.questrail.echoprobe.transport.tcp.netty;

import com.questrail.echoprobe.transport.ConnectionListener;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;

import java.util.Objects;

/**
 * NettyConnectionAdapter
 * -----------------------------------------------------------------------------
 * Translates Netty channel events for one accepted connection into
 * {@link ConnectionListener} callbacks and writes the listener's replies.
 *
 * <h2>Read/write sequencing</h2>
 * Auto-read is off. The adapter issues one read, hands the bytes to the
 * listener, writes the reply, and issues the next read only after that write
 * has completed. A failed write ends the connection; Netty never reports a
 * partial write as success.
 *
 * <h2>Terminal callbacks</h2>
 * Exactly one of peer-closed, idle-timeout, transport-shutdown or failure is
 * delivered, guarded by
 * {@link #terminated}. All state is confined to the channel's event loop.
 */
final class NettyConnectionAdapter extends ChannelInboundHandlerAdapter
{
    private final ConnectionListener listener;

    private boolean terminated;
    private ChannelFuture lastWrite;

    NettyConnectionAdapter(ConnectionListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx)
    {
        // A throwing listener surfaces through exceptionCaught as a failure.
        if (!listener.onOpen(ctx.channel().remoteAddress())) {
            terminated = true;
            ctx.close();
            return;
        }

        ctx.fireChannelActive();
        ctx.read();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg)
    {
        final byte[] payload;
        try {
            ByteBuf buf = (ByteBuf) msg;
            payload = new byte[buf.readableBytes()];
            buf.readBytes(payload);
        } finally {
            ReferenceCountUtil.release(msg);
        }

        if (terminated || payload.length == 0) {
            return;
        }

        final byte[] reply;
        try {
            reply = listener.onData(payload);
        } catch (Exception e) {
            fail(ctx, e);
            return;
        }

        ChannelFuture write = ctx.write(Unpooled.wrappedBuffer(reply));
        write.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                fail(ctx, future.cause());
            }
        });
        lastWrite = write;
    }

    @Override
    public void channelReadComplete(ChannelHandlerContext ctx)
    {
        ctx.flush();

        ChannelFuture pending = lastWrite;
        lastWrite = null;
        if (pending == null) {
            requestRead(ctx);
            return;
        }
        pending.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                requestRead(ctx);
            }
        });
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt)
    {
        if (evt instanceof IdleStateEvent && ((IdleStateEvent) evt).state() == IdleState.READER_IDLE) {
            if (!terminated) {
                terminated = true;
                try {
                    listener.onIdleTimeout();
                } finally {
                    ctx.close();
                }
            }
            return;
        }
        if (evt == TransportShutdownEvent.INSTANCE) {
            if (!terminated) {
                terminated = true;
                try {
                    listener.onTransportShutdown();
                } finally {
                    ctx.close();
                }
            }
            return;
        }
        ctx.fireUserEventTriggered(evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx)
    {
        if (!terminated) {
            terminated = true;
            listener.onPeerClosed();
        }
        ctx.fireChannelInactive();
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        fail(ctx, cause);
    }

    private void requestRead(ChannelHandlerContext ctx)
    {
        if (!terminated && ctx.channel().isActive()) {
            ctx.read();
        }
    }

    private void fail(ChannelHandlerContext ctx, Throwable cause)
    {
        if (terminated) {
            return;
        }
        terminated = true;
        try {
            listener.onFailure(cause);
        } finally {
            ctx.close();
        }
    }
}
