package com.questrail.mdoc.harness.netty;

import com.questrail.mdoc.harness.ControlConnection;
import com.questrail.mdoc.harness.ControlMessage;
import com.questrail.mdoc.harness.HarnessException;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyControlConnection
 * =============================================================================
 * {@link ControlConnection} over one Netty socket channel.
 *
 * <p>Inbound messages are queued by the event loop and taken by the blocking
 * harness thread. Netty types do not leave this package.</p>
 */
final class NettyControlConnection implements ControlConnection
{
    private static final Logger log = LoggerFactory.getLogger(NettyControlConnection.class);

    private static final Object CLOSED = new Object();

    private final Channel channel;
    private final Runnable onClosed;
    private final LinkedBlockingQueue<Object> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Throwable failure;

    NettyControlConnection(Channel channel, Runnable onClosed)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.onClosed = onClosed;
    }

    SimpleChannelInboundHandler<ControlMessage> inboundHandler()
    {
        return new InboundHandler();
    }

    @Override
    public void send(ControlMessage message)
    {
        Objects.requireNonNull(message, "message");
        ChannelFuture f = channel.writeAndFlush(message).awaitUninterruptibly();
        if (!f.isSuccess()) {
            throw new HarnessException("Failed to send " + message.getClass().getSimpleName(), f.cause());
        }
    }

    @Override
    public ControlMessage receive(Duration timeout)
    {
        Object item;
        try {
            item = inbox.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HarnessException("Interrupted while waiting for a control message", e);
        }
        if (item == null) {
            throw new HarnessException("No control message within " + timeout);
        }
        if (item == CLOSED) {
            inbox.offer(CLOSED);
            throw new HarnessException("Control connection closed", failure);
        }
        return (ControlMessage) item;
    }

    @Override
    public void close()
    {
        if (closed.compareAndSet(false, true)) {
            channel.close();
            inbox.offer(CLOSED);
            if (onClosed != null) {
                onClosed.run();
            }
        }
    }

    private final class InboundHandler extends SimpleChannelInboundHandler<ControlMessage>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ControlMessage msg)
        {
            inbox.offer(msg);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbox.offer(CLOSED);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            log.warn("Control connection error", cause);
            failure = cause;
            ctx.close();
        }
    }
}
