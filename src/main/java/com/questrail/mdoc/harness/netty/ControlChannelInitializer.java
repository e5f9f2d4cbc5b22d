package com.questrail.mdoc.harness.netty;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.util.function.Consumer;

/**
 * Pipeline of a control connection: 4-byte big-endian length prefix, CBOR
 * message codec, then the handler feeding a {@link NettyControlConnection}.
 */
final class ControlChannelInitializer extends ChannelInitializer<SocketChannel>
{
    static final int MAX_FRAME_LENGTH = 1 << 20;

    private final Consumer<NettyControlConnection> onActive;
    private final Runnable onClosed;

    ControlChannelInitializer(Consumer<NettyControlConnection> onActive, Runnable onClosed)
    {
        this.onActive = onActive;
        this.onClosed = onClosed;
    }

    @Override
    protected void initChannel(SocketChannel ch)
    {
        NettyControlConnection connection = new NettyControlConnection(ch, onClosed);
        ChannelPipeline p = ch.pipeline();
        p.addLast(new LengthFieldBasedFrameDecoder(MAX_FRAME_LENGTH, 0, 4, 0, 4));
        p.addLast(new LengthFieldPrepender(4));
        p.addLast(new ControlMessageFrameCodec());
        p.addLast(connection.inboundHandler());
        onActive.accept(connection);
    }
}
