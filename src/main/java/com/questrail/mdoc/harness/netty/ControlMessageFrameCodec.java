package com.questrail.mdoc.harness.netty;

import com.questrail.mdoc.harness.ControlMessage;
import com.questrail.mdoc.harness.ControlMessageCodec;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;

/**
 * Converts between length-delimited frames and {@link ControlMessage}s. Runs
 * after the length-field decoder, so each inbound buffer is one whole message.
 */
final class ControlMessageFrameCodec extends MessageToMessageCodec<ByteBuf, ControlMessage>
{
    @Override
    protected void encode(ChannelHandlerContext ctx, ControlMessage msg, List<Object> out)
    {
        out.add(Unpooled.wrappedBuffer(ControlMessageCodec.encode(msg)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf msg, List<Object> out)
    {
        out.add(ControlMessageCodec.decode(ByteBufUtil.getBytes(msg)));
    }
}
