package com.questrail.isocam.transport.tcp.netty;

import com.questrail.isocam.protocol.codec.WireFrame;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Writes a {@link WireFrame} as header, text, binary.
 */
final class WireFrameEncoder extends MessageToByteEncoder<WireFrame>
{
    @Override
    protected void encode(ChannelHandlerContext ctx, WireFrame frame, ByteBuf out) {
        out.writeInt(frame.textLength());
        out.writeInt(frame.binaryLength());
        out.writeBytes(frame.text());
        out.writeBytes(frame.binary());
    }
}
