package com.questrail.isocam.transport.tcp.netty;

import com.questrail.isocam.protocol.codec.ProtocolException;
import com.questrail.isocam.protocol.codec.WireFrame;
import com.questrail.isocam.protocol.codec.WireFraming;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Splits the inbound byte stream into {@link WireFrame}s using the
 * {@code (text_len, binary_len)} header.
 *
 * <p>An oversize header is a {@link ProtocolException}. So is a connection
 * that ends with a partial frame still buffered.</p>
 */
final class WireFrameDecoder extends ByteToMessageDecoder
{
    private static final Logger log = LoggerFactory.getLogger(WireFrameDecoder.class);

    private final int maxFrameSize;

    WireFrameDecoder(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (in.readableBytes() < WireFraming.HEADER_LENGTH) {
            return;
        }

        in.markReaderIndex();
        WireFraming.Header header = WireFraming.header(in.readUnsignedInt(), in.readUnsignedInt(), maxFrameSize);
        if (in.readableBytes() < header.bodyLength()) {
            in.resetReaderIndex();
            return;
        }

        byte[] text = new byte[header.textLength()];
        in.readBytes(text);
        byte[] binary = new byte[header.binaryLength()];
        in.readBytes(binary);
        out.add(new WireFrame(text, binary));
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable()) {
            log.warn("Peer closed the connection with {} bytes of a partial frame buffered", in.readableBytes());
            ctx.fireExceptionCaught(new ProtocolException(
                    "Peer closed mid-frame (" + in.readableBytes() + " bytes pending)"));
            in.skipBytes(in.readableBytes());
        }
    }
}
