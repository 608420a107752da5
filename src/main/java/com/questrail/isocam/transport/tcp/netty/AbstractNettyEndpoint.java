package com.questrail.isocam.transport.tcp.netty;

import com.questrail.isocam.protocol.codec.WireFrame;
import com.questrail.isocam.transport.MessageEndpoint;
import com.questrail.isocam.transport.MessageEndpointListener;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AbstractNettyEndpoint
 * =============================================================================
 * Shared half of the Netty-backed {@link MessageEndpoint}s: the channel
 * pipeline, outbound writes, and the once-only lifecycle notifications.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Inbound frames are handed to the listener as
 * {@link WireFrame}s; reference-counted buffers are released by the decoder.
 */
abstract class AbstractNettyEndpoint implements MessageEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(AbstractNettyEndpoint.class);

    private final int maxFrameSize;
    private final AtomicBoolean connectedNotified = new AtomicBoolean(false);
    private final AtomicBoolean disconnectedNotified = new AtomicBoolean(false);

    private volatile MessageEndpointListener listener;
    private volatile Channel channel;

    AbstractNettyEndpoint(int maxFrameSize) {
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("maxFrameSize must be > 0");
        }
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public void setListener(MessageEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void send(WireFrame frame) {
        Objects.requireNonNull(frame, "frame");

        Channel ch = channel;
        if (ch == null || !ch.isActive()) {
            log.debug("Dropping outbound {}: not connected", frame);
            return;
        }
        ch.writeAndFlush(frame);
    }

    protected MessageEndpointListener requireListener() {
        MessageEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageEndpointListener must be set before start()");
        }
        return l;
    }

    protected Channel channel() {
        return channel;
    }

    protected void installPipeline(ChannelPipeline pipeline) {
        pipeline.addLast("frameDecoder", new WireFrameDecoder(maxFrameSize));
        pipeline.addLast("frameEncoder", new WireFrameEncoder());
        pipeline.addLast("endpoint", new InboundHandler());
    }

    protected void connectionActive(Channel ch) {
        channel = ch;
        MessageEndpointListener l = listener;
        if (l != null && connectedNotified.compareAndSet(false, true)) {
            l.onConnected();
        }
    }

    protected void connectionLost(Throwable cause) {
        MessageEndpointListener l = listener;
        if (l != null && disconnectedNotified.compareAndSet(false, true)) {
            l.onDisconnected(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Forwards decoded frames and channel lifecycle to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<WireFrame>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception
        {
            connectionActive(ctx.channel());
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WireFrame frame)
        {
            MessageEndpointListener l = listener;
            if (l != null) {
                l.onFrame(frame);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            connectionLost(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // surface the ProtocolException thrown by the frame decoder
            Throwable reported = cause instanceof DecoderException && cause.getCause() != null
                    ? cause.getCause()
                    : cause;
            connectionLost(reported);
            ctx.close();
        }
    }
}
