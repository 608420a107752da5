package com.questrail.isocam.transport.tcp.netty;

import com.questrail.isocam.transport.MessageEndpoint;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyServerEndpoint
 * =============================================================================
 * Worker-side {@link MessageEndpoint}: listens on a TCP address and serves
 * exactly one connection.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} binds synchronously, so a bind failure is thrown to
 *       the caller and {@link #boundPort()} is valid afterwards.</li>
 *   <li>The first accepted connection is served; the listening socket is
 *       closed as soon as it is accepted. Any connection racing in before
 *       that is closed immediately.</li>
 *   <li>{@link #stop()} closes everything and shuts down the event loops.</li>
 * </ul>
 */
public final class NettyServerEndpoint extends AbstractNettyEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyServerEndpoint.class);

    private final InetSocketAddress bindAddress;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;
    private final AtomicBoolean accepted = new AtomicBoolean(false);

    private volatile Channel serverChannel;

    public NettyServerEndpoint(InetSocketAddress bindAddress, int maxFrameSize)
    {
        super(maxFrameSize);
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 1)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        if (!accepted.compareAndSet(false, true)) {
                            log.warn("Rejecting additional connection from {}", ch.remoteAddress());
                            ch.close();
                            return;
                        }
                        installPipeline(ch.pipeline());
                        stopListening();
                    }
                });
    }

    @Override
    public void start()
    {
        requireListener();

        ChannelFuture f = bootstrap.bind(bindAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new IllegalStateException("Cannot listen on " + bindAddress, f.cause());
        }

        serverChannel = f.channel();
        log.info("Listening on {}", serverChannel.localAddress());
        if (accepted.get()) {
            stopListening();
        }
    }

    /**
     * Port actually bound; differs from the requested one when binding port 0.
     */
    public int boundPort()
    {
        Channel server = serverChannel;
        if (server == null) {
            throw new IllegalStateException("Endpoint has not been started");
        }
        return ((InetSocketAddress) server.localAddress()).getPort();
    }

    @Override
    public void stop()
    {
        Channel ch = channel();
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        stopListening();

        bossGroup.shutdownGracefully();
        workerGroup.shutdownGracefully();

        connectionLost(null);
    }

    private void stopListening()
    {
        Channel server = serverChannel;
        if (server != null && server.isOpen()) {
            server.close();
        }
    }
}
