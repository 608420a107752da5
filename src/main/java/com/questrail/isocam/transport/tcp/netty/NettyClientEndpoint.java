package com.questrail.isocam.transport.tcp.netty;

import com.questrail.isocam.time.MonotonicClock;
import com.questrail.isocam.transport.MessageEndpoint;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyClientEndpoint
 * =============================================================================
 * Supervisor-side {@link MessageEndpoint}: connects to the worker.
 *
 * <h2>Connect retry</h2>
 * The worker process needs some time to start listening, so a refused
 * connect is retried every {@code retryDelay} until {@code connectDeadline}
 * has elapsed since {@link #start()}. Any other connect failure, or a refusal
 * past the deadline, is reported through
 * {@link com.questrail.isocam.transport.MessageEndpointListener#onDisconnected(Throwable)}.
 */
public final class NettyClientEndpoint extends AbstractNettyEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyClientEndpoint.class);

    private final InetSocketAddress remote;
    private final Duration connectDeadline;
    private final Duration retryDelay;
    private final MonotonicClock clock;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile long deadlineNanos;

    public NettyClientEndpoint(InetSocketAddress remote,
                               int maxFrameSize,
                               Duration connectDeadline,
                               Duration retryDelay,
                               MonotonicClock clock)
    {
        super(maxFrameSize);
        this.remote = Objects.requireNonNull(remote, "remote");
        this.connectDeadline = Objects.requireNonNull(connectDeadline, "connectDeadline");
        this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        installPipeline(ch.pipeline());
                    }
                });
    }

    @Override
    public void start()
    {
        requireListener();
        deadlineNanos = clock.nowNanos() + connectDeadline.toNanos();
        attemptConnect();
    }

    @Override
    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        Channel ch = channel();
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        group.shutdownGracefully();

        connectionLost(null);
    }

    private void attemptConnect()
    {
        if (stopped.get()) {
            return;
        }
        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                return;
            }

            Throwable cause = future.cause();
            if (!stopped.get() && cause instanceof ConnectException && clock.nowNanos() < deadlineNanos) {
                log.debug("Connection to {} refused; retrying in {}", remote, retryDelay);
                scheduleRetry();
                return;
            }

            log.warn("Giving up connecting to {}", remote, cause);
            connectionLost(cause);
            group.shutdownGracefully();
        });
    }

    private void scheduleRetry()
    {
        try {
            group.schedule(this::attemptConnect, retryDelay.toNanos(), TimeUnit.NANOSECONDS);
        }
        catch (RejectedExecutionException e) {
            connectionLost(e);
        }
    }
}
