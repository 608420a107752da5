package com.questrail.isocam.server;

import com.questrail.isocam.api.CameraDriverProvider;
import com.questrail.isocam.config.WorkerConfig;
import com.questrail.isocam.observability.CameraObservabilitySink;
import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.YamlTextCodec;
import com.questrail.isocam.time.MonotonicClock;
import com.questrail.isocam.time.ScheduledExecutorScheduler;
import com.questrail.isocam.time.SystemMonotonicClock;
import com.questrail.isocam.transport.tcp.netty.NettyServerEndpoint;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * CameraWorker
 * =============================================================================
 * Composition root of the worker process.
 *
 * <h2>Architectural Role</h2>
 * Wires a {@link NettyServerEndpoint}, the YAML message codec and a
 * {@link CameraServerBridge} onto one single-threaded "server thread". No
 * protocol semantics live here.
 *
 * <pre>
 *   NettyServerEndpoint
 *        → CameraServerBridge   (server thread)
 *            → CameraController (control thread, per open camera)
 * </pre>
 *
 * <p>{@link #start()} binds synchronously; once it returns,
 * {@link #boundPort()} is valid and the supervisor may connect.</p>
 */
public final class CameraWorker implements AutoCloseable
{
    private final ScheduledExecutorService serverThread;
    private final NettyServerEndpoint endpoint;
    private final CameraServerBridge bridge;

    public CameraWorker(WorkerConfig config,
                        CameraDriverProvider provider,
                        CameraObservabilitySink observabilitySink)
    {
        this(config, provider, observabilitySink, SystemMonotonicClock.INSTANCE);
    }

    public CameraWorker(WorkerConfig config,
                        CameraDriverProvider provider,
                        CameraObservabilitySink observabilitySink,
                        MonotonicClock clock)
    {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(clock, "clock");

        this.serverThread = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "camera-server");
            t.setDaemon(true);
            return t;
        });
        this.endpoint = new NettyServerEndpoint(
                new InetSocketAddress(config.host(), config.port()),
                config.maxFrameSize());
        this.bridge = new CameraServerBridge(
                endpoint,
                provider,
                config,
                new MessageCodec(new YamlTextCodec(config.maxFrameSize())),
                serverThread,
                new ScheduledExecutorScheduler(serverThread, clock),
                clock,
                observabilitySink);
    }

    /**
     * Binds the listening socket and starts serving.
     *
     * @throws IllegalStateException if the address cannot be bound
     */
    public void start() {
        try {
            bridge.start();
        }
        catch (RuntimeException e) {
            serverThread.shutdownNow();
            throw e;
        }
    }

    public int boundPort() {
        return endpoint.boundPort();
    }

    /**
     * Blocks until the connection has ended and the camera session is closed.
     */
    public void awaitTermination() throws InterruptedException {
        bridge.awaitTermination();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return bridge.awaitTermination(timeout);
    }

    /**
     * Shuts the worker down as if {@code eof} had been received, then
     * releases the server thread.
     */
    @Override
    public void close() throws InterruptedException {
        if (!bridge.isTerminated()) {
            bridge.stop();
            bridge.awaitTermination(Duration.ofSeconds(10));
        }
        serverThread.shutdown();
    }
}
