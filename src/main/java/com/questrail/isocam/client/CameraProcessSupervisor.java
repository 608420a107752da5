package com.questrail.isocam.client;

import com.questrail.isocam.config.ClientConfig;
import com.questrail.isocam.observability.CameraObservabilitySink;
import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.YamlTextCodec;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.server.WorkerArguments;
import com.questrail.isocam.time.MonotonicClock;
import com.questrail.isocam.time.ScheduledExecutorScheduler;
import com.questrail.isocam.time.SystemMonotonicClock;
import com.questrail.isocam.transport.MessageEndpoint;
import com.questrail.isocam.transport.tcp.netty.NettyClientEndpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * CameraProcessSupervisor
 * =============================================================================
 * Runs one camera worker process and the connection to it.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   supervisor.start()               pick a port, launch the worker, connect
 *   supervisor.send(request)         enqueue a request for the worker
 *   supervisor.stop(join, killDelay) send eof; optionally wait, then kill
 * </pre>
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>{@code camera-client}: the client bridge and every listener
 *       callback.</li>
 *   <li>{@code camera-worker-watcher}: waits for the worker to exit. A
 *       non-zero exit is reported as an {@code exception} event carrying the
 *       worker's captured stderr as its trace.</li>
 * </ul>
 */
public final class CameraProcessSupervisor implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(CameraProcessSupervisor.class);

    private static final Duration DEFAULT_KILL_DELAY = Duration.ofSeconds(5);

    private final ClientConfig config;
    private final WorkerLauncher launcher;
    private final CameraEventListener listener;
    private final CameraObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final Function<InetSocketAddress, MessageEndpoint> endpointFactory;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile ScheduledThreadPoolExecutor clientThread;
    private volatile CameraClientBridge bridge;
    private volatile WorkerHandle worker;
    private volatile int port;

    public CameraProcessSupervisor(ClientConfig config, CameraEventListener listener) {
        this(config,
             new ProcessWorkerLauncher(config.javaExecutable(), config.classpath()),
             listener,
             CameraObservabilitySink.NONE);
    }

    public CameraProcessSupervisor(ClientConfig config,
                                   WorkerLauncher launcher,
                                   CameraEventListener listener,
                                   CameraObservabilitySink observabilitySink)
    {
        this(config, launcher, listener, observabilitySink, SystemMonotonicClock.INSTANCE, null);
    }

    /**
     * @param endpointFactory creates the worker connection; {@code null} for
     *                        a {@link NettyClientEndpoint}
     */
    public CameraProcessSupervisor(ClientConfig config,
                                   WorkerLauncher launcher,
                                   CameraEventListener listener,
                                   CameraObservabilitySink observabilitySink,
                                   MonotonicClock clock,
                                   Function<InetSocketAddress, MessageEndpoint> endpointFactory)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, CameraObservabilitySink.NONE);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.endpointFactory = endpointFactory != null
                ? endpointFactory
                : remote -> new NettyClientEndpoint(remote, config.maxFrameSize(),
                        config.connectDeadline(), config.connectRetryDelay(), clock);
    }

    /**
     * Launches the worker and starts connecting to it.
     *
     * @throws IOException if no port can be found or the worker cannot be launched
     */
    public void start() throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Supervisor already started");
        }

        port = config.port() != 0 ? config.port() : probeFreePort(config.host());
        WorkerArguments arguments = new WorkerArguments(
                config.logLevel(),
                config.driverBinPath(),
                config.host(),
                port,
                config.recvTimeout().toNanos() / 1_000_000_000.0,
                config.maxFrameSize());

        worker = launcher.launch(arguments.toArgumentList());

        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "camera-client");
            t.setDaemon(true);
            return t;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        clientThread = executor;

        bridge = new CameraClientBridge(
                endpointFactory.apply(new InetSocketAddress(config.host(), port)),
                new MessageCodec(new YamlTextCodec(config.maxFrameSize())),
                config.recvTimeout(),
                executor,
                new ScheduledExecutorScheduler(executor, clock),
                clock,
                listener,
                observabilitySink);
        bridge.start();

        Thread watcher = new Thread(this::watchWorker, "camera-worker-watcher");
        watcher.setDaemon(true);
        watcher.start();
    }

    /**
     * Enqueues a request for the worker.
     */
    public void send(CameraRequest request) {
        CameraClientBridge b = bridge;
        if (b == null) {
            throw new IllegalStateException("Supervisor not started");
        }
        b.send(request);
    }

    /**
     * Asks the worker to shut down by sending {@code eof}.
     *
     * @param join      wait for the connection and the worker to end
     * @param killDelay how long to wait before killing the worker; only used when joining
     * @return the worker's exit code if it is known
     */
    public OptionalInt stop(boolean join, Duration killDelay) throws InterruptedException {
        CameraClientBridge b = bridge;
        if (b == null || !stopped.compareAndSet(false, true)) {
            return OptionalInt.empty();
        }

        b.send(new CameraRequest.EndOfStream());
        if (!join) {
            return OptionalInt.empty();
        }

        long deadline = clock.nowNanos() + killDelay.toNanos();
        if (!b.awaitClosed(killDelay)) {
            log.warn("Connection to camera worker did not close within {}", killDelay);
            b.close();
        }

        Duration remaining = Duration.ofNanos(Math.max(0, deadline - clock.nowNanos()));
        OptionalInt exit = worker.waitFor(remaining);
        if (exit.isEmpty()) {
            worker.destroyForcibly();
            exit = worker.waitFor(killDelay);
        }
        clientThread.shutdown();
        return exit;
    }

    @Override
    public void close() throws InterruptedException {
        stop(true, DEFAULT_KILL_DELAY);
    }

    /**
     * Port the worker listens on; valid after {@link #start()}.
     */
    public int port() {
        return port;
    }

    public boolean isWorkerAlive() {
        WorkerHandle w = worker;
        return w != null && w.isAlive();
    }

    private void watchWorker() {
        int exitCode;
        try {
            exitCode = worker.waitFor();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while watching the camera worker");
            return;
        }

        final int code = exitCode;
        if (code != 0) {
            ProcessExitException exit = new ProcessExitException(code, worker.stderr());
            log.error("{}", exit.getMessage());
            deliver(() -> listener.onEvent(new CameraEvent.CameraFault(exit.getMessage(), exit.stderr())));
        }
        else {
            log.info("Camera worker exited");
        }
        deliver(() -> listener.onProcessExited(code));

        try {
            if (bridge.awaitClosed(config.connectDeadline())) {
                clientThread.shutdown();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for the worker connection to close");
        }
    }

    private void deliver(Runnable callback) {
        try {
            clientThread.execute(callback);
        }
        catch (RejectedExecutionException e) {
            log.debug("Client thread has shut down; delivering on the watcher thread");
            callback.run();
        }
    }

    static int probeFreePort(String host) throws IOException {
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getByName(host))) {
            return socket.getLocalPort();
        }
    }
}
