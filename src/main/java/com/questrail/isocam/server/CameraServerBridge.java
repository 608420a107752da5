package com.questrail.isocam.server;

import com.questrail.isocam.api.CameraDriverProvider;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.config.WorkerConfig;
import com.questrail.isocam.controller.CameraController;
import com.questrail.isocam.controller.CameraStateReducer;
import com.questrail.isocam.observability.CameraErrorEvent;
import com.questrail.isocam.observability.CameraObservabilitySink;
import com.questrail.isocam.observability.CameraTransportEvent;
import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.ProtocolException;
import com.questrail.isocam.protocol.codec.WireFrame;
import com.questrail.isocam.protocol.internal.decode.CameraMessageDecoder;
import com.questrail.isocam.protocol.internal.encode.CameraMessageEncoder;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.time.Cancellable;
import com.questrail.isocam.time.MonotonicClock;
import com.questrail.isocam.time.MonotonicScheduler;
import com.questrail.isocam.time.SystemWallClock;
import com.questrail.isocam.time.WallClock;
import com.questrail.isocam.transport.MessageEndpoint;
import com.questrail.isocam.transport.MessageEndpointListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * CameraServerBridge
 * =============================================================================
 * Worker-side bridge between the socket and the camera controller.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Decode inbound frames into {@link CameraRequest}s.</li>
 *   <li>Answer {@code serials} directly from the driver provider.</li>
 *   <li>Own the (at most one) {@link CameraController} session: create it on
 *       {@code open_cam}, forward session requests to it, and drop it once it
 *       reports {@code cam_closed}.</li>
 *   <li>Every {@code recv_timeout}, drain the controller's event queue and
 *       send the events in order.</li>
 *   <li>On {@code eof}, peer close, socket error or protocol error: close the
 *       session, close the connection and signal termination.</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * All work runs on the single "server thread" given as {@code serverThread};
 * transport callbacks only hand work over to it. The scheduler must run its
 * tasks on that same thread.
 */
public final class CameraServerBridge implements MessageEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(CameraServerBridge.class);

    private final MessageEndpoint endpoint;
    private final CameraDriverProvider provider;
    private final WorkerConfig config;
    private final MessageCodec codec;
    private final Executor serverThread;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final CameraObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final CameraMessageEncoder encoder = new CameraMessageEncoder();
    private final CameraMessageDecoder decoder = new CameraMessageDecoder();
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile Cancellable tick;

    // server thread only
    private CameraController session;
    private boolean stopped;

    public CameraServerBridge(MessageEndpoint endpoint,
                              CameraDriverProvider provider,
                              WorkerConfig config,
                              MessageCodec codec,
                              Executor serverThread,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              CameraObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.serverThread = Objects.requireNonNull(serverThread, "serverThread");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, CameraObservabilitySink.NONE);
        this.wallClock = SystemWallClock.INSTANCE;
    }

    /**
     * Installs this bridge as the endpoint listener, starts the endpoint and
     * the event pump.
     */
    public void start() {
        endpoint.setListener(this);
        endpoint.start();
        scheduleTick();
    }

    /**
     * Requests an orderly shutdown, as if {@code eof} had been received.
     */
    public void stop() {
        dispatch(() -> shutdown(null));
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isTerminated() {
        return terminated.getCount() == 0;
    }

    // ---------------------------------------------------------------------
    // Transport callbacks (any thread)
    // ---------------------------------------------------------------------

    @Override
    public void onConnected() {
        dispatch(() -> observabilitySink.onTransportEvent(new CameraTransportEvent(
                wallClock.now(),
                CameraTransportEvent.Side.WORKER,
                CameraTransportEvent.Kind.CONNECTED,
                "supervisor connected")));
    }

    @Override
    public void onDisconnected(Throwable cause) {
        dispatch(() -> {
            observabilitySink.onTransportEvent(new CameraTransportEvent(
                    wallClock.now(),
                    CameraTransportEvent.Side.WORKER,
                    CameraTransportEvent.Kind.DISCONNECTED,
                    cause == null ? "closed" : cause.toString()));
            shutdown(cause);
        });
    }

    @Override
    public void onFrame(WireFrame frame) {
        dispatch(() -> handleFrame(frame));
    }

    // ---------------------------------------------------------------------
    // Server thread
    // ---------------------------------------------------------------------

    private void handleFrame(WireFrame frame) {
        if (stopped) {
            return;
        }

        CameraRequest request;
        try {
            request = decoder.decodeRequest(codec.decode(frame));
        }
        catch (ProtocolException e) {
            observabilitySink.onTransportEvent(new CameraTransportEvent(
                    wallClock.now(),
                    CameraTransportEvent.Side.WORKER,
                    CameraTransportEvent.Kind.FRAME_REJECTED,
                    e.getMessage()));
            shutdown(e);
            return;
        }

        log.debug("Received {}", request);
        handleRequest(request);
    }

    private void handleRequest(CameraRequest request) {
        if (request instanceof CameraRequest.EndOfStream) {
            log.info("Supervisor sent eof; shutting down");
            shutdown(null);
            return;
        }
        if (request instanceof CameraRequest.ListSerials) {
            send(listSerials());
            return;
        }
        if (request instanceof CameraRequest.OpenCamera r) {
            if (session != null) {
                send(CameraEvent.CameraFault.rejected(CameraStateReducer.ALREADY_OPEN));
                return;
            }
            log.info("Opening camera {}", r.serial());
            session = new CameraController(r.serial(), provider, config.pollInterval(), observabilitySink);
            session.start();
            return;
        }

        if (session == null) {
            send(CameraEvent.CameraFault.rejected(CameraStateReducer.NO_CAMERA));
            return;
        }
        session.submit(request);
    }

    private CameraEvent listSerials() {
        try {
            List<String> serials = new ArrayList<>(provider.discoverSerials());
            Collections.sort(serials);
            return new CameraEvent.SerialsListed(serials);
        }
        catch (DriverException | RuntimeException e) {
            observabilitySink.onError(new CameraErrorEvent(wallClock.now(), "Camera discovery failed", e));
            return CameraEvent.CameraFault.from(e);
        }
    }

    private void onTick() {
        if (stopped) {
            return;
        }
        pumpEvents();
        if (!stopped) {
            scheduleTick();
        }
    }

    private void scheduleTick() {
        tick = scheduler.scheduleAfter(config.recvTimeout(), clock, this::onTick);
    }

    private void pumpEvents() {
        CameraController current = session;
        if (current == null) {
            return;
        }

        List<CameraEvent> batch = new ArrayList<>();
        current.drainEvents(batch);
        for (CameraEvent event : batch) {
            send(event);
            if (event instanceof CameraEvent.CameraClosed) {
                endSession(current);
            }
        }
    }

    /**
     * Joins a controller that has reported {@code cam_closed} and drops it.
     * Requests it never got to are answered as if no camera were open.
     */
    private void endSession(CameraController controller) {
        joinController(controller);

        List<CameraRequest> abandoned = new ArrayList<>();
        controller.drainPendingRequests(abandoned);
        for (CameraRequest request : abandoned) {
            if (request.sessionScoped()) {
                send(CameraEvent.CameraFault.rejected(CameraStateReducer.NO_CAMERA));
            }
        }
        session = null;
    }

    private void joinController(CameraController controller) {
        try {
            if (!controller.join(config.sessionCloseTimeout())) {
                log.warn("Control thread for camera {} did not finish within {}",
                        controller.serial(), config.sessionCloseTimeout());
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while joining control thread for camera {}", controller.serial());
        }
    }

    private void shutdown(Throwable cause) {
        if (stopped) {
            return;
        }
        stopped = true;

        Cancellable t = tick;
        if (t != null) {
            t.cancel();
        }

        if (cause != null) {
            observabilitySink.onError(new CameraErrorEvent(wallClock.now(), "Connection lost", cause));
        }

        CameraController current = session;
        session = null;
        if (current != null) {
            current.requestClose();
            joinController(current);
        }

        endpoint.stop();
        log.info("Camera server stopped");
        terminated.countDown();
    }

    private void send(CameraEvent event) {
        WireFrame frame;
        try {
            frame = codec.encode(encoder.encode(event));
        }
        catch (ProtocolException e) {
            observabilitySink.onError(new CameraErrorEvent(wallClock.now(), "Cannot encode " + event.tag().wireName(), e));
            frame = codec.encode(encoder.encode(CameraEvent.CameraFault.from(e)));
        }
        endpoint.send(frame);
    }

    private void dispatch(Runnable task) {
        try {
            serverThread.execute(task);
        }
        catch (RejectedExecutionException e) {
            log.debug("Server thread has shut down; dropping callback", e);
        }
    }
}
