package com.questrail.isocam.client;

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
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * CameraClientBridge
 * =============================================================================
 * Supervisor-side bridge between the application and the worker connection.
 *
 * <h2>Outbound</h2>
 * {@link #send(CameraRequest)} may be called from any thread and only
 * enqueues. Every {@code recvTimeout} the client thread drains the queue and
 * writes the requests in order, but only once the connection is up; requests
 * made earlier simply wait. After {@code eof} has been written the bridge
 * closes the connection.
 *
 * <h2>Inbound</h2>
 * Frames are decoded and handed to the {@link CameraEventListener} in arrival
 * order. An undecodable frame is a protocol error: it is reported as an
 * {@code exception} event and the connection is closed.
 *
 * <h2>Threading Model</h2>
 * All state is confined to the single client thread given as
 * {@code clientThread}; the scheduler must run its tasks on that thread too.
 */
public final class CameraClientBridge implements MessageEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(CameraClientBridge.class);

    private final MessageEndpoint endpoint;
    private final MessageCodec codec;
    private final Duration recvTimeout;
    private final Executor clientThread;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final CameraEventListener listener;
    private final CameraObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final CameraMessageEncoder encoder = new CameraMessageEncoder();
    private final CameraMessageDecoder decoder = new CameraMessageDecoder();
    private final BlockingQueue<CameraRequest> outbound = new LinkedBlockingQueue<>();
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    private volatile Cancellable tick;

    // client thread only
    private boolean connected;
    private boolean closed;

    public CameraClientBridge(MessageEndpoint endpoint,
                              MessageCodec codec,
                              Duration recvTimeout,
                              Executor clientThread,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              CameraEventListener listener,
                              CameraObservabilitySink observabilitySink)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.recvTimeout = Objects.requireNonNull(recvTimeout, "recvTimeout");
        this.clientThread = Objects.requireNonNull(clientThread, "clientThread");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, CameraObservabilitySink.NONE);
        this.wallClock = SystemWallClock.INSTANCE;
    }

    /**
     * Starts connecting and starts the request pump.
     */
    public void start() {
        endpoint.setListener(this);
        endpoint.start();
        scheduleTick();
    }

    /**
     * Enqueues a request; it is written on a later tick once connected.
     */
    public void send(CameraRequest request) {
        outbound.offer(Objects.requireNonNull(request, "request"));
    }

    /**
     * Closes the connection without sending {@code eof}.
     */
    public void close() {
        dispatch(() -> finish(null));
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closedLatch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public boolean isClosed() {
        return closedLatch.getCount() == 0;
    }

    // ---------------------------------------------------------------------
    // Transport callbacks (any thread)
    // ---------------------------------------------------------------------

    @Override
    public void onConnected() {
        dispatch(() -> {
            if (closed) {
                return;
            }
            connected = true;
            observabilitySink.onTransportEvent(new CameraTransportEvent(
                    wallClock.now(),
                    CameraTransportEvent.Side.SUPERVISOR,
                    CameraTransportEvent.Kind.CONNECTED,
                    "worker connected"));
            listener.onConnected();
        });
    }

    @Override
    public void onDisconnected(Throwable cause) {
        dispatch(() -> {
            if (closed) {
                return;
            }
            observabilitySink.onTransportEvent(new CameraTransportEvent(
                    wallClock.now(),
                    CameraTransportEvent.Side.SUPERVISOR,
                    CameraTransportEvent.Kind.DISCONNECTED,
                    cause == null ? "closed" : cause.toString()));
            if (cause != null) {
                listener.onEvent(CameraEvent.CameraFault.from(cause));
            }
            finish(cause);
        });
    }

    @Override
    public void onFrame(WireFrame frame) {
        dispatch(() -> handleFrame(frame));
    }

    // ---------------------------------------------------------------------
    // Client thread
    // ---------------------------------------------------------------------

    private void handleFrame(WireFrame frame) {
        if (closed) {
            return;
        }

        CameraEvent event;
        try {
            event = decoder.decodeEvent(codec.decode(frame));
        }
        catch (ProtocolException e) {
            observabilitySink.onTransportEvent(new CameraTransportEvent(
                    wallClock.now(),
                    CameraTransportEvent.Side.SUPERVISOR,
                    CameraTransportEvent.Kind.FRAME_REJECTED,
                    e.getMessage()));
            listener.onEvent(CameraEvent.CameraFault.from(e));
            finish(e);
            return;
        }

        listener.onEvent(event);
    }

    private void onTick() {
        if (closed) {
            return;
        }
        if (connected) {
            flushOutbound();
        }
        if (!closed) {
            scheduleTick();
        }
    }

    private void scheduleTick() {
        tick = scheduler.scheduleAfter(recvTimeout, clock, this::onTick);
    }

    private void flushOutbound() {
        CameraRequest request;
        while (!closed && (request = outbound.poll()) != null) {
            WireFrame frame;
            try {
                frame = codec.encode(encoder.encode(request));
            }
            catch (ProtocolException e) {
                observabilitySink.onError(new CameraErrorEvent(
                        wallClock.now(), "Cannot encode " + request.tag().wireName(), e));
                listener.onEvent(CameraEvent.CameraFault.from(e));
                continue;
            }

            endpoint.send(frame);
            if (request instanceof CameraRequest.EndOfStream) {
                log.debug("Sent eof; closing connection");
                finish(null);
            }
        }
    }

    private void finish(Throwable cause) {
        if (closed) {
            return;
        }
        closed = true;
        connected = false;

        Cancellable t = tick;
        if (t != null) {
            t.cancel();
        }
        if (cause != null) {
            observabilitySink.onError(new CameraErrorEvent(wallClock.now(), "Worker connection lost", cause));
        }
        if (!outbound.isEmpty()) {
            log.debug("Dropping {} unsent requests", outbound.size());
            outbound.clear();
        }

        endpoint.stop();
        listener.onConnectionClosed(cause);
        closedLatch.countDown();
    }

    private void dispatch(Runnable task) {
        try {
            clientThread.execute(task);
        }
        catch (RejectedExecutionException e) {
            log.debug("Client thread has shut down; dropping callback", e);
        }
    }
}
