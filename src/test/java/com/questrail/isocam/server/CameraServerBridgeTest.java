package com.questrail.isocam.server;

import com.questrail.isocam.config.WorkerConfig;
import com.questrail.isocam.controller.CameraStateReducer;
import com.questrail.isocam.observability.CameraTransportEvent;
import com.questrail.isocam.observability.RecordingObservabilitySink;
import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.WireFrame;
import com.questrail.isocam.protocol.codec.YamlTextCodec;
import com.questrail.isocam.protocol.internal.decode.CameraMessageDecoder;
import com.questrail.isocam.protocol.internal.encode.CameraMessageEncoder;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider.Operation;
import com.questrail.isocam.time.DeterministicScheduler;
import com.questrail.isocam.time.ManualMonotonicClock;
import com.questrail.isocam.transport.FakeMessageEndpoint;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CameraServerBridgeTest
 * -----------------------------------------------------------------------------
 * Drives the worker-side bridge through a fake endpoint. Transport callbacks
 * and scheduled pump ticks run on the test thread; only the camera control
 * loop runs on its own thread.
 */
class CameraServerBridgeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FakeMessageEndpoint endpoint = new FakeMessageEndpoint();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final MessageCodec codec = new MessageCodec(new YamlTextCodec());
    private final CameraMessageEncoder encoder = new CameraMessageEncoder();
    private final CameraMessageDecoder decoder = new CameraMessageDecoder();

    private final WorkerConfig config = WorkerConfig.builder()
            .withRecvTimeout(Duration.ofMillis(10))
            .withPollInterval(Duration.ofMillis(1))
            .withSessionCloseTimeout(Duration.ofSeconds(2))
            .build();

    private SimulatedCameraDriverProvider provider = new SimulatedCameraDriverProvider();
    private CameraServerBridge bridge;

    private void startBridge() {
        bridge = new CameraServerBridge(endpoint, provider, config, codec, Runnable::run, scheduler, clock, sink);
        bridge.start();
        endpoint.connect();
    }

    @AfterEach
    void tearDown() {
        if (bridge != null && !bridge.isTerminated()) {
            bridge.stop();
        }
    }

    private void request(CameraRequest request) {
        endpoint.inject(codec.encode(encoder.encode(request)));
    }

    private List<CameraEvent> sentEvents() {
        List<CameraEvent> events = new ArrayList<>();
        for (WireFrame frame : endpoint.sent()) {
            events.add(decoder.decodeEvent(codec.decode(frame)));
        }
        return events;
    }

    /**
     * Runs pump ticks until an event matching {@code condition} has been sent.
     */
    private List<CameraEvent> pumpUntil(Predicate<CameraEvent> condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            clock.advance(config.recvTimeout());
            scheduler.runDueTasks();
            List<CameraEvent> events = sentEvents();
            if (events.stream().anyMatch(condition)) {
                return events;
            }
            Thread.sleep(2);
        }
        fail("Timed out; sent so far: " + sentEvents());
        return List.of();
    }

    private void openCamera() throws InterruptedException {
        request(new CameraRequest.OpenCamera("SIM00001"));
        pumpUntil(e -> e instanceof CameraEvent.CameraOpened);
        endpoint.clear();
    }

    // ---------------------------------------------------------------------
    // Connection-level requests
    // ---------------------------------------------------------------------

    @Test
    void serialsAreAnsweredSortedWithoutASession() {
        startBridge();

        request(new CameraRequest.ListSerials());

        assertEquals(List.of(new CameraEvent.SerialsListed(List.of("SIM00001", "SIM00002"))), sentEvents());
    }

    @Test
    void discoveryFailureIsReportedWithTrace() {
        provider = SimulatedCameraDriverProvider.builder().failOn(Operation.DISCOVER, 0).build();
        startBridge();

        request(new CameraRequest.ListSerials());

        CameraEvent.CameraFault fault = (CameraEvent.CameraFault) sentEvents().get(0);
        assertEquals("Simulated discover failure", fault.message());
        assertFalse(fault.trace().isEmpty());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void sessionRequestWithoutCameraIsRejected() {
        startBridge();

        request(new CameraRequest.Play());
        request(new CameraRequest.WriteSetting("gain", 3));

        assertEquals(List.of(
                CameraEvent.CameraFault.rejected(CameraStateReducer.NO_CAMERA),
                CameraEvent.CameraFault.rejected(CameraStateReducer.NO_CAMERA)), sentEvents());
    }

    // ---------------------------------------------------------------------
    // Session
    // ---------------------------------------------------------------------

    @Test
    void openSendsSettingsThenOpened() throws Exception {
        startBridge();

        request(new CameraRequest.OpenCamera("SIM00001"));
        List<CameraEvent> events = pumpUntil(e -> e instanceof CameraEvent.CameraOpened);

        assertInstanceOf(CameraEvent.SettingsSnapshot.class, events.get(0));
        assertEquals(new CameraEvent.CameraOpened(), events.get(1));
    }

    @Test
    void secondOpenIsRejected() throws Exception {
        startBridge();
        openCamera();

        request(new CameraRequest.OpenCamera("SIM00002"));

        assertEquals(List.of(CameraEvent.CameraFault.rejected(CameraStateReducer.ALREADY_OPEN)), sentEvents());
        assertEquals(1, provider.openCount());
    }

    @Test
    void playStreamsFramesAndCloseEndsSession() throws Exception {
        startBridge();
        openCamera();

        request(new CameraRequest.Play());
        pumpUntil(e -> e instanceof CameraEvent.ImageCaptured);

        request(new CameraRequest.CloseCamera());
        List<CameraEvent> events = pumpUntil(e -> e instanceof CameraEvent.CameraClosed);

        assertEquals(new CameraEvent.PlayingChanged(true), events.get(0));
        int stopped = events.indexOf(new CameraEvent.PlayingChanged(false));
        int closed = events.indexOf(new CameraEvent.CameraClosed());
        assertTrue(stopped > 0 && stopped < closed, events.toString());
        assertTrue(provider.lastOpened().orElseThrow().isDisposed());

        // the session is gone; the camera can be opened again
        endpoint.clear();
        request(new CameraRequest.Stop());
        assertEquals(List.of(CameraEvent.CameraFault.rejected(CameraStateReducer.NO_CAMERA)), sentEvents());

        endpoint.clear();
        openCamera();
        assertEquals(2, provider.openCount());
    }

    @Test
    void failedOpenEndsSessionWithFaultThenClosed() throws Exception {
        startBridge();

        request(new CameraRequest.OpenCamera("MISSING"));
        List<CameraEvent> events = pumpUntil(e -> e instanceof CameraEvent.CameraClosed);

        CameraEvent.CameraFault fault = (CameraEvent.CameraFault) events.get(0);
        assertEquals("No camera with serial MISSING", fault.message());
        assertEquals(new CameraEvent.CameraClosed(), events.get(1));
        assertFalse(bridge.isTerminated());
    }

    // ---------------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------------

    @Test
    void eofClosesSessionAndTerminates() throws Exception {
        startBridge();
        openCamera();

        request(new CameraRequest.EndOfStream());

        assertTrue(bridge.isTerminated());
        assertTrue(endpoint.isStopped());
        assertTrue(provider.lastOpened().orElseThrow().isDisposed());
        assertEquals(0, scheduler.pendingCount());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void malformedFrameTerminates() {
        startBridge();

        endpoint.inject(WireFrame.textOnly("[teleport, 1]".getBytes(StandardCharsets.UTF_8)));

        assertTrue(bridge.isTerminated());
        assertTrue(endpoint.isStopped());
        assertTrue(sink.getTransportEvents().stream()
                .anyMatch(e -> e.kind() == CameraTransportEvent.Kind.FRAME_REJECTED));
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void peerDisconnectTerminates() {
        startBridge();

        endpoint.disconnect(new IOException("Connection reset"));

        assertTrue(bridge.isTerminated());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void stopIsIdempotent() {
        startBridge();

        bridge.stop();
        bridge.stop();

        assertTrue(bridge.isTerminated());
        assertTrue(sink.getErrors().isEmpty());
    }
}
