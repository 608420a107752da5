package com.questrail.isocam.client;

import com.questrail.isocam.observability.CameraTransportEvent;
import com.questrail.isocam.observability.RecordingObservabilitySink;
import com.questrail.isocam.protocol.codec.MessageCodec;
import com.questrail.isocam.protocol.codec.WireFrame;
import com.questrail.isocam.protocol.codec.YamlTextCodec;
import com.questrail.isocam.protocol.internal.decode.CameraMessageDecoder;
import com.questrail.isocam.protocol.internal.encode.CameraMessageEncoder;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.protocol.model.MessageTag;
import com.questrail.isocam.time.DeterministicScheduler;
import com.questrail.isocam.time.ManualMonotonicClock;
import com.questrail.isocam.transport.FakeMessageEndpoint;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CameraClientBridgeTest
 * -----------------------------------------------------------------------------
 * Supervisor-side bridge against a fake endpoint, with every callback and tick
 * on the test thread.
 */
class CameraClientBridgeTest {

    private static final Duration RECV_TIMEOUT = Duration.ofMillis(10);

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final FakeMessageEndpoint endpoint = new FakeMessageEndpoint();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final RecordingCameraEventListener listener = new RecordingCameraEventListener();
    private final MessageCodec codec = new MessageCodec(new YamlTextCodec());
    private final CameraMessageEncoder encoder = new CameraMessageEncoder();
    private final CameraMessageDecoder decoder = new CameraMessageDecoder();

    private CameraClientBridge bridge;

    @BeforeEach
    void setUp() {
        bridge = new CameraClientBridge(endpoint, codec, RECV_TIMEOUT, Runnable::run, scheduler, clock, listener, sink);
        bridge.start();
    }

    private void tick() {
        clock.advance(RECV_TIMEOUT);
        scheduler.runDueTasks();
    }

    private List<CameraRequest> sentRequests() {
        List<CameraRequest> requests = new ArrayList<>();
        for (WireFrame frame : endpoint.sent()) {
            requests.add(decoder.decodeRequest(codec.decode(frame)));
        }
        return requests;
    }

    private void deliver(CameraEvent event) {
        endpoint.inject(codec.encode(encoder.encode(event)));
    }

    @Test
    void requestsAreHeldUntilConnected() {
        bridge.send(new CameraRequest.ListSerials());
        bridge.send(new CameraRequest.OpenCamera("A1"));
        tick();
        tick();

        assertTrue(endpoint.sent().isEmpty());

        endpoint.connect();
        tick();

        assertEquals(List.of(new CameraRequest.ListSerials(), new CameraRequest.OpenCamera("A1")), sentRequests());
        assertEquals(List.of("connected"), listener.lifecycle());
    }

    @Test
    void eventsReachListenerInOrder() {
        endpoint.connect();

        deliver(new CameraEvent.CameraOpened());
        deliver(new CameraEvent.PlayingChanged(true));
        deliver(new CameraEvent.SerialsListed(List.of("A1")));

        assertEquals(List.of(
                new CameraEvent.CameraOpened(),
                new CameraEvent.PlayingChanged(true),
                new CameraEvent.SerialsListed(List.of("A1"))), listener.events());
    }

    @Test
    void eofIsLastRequestAndClosesConnection() {
        endpoint.connect();
        bridge.send(new CameraRequest.Play());
        bridge.send(new CameraRequest.EndOfStream());
        bridge.send(new CameraRequest.Stop());

        tick();

        assertEquals(List.of(new CameraRequest.Play(), new CameraRequest.EndOfStream()), sentRequests());
        assertTrue(bridge.isClosed());
        assertTrue(endpoint.isStopped());
        assertNull(listener.closeCause());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void connectFailureIsReportedAsFault() {
        ConnectException refused = new ConnectException("Connection refused");

        endpoint.disconnect(refused);

        List<CameraEvent.CameraFault> faults = listener.eventsOfType(CameraEvent.CameraFault.class);
        assertEquals(1, faults.size());
        assertEquals("Connection refused", faults.get(0).message());
        assertTrue(faults.get(0).trace().contains("ConnectException"));
        assertSame(refused, listener.closeCause());
        assertEquals(List.of("exception", "connection-closed"), listener.lifecycle());
        assertTrue(bridge.isClosed());
    }

    @Test
    void orderlyPeerCloseIsNotAFault() {
        endpoint.connect();

        endpoint.disconnect(null);

        assertTrue(listener.events().isEmpty());
        assertTrue(bridge.isClosed());
        assertTrue(sink.getErrors().isEmpty());
    }

    @Test
    void malformedFrameClosesConnection() {
        endpoint.connect();

        endpoint.inject(WireFrame.textOnly("just text".getBytes(StandardCharsets.UTF_8)));

        assertEquals(1, listener.eventsOfType(CameraEvent.CameraFault.class).size());
        assertTrue(bridge.isClosed());
        assertTrue(sink.getTransportEvents().stream()
                .anyMatch(e -> e.kind() == CameraTransportEvent.Kind.FRAME_REJECTED));
    }

    @Test
    void imageWithNegativeSizeClosesConnection() {
        endpoint.connect();

        endpoint.inject(codec.encode(MessageTag.IMAGE,
                Arrays.asList("gray16le", List.of(-1, 1), 0, 0, 0.0), new byte[2]));

        assertEquals(1, listener.eventsOfType(CameraEvent.CameraFault.class).size());
        assertTrue(listener.eventsOfType(CameraEvent.ImageCaptured.class).isEmpty());
        assertTrue(bridge.isClosed());
        assertTrue(sink.getTransportEvents().stream()
                .anyMatch(e -> e.kind() == CameraTransportEvent.Kind.FRAME_REJECTED));
    }

    @Test
    void closeDropsUnsentRequests() throws InterruptedException {
        endpoint.connect();
        bridge.send(new CameraRequest.ListSerials());

        bridge.close();
        tick();

        assertTrue(endpoint.sent().isEmpty());
        assertTrue(bridge.awaitClosed(Duration.ZERO));
        assertEquals(List.of("connected", "connection-closed"), listener.lifecycle());
    }
}
