package com.questrail.isocam.controller;

import com.questrail.isocam.api.CameraSettings;
import com.questrail.isocam.observability.CameraStateTransitionEvent;
import com.questrail.isocam.observability.RecordingObservabilitySink;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.sim.SimulatedCameraDriver;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider.Operation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CameraControllerTest
 * -----------------------------------------------------------------------------
 * Runs the controller's real control-loop thread against the simulated driver
 * and checks the events it emits.
 */
class CameraControllerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration POLL = Duration.ofMillis(1);

    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<CameraEvent> events = new ArrayList<>();
    private CameraController controller;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (controller != null) {
            controller.requestClose();
            controller.join(TIMEOUT);
        }
    }

    private CameraController start(SimulatedCameraDriverProvider provider, String serial) {
        controller = new CameraController(serial, provider, POLL, sink);
        controller.start();
        return controller;
    }

    /**
     * Drains events until one matches {@code condition}; fails on timeout.
     */
    private <E extends CameraEvent> E awaitEvent(Class<E> type, Predicate<E> condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (System.nanoTime() < deadline) {
            controller.drainEvents(events);
            for (CameraEvent event : events) {
                if (type.isInstance(event) && condition.test(type.cast(event))) {
                    return type.cast(event);
                }
            }
            Thread.sleep(2);
        }
        fail("Timed out waiting for " + type.getSimpleName() + "; saw " + events);
        return null;
    }

    private <E extends CameraEvent> E awaitEvent(Class<E> type) throws InterruptedException {
        return awaitEvent(type, e -> true);
    }

    private <E extends CameraEvent> List<E> eventsOfType(Class<E> type) {
        List<E> out = new ArrayList<>();
        for (CameraEvent e : events) {
            if (type.isInstance(e)) {
                out.add(type.cast(e));
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Open / close
    // ---------------------------------------------------------------------

    @Test
    void openPublishesFullSettingsThenOpened() throws Exception {
        start(new SimulatedCameraDriverProvider(), "SIM00001");

        awaitEvent(CameraEvent.CameraOpened.class);

        assertInstanceOf(CameraEvent.SettingsSnapshot.class, events.get(0));
        assertInstanceOf(CameraEvent.CameraOpened.class, events.get(1));

        Map<String, Object> snapshot = ((CameraEvent.SettingsSnapshot) events.get(0)).settings();
        assertEquals(CameraSettings.wireKeys(), List.copyOf(snapshot.keySet()));
        assertEquals(64, controller.currentState().settings().sensorSize().width());
        assertTrue(controller.currentState().isOpen());
    }

    @Test
    void closeDisposesDriverAndEndsSession() throws Exception {
        SimulatedCameraDriverProvider provider = new SimulatedCameraDriverProvider();
        start(provider, "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.requestClose();
        awaitEvent(CameraEvent.CameraClosed.class);

        assertTrue(controller.join(TIMEOUT));
        assertTrue(provider.lastOpened().orElseThrow().isDisposed());
        assertFalse(controller.currentState().isOpen());
        assertTrue(sink.hasEventOfType(CameraStateTransitionEvent.class));
    }

    @Test
    void unknownSerialFaultsThenCloses() throws Exception {
        start(new SimulatedCameraDriverProvider(), "NOPE");

        CameraEvent.CameraFault fault = awaitEvent(CameraEvent.CameraFault.class);
        awaitEvent(CameraEvent.CameraClosed.class);

        assertEquals("No camera with serial NOPE", fault.message());
        assertFalse(fault.trace().isEmpty());
        assertTrue(controller.join(TIMEOUT));
        assertTrue(eventsOfType(CameraEvent.CameraOpened.class).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Settings
    // ---------------------------------------------------------------------

    @Test
    void settingIsClampedAndEchoed() throws Exception {
        start(new SimulatedCameraDriverProvider(), "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.WriteSetting("exposure_ms", 1000));

        CameraEvent.SettingChanged changed = awaitEvent(CameraEvent.SettingChanged.class);
        assertEquals(List.of("exposure_ms"), List.copyOf(changed.changes().keySet()));
        assertEquals(100.0, ((Number) changed.changes().get("exposure_ms")).doubleValue());
        assertEquals(100.0, controller.currentState().settings().exposureMs());
    }

    @Test
    void invalidSettingIsRejectedWithoutTrace() throws Exception {
        start(new SimulatedCameraDriverProvider(), "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.WriteSetting("freq", "80 MHz"));

        CameraEvent.CameraFault fault = awaitEvent(CameraEvent.CameraFault.class);
        assertTrue(fault.message().contains("80 MHz"), fault.message());
        assertEquals("", fault.trace());
        assertTrue(controller.currentState().isOpen());
    }

    // ---------------------------------------------------------------------
    // Acquisition
    // ---------------------------------------------------------------------

    @Test
    void softwareTriggerDeliversTriggerCountFramesInOrder() throws Exception {
        SimulatedCameraDriverProvider provider = new SimulatedCameraDriverProvider();
        start(provider, "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.WriteSetting("exposure_ms", 1));
        controller.submit(new CameraRequest.WriteSetting("trigger_count", 3));
        controller.submit(new CameraRequest.Play());

        awaitEvent(CameraEvent.PlayingChanged.class, CameraEvent.PlayingChanged::playing);
        awaitEvent(CameraEvent.ImageCaptured.class, e -> e.frame().frameIndex() == 2);

        List<CameraEvent.ImageCaptured> frames = eventsOfType(CameraEvent.ImageCaptured.class);
        assertEquals(3, frames.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(i, frames.get(i).frame().frameIndex());
            assertEquals(2 - i, frames.get(i).frame().queuedCount());
        }

        SimulatedCameraDriver driver = provider.lastOpened().orElseThrow();
        assertEquals(1, driver.softwareTriggers());

        controller.submit(new CameraRequest.Stop());
        awaitEvent(CameraEvent.PlayingChanged.class, e -> !e.playing());
        assertFalse(driver.isArmed());
    }

    @Test
    void hardwareTriggerArmsWithoutSoftwareTrigger() throws Exception {
        SimulatedCameraDriverProvider provider = new SimulatedCameraDriverProvider();
        start(provider, "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.WriteSetting("exposure_ms", 1));
        controller.submit(new CameraRequest.WriteSetting("trigger_type", "HW Trigger"));
        controller.submit(new CameraRequest.Play());

        awaitEvent(CameraEvent.ImageCaptured.class, e -> e.frame().frameIndex() == 4);

        assertEquals(0, provider.lastOpened().orElseThrow().softwareTriggers());
        assertTrue(controller.currentState().isPlaying());
    }

    @Test
    void noImagesFollowPlayingFalseAfterStop() throws Exception {
        SimulatedCameraDriverProvider provider = new SimulatedCameraDriverProvider();
        start(provider, "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.WriteSetting("exposure_ms", 1));
        controller.submit(new CameraRequest.WriteSetting("trigger_type", "HW Trigger"));
        controller.submit(new CameraRequest.Play());
        awaitEvent(CameraEvent.ImageCaptured.class);

        controller.submit(new CameraRequest.Stop());
        CameraEvent.PlayingChanged stopped = awaitEvent(CameraEvent.PlayingChanged.class, e -> !e.playing());

        Thread.sleep(POLL.toMillis() * 20);
        controller.drainEvents(events);

        int stoppedAt = events.indexOf(stopped);
        for (CameraEvent event : events.subList(stoppedAt + 1, events.size())) {
            assertFalse(event instanceof CameraEvent.ImageCaptured, "image after stop: " + events);
        }
        assertFalse(controller.currentState().isPlaying());
        assertFalse(provider.lastOpened().orElseThrow().isArmed());
    }

    @Test
    void playSettingIsAcceptedWhilePlayingButOthersAreNot() throws Exception {
        start(new SimulatedCameraDriverProvider(), "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.WriteSetting("trigger_count", 0));
        controller.submit(new CameraRequest.Play());
        awaitEvent(CameraEvent.PlayingChanged.class, CameraEvent.PlayingChanged::playing);

        controller.submit(new CameraRequest.WriteSetting("gain", 12));
        CameraEvent.SettingChanged changed = awaitEvent(CameraEvent.SettingChanged.class,
                e -> e.changes().containsKey("gain"));
        assertEquals(12, ((Number) changed.changes().get("gain")).intValue());

        controller.submit(new CameraRequest.WriteSetting("binning_x", 2));
        CameraEvent.CameraFault fault = awaitEvent(CameraEvent.CameraFault.class);
        assertTrue(fault.message().contains("binning_x"), fault.message());
        assertTrue(controller.currentState().isPlaying());
    }

    @Test
    void closeWhilePlayingReportsNotPlayingThenClosed() throws Exception {
        SimulatedCameraDriverProvider provider = new SimulatedCameraDriverProvider();
        start(provider, "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.Play());
        awaitEvent(CameraEvent.PlayingChanged.class, CameraEvent.PlayingChanged::playing);

        controller.requestClose();
        awaitEvent(CameraEvent.CameraClosed.class);

        int stopped = events.indexOf(new CameraEvent.PlayingChanged(false));
        int closed = events.indexOf(new CameraEvent.CameraClosed());
        assertTrue(stopped >= 0 && stopped < closed, events.toString());
        assertTrue(provider.lastOpened().orElseThrow().isDisposed());
    }

    // ---------------------------------------------------------------------
    // Faults
    // ---------------------------------------------------------------------

    @Test
    void driverFaultClosesSession() throws Exception {
        SimulatedCameraDriverProvider provider = SimulatedCameraDriverProvider.builder()
                .failOn(Operation.ARM, 0)
                .build();
        start(provider, "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.submit(new CameraRequest.Play());

        CameraEvent.CameraFault fault = awaitEvent(CameraEvent.CameraFault.class);
        awaitEvent(CameraEvent.CameraClosed.class);

        assertEquals("Simulated arm failure", fault.message());
        assertTrue(fault.trace().contains("DriverException"), fault.trace());
        assertTrue(controller.join(TIMEOUT));
        assertTrue(provider.lastOpened().orElseThrow().isDisposed());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void requestsAfterSessionEndAreLeftForTheCaller() throws Exception {
        start(new SimulatedCameraDriverProvider(), "SIM00001");
        awaitEvent(CameraEvent.CameraOpened.class);

        controller.requestClose();
        awaitEvent(CameraEvent.CameraClosed.class);
        assertTrue(controller.join(TIMEOUT));

        controller.submit(new CameraRequest.Play());
        List<CameraRequest> pending = new ArrayList<>();
        assertEquals(1, controller.drainPendingRequests(pending));
        assertEquals(List.of(new CameraRequest.Play()), pending);
        controller = null;
    }
}
