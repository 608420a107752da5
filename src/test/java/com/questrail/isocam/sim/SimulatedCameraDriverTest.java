package com.questrail.isocam.sim;

import com.questrail.isocam.api.CameraDriver;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.api.PixelFormat;
import com.questrail.isocam.api.SettingName;
import com.questrail.isocam.api.TriggerType;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider.Operation;
import com.questrail.isocam.time.ManualMonotonicClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedCameraDriverTest {

    private ManualMonotonicClock clock;
    private SimulatedCameraDriverProvider provider;
    private CameraDriver driver;

    @BeforeEach
    void setUp() throws DriverException {
        clock = new ManualMonotonicClock();
        provider = SimulatedCameraDriverProvider.builder()
                .withSerials(List.of("B", "A"))
                .withSensorSize(8, 4)
                .withClock(clock)
                .build();
        driver = provider.open("A");
    }

    @Test
    void discoversConfiguredSerialsAndRefusesUnknownOnes() throws DriverException {
        assertEquals(List.of("B", "A"), provider.discoverSerials());

        DriverException e = assertThrows(DriverException.class, () -> provider.open("C"));
        assertEquals("No camera with serial C", e.getMessage());
        assertEquals(1, provider.openCount());
    }

    @Test
    void initialSettingsCoverTheWholeSensor() throws DriverException {
        assertEquals(8, driver.readSettings().roiWidth());
        assertEquals(4, driver.readSettings().roiHeight());
        assertEquals(TriggerType.SOFTWARE, driver.readSettings().triggerType());
        assertFalse(driver.readSettings().supportsColor());
    }

    @Test
    void writeReturnsAppliedValue() throws DriverException {
        Map<SettingName, Object> applied = driver.writeSetting(SettingName.GAIN, 9);

        assertEquals(Map.of(SettingName.GAIN, 9), applied);
        assertEquals(9, driver.readSettings().gain());
        assertEquals(List.of(SettingName.GAIN), ((SimulatedCameraDriver) driver).writes());
    }

    @Test
    void softwareTriggerQueuesTriggerCountFramesPacedByExposure() throws DriverException {
        driver.writeSetting(SettingName.TRIGGER_COUNT, 2);
        driver.writeSetting(SettingName.EXPOSURE_MS, 10.0);
        driver.arm();

        assertEquals(Optional.empty(), driver.pollFrame());

        driver.issueSoftwareTrigger();
        FrameEnvelope first = driver.pollFrame().orElseThrow();
        assertEquals(0, first.frameIndex());
        assertEquals(1, first.queuedCount());

        // the next frame is not ready until the exposure has elapsed
        assertEquals(Optional.empty(), driver.pollFrame());
        clock.advanceMillis(10);
        FrameEnvelope second = driver.pollFrame().orElseThrow();
        assertEquals(1, second.frameIndex());
        assertEquals(0, second.queuedCount());

        clock.advanceMillis(10);
        assertEquals(Optional.empty(), driver.pollFrame());
    }

    @Test
    void hardwareTriggerStreamsContinuously() throws DriverException {
        driver.writeSetting(SettingName.TRIGGER_TYPE, TriggerType.HARDWARE);
        driver.writeSetting(SettingName.EXPOSURE_MS, 1.0);
        driver.arm();

        for (int i = 0; i < 5; i++) {
            assertEquals(i, driver.pollFrame().orElseThrow().frameIndex());
            clock.advanceMillis(1);
        }
    }

    @Test
    void frameGeometryFollowsRoiAndBinning() throws DriverException {
        driver.writeSetting(SettingName.BINNING_X, 2);
        driver.arm();
        driver.issueSoftwareTrigger();

        FrameEnvelope frame = driver.pollFrame().orElseThrow();
        assertEquals(4, frame.width());
        assertEquals(4, frame.height());
        assertEquals(PixelFormat.MONO16, frame.format());
        assertEquals(4 * 4 * 2, frame.pixelLength());
    }

    @Test
    void colorSensorProducesBgrFrames() throws DriverException {
        CameraDriver color = SimulatedCameraDriverProvider.builder()
                .withSensorSize(2, 2)
                .withColor(true)
                .withClock(clock)
                .build()
                .open("SIM00001");
        color.arm();
        color.issueSoftwareTrigger();

        FrameEnvelope frame = color.pollFrame().orElseThrow();
        assertEquals(PixelFormat.BGR48, frame.format());
        assertEquals(2 * 2 * 6, frame.pixelLength());
    }

    @Test
    void armTwiceAndTriggerWhileDisarmedFail() throws DriverException {
        assertThrows(DriverException.class, () -> driver.issueSoftwareTrigger());

        driver.arm();
        assertThrows(DriverException.class, () -> driver.arm());

        driver.disarm();
        assertFalse(driver.isArmed());
    }

    @Test
    void disposedDriverRefusesWork() throws DriverException {
        driver.dispose();
        driver.dispose();

        assertTrue(((SimulatedCameraDriver) driver).isDisposed());
        assertThrows(DriverException.class, () -> driver.readSettings());
        assertEquals(1, provider.callCount(Operation.DISPOSE));
    }

    @Test
    void plannedFailureHitsTheRequestedCall() throws DriverException {
        SimulatedCameraDriverProvider failing = SimulatedCameraDriverProvider.builder()
                .failOn(Operation.WRITE_SETTING, 1)
                .build();
        CameraDriver d = failing.open("SIM00001");

        d.writeSetting(SettingName.GAIN, 1);
        DriverException e = assertThrows(DriverException.class, () -> d.writeSetting(SettingName.GAIN, 2));
        assertEquals("Simulated write_setting failure", e.getMessage());
        d.writeSetting(SettingName.GAIN, 3);
        assertEquals(3, failing.callCount(Operation.WRITE_SETTING));
    }
}
