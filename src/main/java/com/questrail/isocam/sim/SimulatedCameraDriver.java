package com.questrail.isocam.sim;

import com.questrail.isocam.api.CameraDriver;
import com.questrail.isocam.api.CameraSettings;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.api.NumericRange;
import com.questrail.isocam.api.PixelFormat;
import com.questrail.isocam.api.SensorSize;
import com.questrail.isocam.api.SettingName;
import com.questrail.isocam.api.TriggerType;
import com.questrail.isocam.sim.SimulatedCameraDriverProvider.Operation;
import com.questrail.isocam.time.MonotonicClock;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SimulatedCameraDriver
 * -----------------------------------------------------------------------------
 * One simulated camera.
 *
 * <h2>Acquisition</h2>
 * <ul>
 *   <li>Software trigger with {@code trigger_count = n > 0}: every trigger
 *       queues {@code n} frames.</li>
 *   <li>Software trigger with {@code trigger_count = 0}, or hardware trigger:
 *       frames are produced continuously while armed.</li>
 *   <li>Consecutive frames are at least {@code exposure_ms} apart on the
 *       driver's clock. Frame indices start at 0 on every arm.</li>
 * </ul>
 *
 * Pixels are a deterministic ramp offset by the frame index; mono sensors
 * produce {@code gray16le}, color sensors {@code bgr48le}.
 *
 * <p>Mutated only from the control-loop thread; the inspection methods used by
 * tests may be called from any thread.</p>
 */
public final class SimulatedCameraDriver implements CameraDriver
{
    private final String serial;
    private final MonotonicClock clock;
    private final SimulatedCameraDriverProvider provider;

    private final List<SettingName> writes = new CopyOnWriteArrayList<>();
    private final AtomicInteger triggers = new AtomicInteger();
    private final AtomicInteger framesProduced = new AtomicInteger();

    private volatile CameraSettings settings;
    private volatile boolean armed;
    private volatile boolean disposed;

    // control thread only
    private boolean continuous;
    private int pendingFrames;
    private long frameIndex;
    private long nextFrameAtNanos;

    SimulatedCameraDriver(String serial,
                          SensorSize sensor,
                          boolean color,
                          MonotonicClock clock,
                          SimulatedCameraDriverProvider provider) {
        this.serial = serial;
        this.clock = clock;
        this.provider = provider;
        this.settings = CameraSettings.builder()
                .exposureMs(5)
                .exposureRange(NumericRange.of(0, 100))
                .binningX(1)
                .binningXRange(NumericRange.of(1, 4))
                .binningY(1)
                .binningYRange(NumericRange.of(1, 4))
                .sensorSize(sensor)
                .roiWidth(sensor.width())
                .roiHeight(sensor.height())
                .frameQueueSize(1)
                .triggerType(TriggerType.SOFTWARE)
                .triggerCount(1)
                .gain(0)
                .gainRange(NumericRange.of(0, 48))
                .blackLevel(0)
                .blackLevelRange(NumericRange.of(0, 100))
                .supportedFreqs(List.of("20 MHz", "40 MHz"))
                .freq("20 MHz")
                .supportedTaps(List.of("1", "2"))
                .taps("1")
                .supportsColor(color)
                .build();
    }

    @Override
    public CameraSettings readSettings() throws DriverException {
        ensureUsable(Operation.READ_SETTINGS);
        return settings;
    }

    @Override
    public Map<SettingName, Object> writeSetting(SettingName name, Object value) throws DriverException {
        ensureUsable(Operation.WRITE_SETTING);
        settings = settings.with(name, value);
        writes.add(name);
        return Map.of(name, settings.value(name));
    }

    @Override
    public void arm() throws DriverException {
        ensureUsable(Operation.ARM);
        if (armed) {
            throw new DriverException("Camera " + serial + " is already armed");
        }
        CameraSettings s = settings;
        continuous = s.triggerType() == TriggerType.HARDWARE || s.triggerCount() == 0;
        pendingFrames = 0;
        frameIndex = 0;
        nextFrameAtNanos = clock.nowNanos();
        armed = true;
    }

    @Override
    public void issueSoftwareTrigger() throws DriverException {
        ensureUsable(Operation.TRIGGER);
        if (!armed) {
            throw new DriverException("Camera " + serial + " is not armed");
        }
        triggers.incrementAndGet();
        if (!continuous) {
            pendingFrames += settings.triggerCount();
        }
    }

    @Override
    public void disarm() throws DriverException {
        ensureUsable(Operation.DISARM);
        armed = false;
        pendingFrames = 0;
    }

    @Override
    public boolean isArmed() {
        return armed;
    }

    @Override
    public Optional<FrameEnvelope> pollFrame() throws DriverException {
        ensureUsable(Operation.POLL);
        if (!armed || (!continuous && pendingFrames == 0)) {
            return Optional.empty();
        }

        long now = clock.nowNanos();
        if (now < nextFrameAtNanos) {
            return Optional.empty();
        }

        CameraSettings s = settings;
        nextFrameAtNanos = now + (long) (s.exposureMs() * 1_000_000L);
        if (!continuous) {
            pendingFrames--;
        }
        FrameEnvelope frame = render(s, now);
        frameIndex++;
        framesProduced.incrementAndGet();
        return Optional.of(frame);
    }

    @Override
    public void dispose() throws DriverException {
        if (disposed) {
            return;
        }
        provider.check(Operation.DISPOSE);
        armed = false;
        disposed = true;
    }

    public String serial() {
        return serial;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /** Settings written so far, in order. */
    public List<SettingName> writes() {
        return List.copyOf(writes);
    }

    public int softwareTriggers() {
        return triggers.get();
    }

    public int framesProduced() {
        return framesProduced.get();
    }

    private FrameEnvelope render(CameraSettings s, long nowNanos) {
        int width = Math.max(1, s.roiWidth() / Math.max(1, s.binningX()));
        int height = Math.max(1, s.roiHeight() / Math.max(1, s.binningY()));
        PixelFormat format = s.supportsColor() ? PixelFormat.BGR48 : PixelFormat.MONO16;

        byte[] pixels = new byte[width * height * format.bytesPerPixel()];
        for (int i = 0; i < pixels.length; i += 2) {
            int sample = (int) ((i / 2 + frameIndex) & 0xFFFF);
            pixels[i] = (byte) sample;
            pixels[i + 1] = (byte) (sample >>> 8);
        }

        int queued = continuous ? 0 : pendingFrames;
        return new FrameEnvelope(pixels, format, width, height, frameIndex, queued, nowNanos / 1_000_000_000.0);
    }

    private void ensureUsable(Operation op) throws DriverException {
        if (disposed) {
            throw new DriverException("Camera " + serial + " has been disposed");
        }
        provider.check(op);
    }
}
