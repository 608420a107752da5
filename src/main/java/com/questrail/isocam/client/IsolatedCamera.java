package com.questrail.isocam.client;

import com.questrail.isocam.api.CameraSettings;
import com.questrail.isocam.api.ColorGain;
import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.api.SettingName;
import com.questrail.isocam.api.TriggerType;
import com.questrail.isocam.config.ClientConfig;
import com.questrail.isocam.observability.CameraObservabilitySink;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Consumer;

/**
 * IsolatedCamera
 * =============================================================================
 * Application facade over a {@link CameraProcessSupervisor}.
 *
 * <p>Requests are fire-and-forget; the state exposed here
 * ({@link #serials()}, {@link #isCameraOpen()}, {@link #isPlaying()},
 * {@link #settings()}) follows the worker's responses, not the requests.</p>
 *
 * <pre>
 *   try (IsolatedCamera camera = new IsolatedCamera(ClientConfig.defaults())) {
 *       camera.onImage(frame -&gt; ...);
 *       camera.start();
 *       camera.refreshCameras();
 *       camera.openCamera("12345");
 *       camera.setSetting(SettingName.EXPOSURE_MS, 20.0);
 *       camera.play();
 *   }
 * </pre>
 */
public class IsolatedCamera implements CameraEventListener, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(IsolatedCamera.class);

    private final CameraProcessSupervisor supervisor;

    private volatile List<String> serials = List.of();
    private volatile boolean cameraOpen;
    private volatile boolean playing;
    private volatile CameraSettings settings = CameraSettings.defaults();

    private volatile Consumer<FrameEnvelope> imageHandler = frame -> {};
    private volatile Consumer<CameraEvent.CameraFault> faultHandler = IsolatedCamera::logFault;
    private volatile Consumer<Set<String>> settingsHandler = keys -> {};

    public IsolatedCamera(ClientConfig config) {
        this.supervisor = new CameraProcessSupervisor(config, this);
    }

    public IsolatedCamera(ClientConfig config, WorkerLauncher launcher, CameraObservabilitySink observabilitySink) {
        this.supervisor = new CameraProcessSupervisor(config, launcher, this, observabilitySink);
    }

    /**
     * Launches the worker process.
     */
    public void start() throws IOException {
        supervisor.start();
    }

    /**
     * Sends {@code eof} to the worker.
     *
     * @see CameraProcessSupervisor#stop(boolean, Duration)
     */
    public OptionalInt stop(boolean join, Duration killDelay) throws InterruptedException {
        return supervisor.stop(join, killDelay);
    }

    @Override
    public void close() throws InterruptedException {
        supervisor.close();
    }

    // ---------------------------------------------------------------------
    // Requests
    // ---------------------------------------------------------------------

    public void openCamera(String serial) {
        supervisor.send(new CameraRequest.OpenCamera(Objects.requireNonNull(serial, "serial")));
    }

    public void closeCamera() {
        supervisor.send(new CameraRequest.CloseCamera());
    }

    /**
     * Asks for the serial numbers of the attached cameras.
     */
    public void refreshCameras() {
        supervisor.send(new CameraRequest.ListSerials());
    }

    public void play() {
        supervisor.send(new CameraRequest.Play());
    }

    public void stopPlaying() {
        supervisor.send(new CameraRequest.Stop());
    }

    /**
     * Requests a setting change by wire name and wire value.
     */
    public void setSetting(String name, Object value) {
        supervisor.send(new CameraRequest.WriteSetting(Objects.requireNonNull(name, "name"), value));
    }

    /**
     * Requests a setting change with a typed value.
     */
    public void setSetting(SettingName name, Object value) {
        Object wire = value;
        if (value instanceof TriggerType t) {
            wire = t.wireName();
        }
        else if (value instanceof ColorGain g) {
            wire = g.toWire();
        }
        setSetting(name.wireName(), wire);
    }

    // ---------------------------------------------------------------------
    // State
    // ---------------------------------------------------------------------

    /** Serials from the latest {@code serials} response, sorted. */
    public List<String> serials() {
        return serials;
    }

    public boolean isCameraOpen() {
        return cameraOpen;
    }

    public boolean isPlaying() {
        return playing;
    }

    /** Settings merged from every {@code settings} and {@code setting} event. */
    public CameraSettings settings() {
        return settings;
    }

    public int workerPort() {
        return supervisor.port();
    }

    public void onImage(Consumer<FrameEnvelope> handler) {
        this.imageHandler = Objects.requireNonNull(handler, "handler");
    }

    public void onFault(Consumer<CameraEvent.CameraFault> handler) {
        this.faultHandler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Called with the wire keys whose value changed.
     */
    public void onSettingsChanged(Consumer<Set<String>> handler) {
        this.settingsHandler = Objects.requireNonNull(handler, "handler");
    }

    // ---------------------------------------------------------------------
    // CameraEventListener
    // ---------------------------------------------------------------------

    @Override
    public void onEvent(CameraEvent event) {
        if (event instanceof CameraEvent.CameraOpened) {
            cameraOpen = true;
        }
        else if (event instanceof CameraEvent.CameraClosed) {
            playing = false;
            cameraOpen = false;
        }
        else if (event instanceof CameraEvent.PlayingChanged e) {
            playing = e.playing();
        }
        else if (event instanceof CameraEvent.SettingsSnapshot e) {
            mergeSettings(e.settings());
        }
        else if (event instanceof CameraEvent.SettingChanged e) {
            mergeSettings(e.changes());
        }
        else if (event instanceof CameraEvent.SerialsListed e) {
            serials = e.serials();
        }
        else if (event instanceof CameraEvent.ImageCaptured e) {
            imageHandler.accept(e.frame());
        }
        else if (event instanceof CameraEvent.CameraFault e) {
            faultHandler.accept(e);
        }
    }

    @Override
    public void onConnectionClosed(Throwable cause) {
        playing = false;
        cameraOpen = false;
    }

    @Override
    public void onProcessExited(int exitCode) {
        log.debug("Camera worker exited with code {}", exitCode);
    }

    private void mergeSettings(Map<String, Object> wire) {
        CameraSettings.MergeResult result;
        try {
            result = settings.merge(wire);
        }
        catch (IllegalArgumentException e) {
            faultHandler.accept(CameraEvent.CameraFault.from(e));
            return;
        }
        settings = result.settings();
        if (!result.changed().isEmpty()) {
            settingsHandler.accept(result.changed());
        }
    }

    private static void logFault(CameraEvent.CameraFault fault) {
        if (fault.trace().isEmpty()) {
            log.error("{}", fault.message());
        }
        else {
            log.error("{}\n{}", fault.message(), fault.trace());
        }
    }
}
