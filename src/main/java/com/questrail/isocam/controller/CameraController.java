package com.questrail.isocam.controller;

import com.questrail.isocam.api.CameraDriver;
import com.questrail.isocam.api.CameraDriverProvider;
import com.questrail.isocam.api.CameraSettings;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.api.FrameEnvelope;
import com.questrail.isocam.api.SettingName;
import com.questrail.isocam.observability.CameraErrorEvent;
import com.questrail.isocam.observability.CameraObservabilitySink;
import com.questrail.isocam.observability.CameraStateTransitionEvent;
import com.questrail.isocam.protocol.model.CameraEvent;
import com.questrail.isocam.protocol.model.CameraRequest;
import com.questrail.isocam.time.SystemWallClock;
import com.questrail.isocam.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CameraController
 * =============================================================================
 * Owns one camera driver session and the control-loop thread that drives it.
 *
 * <h2>Purpose</h2>
 * The controller serializes two sources of work onto one thread:
 * <ul>
 *   <li>requests submitted by the worker's server thread</li>
 *   <li>frames produced by the driver while playing</li>
 * </ul>
 * Everything it produces goes into a single event queue, so settings echoes,
 * frames and faults are observed in exactly the order they were emitted.
 *
 * <h2>Threading Model</h2>
 * The control-loop thread is the only thread that touches the driver. Other
 * threads interact through {@link #submit(CameraRequest)} and
 * {@link #drainEvents(Collection)}, both backed by unbounded
 * {@link LinkedBlockingQueue}s.
 * <ul>
 *   <li>Idle: the loop blocks on the request queue.</li>
 *   <li>Playing: the loop drains all pending requests, then makes one
 *       non-blocking frame poll, sleeping for the poll interval when no frame
 *       was ready.</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   controller.start()                 opens the camera on the control thread
 *   controller.submit(...)             enqueues a request
 *   controller.requestClose()          enqueues close_cam
 *   controller.join(timeout)           waits for the control thread
 * </pre>
 *
 * A session always ends with {@link CameraEvent.CameraClosed}, whether it was
 * closed on request, by a driver fault, or never managed to open.
 */
public final class CameraController
{
    private static final Logger log = LoggerFactory.getLogger(CameraController.class);

    private final String serial;
    private final CameraDriverProvider provider;
    private final CameraStateReducer reducer;
    private final Duration pollInterval;
    private final CameraObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final BlockingQueue<CameraRequest> requests = new LinkedBlockingQueue<>();
    private final BlockingQueue<CameraEvent> events = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile CameraSessionState state;
    private volatile Thread controlThread;

    // control thread only
    private CameraDriver driver;

    public CameraController(String serial,
                            CameraDriverProvider provider,
                            Duration pollInterval,
                            CameraObservabilitySink observabilitySink)
    {
        this(serial, provider, new CameraStateReducer(), pollInterval, observabilitySink, SystemWallClock.INSTANCE);
    }

    public CameraController(String serial,
                            CameraDriverProvider provider,
                            CameraStateReducer reducer,
                            Duration pollInterval,
                            CameraObservabilitySink observabilitySink,
                            WallClock wallClock)
    {
        this.serial = Objects.requireNonNull(serial, "serial");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, CameraObservabilitySink.NONE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        if (pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be >= 0");
        }
        this.state = CameraSessionState.closed(serial);
    }

    /**
     * Starts the control-loop thread, which immediately opens the camera.
     * Idempotent.
     */
    public void start() {
        if (started.compareAndSet(false, true)) {
            Thread t = new Thread(this::runControlLoop, "camera-control-" + serial);
            t.setDaemon(true);
            controlThread = t;
            t.start();
        }
    }

    /**
     * Enqueues a request for the control loop.
     */
    public void submit(CameraRequest request) {
        Objects.requireNonNull(request, "request");
        requests.offer(request);
    }

    /**
     * Enqueues {@code close_cam}. The session ends with {@code cam_closed}.
     */
    public void requestClose() {
        submit(new CameraRequest.CloseCamera());
    }

    /**
     * Moves all pending events into {@code sink}, in emission order.
     *
     * @return number of events moved
     */
    public int drainEvents(Collection<? super CameraEvent> sink) {
        return events.drainTo(sink);
    }

    /**
     * Moves requests the control loop never consumed into {@code sink}. Only
     * meaningful once the control thread has terminated.
     *
     * @return number of requests moved
     */
    public int drainPendingRequests(Collection<? super CameraRequest> sink) {
        return requests.drainTo(sink);
    }

    /**
     * Waits for the control thread to finish.
     *
     * @return {@code true} if the thread has terminated (or was never started)
     */
    public boolean join(Duration timeout) throws InterruptedException {
        Thread t = controlThread;
        if (t == null) {
            return true;
        }
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    public String serial() {
        return serial;
    }

    /**
     * Latest session state. Safe to call from any thread.
     */
    public CameraSessionState currentState() {
        return state;
    }

    // ---------------------------------------------------------------------
    // Control loop
    // ---------------------------------------------------------------------

    private void runControlLoop() {
        try {
            apply(new CameraRequest.OpenCamera(serial));

            while (state.isOpen()) {
                if (state.isPlaying()) {
                    CameraRequest next;
                    while (state.isPlaying() && (next = requests.poll()) != null) {
                        apply(next);
                    }
                    if (state.isPlaying()) {
                        pollFrame();
                    }
                }
                else {
                    apply(requests.take());
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Control loop for camera {} interrupted; closing session", serial);
        }
        catch (DriverException | RuntimeException e) {
            emit(CameraEvent.CameraFault.from(e));
            observabilitySink.onError(new CameraErrorEvent(
                    wallClock.now(),
                    "Camera " + serial + " failed; closing session",
                    e));
        }
        finally {
            teardown();
            state = state.withPhase(CameraSessionState.Phase.CLOSED);
            emit(new CameraEvent.CameraClosed());
        }
    }

    private void apply(CameraRequest request) throws DriverException {
        CameraSessionState oldState = state;
        CameraStateReducer.Result result = reducer.apply(oldState, request);
        state = result.newState();

        observabilitySink.onStateTransition(new CameraStateTransitionEvent(
                wallClock.now(),
                oldState,
                result.newState(),
                request,
                result.intents()));

        execute(result.intents());
    }

    private void execute(CameraIntents intents) throws DriverException {
        for (CameraIntents.Kind kind : intents.kinds()) {
            switch (kind) {
                case OPEN -> openCamera();
                case WRITE_SETTINGS -> writeSettings(intents);
                case DISARM -> {
                    driver.disarm();
                    emit(new CameraEvent.PlayingChanged(false));
                }
                case CLOSE -> {
                    CameraDriver d = driver;
                    driver = null;
                    d.dispose();
                }
                case ARM -> driver.arm();
                case SOFTWARE_TRIGGER -> driver.issueSoftwareTrigger();
                case REJECT -> emit(CameraEvent.CameraFault.rejected(intents.rejection().orElse("")));
            }
        }

        if (intents.contains(CameraIntents.Kind.ARM)) {
            emit(new CameraEvent.PlayingChanged(true));
        }
    }

    private void openCamera() throws DriverException {
        driver = provider.open(serial);
        CameraSettings settings = driver.readSettings();
        state = state.withSettings(settings);

        emit(new CameraEvent.SettingsSnapshot(settings.toWire()));
        emit(new CameraEvent.CameraOpened());
    }

    private void writeSettings(CameraIntents intents) throws DriverException {
        CameraSettings.Builder updated = state.settings().toBuilder();
        Set<String> echo = new LinkedHashSet<>();
        for (SettingName name : intents.echo()) {
            echo.add(name.wireName());
        }

        for (SettingWrite write : intents.writes()) {
            Map<SettingName, Object> applied = driver.writeSetting(write.name(), write.value());
            for (Map.Entry<SettingName, Object> entry : applied.entrySet()) {
                updated.set(entry.getKey(), entry.getValue());
                echo.add(entry.getKey().wireName());
            }
        }

        CameraSettings settings = updated.build();
        state = state.withSettings(settings);
        emit(new CameraEvent.SettingChanged(settings.toWire(echo)));
    }

    private void pollFrame() throws DriverException, InterruptedException {
        Optional<FrameEnvelope> frame = driver.pollFrame();
        if (frame.isPresent()) {
            emit(new CameraEvent.ImageCaptured(frame.get()));
        }
        else if (!pollInterval.isZero()) {
            TimeUnit.NANOSECONDS.sleep(pollInterval.toNanos());
        }
    }

    /**
     * Disarms and releases whatever is left of the driver. Failures are
     * logged only; the session is ending either way.
     */
    private void teardown() {
        CameraDriver d = driver;
        driver = null;
        if (d == null) {
            return;
        }

        try {
            if (d.isArmed()) {
                d.disarm();
            }
        }
        catch (DriverException | RuntimeException e) {
            log.warn("Failed to disarm camera {} during teardown", serial, e);
        }
        try {
            d.dispose();
        }
        catch (DriverException | RuntimeException e) {
            log.warn("Failed to dispose camera {} during teardown", serial, e);
        }
    }

    private void emit(CameraEvent event) {
        events.offer(event);
    }
}
