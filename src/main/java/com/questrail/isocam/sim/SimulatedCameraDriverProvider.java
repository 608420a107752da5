package com.questrail.isocam.sim;

import com.questrail.isocam.api.CameraDriver;
import com.questrail.isocam.api.CameraDriverProvider;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.api.SensorSize;
import com.questrail.isocam.time.MonotonicClock;
import com.questrail.isocam.time.SystemMonotonicClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SimulatedCameraDriverProvider
 * =============================================================================
 * In-memory camera driver used when the worker is started with the
 * {@code simulated} driver path, and by the tests.
 *
 * <p>Cameras are identified by a fixed list of serials. Each
 * {@link #open(String)} returns a fresh {@link SimulatedCameraDriver}.</p>
 *
 * <h2>Failure injection</h2>
 * {@link Builder#failOn(Operation, int)} makes the {@code n+1}-th call of an
 * operation (counted across every driver this provider opened) throw a
 * {@link DriverException}. Later calls succeed again.
 */
public final class SimulatedCameraDriverProvider implements CameraDriverProvider
{
    private static final Logger log = LoggerFactory.getLogger(SimulatedCameraDriverProvider.class);

    public static final List<String> DEFAULT_SERIALS = List.of("SIM00002", "SIM00001");
    public static final SensorSize DEFAULT_SENSOR = new SensorSize(64, 48);

    /** Driver operations that can be made to fail. */
    public enum Operation {
        DISCOVER,
        OPEN,
        READ_SETTINGS,
        WRITE_SETTING,
        ARM,
        TRIGGER,
        DISARM,
        POLL,
        DISPOSE
    }

    private final List<String> serials;
    private final SensorSize sensorSize;
    private final boolean color;
    private final MonotonicClock clock;
    private final Map<Operation, Integer> failures;
    private final Map<Operation, AtomicInteger> calls = new EnumMap<>(Operation.class);
    private final AtomicInteger openCount = new AtomicInteger();

    private volatile SimulatedCameraDriver lastOpened;

    public SimulatedCameraDriverProvider() {
        this(builder());
    }

    private SimulatedCameraDriverProvider(Builder builder) {
        this.serials = List.copyOf(builder.serials);
        this.sensorSize = builder.sensorSize;
        this.color = builder.color;
        this.clock = builder.clock;
        this.failures = new EnumMap<>(builder.failures);
        for (Operation op : Operation.values()) {
            calls.put(op, new AtomicInteger());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String name() {
        return "simulated";
    }

    @Override
    public List<String> discoverSerials() throws DriverException {
        check(Operation.DISCOVER);
        return serials;
    }

    @Override
    public CameraDriver open(String serial) throws DriverException {
        Objects.requireNonNull(serial, "serial");
        check(Operation.OPEN);
        if (!serials.contains(serial)) {
            throw new DriverException("No camera with serial " + serial);
        }

        SimulatedCameraDriver driver = new SimulatedCameraDriver(serial, sensorSize, color, clock, this);
        openCount.incrementAndGet();
        lastOpened = driver;
        log.debug("Opened simulated camera {}", serial);
        return driver;
    }

    /**
     * The driver returned by the most recent successful {@link #open(String)}.
     */
    public Optional<SimulatedCameraDriver> lastOpened() {
        return Optional.ofNullable(lastOpened);
    }

    public int openCount() {
        return openCount.get();
    }

    /**
     * Number of times {@code op} has been attempted, failed attempts included.
     */
    public int callCount(Operation op) {
        return calls.get(op).get();
    }

    void check(Operation op) throws DriverException {
        int call = calls.get(op).getAndIncrement();
        Integer failAt = failures.get(op);
        if (failAt != null && failAt == call) {
            throw new DriverException("Simulated " + op.name().toLowerCase() + " failure");
        }
    }

    public static final class Builder {
        private List<String> serials = DEFAULT_SERIALS;
        private SensorSize sensorSize = DEFAULT_SENSOR;
        private boolean color;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private final Map<Operation, Integer> failures = new EnumMap<>(Operation.class);

        private Builder() {}

        public Builder withSerials(List<String> serials) {
            this.serials = List.copyOf(serials);
            return this;
        }

        public Builder withSensorSize(int width, int height) {
            this.sensorSize = new SensorSize(width, height);
            return this;
        }

        public Builder withColor(boolean color) {
            this.color = color;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Fails the call of {@code op} that follows {@code succeedingCalls}
         * successful ones.
         */
        public Builder failOn(Operation op, int succeedingCalls) {
            if (succeedingCalls < 0) {
                throw new IllegalArgumentException("succeedingCalls must be >= 0");
            }
            failures.put(Objects.requireNonNull(op, "op"), succeedingCalls);
            return this;
        }

        public SimulatedCameraDriverProvider build() {
            return new SimulatedCameraDriverProvider(this);
        }
    }
}
