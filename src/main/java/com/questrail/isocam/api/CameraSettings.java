package com.questrail.isocam.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CameraSettings
 * =============================================================================
 * Immutable snapshot of a camera's configuration: every recognized setting as
 * a typed field, plus the ranges and capabilities that bound them.
 *
 * <h2>Role in the architecture</h2>
 * This is the single settings schema shared by both sides of the connection.
 * The worker builds it from the driver and publishes it as a wire map; the
 * client merges received maps into its own copy. Neither side subclasses or
 * mutates it.
 *
 * <h2>Wire form</h2>
 * {@link #toWire()} produces an ordered map keyed by wire names
 * ({@code exposure_ms}, {@code exposure_range}, ...). Ranges are two-element
 * sequences, {@code sensor_size} is {@code [width, height]} and
 * {@code color_gain} is {@code [r, g, b]}.
 *
 * <h2>Merging</h2>
 * {@link #merge(Map)} applies a partial wire map and reports which keys
 * actually changed. Unknown keys are ignored so that a newer worker can
 * publish fields an older client does not know.
 */
public final class CameraSettings
{
    public static final String EXPOSURE_RANGE = "exposure_range";
    public static final String BINNING_X_RANGE = "binning_x_range";
    public static final String BINNING_Y_RANGE = "binning_y_range";
    public static final String GAIN_RANGE = "gain_range";
    public static final String BLACK_LEVEL_RANGE = "black_level_range";
    public static final String SENSOR_SIZE = "sensor_size";
    public static final String SUPPORTED_FREQS = "supported_freqs";
    public static final String SUPPORTED_TAPS = "supported_taps";
    public static final String SUPPORTS_COLOR = "supports_color";

    private static final List<String> KEYS = List.of(
            SettingName.EXPOSURE_MS.wireName(), EXPOSURE_RANGE,
            SettingName.BINNING_X.wireName(), BINNING_X_RANGE,
            SettingName.BINNING_Y.wireName(), BINNING_Y_RANGE,
            SENSOR_SIZE,
            SettingName.ROI_X.wireName(), SettingName.ROI_Y.wireName(),
            SettingName.ROI_WIDTH.wireName(), SettingName.ROI_HEIGHT.wireName(),
            SettingName.FRAME_QUEUE_SIZE.wireName(),
            SettingName.TRIGGER_TYPE.wireName(), SettingName.TRIGGER_COUNT.wireName(),
            SettingName.GAIN.wireName(), GAIN_RANGE,
            SettingName.BLACK_LEVEL.wireName(), BLACK_LEVEL_RANGE,
            SUPPORTED_FREQS, SettingName.FREQ.wireName(),
            SUPPORTED_TAPS, SettingName.TAPS.wireName(),
            SUPPORTS_COLOR, SettingName.COLOR_GAIN.wireName());

    /**
     * Result of {@link #merge(Map)}.
     *
     * @param settings the merged snapshot
     * @param changed  wire keys whose value differs from the previous snapshot
     */
    public record MergeResult(CameraSettings settings, Set<String> changed) {
        public MergeResult {
            Objects.requireNonNull(settings, "settings");
            changed = Collections.unmodifiableSet(new LinkedHashSet<>(changed));
        }
    }

    private final double exposureMs;
    private final NumericRange exposureRange;
    private final int binningX;
    private final NumericRange binningXRange;
    private final int binningY;
    private final NumericRange binningYRange;
    private final SensorSize sensorSize;
    private final int roiX;
    private final int roiY;
    private final int roiWidth;
    private final int roiHeight;
    private final int frameQueueSize;
    private final TriggerType triggerType;
    private final int triggerCount;
    private final int gain;
    private final NumericRange gainRange;
    private final int blackLevel;
    private final NumericRange blackLevelRange;
    private final List<String> supportedFreqs;
    private final String freq;
    private final List<String> supportedTaps;
    private final String taps;
    private final boolean supportsColor;
    private final ColorGain colorGain;

    private CameraSettings(Builder b) {
        this.exposureMs = b.exposureMs;
        this.exposureRange = Objects.requireNonNull(b.exposureRange, "exposureRange");
        this.binningX = b.binningX;
        this.binningXRange = Objects.requireNonNull(b.binningXRange, "binningXRange");
        this.binningY = b.binningY;
        this.binningYRange = Objects.requireNonNull(b.binningYRange, "binningYRange");
        this.sensorSize = Objects.requireNonNull(b.sensorSize, "sensorSize");
        this.roiX = b.roiX;
        this.roiY = b.roiY;
        this.roiWidth = b.roiWidth;
        this.roiHeight = b.roiHeight;
        this.frameQueueSize = b.frameQueueSize;
        this.triggerType = Objects.requireNonNull(b.triggerType, "triggerType");
        this.triggerCount = b.triggerCount;
        this.gain = b.gain;
        this.gainRange = Objects.requireNonNull(b.gainRange, "gainRange");
        this.blackLevel = b.blackLevel;
        this.blackLevelRange = Objects.requireNonNull(b.blackLevelRange, "blackLevelRange");
        this.supportedFreqs = List.copyOf(b.supportedFreqs);
        this.freq = Objects.requireNonNull(b.freq, "freq");
        this.supportedTaps = List.copyOf(b.supportedTaps);
        this.taps = Objects.requireNonNull(b.taps, "taps");
        this.supportsColor = b.supportsColor;
        this.colorGain = Objects.requireNonNull(b.colorGain, "colorGain");
    }

    /**
     * Settings of a camera nobody has read yet: a single-tap 20 MHz mono
     * sensor of size zero with software triggering.
     */
    public static CameraSettings defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Builds a snapshot from a complete or partial wire map, starting from
     * {@link #defaults()}.
     *
     * @throws IllegalArgumentException if a known key carries a malformed value
     */
    public static CameraSettings fromWire(Map<String, ?> wire) {
        return defaults().merge(wire).settings();
    }

    /** Wire keys in publication order. */
    public static List<String> wireKeys() {
        return KEYS;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public double exposureMs() { return exposureMs; }
    public NumericRange exposureRange() { return exposureRange; }
    public int binningX() { return binningX; }
    public NumericRange binningXRange() { return binningXRange; }
    public int binningY() { return binningY; }
    public NumericRange binningYRange() { return binningYRange; }
    public SensorSize sensorSize() { return sensorSize; }
    public int roiX() { return roiX; }
    public int roiY() { return roiY; }
    public int roiWidth() { return roiWidth; }
    public int roiHeight() { return roiHeight; }
    public int frameQueueSize() { return frameQueueSize; }
    public TriggerType triggerType() { return triggerType; }
    public int triggerCount() { return triggerCount; }
    public int gain() { return gain; }
    public NumericRange gainRange() { return gainRange; }
    public int blackLevel() { return blackLevel; }
    public NumericRange blackLevelRange() { return blackLevelRange; }
    public List<String> supportedFreqs() { return supportedFreqs; }
    public String freq() { return freq; }
    public List<String> supportedTaps() { return supportedTaps; }
    public String taps() { return taps; }
    public boolean supportsColor() { return supportsColor; }
    public ColorGain colorGain() { return colorGain; }

    /**
     * Returns the typed value of a writable setting, of type
     * {@link SettingName#valueType()}.
     */
    public Object value(SettingName name) {
        Objects.requireNonNull(name, "name");
        return switch (name) {
            case EXPOSURE_MS -> exposureMs;
            case BINNING_X -> binningX;
            case BINNING_Y -> binningY;
            case ROI_X -> roiX;
            case ROI_Y -> roiY;
            case ROI_WIDTH -> roiWidth;
            case ROI_HEIGHT -> roiHeight;
            case TRIGGER_TYPE -> triggerType;
            case TRIGGER_COUNT -> triggerCount;
            case FRAME_QUEUE_SIZE -> frameQueueSize;
            case GAIN -> gain;
            case BLACK_LEVEL -> blackLevel;
            case FREQ -> freq;
            case TAPS -> taps;
            case COLOR_GAIN -> colorGain;
        };
    }

    /**
     * Returns a copy with one writable setting replaced by a typed value.
     */
    public CameraSettings with(SettingName name, Object value) {
        return toBuilder().set(name, value).build();
    }

    /**
     * Returns the wire representation of a single key.
     *
     * @throws IllegalArgumentException for an unknown key
     */
    public Object wireValue(String key) {
        Objects.requireNonNull(key, "key");
        return switch (key) {
            case "exposure_ms" -> exposureMs;
            case EXPOSURE_RANGE -> exposureRange.toWire();
            case "binning_x" -> binningX;
            case BINNING_X_RANGE -> binningXRange.toWire();
            case "binning_y" -> binningY;
            case BINNING_Y_RANGE -> binningYRange.toWire();
            case SENSOR_SIZE -> sensorSize.toWire();
            case "roi_x" -> roiX;
            case "roi_y" -> roiY;
            case "roi_width" -> roiWidth;
            case "roi_height" -> roiHeight;
            case "frame_queue_size" -> frameQueueSize;
            case "trigger_type" -> triggerType.wireName();
            case "trigger_count" -> triggerCount;
            case "gain" -> gain;
            case GAIN_RANGE -> gainRange.toWire();
            case "black_level" -> blackLevel;
            case BLACK_LEVEL_RANGE -> blackLevelRange.toWire();
            case SUPPORTED_FREQS -> supportedFreqs;
            case "freq" -> freq;
            case SUPPORTED_TAPS -> supportedTaps;
            case "taps" -> taps;
            case SUPPORTS_COLOR -> supportsColor;
            case "color_gain" -> colorGain.toWire();
            default -> throw new IllegalArgumentException("Unknown setting key: " + key);
        };
    }

    /**
     * Full wire map, in publication order.
     */
    public Map<String, Object> toWire() {
        return toWire(KEYS);
    }

    /**
     * Wire map restricted to {@code keys}, in the order given.
     */
    public Map<String, Object> toWire(Collection<String> keys) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : keys) {
            out.put(key, wireValue(key));
        }
        return out;
    }

    /**
     * Applies a partial wire map.
     *
     * @throws IllegalArgumentException if a known key carries a malformed value
     */
    public MergeResult merge(Map<String, ?> wire) {
        Objects.requireNonNull(wire, "wire");

        Builder builder = toBuilder();
        List<String> touched = new ArrayList<>();
        for (Map.Entry<String, ?> entry : wire.entrySet()) {
            if (KEYS.contains(entry.getKey())) {
                builder.setWire(entry.getKey(), entry.getValue());
                touched.add(entry.getKey());
            }
        }

        CameraSettings merged = builder.build();
        Set<String> changed = new LinkedHashSet<>();
        for (String key : touched) {
            if (!Objects.equals(wireValue(key), merged.wireValue(key))) {
                changed.add(key);
            }
        }
        return new MergeResult(merged, changed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CameraSettings other && toWire().equals(other.toWire());
    }

    @Override
    public int hashCode() {
        return toWire().hashCode();
    }

    @Override
    public String toString() {
        return "CameraSettings" + toWire();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private double exposureMs = 5;
        private NumericRange exposureRange = NumericRange.of(0, 100);
        private int binningX;
        private NumericRange binningXRange = NumericRange.of(0, 0);
        private int binningY;
        private NumericRange binningYRange = NumericRange.of(0, 0);
        private SensorSize sensorSize = new SensorSize(0, 0);
        private int roiX;
        private int roiY;
        private int roiWidth;
        private int roiHeight;
        private int frameQueueSize = 1;
        private TriggerType triggerType = TriggerType.SOFTWARE;
        private int triggerCount = 1;
        private int gain;
        private NumericRange gainRange = NumericRange.of(0, 100);
        private int blackLevel;
        private NumericRange blackLevelRange = NumericRange.of(0, 100);
        private List<String> supportedFreqs = List.of("20 MHz");
        private String freq = "20 MHz";
        private List<String> supportedTaps = List.of("1");
        private String taps = "1";
        private boolean supportsColor;
        private ColorGain colorGain = ColorGain.UNITY;

        private Builder() {}

        private Builder(CameraSettings s) {
            this.exposureMs = s.exposureMs;
            this.exposureRange = s.exposureRange;
            this.binningX = s.binningX;
            this.binningXRange = s.binningXRange;
            this.binningY = s.binningY;
            this.binningYRange = s.binningYRange;
            this.sensorSize = s.sensorSize;
            this.roiX = s.roiX;
            this.roiY = s.roiY;
            this.roiWidth = s.roiWidth;
            this.roiHeight = s.roiHeight;
            this.frameQueueSize = s.frameQueueSize;
            this.triggerType = s.triggerType;
            this.triggerCount = s.triggerCount;
            this.gain = s.gain;
            this.gainRange = s.gainRange;
            this.blackLevel = s.blackLevel;
            this.blackLevelRange = s.blackLevelRange;
            this.supportedFreqs = s.supportedFreqs;
            this.freq = s.freq;
            this.supportedTaps = s.supportedTaps;
            this.taps = s.taps;
            this.supportsColor = s.supportsColor;
            this.colorGain = s.colorGain;
        }

        public Builder exposureMs(double v) { this.exposureMs = v; return this; }
        public Builder exposureRange(NumericRange v) { this.exposureRange = v; return this; }
        public Builder binningX(int v) { this.binningX = v; return this; }
        public Builder binningXRange(NumericRange v) { this.binningXRange = v; return this; }
        public Builder binningY(int v) { this.binningY = v; return this; }
        public Builder binningYRange(NumericRange v) { this.binningYRange = v; return this; }
        public Builder sensorSize(SensorSize v) { this.sensorSize = v; return this; }
        public Builder roiX(int v) { this.roiX = v; return this; }
        public Builder roiY(int v) { this.roiY = v; return this; }
        public Builder roiWidth(int v) { this.roiWidth = v; return this; }
        public Builder roiHeight(int v) { this.roiHeight = v; return this; }
        public Builder frameQueueSize(int v) { this.frameQueueSize = v; return this; }
        public Builder triggerType(TriggerType v) { this.triggerType = v; return this; }
        public Builder triggerCount(int v) { this.triggerCount = v; return this; }
        public Builder gain(int v) { this.gain = v; return this; }
        public Builder gainRange(NumericRange v) { this.gainRange = v; return this; }
        public Builder blackLevel(int v) { this.blackLevel = v; return this; }
        public Builder blackLevelRange(NumericRange v) { this.blackLevelRange = v; return this; }
        public Builder supportedFreqs(List<String> v) { this.supportedFreqs = List.copyOf(v); return this; }
        public Builder freq(String v) { this.freq = v; return this; }
        public Builder supportedTaps(List<String> v) { this.supportedTaps = List.copyOf(v); return this; }
        public Builder taps(String v) { this.taps = v; return this; }
        public Builder supportsColor(boolean v) { this.supportsColor = v; return this; }
        public Builder colorGain(ColorGain v) { this.colorGain = v; return this; }

        /**
         * Sets a writable setting from a typed value.
         *
         * @throws ClassCastException if {@code value} is not of the setting's value type
         */
        public Builder set(SettingName name, Object value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            switch (name) {
                case EXPOSURE_MS -> exposureMs(((Number) value).doubleValue());
                case BINNING_X -> binningX(((Number) value).intValue());
                case BINNING_Y -> binningY(((Number) value).intValue());
                case ROI_X -> roiX(((Number) value).intValue());
                case ROI_Y -> roiY(((Number) value).intValue());
                case ROI_WIDTH -> roiWidth(((Number) value).intValue());
                case ROI_HEIGHT -> roiHeight(((Number) value).intValue());
                case TRIGGER_TYPE -> triggerType((TriggerType) value);
                case TRIGGER_COUNT -> triggerCount(((Number) value).intValue());
                case FRAME_QUEUE_SIZE -> frameQueueSize(((Number) value).intValue());
                case GAIN -> gain(((Number) value).intValue());
                case BLACK_LEVEL -> blackLevel(((Number) value).intValue());
                case FREQ -> freq((String) value);
                case TAPS -> taps((String) value);
                case COLOR_GAIN -> colorGain((ColorGain) value);
            }
            return this;
        }

        /**
         * Sets any known key from its wire representation.
         *
         * @throws IllegalArgumentException for an unknown key or malformed value
         */
        public Builder setWire(String key, Object value) {
            switch (key) {
                case "exposure_ms" -> exposureMs(number(key, value));
                case EXPOSURE_RANGE -> exposureRange(range(key, value));
                case "binning_x" -> binningX(integer(key, value));
                case BINNING_X_RANGE -> binningXRange(range(key, value));
                case "binning_y" -> binningY(integer(key, value));
                case BINNING_Y_RANGE -> binningYRange(range(key, value));
                case SENSOR_SIZE -> {
                    List<?> pair = sequence(key, value, 2);
                    sensorSize(new SensorSize(integer(key, pair.get(0)), integer(key, pair.get(1))));
                }
                case "roi_x" -> roiX(integer(key, value));
                case "roi_y" -> roiY(integer(key, value));
                case "roi_width" -> roiWidth(integer(key, value));
                case "roi_height" -> roiHeight(integer(key, value));
                case "frame_queue_size" -> frameQueueSize(integer(key, value));
                case "trigger_type" -> triggerType(TriggerType.fromWireName(string(key, value))
                        .orElseThrow(() -> new IllegalArgumentException("Unknown trigger type: " + value)));
                case "trigger_count" -> triggerCount(integer(key, value));
                case "gain" -> gain(integer(key, value));
                case GAIN_RANGE -> gainRange(range(key, value));
                case "black_level" -> blackLevel(integer(key, value));
                case BLACK_LEVEL_RANGE -> blackLevelRange(range(key, value));
                case SUPPORTED_FREQS -> supportedFreqs(strings(key, value));
                case "freq" -> freq(string(key, value));
                case SUPPORTED_TAPS -> supportedTaps(strings(key, value));
                case "taps" -> taps(string(key, value));
                case SUPPORTS_COLOR -> {
                    if (!(value instanceof Boolean b)) {
                        throw malformed(key, value);
                    }
                    supportsColor(b);
                }
                case "color_gain" -> {
                    List<?> rgb = sequence(key, value, 3);
                    colorGain(new ColorGain(number(key, rgb.get(0)), number(key, rgb.get(1)), number(key, rgb.get(2))));
                }
                default -> throw new IllegalArgumentException("Unknown setting key: " + key);
            }
            return this;
        }

        public CameraSettings build() {
            return new CameraSettings(this);
        }

        private static double number(String key, Object value) {
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            throw malformed(key, value);
        }

        private static int integer(String key, Object value) {
            return (int) number(key, value);
        }

        private static String string(String key, Object value) {
            if (value == null) {
                return "";
            }
            if (value instanceof String s) {
                return s;
            }
            throw malformed(key, value);
        }

        private static NumericRange range(String key, Object value) {
            List<?> pair = sequence(key, value, 2);
            return NumericRange.of(number(key, pair.get(0)), number(key, pair.get(1)));
        }

        private static List<String> strings(String key, Object value) {
            if (!(value instanceof List<?> list)) {
                throw malformed(key, value);
            }
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(string(key, item));
            }
            return out;
        }

        private static List<?> sequence(String key, Object value, int size) {
            if (value instanceof List<?> list && list.size() == size) {
                return list;
            }
            throw malformed(key, value);
        }

        private static IllegalArgumentException malformed(String key, Object value) {
            return new IllegalArgumentException("Malformed value for " + key + ": " + value);
        }
    }
}
