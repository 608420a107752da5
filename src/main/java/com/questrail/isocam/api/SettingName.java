package com.questrail.isocam.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * SettingName
 * -----------------------------------------------------------------------------
 * The writable camera settings.
 *
 * <p>All constants together form the set of settings accepted while the camera
 * is open and idle. The subset flagged {@code playable} may also be written
 * while frames are being acquired.</p>
 */
public enum SettingName
{
    EXPOSURE_MS("exposure_ms", Double.class, true),
    BINNING_X("binning_x", Integer.class, false),
    BINNING_Y("binning_y", Integer.class, false),
    ROI_X("roi_x", Integer.class, false),
    ROI_Y("roi_y", Integer.class, false),
    ROI_WIDTH("roi_width", Integer.class, false),
    ROI_HEIGHT("roi_height", Integer.class, false),
    TRIGGER_TYPE("trigger_type", TriggerType.class, false),
    TRIGGER_COUNT("trigger_count", Integer.class, false),
    FRAME_QUEUE_SIZE("frame_queue_size", Integer.class, false),
    GAIN("gain", Integer.class, true),
    BLACK_LEVEL("black_level", Integer.class, true),
    FREQ("freq", String.class, false),
    TAPS("taps", String.class, false),
    COLOR_GAIN("color_gain", ColorGain.class, true);

    private static final Set<SettingName> PLAY_SETTINGS;

    static {
        EnumSet<SettingName> play = EnumSet.noneOf(SettingName.class);
        for (SettingName name : values()) {
            if (name.playable) {
                play.add(name);
            }
        }
        PLAY_SETTINGS = Collections.unmodifiableSet(play);
    }

    private final String wireName;
    private final Class<?> valueType;
    private final boolean playable;

    SettingName(String wireName, Class<?> valueType, boolean playable) {
        this.wireName = wireName;
        this.valueType = valueType;
        this.playable = playable;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Java type of values exchanged with the driver for this setting.
     */
    public Class<?> valueType() {
        return valueType;
    }

    public boolean playable() {
        return playable;
    }

    public static Optional<SettingName> fromWireName(String name) {
        for (SettingName setting : values()) {
            if (setting.wireName.equals(name)) {
                return Optional.of(setting);
            }
        }
        return Optional.empty();
    }

    /** Settings that may be written while the camera is open and idle. */
    public static Set<SettingName> allSettings() {
        return Collections.unmodifiableSet(EnumSet.allOf(SettingName.class));
    }

    /** Settings that may be written while the camera is playing. */
    public static Set<SettingName> playSettings() {
        return PLAY_SETTINGS;
    }
}
