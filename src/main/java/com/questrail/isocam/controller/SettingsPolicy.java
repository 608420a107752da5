package com.questrail.isocam.controller;

import com.questrail.isocam.api.CameraSettings;
import com.questrail.isocam.api.ColorGain;
import com.questrail.isocam.api.NumericRange;
import com.questrail.isocam.api.SettingName;
import com.questrail.isocam.api.TriggerType;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SettingsPolicy
 * -----------------------------------------------------------------------------
 * Validates a setting write request against the current session and turns it
 * into the driver writes to perform.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Unknown names are rejected. While playing, only play settings are
 *       accepted.</li>
 *   <li>{@code exposure_ms}, {@code gain}, {@code black_level},
 *       {@code binning_x} and {@code binning_y} are clamped to their
 *       advertised range; all but exposure are integers.</li>
 *   <li>{@code roi_x} is clamped to the sensor; if the ROI would then extend
 *       past the sensor edge, {@code roi_width} is shrunk first. Both are
 *       echoed. {@code roi_width} is clamped to
 *       {@code [1, sensor_width - roi_x]} and echoed with {@code roi_x}.
 *       The Y axis is symmetric.</li>
 *   <li>{@code trigger_count >= 0}, {@code frame_queue_size >= 1}.</li>
 *   <li>{@code trigger_type}, {@code freq} and {@code taps} must be one of
 *       the supported values.</li>
 *   <li>{@code color_gain} is three numbers and requires a color sensor.</li>
 * </ul>
 *
 * This class is pure and stateless.
 */
public final class SettingsPolicy
{
    /**
     * Validates one write request.
     *
     * @param settings current settings of the open camera
     * @param playing  whether the camera is currently playing
     * @param name     requested setting, as received
     * @param value    requested value, in wire form
     */
    public SettingValidation validate(CameraSettings settings, boolean playing, String name, Object value) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(name, "name");

        Optional<SettingName> known = SettingName.fromWireName(name);
        if (known.isEmpty()) {
            return reject("Setting \"" + name + "\" is not recognized");
        }

        SettingName setting = known.get();
        if (playing && !setting.playable()) {
            return reject("Setting \"" + name + "\" cannot be set while the camera is playing");
        }

        return switch (setting) {
            case EXPOSURE_MS -> number(value)
                    .map(v -> accept(setting, settings.exposureRange().clamp(v)))
                    .orElseGet(() -> notANumber(setting, value));
            case GAIN -> clampedInt(setting, value, settings.gainRange());
            case BLACK_LEVEL -> clampedInt(setting, value, settings.blackLevelRange());
            case BINNING_X -> clampedInt(setting, value, settings.binningXRange());
            case BINNING_Y -> clampedInt(setting, value, settings.binningYRange());
            case ROI_X -> roiOrigin(settings, value, true);
            case ROI_Y -> roiOrigin(settings, value, false);
            case ROI_WIDTH -> roiExtent(settings, value, true);
            case ROI_HEIGHT -> roiExtent(settings, value, false);
            case TRIGGER_COUNT -> number(value)
                    .map(v -> accept(setting, (int) Math.max(0, v)))
                    .orElseGet(() -> notANumber(setting, value));
            case FRAME_QUEUE_SIZE -> number(value)
                    .map(v -> accept(setting, (int) Math.max(1, v)))
                    .orElseGet(() -> notANumber(setting, value));
            case TRIGGER_TYPE -> triggerType(value);
            case FREQ -> oneOf(setting, value, settings.supportedFreqs());
            case TAPS -> oneOf(setting, value, settings.supportedTaps());
            case COLOR_GAIN -> colorGain(settings, value);
        };
    }

    // ---------------------------------------------------------------------
    // Per-setting rules
    // ---------------------------------------------------------------------

    private SettingValidation clampedInt(SettingName setting, Object value, NumericRange range) {
        return number(value)
                .map(v -> accept(setting, range.clampToInt(v)))
                .orElseGet(() -> notANumber(setting, value));
    }

    private SettingValidation roiOrigin(CameraSettings settings, Object value, boolean horizontal) {
        SettingName origin = horizontal ? SettingName.ROI_X : SettingName.ROI_Y;
        SettingName extent = horizontal ? SettingName.ROI_WIDTH : SettingName.ROI_HEIGHT;
        int sensor = horizontal ? settings.sensorSize().width() : settings.sensorSize().height();
        int currentExtent = horizontal ? settings.roiWidth() : settings.roiHeight();

        Optional<Double> requested = number(value);
        if (requested.isEmpty()) {
            return notANumber(origin, value);
        }

        int position = NumericRange.of(0, Math.max(0, sensor - 1)).clampToInt(requested.get());
        int maxExtent = Math.max(1, sensor - position);

        if (currentExtent > maxExtent) {
            return new SettingValidation.Accepted(
                    List.of(new SettingWrite(extent, maxExtent), new SettingWrite(origin, position)),
                    EnumSet.of(origin, extent));
        }
        return new SettingValidation.Accepted(
                List.of(new SettingWrite(origin, position)),
                EnumSet.of(origin, extent));
    }

    private SettingValidation roiExtent(CameraSettings settings, Object value, boolean horizontal) {
        SettingName origin = horizontal ? SettingName.ROI_X : SettingName.ROI_Y;
        SettingName extent = horizontal ? SettingName.ROI_WIDTH : SettingName.ROI_HEIGHT;
        int sensor = horizontal ? settings.sensorSize().width() : settings.sensorSize().height();
        int position = horizontal ? settings.roiX() : settings.roiY();

        Optional<Double> requested = number(value);
        if (requested.isEmpty()) {
            return notANumber(extent, value);
        }

        int size = NumericRange.of(1, Math.max(1, sensor - position)).clampToInt(requested.get());
        return new SettingValidation.Accepted(
                List.of(new SettingWrite(extent, size)),
                EnumSet.of(origin, extent));
    }

    private SettingValidation triggerType(Object value) {
        if (value instanceof String name) {
            Optional<TriggerType> type = TriggerType.fromWireName(name);
            if (type.isPresent()) {
                return accept(SettingName.TRIGGER_TYPE, type.get());
            }
        }
        return reject("Setting \"trigger_type\" does not support " + value);
    }

    private SettingValidation oneOf(SettingName setting, Object value, List<String> supported) {
        if (value instanceof String s && supported.contains(s)) {
            return accept(setting, s);
        }
        return reject("Setting \"" + setting.wireName() + "\" does not support " + value
                + "; supported: " + supported);
    }

    private SettingValidation colorGain(CameraSettings settings, Object value) {
        if (!settings.supportsColor()) {
            return reject("Setting \"color_gain\" requires a color camera");
        }
        if (value instanceof List<?> rgb && rgb.size() == 3
                && rgb.stream().allMatch(c -> c instanceof Number n && Double.isFinite(n.doubleValue()))) {
            return accept(SettingName.COLOR_GAIN, new ColorGain(
                    ((Number) rgb.get(0)).doubleValue(),
                    ((Number) rgb.get(1)).doubleValue(),
                    ((Number) rgb.get(2)).doubleValue()));
        }
        return reject("Setting \"color_gain\" expects three numbers but got " + value);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static Optional<Double> number(Object value) {
        if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
            return Optional.of(n.doubleValue());
        }
        return Optional.empty();
    }

    private static SettingValidation accept(SettingName setting, Object value) {
        return new SettingValidation.Accepted(
                List.of(new SettingWrite(setting, value)),
                EnumSet.of(setting));
    }

    private static SettingValidation notANumber(SettingName setting, Object value) {
        return reject("Setting \"" + setting.wireName() + "\" expects a number but got " + value);
    }

    private static SettingValidation reject(String reason) {
        return new SettingValidation.Rejected(reason);
    }
}
