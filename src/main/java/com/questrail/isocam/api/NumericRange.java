package com.questrail.isocam.api;

import java.util.List;

/**
 * Inclusive {@code [min, max]} range advertised by the camera for a numeric
 * setting.
 */
public record NumericRange(double min, double max)
{
    public NumericRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("invalid range [" + min + ", " + max + "]");
        }
    }

    public static NumericRange of(double min, double max) {
        return new NumericRange(min, max);
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    /** Clamps and rounds toward zero, as integer-valued settings require. */
    public int clampToInt(double value) {
        return (int) clamp(value);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /** Wire form: {@code [min, max]}. */
    public List<Double> toWire() {
        return List.of(min, max);
    }
}
