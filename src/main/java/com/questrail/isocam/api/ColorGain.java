package com.questrail.isocam.api;

import java.util.List;

/**
 * Per-channel gain applied by the color pipeline of color sensors.
 */
public record ColorGain(double red, double green, double blue)
{
    public static final ColorGain UNITY = new ColorGain(1, 1, 1);

    public List<Double> toWire() {
        return List.of(red, green, blue);
    }
}
