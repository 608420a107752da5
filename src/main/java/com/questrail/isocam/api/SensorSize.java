package com.questrail.isocam.api;

import java.util.List;

/**
 * Full sensor dimensions in pixels.
 */
public record SensorSize(int width, int height)
{
    public SensorSize {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("negative sensor size " + width + "x" + height);
        }
    }

    public List<Integer> toWire() {
        return List.of(width, height);
    }
}
