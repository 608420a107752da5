package com.questrail.isocam.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the camera service.
 */
public record CameraErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
