package com.questrail.isocam.observability;

import com.questrail.isocam.controller.CameraIntents;
import com.questrail.isocam.controller.CameraSessionState;
import com.questrail.isocam.protocol.model.CameraRequest;

import java.time.Instant;

/**
 * Record representing one request applied by the camera controller.
 */
public record CameraStateTransitionEvent(
    Instant timestamp,
    CameraSessionState oldState,
    CameraSessionState newState,
    CameraRequest triggeringRequest,
    CameraIntents resultingIntents
) {
    /**
     * Checks if the session phase changed during this transition.
     */
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }
}
