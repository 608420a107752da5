package com.questrail.isocam.controller;

import com.questrail.isocam.api.CameraSettings;

import java.util.Objects;

/**
 * CameraSessionState
 * -----------------------------------------------------------------------------
 * Immutable state of the camera session owned by one controller.
 *
 * <p>The serial is fixed for the lifetime of a controller; the phase and the
 * settings snapshot change as requests are applied. Settings are only
 * meaningful once the camera has been opened.</p>
 */
public record CameraSessionState(String serial, Phase phase, CameraSettings settings)
{
    public enum Phase {
        /** No camera open (before open, and after close or a driver fault). */
        CLOSED,

        /** Camera open, not acquiring. Every setting may be written. */
        OPEN,

        /** Camera armed and producing frames. Only play settings may be written. */
        PLAYING
    }

    public CameraSessionState {
        Objects.requireNonNull(serial, "serial");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(settings, "settings");
    }

    public static CameraSessionState closed(String serial) {
        return new CameraSessionState(serial, Phase.CLOSED, CameraSettings.defaults());
    }

    public boolean isOpen() {
        return phase != Phase.CLOSED;
    }

    public boolean isPlaying() {
        return phase == Phase.PLAYING;
    }

    public CameraSessionState withPhase(Phase phase) {
        return new CameraSessionState(serial, phase, settings);
    }

    public CameraSessionState withSettings(CameraSettings settings) {
        return new CameraSessionState(serial, phase, settings);
    }
}
