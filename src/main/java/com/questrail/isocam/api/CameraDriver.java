package com.questrail.isocam.api;

import java.util.Map;
import java.util.Optional;

/**
 * CameraDriver
 * =============================================================================
 * Boundary to one opened physical camera.
 *
 * <p>The camera controller is the only caller, always from its control-loop
 * thread. Implementations need not be thread-safe. Every method may fail with
 * a {@link DriverException}; the controller then ends the session.</p>
 *
 * <p>Values passed to {@link #writeSetting(SettingName, Object)} have already
 * been validated and clamped by the controller and are of the Java type given
 * by {@link SettingName#valueType()}.</p>
 */
public interface CameraDriver
{
    /**
     * Reads the complete current configuration of the camera.
     */
    CameraSettings readSettings() throws DriverException;

    /**
     * Applies one setting.
     *
     * @return the values actually applied, keyed by setting; must contain at
     *         least {@code name}. A driver may report other settings the
     *         hardware recomputed as a side effect.
     */
    Map<SettingName, Object> writeSetting(SettingName name, Object value) throws DriverException;

    /**
     * Arms the camera for acquisition.
     */
    void arm() throws DriverException;

    /**
     * Issues a software trigger; only meaningful while armed in software
     * trigger mode.
     */
    void issueSoftwareTrigger() throws DriverException;

    /**
     * Disarms the camera.
     */
    void disarm() throws DriverException;

    boolean isArmed();

    /**
     * Non-blocking poll for the next queued frame.
     *
     * @return the next frame, or empty when none is queued
     */
    Optional<FrameEnvelope> pollFrame() throws DriverException;

    /**
     * Releases the camera. The driver is unusable afterwards.
     */
    void dispose() throws DriverException;
}
