package com.questrail.isocam.client;

import com.questrail.isocam.protocol.model.CameraEvent;

/**
 * Application-facing callback of the supervisor.
 *
 * <p>Callbacks are made from the supervisor's client thread, in the order the
 * worker emitted the events. Implementations should return quickly.</p>
 */
public interface CameraEventListener
{
    void onEvent(CameraEvent event);

    /**
     * The connection to the worker is up; queued requests start flowing.
     */
    default void onConnected() {}

    /**
     * The connection to the worker is gone.
     *
     * @param cause {@code null} after an orderly shutdown
     */
    default void onConnectionClosed(Throwable cause) {}

    /**
     * The worker process has exited.
     */
    default void onProcessExited(int exitCode) {}
}
