package com.questrail.isocam.api;

import java.util.List;

/**
 * CameraDriverProvider
 * -----------------------------------------------------------------------------
 * Entry point of a vendor driver: device discovery and session opening.
 *
 * <p>Providers are located with {@link java.util.ServiceLoader} from the
 * driver directory handed to the worker process, so implementations need a
 * public no-argument constructor and a
 * {@code META-INF/services/com.questrail.isocam.api.CameraDriverProvider}
 * registration.</p>
 */
public interface CameraDriverProvider
{
    /**
     * Human-readable provider name, used in logs.
     */
    String name();

    /**
     * Enumerates the serial numbers of attached cameras.
     *
     * @throws DriverException if the vendor SDK fails to enumerate
     */
    List<String> discoverSerials() throws DriverException;

    /**
     * Opens the camera with the given serial number.
     *
     * <p>The returned driver is used only from the control-loop thread that
     * opened it.</p>
     *
     * @throws DriverException if the camera cannot be opened
     */
    CameraDriver open(String serial) throws DriverException;
}
