package com.questrail.isocam.api;

/**
 * Failure raised by a camera driver.
 *
 * <p>Any {@code DriverException} escaping a driver call ends the camera
 * session: driver state is not trusted after a failure.</p>
 */
public class DriverException extends Exception
{
    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
