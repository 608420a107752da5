package com.questrail.isocam.protocol.codec;

/**
 * Indicates that bytes received from the peer could not be turned into a
 * valid camera protocol message.
 *
 * This typically reflects:
 * <ul>
 *   <li>a frame header announcing lengths beyond the configured maximum</li>
 *   <li>a binary part on a tag other than {@code image}</li>
 *   <li>text that the text codec cannot decode, or an unknown tag</li>
 *   <li>a value whose shape does not match its tag</li>
 * </ul>
 *
 * A protocol error is fatal to the connection it occurred on.
 */
public final class ProtocolException extends RuntimeException
{
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
