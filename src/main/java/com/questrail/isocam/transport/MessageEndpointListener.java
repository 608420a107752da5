package com.questrail.isocam.transport;

import com.questrail.isocam.protocol.codec.WireFrame;

/**
 * MessageEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link MessageEndpoint}.
 *
 * <p>Callbacks are delivered serialized, on a transport thread. Listeners are
 * expected to hand the work over to their own thread rather than block.</p>
 */
public interface MessageEndpointListener
{
    /**
     * Called once the connection to the peer is established.
     */
    void onConnected();

    /**
     * Called when the connection ends or could not be established.
     *
     * @param cause the failure, or {@code null} for an orderly close
     */
    void onDisconnected(Throwable cause);

    /**
     * Called for each complete frame received, in arrival order.
     */
    void onFrame(WireFrame frame);
}
