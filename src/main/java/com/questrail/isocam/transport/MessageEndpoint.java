package com.questrail.isocam.transport;

import com.questrail.isocam.protocol.codec.WireFrame;

/**
 * MessageEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for one stream connection carrying framed messages.
 *
 * <p>Higher layers (the worker's server bridge and the supervisor's client
 * bridge) are responsible for:</p>
 * <ul>
 *   <li>decoding inbound frames into requests or events</li>
 *   <li>deciding what to send and when</li>
 *   <li>tearing down sessions when the connection goes away</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface MessageEndpoint
{
    /**
     * Start the endpoint: listen for, or connect to, the peer.
     *
     * <p>Once the connection is usable the endpoint MUST notify its listener
     * via {@link MessageEndpointListener#onConnected()} exactly once.</p>
     */
    void start();

    /**
     * Close the connection and release all transport resources.
     *
     * <p>The listener is notified via
     * {@link MessageEndpointListener#onDisconnected(Throwable)} at most once
     * over the endpoint's lifetime.</p>
     */
    void stop();

    /**
     * Send one frame to the peer.
     *
     * <p>Frames are written in call order. Sending before the connection is up
     * or after it is gone is dropped by the endpoint.</p>
     */
    void send(WireFrame frame);

    /**
     * Register the listener that receives inbound frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(MessageEndpointListener listener);
}
