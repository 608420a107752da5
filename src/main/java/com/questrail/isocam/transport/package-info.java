/**
 * Camera Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP in production, a
 * fake in tests) and the worker and supervisor bridges.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>complete frames as {@link com.questrail.isocam.protocol.codec.WireFrame}</li>
 *   <li>connection lifecycle notifications (connected/disconnected)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and length-prefix framing only</li>
 *   <li>Not decode message text</li>
 *   <li>Not emit camera requests or events directly</li>
 * </ul>
 */
package com.questrail.isocam.transport;
