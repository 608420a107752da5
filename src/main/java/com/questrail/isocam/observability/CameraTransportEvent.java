package com.questrail.isocam.observability;

import java.time.Instant;

/**
 * Record representing a connection lifecycle event on either side of the
 * supervisor/worker socket.
 */
public record CameraTransportEvent(
    Instant timestamp,
    Side side,
    Kind kind,
    String detail
) {
    public enum Side {
        WORKER,
        SUPERVISOR
    }

    public enum Kind {
        CONNECTED,
        DISCONNECTED,
        FRAME_REJECTED
    }
}
