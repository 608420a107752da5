package com.questrail.isocam.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>MUST NOT be used for deadlines or cadence.</p>
 */
public interface WallClock
{
    Instant now();
}
