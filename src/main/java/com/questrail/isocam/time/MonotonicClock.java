package com.questrail.isocam.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every timing decision in the camera service: connect
 * deadlines, drain cadence, poll back-off and frame capture timestamps.
 *
 * <h2>Binding invariant</h2>
 * Deadlines and elapsed-time checks MUST use a monotonic source. Wall-clock
 * time ({@code Instant.now()}) is reserved for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful relative to each other.</p>
     */
    long nowNanos();

    /**
     * Returns the current tick expressed in fractional seconds.
     *
     * <p>This is the representation carried by {@code capture_time} on the wire.</p>
     */
    default double nowSeconds()
    {
        return nowNanos() / 1_000_000_000.0;
    }
}
