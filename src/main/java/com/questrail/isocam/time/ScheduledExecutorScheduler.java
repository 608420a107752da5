package com.questrail.isocam.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted to relative delays at scheduling time
 * using the supplied clock, so callers must compute deadlines on the same
 * clock instance. Tasks may run late, never early.</p>
 *
 * <p>The executor is not owned: callers shut it down. When it is a
 * single-thread executor every task scheduled here runs on that one thread,
 * which is how the server and client pump threads are realized.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        return new ScheduledFutureCancellable(future);
    }

    private static final class ScheduledFutureCancellable implements Cancellable {
        private final ScheduledFuture<?> future;

        private ScheduledFutureCancellable(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public boolean cancel() {
            // never interrupt a running drain tick
            return future.cancel(false);
        }
    }
}
