package com.questrail.isocam.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledExecutorSchedulerTest {

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
    private final ScheduledExecutorScheduler scheduler =
            new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void runsTaskAfterDelay() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ofMillis(20), SystemMonotonicClock.INSTANCE, ran::countDown);

        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void pastDeadlineRunsImmediately() throws InterruptedException {
        CountDownLatch ran = new CountDownLatch(1);

        scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos() - 1_000_000, ran::countDown);

        assertTrue(ran.await(5, TimeUnit.SECONDS));
    }

    @Test
    void cancelledTaskDoesNotRun() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable c = scheduler.scheduleAfter(Duration.ofMillis(200), SystemMonotonicClock.INSTANCE, () -> ran.set(true));

        assertTrue(c.cancel());
        Thread.sleep(300);
        assertFalse(ran.get());
    }
}
