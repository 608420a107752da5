package com.questrail.isocam.client;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * A running worker.
 */
public interface WorkerHandle
{
    /**
     * Blocks until the worker exits.
     *
     * @return the exit code
     */
    int waitFor() throws InterruptedException;

    /**
     * @return the exit code, or empty if the worker is still running after {@code timeout}
     */
    OptionalInt waitFor(Duration timeout) throws InterruptedException;

    boolean isAlive();

    void destroyForcibly();

    /**
     * Tail of what the worker wrote to its standard error so far.
     */
    String stderr();
}
