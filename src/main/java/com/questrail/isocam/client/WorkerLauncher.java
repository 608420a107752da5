package com.questrail.isocam.client;

import java.io.IOException;
import java.util.List;

/**
 * Starts a worker with the given positional arguments.
 *
 * <p>The production implementation spawns a JVM; tests may run the worker
 * in-process.</p>
 */
public interface WorkerLauncher
{
    /**
     * @param arguments {@code <log_level> <driver_bin_path> <host> <port> <recv_timeout>}
     * @throws IOException if the worker cannot be started
     */
    WorkerHandle launch(List<String> arguments) throws IOException;
}
