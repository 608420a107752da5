package com.questrail.isocam.server;

import com.questrail.isocam.api.CameraDriverProvider;
import com.questrail.isocam.api.DriverException;
import com.questrail.isocam.observability.Slf4jCameraObservabilitySink;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the worker process.
 *
 * <pre>
 *   java -cp ... com.questrail.isocam.server.CameraWorkerMain \
 *        &lt;log_level&gt; &lt;driver_bin_path&gt; &lt;host&gt; &lt;port&gt; &lt;recv_timeout&gt; [&lt;max_frame_size&gt;]
 * </pre>
 *
 * Exit status: 0 after an orderly shutdown, 1 when the driver cannot be
 * loaded or the worker fails, 2 on bad arguments.
 *
 * <p>Logs go to standard error, which the supervisor captures. The numeric
 * log level from the command line is applied to the Logback root logger.</p>
 */
public final class CameraWorkerMain
{
    private static final Logger log = LoggerFactory.getLogger(CameraWorkerMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private CameraWorkerMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        WorkerArguments arguments;
        try {
            arguments = WorkerArguments.parse(args);
        }
        catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            return EXIT_USAGE;
        }

        configureLogging(arguments.slf4jLevel());
        log.debug("Worker arguments: {}", arguments);

        try {
            CameraDriverProvider provider = new CameraDriverLoader().load(arguments.driverBinPath());
            try (CameraWorker worker = new CameraWorker(
                    arguments.toWorkerConfig(), provider, new Slf4jCameraObservabilitySink())) {
                worker.start();
                log.info("Camera worker ready on {}:{}", arguments.host(), worker.boundPort());
                worker.awaitTermination();
            }
            return EXIT_OK;
        }
        catch (DriverException e) {
            log.error("Cannot load camera driver", e);
            return EXIT_FAILURE;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Camera worker interrupted", e);
            return EXIT_FAILURE;
        }
        catch (RuntimeException e) {
            log.error("Camera worker failed", e);
            return EXIT_FAILURE;
        }
    }

    private static void configureLogging(String level) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
            return;
        }
        log.warn("Logging backend {} does not support setting the level to {}",
                factory.getClass().getName(), level);
    }
}
