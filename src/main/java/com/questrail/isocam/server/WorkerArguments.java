package com.questrail.isocam.server;

import com.questrail.isocam.config.WorkerConfig;
import com.questrail.isocam.protocol.codec.WireFraming;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Positional command line of the worker process:
 * {@code <log_level> <driver_bin_path> <host> <port> <recv_timeout> [max_frame_size]}.
 * The supervisor appends {@code max_frame_size} only when its own frame limit
 * differs from {@link WireFraming#DEFAULT_MAX_FRAME_SIZE}.
 *
 * @param logLevel           numeric level: 10 debug, 20 info, 30 warning, 40 error, 50 critical
 * @param driverBinPath      driver jar directory, or {@code simulated}
 * @param host               address to listen on
 * @param port               port to listen on
 * @param recvTimeoutSeconds server pump cadence, in seconds
 * @param maxFrameSize       largest accepted {@code text_len + binary_len}
 */
public record WorkerArguments(
    int logLevel,
    String driverBinPath,
    String host,
    int port,
    double recvTimeoutSeconds,
    int maxFrameSize
) {
    public static final int ARGUMENT_COUNT = 5;
    public static final int MAX_ARGUMENT_COUNT = 6;

    public WorkerArguments {
        Objects.requireNonNull(driverBinPath, "driverBinPath");
        Objects.requireNonNull(host, "host");
        if (driverBinPath.isBlank()) {
            throw new IllegalArgumentException("driver_bin_path must not be empty");
        }
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be empty");
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (!Double.isFinite(recvTimeoutSeconds) || recvTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("recv_timeout must be a positive number of seconds: " + recvTimeoutSeconds);
        }
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("max_frame_size must be > 0: " + maxFrameSize);
        }
    }

    public WorkerArguments(int logLevel, String driverBinPath, String host, int port, double recvTimeoutSeconds) {
        this(logLevel, driverBinPath, host, port, recvTimeoutSeconds, WireFraming.DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Parses the positional arguments.
     *
     * @throws IllegalArgumentException if the count is wrong or a value is malformed
     */
    public static WorkerArguments parse(String... args) {
        Objects.requireNonNull(args, "args");
        if (args.length != ARGUMENT_COUNT && args.length != MAX_ARGUMENT_COUNT) {
            throw new IllegalArgumentException("Expected " + ARGUMENT_COUNT
                    + " arguments <log_level> <driver_bin_path> <host> <port> <recv_timeout>"
                    + " [max_frame_size], got " + args.length);
        }

        return new WorkerArguments(
                parseInt("log_level", args[0]),
                args[1],
                args[2],
                parseInt("port", args[3]),
                parseDouble("recv_timeout", args[4]),
                args.length == MAX_ARGUMENT_COUNT
                        ? parseInt("max_frame_size", args[5])
                        : WireFraming.DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Inverse of {@link #parse(String...)}.
     */
    public List<String> toArgumentList() {
        List<String> args = new ArrayList<>(List.of(
                Integer.toString(logLevel),
                driverBinPath,
                host,
                Integer.toString(port),
                Double.toString(recvTimeoutSeconds)));
        if (maxFrameSize != WireFraming.DEFAULT_MAX_FRAME_SIZE) {
            args.add(Integer.toString(maxFrameSize));
        }
        return List.copyOf(args);
    }

    public Duration recvTimeout() {
        return Duration.ofNanos(Math.max(1, Math.round(recvTimeoutSeconds * 1_000_000_000.0)));
    }

    /**
     * Name of the equivalent SLF4J level.
     */
    public String slf4jLevel() {
        if (logLevel < 10) {
            return "trace";
        }
        if (logLevel < 20) {
            return "debug";
        }
        if (logLevel < 30) {
            return "info";
        }
        if (logLevel < 40) {
            return "warn";
        }
        return "error";
    }

    public WorkerConfig toWorkerConfig() {
        return WorkerConfig.builder()
                .withHost(host)
                .withPort(port)
                .withRecvTimeout(recvTimeout())
                .withMaxFrameSize(maxFrameSize)
                .build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }
}
