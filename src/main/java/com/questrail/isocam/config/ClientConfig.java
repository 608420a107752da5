package com.questrail.isocam.config;

import com.questrail.isocam.protocol.codec.WireFraming;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the supervisor and of the worker process it spawns.
 *
 * <p>Each supervisor gets its own instance; nothing here is shared or
 * mutable.</p>
 *
 * @param host              worker address; loopback by default
 * @param port              worker port; 0 picks a free ephemeral port before spawning
 * @param recvTimeout       cadence of both pump loops
 * @param connectDeadline   how long refused connects are retried
 * @param connectRetryDelay pause between connect attempts
 * @param driverBinPath     driver jar directory, or {@code simulated}
 * @param logLevel          numeric worker log level (10 debug .. 50 critical)
 * @param maxFrameSize      largest accepted {@code text_len + binary_len}
 * @param javaExecutable    java launcher used for the worker
 * @param classpath         worker class path
 */
public record ClientConfig(
    String host,
    int port,
    Duration recvTimeout,
    Duration connectDeadline,
    Duration connectRetryDelay,
    String driverBinPath,
    int logLevel,
    int maxFrameSize,
    String javaExecutable,
    String classpath
) {
    public static final String SIMULATED_DRIVER = "simulated";

    public ClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(recvTimeout, "recvTimeout");
        Objects.requireNonNull(connectDeadline, "connectDeadline");
        Objects.requireNonNull(connectRetryDelay, "connectRetryDelay");
        Objects.requireNonNull(driverBinPath, "driverBinPath");
        Objects.requireNonNull(javaExecutable, "javaExecutable");
        Objects.requireNonNull(classpath, "classpath");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (recvTimeout.isNegative() || recvTimeout.isZero()) {
            throw new IllegalArgumentException("recvTimeout must be > 0");
        }
        if (maxFrameSize <= 0) {
            throw new IllegalArgumentException("maxFrameSize must be > 0");
        }
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withHost(host)
                .withPort(port)
                .withRecvTimeout(recvTimeout)
                .withConnectDeadline(connectDeadline)
                .withConnectRetryDelay(connectRetryDelay)
                .withDriverBinPath(driverBinPath)
                .withLogLevel(logLevel)
                .withMaxFrameSize(maxFrameSize)
                .withJavaExecutable(javaExecutable)
                .withClasspath(classpath);
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 0;
        private Duration recvTimeout = Duration.ofMillis(10);
        private Duration connectDeadline = Duration.ofSeconds(5);
        private Duration connectRetryDelay = Duration.ofMillis(50);
        private String driverBinPath = SIMULATED_DRIVER;
        private int logLevel = 20;
        private int maxFrameSize = WireFraming.DEFAULT_MAX_FRAME_SIZE;
        private String javaExecutable = Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        private String classpath = System.getProperty("java.class.path", "");

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withRecvTimeout(Duration recvTimeout) {
            this.recvTimeout = recvTimeout;
            return this;
        }

        public Builder withConnectDeadline(Duration connectDeadline) {
            this.connectDeadline = connectDeadline;
            return this;
        }

        public Builder withConnectRetryDelay(Duration connectRetryDelay) {
            this.connectRetryDelay = connectRetryDelay;
            return this;
        }

        public Builder withDriverBinPath(String driverBinPath) {
            this.driverBinPath = driverBinPath;
            return this;
        }

        public Builder withLogLevel(int logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder withMaxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder withJavaExecutable(String javaExecutable) {
            this.javaExecutable = javaExecutable;
            return this;
        }

        public Builder withClasspath(String classpath) {
            this.classpath = classpath;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(host, port, recvTimeout, connectDeadline, connectRetryDelay,
                    driverBinPath, logLevel, maxFrameSize, javaExecutable, classpath);
        }
    }
}
