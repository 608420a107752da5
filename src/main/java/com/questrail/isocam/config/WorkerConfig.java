package com.questrail.isocam.config;

import com.questrail.isocam.protocol.codec.WireFraming;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of one worker process.
 *
 * @param host                address to listen on
 * @param port                port to listen on; 0 binds an ephemeral port
 * @param recvTimeout         cadence at which the server thread drains controller events
 * @param pollInterval        control-loop sleep when a playing camera has no frame ready
 * @param sessionCloseTimeout bound on waiting for a control thread to finish
 * @param maxFrameSize        largest accepted {@code text_len + binary_len}
 */
public record WorkerConfig(
    String host,
    int port,
    Duration recvTimeout,
    Duration pollInterval,
    Duration sessionCloseTimeout,
    int maxFrameSize
) {
    public WorkerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(recvTimeout, "recvTimeout");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(sessionCloseTimeout, "sessionCloseTimeout");
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

    public static WorkerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 0;
        private Duration recvTimeout = Duration.ofMillis(10);
        private Duration pollInterval = Duration.ofMillis(5);
        private Duration sessionCloseTimeout = Duration.ofSeconds(5);
        private int maxFrameSize = WireFraming.DEFAULT_MAX_FRAME_SIZE;

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

        public Builder withPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder withSessionCloseTimeout(Duration sessionCloseTimeout) {
            this.sessionCloseTimeout = sessionCloseTimeout;
            return this;
        }

        public Builder withMaxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public WorkerConfig build() {
            return new WorkerConfig(host, port, recvTimeout, pollInterval, sessionCloseTimeout, maxFrameSize);
        }
    }
}
