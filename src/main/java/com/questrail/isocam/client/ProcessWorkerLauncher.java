package com.questrail.isocam.client;

import com.questrail.isocam.server.CameraWorkerMain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * Spawns the worker as a child JVM running {@link CameraWorkerMain}.
 *
 * <p>The child's standard output is inherited. Its standard error is read by
 * a pump thread that logs every line at debug level and keeps the last
 * {@value #STDERR_TAIL_LINES} lines for fault reports.</p>
 */
public final class ProcessWorkerLauncher implements WorkerLauncher
{
    private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

    static final int STDERR_TAIL_LINES = 200;

    private final String javaExecutable;
    private final String classpath;

    public ProcessWorkerLauncher(String javaExecutable, String classpath) {
        this.javaExecutable = Objects.requireNonNull(javaExecutable, "javaExecutable");
        this.classpath = Objects.requireNonNull(classpath, "classpath");
    }

    List<String> command(List<String> arguments) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.add("-cp");
        command.add(classpath);
        command.add(CameraWorkerMain.class.getName());
        command.addAll(arguments);
        return command;
    }

    @Override
    public WorkerHandle launch(List<String> arguments) throws IOException {
        List<String> command = command(arguments);
        log.debug("Launching camera worker: {}", command);

        Process process = new ProcessBuilder(command)
                .redirectOutput(ProcessBuilder.Redirect.INHERIT)
                .redirectError(ProcessBuilder.Redirect.PIPE)
                .start();

        StderrPump pump = new StderrPump(process.getErrorStream());
        Thread t = new Thread(pump, "camera-worker-stderr");
        t.setDaemon(true);
        t.start();

        log.info("Camera worker started with pid {}", process.pid());
        return new ProcessHandle(process, pump, t);
    }

    private static final class StderrPump implements Runnable {
        private final InputStream in;
        private final Deque<String> tail = new ArrayDeque<>();

        private StderrPump(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[worker] {}", line);
                    synchronized (tail) {
                        tail.addLast(line);
                        if (tail.size() > STDERR_TAIL_LINES) {
                            tail.removeFirst();
                        }
                    }
                }
            }
            catch (IOException e) {
                log.debug("Worker stderr closed", e);
            }
        }

        String text() {
            synchronized (tail) {
                return String.join(System.lineSeparator(), tail);
            }
        }
    }

    private static final class ProcessHandle implements WorkerHandle {
        private final Process process;
        private final StderrPump pump;
        private final Thread pumpThread;

        private ProcessHandle(Process process, StderrPump pump, Thread pumpThread) {
            this.process = process;
            this.pump = pump;
            this.pumpThread = pumpThread;
        }

        @Override
        public int waitFor() throws InterruptedException {
            int code = process.waitFor();
            // stderr is complete once the pump has seen EOF
            pumpThread.join(1000);
            return code;
        }

        @Override
        public OptionalInt waitFor(Duration timeout) throws InterruptedException {
            if (!process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
                return OptionalInt.empty();
            }
            pumpThread.join(1000);
            return OptionalInt.of(process.exitValue());
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroyForcibly() {
            if (process.isAlive()) {
                log.warn("Killing camera worker pid {}", process.pid());
                process.destroyForcibly();
            }
        }

        @Override
        public String stderr() {
            return pump.text();
        }
    }
}
