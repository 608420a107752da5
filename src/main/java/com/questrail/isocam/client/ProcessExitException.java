package com.questrail.isocam.client;

/**
 * The worker process exited with a non-zero status.
 */
public final class ProcessExitException extends Exception
{
    private final int exitCode;
    private final String stderr;

    public ProcessExitException(int exitCode, String stderr) {
        super("Camera worker exited with code " + exitCode);
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Captured standard error of the worker.
     */
    public String stderr() {
        return stderr;
    }
}
