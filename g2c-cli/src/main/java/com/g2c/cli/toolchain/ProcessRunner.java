package com.g2c.cli.toolchain;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs one subprocess to completion under a wall-clock timeout, capturing stdout and stderr
 * separately. A process that outlives its timeout is killed and reported as timed out.
 */
public class ProcessRunner {

    public static class ToolchainException extends RuntimeException {
        public ToolchainException(String msg) { super(msg); }
        public ToolchainException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * @param exitCode process exit status, or -1 when the process was killed on timeout
     */
    public record Result(int exitCode, String stdout, String stderr, boolean timedOut) {
        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }

    /** Bytes kept per stream; anything beyond is drained and discarded. */
    public static final int DEFAULT_CAPTURE_LIMIT = 8 * 1024 * 1024;

    private final String label;
    private final int captureLimit;

    /**
     * @param label short name used in log lines and error messages ("compiler", "program")
     */
    public ProcessRunner(String label) {
        this(label, DEFAULT_CAPTURE_LIMIT);
    }

    public ProcessRunner(String label, int captureLimit) {
        if (captureLimit <= 0) {
            throw new IllegalArgumentException("captureLimit must be positive: " + captureLimit);
        }
        this.label = label;
        this.captureLimit = captureLimit;
    }

    /**
     * @throws ToolchainException if the process cannot be started or the wait is interrupted
     */
    public Result run(List<String> command, Path workDir, int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new ToolchainException("Timeout for " + label + " must be positive: " + timeoutSeconds);
        }
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workDir != null) {
            pb.directory(workDir.toFile());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolchainException("Failed to spawn " + label + " process " + command.get(0) + ": " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            System.err.println("[g2c] WARNING: could not close " + label + " stdin: " + e.getMessage());
        }

        StreamCollector stdout = new StreamCollector(process.getInputStream(), label + "-stdout", captureLimit);
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), label + "-stderr", captureLimit);
        stdout.start();
        stderr.start();

        try {
            boolean exited = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!exited) {
                System.err.println("[g2c] WARNING: " + label + " did not finish within " + timeoutSeconds
                        + "s, killing it");
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                stdout.join(1000);
                stderr.join(1000);
                return new Result(-1, stdout.text(), stderr.text(), true);
            }
            stdout.join();
            stderr.join();
            return new Result(process.exitValue(), stdout.text(), stderr.text(), false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ToolchainException(label + " interrupted", e);
        }
    }

    /**
     * Drains one stream on a daemon thread so a chatty process never blocks on a full pipe. At most
     * {@code limit} bytes are kept; the text then ends with a truncation notice.
     */
    private static final class StreamCollector extends Thread {

        private final InputStream in;
        private final int limit;
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private long discarded;

        StreamCollector(InputStream in, String name, int limit) {
            super(name);
            this.in = in;
            this.limit = limit;
            setDaemon(true);
        }

        @Override
        public void run() {
            byte[] chunk = new byte[8192];
            try (InputStream stream = in) {
                int n;
                while ((n = stream.read(chunk)) != -1) {
                    synchronized (bytes) {
                        int keep = Math.min(n, limit - bytes.size());
                        if (keep > 0) bytes.write(chunk, 0, keep);
                        if (keep < n) {
                            if (discarded == 0) {
                                System.err.println("[g2c] WARNING: " + getName() + " exceeded " + limit
                                        + " bytes; further output is discarded");
                            }
                            discarded += n - keep;
                        }
                    }
                }
            } catch (IOException e) {
                // stream closed underneath us when the process was killed
                System.err.println("[g2c] WARNING: " + getName() + " closed early: " + e.getMessage());
            }
        }

        String text() {
            synchronized (bytes) {
                String text = bytes.toString(StandardCharsets.UTF_8);
                return discarded == 0 ? text : text + "\n[g2c] output truncated: " + discarded + " more bytes discarded\n";
            }
        }
    }
}
