package com.g2c.cli.toolchain;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Executes a compiled program with no arguments under a timeout.
 */
public class ProgramRunner {

    /** Exit status of a generated program whose loop guard fired. */
    public static final int LOOP_GUARD_EXIT = 3;

    private final int timeoutSeconds;
    private final ProcessRunner runner = new ProcessRunner("program");

    public ProgramRunner(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @throws ProcessRunner.ToolchainException if the binary is missing or cannot be started
     */
    public ProcessRunner.Result run(Path binary) {
        if (!Files.isRegularFile(binary)) {
            throw new ProcessRunner.ToolchainException("Program not found: " + binary);
        }
        Path absolute = binary.toAbsolutePath();
        return runner.run(List.of(absolute.toString()), absolute.getParent(), timeoutSeconds);
    }
}
