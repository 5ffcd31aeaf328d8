package com.g2c.cli.toolchain;

import com.g2c.cli.config.G2cConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a generated C++ file with the configured native compiler.
 */
public class NativeCompiler {

    private final String compiler;
    private final List<String> compilerArgs;
    private final int timeoutSeconds;
    private final ProcessRunner runner = new ProcessRunner("compiler");

    public NativeCompiler(G2cConfig config) {
        this(config.getCompiler(), config.getCompilerArgs(), config.getCompileTimeoutSeconds());
    }

    public NativeCompiler(String compiler, List<String> compilerArgs, int timeoutSeconds) {
        this.compiler = compiler;
        this.compilerArgs = List.copyOf(compilerArgs);
        this.timeoutSeconds = timeoutSeconds;
    }

    /** {@code <compiler> <args...> <source> -o <binary>} */
    public List<String> command(Path source, Path binary) {
        List<String> command = new ArrayList<>();
        command.add(compiler);
        command.addAll(compilerArgs);
        command.add(source.toString());
        command.add("-o");
        command.add(binary.toString());
        return command;
    }

    /**
     * Compiles {@code source} into {@code binary}. Diagnostics are in the result's stderr;
     * a non-zero exit is returned, not thrown.
     *
     * @throws ProcessRunner.ToolchainException if the compiler cannot be started
     */
    public ProcessRunner.Result compile(Path source, Path binary) {
        System.err.println("[g2c] Compiling " + source.getFileName() + " with " + compiler);
        Path dir = source.toAbsolutePath().getParent();
        return runner.run(command(source.toAbsolutePath(), binary.toAbsolutePath()), dir, timeoutSeconds);
    }
}
