package com.g2c.cli.toolchain;

import com.g2c.cli.config.G2cConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NativeCompilerTest {

    @Test
    void commandPlacesArgumentsBeforeSource() {
        NativeCompiler compiler = new NativeCompiler("clang++", List.of("-std=c++17", "-Wall"), 30);
        assertEquals(List.of("clang++", "-std=c++17", "-Wall", Paths.get("a.cpp").toString(), "-o", "a"),
                compiler.command(Paths.get("a.cpp"), Paths.get("a")));
    }

    @Test
    void defaultsComeFromConfig() {
        List<String> command = new NativeCompiler(new G2cConfig()).command(Paths.get("p.cpp"), Paths.get("p"));
        assertEquals("g++", command.get(0));
        assertEquals("-std=c++17", command.get(1));
        assertEquals("-O0", command.get(2));
    }

    @Test
    void missingCompilerFailsToSpawn(@TempDir Path dir) {
        NativeCompiler compiler = new NativeCompiler("g2c-no-such-compiler", List.of(), 5);
        assertThrows(ProcessRunner.ToolchainException.class,
                () -> compiler.compile(dir.resolve("a.cpp"), dir.resolve("a")));
    }

    @Test
    void missingProgramFailsToRun(@TempDir Path dir) {
        assertThrows(ProcessRunner.ToolchainException.class, () -> new ProgramRunner(5).run(dir.resolve("nope")));
    }
}
