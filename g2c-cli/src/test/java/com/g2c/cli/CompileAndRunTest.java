package com.g2c.cli;

import com.g2c.cli.toolchain.NativeCompiler;
import com.g2c.cli.toolchain.ProcessRunner;
import com.g2c.cli.toolchain.ProgramRunner;
import com.g2c.compiler.GraphCompiler;
import com.g2c.compiler.ir.GraphDocumentReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Builds and runs generated programs with the host's g++. Skipped where no g++ is installed.
 */
@EnabledIf("compilerAvailable")
class CompileAndRunTest {

    private static final Path GRAPHS =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures")
             .resolve("graphs");

    static boolean compilerAvailable() {
        try {
            return new ProcessRunner("g++").run(List.of("g++", "--version"), null, 30).succeeded();
        } catch (ProcessRunner.ToolchainException e) {
            return false;
        }
    }

    private static ProcessRunner.Result buildAndRun(String graph, Path dir) throws IOException {
        String source = new GraphCompiler().compile(new GraphDocumentReader().read(GRAPHS.resolve(graph))).source();
        Path cpp = dir.resolve(graph.replace(".json", ".cpp"));
        Files.writeString(cpp, source, StandardCharsets.UTF_8);
        Path binary = G2cMain.binaryPathFor(cpp);

        ProcessRunner.Result build = new NativeCompiler("g++", List.of("-std=c++17", "-O0"), 120).compile(cpp, binary);
        assertTrue(build.succeeded(), () -> "g++ failed:\n" + build.stderr() + "\n" + source);
        return new ProgramRunner(30).run(binary);
    }

    @Test
    void helloWorldPrintsHello(@TempDir Path dir) throws IOException {
        ProcessRunner.Result run = buildAndRun("hello.json", dir);
        assertEquals(0, run.exitCode());
        assertEquals("Hello\n", run.stdout());
    }

    @Test
    void counterLoopPrintsZeroToTwo(@TempDir Path dir) throws IOException {
        ProcessRunner.Result run = buildAndRun("counter-loop.json", dir);
        assertEquals(0, run.exitCode());
        assertEquals("0\n1\n2\n", run.stdout());
    }

    @Test
    void functionCallAndBranchRun(@TempDir Path dir) throws IOException {
        assertEquals("49\n", buildAndRun("square.json", dir).stdout());
        assertEquals("yes\n", buildAndRun("branch.json", dir).stdout());
    }

    @Test
    void neverEndingLoopIsStoppedByGuard(@TempDir Path dir) throws IOException {
        ProcessRunner.Result run = buildAndRun("forever.json", dir);
        assertFalse(run.timedOut());
        assertEquals(ProgramRunner.LOOP_GUARD_EXIT, run.exitCode());
        assertTrue(run.stderr().contains("g2c: loop guard exceeded in node loop (limit 100000)"));
        assertTrue(run.stdout().startsWith("tick\ntick\n"));
    }

    @Test
    void compileCommandRunsProgram(@TempDir Path dir) {
        assertEquals(0, G2cMain.run(new String[] {
                "compile", GRAPHS.resolve("hello.json").toString(), "--out", dir.resolve("hello.cpp").toString(), "--run"}));
        assertTrue(Files.isRegularFile(dir.resolve("hello")));
        assertEquals(1, G2cMain.run(new String[] {
                "compile", GRAPHS.resolve("forever.json").toString(), "--out", dir.resolve("forever.cpp").toString(), "--run"}));
    }
}
