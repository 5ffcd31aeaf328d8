package com.g2c.cli;

import com.g2c.cli.toolchain.ProcessRunner;
import com.g2c.compiler.codegen.CompilationMap;
import com.g2c.compiler.codegen.CompilationMapSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class G2cMainTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures");

    private static String graph(String name) {
        return FIXTURES.resolve("graphs").resolve(name).toString();
    }

    @Test
    void noArgumentsIsUsageError() {
        assertThrows(G2cMain.UsageException.class, () -> G2cMain.run(new String[0]));
    }

    @Test
    void unknownCommandIsUsageError() {
        G2cMain.UsageException e = assertThrows(G2cMain.UsageException.class,
                () -> G2cMain.run(new String[] {"frobnicate"}));
        assertEquals("Unknown command: frobnicate", e.getMessage());
    }

    @Test
    void unknownFlagIsUsageError() {
        assertThrows(G2cMain.UsageException.class,
                () -> G2cMain.run(new String[] {"validate", graph("hello.json"), "--run"}));
    }

    @Test
    void flagWithoutValueIsUsageError() {
        G2cMain.UsageException e = assertThrows(G2cMain.UsageException.class,
                () -> G2cMain.run(new String[] {"validate", graph("hello.json"), "--plugins"}));
        assertEquals("--plugins requires an argument", e.getMessage());
    }

    @Test
    void missingDocumentIsUsageError() {
        assertThrows(G2cMain.UsageException.class, () -> G2cMain.run(new String[] {"emit"}));
        assertThrows(G2cMain.UsageException.class,
                () -> G2cMain.run(new String[] {"validate", "a.json", "b.json"}));
    }

    @Test
    void pluginDirectoryGivenTwiceIsUsageError() {
        assertThrows(G2cMain.UsageException.class, () -> G2cMain.run(new String[] {
                "emit", graph("hello.json"), "plugins", "--plugins", "other"}));
    }

    @Test
    void validateReportsOutcomeInExitStatus() {
        assertEquals(0, G2cMain.run(new String[] {"validate", graph("hello.json")}));
        assertEquals(1, G2cMain.run(new String[] {"validate", graph("cycle.json")}));
        assertEquals(1, G2cMain.run(new String[] {"validate", graph("sqrt-call.json")}));
        assertEquals(0, G2cMain.run(new String[] {
                "validate", graph("sqrt-call.json"), "--plugins", FIXTURES.resolve("plugins").toString()}));
    }

    @Test
    void emitWritesSourceAndMap(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("build").resolve("hello.cpp");
        assertEquals(0, G2cMain.run(new String[] {"emit", graph("hello.json"), "--out", out.toString()}));

        String source = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(source.contains("std::cout << literal_1 << std::endl;"));
        CompilationMap map = new CompilationMapSerializer().read(dir.resolve("build").resolve("hello.cpp.map.json"));
        assertEquals(8, map.get("n2").endLine);
    }

    @Test
    void emitAcceptsPositionalPluginDirectory(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("sqrt.cpp");
        assertEquals(0, G2cMain.run(new String[] {
                "emit", graph("sqrt-call.json"), FIXTURES.resolve("plugins").toString(), "--out", out.toString()}));
        assertTrue(Files.readString(out, StandardCharsets.UTF_8).contains("std::sqrt("));
    }

    @Test
    void emitOfInvalidDocumentWritesNothing(@TempDir Path dir) {
        Path out = dir.resolve("cycle.cpp");
        assertEquals(1, G2cMain.run(new String[] {"emit", graph("cycle.json"), "--out", out.toString()}));
        assertFalse(Files.exists(out));
        assertFalse(Files.exists(dir.resolve("cycle.cpp.map.json")));
    }

    @Test
    void emitHonoursConfig(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("g2c.json");
        Files.writeString(config, "{\"indent\": 2, \"emit_node_markers\": false}");
        Path out = dir.resolve("hello.cpp");
        assertEquals(0, G2cMain.run(new String[] {
                "emit", graph("hello.json"), "--out", out.toString(), "--config", config.toString()}));
        String source = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(source.contains("\n  std::cout << literal_1 << std::endl;\n"));
        assertFalse(source.contains("// node:"));
    }

    @Test
    void compileWithMissingCompilerFails(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("g2c.json");
        Files.writeString(config, "{\"compiler\": \"g2c-no-such-compiler\"}");
        assertThrows(ProcessRunner.ToolchainException.class, () -> G2cMain.run(new String[] {
                "compile", graph("hello.json"), "--out", dir.resolve("hello.cpp").toString(),
                "--config", config.toString()}));
        assertTrue(Files.exists(dir.resolve("hello.cpp")));
    }

    @Test
    void mapCommandReadsMapAndCompilerOutput(@TempDir Path dir) throws IOException {
        Path out = dir.resolve("hello.cpp");
        G2cMain.run(new String[] {"emit", graph("hello.json"), "--out", out.toString()});
        Path stderr = dir.resolve("gcc.txt");
        Files.writeString(stderr, "hello.cpp:8:20: error: bad\n");
        assertEquals(0, G2cMain.run(new String[] {"map", dir.resolve("hello.cpp.map.json").toString(), stderr.toString()}));
        assertThrows(G2cMain.UsageException.class, () -> G2cMain.run(new String[] {
                "map", dir.resolve("hello.cpp.map.json").toString(), dir.resolve("missing.txt").toString()}));
    }

    @Test
    void derivedPaths() {
        assertEquals(Paths.get("out", "prog.cpp"), G2cMain.defaultOutput(Paths.get("out", "prog.json")));
        assertEquals(Paths.get("out", "prog.graph.cpp"), G2cMain.defaultOutput(Paths.get("out", "prog.graph")));
        assertEquals(Paths.get("out", "prog.cpp.map.json"), G2cMain.mapPathFor(Paths.get("out", "prog.cpp")));
        assertEquals(Paths.get("out", "prog"), G2cMain.binaryPathFor(Paths.get("out", "prog.cpp")));
        assertEquals(Paths.get("out", "prog.cc.bin"), G2cMain.binaryPathFor(Paths.get("out", "prog.cc")));
    }
}
