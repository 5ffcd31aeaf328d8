package com.g2c.cli.config;

import com.g2c.compiler.codegen.GeneratorOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigReaderTest {

    private final ConfigReader reader = new ConfigReader();

    @Test
    void readsEveryField(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("g2c.json");
        Files.writeString(file, "{\n"
                + "  \"plugin_dir\": \"ext\",\n"
                + "  \"loop_guard_limit\": 50,\n"
                + "  \"indent\": 2,\n"
                + "  \"emit_node_markers\": false,\n"
                + "  \"compiler\": \"clang++\",\n"
                + "  \"compiler_args\": [\"-std=c++17\", \"-Wall\"],\n"
                + "  \"compile_timeout_seconds\": 30,\n"
                + "  \"run_timeout_seconds\": 5\n"
                + "}");
        G2cConfig config = reader.read(file);
        assertEquals("ext", config.getPluginDir());
        assertEquals(50L, config.getLoopGuardLimit());
        assertEquals("clang++", config.getCompiler());
        assertEquals(List.of("-std=c++17", "-Wall"), config.getCompilerArgs());
        assertEquals(30, config.getCompileTimeoutSeconds());
        assertEquals(5, config.getRunTimeoutSeconds());
        assertEquals(new GeneratorOptions(50, 2, false), config.toGeneratorOptions());
    }

    @Test
    void missingFieldsTakeDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("g2c.json");
        Files.writeString(file, "{}");
        G2cConfig config = reader.read(file);
        assertEquals("plugins", config.getPluginDir());
        assertEquals("g++", config.getCompiler());
        assertEquals(G2cConfig.DEFAULT_COMPILER_ARGS, config.getCompilerArgs());
        assertEquals(60, config.getCompileTimeoutSeconds());
        assertEquals(10, config.getRunTimeoutSeconds());
        assertEquals(GeneratorOptions.defaults(), config.toGeneratorOptions());
    }

    @Test
    void noPathGivesDefaults() {
        assertEquals(GeneratorOptions.defaults(), reader.readOrDefaults(null).toGeneratorOptions());
    }

    @Test
    void missingFileFails(@TempDir Path dir) {
        ConfigReader.ConfigReadException e = assertThrows(ConfigReader.ConfigReadException.class,
                () -> reader.read(dir.resolve("g2c.json")));
        assertTrue(e.getMessage().startsWith("Config file not found"));
    }

    @Test
    void emptyFileFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("g2c.json");
        Files.writeString(file, "");
        assertThrows(ConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void malformedFileFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("g2c.json");
        Files.writeString(file, "{\"indent\": \"wide\"}");
        assertThrows(ConfigReader.ConfigReadException.class, () -> reader.read(file));
    }

    @Test
    void outOfRangeGuardIsRejectedWhenConverted(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("g2c.json");
        Files.writeString(file, "{\"loop_guard_limit\": 0}");
        G2cConfig config = reader.read(file);
        assertThrows(IllegalArgumentException.class, config::toGeneratorOptions);
    }
}
