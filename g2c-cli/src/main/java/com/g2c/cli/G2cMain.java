package com.g2c.cli;

import com.g2c.cli.config.ConfigReader;
import com.g2c.cli.config.G2cConfig;
import com.g2c.cli.toolchain.NativeCompiler;
import com.g2c.cli.toolchain.ProcessRunner;
import com.g2c.cli.toolchain.ProgramRunner;
import com.g2c.compiler.GraphCompiler;
import com.g2c.compiler.codegen.CodeGenerator;
import com.g2c.compiler.codegen.CompilationMap;
import com.g2c.compiler.codegen.CompilationMapSerializer;
import com.g2c.compiler.codegen.GeneratorOptions;
import com.g2c.compiler.diagnostics.CompilerDiagnostic;
import com.g2c.compiler.diagnostics.CompilerOutputParser;
import com.g2c.compiler.diagnostics.DiagnosticsMapper;
import com.g2c.compiler.diagnostics.MappedDiagnostic;
import com.g2c.compiler.ir.GraphDocumentReader;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.plugin.PluginRegistry;
import com.g2c.compiler.validation.Diagnostic;
import com.g2c.compiler.validation.ValidationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar g2c-cli.jar validate <document.json> [--plugins <dir>] [--config <g2c.json>]
 *   java -jar g2c-cli.jar emit     <document.json> [pluginDir] [--plugins <dir>] [--out <file.cpp>] [--config <g2c.json>]
 *   java -jar g2c-cli.jar compile  <document.json> [--plugins <dir>] [--out <file.cpp>] [--config <g2c.json>] [--run]
 *   java -jar g2c-cli.jar map      <file.cpp.map.json> <compiler-output.txt>
 */
public class G2cMain {

    static final String MAP_SUFFIX = ".map.json";

    private static final String USAGE = String.join("\n",
            "Usage: java -jar g2c-cli.jar <command> ...",
            "  validate <document.json> [--plugins <dir>] [--config <g2c.json>]",
            "  emit     <document.json> [pluginDir] [--plugins <dir>] [--out <file.cpp>] [--config <g2c.json>]",
            "  compile  <document.json> [--plugins <dir>] [--out <file.cpp>] [--config <g2c.json>] [--run]",
            "  map      <file.cpp.map.json> <compiler-output.txt>");

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } catch (UsageException e) {
            System.err.println("[g2c] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            exitCode = 2;
        } catch (GraphDocumentReader.DocumentReadException
                 | ConfigReader.ConfigReadException
                 | CompilationMapSerializer.SerializerException
                 | ProcessRunner.ToolchainException
                 | CodeGenerator.GenerationException e) {
            System.err.println("[g2c] ERROR: " + e.getMessage());
            exitCode = 1;
        } catch (Exception e) {
            System.err.println("[g2c] FATAL: " + e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    /** Runs one command and returns its exit status. */
    static int run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No command specified");
        }
        switch (args[0]) {
            case "validate": {
                Options opts = Options.parse(args, Set.of("--plugins", "--config"), 1, 1);
                return validate(opts);
            }
            case "emit": {
                Options opts = Options.parse(args, Set.of("--plugins", "--out", "--config"), 1, 2);
                if (opts.positionals.size() == 2) {
                    if (opts.pluginDir != null) {
                        throw new UsageException("Plugin directory given twice (positional and --plugins)");
                    }
                    opts.pluginDir = opts.positionals.get(1);
                }
                return emit(opts) != null ? 0 : 1;
            }
            case "compile": {
                Options opts = Options.parse(args, Set.of("--plugins", "--out", "--config", "--run"), 1, 1);
                return compile(opts);
            }
            case "map": {
                Options opts = Options.parse(args, Set.of(), 2, 2);
                return map(Paths.get(opts.positionals.get(0)), Paths.get(opts.positionals.get(1)));
            }
            default:
                throw new UsageException("Unknown command: " + args[0]);
        }
    }

    // --- commands ---

    private static int validate(Options opts) {
        G2cConfig config = new ConfigReader().readOrDefaults(opts.configPath());
        GraphCompiler compiler = new GraphCompiler(plugins(opts, config), generatorOptions(config));
        GraphModel.Graph document = new GraphDocumentReader().read(opts.documentPath());

        ValidationResult result = compiler.validate(document);
        printDiagnostics(result);
        if (!result.isOk()) {
            System.err.println("[g2c] Validation failed with " + result.errors().size() + " error(s)");
            return 1;
        }
        System.out.println("OK");
        return 0;
    }

    /** Writes the source and its map; null when validation failed. */
    private static Emitted emit(Options opts) {
        G2cConfig config = new ConfigReader().readOrDefaults(opts.configPath());
        GraphCompiler compiler = new GraphCompiler(plugins(opts, config), generatorOptions(config));
        Path documentPath = opts.documentPath();
        GraphModel.Graph document = new GraphDocumentReader().read(documentPath);

        ValidationResult result = compiler.validate(document);
        printDiagnostics(result);
        if (!result.isOk()) {
            System.err.println("[g2c] Validation failed with " + result.errors().size() + " error(s)");
            return null;
        }

        CodeGenerator.GeneratedProgram program = compiler.compile(document);
        Path out = opts.out != null ? Paths.get(opts.out) : defaultOutput(documentPath);
        Path mapPath = mapPathFor(out);
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(out, program.source(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CodeGenerator.GenerationException("Failed to write " + out + ": " + e.getMessage(), e);
        }
        new CompilationMapSerializer().write(program.map(), mapPath);
        System.err.println("[g2c] Wrote " + out + " (" + program.map().size() + " mapped nodes) and " + mapPath);
        return new Emitted(out, program.map(), config);
    }

    private static int compile(Options opts) {
        Emitted emitted = emit(opts);
        if (emitted == null) return 1;

        Path binary = binaryPathFor(emitted.source());
        ProcessRunner.Result build = new NativeCompiler(emitted.config()).compile(emitted.source(), binary);
        if (build.timedOut()) {
            System.err.println("[g2c] ERROR: compiler timed out after "
                    + emitted.config().getCompileTimeoutSeconds() + "s");
            return 1;
        }
        if (build.exitCode() != 0) {
            printCompilerDiagnostics(build.stdout() + build.stderr(), emitted);
            System.err.println("[g2c] Native compilation failed (exit " + build.exitCode() + ")");
            return 1;
        }
        System.err.println("[g2c] Built " + binary);
        if (!opts.run) return 0;

        ProcessRunner.Result execution = new ProgramRunner(emitted.config().getRunTimeoutSeconds()).run(binary);
        System.out.print(execution.stdout());
        System.err.print(execution.stderr());
        if (execution.timedOut()) {
            System.err.println("[g2c] ERROR: program timed out after "
                    + emitted.config().getRunTimeoutSeconds() + "s");
            return 1;
        }
        if (execution.exitCode() == ProgramRunner.LOOP_GUARD_EXIT) {
            System.err.println("[g2c] ERROR: program stopped by a loop guard (exit " + execution.exitCode() + ")");
            return 1;
        }
        if (execution.exitCode() != 0) {
            System.err.println("[g2c] ERROR: program exited with status " + execution.exitCode());
            return 1;
        }
        return 0;
    }

    private static int map(Path mapPath, Path outputPath) {
        CompilationMap map = new CompilationMapSerializer().read(mapPath);
        String output;
        try {
            output = Files.readString(outputPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UsageException("Cannot read compiler output " + outputPath + ": " + e.getMessage());
        }
        for (MappedDiagnostic d : new DiagnosticsMapper(map).map(CompilerOutputParser.parse(output))) {
            System.out.println(d.format());
        }
        return 0;
    }

    // --- helpers ---

    private record Emitted(Path source, CompilationMap map, G2cConfig config) {}

    private static PluginRegistry plugins(Options opts, G2cConfig config) {
        Path dir = Paths.get(opts.pluginDir != null ? opts.pluginDir : config.getPluginDir());
        PluginRegistry registry = PluginRegistry.load(dir);
        if (registry.size() > 0) {
            System.err.println("[g2c] Loaded " + registry.size() + " plugin(s) from " + dir);
        }
        return registry;
    }

    private static GeneratorOptions generatorOptions(G2cConfig config) {
        try {
            return config.toGeneratorOptions();
        } catch (IllegalArgumentException e) {
            throw new ConfigReader.ConfigReadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static void printDiagnostics(ValidationResult result) {
        for (Diagnostic d : result.diagnostics()) {
            System.out.println(d.format());
        }
    }

    /** Diagnostics in the generated file are mapped to nodes; the rest are printed as reported. */
    private static void printCompilerDiagnostics(String output, Emitted emitted) {
        String sourceName = emitted.source().getFileName().toString();
        List<CompilerDiagnostic> ours = new ArrayList<>();
        List<CompilerDiagnostic> others = new ArrayList<>();
        for (CompilerDiagnostic d : CompilerOutputParser.parse(output)) {
            Path file = Paths.get(d.file()).getFileName();
            if (file != null && file.toString().equals(sourceName)) ours.add(d);
            else others.add(d);
        }
        for (MappedDiagnostic d : new DiagnosticsMapper(emitted.map()).map(ours)) {
            System.out.println(d.format());
        }
        for (CompilerDiagnostic d : others) {
            System.out.println(d.file() + ":" + d.line() + ": " + d.severity() + ": " + d.message());
        }
        if (ours.isEmpty() && others.isEmpty()) {
            System.out.print(output);
        }
    }

    static Path defaultOutput(Path documentPath) {
        String name = documentPath.getFileName().toString();
        String base = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return documentPath.resolveSibling(base + ".cpp");
    }

    static Path mapPathFor(Path source) {
        return source.resolveSibling(source.getFileName() + MAP_SUFFIX);
    }

    static Path binaryPathFor(Path source) {
        String name = source.getFileName().toString();
        String base = name.endsWith(".cpp") ? name.substring(0, name.length() - ".cpp".length()) : name + ".bin";
        return source.resolveSibling(base);
    }

    /** Parsed command line of one command: positionals plus the flags that command accepts. */
    private static final class Options {
        final List<String> positionals = new ArrayList<>();
        String pluginDir;
        String out;
        String config;
        boolean run;

        static Options parse(String[] args, Set<String> allowed, int minPositionals, int maxPositionals) {
            Options opts = new Options();
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                if (arg.startsWith("--")) {
                    if (!allowed.contains(arg)) {
                        throw new UsageException("Unknown flag for " + args[0] + ": " + arg);
                    }
                    switch (arg) {
                        case "--plugins" -> opts.pluginDir = requireNext(args, i++, arg);
                        case "--out"     -> opts.out       = requireNext(args, i++, arg);
                        case "--config"  -> opts.config    = requireNext(args, i++, arg);
                        case "--run"     -> opts.run       = true;
                        default -> throw new UsageException("Unknown flag: " + arg);
                    }
                } else {
                    opts.positionals.add(arg);
                }
            }
            if (opts.positionals.size() < minPositionals) {
                throw new UsageException(args[0] + " requires " + (minPositionals == 1 ? "a document path"
                        : minPositionals + " arguments"));
            }
            if (opts.positionals.size() > maxPositionals) {
                throw new UsageException("Unexpected argument for " + args[0] + ": "
                        + opts.positionals.get(maxPositionals));
            }
            return opts;
        }

        Path documentPath() {
            return Paths.get(positionals.get(0));
        }

        Path configPath() {
            return config != null ? Paths.get(config) : null;
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
