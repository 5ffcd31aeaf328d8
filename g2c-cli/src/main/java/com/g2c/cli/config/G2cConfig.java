package com.g2c.cli.config;

import com.g2c.compiler.codegen.GeneratorOptions;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Deserialized form of {@code g2c.json}. Every field is optional; getters supply the defaults.
 */
public class G2cConfig {

    static final List<String> DEFAULT_COMPILER_ARGS = List.of("-std=c++17", "-O0");

    /** Directory of plugin descriptors, used when no plugin directory is given on the command line. */
    @SerializedName("plugin_dir")
    private String pluginDir;

    @SerializedName("loop_guard_limit")
    private Long loopGuardLimit;

    @SerializedName("indent")
    private Integer indent;

    @SerializedName("emit_node_markers")
    private Boolean emitNodeMarkers;

    /** Native compiler executable (default: g++). */
    @SerializedName("compiler")
    private String compiler;

    /** Arguments placed before the source file (default: -std=c++17 -O0). */
    @SerializedName("compiler_args")
    private List<String> compilerArgs;

    @SerializedName("compile_timeout_seconds")
    private Integer compileTimeoutSeconds;

    @SerializedName("run_timeout_seconds")
    private Integer runTimeoutSeconds;

    public String getPluginDir()         { return pluginDir != null ? pluginDir : "plugins"; }
    public long getLoopGuardLimit()      { return loopGuardLimit != null ? loopGuardLimit : GeneratorOptions.DEFAULT_LOOP_GUARD_LIMIT; }
    public int getIndent()               { return indent != null ? indent : GeneratorOptions.DEFAULT_INDENT; }
    public boolean isEmitNodeMarkers()   { return emitNodeMarkers == null || emitNodeMarkers; }
    public String getCompiler()          { return compiler != null ? compiler : "g++"; }
    public List<String> getCompilerArgs() { return compilerArgs != null ? compilerArgs : DEFAULT_COMPILER_ARGS; }
    public int getCompileTimeoutSeconds() { return compileTimeoutSeconds != null ? compileTimeoutSeconds : 60; }
    public int getRunTimeoutSeconds()    { return runTimeoutSeconds != null ? runTimeoutSeconds : 10; }

    /**
     * @throws IllegalArgumentException if the guard limit or indent is out of range
     */
    public GeneratorOptions toGeneratorOptions() {
        return new GeneratorOptions(getLoopGuardLimit(), getIndent(), isEmitNodeMarkers());
    }
}
