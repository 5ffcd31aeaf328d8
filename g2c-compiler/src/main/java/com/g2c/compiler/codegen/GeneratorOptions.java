package com.g2c.compiler.codegen;

/**
 * @param loopGuardLimit  iterations after which a generated loop aborts the program with exit status 3
 * @param indent          spaces per nesting level
 * @param emitNodeMarkers precede each node's statements with a {@code // node: <id>} comment
 */
public record GeneratorOptions(long loopGuardLimit, int indent, boolean emitNodeMarkers) {

    public static final long DEFAULT_LOOP_GUARD_LIMIT = 100_000L;
    public static final int DEFAULT_INDENT = 4;

    public GeneratorOptions {
        if (loopGuardLimit <= 0) throw new IllegalArgumentException("loopGuardLimit must be positive: " + loopGuardLimit);
        if (indent < 0) throw new IllegalArgumentException("indent must not be negative: " + indent);
    }

    public static GeneratorOptions defaults() {
        return new GeneratorOptions(DEFAULT_LOOP_GUARD_LIMIT, DEFAULT_INDENT, true);
    }
}
