package com.g2c.compiler.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lines of one generated body with the current nesting depth. Line numbers are 1-based and
 * relative to the buffer; the generator shifts them when the program is assembled.
 */
final class SourceBuffer {

    private final List<String> lines = new ArrayList<>();
    private final String unit;
    private int depth;

    SourceBuffer(int indentWidth) {
        this.unit = " ".repeat(indentWidth);
    }

    void indent() {
        depth++;
    }

    void dedent() {
        if (depth == 0) throw new IllegalStateException("dedent below column 0");
        depth--;
    }

    String prefix() {
        return unit.repeat(depth);
    }

    /** Appends an indented line and returns its number. */
    int add(String text) {
        lines.add(prefix() + text);
        return lines.size();
    }

    /** Appends a line already carrying its indentation. */
    int addRaw(String text) {
        lines.add(text);
        return lines.size();
    }

    /** Number of the next line to be written. */
    int nextLine() {
        return lines.size() + 1;
    }

    int lastLine() {
        return lines.size();
    }

    List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
