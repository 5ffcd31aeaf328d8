package com.g2c.compiler.codegen;

import com.g2c.compiler.ir.ValueType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Includes and top-of-file declarations gathered while generating one program. Owned by a
 * single generation run and passed to every rule through {@link EmitContext}.
 */
public final class Declarations {

    private final SortedSet<String> includes = new TreeSet<>();
    private final Set<String> declarations = new LinkedHashSet<>();

    /** Adds a header: {@code <x>} and {@code "x"} are kept, a bare name becomes {@code <name>}. */
    public void include(String header) {
        String h = header.trim();
        if (h.startsWith("#include")) h = h.substring("#include".length()).trim();
        if (h.isEmpty()) return;
        if (!h.startsWith("<") && !h.startsWith("\"")) h = "<" + h + ">";
        includes.add(h);
    }

    /** Adds a verbatim declaration line, once. */
    public void declare(String line) {
        declarations.add(line);
    }

    /** A plugin's required declaration: an include when it names a header, else a declaration. */
    public void require(String requiredDeclaration) {
        if (requiredDeclaration == null || requiredDeclaration.isBlank()) return;
        String r = requiredDeclaration.trim();
        if (r.startsWith("<") || r.startsWith("\"") || r.startsWith("#include")) {
            include(r);
        } else {
            declare(r);
        }
    }

    /** Includes the header a C++ type spelling needs, if any. */
    public void requireType(ValueType type) {
        if (ValueType.STRING.equals(type)) include("<string>");
    }

    /** Include lines in sorted order. */
    public List<String> includeLines() {
        List<String> lines = new ArrayList<>();
        for (String h : includes) lines.add("#include " + h);
        return lines;
    }

    /** Declaration lines in first-use order. */
    public List<String> declarationLines() {
        return Collections.unmodifiableList(new ArrayList<>(declarations));
    }
}
