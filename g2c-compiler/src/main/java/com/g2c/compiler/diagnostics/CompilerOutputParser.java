package com.g2c.compiler.diagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@code file:line:column: severity: message} lines from compiler stderr. Lines that do
 * not match (context, carets, summaries) are ignored.
 */
public final class CompilerOutputParser {

    private static final Pattern LINE =
            Pattern.compile("^(.*?):(\\d+):(\\d+):\\s*(fatal error|error|warning|note):\\s*(.*)$");

    private CompilerOutputParser() {}

    public static List<CompilerDiagnostic> parse(String output) {
        List<CompilerDiagnostic> result = new ArrayList<>();
        if (output == null) return result;
        for (String raw : output.split("\\R")) {
            Matcher m = LINE.matcher(raw);
            if (!m.matches()) continue;
            try {
                result.add(new CompilerDiagnostic(m.group(1), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(3)), m.group(4), m.group(5)));
            } catch (NumberFormatException e) {
                // line or column too large for an int: not a position we can map
                result.add(new CompilerDiagnostic(m.group(1), -1, null, m.group(4), m.group(5)));
            }
        }
        return result;
    }
}
