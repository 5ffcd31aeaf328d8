package com.g2c.compiler.diagnostics;

/**
 * One message extracted from native compiler output.
 *
 * @param column   1-based column, or null when the compiler gave none
 * @param severity {@code error}, {@code fatal error}, {@code warning} or {@code note}
 */
public record CompilerDiagnostic(String file, int line, Integer column, String severity, String message) {}
