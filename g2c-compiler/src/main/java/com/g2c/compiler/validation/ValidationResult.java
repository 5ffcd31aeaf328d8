package com.g2c.compiler.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered diagnostics of one validation run. The graph is valid iff no diagnostic is an error.
 */
public final class ValidationResult {

    private final List<Diagnostic> diagnostics;

    public ValidationResult(List<Diagnostic> diagnostics) {
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public boolean isOk() {
        for (Diagnostic d : diagnostics) {
            if (d.isError()) return false;
        }
        return true;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public List<Diagnostic> errors() {
        List<Diagnostic> errors = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.isError()) errors.add(d);
        }
        return errors;
    }

    public List<Diagnostic> withSeverity(Severity severity) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.severity() == severity) result.add(d);
        }
        return result;
    }

    public List<Diagnostic> withCategory(Category category) {
        List<Diagnostic> result = new ArrayList<>();
        for (Diagnostic d : diagnostics) {
            if (d.category() == category) result.add(d);
        }
        return result;
    }
}
