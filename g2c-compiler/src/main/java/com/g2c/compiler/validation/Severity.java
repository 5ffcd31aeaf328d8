package com.g2c.compiler.validation;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING,
    INFO;

    /** Lower-case spelling used in printed diagnostics. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
