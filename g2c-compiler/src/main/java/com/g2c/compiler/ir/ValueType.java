package com.g2c.compiler.ir;

import java.util.Locale;
import java.util.Objects;

/**
 * Loosely-typed value kind carried by one port. Any spelling that is not a known alias is kept
 * verbatim as an opaque C++ type.
 */
public final class ValueType {

    public enum Kind { INT, DOUBLE, BOOL, STRING, VOID, ANY, OPAQUE }

    public static final ValueType INT    = new ValueType(Kind.INT, "int");
    public static final ValueType DOUBLE = new ValueType(Kind.DOUBLE, "double");
    public static final ValueType BOOL   = new ValueType(Kind.BOOL, "bool");
    public static final ValueType STRING = new ValueType(Kind.STRING, "string");
    public static final ValueType VOID   = new ValueType(Kind.VOID, "void");
    public static final ValueType ANY    = new ValueType(Kind.ANY, "any");

    private final Kind kind;
    private final String name;

    private ValueType(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /**
     * Canonicalizes a declared type spelling.
     *
     * @return the type, or null for a null/blank spelling (undeclared)
     */
    public static ValueType parse(String spelling) {
        if (spelling == null || spelling.isBlank()) return null;
        String s = spelling.trim();
        switch (s.toLowerCase(Locale.ROOT)) {
            case "int", "integer", "long" -> { return INT; }
            case "double", "number", "float" -> { return DOUBLE; }
            case "bool", "boolean" -> { return BOOL; }
            case "string", "str", "std::string" -> { return STRING; }
            case "void" -> { return VOID; }
            case "any", "auto" -> { return ANY; }
            default -> { return new ValueType(Kind.OPAQUE, s); }
        }
    }

    /**
     * Least upper bound used when several writers feed one variable. A null side is "not yet known".
     */
    public static ValueType join(ValueType a, ValueType b) {
        if (a == null) return b;
        if (b == null) return a;
        if (a.equals(b)) return a;
        if (a.isNumeric() && b.isNumeric()) return DOUBLE;
        return ANY;
    }

    /** True when a value of type {@code actual} may flow into a port expecting this type. */
    public boolean accepts(ValueType actual) {
        if (actual == null) return true;
        if (kind == Kind.ANY || actual.kind == Kind.ANY) return true;
        if (equals(actual)) return true;
        return kind == Kind.DOUBLE && actual.kind == Kind.INT;
    }

    public boolean isNumeric() {
        return kind == Kind.INT || kind == Kind.DOUBLE;
    }

    public Kind kind() { return kind; }

    /** Canonical spelling, used in messages. */
    public String name() { return name; }

    /** C++ spelling; {@code any} becomes {@code auto}. */
    public String cppName() {
        return switch (kind) {
            case STRING -> "std::string";
            case ANY -> "auto";
            default -> name;
        };
    }

    /** A type that can declare a variable or a parameter without deduction. */
    public boolean isConcrete() {
        return kind != Kind.ANY && kind != Kind.VOID;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValueType other)) return false;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
