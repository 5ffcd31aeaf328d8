package com.g2c.compiler.ir;

/**
 * Effective description of one port: its name, the type it expects or produces (null when
 * unconstrained) and whether an input may be left unconnected.
 */
public record PortSpec(String name, ValueType type, boolean optional) {

    public static PortSpec of(String name) {
        return new PortSpec(name, null, false);
    }

    public static PortSpec of(String name, ValueType type) {
        return new PortSpec(name, type, false);
    }

    public static PortSpec optional(String name, ValueType type) {
        return new PortSpec(name, type, true);
    }
}
