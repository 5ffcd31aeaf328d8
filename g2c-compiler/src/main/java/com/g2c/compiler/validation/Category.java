package com.g2c.compiler.validation;

/**
 * Error taxonomy. {@link #STRUCTURAL} problems abort validation early; all others are collected.
 */
public enum Category {
    /** Malformed document shape: missing arrays or node ids. */
    STRUCTURAL,
    /** Unknown node, port or node type; duplicate ids; fan-in; unconnected inputs. */
    REFERENTIAL,
    /** Dataflow cycle. */
    CYCLE,
    /** Type mismatch or a value whose type cannot be inferred. */
    TYPE,
    /** Function parameter, argument-source, return or call mismatch. */
    LINKAGE,
    /** Branch and loop structure reconstructed from control edges. */
    CONTROL
}
