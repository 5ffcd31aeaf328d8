package com.g2c.compiler.ir;

/**
 * How a node type behaves for scheduling. Only {@link #PURE} and {@link #STATE_READ} nodes may be
 * moved into the control body that consumes them.
 */
public enum NodeRole {
    PURE,
    STATE_READ,
    STATE_WRITE,
    EFFECT,
    ARGUMENT,
    RETURN,
    BRANCH,
    LOOP;

    public boolean isSinkable() {
        return this == PURE || this == STATE_READ;
    }

    public boolean isControl() {
        return this == BRANCH || this == LOOP;
    }
}
