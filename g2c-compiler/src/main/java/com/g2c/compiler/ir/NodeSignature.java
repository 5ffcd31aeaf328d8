package com.g2c.compiler.ir;

import java.util.List;

/**
 * Default ports and scheduling role of one node type. A node that declares its own ports
 * overrides these defaults.
 *
 * @param type    canonical node type
 * @param role    scheduling role
 * @param inputs  default input ports, in argument order
 * @param outputs default output ports; the first is the primary output
 * @param builtIn false for types contributed by plugins
 */
public record NodeSignature(
        String type,
        NodeRole role,
        List<PortSpec> inputs,
        List<PortSpec> outputs,
        boolean builtIn
) {

    public PortSpec input(String name) {
        for (PortSpec p : inputs) {
            if (p.name().equals(name)) return p;
        }
        return null;
    }

    public PortSpec output(String name) {
        for (PortSpec p : outputs) {
            if (p.name().equals(name)) return p;
        }
        return null;
    }
}
