package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.PortRef;
import com.g2c.compiler.ir.ValueType;

import java.util.Collections;
import java.util.Map;

/**
 * Result of type inference for one body. Absent entries are untyped.
 *
 * @param outputs    inferred type per output port
 * @param variables  inferred type per variable name
 * @param returnType join of the values returned by {@code Return} nodes, {@code void} when none carries a value
 */
public record TypeTable(Map<PortRef, ValueType> outputs, Map<String, ValueType> variables, ValueType returnType) {

    public TypeTable {
        outputs = Collections.unmodifiableMap(outputs);
        variables = Collections.unmodifiableMap(variables);
    }

    public ValueType typeOf(PortRef port) {
        return outputs.get(port);
    }

    public ValueType typeOf(String nodeId, String port) {
        return outputs.get(new PortRef(nodeId, port));
    }

    public ValueType variable(String name) {
        return variables.get(name);
    }
}
