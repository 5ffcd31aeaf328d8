package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.ValueType;

import java.util.Collections;
import java.util.Map;

/**
 * Analysis of a whole document: the top-level body plus one analysis per function.
 *
 * @param returnTypes declared or inferred return type per function name; absent when unknown
 */
public record DocumentAnalysis(
        FunctionIndex functions,
        NodePorts ports,
        Map<String, ValueType> returnTypes,
        GraphAnalysis top,
        Map<String, GraphAnalysis> functionBodies
) {

    public DocumentAnalysis {
        returnTypes = Collections.unmodifiableMap(returnTypes);
        functionBodies = Collections.unmodifiableMap(functionBodies);
    }

    public GraphAnalysis function(String name) {
        return functionBodies.get(name);
    }

    public ValueType returnType(String function) {
        return returnTypes.get(function);
    }
}
