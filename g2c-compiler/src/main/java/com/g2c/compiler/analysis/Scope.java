package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;

/**
 * One body being analyzed or generated: the top-level program or a single function.
 */
public record Scope(String functionName, GraphModel.FunctionDef function, GraphModel.Graph graph) {

    public static Scope top(GraphModel.Graph graph) {
        return new Scope(null, null, graph);
    }

    public static Scope of(GraphModel.FunctionDef function) {
        GraphModel.Graph body = function.graph != null ? function.graph : new GraphModel.Graph();
        return new Scope(function.name, function, body);
    }

    public boolean isFunction() {
        return functionName != null;
    }

    /** Key used in the compilation map: bare id at top level, {@code function::id} inside a function. */
    public String qualify(String nodeId) {
        return isFunction() ? functionName + "::" + nodeId : nodeId;
    }

    /** Prefix for diagnostics raised inside this scope. */
    public String messagePrefix() {
        return isFunction() ? "In function " + functionName + ": " : "";
    }
}
