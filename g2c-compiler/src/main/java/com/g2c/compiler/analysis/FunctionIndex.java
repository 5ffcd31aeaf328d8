package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.ValueType;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Function definitions of one document, by name (first definition wins).
 */
public final class FunctionIndex {

    private static final FunctionIndex EMPTY = new FunctionIndex(new TreeMap<>());

    private final Map<String, GraphModel.FunctionDef> byName;

    private FunctionIndex(Map<String, GraphModel.FunctionDef> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    public static FunctionIndex of(GraphModel.Graph document) {
        Map<String, GraphModel.FunctionDef> byName = new TreeMap<>();
        for (GraphModel.FunctionDef f : document.getFunctions()) {
            if (f != null && f.name != null) {
                byName.putIfAbsent(f.name, f);
            }
        }
        return new FunctionIndex(byName);
    }

    public static FunctionIndex empty() {
        return EMPTY;
    }

    public GraphModel.FunctionDef get(String name) {
        return name == null ? null : byName.get(name);
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /** Functions in name order. */
    public Collection<GraphModel.FunctionDef> all() {
        return byName.values();
    }

    /**
     * True when calls to {@code name} produce a value: a declared non-void return type, or no
     * declaration and a {@code Return} node that carries a value.
     */
    public boolean returnsValue(String name) {
        GraphModel.FunctionDef f = get(name);
        if (f == null) return false;
        ValueType declared = ValueType.parse(f.returnType);
        if (declared != null) return !declared.equals(ValueType.VOID);
        if (f.graph == null) return false;
        for (GraphModel.Node n : f.graph.getNodes()) {
            if (n == null || !NodeTypes.RETURN.equals(NodeTypes.canonical(n.type))) continue;
            if (n.hasParameter("value")) return true;
            for (GraphModel.Edge e : f.graph.getEdges()) {
                if (e != null && e.isData() && n.id != null && n.id.equals(e.toNode)) return true;
            }
        }
        return false;
    }
}
