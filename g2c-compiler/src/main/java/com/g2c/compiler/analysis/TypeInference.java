package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeRole;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.PortRef;
import com.g2c.compiler.ir.PortSpec;
import com.g2c.compiler.ir.ValueType;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Port-level type inference by worklist over a fixed per-node-type rule table.
 * A declared output type always wins over the rule. Nodes whose inputs never resolve stay
 * untyped; the validator reports their consumers.
 */
public final class TypeInference {

    private final Scope scope;
    private final EdgeIndex edges;
    private final NodePorts ports;
    private final Map<String, ValueType> functionReturnTypes;

    private final Map<PortRef, ValueType> outputs = new TreeMap<>();
    private final Map<String, ValueType> variables = new TreeMap<>();
    private final Map<String, List<String>> readersByVariable = new LinkedHashMap<>();

    public TypeInference(Scope scope, EdgeIndex edges, NodePorts ports, Map<String, ValueType> functionReturnTypes) {
        this.scope = scope;
        this.edges = edges;
        this.ports = ports;
        this.functionReturnTypes = functionReturnTypes;
    }

    /**
     * @param order visiting order for the initial worklist (topological order, then cycle members)
     */
    public TypeTable infer(List<String> order) {
        for (GraphModel.Node n : edges.nodes().values()) {
            if (NodeTypes.VAR_GET.equals(NodeTypes.canonical(n.type)) && n.stringParameter("name") != null) {
                readersByVariable.computeIfAbsent(n.stringParameter("name"), k -> new ArrayList<>()).add(n.id);
            }
        }

        Deque<String> work = new ArrayDeque<>(order);
        Set<String> queued = new HashSet<>(order);
        // each node can change type a bounded number of times (untyped, int, double, any)
        int budget = Math.max(16, order.size() * 8);
        while (!work.isEmpty() && budget-- > 0) {
            String id = work.poll();
            queued.remove(id);
            GraphModel.Node node = edges.node(id);
            if (node == null) continue;

            if (apply(node)) {
                for (EdgeIndex.ResolvedEdge e : edges.dataOut(id)) {
                    if (queued.add(e.toNode())) work.add(e.toNode());
                }
            }
            String variable = writtenVariable(node);
            if (variable != null && refreshVariable(variable)) {
                for (String reader : readersByVariable.getOrDefault(variable, List.of())) {
                    if (queued.add(reader)) work.add(reader);
                }
            }
        }
        return new TypeTable(outputs, variables, returnType());
    }

    private boolean apply(GraphModel.Node node) {
        boolean changed = false;
        ValueType ruled = rule(node);
        for (PortSpec out : ports.outputs(node)) {
            ValueType type = out.type() != null ? out.type() : ruled;
            PortRef ref = new PortRef(node.id, out.name());
            if (type != null && !type.equals(outputs.get(ref))) {
                outputs.put(ref, type);
                changed = true;
            }
        }
        return changed;
    }

    /** Recomputes a variable's type from its declaration or the join of its writers. */
    private boolean refreshVariable(String variable) {
        ValueType effective = declaredVariableType(variable);
        if (effective == null) {
            for (GraphModel.Node writer : edges.nodes().values()) {
                if (variable.equals(writtenVariable(writer))) effective = ValueType.join(effective, writerType(writer));
            }
        }
        if (effective == null || effective.equals(variables.get(variable))) return false;
        variables.put(variable, effective);
        return true;
    }

    private ValueType rule(GraphModel.Node node) {
        String type = NodeTypes.canonical(node.type);
        if (NodeTypes.ARITHMETIC.contains(type)) {
            ValueType a = inputType(node, "a");
            ValueType b = inputType(node, "b");
            if (a == null || b == null) return null;
            if (a.kind() == ValueType.Kind.ANY || b.kind() == ValueType.Kind.ANY) return ValueType.ANY;
            if (a.equals(ValueType.INT) && b.equals(ValueType.INT)) return ValueType.INT;
            return ValueType.DOUBLE;
        }
        if (NodeTypes.ORDERING.contains(type) || NodeTypes.EQUALITY.contains(type)
                || NodeTypes.LOGIC.contains(type) || NodeTypes.NOT.equals(type)) {
            return ValueType.BOOL;
        }
        switch (type == null ? "" : type) {
            case NodeTypes.LITERAL:
                return literalType(node.parameter("value"));
            case NodeTypes.CONCAT:
                return ValueType.STRING;
            case NodeTypes.CAST:
                return ValueType.parse(node.stringParameter("targetType"));
            case NodeTypes.VAR_GET: {
                String name = node.stringParameter("name");
                return name == null ? null : variables.get(name);
            }
            case NodeTypes.VAR_SET:
                return inputType(node, "value");
            case NodeTypes.ARG:
                return argumentType(node);
            case NodeTypes.CALL_FUNCTION: {
                String callee = node.stringParameter("functionName");
                ValueType ret = functionReturnTypes.get(callee);
                return ret != null && !ret.equals(ValueType.VOID) ? ret : null;
            }
            default: {
                // plugin types: the descriptor's return type is the signature's output type
                List<PortSpec> outs = ports.catalog().lookup(node.type)
                        .map(s -> s.outputs()).orElse(List.of());
                return outs.isEmpty() ? null : outs.get(0).type();
            }
        }
    }

    private ValueType argumentType(GraphModel.Node node) {
        if (!scope.isFunction()) return null;
        String name = node.stringParameter("name");
        for (GraphModel.Param p : scope.function().getParams()) {
            if (p != null && p.name != null && p.name.equals(name)) {
                ValueType declared = ValueType.parse(p.type);
                return declared != null ? declared : ValueType.ANY;
            }
        }
        return null;
    }

    /** Type flowing into an input: the producer's output type, else the literal default's type. */
    ValueType inputType(GraphModel.Node node, String port) {
        EdgeIndex.ResolvedEdge feeding = edges.feeding(node.id, port);
        if (feeding != null) return outputs.get(feeding.from());
        return literalType(node.parameter(port));
    }

    private String writtenVariable(GraphModel.Node node) {
        String type = NodeTypes.canonical(node.type);
        if (!NodeTypes.VAR_SET.equals(type) && !NodeTypes.VAR_DECL.equals(type)) return null;
        return node.stringParameter("name");
    }

    private ValueType writerType(GraphModel.Node writer) {
        if (NodeTypes.VAR_DECL.equals(NodeTypes.canonical(writer.type))) {
            ValueType declared = ValueType.parse(writer.stringParameter("type"));
            if (declared != null) return declared;
        }
        return inputType(writer, "value");
    }

    private ValueType declaredVariableType(String variable) {
        for (GraphModel.Node n : edges.nodes().values()) {
            if (NodeTypes.VAR_DECL.equals(NodeTypes.canonical(n.type)) && variable.equals(n.stringParameter("name"))) {
                ValueType declared = ValueType.parse(n.stringParameter("type"));
                if (declared != null) return declared;
            }
        }
        return null;
    }

    private ValueType returnType() {
        ValueType joined = null;
        for (GraphModel.Node n : edges.nodes().values()) {
            if (ports.catalog().roleOf(n.type) != NodeRole.RETURN) continue;
            ValueType t = inputType(n, "value");
            if (t != null) joined = ValueType.join(joined, t);
        }
        return joined != null ? joined : ValueType.VOID;
    }

    /** Type of a JSON literal: boolean, integral number, other number or string. */
    public static ValueType literalType(JsonElement value) {
        if (value == null || !value.isJsonPrimitive()) return null;
        JsonPrimitive p = value.getAsJsonPrimitive();
        if (p.isBoolean()) return ValueType.BOOL;
        if (p.isString()) return ValueType.STRING;
        if (p.isNumber()) return isIntegral(p.getAsString()) ? ValueType.INT : ValueType.DOUBLE;
        return null;
    }

    static boolean isIntegral(String number) {
        if (number.contains(".") || number.contains("e") || number.contains("E")) return false;
        try {
            Integer.parseInt(number);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
