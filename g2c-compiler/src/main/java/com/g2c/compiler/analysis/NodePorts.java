package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.NodeSignature;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.PortSpec;
import com.g2c.compiler.ir.ValueType;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a node's effective ports: the ports it declares, or the defaults of its type.
 * Calls to user functions take their inputs from the callee's parameter list.
 */
public final class NodePorts {

    private final NodeCatalog catalog;
    private final FunctionIndex functions;

    public NodePorts(NodeCatalog catalog, FunctionIndex functions) {
        this.catalog = catalog;
        this.functions = functions;
    }

    public NodeCatalog catalog() {
        return catalog;
    }

    public FunctionIndex functions() {
        return functions;
    }

    public List<PortSpec> inputs(GraphModel.Node node) {
        NodeSignature sig = catalog.lookup(node.type).orElse(null);
        if (!node.getInputs().isEmpty()) {
            return declared(node.getInputs(), sig, true);
        }
        if (isCall(node)) {
            GraphModel.FunctionDef callee = functions.get(node.stringParameter("functionName"));
            if (callee != null) {
                List<PortSpec> params = new ArrayList<>();
                for (GraphModel.Param p : callee.getParams()) {
                    if (p != null && p.name != null) params.add(PortSpec.of(p.name, ValueType.parse(p.type)));
                }
                return params;
            }
        }
        return sig != null ? sig.inputs() : List.of();
    }

    public List<PortSpec> outputs(GraphModel.Node node) {
        NodeSignature sig = catalog.lookup(node.type).orElse(null);
        if (!node.getOutputs().isEmpty()) {
            return declared(node.getOutputs(), sig, false);
        }
        if (isCall(node)) {
            String name = node.stringParameter("functionName");
            GraphModel.FunctionDef callee = functions.get(name);
            if (callee != null) {
                return functions.returnsValue(name)
                        ? List.of(PortSpec.of("out", ValueType.parse(callee.returnType)))
                        : List.of();
            }
        }
        return sig != null ? sig.outputs() : List.of();
    }

    public PortSpec input(GraphModel.Node node, String name) {
        for (PortSpec p : inputs(node)) {
            if (p.name().equals(name)) return p;
        }
        return null;
    }

    public PortSpec output(GraphModel.Node node, String name) {
        for (PortSpec p : outputs(node)) {
            if (p.name().equals(name)) return p;
        }
        return null;
    }

    /** Name of the first output, or null for nodes without outputs. */
    public String primaryOutput(GraphModel.Node node) {
        List<PortSpec> outs = outputs(node);
        return outs.isEmpty() ? null : outs.get(0).name();
    }

    /** Name of the first input, or null for nodes without inputs. */
    public String primaryInput(GraphModel.Node node) {
        List<PortSpec> ins = inputs(node);
        return ins.isEmpty() ? null : ins.get(0).name();
    }

    private static boolean isCall(GraphModel.Node node) {
        return NodeTypes.CALL_FUNCTION.equals(NodeTypes.canonical(node.type));
    }

    private static List<PortSpec> declared(List<GraphModel.Port> ports, NodeSignature sig, boolean inputs) {
        List<PortSpec> result = new ArrayList<>();
        for (GraphModel.Port p : ports) {
            if (p == null || p.name == null) continue;
            PortSpec fallback = sig == null ? null : inputs ? sig.input(p.name) : sig.output(p.name);
            ValueType type = ValueType.parse(p.type);
            if (type == null && fallback != null) type = fallback.type();
            boolean optional = fallback != null && fallback.optional();
            result.add(new PortSpec(p.name, type, optional));
        }
        return result;
    }
}
