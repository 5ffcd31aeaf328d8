package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeRole;

import java.util.List;
import java.util.SortedSet;

/**
 * Everything the validator and the generator need to know about one body.
 *
 * @param cycles   dataflow cycles (SCCs with more than one member, or a self-edge)
 * @param order    topological order of the nodes outside cycles
 * @param residual nodes Kahn could not order; always the union of {@code cycles}
 */
public record GraphAnalysis(
        Scope scope,
        EdgeIndex edges,
        NodePorts ports,
        List<SortedSet<String>> cycles,
        List<String> order,
        SortedSet<String> residual,
        TypeTable types,
        ControlStructure control
) {

    public GraphModel.Node node(String id) {
        return edges.node(id);
    }

    public NodeRole role(String id) {
        GraphModel.Node n = edges.node(id);
        return n == null ? NodeRole.EFFECT : ports.catalog().roleOf(n.type);
    }

    public boolean isCyclic(String id) {
        return residual.contains(id);
    }
}
