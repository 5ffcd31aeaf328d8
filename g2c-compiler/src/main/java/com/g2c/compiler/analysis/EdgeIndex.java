package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.PortRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Dataflow and control adjacency of one body, with omitted edge ports filled in.
 * Edges naming a node that does not exist are left out; the validator reports them.
 */
public final class EdgeIndex {

    /** An edge whose port names have been resolved against the endpoints' effective ports. */
    public record ResolvedEdge(
            String fromNode,
            String fromPort,
            String toNode,
            String toPort,
            boolean control,
            GraphModel.Edge source
    ) {
        public PortRef from() { return new PortRef(fromNode, fromPort); }
        public PortRef to()   { return new PortRef(toNode, toPort); }
    }

    private final Map<String, GraphModel.Node> nodes;
    private final List<ResolvedEdge> all = new ArrayList<>();
    private final Map<String, List<ResolvedEdge>> dataOut = new LinkedHashMap<>();
    private final Map<String, List<ResolvedEdge>> dataIn = new LinkedHashMap<>();
    private final Map<String, List<ResolvedEdge>> controlOut = new LinkedHashMap<>();
    private final Map<String, List<ResolvedEdge>> controlIn = new LinkedHashMap<>();

    private EdgeIndex(Map<String, GraphModel.Node> nodes) {
        this.nodes = nodes;
        for (String id : nodes.keySet()) {
            dataOut.put(id, new ArrayList<>());
            dataIn.put(id, new ArrayList<>());
            controlOut.put(id, new ArrayList<>());
            controlIn.put(id, new ArrayList<>());
        }
    }

    public static EdgeIndex build(GraphModel.Graph graph, NodePorts ports) {
        Map<String, GraphModel.Node> nodes = new LinkedHashMap<>();
        for (GraphModel.Node n : graph.getNodes()) {
            if (n != null && n.id != null) nodes.putIfAbsent(n.id, n);
        }
        EdgeIndex index = new EdgeIndex(nodes);
        for (GraphModel.Edge e : graph.getEdges()) {
            if (e == null) continue;
            GraphModel.Node from = nodes.get(e.fromNode);
            GraphModel.Node to = nodes.get(e.toNode);
            if (from == null || to == null) continue;
            index.add(resolve(e, from, to, ports));
        }
        return index;
    }

    static ResolvedEdge resolve(GraphModel.Edge e, GraphModel.Node from, GraphModel.Node to, NodePorts ports) {
        if (e.isControl()) {
            String fromPort = e.fromPort != null ? e.fromPort : "next";
            String toPort = e.toPort != null ? e.toPort : "in";
            return new ResolvedEdge(e.fromNode, fromPort, e.toNode, toPort, true, e);
        }
        String fromPort = e.fromPort;
        if (fromPort == null) {
            fromPort = ports.primaryOutput(from);
            if (fromPort == null) fromPort = "out";
        }
        String toPort = e.toPort;
        if (toPort == null) {
            toPort = ports.primaryInput(to);
            if (toPort == null) toPort = "in";
        }
        return new ResolvedEdge(e.fromNode, fromPort, e.toNode, toPort, false, e);
    }

    private void add(ResolvedEdge edge) {
        all.add(edge);
        if (edge.control()) {
            controlOut.get(edge.fromNode()).add(edge);
            controlIn.get(edge.toNode()).add(edge);
        } else {
            dataOut.get(edge.fromNode()).add(edge);
            dataIn.get(edge.toNode()).add(edge);
        }
    }

    /** Nodes by id in document order; a repeated id keeps its first node. */
    public Map<String, GraphModel.Node> nodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public GraphModel.Node node(String id) {
        return nodes.get(id);
    }

    public List<ResolvedEdge> all() {
        return Collections.unmodifiableList(all);
    }

    public List<ResolvedEdge> dataOut(String nodeId) {
        return dataOut.getOrDefault(nodeId, List.of());
    }

    public List<ResolvedEdge> dataIn(String nodeId) {
        return dataIn.getOrDefault(nodeId, List.of());
    }

    public List<ResolvedEdge> controlOut(String nodeId) {
        return controlOut.getOrDefault(nodeId, List.of());
    }

    public List<ResolvedEdge> controlIn(String nodeId) {
        return controlIn.getOrDefault(nodeId, List.of());
    }

    /** Data edges terminating at one input port, in document order. */
    public List<ResolvedEdge> dataInto(String nodeId, String port) {
        List<ResolvedEdge> result = new ArrayList<>();
        for (ResolvedEdge e : dataIn(nodeId)) {
            if (e.toPort().equals(port)) result.add(e);
        }
        return result;
    }

    /** The single data edge feeding an input port, or null when unconnected. */
    public ResolvedEdge feeding(String nodeId, String port) {
        for (ResolvedEdge e : dataIn(nodeId)) {
            if (e.toPort().equals(port)) return e;
        }
        return null;
    }

    /** Dataflow successors of every node, deduplicated and sorted by id. */
    public Map<String, List<String>> dataSuccessors() {
        Map<String, List<String>> succ = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            TreeSet<String> targets = new TreeSet<>();
            for (ResolvedEdge e : dataOut(id)) targets.add(e.toNode());
            succ.put(id, new ArrayList<>(targets));
        }
        return succ;
    }
}
