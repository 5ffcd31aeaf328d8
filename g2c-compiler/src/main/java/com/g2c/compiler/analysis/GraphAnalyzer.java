package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.ValueType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds adjacency, cycles, topological order, port types and control regions for a document
 * and each of its function bodies.
 *
 * <p>Function return types that are not declared are inferred from the bodies' {@code Return}
 * nodes. Since bodies may call each other, this is iterated to a fixed point in function-name
 * order before the final analyses are produced.
 */
public class GraphAnalyzer {

    private final NodeCatalog catalog;

    public GraphAnalyzer(NodeCatalog catalog) {
        this.catalog = catalog;
    }

    public DocumentAnalysis analyzeDocument(GraphModel.Graph document) {
        FunctionIndex functions = FunctionIndex.of(document);
        NodePorts ports = new NodePorts(catalog, functions);

        Map<String, ValueType> returnTypes = new TreeMap<>();
        List<GraphModel.FunctionDef> inferred = new ArrayList<>();
        for (GraphModel.FunctionDef f : functions.all()) {
            ValueType declared = ValueType.parse(f.returnType);
            if (declared != null) {
                returnTypes.put(f.name, declared);
            } else {
                inferred.add(f);
            }
        }
        for (int round = 0; round <= inferred.size(); round++) {
            boolean changed = false;
            for (GraphModel.FunctionDef f : inferred) {
                ValueType t = analyze(Scope.of(f), ports, returnTypes).types().returnType();
                if (!t.equals(returnTypes.get(f.name))) {
                    returnTypes.put(f.name, t);
                    changed = true;
                }
            }
            if (!changed) break;
        }

        Map<String, GraphAnalysis> bodies = new LinkedHashMap<>();
        for (GraphModel.FunctionDef f : functions.all()) {
            bodies.put(f.name, analyze(Scope.of(f), ports, returnTypes));
        }
        GraphAnalysis top = analyze(Scope.top(document), ports, returnTypes);
        return new DocumentAnalysis(functions, ports, returnTypes, top, bodies);
    }

    /** Analyzes one body against already-known function return types. */
    public GraphAnalysis analyze(Scope scope, NodePorts ports, Map<String, ValueType> returnTypes) {
        EdgeIndex edges = EdgeIndex.build(scope.graph(), ports);
        Map<String, List<String>> successors = edges.dataSuccessors();

        List<SortedSet<String>> cycles = StronglyConnectedComponents.cycles(successors);
        SortedSet<String> cyclic = new TreeSet<>();
        cycles.forEach(cyclic::addAll);

        // cycle members are left out so that everything else still gets a definite place
        List<String> acyclic = new ArrayList<>();
        for (String id : edges.nodes().keySet()) {
            if (!cyclic.contains(id)) acyclic.add(id);
        }
        List<String> order = TopologicalSort.sort(acyclic, successors).order();

        List<String> visit = new ArrayList<>(order);
        visit.addAll(cyclic);
        TypeTable types = new TypeInference(scope, edges, ports, returnTypes).infer(visit);
        ControlStructure control = ControlStructure.analyze(edges, ports.catalog(), order, cyclic);

        return new GraphAnalysis(scope, edges, ports, cycles, order, cyclic, types, control);
    }
}
