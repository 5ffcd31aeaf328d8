package com.g2c.compiler.validation;

import com.g2c.compiler.analysis.ControlStructure;
import com.g2c.compiler.analysis.DocumentAnalysis;
import com.g2c.compiler.analysis.EdgeIndex;
import com.g2c.compiler.analysis.GraphAnalysis;
import com.g2c.compiler.analysis.GraphAnalyzer;
import com.g2c.compiler.analysis.NodePorts;
import com.g2c.compiler.analysis.Scope;
import com.g2c.compiler.analysis.TypeInference;
import com.g2c.compiler.analysis.TypeTable;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.NodeRole;
import com.g2c.compiler.ir.NodeSignature;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.PortRef;
import com.g2c.compiler.ir.PortSpec;
import com.g2c.compiler.ir.ValueType;
import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Checks a graph document before generation.
 *
 * <p>Missing {@code nodes}/{@code edges} arrays and missing node ids abort validation with
 * {@link Category#STRUCTURAL} errors, since nothing else can be checked meaningfully. Every other
 * problem is collected. Function bodies are checked through the same path as the top level,
 * with messages prefixed by the owning function. Running twice on the same document yields the
 * same list in the same order.
 */
public class GraphValidator {

    private final GraphAnalyzer analyzer;

    public GraphValidator(NodeCatalog catalog) {
        this.analyzer = new GraphAnalyzer(catalog);
    }

    public ValidationResult validate(GraphModel.Graph document) {
        List<Diagnostic> structural = checkShape(document);
        if (!structural.isEmpty()) {
            return new ValidationResult(structural);
        }
        DocumentAnalysis analysis = analyzer.analyzeDocument(document);

        List<Diagnostic> out = new ArrayList<>();
        checkFunctionNames(document, out);
        new BodyCheck(analysis, analysis.top(), out).run();
        for (GraphModel.FunctionDef f : analysis.functions().all()) {
            new BodyCheck(analysis, analysis.function(f.name), out).run();
        }
        return new ValidationResult(out);
    }

    // --- structural prerequisites ---

    static List<Diagnostic> checkShape(GraphModel.Graph document) {
        List<Diagnostic> out = new ArrayList<>();
        if (document == null) {
            out.add(structural("Document is empty", null));
            return out;
        }
        checkBodyShape(document, null, out);
        if (document.functions != null) {
            for (int i = 0; i < document.functions.size(); i++) {
                GraphModel.FunctionDef f = document.functions.get(i);
                if (f == null || f.name == null || f.name.isBlank()) {
                    out.add(structural("Function at index " + i + " has no name", null));
                    continue;
                }
                if (f.graph == null) {
                    out.add(structural("Function " + f.name + " has no graph", f.name));
                    continue;
                }
                checkBodyShape(f.graph, f.name, out);
                if (!f.graph.getFunctions().isEmpty()) {
                    out.add(structural("Function " + f.name + " declares nested functions", f.name));
                }
            }
        }
        return out;
    }

    private static void checkBodyShape(GraphModel.Graph graph, String function, List<Diagnostic> out) {
        if (graph.nodes == null) out.add(structural("Graph has no 'nodes' array", function));
        if (graph.edges == null) out.add(structural("Graph has no 'edges' array", function));
        List<GraphModel.Node> nodes = graph.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            GraphModel.Node n = nodes.get(i);
            if (n == null || n.id == null || n.id.isBlank()) {
                out.add(structural("Node at index " + i + " has no id", function));
            }
        }
        List<GraphModel.Edge> edges = graph.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            GraphModel.Edge e = edges.get(i);
            if (e == null) {
                out.add(structural("Edge at index " + i + " is null", function));
            } else if (!e.hasKnownKind()) {
                out.add(structural("Edge at index " + i + " (" + e.fromNode + " -> " + e.toNode
                        + ") has unknown kind '" + e.kind + "'; expected data or control", function));
            }
        }
    }

    private static Diagnostic structural(String message, String function) {
        String prefix = function != null ? "In function " + function + ": " : "";
        return new Diagnostic(Severity.ERROR, Category.STRUCTURAL, prefix + message, null, null, function, List.of());
    }

    private static void checkFunctionNames(GraphModel.Graph document, List<Diagnostic> out) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (GraphModel.FunctionDef f : document.getFunctions()) {
            counts.merge(f.name, 1, Integer::sum);
        }
        counts.forEach((name, count) -> {
            if (count > 1) {
                out.add(new Diagnostic(Severity.ERROR, Category.LINKAGE,
                        "Function " + name + " is defined " + count + " times; only the first definition is used",
                        null, null, name, List.of()));
            }
        });
    }

    // --- per-body checks ---

    private static final class BodyCheck {

        private final DocumentAnalysis document;
        private final GraphAnalysis analysis;
        private final Scope scope;
        private final EdgeIndex edges;
        private final NodePorts ports;
        private final TypeTable types;
        private final List<Diagnostic> out;

        /** Nodes already reported as malformed; their outputs are not blamed again. */
        private final Set<String> faulty = new HashSet<>();
        private final Set<EdgeIndex.ResolvedEdge> badEdges = new HashSet<>();

        BodyCheck(DocumentAnalysis document, GraphAnalysis analysis, List<Diagnostic> out) {
            this.document = document;
            this.analysis = analysis;
            this.scope = analysis.scope();
            this.edges = analysis.edges();
            this.ports = analysis.ports();
            this.types = analysis.types();
            this.out = out;
        }

        void run() {
            checkDuplicateIds();
            checkNodeTypes();
            checkParameters();
            checkDeclaredPorts();
            checkEdges();
            checkFanIn();
            checkRequiredInputs();
            checkEdgeTypes();
            checkCycles();
            checkUntypedConsumers();
            checkVariables();
            checkReturns();
            if (scope.isFunction()) checkParameterLinkage();
            checkControl();
        }

        private void checkDuplicateIds() {
            Map<String, Integer> counts = new LinkedHashMap<>();
            for (GraphModel.Node n : scope.graph().getNodes()) {
                counts.merge(n.id, 1, Integer::sum);
            }
            counts.forEach((id, count) -> {
                if (count > 1) {
                    error(Category.REFERENTIAL, "Duplicate node id '" + id + "' (" + count + " occurrences)", id, null, List.of());
                }
            });
        }

        private void checkNodeTypes() {
            for (GraphModel.Node n : edges.nodes().values()) {
                if (n.type == null || n.type.isBlank()) {
                    error(Category.REFERENTIAL, "Node " + n.id + " has no type", n.id, null, List.of());
                    faulty.add(n.id);
                } else if (!ports.catalog().contains(n.type)) {
                    error(Category.REFERENTIAL, "Node " + n.id + " has unknown type '" + n.type + "'", n.id, null, List.of());
                    faulty.add(n.id);
                }
            }
        }

        private void checkParameters() {
            for (GraphModel.Node n : edges.nodes().values()) {
                String type = NodeTypes.canonical(n.type);
                if (NodeTypes.LITERAL.equals(type)) {
                    JsonElement value = n.parameter("value");
                    if (value == null) {
                        fault(Category.TYPE, "Literal " + n.id + " has no value", n.id);
                    } else if (!value.isJsonPrimitive()) {
                        fault(Category.TYPE, "Literal " + n.id + " value must be a number, string or boolean", n.id);
                    }
                } else if (NodeTypes.CAST.equals(type)) {
                    ValueType target = ValueType.parse(n.stringParameter("targetType"));
                    if (target == null) {
                        fault(Category.TYPE, "Cast " + n.id + " has no targetType", n.id);
                    } else if (!target.isConcrete()) {
                        fault(Category.TYPE, "Cast " + n.id + " cannot convert to '" + target + "'", n.id);
                    }
                } else if (NodeTypes.VARIABLES.contains(type)) {
                    if (n.stringParameter("name") == null) {
                        fault(Category.REFERENTIAL, "Variable node " + n.id + " has no name", n.id);
                    }
                } else if (NodeTypes.CALL_FUNCTION.equals(type)) {
                    checkCall(n);
                } else if (NodeTypes.ARG.equals(type)) {
                    if (!scope.isFunction()) {
                        fault(Category.LINKAGE, "Arg node " + n.id + " is only allowed inside a function", n.id);
                    } else if (n.stringParameter("name") == null) {
                        fault(Category.LINKAGE, "Arg node " + n.id + " has no name", n.id);
                    } else if (!isParameter(n.stringParameter("name")) && !edges.dataOut(n.id).isEmpty()) {
                        fault(Category.LINKAGE, "Arg node " + n.id + " matches no parameter of "
                                + scope.functionName() + " but its value is used", n.id);
                    }
                }
            }
        }

        private boolean isParameter(String name) {
            for (GraphModel.Param p : scope.function().getParams()) {
                if (p != null && name.equals(p.name)) return true;
            }
            return false;
        }

        /**
         * Built-in and plugin nodes may restate their ports (to pin a type) but not rename them:
         * declared inputs must cover the required ones and declared ports must exist on the type.
         */
        private void checkDeclaredPorts() {
            for (GraphModel.Node n : edges.nodes().values()) {
                if (NodeTypes.CALL_FUNCTION.equals(NodeTypes.canonical(n.type))) continue;
                NodeSignature sig = ports.catalog().lookup(n.type).orElse(null);
                if (sig == null) continue;
                if (!n.getInputs().isEmpty()) {
                    Set<String> declared = new TreeSet<>();
                    for (GraphModel.Port p : n.getInputs()) {
                        if (p != null && p.name != null) declared.add(p.name);
                    }
                    Set<String> expected = new TreeSet<>();
                    Set<String> required = new TreeSet<>();
                    for (PortSpec p : sig.inputs()) {
                        expected.add(p.name());
                        if (!p.optional()) required.add(p.name());
                    }
                    if (!expected.containsAll(declared) || !declared.containsAll(required)) {
                        fault(Category.REFERENTIAL, "Node " + n.id + " declares inputs (" + String.join(", ", declared)
                                + ") that do not match type " + sig.type() + " (" + String.join(", ", expected) + ")", n.id);
                    }
                }
                for (GraphModel.Port p : n.getOutputs()) {
                    if (p != null && p.name != null && sig.output(p.name) == null) {
                        fault(Category.REFERENTIAL, "Node " + n.id + " declares output '" + p.name
                                + "' that type " + sig.type() + " does not have", n.id);
                    }
                }
            }
        }

        private void checkCall(GraphModel.Node n) {
            String callee = n.stringParameter("functionName");
            if (callee == null) {
                fault(Category.LINKAGE, "Call " + n.id + " has no functionName", n.id);
                return;
            }
            GraphModel.FunctionDef f = document.functions().get(callee);
            if (f == null) {
                fault(Category.LINKAGE, "Call " + n.id + " refers to unknown function '" + callee + "'", n.id);
                return;
            }
            if (!n.getInputs().isEmpty()) {
                Set<String> declared = new TreeSet<>();
                for (PortSpec p : ports.inputs(n)) declared.add(p.name());
                Set<String> params = new TreeSet<>();
                for (GraphModel.Param p : f.getParams()) {
                    if (p != null && p.name != null) params.add(p.name);
                }
                if (!declared.equals(params)) {
                    error(Category.LINKAGE, "Call " + n.id + " must take exactly the parameters of " + callee
                            + " (" + String.join(", ", params) + "), not (" + String.join(", ", declared) + ")",
                            n.id, null, List.of());
                }
            }
        }

        private void checkEdges() {
            List<GraphModel.Edge> raw = scope.graph().getEdges();
            for (int i = 0; i < raw.size(); i++) {
                GraphModel.Edge e = raw.get(i);
                if (edges.node(e.fromNode) == null) {
                    error(Category.REFERENTIAL, "Edge " + i + " references unknown source node '" + e.fromNode + "'",
                            edges.node(e.toNode) != null ? e.toNode : null, null, List.of());
                }
                if (edges.node(e.toNode) == null) {
                    error(Category.REFERENTIAL, "Edge " + i + " references unknown target node '" + e.toNode + "'",
                            edges.node(e.fromNode) != null ? e.fromNode : null, null, List.of());
                }
            }
            for (EdgeIndex.ResolvedEdge e : edges.all()) {
                if (e.control()) continue;
                GraphModel.Node from = edges.node(e.fromNode());
                GraphModel.Node to = edges.node(e.toNode());
                if (portsKnown(from) && ports.output(from, e.fromPort()) == null) {
                    error(Category.REFERENTIAL, "Node " + from.id + " has no output port '" + e.fromPort() + "'",
                            from.id, e.fromPort(), List.of(to.id));
                    badEdges.add(e);
                }
                if (portsKnown(to) && ports.input(to, e.toPort()) == null) {
                    error(Category.REFERENTIAL, "Node " + to.id + " has no input port '" + e.toPort() + "'",
                            to.id, e.toPort(), List.of(from.id));
                    badEdges.add(e);
                }
            }
        }

        /** False for nodes whose port list cannot be known (unknown type or callee). */
        private boolean portsKnown(GraphModel.Node n) {
            if (!n.getInputs().isEmpty() || !n.getOutputs().isEmpty()) return true;
            if (!ports.catalog().contains(n.type)) return false;
            if (NodeTypes.CALL_FUNCTION.equals(NodeTypes.canonical(n.type))) {
                return document.functions().contains(n.stringParameter("functionName"));
            }
            return true;
        }

        private void checkFanIn() {
            Map<PortRef, List<String>> sources = new TreeMap<>();
            for (EdgeIndex.ResolvedEdge e : edges.all()) {
                if (!e.control()) sources.computeIfAbsent(e.to(), k -> new ArrayList<>()).add(e.fromNode());
            }
            sources.forEach((port, from) -> {
                if (from.size() > 1) {
                    List<String> sorted = new ArrayList<>(from);
                    sorted.sort(null);
                    error(Category.REFERENTIAL, "Input port " + port + " has " + from.size()
                                    + " incoming data edges (from " + String.join(", ", sorted) + ")",
                            port.nodeId(), port.port(), sorted);
                }
            });
        }

        private void checkRequiredInputs() {
            for (GraphModel.Node n : edges.nodes().values()) {
                if (!portsKnown(n)) continue;
                boolean call = NodeTypes.CALL_FUNCTION.equals(NodeTypes.canonical(n.type));
                for (PortSpec in : ports.inputs(n)) {
                    if (!edges.dataInto(n.id, in.name()).isEmpty()) continue;
                    if (n.hasParameter(in.name())) {
                        add(Severity.INFO, Category.REFERENTIAL,
                                "Input " + n.id + "." + in.name() + " uses its literal default", n.id, in.name(), List.of());
                    } else if (!in.optional()) {
                        error(call ? Category.LINKAGE : Category.REFERENTIAL,
                                "Input port " + in.name() + " of node " + n.id + " is not connected and has no literal default",
                                n.id, in.name(), List.of());
                    }
                }
            }
        }

        private void checkEdgeTypes() {
            for (EdgeIndex.ResolvedEdge e : edges.all()) {
                if (e.control() || badEdges.contains(e)) continue;
                GraphModel.Node to = edges.node(e.toNode());
                if (!portsKnown(to)) continue;
                ValueType actual = types.typeOf(e.from());
                ValueType expected = ports.input(to, e.toPort()).type();
                if (actual != null && expected != null && !expected.accepts(actual)) {
                    error(Category.TYPE, "Type mismatch on edge " + e.from() + " -> " + e.to()
                                    + ": expected " + expected + ", got " + actual,
                            to.id, e.toPort(), List.of(e.fromNode(), e.toNode()));
                    add(Severity.INFO, Category.TYPE, "Insert a Cast node with targetType '" + expected
                                    + "' between " + e.fromNode() + " and " + e.toNode(),
                            to.id, e.toPort(), List.of(e.fromNode(), e.toNode()));
                }
            }
            for (GraphModel.Node n : edges.nodes().values()) {
                if (!portsKnown(n)) continue;
                for (PortSpec in : ports.inputs(n)) {
                    if (in.type() == null || !edges.dataInto(n.id, in.name()).isEmpty()) continue;
                    ValueType actual = TypeInference.literalType(n.parameter(in.name()));
                    if (actual != null && !in.type().accepts(actual)) {
                        error(Category.TYPE, "Literal default of " + n.id + "." + in.name() + " is " + actual
                                + ", expected " + in.type(), n.id, in.name(), List.of());
                    }
                }
            }
        }

        private void checkCycles() {
            for (SortedSet<String> cycle : analysis.cycles()) {
                error(Category.CYCLE, "Dataflow cycle among nodes {" + String.join(", ", cycle) + "}",
                        cycle.first(), null, new ArrayList<>(cycle));
            }
        }

        /**
         * Reports the first consumer of a value that never got a type. Producers inside cycles,
         * malformed producers and producers with unresolved inputs are reported elsewhere.
         */
        private void checkUntypedConsumers() {
            for (EdgeIndex.ResolvedEdge e : edges.all()) {
                if (e.control() || badEdges.contains(e)) continue;
                String from = e.fromNode();
                if (types.typeOf(e.from()) != null || analysis.isCyclic(from) || faulty.contains(from)) continue;
                if (analysis.role(from) == NodeRole.STATE_READ || !inputsResolved(edges.node(from))) continue;
                error(Category.TYPE, "Node " + e.toNode() + " consumes an untyped value from " + e.from(),
                        e.toNode(), e.toPort(), List.of(from));
            }
        }

        private boolean inputsResolved(GraphModel.Node n) {
            if (!portsKnown(n)) return false;
            for (PortSpec in : ports.inputs(n)) {
                List<EdgeIndex.ResolvedEdge> feeding = edges.dataInto(n.id, in.name());
                if (feeding.isEmpty()) {
                    if (!in.optional() && !n.hasParameter(in.name())) return false;
                } else if (types.typeOf(feeding.get(0).from()) == null) {
                    return false;
                }
            }
            return true;
        }

        private void checkVariables() {
            Map<String, String> firstUse = new TreeMap<>();
            for (GraphModel.Node n : edges.nodes().values()) {
                if (NodeTypes.VARIABLES.contains(NodeTypes.canonical(n.type)) && n.stringParameter("name") != null) {
                    firstUse.putIfAbsent(n.stringParameter("name"), n.id);
                }
            }
            firstUse.forEach((name, nodeId) -> {
                ValueType t = types.variable(name);
                if (t == null) {
                    error(Category.TYPE, "Cannot infer the type of variable " + name
                            + "; give it a typed VarDecl or assign it a typed value", nodeId, null, List.of());
                } else if (!t.isConcrete()) {
                    error(Category.TYPE, "Variable " + name
                            + " has no single concrete type; declare one with a VarDecl type", nodeId, null, List.of());
                }
            });
            for (GraphModel.Node n : edges.nodes().values()) {
                String type = NodeTypes.canonical(n.type);
                if (!NodeTypes.VAR_SET.equals(type) && !NodeTypes.VAR_DECL.equals(type)) continue;
                if (n.stringParameter("name") == null) continue;
                ValueType declared = types.variable(n.stringParameter("name"));
                ValueType value = valueType(n, "value");
                if (declared != null && declared.isConcrete() && value != null && !declared.accepts(value)) {
                    error(Category.TYPE, "Variable " + n.stringParameter("name") + " is " + declared
                            + " but node " + n.id + " assigns " + value, n.id, "value", List.of());
                }
            }
        }

        private void checkReturns() {
            ValueType declared = scope.isFunction() ? ValueType.parse(scope.function().returnType) : null;
            boolean anyReturn = false;
            for (GraphModel.Node n : edges.nodes().values()) {
                if (analysis.role(n.id) != NodeRole.RETURN) continue;
                anyReturn = true;
                boolean hasValue = !edges.dataInto(n.id, "value").isEmpty() || n.hasParameter("value");
                ValueType value = valueType(n, "value");
                if (!scope.isFunction()) {
                    if (value != null && !ValueType.INT.accepts(value)) {
                        error(Category.TYPE, "Top-level Return " + n.id + " must return an int exit status, got " + value,
                                n.id, "value", List.of());
                    }
                } else if (declared != null && declared.equals(ValueType.VOID) && hasValue) {
                    error(Category.LINKAGE, "Function " + scope.functionName() + " returns void but Return node "
                            + n.id + " carries a value", n.id, "value", List.of());
                } else if (declared != null && declared.isConcrete() && !hasValue) {
                    error(Category.LINKAGE, "Return node " + n.id + " must supply a " + declared + " value",
                            n.id, "value", List.of());
                } else if (declared != null && value != null && !declared.accepts(value)) {
                    error(Category.TYPE, "Return node " + n.id + " returns " + value + " but the function returns "
                            + declared, n.id, "value", List.of());
                }
            }
            if (!scope.isFunction()) return;
            if (declared != null && !declared.equals(ValueType.VOID) && !anyReturn) {
                error(Category.LINKAGE, "Function " + scope.functionName() + " declares return type " + declared
                        + " but has no Return node", null, null, List.of());
            }
            ValueType inferred = document.returnType(scope.functionName());
            if (declared == null && inferred != null && inferred.kind() == ValueType.Kind.ANY) {
                error(Category.LINKAGE, "Cannot infer the return type of function " + scope.functionName()
                        + "; declare its returnType", null, null, List.of());
            }
        }

        private void checkParameterLinkage() {
            Map<String, List<String>> argNodes = new LinkedHashMap<>();
            for (GraphModel.Node n : edges.nodes().values()) {
                if (analysis.role(n.id) == NodeRole.ARGUMENT && n.stringParameter("name") != null) {
                    argNodes.computeIfAbsent(n.stringParameter("name"), k -> new ArrayList<>()).add(n.id);
                }
            }
            Set<String> params = new HashSet<>();
            for (GraphModel.Param p : scope.function().getParams()) {
                if (p == null || p.name == null || p.name.isBlank()) {
                    error(Category.LINKAGE, "Function " + scope.functionName() + " has a parameter without a name",
                            null, null, List.of());
                    continue;
                }
                if (!params.add(p.name)) {
                    error(Category.LINKAGE, "Parameter " + p.name + " is declared more than once", null, null, List.of());
                    continue;
                }
                List<String> sources = argNodes.getOrDefault(p.name, List.of());
                if (sources.isEmpty()) {
                    error(Category.LINKAGE, "Parameter " + p.name + " has no matching Arg node", null, null, List.of());
                } else if (sources.size() > 1) {
                    error(Category.LINKAGE, "Parameter " + p.name + " has " + sources.size()
                            + " Arg nodes: " + String.join(", ", sources), sources.get(0), null, sources);
                }
            }
            argNodes.forEach((name, nodes) -> {
                if (!params.contains(name)) {
                    for (String id : nodes) {
                        if (faulty.contains(id)) continue;
                        add(Severity.WARNING, Category.LINKAGE, "Arg node " + id + " does not match any parameter of "
                                + scope.functionName(), id, null, List.of());
                    }
                }
            });
        }

        private void checkControl() {
            for (ControlStructure.Issue issue : analysis.control().issues()) {
                add(issue.error() ? Severity.ERROR : Severity.WARNING, Category.CONTROL, issue.message(),
                        issue.nodeId(), null, issue.related());
            }
        }

        // --- helpers ---

        private ValueType valueType(GraphModel.Node n, String port) {
            EdgeIndex.ResolvedEdge feeding = edges.feeding(n.id, port);
            if (feeding != null) return types.typeOf(feeding.from());
            return TypeInference.literalType(n.parameter(port));
        }

        private void fault(Category category, String message, String nodeId) {
            faulty.add(nodeId);
            error(category, message, nodeId, null, List.of());
        }

        private void error(Category category, String message, String nodeId, String port, List<String> related) {
            add(Severity.ERROR, category, message, nodeId, port, related);
        }

        private void add(Severity severity, Category category, String message, String nodeId, String port,
                         List<String> related) {
            out.add(new Diagnostic(severity, category, scope.messagePrefix() + message, nodeId, port,
                    scope.functionName(), related));
        }
    }
}
