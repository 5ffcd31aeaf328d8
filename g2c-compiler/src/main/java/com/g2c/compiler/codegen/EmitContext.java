package com.g2c.compiler.codegen;

import com.g2c.compiler.analysis.ControlStructure;
import com.g2c.compiler.analysis.EdgeIndex;
import com.g2c.compiler.analysis.GraphAnalysis;
import com.g2c.compiler.analysis.Scope;
import com.g2c.compiler.analysis.TypeInference;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.ValueType;
import com.g2c.compiler.symbols.SymbolTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Everything a {@link NodeRule} sees while one body is generated: the body's analysis and
 * symbol table, the program-wide declarations, and the output buffer. Created per body and
 * discarded afterwards.
 */
public final class EmitContext {

    private final GraphAnalysis analysis;
    private final SymbolTable symbols;
    private final Declarations declarations;
    private final GeneratorOptions options;
    private final RuleRegistry rules;
    private final ProgramInfo program;
    private final SourceBuffer buffer;

    private final Map<String, CompilationMap.NodeSpan> spans = new LinkedHashMap<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    /** Document-level facts shared by every body: function identifiers and return types. */
    interface ProgramInfo {
        String functionIdentifier(String function);

        ValueType returnType(String function);

        GraphModel.FunctionDef function(String name);
    }

    private record PendingPort(String nodeId, String port, int startColumn, int endColumn) {}

    private static final class Frame {
        final String nodeId;
        final List<CompilationMap.PortSpan> ports = new ArrayList<>();

        Frame(String nodeId) {
            this.nodeId = nodeId;
        }
    }

    EmitContext(GraphAnalysis analysis, SymbolTable symbols, Declarations declarations, GeneratorOptions options,
                RuleRegistry rules, ProgramInfo program) {
        this.analysis = analysis;
        this.symbols = symbols;
        this.declarations = declarations;
        this.options = options;
        this.rules = rules;
        this.program = program;
        this.buffer = new SourceBuffer(options.indent());
    }

    public Scope scope() {
        return analysis.scope();
    }

    public GraphAnalysis analysis() {
        return analysis;
    }

    public EdgeIndex edges() {
        return analysis.edges();
    }

    public ControlStructure control() {
        return analysis.control();
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public Declarations declarations() {
        return declarations;
    }

    public GeneratorOptions options() {
        return options;
    }

    public String functionIdentifier(String function) {
        return program.functionIdentifier(function);
    }

    public ValueType returnType(String function) {
        return program.returnType(function);
    }

    public GraphModel.FunctionDef function(String name) {
        return program.function(name);
    }

    // --- inputs and outputs ---

    /** True if the input has a data edge or a literal default. */
    public boolean hasInput(GraphModel.Node node, String port) {
        return edges().feeding(node.id, port) != null || node.hasParameter(port);
    }

    /**
     * C++ expression for an input: the producer's identifier, or the literal default.
     *
     * @throws CodeGenerator.GenerationException if neither exists or the producer was not emitted first
     */
    public String input(GraphModel.Node node, String port) {
        EdgeIndex.ResolvedEdge feeding = edges().feeding(node.id, port);
        if (feeding != null) {
            String id = symbols.lookup(feeding.fromNode(), feeding.fromPort());
            if (id == null) {
                throw new CodeGenerator.GenerationException(scope().messagePrefix() + "Input " + node.id + "." + port
                        + " reads " + feeding.from() + ", which has not been generated yet");
            }
            return id;
        }
        if (node.hasParameter(port)) {
            try {
                ValueType type = inputType(node, port);
                declarations.requireType(type);
                return CppSyntax.literal(node.parameter(port), type);
            } catch (IllegalArgumentException e) {
                throw new CodeGenerator.GenerationException(scope().messagePrefix() + "Literal default of "
                        + node.id + "." + port + " is not a scalar", e);
            }
        }
        throw new CodeGenerator.GenerationException(scope().messagePrefix() + "Input " + node.id + "." + port
                + " has no data edge and no literal default");
    }

    public ValueType inputType(GraphModel.Node node, String port) {
        EdgeIndex.ResolvedEdge feeding = edges().feeding(node.id, port);
        if (feeding != null) return analysis.types().typeOf(feeding.from());
        return TypeInference.literalType(node.parameter(port));
    }

    public ValueType outputType(GraphModel.Node node, String port) {
        return analysis.types().typeOf(node.id, port);
    }

    /** True if some data edge reads this output. */
    public boolean isConsumed(GraphModel.Node node) {
        return !edges().dataOut(node.id).isEmpty();
    }

    // --- writing ---

    /** Starts a line at the current indentation. */
    public Line line() {
        return new Line(buffer.prefix());
    }

    /**
     * Starts {@code <type> <id> = } for an output, binding a fresh identifier for it.
     */
    public Line declare(GraphModel.Node node, String port) {
        String id = symbols.bind(node.id, port, hint(node));
        ValueType type = outputType(node, port);
        declarations.requireType(type);
        return line().text(CppSyntax.declarationType(type) + " " + id + " = ");
    }

    /** Writes a whole statement line. */
    public int statement(String text) {
        return buffer.add(text);
    }

    public void indent() {
        buffer.indent();
    }

    public void dedent() {
        buffer.dedent();
    }

    /** Generates every node scheduled in {@code region}, in order. */
    public void emitRegion(ControlStructure.Region region) {
        for (String id : control().schedule(region)) {
            emitNode(id);
        }
    }

    void emitNode(String id) {
        GraphModel.Node node = edges().node(id);
        NodeRule rule = rules.get(node.type).orElseThrow(() -> new CodeGenerator.GenerationException(
                scope().messagePrefix() + "No generation rule for node type '" + node.type + "' (node " + id + ")"));
        int start = buffer.nextLine();
        if (options.emitNodeMarkers()) {
            buffer.add("// node: " + id.replace('\n', ' ').replace('\r', ' '));
        }
        frames.push(new Frame(id));
        try {
            rule.emit(node, this);
        } finally {
            Frame frame = frames.pop();
            int end = buffer.lastLine();
            if (end >= start) {
                spans.put(id, new CompilationMap.NodeSpan(start, end, frame.ports));
            }
        }
    }

    /** Maps a node that emits nothing of its own onto an existing line (argument sources). */
    void mapToLine(String nodeId, int line) {
        spans.put(nodeId, new CompilationMap.NodeSpan(line, line, List.of()));
    }

    SourceBuffer buffer() {
        return buffer;
    }

    Map<String, CompilationMap.NodeSpan> spans() {
        return spans;
    }

    static String hint(GraphModel.Node node) {
        String type = NodeTypes.canonical(node.type);
        return type == null ? "v" : type.toLowerCase(Locale.ROOT);
    }

    /**
     * One output line under construction. Input expressions written through
     * {@link #input(GraphModel.Node, String)} record their column range for the current node.
     */
    public final class Line {

        private final StringBuilder sb;
        private final List<PendingPort> pending = new ArrayList<>();

        private Line(String prefix) {
            this.sb = new StringBuilder(prefix);
        }

        public Line text(String s) {
            sb.append(s);
            return this;
        }

        public Line input(GraphModel.Node node, String port) {
            String expr = EmitContext.this.input(node, port);
            int start = sb.length() + 1;
            sb.append(expr);
            pending.add(new PendingPort(node.id, port, start, sb.length()));
            return this;
        }

        /** Writes the line and returns its number. */
        public int end() {
            int line = buffer.addRaw(sb.toString());
            Frame frame = frames.peek();
            if (frame != null) {
                for (PendingPort p : pending) {
                    if (p.nodeId().equals(frame.nodeId)) {
                        frame.ports.add(new CompilationMap.PortSpan(p.port(), line, p.startColumn(), p.endColumn()));
                    }
                }
            }
            return line;
        }
    }
}
