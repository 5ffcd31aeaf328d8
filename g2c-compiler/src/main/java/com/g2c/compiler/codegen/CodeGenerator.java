package com.g2c.compiler.codegen;

import com.g2c.compiler.analysis.ControlStructure;
import com.g2c.compiler.analysis.DocumentAnalysis;
import com.g2c.compiler.analysis.GraphAnalysis;
import com.g2c.compiler.analysis.Scope;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeRole;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.ValueType;
import com.g2c.compiler.symbols.SymbolTable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns a validated document into C++17 source plus a {@link CompilationMap}.
 *
 * <p>Each body (every function, then the top level as {@code main}) goes through the same
 * steps: open the signature and declare the body's variables, emit the top region's schedule
 * through the rule registry (branches and loops recurse into their own regions), add the
 * implicit default return, close. The program is assembled as sorted includes, declarations
 * in first-use order, function prototypes, function definitions and {@code main}.
 *
 * <p>Generation is a pure function of the document, the rule set and the options: the same
 * inputs always give byte-identical source and an identical map.
 */
public class CodeGenerator {

    private final RuleRegistry rules;
    private final GeneratorOptions options;

    public CodeGenerator(RuleRegistry rules, GeneratorOptions options) {
        this.rules = rules;
        this.options = options;
    }

    /** Result of one generation run. */
    public record GeneratedProgram(String source, CompilationMap map) {}

    /** Raised when the document cannot be generated; no partial output is produced. */
    public static class GenerationException extends RuntimeException {
        public GenerationException(String message) { super(message); }
        public GenerationException(String message, Throwable cause) { super(message, cause); }
    }

    private record Body(Scope scope, String prototype, EmitContext ctx) {}

    /**
     * @param document a document the validator accepted
     * @param analysis the analysis of that document
     * @throws GenerationException on an invariant violation, e.g. an input with no producer
     */
    public GeneratedProgram generate(GraphModel.Graph document, DocumentAnalysis analysis) {
        Declarations declarations = new Declarations();
        for (String header : document.getImports()) {
            if (header != null) declarations.include(header);
        }

        Map<String, String> functionIds = functionIdentifiers(analysis);
        EmitContext.ProgramInfo program = new EmitContext.ProgramInfo() {
            @Override
            public String functionIdentifier(String function) {
                return functionIds.get(function);
            }

            @Override
            public ValueType returnType(String function) {
                return analysis.returnType(function);
            }

            @Override
            public GraphModel.FunctionDef function(String name) {
                return analysis.functions().get(name);
            }
        };

        List<Body> functions = new ArrayList<>();
        for (GraphModel.FunctionDef f : analysis.functions().all()) {
            functions.add(generateFunction(f, analysis, functionIds, declarations, program));
        }
        Body main = generateMain(analysis.top(), functionIds, declarations, program);

        return assemble(declarations, functions, main);
    }

    // --- bodies ---

    private Body generateFunction(GraphModel.FunctionDef f, DocumentAnalysis document, Map<String, String> functionIds,
                                  Declarations declarations, EmitContext.ProgramInfo program) {
        GraphAnalysis analysis = document.function(f.name);
        SymbolTable symbols = new SymbolTable(functionIds.values());

        List<String> templateParams = new ArrayList<>();
        List<String> formals = new ArrayList<>();
        Map<String, String> paramIds = new LinkedHashMap<>();
        for (GraphModel.Param p : f.getParams()) {
            String id = uniqueParameter(p.name, symbols);
            paramIds.put(p.name, id);
            ValueType type = ValueType.parse(p.type);
            String cppType;
            if (type == null || type.kind() == ValueType.Kind.ANY) {
                cppType = "T" + templateParams.size();
                templateParams.add("typename " + cppType);
            } else {
                cppType = type.cppName();
                declarations.requireType(type);
            }
            formals.add(cppType + " " + id);
        }

        ValueType returnType = document.returnType(f.name);
        if (returnType == null) returnType = ValueType.VOID;
        declarations.requireType(returnType);
        String template = templateParams.isEmpty() ? "" : "template <" + String.join(", ", templateParams) + ">";
        String signature = returnType.cppName() + " " + functionIds.get(f.name) + "(" + String.join(", ", formals) + ")";

        EmitContext ctx = new EmitContext(analysis, symbols, declarations, options, rules, program);
        SourceBuffer buffer = ctx.buffer();
        if (!template.isEmpty()) buffer.add(template);
        int signatureLine = buffer.add(signature + " {");

        for (GraphModel.Node n : analysis.edges().nodes().values()) {
            if (analysis.role(n.id) != NodeRole.ARGUMENT) continue;
            String param = paramIds.get(n.stringParameter("name"));
            if (param == null) continue;
            symbols.seed(n.id, "out", param);
            ctx.mapToLine(n.id, signatureLine);
        }

        buffer.indent();
        declareVariables(ctx);
        ctx.emitRegion(ControlStructure.Region.TOP);
        if (!returnType.equals(ValueType.VOID) && !hasTopLevelReturn(analysis)) {
            buffer.add("return " + returnType.cppName() + "{};");
        }
        buffer.dedent();
        buffer.add("}");

        String prototype = (template.isEmpty() ? "" : template + " ") + signature + ";";
        return new Body(analysis.scope(), prototype, ctx);
    }

    private Body generateMain(GraphAnalysis analysis, Map<String, String> functionIds, Declarations declarations,
                              EmitContext.ProgramInfo program) {
        SymbolTable symbols = new SymbolTable(functionIds.values());
        EmitContext ctx = new EmitContext(analysis, symbols, declarations, options, rules, program);
        SourceBuffer buffer = ctx.buffer();
        buffer.add("int main() {");
        buffer.indent();
        declareVariables(ctx);
        ctx.emitRegion(ControlStructure.Region.TOP);
        if (!hasTopLevelReturn(analysis)) {
            buffer.add("return 0;");
        }
        buffer.dedent();
        buffer.add("}");
        return new Body(analysis.scope(), null, ctx);
    }

    /** Every variable of the body is declared once, value-initialized, before the first statement. */
    private static void declareVariables(EmitContext ctx) {
        Set<String> names = new TreeSet<>();
        for (GraphModel.Node n : ctx.edges().nodes().values()) {
            if (NodeTypes.VARIABLES.contains(NodeTypes.canonical(n.type)) && n.stringParameter("name") != null) {
                names.add(n.stringParameter("name"));
            }
        }
        for (String name : names) {
            ValueType type = ctx.analysis().types().variable(name);
            if (type == null || !type.isConcrete()) {
                throw new GenerationException(ctx.scope().messagePrefix() + "Variable " + name + " has no concrete type");
            }
            ctx.declarations().requireType(type);
            ctx.statement(type.cppName() + " " + ctx.symbols().variable(name) + "{};");
        }
    }

    private static boolean hasTopLevelReturn(GraphAnalysis analysis) {
        for (String id : analysis.control().schedule(ControlStructure.Region.TOP)) {
            if (analysis.role(id) == NodeRole.RETURN) return true;
        }
        return false;
    }

    private static String uniqueParameter(String name, SymbolTable symbols) {
        String base = SymbolTable.parameterName(name);
        String id = base;
        for (int n = 1; symbols.isTaken(id); n++) {
            id = base + "_" + n;
        }
        symbols.reserve(id);
        return id;
    }

    /** One identifier per function, in name order; sanitized names that collide get a suffix. */
    private static Map<String, String> functionIdentifiers(DocumentAnalysis analysis) {
        Map<String, String> ids = new TreeMap<>();
        Set<String> taken = new HashSet<>();
        for (GraphModel.FunctionDef f : analysis.functions().all()) {
            String base = SymbolTable.functionName(f.name);
            String id = base;
            for (int n = 1; !taken.add(id); n++) {
                id = base + "_" + n;
            }
            ids.put(f.name, id);
        }
        return ids;
    }

    // --- assembly ---

    private static GeneratedProgram assemble(Declarations declarations, List<Body> functions, Body main) {
        List<String> lines = new ArrayList<>(declarations.includeLines());
        List<String> declared = declarations.declarationLines();
        if (!declared.isEmpty()) {
            if (!lines.isEmpty()) lines.add("");
            lines.addAll(declared);
        }
        if (!functions.isEmpty()) {
            if (!lines.isEmpty()) lines.add("");
            for (Body f : functions) lines.add(f.prototype());
        }

        Map<String, CompilationMap.NodeSpan> spans = new TreeMap<>();
        List<Body> bodies = new ArrayList<>(functions);
        bodies.add(main);
        for (Body body : bodies) {
            if (!lines.isEmpty()) lines.add("");
            int offset = lines.size();
            lines.addAll(body.ctx().buffer().lines());
            Scope scope = body.scope();
            body.ctx().spans().forEach((nodeId, span) -> {
                String key = scope.qualify(nodeId);
                if (spans.containsKey(key)) {
                    throw new GenerationException("Compilation map key " + key + " is used by two nodes; "
                            + "rename the top-level node so it does not look like a function-qualified id");
                }
                spans.put(key, shift(span, offset, scope.functionName(), nodeId));
            });
        }
        return new GeneratedProgram(String.join("\n", lines) + "\n", new CompilationMap(spans));
    }

    private static CompilationMap.NodeSpan shift(CompilationMap.NodeSpan span, int offset, String function,
                                                 String nodeId) {
        List<CompilationMap.PortSpan> ports = new ArrayList<>();
        for (CompilationMap.PortSpan p : span.getPorts()) {
            ports.add(new CompilationMap.PortSpan(p.port, p.line + offset, p.startColumn, p.endColumn));
        }
        return new CompilationMap.NodeSpan(span.startLine + offset, span.endLine + offset, ports, function,
                function != null ? nodeId : null);
    }
}
