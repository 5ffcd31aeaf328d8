package com.g2c.compiler.codegen;

import com.g2c.compiler.analysis.ControlStructure;
import com.g2c.compiler.analysis.ControlStructure.Region;
import com.g2c.compiler.analysis.ControlStructure.Tag;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeTypes;
import com.g2c.compiler.ir.ValueType;

import java.util.Map;

/**
 * Generation rules of the built-in node vocabulary.
 */
final class BuiltInRules {

    private static final Map<String, String> BINARY_OPERATORS = Map.ofEntries(
            Map.entry(NodeTypes.ADD, "+"),
            Map.entry(NodeTypes.SUB, "-"),
            Map.entry(NodeTypes.MUL, "*"),
            Map.entry(NodeTypes.DIV, "/"),
            Map.entry(NodeTypes.MOD, "%"),
            Map.entry(NodeTypes.EQ, "=="),
            Map.entry(NodeTypes.NEQ, "!="),
            Map.entry(NodeTypes.LT, "<"),
            Map.entry(NodeTypes.GT, ">"),
            Map.entry(NodeTypes.LTE, "<="),
            Map.entry(NodeTypes.GTE, ">="),
            Map.entry(NodeTypes.AND, "&&"),
            Map.entry(NodeTypes.OR, "||")
    );

    private BuiltInRules() {}

    static void registerAll(RuleRegistry registry) {
        registry.register(NodeTypes.LITERAL, BuiltInRules::literal);
        BINARY_OPERATORS.keySet().stream().sorted().forEach(type -> registry.register(type, BuiltInRules::binary));
        registry.register(NodeTypes.NOT, BuiltInRules::not);
        registry.register(NodeTypes.CONCAT, BuiltInRules::concat);
        registry.register(NodeTypes.CAST, BuiltInRules::cast);
        registry.register(NodeTypes.VAR_GET, BuiltInRules::varGet);
        registry.register(NodeTypes.VAR_SET, BuiltInRules::varSet);
        registry.register(NodeTypes.VAR_DECL, BuiltInRules::varDecl);
        registry.register(NodeTypes.PRINT, BuiltInRules::print);
        registry.register(NodeTypes.RETURN, BuiltInRules::ret);
        // argument sources resolve to the formal parameter and are never scheduled
        registry.register(NodeTypes.ARG, (node, ctx) -> { });
        registry.register(NodeTypes.CALL_FUNCTION, BuiltInRules::call);
        registry.register(NodeTypes.IF, BuiltInRules::conditional);
        registry.register(NodeTypes.WHILE, BuiltInRules::loop);
    }

    static void literal(GraphModel.Node node, EmitContext ctx) {
        ValueType type = ctx.outputType(node, "out");
        ctx.declare(node, "out").text(CppSyntax.literal(node.parameter("value"), type) + ";").end();
    }

    static void binary(GraphModel.Node node, EmitContext ctx) {
        String type = NodeTypes.canonical(node.type);
        EmitContext.Line line = ctx.declare(node, "out");
        if (NodeTypes.MOD.equals(type) && ValueType.DOUBLE.equals(ctx.outputType(node, "out"))) {
            ctx.declarations().include("<cmath>");
            line.text("std::fmod(").input(node, "a").text(", ").input(node, "b").text(");").end();
            return;
        }
        line.input(node, "a").text(" " + BINARY_OPERATORS.get(type) + " ").input(node, "b").text(";").end();
    }

    static void not(GraphModel.Node node, EmitContext ctx) {
        ctx.declare(node, "out").text("!(").input(node, "in").text(");").end();
    }

    static void concat(GraphModel.Node node, EmitContext ctx) {
        requireStringHelper(ctx);
        ctx.declare(node, "out").text("g2c_str(").input(node, "a").text(") + g2c_str(").input(node, "b").text(");").end();
    }

    static void cast(GraphModel.Node node, EmitContext ctx) {
        ValueType target = ValueType.parse(node.stringParameter("targetType"));
        ValueType source = ctx.inputType(node, "in");
        EmitContext.Line line = ctx.declare(node, "out");
        if (ValueType.STRING.equals(target)) {
            requireStringHelper(ctx);
            line.text("g2c_str(").input(node, "in").text(");").end();
        } else if (ValueType.STRING.equals(source) && ValueType.INT.equals(target)) {
            ctx.declarations().include("<string>");
            line.text("std::stoi(").input(node, "in").text(");").end();
        } else if (ValueType.STRING.equals(source) && ValueType.DOUBLE.equals(target)) {
            ctx.declarations().include("<string>");
            line.text("std::stod(").input(node, "in").text(");").end();
        } else if (ValueType.STRING.equals(source) && ValueType.BOOL.equals(target)) {
            line.text("(").input(node, "in").text(" == \"true\");").end();
        } else {
            line.text("static_cast<" + target.cppName() + ">(").input(node, "in").text(");").end();
        }
    }

    static void varGet(GraphModel.Node node, EmitContext ctx) {
        String variable = ctx.symbols().variable(node.stringParameter("name"));
        ctx.declare(node, "out").text(variable + ";").end();
    }

    static void varSet(GraphModel.Node node, EmitContext ctx) {
        String variable = ctx.symbols().variable(node.stringParameter("name"));
        ctx.line().text(variable + " = ").input(node, "value").text(";").end();
        if (ctx.isConsumed(node)) {
            ctx.declare(node, "out").text(variable + ";").end();
        }
    }

    static void varDecl(GraphModel.Node node, EmitContext ctx) {
        if (!ctx.hasInput(node, "value")) return;
        String variable = ctx.symbols().variable(node.stringParameter("name"));
        ctx.line().text(variable + " = ").input(node, "value").text(";").end();
    }

    static void print(GraphModel.Node node, EmitContext ctx) {
        ctx.declarations().include("<iostream>");
        EmitContext.Line line = ctx.line().text("std::cout << ");
        if (ValueType.BOOL.equals(ctx.inputType(node, "text"))) {
            line.text("(").input(node, "text").text(" ? \"true\" : \"false\")");
        } else {
            line.input(node, "text");
        }
        line.text(" << std::endl;").end();
    }

    static void ret(GraphModel.Node node, EmitContext ctx) {
        if (ctx.hasInput(node, "value")) {
            ctx.line().text("return ").input(node, "value").text(";").end();
        } else {
            ctx.statement(ctx.scope().isFunction() ? "return;" : "return 0;");
        }
    }

    static void call(GraphModel.Node node, EmitContext ctx) {
        String name = node.stringParameter("functionName");
        GraphModel.FunctionDef callee = ctx.function(name);
        if (callee == null) {
            throw new CodeGenerator.GenerationException(ctx.scope().messagePrefix() + "Call " + node.id
                    + " refers to unknown function '" + name + "'");
        }
        ValueType returns = ctx.returnType(name);
        EmitContext.Line line = returns != null && !returns.equals(ValueType.VOID)
                ? ctx.declare(node, "out")
                : ctx.line();
        line.text(ctx.functionIdentifier(name) + "(");
        boolean first = true;
        for (GraphModel.Param p : callee.getParams()) {
            if (!first) line.text(", ");
            line.input(node, p.name);
            first = false;
        }
        line.text(");").end();
    }

    static void conditional(GraphModel.Node node, EmitContext ctx) {
        ControlStructure control = ctx.control();
        ctx.line().text("if (").input(node, "cond").text(") {").end();
        ctx.indent();
        ctx.emitRegion(new Region(node.id, Tag.THEN));
        ctx.dedent();
        if (control.successor(node.id, Tag.ELSE) != null) {
            ctx.statement("} else {");
            ctx.indent();
            ctx.emitRegion(new Region(node.id, Tag.ELSE));
            ctx.dedent();
        }
        ctx.statement("}");
    }

    /**
     * Emits a guarded loop. The header region (the condition and everything it reads) is
     * re-evaluated on every iteration; exceeding the guard limit aborts with exit status 3.
     */
    static void loop(GraphModel.Node node, EmitContext ctx) {
        ctx.declarations().include("<cstdlib>");
        ctx.declarations().include("<iostream>");
        String guard = ctx.symbols().fresh("guard");
        long limit = ctx.options().loopGuardLimit();

        ctx.statement("long long " + guard + " = 0;");
        ctx.statement("while (true) {");
        ctx.indent();
        ctx.emitRegion(new Region(node.id, Tag.COND));
        ctx.line().text("if (!(").input(node, "cond").text(")) break;").end();
        ctx.statement("if (++" + guard + " > " + limit + "LL) { std::cerr << "
                + CppSyntax.quote("g2c: loop guard exceeded in node " + node.id + " (limit " + limit + ")")
                + " << std::endl; std::exit(3); }");
        ctx.emitRegion(new Region(node.id, Tag.BODY));
        ctx.dedent();
        ctx.statement("}");
    }

    private static void requireStringHelper(EmitContext ctx) {
        ctx.declarations().include("<sstream>");
        ctx.declarations().include("<string>");
        ctx.declarations().declare(CppSyntax.STR_HELPER);
    }
}
