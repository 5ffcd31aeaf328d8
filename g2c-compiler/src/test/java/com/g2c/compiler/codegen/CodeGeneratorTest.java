package com.g2c.compiler.codegen;

import com.g2c.compiler.TestGraphs;
import com.g2c.compiler.analysis.DocumentAnalysis;
import com.g2c.compiler.analysis.GraphAnalyzer;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.NodeRole;
import com.g2c.compiler.ir.NodeSignature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeGeneratorTest {

    private static CodeGenerator.GeneratedProgram generate(GraphModel.Graph g, GeneratorOptions options) {
        GraphAnalyzer analyzer = new GraphAnalyzer(NodeCatalog.builtIns());
        return new CodeGenerator(RuleRegistry.builtIns(), options).generate(g, analyzer.analyzeDocument(g));
    }

    private static CodeGenerator.GeneratedProgram generate(GraphModel.Graph g) {
        return generate(g, GeneratorOptions.defaults());
    }

    @Test
    void helloWorldSource() {
        CodeGenerator.GeneratedProgram program = generate(TestGraphs.fixture("hello.json"));
        String expected = String.join("\n",
                "#include <iostream>",
                "#include <string>",
                "",
                "int main() {",
                "    // node: n1",
                "    std::string literal_1 = std::string(\"Hello\");",
                "    // node: n2",
                "    std::cout << literal_1 << std::endl;",
                "    return 0;",
                "}",
                "");
        assertEquals(expected, program.source());
    }

    @Test
    void helloWorldMapCoversMarkerAndStatement() {
        CompilationMap map = generate(TestGraphs.fixture("hello.json")).map();
        assertEquals(2, map.size());
        assertEquals(5, map.get("n1").startLine);
        assertEquals(6, map.get("n1").endLine);
        CompilationMap.NodeSpan print = map.get("n2");
        assertEquals(7, print.startLine);
        assertEquals(8, print.endLine);
        CompilationMap.PortSpan text = print.getPorts().get(0);
        assertEquals("text", text.port);
        assertEquals(8, text.line);
        assertEquals(18, text.startColumn);
        assertEquals(26, text.endColumn);
    }

    @Test
    void functionsArePrototypedAndDefinedBeforeMain() {
        CodeGenerator.GeneratedProgram program = generate(TestGraphs.fixture("square.json"));
        String expected = String.join("\n",
                "#include <iostream>",
                "",
                "int g2c_u_square(int g2c_u_x);",
                "",
                "int g2c_u_square(int g2c_u_x) {",
                "    // node: mul",
                "    int mul_1 = g2c_u_x * g2c_u_x;",
                "    // node: ret",
                "    return mul_1;",
                "}",
                "",
                "int main() {",
                "    // node: seven",
                "    int literal_1 = 7;",
                "    // node: call",
                "    int callfunction_1 = g2c_u_square(literal_1);",
                "    // node: show",
                "    std::cout << callfunction_1 << std::endl;",
                "    return 0;",
                "}",
                "");
        assertEquals(expected, program.source());

        CompilationMap map = program.map();
        assertEquals(5, map.get("square::arg").startLine);
        assertEquals(6, map.get("square::mul").startLine);
        assertEquals(13, map.get("seven").startLine);
        assertFalse(map.contains("mul"));
        assertEquals("square", map.get("square::mul").function);
        assertEquals("mul", map.get("square::mul").node);
        assertNull(map.get("seven").function);
    }

    @Test
    void loopIsGuardedAndReadsItsConditionEachIteration() {
        String source = generate(TestGraphs.fixture("counter-loop.json")).source();
        List<String> lines = List.of(source.split("\n"));
        assertEquals("    int g2c_u_i{};", lines.get(lines.indexOf("int main() {") + 1));
        assertTrue(source.contains("    long long guard_1 = 0;\n    while (true) {\n"));
        assertTrue(source.contains("        int varget_1 = g2c_u_i;\n"));
        assertTrue(source.contains("        if (!(lt_1)) break;\n"));
        assertTrue(source.contains("        if (++guard_1 > 100000LL) { std::cerr << "
                + "\"g2c: loop guard exceeded in node loop (limit 100000)\" << std::endl; std::exit(3); }\n"));
        assertTrue(source.contains("        g2c_u_i = add_1;\n"));
        assertTrue(source.startsWith("#include <cstdlib>\n#include <iostream>\n"));
        // the condition is recomputed inside the loop, before the guard
        assertTrue(source.indexOf("int varget_1") > source.indexOf("while (true)"));
        assertTrue(source.indexOf("int varget_1") < source.indexOf("if (!(lt_1)) break;"));
    }

    @Test
    void loopThatNeverEndsStillHasGuardExit() {
        String source = generate(TestGraphs.graph()
                .node("t", "Literal", "value", true)
                .node("w", "While")
                .node("p", "Print", "text", "tick")
                .data("t", "w", "cond")
                .control("w", "body", "p")
                .build()).source();
        assertTrue(source.contains("if (!(literal_1)) break;"));
        assertTrue(source.contains("if (++guard_1 > 100000LL)"));
        assertTrue(source.contains("std::exit(3);"));
        assertTrue(source.contains("std::cout << std::string(\"tick\") << std::endl;"));
    }

    @Test
    void loopGuardLimitIndentAndMarkersFollowOptions() {
        String source = generate(TestGraphs.fixture("counter-loop.json"), new GeneratorOptions(5, 2, false)).source();
        assertTrue(source.contains("  while (true) {\n"));
        assertTrue(source.contains("if (++guard_1 > 5LL)"));
        assertTrue(source.contains("(limit 5)"));
        assertFalse(source.contains("// node:"));
    }

    @Test
    void branchesBecomeIfElse() {
        String source = generate(TestGraphs.fixture("branch.json")).source();
        assertTrue(source.contains(String.join("\n",
                "    if (literal_1) {",
                "        // node: yes",
                "        std::cout << std::string(\"yes\") << std::endl;",
                "    } else {",
                "        // node: no",
                "        std::cout << std::string(\"no\") << std::endl;",
                "    }")));
    }

    @Test
    void statementInsideBranchMapsToInnerNode() {
        CompilationMap map = generate(TestGraphs.fixture("branch.json")).map();
        CompilationMap.NodeSpan check = map.get("check");
        CompilationMap.NodeSpan yes = map.get("yes");
        assertTrue(check.startLine < yes.startLine && yes.endLine < check.endLine);
    }

    @Test
    void untypedParameterBecomesTemplateParameter() {
        GraphModel.Graph body = TestGraphs.graph()
                .node("v", "Arg", "name", "value")
                .node("p", "Print")
                .data("v", "p", "text")
                .build();
        String source = generate(TestGraphs.graph().function("show", null, body, "value", null).build()).source();
        assertTrue(source.contains("template <typename T0> void g2c_u_show(T0 g2c_u_value);\n"));
        assertTrue(source.contains("template <typename T0>\nvoid g2c_u_show(T0 g2c_u_value) {\n"));
        assertTrue(source.contains("    std::cout << g2c_u_value << std::endl;\n"));
    }

    @Test
    void nonVoidFunctionGetsDefaultReturnWhenReturnIsNested() {
        GraphModel.Graph body = TestGraphs.graph()
                .node("c", "Literal", "value", true)
                .node("if", "If")
                .node("r", "Return", "value", 1)
                .data("c", "if", "cond")
                .control("if", "then", "r")
                .build();
        String source = generate(TestGraphs.graph().function("one", "int", body).build()).source();
        assertTrue(source.contains("        return 1;\n    }\n    return int{};\n}\n"));
    }

    @Test
    void castFromStringUsesConversionFunction() {
        String source = generate(TestGraphs.graph()
                .node("s", "Literal", "value", "42")
                .node("c", "Cast", "targetType", "int")
                .node("p", "Print")
                .data("s", "c", "in")
                .data("c", "p", "text")
                .build()).source();
        assertTrue(source.contains("int cast_1 = std::stoi(literal_1);"));
    }

    @Test
    void concatDeclaresStringHelperOnce() {
        String source = generate(TestGraphs.graph()
                .node("n", "Literal", "value", 3)
                .node("c1", "Concat", "b", "a")
                .node("c2", "Concat", "b", "b")
                .node("p", "Print")
                .data("n", "c1", "a")
                .data("c1", "c2", "a")
                .data("c2", "p", "text")
                .build()).source();
        assertEquals(source.indexOf(CppSyntax.STR_HELPER), source.lastIndexOf(CppSyntax.STR_HELPER));
        assertTrue(source.contains("#include <sstream>"));
        assertTrue(source.contains("std::string concat_1 = g2c_str(literal_1) + g2c_str(std::string(\"a\"));"));
    }

    @Test
    void importsBecomeIncludes() {
        String source = generate(TestGraphs.graph().imports("vector", "<map>").build()).source();
        assertTrue(source.startsWith("#include <map>\n#include <vector>\n\nint main() {\n"));
    }

    @Test
    void generationIsDeterministic() {
        GraphModel.Graph g = TestGraphs.fixture("counter-loop.json");
        CodeGenerator.GeneratedProgram a = generate(g);
        CodeGenerator.GeneratedProgram b = generate(g);
        assertEquals(a.source(), b.source());
        CompilationMapSerializer serializer = new CompilationMapSerializer();
        assertEquals(serializer.toJson(a.map()), serializer.toJson(b.map()));
    }

    @Test
    void topLevelIdShadowingFunctionKeyFailsGeneration() {
        GraphModel.Graph body = TestGraphs.graph()
                .node("p", "Print", "text", "in f")
                .build();
        GraphModel.Graph g = TestGraphs.graph()
                .node("f::p", "Print", "text", "top")
                .function("f", null, body)
                .build();
        CodeGenerator.GenerationException e =
                assertThrows(CodeGenerator.GenerationException.class, () -> generate(g));
        assertTrue(e.getMessage().contains("f::p"));
    }

    @Test
    void nodeTypeWithoutRuleFailsGeneration() {
        NodeCatalog catalog = NodeCatalog.builtIns()
                .with(new NodeSignature("Mystery", NodeRole.EFFECT, List.of(), List.of(), false));
        GraphModel.Graph g = TestGraphs.graph().node("x", "Mystery").build();
        DocumentAnalysis analysis = new GraphAnalyzer(catalog).analyzeDocument(g);
        CodeGenerator generator = new CodeGenerator(RuleRegistry.builtIns(), GeneratorOptions.defaults());
        CodeGenerator.GenerationException e =
                assertThrows(CodeGenerator.GenerationException.class, () -> generator.generate(g, analysis));
        assertTrue(e.getMessage().contains("Mystery"));
    }
}
