package com.g2c.compiler.plugin;

import com.g2c.compiler.GraphCompiler;
import com.g2c.compiler.TestGraphs;
import com.g2c.compiler.codegen.GeneratorOptions;
import com.g2c.compiler.codegen.RuleRegistry;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.NodeSignature;
import com.g2c.compiler.ir.ValueType;
import com.g2c.compiler.validation.ValidationResult;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private static final String SQRT = "{\"nodeType\":\"Sqrt\",\"externalSymbol\":\"std::sqrt\","
            + "\"requiredDeclaration\":\"<cmath>\","
            + "\"parameters\":[{\"name\":\"x\",\"kind\":\"boundInput\",\"type\":\"double\"}],"
            + "\"returnType\":\"double\"}";

    @Test
    void loadsDescriptorsInFileNameOrder() {
        PluginRegistry registry = PluginRegistry.load(TestGraphs.pluginDir("plugins"));
        assertEquals(2, registry.size());
        assertEquals("ClampHigh", registry.descriptors().get(0).nodeType);
        assertEquals("Sqrt", registry.descriptors().get(1).nodeType);
        assertTrue(registry.warnings().isEmpty());
    }

    @Test
    void invalidDescriptorsAreSkippedAndTheRestLoad() {
        PluginRegistry registry = PluginRegistry.load(TestGraphs.pluginDir("plugins-invalid"));
        assertEquals(1, registry.size());
        assertTrue(registry.get("Abs").isPresent());
        assertEquals(3, registry.warnings().size());
        assertTrue(registry.warnings().get(0).contains("broken.json"));
        assertTrue(registry.warnings().get(1).contains("is built in"));
        assertTrue(registry.warnings().get(2).contains("missing required field externalSymbol"));
    }

    @Test
    void missingDirectoryGivesEmptyRegistry(@TempDir Path dir) {
        PluginRegistry registry = PluginRegistry.load(dir.resolve("nope"));
        assertEquals(0, registry.size());
        assertTrue(registry.warnings().isEmpty());
    }

    @Test
    void duplicateNodeTypeIsSkipped() {
        PluginRegistry registry = PluginRegistry.empty();
        assertTrue(registry.add("a.json", SQRT));
        assertFalse(registry.add("b.json", SQRT));
        assertEquals(1, registry.size());
        assertTrue(registry.warnings().get(0).contains("already registered"));
    }

    @Test
    void aliasOfBuiltInIsRejected() {
        PluginRegistry registry = PluginRegistry.empty();
        assertFalse(registry.add("x.json", SQRT.replace("\"Sqrt\"", "\"Const\"")));
    }

    @Test
    void schemaProblemsAreAllReported() {
        List<String> problems = PluginRegistry.checkSchema(JsonParser.parseString(
                "{\"nodeType\":\"X\",\"externalSymbol\":\"not a name\",\"returnType\":\"any\","
                        + "\"parameters\":[{\"name\":\"1a\",\"kind\":\"input\"},"
                        + "{\"name\":\"k\",\"kind\":\"literalConstant\",\"type\":\"int\"},"
                        + "{\"name\":\"k\",\"kind\":\"boundInput\",\"value\":[1]}]}"));
        assertTrue(problems.contains("externalSymbol 'not a name' is not a C++ name"));
        assertTrue(problems.contains("returnType must be a concrete type"));
        assertTrue(problems.contains("parameters[0]: name '1a' is not an identifier"));
        assertTrue(problems.contains("parameters[0]: kind must be boundInput or literalConstant, not 'input'"));
        assertTrue(problems.contains("parameters[1]: literalConstant needs a default value"));
        assertTrue(problems.contains("parameters[2]: duplicate parameter name 'k'"));
        assertTrue(problems.contains("parameters[2]: value must be a number, string or boolean"));
    }

    @Test
    void nonObjectDescriptorIsRejected() {
        assertEquals(List.of("descriptor must be a JSON object"), PluginRegistry.checkSchema(JsonParser.parseString("[]")));
    }

    @Test
    void signatureHasBoundInputsOnly() {
        PluginRegistry registry = PluginRegistry.load(TestGraphs.pluginDir("plugins"));
        NodeSignature clamp = PluginRegistry.signatureOf(registry.get("ClampHigh").orElseThrow());
        assertEquals(1, clamp.inputs().size());
        assertEquals("value", clamp.inputs().get(0).name());
        assertEquals(ValueType.INT, clamp.inputs().get(0).type());
        assertEquals(1, clamp.outputs().size());

        NodeCatalog catalog = registry.extend(NodeCatalog.builtIns());
        assertTrue(catalog.contains("Sqrt"));
        assertTrue(catalog.contains("ClampHigh"));
        assertFalse(NodeCatalog.builtIns().contains("Sqrt"));
    }

    @Test
    void registersOneRulePerDescriptor() {
        RuleRegistry rules = RuleRegistry.builtIns();
        PluginRegistry.load(TestGraphs.pluginDir("plugins")).registerRules(rules);
        assertTrue(rules.contains("Sqrt"));
        assertTrue(rules.contains("ClampHigh"));
    }

    @Test
    void pluginCallCompiles() {
        GraphCompiler compiler = new GraphCompiler(PluginRegistry.load(TestGraphs.pluginDir("plugins")),
                GeneratorOptions.defaults());
        String source = compiler.compile(TestGraphs.fixture("sqrt-call.json")).source();
        assertTrue(source.startsWith("#include <cmath>\n#include <iostream>\n"));
        assertTrue(source.contains("    double sqrt_1 = std::sqrt(literal_1);\n"));
    }

    @Test
    void literalConstantUsesDescriptorValueUnlessNodeOverrides() {
        GraphCompiler compiler = new GraphCompiler(PluginRegistry.load(TestGraphs.pluginDir("plugins")),
                GeneratorOptions.defaults());
        String byDefault = compiler.compile(TestGraphs.graph()
                .node("n", "Literal", "value", 42)
                .node("c", "ClampHigh")
                .node("p", "Print")
                .data("n", "c", "value")
                .data("c", "p", "text")
                .build()).source();
        assertTrue(byDefault.contains("int clamphigh_1 = std::min(literal_1, 10);"));
        assertTrue(byDefault.contains("#include <algorithm>"));

        String overridden = compiler.compile(TestGraphs.graph()
                .node("n", "Literal", "value", 42)
                .node("c", "ClampHigh", "limit", 3)
                .node("p", "Print")
                .data("n", "c", "value")
                .data("c", "p", "text")
                .build()).source();
        assertTrue(overridden.contains("std::min(literal_1, 3);"));
    }

    @Test
    void pluginNodeWithoutRegistryIsUnknown() {
        ValidationResult result = new GraphCompiler().validate(TestGraphs.fixture("sqrt-call.json"));
        assertFalse(result.isOk());
    }
}
