package com.g2c.compiler.analysis;

import com.g2c.compiler.TestGraphs;
import com.g2c.compiler.analysis.ControlStructure.Region;
import com.g2c.compiler.analysis.ControlStructure.Tag;
import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ControlStructureTest {

    private final GraphAnalyzer analyzer = new GraphAnalyzer(NodeCatalog.builtIns());

    private ControlStructure control(GraphModel.Graph g) {
        return analyzer.analyzeDocument(g).top().control();
    }

    @Test
    void loopBodyAndHeaderAreSeparateRegions() {
        ControlStructure cs = control(TestGraphs.fixture("counter-loop.json"));
        Region cond = new Region("loop", Tag.COND);
        Region body = new Region("loop", Tag.BODY);

        assertEquals(List.of("decl", "loop"), cs.schedule(Region.TOP));
        assertEquals(List.of("get_i", "lt"), cs.schedule(cond));
        assertEquals(List.of("cur", "inc", "show", "set"), cs.schedule(body));
        assertEquals(cond, cs.parent(body));
        assertTrue(cs.isWithin(body, Region.TOP));
        assertTrue(cs.issues().isEmpty(), () -> cs.issues().toString());
    }

    @Test
    void branchesClaimTheirTaggedSuccessors() {
        ControlStructure cs = control(TestGraphs.fixture("branch.json"));
        assertEquals(new Region("check", Tag.THEN), cs.region("yes"));
        assertEquals(new Region("check", Tag.ELSE), cs.region("no"));
        assertEquals(Region.TOP, cs.region("flag"));
        assertEquals("yes", cs.successor("check", Tag.THEN));
        assertTrue(cs.isControlNode("check"));
    }

    @Test
    void trueAndFalseAreAcceptedAsBranchTags() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("c", "Literal", "value", true)
                .node("if", "If")
                .node("p", "Print", "text", "t")
                .data("c", "if", "cond")
                .control("if", "true", "p")
                .build());
        assertEquals(new Region("if", Tag.THEN), cs.region("p"));
    }

    @Test
    void pureProducerSinksIntoTheBodyThatConsumesIt() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("c", "Literal", "value", true)
                .node("if", "If")
                .node("msg", "Literal", "value", "inside")
                .node("p", "Print")
                .data("c", "if", "cond")
                .data("msg", "p", "text")
                .control("if", "then", "p")
                .build());
        assertEquals(new Region("if", Tag.THEN), cs.region("msg"));
        assertEquals(List.of("msg", "p"), cs.schedule(new Region("if", Tag.THEN)));
    }

    @Test
    void sharedProducerStaysInTheCommonRegion() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("c", "Literal", "value", true)
                .node("if", "If")
                .node("msg", "Literal", "value", "both")
                .node("yes", "Print")
                .node("no", "Print")
                .data("c", "if", "cond")
                .data("msg", "yes", "text")
                .data("msg", "no", "text")
                .control("if", "then", "yes")
                .control("if", "else", "no")
                .build());
        assertEquals(Region.TOP, cs.region("msg"));
    }

    @Test
    void loopWithoutBodyIsWarned() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("c", "Literal", "value", false)
                .node("w", "While")
                .data("c", "w", "cond")
                .build());
        assertEquals(1, cs.issues().size());
        assertFalse(cs.issues().get(0).error());
        assertTrue(cs.issues().get(0).message().contains("no body"));
    }

    @Test
    void twoSuccessorsWithTheSameTagAreAnError() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("c", "Literal", "value", true)
                .node("if", "If")
                .node("a", "Print", "text", "a")
                .node("b", "Print", "text", "b")
                .data("c", "if", "cond")
                .control("if", "then", "a")
                .control("if", "then", "b")
                .build());
        assertTrue(cs.issues().stream().anyMatch(i -> i.error() && i.message().contains("'then' successors")));
    }

    @Test
    void valueEscapingABranchIsAnError() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("c", "Literal", "value", true)
                .node("if", "If")
                .node("one", "Literal", "value", 1)
                .node("set", "VarSet", "name", "x")
                .node("after", "Print")
                .data("c", "if", "cond")
                .data("one", "set", "value")
                .data("set", "after", "text")
                .control("if", "then", "set")
                .build());
        assertTrue(cs.issues().stream().anyMatch(i -> i.error() && i.message().contains("produced inside if.then")));
    }

    @Test
    void conditionReadingVariableOutsideLoopIsWarned() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("get", "VarGet", "name", "n")
                .node("before", "Print")
                .node("lt", "Lt", "b", 3)
                .node("w", "While")
                .node("p", "Print", "text", "tick")
                .data("get", "lt", "a")
                .data("get", "before", "text")
                .data("lt", "w", "cond")
                .control("w", "body", "p")
                .build());
        assertTrue(cs.issues().stream().anyMatch(i -> !i.error() && i.message().contains("Condition of loop w")));
    }

    @Test
    void sequencingEdgesOrderEffects() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("b", "Print", "text", "first")
                .node("a", "Print", "text", "second")
                .control("b", "a")
                .build());
        assertEquals(List.of("b", "a"), cs.schedule(Region.TOP));
    }

    @Test
    void sequencingCycleIsAnError() {
        ControlStructure cs = control(TestGraphs.graph()
                .node("a", "Print", "text", "a")
                .node("b", "Print", "text", "b")
                .control("a", "b")
                .control("b", "a")
                .build());
        assertTrue(cs.issues().stream().anyMatch(i -> i.error() && i.message().startsWith("Sequencing cycle")));
        assertEquals(2, cs.schedule(Region.TOP).size());
    }
}
