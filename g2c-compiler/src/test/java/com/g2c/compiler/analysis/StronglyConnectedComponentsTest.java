package com.g2c.compiler.analysis;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class StronglyConnectedComponentsTest {

    @Test
    void twoNodeCycleIsOneComponent() {
        List<SortedSet<String>> cycles = StronglyConnectedComponents.cycles(Map.of(
                "a", List.of("b"),
                "b", List.of("a"),
                "c", List.of("a")));
        assertEquals(1, cycles.size());
        assertEquals(Set.of("a", "b"), cycles.get(0));
    }

    @Test
    void selfEdgeIsACycleButASingletonIsNot() {
        List<SortedSet<String>> cycles = StronglyConnectedComponents.cycles(Map.of(
                "loop", List.of("loop"),
                "lone", List.of()));
        assertEquals(1, cycles.size());
        assertEquals(Set.of("loop"), cycles.get(0));
    }

    @Test
    void disjointCyclesAreOrderedBySmallestMember() {
        List<SortedSet<String>> cycles = StronglyConnectedComponents.cycles(Map.of(
                "z", List.of("y"),
                "y", List.of("z"),
                "b", List.of("c"),
                "c", List.of("b")));
        assertEquals(2, cycles.size());
        assertEquals("b", cycles.get(0).first());
        assertEquals("y", cycles.get(1).first());
    }

    @Test
    void unknownSuccessorsAreIgnored() {
        assertTrue(StronglyConnectedComponents.cycles(Map.of("a", List.of("ghost"))).isEmpty());
    }

    @Test
    void longChainEndingInCycleDoesNotExhaustStack() {
        int n = 200_000;
        Map<String, List<String>> successors = new HashMap<>();
        for (int i = 0; i < n - 1; i++) {
            successors.put("n" + i, List.of("n" + (i + 1)));
        }
        successors.put("n" + (n - 1), List.of("n" + (n - 2)));
        List<SortedSet<String>> cycles = StronglyConnectedComponents.cycles(successors);
        assertEquals(1, cycles.size());
        assertEquals(Set.of("n" + (n - 2), "n" + (n - 1)), cycles.get(0));
        assertEquals(n - 1, StronglyConnectedComponents.find(successors).size());
    }
}
