package com.g2c.compiler.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Kahn's algorithm with ties among ready nodes broken by ascending id, so the same graph
 * always yields the same order.
 */
public final class TopologicalSort {

    /**
     * @param order    nodes that could be ordered
     * @param residual nodes left with unsatisfied predecessors (members of, or downstream of, cycles)
     */
    public record Result(List<String> order, SortedSet<String> residual) {
        public boolean isComplete() {
            return residual.isEmpty();
        }
    }

    private TopologicalSort() {}

    /**
     * Orders {@code nodes}; edges whose endpoints are not both in {@code nodes} are ignored, and
     * parallel edges count once.
     */
    public static Result sort(Collection<String> nodes, Map<String, ? extends Collection<String>> successors) {
        Map<String, TreeSet<String>> succ = new LinkedHashMap<>();
        Map<String, Integer> indegree = new LinkedHashMap<>();
        for (String id : nodes) {
            succ.put(id, new TreeSet<>());
            indegree.put(id, 0);
        }
        for (String from : nodes) {
            Collection<String> targets = successors.get(from);
            if (targets == null) continue;
            for (String to : targets) {
                if (!indegree.containsKey(to)) continue;
                if (succ.get(from).add(to)) indegree.merge(to, 1, Integer::sum);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        indegree.forEach((id, deg) -> {
            if (deg == 0) ready.add(id);
        });

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String u = ready.poll();
            order.add(u);
            for (String v : succ.get(u)) {
                int deg = indegree.merge(v, -1, Integer::sum);
                if (deg == 0) ready.add(v);
            }
        }

        SortedSet<String> residual = new TreeSet<>(nodes);
        residual.removeAll(order);
        return new Result(order, residual);
    }
}
