package com.g2c.compiler.analysis;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Tarjan's strongly-connected-components algorithm over a successor map.
 */
public final class StronglyConnectedComponents {

    private final Map<String, List<String>> successors;
    private final Map<String, Integer> index = new HashMap<>();
    private final Map<String, Integer> lowLink = new HashMap<>();
    private final Deque<String> stack = new ArrayDeque<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<SortedSet<String>> components = new ArrayList<>();
    private int counter = 0;

    private StronglyConnectedComponents(Map<String, List<String>> successors) {
        this.successors = successors;
    }

    /**
     * Every component of the graph, each as a sorted member set, ordered by smallest member.
     * Successor targets missing from the key set are ignored.
     */
    public static List<SortedSet<String>> find(Map<String, List<String>> successors) {
        StronglyConnectedComponents tarjan = new StronglyConnectedComponents(successors);
        for (String id : new TreeSet<>(successors.keySet())) {
            if (!tarjan.index.containsKey(id)) tarjan.connect(id);
        }
        tarjan.components.sort(Comparator.comparing(SortedSet::first));
        return tarjan.components;
    }

    /**
     * Components that form a cycle: more than one member, or one member with an edge to itself.
     */
    public static List<SortedSet<String>> cycles(Map<String, List<String>> successors) {
        List<SortedSet<String>> cycles = new ArrayList<>();
        for (SortedSet<String> c : find(successors)) {
            if (c.size() > 1) {
                cycles.add(c);
            } else {
                String only = c.first();
                if (successors.getOrDefault(only, List.of()).contains(only)) cycles.add(c);
            }
        }
        return cycles;
    }

    /** One suspended visit: the node and how far through its successors it has got. */
    private static final class Frame {
        final String node;
        final Iterator<String> next;

        Frame(String node, Iterator<String> next) {
            this.node = node;
            this.next = next;
        }
    }

    /** Iterative form of the recursive visit, so path length is bounded by heap rather than thread stack. */
    private void connect(String root) {
        Deque<Frame> work = new ArrayDeque<>();
        work.push(enter(root));
        while (!work.isEmpty()) {
            Frame frame = work.peek();
            String v = frame.node;
            if (frame.next.hasNext()) {
                String w = frame.next.next();
                if (!successors.containsKey(w)) continue;
                if (!index.containsKey(w)) {
                    work.push(enter(w));
                } else if (onStack.contains(w)) {
                    lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                }
                continue;
            }

            work.pop();
            if (lowLink.get(v).equals(index.get(v))) {
                SortedSet<String> component = new TreeSet<>();
                String w;
                do {
                    w = stack.pop();
                    onStack.remove(w);
                    component.add(w);
                } while (!w.equals(v));
                components.add(component);
            }
            Frame parent = work.peek();
            if (parent != null) {
                lowLink.put(parent.node, Math.min(lowLink.get(parent.node), lowLink.get(v)));
            }
        }
    }

    private Frame enter(String v) {
        index.put(v, counter);
        lowLink.put(v, counter);
        counter++;
        stack.push(v);
        onStack.add(v);
        return new Frame(v, successors.getOrDefault(v, List.of()).iterator());
    }
}
