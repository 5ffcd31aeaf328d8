package com.g2c.compiler.analysis;

import com.g2c.compiler.ir.GraphModel;
import com.g2c.compiler.ir.NodeCatalog;
import com.g2c.compiler.ir.NodeRole;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Reconstructs structured control flow from control edges.
 *
 * <p>Every node is placed in a region: the top level, the {@code then}/{@code else} body of a
 * conditional, or the {@code cond} header / {@code body} of a loop (the header encloses the body).
 * Bodies are the nodes control-reachable from the tagged successor. Pure nodes outside any body
 * sink into the innermost region enclosing all their consumers, so values read inside a loop are
 * recomputed on every iteration. Each region is then scheduled with Kahn's algorithm over the
 * region-projected dataflow and sequencing edges.
 */
public final class ControlStructure {

    public enum Tag { TOP, THEN, ELSE, COND, BODY }

    /** A region of one body; {@code owner} is the control node, null for the top level. */
    public record Region(String owner, Tag tag) implements Comparable<Region> {

        public static final Region TOP = new Region(null, Tag.TOP);

        public String key() {
            return owner == null ? "top" : owner + "." + tag.name().toLowerCase(Locale.ROOT);
        }

        @Override
        public int compareTo(Region other) {
            return key().compareTo(other.key());
        }

        @Override
        public String toString() {
            return key();
        }
    }

    /** A structural problem found while reconstructing regions. */
    public record Issue(boolean error, String message, String nodeId, List<String> related) {}

    private final EdgeIndex edges;
    private final NodeCatalog catalog;
    private final Set<String> cyclic;

    private final Map<String, Map<Tag, String>> successors = new TreeMap<>();
    private final Map<String, Region> regionOf = new LinkedHashMap<>();
    private final Map<Region, List<String>> schedules = new TreeMap<>();
    private final List<Issue> issues = new ArrayList<>();

    private ControlStructure(EdgeIndex edges, NodeCatalog catalog, Set<String> cyclic) {
        this.edges = edges;
        this.catalog = catalog;
        this.cyclic = cyclic;
    }

    /**
     * @param order  topological order of the non-cyclic nodes
     * @param cyclic members of dataflow cycles
     */
    public static ControlStructure analyze(EdgeIndex edges, NodeCatalog catalog, List<String> order, Set<String> cyclic) {
        ControlStructure cs = new ControlStructure(edges, catalog, cyclic);
        cs.collectSuccessors();
        cs.claimBodies();
        cs.breakNestingCycles();
        cs.sinkPureNodes(order);
        cs.checkEscapes();
        cs.checkLoopConditions();
        cs.schedule();
        return cs;
    }

    // --- queries ---

    public Region region(String nodeId) {
        return regionOf.getOrDefault(nodeId, Region.TOP);
    }

    /** Nodes emitted directly in {@code region}, in emission order. Argument sources are excluded. */
    public List<String> schedule(Region region) {
        return schedules.getOrDefault(region, List.of());
    }

    /** Tagged control successor of a conditional or loop, or null. */
    public String successor(String controlNode, Tag tag) {
        return successors.getOrDefault(controlNode, Map.of()).get(tag);
    }

    public boolean isControlNode(String nodeId) {
        return successors.containsKey(nodeId);
    }

    public List<Issue> issues() {
        return Collections.unmodifiableList(issues);
    }

    /** Enclosing region, or null for the top level. */
    public Region parent(Region r) {
        if (r.owner() == null) return null;
        if (r.tag() == Tag.BODY) return new Region(r.owner(), Tag.COND);
        return region(r.owner());
    }

    /** True if {@code inner} is {@code outer} or nested inside it. */
    public boolean isWithin(Region inner, Region outer) {
        int guard = regionOf.size() * 2 + 4;
        for (Region r = inner; r != null && guard-- > 0; r = parent(r)) {
            if (r.equals(outer)) return true;
        }
        return false;
    }

    // --- construction ---

    private void collectSuccessors() {
        for (String id : new TreeSet<>(edges.nodes().keySet())) {
            NodeRole role = roleOf(id);
            if (!role.isControl()) continue;
            Map<Tag, TreeSet<String>> byTag = new EnumMap<>(Tag.class);
            for (EdgeIndex.ResolvedEdge e : edges.controlOut(id)) {
                Tag tag = tagOf(role, e.fromPort());
                if (tag != null) byTag.computeIfAbsent(tag, t -> new TreeSet<>()).add(e.toNode());
            }
            Map<Tag, String> chosen = new EnumMap<>(Tag.class);
            byTag.forEach((tag, targets) -> {
                if (targets.size() > 1) {
                    issues.add(new Issue(true,
                            (role == NodeRole.LOOP ? "Loop " : "Conditional ") + id + " has "
                                    + targets.size() + " '" + tag.name().toLowerCase(Locale.ROOT)
                                    + "' successors: " + String.join(", ", targets),
                            id, new ArrayList<>(targets)));
                }
                chosen.put(tag, targets.first());
            });
            if (role == NodeRole.LOOP && !chosen.containsKey(Tag.BODY)) {
                issues.add(new Issue(false, "Loop " + id + " has no body successor", id, List.of()));
            }
            successors.put(id, chosen);
        }
    }

    private void claimBodies() {
        Map<String, SortedSet<Region>> claims = new TreeMap<>();
        for (Map.Entry<String, Map<Tag, String>> entry : successors.entrySet()) {
            String owner = entry.getKey();
            for (Map.Entry<Tag, String> tagged : entry.getValue().entrySet()) {
                Region body = new Region(owner, tagged.getKey());
                for (String member : reachable(owner, tagged.getValue())) {
                    claims.computeIfAbsent(member, k -> new TreeSet<>()).add(body);
                }
            }
        }
        claims.forEach((nodeId, regions) -> {
            if (regions.size() > 1) {
                List<String> keys = new ArrayList<>();
                for (Region r : regions) keys.add(r.key());
                issues.add(new Issue(true,
                        "Node " + nodeId + " is reachable from more than one control body: " + String.join(", ", keys),
                        nodeId, List.of()));
            }
            regionOf.put(nodeId, regions.first());
        });
    }

    /** Nodes reachable from {@code start} over sequencing control edges, not entering nested bodies. */
    private Set<String> reachable(String owner, String start) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            String u = queue.poll();
            if (u.equals(owner)) {
                issues.add(new Issue(false,
                        "Control edge back to enclosing control node " + owner + " is ignored",
                        owner, List.of()));
                continue;
            }
            if (!seen.add(u)) continue;
            NodeRole role = roleOf(u);
            for (EdgeIndex.ResolvedEdge e : sorted(edges.controlOut(u))) {
                if (role.isControl() && tagOf(role, e.fromPort()) != null) continue;
                queue.add(e.toNode());
            }
        }
        return seen;
    }

    private void breakNestingCycles() {
        for (String owner : successors.keySet()) {
            Region r = regionOf.get(owner);
            int steps = successors.size() * 2 + 2;
            while (r != null && r.owner() != null && steps-- > 0) {
                if (r.owner().equals(owner)) {
                    issues.add(new Issue(true,
                            "Control node " + owner + " is nested inside its own body", owner, List.of()));
                    regionOf.put(owner, Region.TOP);
                    break;
                }
                r = parent(r);
            }
        }
    }

    private void sinkPureNodes(List<String> order) {
        List<String> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        for (String id : reversed) {
            if (regionOf.containsKey(id)) continue;
            if (!roleOf(id).isSinkable()) {
                regionOf.put(id, Region.TOP);
                continue;
            }
            Region common = null;
            for (EdgeIndex.ResolvedEdge e : edges.dataOut(id)) {
                Region consumer = consumerRegion(e);
                common = common == null ? consumer : commonAncestor(common, consumer);
            }
            regionOf.put(id, common != null ? common : Region.TOP);
        }
        for (String id : edges.nodes().keySet()) {
            regionOf.putIfAbsent(id, Region.TOP);
        }
    }

    private void checkEscapes() {
        for (EdgeIndex.ResolvedEdge e : edges.all()) {
            if (e.control() || cyclic.contains(e.fromNode()) || cyclic.contains(e.toNode())) continue;
            Region produced = region(e.fromNode());
            Region consumed = consumerRegion(e);
            if (!isWithin(consumed, produced)) {
                issues.add(new Issue(true,
                        "Value of node " + e.fromNode() + " is produced inside " + produced.key()
                                + " but consumed by node " + e.toNode() + " outside it",
                        e.toNode(), List.of(e.fromNode(), e.toNode())));
            }
        }
    }

    private void checkLoopConditions() {
        for (Map.Entry<String, Map<Tag, String>> entry : successors.entrySet()) {
            String loop = entry.getKey();
            if (roleOf(loop) != NodeRole.LOOP) continue;
            Region header = new Region(loop, Tag.COND);
            Deque<String> queue = new ArrayDeque<>();
            Set<String> seen = new HashSet<>();
            for (EdgeIndex.ResolvedEdge e : edges.dataInto(loop, "cond")) queue.add(e.fromNode());
            while (!queue.isEmpty()) {
                String p = queue.poll();
                if (!seen.add(p)) continue;
                NodeRole role = roleOf(p);
                if (!role.isSinkable()) continue;
                if (role == NodeRole.STATE_READ && !isWithin(region(p), header)) {
                    issues.add(new Issue(false,
                            "Condition of loop " + loop + " reads a variable through node " + p
                                    + ", which is evaluated outside the loop and will not be re-evaluated per iteration",
                            loop, List.of(p)));
                }
                for (EdgeIndex.ResolvedEdge in : edges.dataIn(p)) queue.add(in.fromNode());
            }
        }
    }

    private void schedule() {
        Set<Region> regions = new TreeSet<>();
        regions.add(Region.TOP);
        for (Map.Entry<String, Map<Tag, String>> entry : successors.entrySet()) {
            if (roleOf(entry.getKey()) == NodeRole.LOOP) {
                regions.add(new Region(entry.getKey(), Tag.COND));
                regions.add(new Region(entry.getKey(), Tag.BODY));
            } else {
                regions.add(new Region(entry.getKey(), Tag.THEN));
                regions.add(new Region(entry.getKey(), Tag.ELSE));
            }
        }

        for (Region r : regions) {
            List<String> members = new ArrayList<>();
            for (Map.Entry<String, Region> entry : regionOf.entrySet()) {
                if (entry.getValue().equals(r) && roleOf(entry.getKey()) != NodeRole.ARGUMENT) {
                    members.add(entry.getKey());
                }
            }
            Set<String> memberSet = new HashSet<>(members);
            Map<String, Set<String>> succ = new LinkedHashMap<>();
            for (EdgeIndex.ResolvedEdge e : edges.all()) {
                if (e.control() && isStructural(e)) continue;
                String a = representative(r, e.fromNode(), region(e.fromNode()), memberSet);
                Region target = e.control() ? region(e.toNode()) : consumerRegion(e);
                String b = representative(r, e.toNode(), target, memberSet);
                if (a != null && b != null && !a.equals(b)) {
                    succ.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
                }
            }
            TopologicalSort.Result result = TopologicalSort.sort(members, succ);
            List<String> order = new ArrayList<>(result.order());
            if (!result.isComplete()) {
                Set<String> unexplained = new TreeSet<>(result.residual());
                unexplained.removeAll(cyclic);
                if (!unexplained.isEmpty()) {
                    issues.add(new Issue(true,
                            "Sequencing cycle in " + r.key() + " among nodes: " + String.join(", ", result.residual()),
                            result.residual().first(), new ArrayList<>(result.residual())));
                }
                order.addAll(result.residual());
            }
            schedules.put(r, Collections.unmodifiableList(order));
        }
    }

    // --- helpers ---

    /**
     * The member of {@code r} that stands for {@code nodeId} (found in region {@code q}): the node
     * itself, or the control node in {@code r} whose body contains it. Null when outside {@code r}.
     */
    private String representative(Region r, String nodeId, Region q, Set<String> members) {
        if (q.equals(r)) return members.contains(nodeId) ? nodeId : null;
        int guard = regionOf.size() * 2 + 4;
        for (Region cur = q; cur != null && cur.owner() != null && guard-- > 0; cur = parent(cur)) {
            Region up = parent(cur);
            if (r.equals(up)) return members.contains(cur.owner()) ? cur.owner() : null;
        }
        return null;
    }

    /** Region in which a data edge's value is consumed; a loop reads its condition in its header. */
    private Region consumerRegion(EdgeIndex.ResolvedEdge e) {
        if (roleOf(e.toNode()) == NodeRole.LOOP && "cond".equals(e.toPort())) {
            return new Region(e.toNode(), Tag.COND);
        }
        return region(e.toNode());
    }

    private Region commonAncestor(Region a, Region b) {
        Set<Region> chain = new HashSet<>();
        int guard = regionOf.size() * 2 + 4;
        for (Region r = a; r != null && guard-- > 0; r = parent(r)) chain.add(r);
        guard = regionOf.size() * 2 + 4;
        for (Region r = b; r != null && guard-- > 0; r = parent(r)) {
            if (chain.contains(r)) return r;
        }
        return Region.TOP;
    }

    private boolean isStructural(EdgeIndex.ResolvedEdge e) {
        NodeRole role = roleOf(e.fromNode());
        return role.isControl() && tagOf(role, e.fromPort()) != null;
    }

    private NodeRole roleOf(String nodeId) {
        GraphModel.Node n = edges.node(nodeId);
        return n == null ? NodeRole.EFFECT : catalog.roleOf(n.type);
    }

    static Tag tagOf(NodeRole role, String fromPort) {
        if (fromPort == null) return null;
        String p = fromPort.toLowerCase(Locale.ROOT);
        if (role == NodeRole.BRANCH) {
            if (p.equals("then") || p.equals("true")) return Tag.THEN;
            if (p.equals("else") || p.equals("false")) return Tag.ELSE;
        } else if (role == NodeRole.LOOP) {
            if (p.equals("body") || p.equals("loop") || p.equals("do")) return Tag.BODY;
        }
        return null;
    }

    private static List<EdgeIndex.ResolvedEdge> sorted(List<EdgeIndex.ResolvedEdge> list) {
        List<EdgeIndex.ResolvedEdge> copy = new ArrayList<>(list);
        copy.sort((x, y) -> x.toNode().compareTo(y.toNode()));
        return copy;
    }
}
