package com.g2c.compiler.codegen;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Line ranges of the generated source, keyed by node id at top level and by
 * {@code <function>::<nodeId>} inside function bodies. Spans inside functions also record the
 * function and the bare node id, so readers never need to split keys. Lines and columns are
 * 1-based and inclusive.
 */
public final class CompilationMap {

    public static class NodeSpan {
        @SerializedName("startLine") public int startLine;
        @SerializedName("endLine")   public int endLine;
        @SerializedName("ports")     public List<PortSpan> ports;  // nullable: no input expressions recorded
        @SerializedName("function")  public String function;       // nullable: top level
        @SerializedName("node")      public String node;           // nullable: the key is the node id

        public NodeSpan() {}

        public NodeSpan(int startLine, int endLine, List<PortSpan> ports) {
            this(startLine, endLine, ports, null, null);
        }

        public NodeSpan(int startLine, int endLine, List<PortSpan> ports, String function, String node) {
            this.startLine = startLine;
            this.endLine = endLine;
            this.ports = ports == null || ports.isEmpty() ? null : List.copyOf(ports);
            this.function = function;
            this.node = node;
        }

        public List<PortSpan> getPorts() { return ports != null ? ports : Collections.emptyList(); }

        public boolean covers(int line) {
            return line >= startLine && line <= endLine;
        }

        public int lineCount() {
            return endLine - startLine + 1;
        }
    }

    /** Where one resolved input expression sits on its line. */
    public static class PortSpan {
        @SerializedName("port")        public String port;
        @SerializedName("line")        public int line;
        @SerializedName("startColumn") public int startColumn;
        @SerializedName("endColumn")   public int endColumn;

        public PortSpan() {}

        public PortSpan(String port, int line, int startColumn, int endColumn) {
            this.port = port;
            this.line = line;
            this.startColumn = startColumn;
            this.endColumn = endColumn;
        }

        public boolean covers(int line, int column) {
            return this.line == line && column >= startColumn && column <= endColumn;
        }
    }

    private final Map<String, NodeSpan> spans;

    public CompilationMap(Map<String, NodeSpan> spans) {
        this.spans = Collections.unmodifiableMap(new TreeMap<>(spans));
    }

    /** Spans sorted by key. */
    public Map<String, NodeSpan> spans() {
        return spans;
    }

    public NodeSpan get(String key) {
        return spans.get(key);
    }

    public boolean contains(String key) {
        return spans.containsKey(key);
    }

    public int size() {
        return spans.size();
    }
}
