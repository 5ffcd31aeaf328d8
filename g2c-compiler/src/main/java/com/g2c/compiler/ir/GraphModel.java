package com.g2c.compiler.ir;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * POJOs matching the graph document schema.
 * Built by the caller (or {@link GraphDocumentReader}) and never mutated by analysis,
 * validation or generation.
 */
public final class GraphModel {

    private GraphModel() {}

    /** A top-level program or one function body. Function bodies carry no functions of their own. */
    public static class Graph {
        @SerializedName("nodes")     public List<Node> nodes;
        @SerializedName("edges")     public List<Edge> edges;
        @SerializedName("functions") public List<FunctionDef> functions;
        @SerializedName("imports")   public List<String> imports;

        public List<Node> getNodes()             { return nodes     != null ? nodes     : Collections.emptyList(); }
        public List<Edge> getEdges()             { return edges     != null ? edges     : Collections.emptyList(); }
        public List<FunctionDef> getFunctions()  { return functions != null ? functions : Collections.emptyList(); }
        public List<String> getImports()         { return imports   != null ? imports   : Collections.emptyList(); }
    }

    public static class Node {
        @SerializedName("id")         public String id;
        @SerializedName("type")       public String type;
        @SerializedName("inputs")     public List<Port> inputs;
        @SerializedName("outputs")    public List<Port> outputs;
        @SerializedName("parameters") public JsonObject parameters;  // literal/config bag, nullable

        public List<Port> getInputs()  { return inputs  != null ? inputs  : Collections.emptyList(); }
        public List<Port> getOutputs() { return outputs != null ? outputs : Collections.emptyList(); }

        /** Raw parameter value, or null when absent or JSON null. */
        public JsonElement parameter(String name) {
            if (parameters == null) return null;
            JsonElement value = parameters.get(name);
            return value == null || value.isJsonNull() ? null : value;
        }

        public boolean hasParameter(String name) {
            return parameter(name) != null;
        }

        /** Parameter as a string if it is a JSON primitive, else null. */
        public String stringParameter(String name) {
            JsonElement value = parameter(name);
            return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
        }
    }

    public static class Port {
        @SerializedName("name") public String name;
        @SerializedName("type") public String type;  // nullable

        public Port() {}

        public Port(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public enum EdgeKind {
        DATA,
        CONTROL;

        /** Parses a document's {@code kind} spelling; null for anything unrecognised. */
        public static EdgeKind parse(String raw) {
            if (raw == null) return null;
            switch (raw) {
                case "data": case "dataflow": case "DATA": return DATA;
                case "control": case "CONTROL": return CONTROL;
                default: return null;
            }
        }
    }

    public static class Edge {
        @SerializedName("fromNode") public String fromNode;
        @SerializedName("fromPort") public String fromPort;  // nullable: primary output
        @SerializedName("toNode")   public String toNode;
        @SerializedName("toPort")   public String toPort;    // nullable: first input
        @SerializedName("kind")     public String kind;      // nullable: data

        /** False when {@code kind} is present but not a recognised spelling. */
        public boolean hasKnownKind() { return kind == null || EdgeKind.parse(kind) != null; }

        /** Unrecognised kinds read as data; the validator rejects them before analysis. */
        public EdgeKind getKind() {
            EdgeKind parsed = EdgeKind.parse(kind);
            return parsed != null ? parsed : EdgeKind.DATA;
        }
        public boolean isControl() { return getKind() == EdgeKind.CONTROL; }
        public boolean isData()    { return getKind() == EdgeKind.DATA; }

        @Override
        public String toString() {
            return fromNode + "." + fromPort + " -> " + toNode + "." + toPort
                    + (isControl() ? " (control)" : "");
        }
    }

    public static class FunctionDef {
        @SerializedName("name")       public String name;
        @SerializedName("params")     public List<Param> params;
        @SerializedName("returnType") public String returnType;  // nullable: inferred from Return nodes
        @SerializedName("graph")      public Graph graph;

        public List<Param> getParams() { return params != null ? params : Collections.emptyList(); }
    }

    public static class Param {
        @SerializedName("name") public String name;
        @SerializedName("type") public String type;  // nullable: generic parameter

        public Param() {}

        public Param(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }
}
