package com.g2c.compiler.validation;

import java.util.List;

/**
 * One validation finding.
 *
 * @param nodeId       node the finding is about, or null
 * @param portName     port of that node, or null
 * @param function     owning function, null at top level
 * @param relatedNodes other nodes involved (cycle members, fan-in sources), sorted
 */
public record Diagnostic(
        Severity severity,
        Category category,
        String message,
        String nodeId,
        String portName,
        String function,
        List<String> relatedNodes
) {

    public Diagnostic {
        relatedNodes = relatedNodes == null ? List.of() : List.copyOf(relatedNodes);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /** {@code error [CYCLE] message (node a, port in)}. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity.label()).append(" [").append(category).append("] ").append(message);
        if (nodeId != null) {
            sb.append(" (node ").append(nodeId);
            if (portName != null) sb.append(", port ").append(portName);
            sb.append(')');
        }
        return sb.toString();
    }
}
