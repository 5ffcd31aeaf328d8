package com.g2c.compiler.diagnostics;

/**
 * A compiler diagnostic attached to the node whose generated lines contain it.
 *
 * @param key      compilation-map key ({@code nodeId} or {@code function::nodeId}); null when unmapped
 * @param function owning function, null at top level or when unmapped
 * @param nodeId   node id without the function qualifier; null when unmapped
 * @param portName input port whose expression contains the column, or null
 */
public record MappedDiagnostic(
        String key,
        String function,
        String nodeId,
        String portName,
        String severity,
        String message,
        int sourceLine,
        Integer sourceColumn
) {

    public static final String UNMAPPED = "unmapped";

    public boolean isMapped() {
        return key != null;
    }

    /** {@code error at line 12:5 [node add_1, port a]: message}. */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(severity).append(" at line ").append(sourceLine);
        if (sourceColumn != null) sb.append(':').append(sourceColumn);
        sb.append(" [");
        if (isMapped()) {
            sb.append("node ").append(key);
            if (portName != null) sb.append(", port ").append(portName);
        } else {
            sb.append(UNMAPPED);
        }
        return sb.append("]: ").append(message).toString();
    }
}
