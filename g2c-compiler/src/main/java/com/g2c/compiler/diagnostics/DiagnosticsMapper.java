package com.g2c.compiler.diagnostics;

import com.g2c.compiler.codegen.CompilationMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Attaches compiler diagnostics to graph nodes through a {@link CompilationMap}.
 *
 * <p>The smallest span covering the line wins, so a statement inside a branch maps to the inner
 * node rather than the enclosing conditional; among equal sizes the later-starting span wins,
 * then the first key. Lines that no span covers are reported as unmapped. Never throws on
 * out-of-range input.
 */
public class DiagnosticsMapper {

    private final CompilationMap map;

    public DiagnosticsMapper(CompilationMap map) {
        this.map = map;
    }

    public List<MappedDiagnostic> map(List<CompilerDiagnostic> diagnostics) {
        List<MappedDiagnostic> result = new ArrayList<>();
        for (CompilerDiagnostic d : diagnostics) {
            result.add(map(d.line(), d.column(), d.severity(), d.message()));
        }
        return result;
    }

    public MappedDiagnostic map(int line, Integer column, String severity, String message) {
        String bestKey = null;
        CompilationMap.NodeSpan best = null;
        for (Map.Entry<String, CompilationMap.NodeSpan> entry : map.spans().entrySet()) {
            CompilationMap.NodeSpan span = entry.getValue();
            if (!span.covers(line)) continue;
            if (best == null
                    || span.lineCount() < best.lineCount()
                    || (span.lineCount() == best.lineCount() && span.startLine > best.startLine)) {
                best = span;
                bestKey = entry.getKey();
            }
        }
        if (best == null) {
            return new MappedDiagnostic(null, null, null, null, severity, message, line, column);
        }

        String port = null;
        if (column != null) {
            int width = Integer.MAX_VALUE;
            for (CompilationMap.PortSpan p : best.getPorts()) {
                int w = p.endColumn - p.startColumn;
                if (p.covers(line, column) && w < width) {
                    port = p.port;
                    width = w;
                }
            }
        }
        String nodeId = best.node != null ? best.node : bestKey;
        return new MappedDiagnostic(bestKey, best.function, nodeId, port, severity, message, line, column);
    }
}
