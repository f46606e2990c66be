package org.nanoir.ir.diagnostics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A single problem found while checking an IR document.
 *
 * @param type    The severity.
 * @param path    Location inside the document, e.g. {@code ["functions", 0, "nodes", 3, "a"]}.
 * @param nodeId  The offending node id, or {@code null} if not node-related.
 * @param message The human readable message.
 */
public record Diagnostic(
        Type type,
        List<Object> path,
        String nodeId,
        String message
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that makes the document invalid. */
        ERROR,
        /** A suspicious construct that does not invalidate the document. */
        WARNING,
        /** An informational message. */
        INFO
    }

    public Diagnostic {
        path = path == null ? List.of() : List.copyOf(path);
    }

    /**
     * Renders the path as {@code functions[0].nodes[3].a}.
     *
     * @return The dotted path.
     */
    public String pathString() {
        StringBuilder sb = new StringBuilder();
        for (Object segment : path) {
            if (segment instanceof Integer i) {
                sb.append('[').append(i).append(']');
            } else {
                if (sb.length() > 0) sb.append('.');
                sb.append(segment);
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        String where = path.isEmpty() ? "<document>" : pathString();
        String node = nodeId == null ? "" : " (node " + nodeId + ")";
        return String.format("[%s] %s%s: %s", type, where, node, message);
    }

    static String join(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
