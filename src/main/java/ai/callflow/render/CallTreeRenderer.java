package ai.callflow.render;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import ai.callflow.graph.CallGraph;

/**
 * Plain-text caller -> callee tree. A callee already on the current path is
 * marked "(recursive)" and not expanded again.
 */
public final class CallTreeRenderer {

    private static final String INDENT = "  ";

    private CallTreeRenderer() {
    }

    public static String render(CallGraph graph, String methodName) {
        Objects.requireNonNull(graph, "graph");
        final var sb = new StringBuilder();
        for (String root : MethodSelection.of(graph, methodName).methods()) {
            appendTree(graph, root, 0, new LinkedHashSet<>(), sb);
        }
        return sb.toString();
    }

    private static void appendTree(CallGraph graph, String method, int depth, Set<String> path, StringBuilder sb) {
        final boolean recursive = path.contains(method);
        sb.append(INDENT.repeat(depth)).append(method);
        if (recursive) {
            sb.append(" (recursive)\n");
            return;
        }
        sb.append('\n');

        path.add(method);
        for (String callee : graph.callees(method)) {
            appendTree(graph, callee, depth + 1, path, sb);
        }
        path.remove(method);
    }
}
