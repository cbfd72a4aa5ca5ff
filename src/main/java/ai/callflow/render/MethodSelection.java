package ai.callflow.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import ai.callflow.graph.CallGraph;
import ai.callflow.model.MethodNode;

/**
 * Which methods a render covers: the requested one if it exists, otherwise
 * every public or protected method in name order.
 */
record MethodSelection(List<String> methods, boolean specific) {

    static MethodSelection of(CallGraph graph, String methodName) {
        Objects.requireNonNull(graph, "graph");
        if (methodName != null && graph.nodes().containsKey(methodName)) {
            return new MethodSelection(List.of(methodName), true);
        }
        final List<String> visible = new ArrayList<>();
        for (MethodNode node : graph.nodes().values()) {
            if (node.isVisibleApi()) {
                visible.add(node.name());
            }
        }
        visible.sort(null);
        return new MethodSelection(List.copyOf(visible), false);
    }
}
