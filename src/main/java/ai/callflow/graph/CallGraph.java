package ai.callflow.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import ai.callflow.model.FlowStep;
import ai.callflow.model.MethodNode;

/**
 * Analysis result for one source unit, read-only once built.
 * - nodes: method name -> declaration
 * - calls: caller -> internal callees in encounter order (duplicates kept)
 * - flows: method name -> top-level flow steps of its body
 */
public record CallGraph(
        Map<String, MethodNode> nodes,
        Map<String, List<String>> calls,
        Map<String, List<FlowStep>> flows
) {
    public CallGraph {
        nodes = freeze(nodes);
        calls = freezeLists(calls);
        flows = freezeLists(flows);
    }

    public static CallGraph empty() {
        return new CallGraph(Map.of(), Map.of(), Map.of());
    }

    public Optional<MethodNode> node(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public List<String> callees(String caller) {
        return calls.getOrDefault(caller, List.of());
    }

    public List<FlowStep> flow(String method) {
        return flows.getOrDefault(method, List.of());
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        if (map == null) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static <T> Map<String, List<T>> freezeLists(Map<String, List<T>> map) {
        if (map == null) {
            return Map.of();
        }
        final Map<String, List<T>> copy = new LinkedHashMap<>();
        for (var e : map.entrySet()) {
            copy.put(e.getKey(), e.getValue() == null ? List.of() : List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
