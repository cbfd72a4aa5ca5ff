package ai.callflow.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import ai.callflow.model.MethodNode;

/**
 * Declared methods of one source unit, keyed by simple name.
 * A later registration with the same name replaces the earlier one
 * (overloads collapse; calls cannot be told apart by signature).
 */
public final class MethodRegistry {

    private final Map<String, MethodNode> byName = new LinkedHashMap<>();

    /**
     * @return the declaration this one replaces, if any
     */
    public Optional<MethodNode> register(MethodNode method) {
        Objects.requireNonNull(method, "method");
        return Optional.ofNullable(byName.put(method.name(), method));
    }

    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    public Map<String, MethodNode> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(byName));
    }
}
