package ai.callflow.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One declared method or constructor. Identified by its simple name only.
 */
public record MethodNode(
        String name,
        SourceRange range,
        List<String> modifiers,  // annotations and keywords, source order
        String returnType        // "" for constructors
) {
    public MethodNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(range, "range");
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        returnType = returnType == null ? "" : returnType;
    }

    public boolean hasModifier(String modifier) {
        return modifiers.contains(modifier);
    }

    /**
     * Part of the default diagram view: declared public or protected.
     */
    @JsonIgnore
    public boolean isVisibleApi() {
        return hasModifier("public") || hasModifier("protected");
    }
}
