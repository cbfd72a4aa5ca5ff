package ai.callflow.render;

import java.util.List;
import java.util.Objects;

/**
 * Flowchart markup plus the receivers of all external calls found in the
 * rendered methods, filtered or not.
 */
public record DiagramResult(String diagramText, List<String> externalServices) {
    public DiagramResult {
        Objects.requireNonNull(diagramText, "diagramText");
        externalServices = externalServices == null ? List.of() : List.copyOf(externalServices);
    }
}
