package ai.callflow.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.callflow.graph.CallGraph;
import ai.callflow.render.DiagramResult;

/**
 * JSON form of an analysis, for UIs and other tools.
 */
public final class GraphWriter {

    public static final String SCHEMA_VERSION = "callflow/v1";

    private final ObjectMapper jsonMapper;

    public GraphWriter() {
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(CallGraph graph) throws IOException {
        return toJson(graph, null);
    }

    /**
     * @param diagram may be {@code null}; the field is then omitted
     */
    public String toJson(CallGraph graph, DiagramResult diagram) throws IOException {
        Objects.requireNonNull(graph, "graph");
        return jsonMapper.writeValueAsString(new Document(SCHEMA_VERSION, graph, diagram));
    }

    public void write(Path file, CallGraph graph, DiagramResult diagram) throws IOException {
        Objects.requireNonNull(file, "file");
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(graph, diagram), StandardCharsets.UTF_8);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Document(
            String schema,
            CallGraph graph,
            DiagramResult diagram
    ) {
    }
}
