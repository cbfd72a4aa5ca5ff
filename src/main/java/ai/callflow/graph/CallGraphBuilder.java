package ai.callflow.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import ai.callflow.model.FlowStep;
import ai.callflow.scan.DeclarationCollector;
import ai.callflow.scan.FlowExtractor;
import ai.callflow.scan.SourceParseException;
import ai.callflow.scan.SourceParser;
import ai.callflow.scan.SourceText;

/**
 * Builds the call graph of one Java source unit.
 * Every call starts from scratch: parse, collect, extract.
 */
public final class CallGraphBuilder {

    private final SourceParser parser;

    public CallGraphBuilder() {
        this(new SourceParser());
    }

    public CallGraphBuilder(SourceParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public CallGraph build(String sourceCode) throws SourceParseException {
        Objects.requireNonNull(sourceCode, "sourceCode");

        // Step 1: syntax tree
        final var cu = parser.parse(sourceCode);
        final SourceText source = new SourceText(sourceCode);

        // Step 2: method registry (first pass, names only)
        final var collected = new DeclarationCollector(source).collect(cu);
        final MethodRegistry registry = collected.registry();

        // Step 3: flows and call adjacency per declaration; same-named
        // declarations overwrite each other, last one wins
        final FlowExtractor extractor = new FlowExtractor(source, registry);
        final Map<String, List<String>> calls = new LinkedHashMap<>();
        final Map<String, List<FlowStep>> flows = new LinkedHashMap<>();

        for (var declaration : collected.declarations()) {
            final var extraction = extractor.extract(declaration.node());
            final List<String> callees = new ArrayList<>();
            final List<FlowStep> steps = new ArrayList<>();
            extraction.ifPresent(x -> {
                callees.addAll(x.callees());
                steps.addAll(x.steps());
            });
            calls.put(declaration.name(), callees);
            flows.put(declaration.name(), steps);
        }

        return new CallGraph(registry.asMap(), calls, flows);
    }
}
