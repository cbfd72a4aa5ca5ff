package ai.callflow;

import java.util.Objects;

import ai.callflow.graph.CallGraph;
import ai.callflow.graph.CallGraphBuilder;
import ai.callflow.render.CallTreeRenderer;
import ai.callflow.render.DiagramResult;
import ai.callflow.render.MermaidFlowchartRenderer;
import ai.callflow.render.RenderOptions;
import ai.callflow.scan.SourceParseException;

/**
 * Entry point for callers embedding the analysis: parse once, render as often
 * as needed with different options. Stateless, safe to share.
 */
public final class CallFlowAnalyzer {

    private final CallGraphBuilder builder;

    public CallFlowAnalyzer() {
        this(new CallGraphBuilder());
    }

    public CallFlowAnalyzer(CallGraphBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    /**
     * @throws SourceParseException if the source is not valid Java
     */
    public CallGraph parse(String source) throws SourceParseException {
        return builder.build(source);
    }

    /**
     * Renders from an existing graph; never re-parses.
     *
     * @param methodName a single method, or {@code null} for all public and protected ones
     */
    public DiagramResult render(CallGraph graph, String methodName, RenderOptions options) {
        return MermaidFlowchartRenderer.render(graph, methodName, options);
    }

    /**
     * Parses and renders in one go. Parse failures propagate the same way as
     * from {@link #parse(String)}.
     */
    public DiagramResult render(String source, String methodName, RenderOptions options)
            throws SourceParseException {
        return render(parse(source), methodName, options);
    }

    public String callTree(CallGraph graph, String methodName) {
        return CallTreeRenderer.render(graph, methodName);
    }
}
