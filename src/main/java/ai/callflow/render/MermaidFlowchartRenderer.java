package ai.callflow.render;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import ai.callflow.graph.CallGraph;
import ai.callflow.model.FlowStep;
import ai.callflow.model.Ids;
import ai.callflow.model.Labels;
import ai.callflow.model.MethodNode;

/**
 * Renders flow steps as a Mermaid {@code flowchart TD}, one subgraph per
 * method. Node ids are numbered per render, so output is reproducible.
 *
 * <p>Rendering keeps a frontier: the nodes whose outgoing edge is not drawn
 * yet. Each step connects the frontier to its own node and leaves a new
 * frontier behind. A pending edge label ("Yes", "No", a case label) is put on
 * the edges of the first step that actually draws something.
 */
public final class MermaidFlowchartRenderer {

    static final int LOOP_LABEL_MAX = 60;
    static final int CASE_LABEL_MAX = 30;

    private static final String[] STYLES = {
            "  classDef public fill:#f9f,stroke:#333,stroke-width:2px;",
            "  classDef internal fill:#e1f5fe,stroke:#01579b,stroke-width:1px;",
            "  classDef external fill:#ffe0b2,stroke:#e65100,stroke-width:1px,stroke-dasharray: 5 5;",
            "  classDef decision fill:#fff9c4,stroke:#fbc02d,stroke-width:1px,shape:rhombus;",
            "  classDef loop fill:#e8f5e9,stroke:#2e7d32,stroke-width:1px;",
            "  classDef endNode fill:#fce4ec,stroke:#c62828,stroke-width:2px;"
    };

    private final CallGraph graph;
    private final RenderOptions options;
    private final StringBuilder out = new StringBuilder();
    private int nodeCounter;

    private MermaidFlowchartRenderer(CallGraph graph, RenderOptions options) {
        this.graph = graph;
        this.options = options;
    }

    /**
     * @param methodName method to render; {@code null} or unknown renders all
     *                   public and protected methods
     */
    public static DiagramResult render(CallGraph graph, String methodName, RenderOptions options) {
        Objects.requireNonNull(graph, "graph");
        final RenderOptions safeOptions = options == null ? RenderOptions.none() : options;
        return new MermaidFlowchartRenderer(graph, safeOptions).run(methodName);
    }

    private DiagramResult run(String methodName) {
        final MethodSelection selection = MethodSelection.of(graph, methodName);

        out.append("flowchart TD\n");
        if (options.collapseDetails() && !selection.specific()) {
            for (String method : selection.methods()) {
                renderPlaceholder(method);
            }
        } else {
            for (String method : selection.methods()) {
                renderMethod(method);
            }
        }
        for (String style : STYLES) {
            out.append(style).append('\n');
        }

        final Set<String> services = new LinkedHashSet<>();
        for (String method : selection.methods()) {
            collectServices(graph.flow(method), services);
        }
        return new DiagramResult(out.toString(), new ArrayList<>(services));
    }

    private void renderPlaceholder(String method) {
        final MethodNode node = graph.nodes().get(method);
        final String id = nextId();
        out.append("    ").append(id).append("([\"").append(Labels.sanitize(method)).append("\"]):::public\n");
        click(id, node.range().start());
    }

    private void renderMethod(String method) {
        final MethodNode node = graph.nodes().get(method);
        out.append("  subgraph ").append(method).append('\n');
        out.append("    direction TB\n");

        final String startId = nextId();
        out.append("    ").append(startId).append("([\"").append(Labels.sanitize(method)).append("\"]):::public\n");
        click(startId, node.range().start());

        final List<String> exits = renderSequence(graph.flow(method), List.of(startId), null);

        final String endId = nextId();
        for (String prev : exits) {
            edge(prev, endId, null);
        }
        out.append("    ").append(endId).append("([\"End of ").append(Labels.sanitize(method))
                .append("\"]):::endNode\n");
        click(endId, Math.max(node.range().start(), node.range().end() - 1));
        out.append("  end\n");
    }

    private List<String> renderSequence(List<FlowStep> steps, List<String> frontier, String label) {
        List<String> current = frontier;
        String pending = label;
        for (FlowStep step : steps) {
            final List<String> next = renderStep(step, current, pending);
            if (!next.equals(current)) {
                pending = null;
                current = next;
            }
        }
        return current;
    }

    private List<String> renderStep(FlowStep step, List<String> frontier, String label) {
        if (step instanceof FlowStep.Call call) {
            return renderCall(call, frontier, label);
        }
        if (step instanceof FlowStep.Decision decision) {
            return renderDecision(decision, frontier, label);
        }
        if (step instanceof FlowStep.Loop loop) {
            return renderLoop(loop, frontier, label);
        }
        if (step instanceof FlowStep.Switch sw) {
            return renderSwitch(sw, frontier, label);
        }
        final FlowStep.Return ret = (FlowStep.Return) step;
        final String id = nextId();
        out.append("    ").append(id).append("[\"").append(withLine(Labels.sanitize(ret.label()), ret.line()))
                .append("\"]\n");
        click(id, ret.offset());
        connect(frontier, id, label);
        return List.of(id);
    }

    private List<String> renderCall(FlowStep.Call call, List<String> frontier, String label) {
        if (call.external() && options.ignores(call)) {
            return frontier;
        }
        final String text = call.external() ? "External: " + call.rawText() : call.name();
        final String style = call.external() ? "external" : "internal";

        final String id = nextId();
        out.append("    ").append(id).append("[\"").append(withLine(Labels.sanitize(text), call.line()))
                .append("\"]:::").append(style).append('\n');
        click(id, call.offset());
        connect(frontier, id, label);
        return List.of(id);
    }

    private List<String> renderDecision(FlowStep.Decision decision, List<String> frontier, String label) {
        final String id = nextId();
        out.append("    ").append(id).append("{\"").append(withLine(Labels.sanitize(decision.label()), decision.line()))
                .append("\"}:::decision\n");
        click(id, decision.offset());
        connect(frontier, id, label);

        final Set<String> exits = new LinkedHashSet<>();
        exits.addAll(renderSequence(decision.yesBranch(), List.of(id), "Yes"));
        exits.addAll(renderSequence(decision.noBranch(), List.of(id), "No"));
        return List.copyOf(exits);
    }

    private List<String> renderLoop(FlowStep.Loop loop, List<String> frontier, String label) {
        final String text = Labels.truncate(Labels.sanitize(loop.label()), LOOP_LABEL_MAX);
        final String id = nextId();
        out.append("    ").append(id).append("{{\"").append(withLine(text, loop.line()))
                .append("\"}}:::loop\n");
        click(id, loop.offset());
        connect(frontier, id, label);

        final List<String> bodyExits = renderSequence(loop.body(), List.of(id), "loop body");
        for (String exit : bodyExits) {
            if (!exit.equals(id)) {
                out.append("    ").append(exit).append(" -.->|repeat| ").append(id).append('\n');
            }
        }
        return List.of(id);
    }

    private List<String> renderSwitch(FlowStep.Switch sw, List<String> frontier, String label) {
        final String id = nextId();
        out.append("    ").append(id).append("{\"").append(withLine(Labels.sanitize(sw.label()), sw.line()))
                .append("\"}:::decision\n");
        click(id, sw.offset());
        connect(frontier, id, label);

        final Set<String> exits = new LinkedHashSet<>();
        for (FlowStep.SwitchCase c : sw.cases()) {
            final String caseLabel = Labels.truncate(Labels.sanitize(c.label()), CASE_LABEL_MAX);
            exits.addAll(renderSequence(c.steps(), List.of(id), caseLabel));
        }
        if (exits.isEmpty()) {
            return List.of(id);
        }
        return List.copyOf(exits);
    }

    private void collectServices(List<FlowStep> steps, Set<String> services) {
        for (FlowStep step : steps) {
            if (step instanceof FlowStep.Call call) {
                if (call.external() && !call.serviceName().isEmpty()) {
                    services.add(call.serviceName());
                }
            } else if (step instanceof FlowStep.Decision decision) {
                collectServices(decision.yesBranch(), services);
                collectServices(decision.noBranch(), services);
            } else if (step instanceof FlowStep.Loop loop) {
                collectServices(loop.body(), services);
            } else if (step instanceof FlowStep.Switch sw) {
                for (FlowStep.SwitchCase c : sw.cases()) {
                    collectServices(c.steps(), services);
                }
            }
        }
    }

    private String withLine(String text, int line) {
        return options.showSourceReference() ? text + " (L" + line + ")" : text;
    }

    private void connect(List<String> frontier, String to, String label) {
        for (String prev : frontier) {
            edge(prev, to, label);
        }
    }

    private void edge(String from, String to, String label) {
        out.append("    ").append(from);
        if (label == null) {
            out.append(" --> ");
        } else {
            out.append(" -->|").append(label).append("| ");
        }
        out.append(to).append('\n');
    }

    private void click(String id, int offset) {
        out.append("    click ").append(id).append(" call onNodeClick(\"")
                .append(Ids.offsetTarget(offset)).append("\") \"Scroll to source\"\n");
    }

    private String nextId() {
        nodeCounter++;
        return Ids.nodeId(nodeCounter);
    }
}
