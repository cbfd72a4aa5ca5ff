package ai.callflow.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.callflow.graph.CallGraph;
import ai.callflow.graph.CallGraphBuilder;
import ai.callflow.model.FlowStep;

class MermaidFlowchartRendererTest {

    private static CallGraph build(String code) throws Exception {
        return new CallGraphBuilder().build(code);
    }

    private static String diagram(String code, String method, RenderOptions options) throws Exception {
        return MermaidFlowchartRenderer.render(build(code), method, options).diagramText();
    }

    private static String click(String id, int offset) {
        return "    click " + id + " call onNodeClick(\"offset-" + offset + "\") \"Scroll to source\"\n";
    }

    @Test
    void rendersSingleCallMethodExactly() throws Exception {
        final var graph = build("""
                public class Simple {
                    public void doWork() {
                        step1();
                    }
                    private void step1() { }
                }
                """);
        final var range = graph.node("doWork").orElseThrow().range();
        final var call = (FlowStep.Call) graph.flow("doWork").get(0);

        final var text = MermaidFlowchartRenderer.render(graph, null, RenderOptions.none()).diagramText();

        assertThat(text).isEqualTo("flowchart TD\n"
                + "  subgraph doWork\n"
                + "    direction TB\n"
                + "    N1([\"doWork\"]):::public\n"
                + click("N1", range.start())
                + "    N2[\"step1\"]:::internal\n"
                + click("N2", call.offset())
                + "    N1 --> N2\n"
                + "    N2 --> N3\n"
                + "    N3([\"End of doWork\"]):::endNode\n"
                + click("N3", range.end() - 1)
                + "  end\n"
                + "  classDef public fill:#f9f,stroke:#333,stroke-width:2px;\n"
                + "  classDef internal fill:#e1f5fe,stroke:#01579b,stroke-width:1px;\n"
                + "  classDef external fill:#ffe0b2,stroke:#e65100,stroke-width:1px,stroke-dasharray: 5 5;\n"
                + "  classDef decision fill:#fff9c4,stroke:#fbc02d,stroke-width:1px,shape:rhombus;\n"
                + "  classDef loop fill:#e8f5e9,stroke:#2e7d32,stroke-width:1px;\n"
                + "  classDef endNode fill:#fce4ec,stroke:#c62828,stroke-width:2px;\n");
    }

    @Test
    void joinsBothDecisionBranchesIntoNextStep() throws Exception {
        final var text = diagram("""
                public class Decision {
                    public void check(int x) {
                        if (x > 0) {
                            positive();
                        } else {
                            negative();
                        }
                        done();
                    }
                    void positive() { }
                    void negative() { }
                    void done() { }
                }
                """, null, RenderOptions.none());

        assertThat(text)
                .contains("    N2{\"x > 0\"}:::decision\n")
                .contains("    N1 --> N2\n")
                .contains("    N2 -->|Yes| N3\n")
                .contains("    N2 -->|No| N4\n")
                .contains("    N3 --> N5\n")
                .contains("    N4 --> N5\n")
                .contains("    N5 --> N6\n")
                .contains("    N6([\"End of check\"]):::endNode\n");
    }

    @Test
    void leavesDecisionDirectlyWhenElseIsMissing() throws Exception {
        final var text = diagram("""
                public class Guard {
                    public void run(boolean ready) {
                        if (ready) {
                            go();
                        }
                        after();
                    }
                    void go() { }
                    void after() { }
                }
                """, "run", RenderOptions.none());

        assertThat(text)
                .contains("    N2 -->|Yes| N3\n")
                .contains("    N3 --> N4\n")
                .contains("    N2 --> N4\n");
    }

    @Test
    void drawsLoopWithBodyAndRepeatEdge() throws Exception {
        final var text = diagram("""
                public class LoopTest {
                    public void process() {
                        for (int i = 0; i < 10; i++) {
                            work();
                        }
                        after();
                    }
                    void work() { }
                    void after() { }
                }
                """, null, RenderOptions.none());

        assertThat(text)
                .contains("    N2{{\"for (int i = 0; i < 10; i++)\"}}:::loop\n")
                .contains("    N2 -->|loop body| N3\n")
                .contains("    N3 -.->|repeat| N2\n")
                .contains("    N2 --> N4\n")
                .doesNotContain("N3 --> N4");
    }

    @Test
    void truncatesLongLoopHeaders() throws Exception {
        final var text = diagram("""
                public class Long {
                    public void run(java.util.List<String> items) {
                        for (String someVeryLongVariableName : items.subList(0, 10).stream().toList()) {
                        }
                    }
                }
                """, null, RenderOptions.none());

        final var line = text.lines().filter(l -> l.contains(":::loop")).findFirst().orElseThrow();
        final var label = line.substring(line.indexOf("{{\"") + 3, line.indexOf("\"}}"));
        assertThat(label).hasSize(MermaidFlowchartRenderer.LOOP_LABEL_MAX).endsWith("...");
    }

    @Test
    void labelsSwitchEdgesInCaseOrder() throws Exception {
        final var text = diagram("""
                public class SwitchTest {
                    public void route(int code) {
                        switch (code) {
                            case 1:
                                handleOne();
                                break;
                            case 2:
                                handleTwo();
                                break;
                            default:
                                handleDefault();
                        }
                    }
                    void handleOne() { }
                    void handleTwo() { }
                    void handleDefault() { }
                }
                """, null, RenderOptions.none());

        assertThat(text).contains("    N2{\"switch (code)\"}:::decision\n");
        final int one = text.indexOf("-->|case 1|");
        final int two = text.indexOf("-->|case 2|");
        final int other = text.indexOf("-->|default|");
        assertThat(one).isPositive();
        assertThat(two).isGreaterThan(one);
        assertThat(other).isGreaterThan(two);
        assertThat(text)
                .contains("    N3 --> N6\n")
                .contains("    N4 --> N6\n")
                .contains("    N5 --> N6\n");
    }

    @Test
    void rendersOnlyVisibleMethodsByDefault_inNameOrder() throws Exception {
        final var text = diagram("""
                public class Visibility {
                    public void zeta() { }
                    private void hidden() { }
                    protected void alpha() { }
                    void packagePrivate() { }
                }
                """, null, RenderOptions.none());

        assertThat(text)
                .contains("subgraph alpha")
                .contains("subgraph zeta")
                .doesNotContain("hidden")
                .doesNotContain("packagePrivate");
        assertThat(text.indexOf("subgraph alpha")).isLessThan(text.indexOf("subgraph zeta"));
    }

    @Test
    void rendersRequestedMethodEvenWhenPrivate() throws Exception {
        final var text = diagram("""
                public class Visibility {
                    public void open() { }
                    private void hidden() { }
                }
                """, "hidden", RenderOptions.none());

        assertThat(text).contains("subgraph hidden").doesNotContain("subgraph open");
    }

    @Test
    void fallsBackToVisibleMethodsForUnknownName() throws Exception {
        final var code = """
                public class Visibility {
                    public void open() { }
                    private void hidden() { }
                }
                """;

        assertThat(diagram(code, "nope", RenderOptions.none()))
                .isEqualTo(diagram(code, null, RenderOptions.none()));
    }

    @Test
    void labelsExternalCallsWithRawText() throws Exception {
        final var text = diagram("""
                public class Student {
                    public void study() {
                        teacher.ask();
                        this.lesson1();
                    }
                    void lesson1() { }
                }
                """, null, RenderOptions.none());

        assertThat(text)
                .contains("    N2[\"External: teacher.ask()\"]:::external\n")
                .contains("    N3[\"lesson1\"]:::internal\n");
    }

    @Test
    void filtersIgnoredServicesAndVariables_butStillReportsThem() throws Exception {
        final var code = """
                public class ServiceCall {
                    public void run() {
                        emailService.send();
                        logger.info("start");
                        System.out.println("x");
                        userRepository.save();
                    }
                }
                """;
        final var options = RenderOptions.none()
                .withIgnoredServices(List.of("emailService"))
                .withIgnoredVariables(List.of("logger"));

        final var result = MermaidFlowchartRenderer.render(build(code), null, options);

        assertThat(result.diagramText())
                .doesNotContain("emailService")
                .doesNotContain("logger")
                .contains("External: System.out.println('x')")
                .contains("External: userRepository.save()");
        assertThat(result.externalServices())
                .containsExactly("emailService", "logger", "System", "userRepository");
    }

    @Test
    void keepsFrontierAcrossFilteredCalls() throws Exception {
        final var text = diagram("""
                public class Chain {
                    public void run() {
                        first();
                        System.out.println("hidden");
                        second();
                    }
                    void first() { }
                    void second() { }
                }
                """, null, RenderOptions.defaults());

        assertThat(text)
                .doesNotContain("System.out")
                .contains("    N2[\"first\"]:::internal\n")
                .contains("    N3[\"second\"]:::internal\n")
                .contains("    N2 --> N3\n");
    }

    @Test
    void keepsBranchLabelWhenFirstBranchCallIsFiltered() throws Exception {
        final var text = diagram("""
                public class Branch {
                    public void run(boolean flag) {
                        if (flag) {
                            System.err.println("log");
                            work();
                        }
                    }
                    void work() { }
                }
                """, null, RenderOptions.defaults());

        assertThat(text).contains("    N2 -->|Yes| N3\n").contains("    N3[\"work\"]:::internal\n");
    }

    @Test
    void collapsesToOneNodePerMethod() throws Exception {
        final var code = """
                public class Collapse {
                    public void a() {
                        helper();
                    }
                    public void b() {
                        helper();
                    }
                    private void helper() { }
                }
                """;
        final var collapsed = diagram(code, null, RenderOptions.none().withCollapseDetails(true));
        final var full = diagram(code, null, RenderOptions.none());

        assertThat(collapsed)
                .contains("    N1([\"a\"]):::public\n")
                .contains("    N2([\"b\"]):::public\n")
                .doesNotContain("subgraph")
                .doesNotContain("helper");
        assertThat(collapsed.length()).isLessThan(full.length());
    }

    @Test
    void ignoresCollapseForSpecificMethod() throws Exception {
        final var code = """
                public class Collapse {
                    public void a() {
                        helper();
                    }
                    private void helper() { }
                }
                """;

        assertThat(diagram(code, "a", RenderOptions.none().withCollapseDetails(true)))
                .isEqualTo(diagram(code, "a", RenderOptions.none()));
    }

    @Test
    void appendsLineReferenceWhenEnabled() throws Exception {
        final var code = """
                public class Simple {
                    public void doWork() {
                        step1();
                    }
                    private void step1() { }
                }
                """;

        assertThat(diagram(code, null, RenderOptions.none().withSourceReference(true)))
                .contains("    N2[\"step1 (L3)\"]:::internal\n");
        assertThat(diagram(code, null, RenderOptions.none()))
                .doesNotContain("(L3)");
    }

    @Test
    void appendsLineReferenceToEveryStepKind() throws Exception {
        final var code = """
                public class Refs {
                    public int run(int x) {
                        if (x > 0) {
                            step();
                        }
                        while (x < 5) {
                            x++;
                        }
                        switch (x) {
                            case 1:
                                step();
                        }
                        return x;
                    }
                    void step() { }
                }
                """;

        assertThat(diagram(code, null, RenderOptions.none().withSourceReference(true)))
                .contains("    N2{\"x > 0 (L3)\"}:::decision\n")
                .contains("    N3[\"step (L4)\"]:::internal\n")
                .contains("    N4{{\"while (x < 5) (L6)\"}}:::loop\n")
                .contains("    N5{\"switch (x) (L9)\"}:::decision\n")
                .contains("    N6[\"step (L11)\"]:::internal\n")
                .contains("    N7[\"return x; (L13)\"]\n")
                .doesNotContain("run (L");
        assertThat(diagram(code, null, RenderOptions.none()))
                .contains("    N2{\"x > 0\"}:::decision\n")
                .contains("    N4{{\"while (x < 5)\"}}:::loop\n")
                .contains("    N5{\"switch (x)\"}:::decision\n")
                .contains("    N7[\"return x;\"]\n")
                .doesNotContain("(L");
    }

    @Test
    void rendersReturnAsPlainNode() throws Exception {
        final var text = diagram("""
                public class Calc {
                    public int total() {
                        return "a".length();
                    }
                }
                """, null, RenderOptions.none());

        assertThat(text)
                .contains("    N2[\"return 'a'.length();\"]\n")
                .contains("    N2 --> N3\n");
    }

    @Test
    void connectsStartToEndForEmptyBody() throws Exception {
        final var text = diagram("""
                public abstract class Api {
                    public abstract void call();
                }
                """, null, RenderOptions.none());

        assertThat(text)
                .contains("    N1([\"call\"]):::public\n")
                .contains("    N1 --> N2\n")
                .contains("    N2([\"End of call\"]):::endNode\n");
    }

    @Test
    void rendersHeaderAndStylesForEmptyGraph() {
        final var result = MermaidFlowchartRenderer.render(CallGraph.empty(), null, null);

        assertThat(result.diagramText())
                .startsWith("flowchart TD\n")
                .contains("classDef endNode")
                .doesNotContain("subgraph");
        assertThat(result.externalServices()).isEmpty();
    }

    @Test
    void numbersNodesFromOneOnEveryRender() throws Exception {
        final var graph = build("""
                public class Simple {
                    public void doWork() {
                        step1();
                    }
                    private void step1() { }
                }
                """);

        final var first = MermaidFlowchartRenderer.render(graph, null, RenderOptions.none());
        final var second = MermaidFlowchartRenderer.render(graph, null, RenderOptions.none());

        assertThat(second).isEqualTo(first);
    }
}
