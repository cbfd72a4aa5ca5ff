package ai.callflow.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;

import ai.callflow.graph.MethodRegistry;
import ai.callflow.model.FlowStep;
import ai.callflow.model.Labels;

/**
 * Second pass: turns a method body into nested {@link FlowStep}s and collects
 * the internal callees met on the way.
 *
 * <p>Statements without a dedicated rule are descended into: nested
 * statements are dispatched as usual, nested expressions contribute their
 * calls. Nothing in the body is silently dropped.
 */
public final class FlowExtractor {

    private final SourceText source;
    private final CallClassifier classifier;

    public FlowExtractor(SourceText source, MethodRegistry registry) {
        this.source = Objects.requireNonNull(source, "source");
        this.classifier = new CallClassifier(source, Objects.requireNonNull(registry, "registry"));
    }

    /**
     * @return empty for abstract, interface and native methods
     */
    public Optional<Extraction> extract(CallableDeclaration<?> declaration) {
        Objects.requireNonNull(declaration, "declaration");
        final Optional<BlockStmt> body;
        if (declaration instanceof MethodDeclaration md) {
            body = md.getBody();
        } else if (declaration instanceof ConstructorDeclaration cd) {
            body = Optional.of(cd.getBody());
        } else {
            body = Optional.empty();
        }
        return body.map(this::extractBody);
    }

    public Extraction extractBody(BlockStmt body) {
        Objects.requireNonNull(body, "body");
        final List<String> callees = new ArrayList<>();
        final List<FlowStep> steps = statement(body, callees);
        return new Extraction(steps, callees);
    }

    private List<FlowStep> statement(Statement stmt, List<String> callees) {
        if (stmt instanceof BlockStmt block) {
            return statements(block.getStatements(), callees);
        }
        if (stmt instanceof ExpressionStmt es) {
            return calls(es, callees);
        }
        if (stmt instanceof ReturnStmt rs) {
            return List.of(returnStep(rs, callees));
        }
        if (stmt instanceof IfStmt ifStmt) {
            return ifSteps(ifStmt, callees);
        }
        if (stmt instanceof ForStmt
                || stmt instanceof WhileStmt
                || stmt instanceof DoStmt
                || stmt instanceof ForEachStmt) {
            return List.of(loopStep(stmt, callees));
        }
        if (stmt instanceof SwitchStmt ss) {
            return List.of(switchStep(ss, callees));
        }
        return generic(stmt, callees);
    }

    private List<FlowStep> statements(List<Statement> stmts, List<String> callees) {
        final List<FlowStep> steps = new ArrayList<>();
        for (Statement s : stmts) {
            steps.addAll(statement(s, callees));
        }
        return steps;
    }

    private List<FlowStep> node(Node node, List<String> callees) {
        if (node instanceof Statement s) {
            return statement(s, callees);
        }
        if (node instanceof Expression e) {
            return calls(e, callees);
        }
        return generic(node, callees);
    }

    private List<FlowStep> generic(Node node, List<String> callees) {
        final List<FlowStep> steps = new ArrayList<>();
        for (Node child : SourceText.childrenInOrder(node)) {
            steps.addAll(node(child, callees));
        }
        return steps;
    }

    private List<FlowStep> calls(Node node, List<String> callees) {
        final List<FlowStep.Call> found = classifier.classify(node);
        recordCallees(found, callees);
        return new ArrayList<>(found);
    }

    /** Adds internal callees without producing steps (loop headers, selectors, return values). */
    private void calleesOnly(Node node, List<String> callees) {
        recordCallees(classifier.classify(node), callees);
    }

    private void recordCallees(List<FlowStep.Call> found, List<String> callees) {
        for (FlowStep.Call call : found) {
            if (classifier.resolvesInternally(call)) {
                callees.add(call.name());
            }
        }
    }

    private FlowStep returnStep(ReturnStmt rs, List<String> callees) {
        rs.getExpression().ifPresent(e -> calleesOnly(e, callees));
        return new FlowStep.Return(
                Labels.sanitize(source.textOf(rs)),
                source.startOffset(rs),
                source.lineOf(rs)
        );
    }

    private List<FlowStep> ifSteps(IfStmt ifStmt, List<String> callees) {
        final Expression condition = ifStmt.getCondition();
        final List<FlowStep> steps = calls(condition, callees);

        final List<FlowStep> yes = statement(ifStmt.getThenStmt(), callees);
        final List<FlowStep> no = ifStmt.getElseStmt()
                .map(s -> statement(s, callees))
                .orElse(List.of());

        steps.add(new FlowStep.Decision(
                Labels.sanitize(source.textOf(condition)),
                source.startOffset(condition),
                source.lineOf(condition),
                yes,
                no
        ));
        return steps;
    }

    private FlowStep loopStep(Statement loop, List<String> callees) {
        final String header;
        final List<FlowStep> body;
        if (loop instanceof ForStmt fs) {
            fs.getInitialization().forEach(e -> calleesOnly(e, callees));
            fs.getCompare().ifPresent(e -> calleesOnly(e, callees));
            fs.getUpdate().forEach(e -> calleesOnly(e, callees));
            header = forHeader(fs);
            body = statement(fs.getBody(), callees);
        } else if (loop instanceof WhileStmt ws) {
            calleesOnly(ws.getCondition(), callees);
            header = "while (" + source.textOf(ws.getCondition()) + ")";
            body = statement(ws.getBody(), callees);
        } else if (loop instanceof DoStmt ds) {
            // body comes first in the source
            body = statement(ds.getBody(), callees);
            calleesOnly(ds.getCondition(), callees);
            header = "do...while (" + source.textOf(ds.getCondition()) + ")";
        } else {
            final ForEachStmt fe = (ForEachStmt) loop;
            calleesOnly(fe.getIterable(), callees);
            header = forEachHeader(fe);
            body = statement(fe.getBody(), callees);
        }
        return new FlowStep.Loop(
                Labels.sanitize(header),
                source.startOffset(loop),
                source.lineOf(loop),
                body
        );
    }

    private String forHeader(ForStmt fs) {
        final String init = joinTexts(fs.getInitialization());
        final String compare = fs.getCompare().map(source::textOf).orElse("");
        final String update = joinTexts(fs.getUpdate());
        if (init.isEmpty() && compare.isEmpty() && update.isEmpty()) {
            return "for (;;)";
        }
        return "for (" + init + "; " + compare + "; " + update + ")";
    }

    private String forEachHeader(ForEachStmt fe) {
        final var variables = fe.getVariable().getVariables();
        if (variables.isEmpty()) {
            return "for (" + source.textOf(fe.getVariable()) + " : " + source.textOf(fe.getIterable()) + ")";
        }
        final VariableDeclarator v = variables.get(0);
        return "for (" + source.textOf(v.getType()) + " " + v.getNameAsString()
                + " : " + source.textOf(fe.getIterable()) + ")";
    }

    private String joinTexts(NodeList<Expression> expressions) {
        final List<String> parts = new ArrayList<>(expressions.size());
        for (Expression e : expressions) {
            parts.add(source.textOf(e));
        }
        return String.join(", ", parts);
    }

    private FlowStep switchStep(SwitchStmt ss, List<String> callees) {
        final Expression selector = ss.getSelector();
        final NodeList<SwitchEntry> entries = ss.getEntries();
        calleesOnly(selector, callees);

        final List<FlowStep.SwitchCase> cases = new ArrayList<>();
        final List<String> groupLabels = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            final SwitchEntry entry = entries.get(i);
            groupLabels.add(entryLabel(entry));

            // "case 1: case 2: work();" shares one statement group
            final boolean fallsThrough = entry.getType() == SwitchEntry.Type.STATEMENT_GROUP
                    && entry.getStatements().isEmpty()
                    && i < entries.size() - 1;
            if (fallsThrough) {
                continue;
            }

            final String label = groupLabels.isEmpty() ? "case" : String.join(", ", groupLabels);
            cases.add(new FlowStep.SwitchCase(
                    Labels.sanitize(label),
                    statements(entry.getStatements(), callees)
            ));
            groupLabels.clear();
        }

        return new FlowStep.Switch(
                Labels.sanitize("switch (" + source.textOf(selector) + ")"),
                source.startOffset(ss),
                source.lineOf(ss),
                cases
        );
    }

    private String entryLabel(SwitchEntry entry) {
        if (entry.getLabels().isEmpty()) {
            return "default";
        }
        final StringBuilder label = new StringBuilder("case ").append(joinTexts(entry.getLabels()));
        if (entry.isDefault()) {
            // case null, default
            label.append(", default");
        }
        entry.getGuard().ifPresent(g -> label.append(" when ").append(source.textOf(g)));
        return label.toString();
    }

    /**
     * Flow of one body plus its internal callees in encounter order.
     */
    public record Extraction(List<FlowStep> steps, List<String> callees) {
        public Extraction {
            steps = List.copyOf(steps);
            callees = List.copyOf(callees);
        }
    }
}
