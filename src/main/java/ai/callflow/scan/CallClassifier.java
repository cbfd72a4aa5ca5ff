package ai.callflow.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;

import ai.callflow.graph.MethodRegistry;
import ai.callflow.model.FlowStep;
import ai.callflow.model.Ids;

/**
 * Finds method invocations in a subtree and sorts them into internal and
 * external calls.
 * - unqualified call to a registered name -> internal
 * - call on {@code this} -> internal
 * - anything else -> external
 */
public final class CallClassifier {

    private final SourceText source;
    private final MethodRegistry registry;

    public CallClassifier(SourceText source, MethodRegistry registry) {
        this.source = Objects.requireNonNull(source, "source");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Every invocation under {@code node} (inclusive) in document order; an
     * invocation precedes the ones nested in its receiver and arguments.
     */
    public List<FlowStep.Call> classify(Node node) {
        Objects.requireNonNull(node, "node");
        final List<FlowStep.Call> calls = new ArrayList<>();
        visit(node, calls);
        return calls;
    }

    /**
     * Whether a call resolves to a method declared in this unit, i.e. belongs
     * in the caller -> callee adjacency.
     */
    public boolean resolvesInternally(FlowStep.Call call) {
        return !call.external() && registry.contains(call.name());
    }

    private void visit(Node node, List<FlowStep.Call> out) {
        if (node instanceof MethodCallExpr call) {
            out.add(toCall(call));
        }
        for (Node child : SourceText.childrenInOrder(node)) {
            visit(child, out);
        }
    }

    private FlowStep.Call toCall(MethodCallExpr call) {
        final String name = call.getNameAsString();
        final String receiver = call.getScope()
                .map(scope -> source.textOf(scope).trim())
                .orElse("");

        final boolean internal = receiver.isEmpty()
                ? registry.contains(name)
                : Ids.isSelfReference(receiver);

        return new FlowStep.Call(
                name,
                !internal,
                receiver,
                source.textOf(call),
                source.startOffset(call),
                source.lineOf(call)
        );
    }
}
