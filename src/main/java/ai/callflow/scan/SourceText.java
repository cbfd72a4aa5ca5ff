package ai.callflow.scan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.github.javaparser.Position;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;

import ai.callflow.model.SourceRange;

/**
 * Maps JavaParser line/column positions back to offsets in the original text,
 * so labels can quote the source exactly as written.
 */
public final class SourceText {

    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.lineStarts = computeLineStarts(text);
    }

    /**
     * Offset of a 1-based line/column position, clamped to the text bounds.
     */
    public int offsetOf(Position position) {
        Objects.requireNonNull(position, "position");
        final int lineIndex = Math.max(0, Math.min(position.line - 1, lineStarts.length - 1));
        final int offset = lineStarts[lineIndex] + Math.max(0, position.column - 1);
        return Math.min(offset, text.length());
    }

    public int startOffset(Node node) {
        return node.getRange()
                .map(r -> offsetOf(r.begin))
                .orElse(0);
    }

    /** Exclusive end offset. */
    public int endOffset(Node node) {
        return node.getRange()
                .map(r -> Math.min(offsetOf(r.end) + 1, text.length()))
                .orElse(0);
    }

    public SourceRange rangeOf(Node node) {
        final int start = startOffset(node);
        return new SourceRange(start, Math.max(start, endOffset(node)));
    }

    public int lineOf(Node node) {
        return node.getBegin().map(p -> p.line).orElse(0);
    }

    /**
     * The node's literal source text; falls back to JavaParser's printed form
     * for synthetic nodes without a range.
     */
    public String textOf(Node node) {
        if (node.getRange().isEmpty()) {
            return node.toString();
        }
        final int start = startOffset(node);
        final int end = endOffset(node);
        return end > start ? text.substring(start, end) : "";
    }

    /**
     * Child nodes in document order, comments excluded. JavaParser keeps
     * children in construction order, which is not always source order.
     */
    public static List<Node> childrenInOrder(Node node) {
        final List<Node> children = new ArrayList<>();
        for (Node child : node.getChildNodes()) {
            if (!(child instanceof Comment)) {
                children.add(child);
            }
        }
        children.sort(Comparator.comparing(
                (Node n) -> n.getBegin().orElse(null),
                Comparator.nullsLast(Comparator.naturalOrder())));
        return children;
    }

    private static int[] computeLineStarts(String text) {
        final List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '\n') {
                starts.add(i + 1);
            } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                starts.add(i + 1);
            }
        }
        final int[] result = new int[starts.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = starts.get(i);
        }
        return result;
    }
}
