package ai.callflow.scan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import ai.callflow.graph.MethodRegistry;
import ai.callflow.model.MethodNode;

/**
 * First pass: finds method and constructor declarations in the type bodies
 * of a compilation unit, nested member types included. Method bodies are not
 * searched.
 */
public final class DeclarationCollector {

    private final SourceText source;

    public DeclarationCollector(SourceText source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public Collected collect(CompilationUnit cu) {
        Objects.requireNonNull(cu, "cu");
        final MethodRegistry registry = new MethodRegistry();
        final List<Declaration> declarations = new ArrayList<>();
        for (TypeDeclaration<?> type : cu.getTypes()) {
            collectMembers(type, registry, declarations);
        }
        return new Collected(registry, declarations);
    }

    private void collectMembers(TypeDeclaration<?> type,
                                MethodRegistry registry,
                                List<Declaration> declarations) {
        for (BodyDeclaration<?> member : type.getMembers()) {
            if (member instanceof MethodDeclaration md) {
                register(md, source.textOf(md.getType()).trim(), registry, declarations);
            } else if (member instanceof ConstructorDeclaration cd) {
                register(cd, "", registry, declarations);
            } else if (member instanceof TypeDeclaration<?> nested) {
                collectMembers(nested, registry, declarations);
            }
        }
    }

    private void register(CallableDeclaration<?> decl,
                          String returnType,
                          MethodRegistry registry,
                          List<Declaration> declarations) {
        final String name = decl.getNameAsString().trim();
        final var method = new MethodNode(
                name,
                source.rangeOf(decl),
                modifierTokens(decl),
                returnType
        );
        registry.register(method);
        declarations.add(new Declaration(name, decl));
    }

    /**
     * Annotations and keyword modifiers as written, in source order.
     */
    private List<String> modifierTokens(CallableDeclaration<?> decl) {
        final List<Node> parts = new ArrayList<>(decl.getAnnotations());
        parts.addAll(decl.getModifiers());
        parts.sort(Comparator.comparingInt(source::startOffset));

        final List<String> tokens = new ArrayList<>(parts.size());
        for (Node part : parts) {
            final String text = source.textOf(part).trim();
            if (!text.isEmpty()) {
                tokens.add(text);
            }
        }
        return tokens;
    }

    public record Declaration(String name, CallableDeclaration<?> node) {
    }

    public record Collected(MethodRegistry registry, List<Declaration> declarations) {
        public Collected {
            declarations = List.copyOf(declarations);
        }
    }
}
