package ai.callflow.scan;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import ai.callflow.model.MethodNode;

class DeclarationCollectorTest {

    private static DeclarationCollector.Collected collect(String code) throws Exception {
        final var cu = new SourceParser().parse(code);
        return new DeclarationCollector(new SourceText(code)).collect(cu);
    }

    @Test
    void collectsMethodsConstructorsAndNestedMembers() throws Exception {
        final String code = """
                class Student {
                    @Override
                    public static void study() { lesson1(); }
                    private int lesson1() { return 1; }
                    Student() {}
                    static class Inner {
                        protected String helper() { return ""; }
                    }
                    interface Callback { void done(); }
                }
                """;

        final var collected = collect(code);
        final var registry = collected.registry();

        assertThat(collected.declarations())
                .extracting(DeclarationCollector.Declaration::name)
                .containsExactly("study", "lesson1", "Student", "helper", "done");

        final MethodNode study = registry.asMap().get("study");
        assertThat(study.modifiers()).containsExactly("@Override", "public", "static");
        assertThat(study.returnType()).isEqualTo("void");
        assertThat(study.range().start()).isEqualTo(code.indexOf("@Override"));
        assertThat(study.range().end()).isEqualTo(code.indexOf("lesson1(); }") + "lesson1(); }".length());

        assertThat(registry.asMap().get("lesson1").modifiers()).containsExactly("private");
        assertThat(registry.asMap().get("lesson1").returnType()).isEqualTo("int");

        final MethodNode ctor = registry.asMap().get("Student");
        assertThat(ctor.modifiers()).isEmpty();
        assertThat(ctor.returnType()).isEmpty();

        assertThat(registry.asMap().get("helper").returnType()).isEqualTo("String");
        assertThat(registry.asMap().get("done").modifiers()).isEmpty();
    }

    @Test
    void keepsGenericReturnTypeAsWritten() throws Exception {
        final var collected = collect("class A { public java.util.List<String> names() { return null; } }");

        assertThat(collected.registry().asMap().get("names").returnType())
                .isEqualTo("java.util.List<String>");
    }

    @Test
    void laterDeclarationWithSameNameWins() throws Exception {
        final String code = """
                class Overloads {
                    public void send() { }
                    private void send(String message) { }
                }
                """;

        final var collected = collect(code);

        assertThat(collected.registry().asMap()).hasSize(1);
        assertThat(collected.declarations()).hasSize(2);
        final MethodNode send = collected.registry().asMap().get("send");
        assertThat(send.modifiers()).containsExactly("private");
        assertThat(send.range().start()).isEqualTo(code.indexOf("private void send"));
    }

    @Test
    void ignoresMethodsOfLocalAndAnonymousClasses() throws Exception {
        final String code = """
                class Outer {
                    void run() {
                        Runnable r = new Runnable() {
                            public void run() { hidden(); }
                            void hidden() { }
                        };
                    }
                }
                """;

        final var collected = collect(code);

        assertThat(collected.registry().asMap()).containsOnlyKeys("run");
        assertThat(collected.declarations()).hasSize(1);
    }

    @Test
    void yieldsEmptyRegistryWithoutDeclarations() throws Exception {
        final var collected = collect("class Empty { int field; }");

        assertThat(collected.registry().asMap()).isEmpty();
        assertThat(collected.declarations()).isEmpty();
    }
}
