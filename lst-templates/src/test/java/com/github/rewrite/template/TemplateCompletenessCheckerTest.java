package com.github.rewrite.template;

import org.junit.jupiter.api.Test;
import org.openrewrite.InMemoryExecutionContext;
import org.openrewrite.java.JavaParser;
import org.openrewrite.java.tree.J;

import java.util.List;

import static com.github.rewrite.template.TemplateSentinels.mangledName;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateCompletenessCheckerTest {

    private static J.CompilationUnit parse(String source) {
        return (J.CompilationUnit) JavaParser.fromJavaVersion().build().parse(source).toList().get(0);
    }

    @Test
    void acceptsTreeWithoutPlaceholders() {
        J.CompilationUnit cu = parse("class A { int x = y + 1; }");

        assertThatCode(() -> new TemplateCompletenessChecker(List.of("y")).check(cu, new InMemoryExecutionContext()))
                .doesNotThrowAnyException();
    }

    @Test
    void reportsLeftoverIdentifier() {
        J.CompilationUnit cu = parse("class A { void m() { run.%s(); } }".formatted(mangledName("call")));

        assertThatThrownBy(() -> new TemplateCompletenessChecker(List.of("other", "call"))
                .check(cu, new InMemoryExecutionContext()))
                .isInstanceOf(TemplateException.class)
                .satisfies(e -> {
                    TemplateError error = ((TemplateException) e).getError();
                    assertThat(error.getKind()).isEqualTo(TemplateError.Kind.INCOMPLETE_SUBSTITUTION);
                    assertThat(error.getVariable()).isEqualTo("call");
                });
    }

    @Test
    void reportsPlaceholderLeftInLiteral() {
        J.CompilationUnit cu = parse("class A { String s = \"Hi %s\"; }".formatted(mangledName("who")));

        assertThatThrownBy(() -> new TemplateCompletenessChecker(List.of("who"))
                .check(cu, new InMemoryExecutionContext()))
                .isInstanceOf(TemplateException.class)
                .hasMessage("Template variable who was not replaced properly");
    }

    @Test
    void reportsFirstLeftoverInTraversalOrder() {
        J.CompilationUnit cu = parse("class A { int x = %s; int y = %s; }"
                .formatted(mangledName("second"), mangledName("first")));

        assertThatThrownBy(() -> new TemplateCompletenessChecker(List.of("first", "second"))
                .check(cu, new InMemoryExecutionContext()))
                .isInstanceOf(TemplateException.class)
                .hasMessage("Template variable second was not replaced properly");
    }

    @Test
    void plainVisitLeavesTreeUntouched() {
        J.CompilationUnit cu = parse("class A { int x = %s; }".formatted(mangledName("left")));

        assertThat(new TemplateCompletenessChecker(List.of("left")).visit(cu, new InMemoryExecutionContext()))
                .isSameAs(cu);
    }

    @Test
    void ignoresPlaceholderOfUndeclaredVariable() {
        J.CompilationUnit cu = parse("class A { int x = %s; }".formatted(mangledName("stray")));

        assertThatCode(() -> new TemplateCompletenessChecker(List.of("y")).check(cu, new InMemoryExecutionContext()))
                .doesNotThrowAnyException();
    }
}
