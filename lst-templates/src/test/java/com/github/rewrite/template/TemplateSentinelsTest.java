package com.github.rewrite.template;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.github.rewrite.template.TemplateSentinels.PREFIX;
import static com.github.rewrite.template.TemplateSentinels.SUFFIX;
import static com.github.rewrite.template.TemplateSentinels.mangledName;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateSentinelsTest {

    @Test
    void mangledNameWrapsVariable() {
        assertThat(mangledName("x")).isEqualTo(PREFIX + "x" + SUFFIX);
        assertThat(mangledName("x")).matches("[A-Za-z_][A-Za-z0-9_]*");
    }

    @Test
    void replacesEveryMarkerAndKeepsOtherText() {
        String mangled = TemplateSentinels.mangle("{a} + {b} * {a} + {c", List.of("a", "b"));

        assertThat(mangled).isEqualTo(mangledName("a") + " + " + mangledName("b") + " * " +
                                      mangledName("a") + " + {c");
    }

    @Test
    void variableOrderDoesNotMatter() {
        String template = "call({first}, {second}, {firstly})";

        assertThat(TemplateSentinels.mangle(template, List.of("first", "second", "firstly")))
                .isEqualTo(TemplateSentinels.mangle(template, List.of("firstly", "second", "first")));
    }

    @Test
    void missingMarkerNamesVariable() {
        assertThatThrownBy(() -> TemplateSentinels.mangle("x + y", Set.of("z")))
                .isInstanceOf(TemplateException.class)
                .hasMessage("Template string is missing a reference to z referred to in replacements")
                .satisfies(e -> {
                    TemplateError error = ((TemplateException) e).getError();
                    assertThat(error.getKind()).isEqualTo(TemplateError.Kind.MISSING_PLACEHOLDER);
                    assertThat(error.getVariable()).isEqualTo("z");
                });
    }

    @Test
    void bareNameIsNotAMarker() {
        assertThatThrownBy(() -> TemplateSentinels.mangle("value + 1", Set.of("value")))
                .isInstanceOf(TemplateException.class)
                .satisfies(e -> assertThat(((TemplateException) e).getKind())
                        .isEqualTo(TemplateError.Kind.MISSING_PLACEHOLDER));
    }

    @Test
    void variablesMustBeJavaIdentifiers() {
        for (String name : List.of("a.b", "a-b", "x y", "", "1st")) {
            assertThatThrownBy(() -> TemplateSentinels.mangle("{" + name + "}", List.of(name)))
                    .isInstanceOf(TemplateException.class)
                    .satisfies(e -> {
                        TemplateError error = ((TemplateException) e).getError();
                        assertThat(error.getKind()).isEqualTo(TemplateError.Kind.INVALID_VARIABLE_NAME);
                        assertThat(error.getVariable()).isEqualTo(name);
                    });
        }
        assertThat(TemplateSentinels.mangle("{$value} + {_x1}", List.of("$value", "_x1")))
                .isEqualTo(mangledName("$value") + " + " + mangledName("_x1"));
    }

    @Test
    void reservedStringsAreRejectedBeforeMarkersAreChecked() {
        assertThatThrownBy(() -> TemplateSentinels.mangle("x" + PREFIX, Set.of("missing")))
                .isInstanceOf(TemplateException.class)
                .satisfies(e -> assertThat(((TemplateException) e).getKind())
                        .isEqualTo(TemplateError.Kind.RESERVED_STRING));
        assertThatThrownBy(() -> TemplateSentinels.mangle(SUFFIX, Set.of()))
                .isInstanceOf(TemplateException.class)
                .hasMessage("Cannot parse a template containing reserved strings");
    }

    @Test
    void unmangleRecoversExactMatchesOnly() {
        assertThat(TemplateSentinels.unmangle(mangledName("name"))).isEqualTo("name");
        assertThat(TemplateSentinels.unmangle("x" + mangledName("name"))).isNull();
        assertThat(TemplateSentinels.unmangle(mangledName("name") + "x")).isNull();
        assertThat(TemplateSentinels.unmangle(PREFIX + "name")).isNull();
        assertThat(TemplateSentinels.unmangle("plainIdentifier")).isNull();
    }
}
