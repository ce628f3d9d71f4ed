package com.github.rewrite.template.config;

import lombok.Value;
import lombok.With;
import org.openrewrite.java.JavaParser;

import java.util.List;

/**
 * How templates are parsed: which artifacts and stub sources are visible for type attribution.
 * <p>
 * Values are immutable and every render call builds its own {@link JavaParser} from them, so no
 * call can observe parser state left behind by another one. There is no shared default
 * instance; {@link #defaults()} returns a new value each time.
 * <p>
 * When rendering templates inside a recipe, pass the classpath of the source under
 * transformation so that the rendered nodes carry the same type information.
 */
@Value
@With
public class TemplateParserConfig {

    /**
     * Artifact names resolved from the runtime classpath, e.g. {@code "guava"}.
     */
    List<String> classpath;

    /**
     * Additional Java sources (usually stubs) the template may refer to.
     */
    List<String> dependsOn;

    boolean logCompilationWarningsAndErrors;

    public static TemplateParserConfig defaults() {
        return new TemplateParserConfig(List.of(), List.of(), false);
    }

    public JavaParser newParser() {
        return JavaParser.fromJavaVersion()
                .classpath(classpath.toArray(new String[0]))
                .dependsOn(dependsOn.toArray(new String[0]))
                .logCompilationWarningsAndErrors(logCompilationWarningsAndErrors)
                .build();
    }
}
