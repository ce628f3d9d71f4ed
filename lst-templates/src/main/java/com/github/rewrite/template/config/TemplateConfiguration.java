package com.github.rewrite.template.config;

import com.github.rewrite.template.comments.DuplicateCommentPolicy;
import lombok.Value;
import lombok.With;

/**
 * Project-level settings for template rendering and comment collection.
 * <p>
 * If no lst-templates.yaml exists in the project root, {@link #defaults()} is used.
 * <p>
 * Example lst-templates.yaml:
 * <pre>
 * parser:
 *   classpath:
 *     - guava
 *     - jakarta.inject-api
 *   dependsOn:
 *     - "package com.example; public class Stub {}"
 *   logCompilationWarningsAndErrors: false
 *
 * comments:
 *   duplicates: last-wins | first-wins    # default: last-wins
 * </pre>
 */
@Value
@With
public class TemplateConfiguration {

    TemplateParserConfig parser;

    DuplicateCommentPolicy duplicateCommentPolicy;

    public static TemplateConfiguration defaults() {
        return new TemplateConfiguration(TemplateParserConfig.defaults(), DuplicateCommentPolicy.LAST_WINS);
    }
}
