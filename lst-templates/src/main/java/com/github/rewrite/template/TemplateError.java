package com.github.rewrite.template;

import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * Describes why a template could not be rendered.
 * <p>
 * Every failure is a template authoring defect on the caller's side; none of them is retried.
 */
@Value
public class TemplateError {

    public enum Kind {
        /**
         * The raw template already contains a sentinel prefix or suffix.
         */
        RESERVED_STRING,

        /**
         * A replacement variable has no {@code {name}} marker in the template.
         */
        MISSING_PLACEHOLDER,

        /**
         * A replacement variable name is not a Java identifier, so its mangled form would not
         * parse as a single identifier.
         */
        INVALID_VARIABLE_NAME,

        /**
         * A replacement value is not an expression.
         */
        UNSUPPORTED_REPLACEMENT,

        /**
         * The mangled template did not parse into the expected shape.
         */
        PARSE_FAILURE,

        /**
         * The substituted result is not the kind of node the entry point promises.
         */
        RESULT_TYPE_MISMATCH,

        /**
         * A placeholder survived substitution.
         */
        INCOMPLETE_SUBSTITUTION
    }

    Kind kind;

    /**
     * The template variable the error is about, if any.
     */
    @Nullable
    String variable;

    String message;

    public static TemplateError of(Kind kind, String message) {
        return new TemplateError(kind, null, message);
    }

    public static TemplateError of(Kind kind, String variable, String message) {
        return new TemplateError(kind, variable, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
