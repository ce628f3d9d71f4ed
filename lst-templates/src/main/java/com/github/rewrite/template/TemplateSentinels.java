package com.github.rewrite.template;

import org.jspecify.annotations.Nullable;

import javax.lang.model.SourceVersion;
import java.util.Collection;

/**
 * Hides template placeholders inside otherwise valid Java source.
 * <p>
 * Every {@code {name}} marker is rewritten into {@code PREFIX + name + SUFFIX}. Both sentinels
 * consist of identifier characters only, so the parser reads a mangled placeholder as a plain
 * {@link org.openrewrite.java.tree.J.Identifier} that the substitution pass can find again.
 */
public final class TemplateSentinels {

    public static final String PREFIX = "__REWRITE_TEMPLATE_MANGLED_NAME_";
    public static final String SUFFIX = "_EMAN_DELGNAM_ETALPMET_ETIRWER__";

    private TemplateSentinels() {
    }

    public static String mangledName(String variable) {
        return PREFIX + variable + SUFFIX;
    }

    /**
     * Replaces the {@code {name}} marker of every variable with its mangled name.
     *
     * @param template  the raw template text
     * @param variables the names of the replacement variables
     * @return the template with every marker mangled and the rest of the text untouched
     * @throws TemplateException with {@link TemplateError.Kind#RESERVED_STRING} if the raw template
     *                           already contains a sentinel, {@link TemplateError.Kind#INVALID_VARIABLE_NAME}
     *                           if a variable is not a Java identifier, or
     *                           {@link TemplateError.Kind#MISSING_PLACEHOLDER} if a variable has no marker
     */
    public static String mangle(String template, Collection<String> variables) {
        if (template.contains(PREFIX) || template.contains(SUFFIX)) {
            throw new TemplateException(TemplateError.of(TemplateError.Kind.RESERVED_STRING,
                    "Cannot parse a template containing reserved strings"));
        }

        String mangled = template;
        for (String variable : variables) {
            // the mangled name has to survive the parser as a single identifier token
            if (!SourceVersion.isIdentifier(variable)) {
                throw new TemplateException(TemplateError.of(TemplateError.Kind.INVALID_VARIABLE_NAME, variable,
                        "Template variable '" + variable + "' is not a valid Java identifier"));
            }
            String marker = "{" + variable + "}";
            if (!template.contains(marker)) {
                throw new TemplateException(TemplateError.of(TemplateError.Kind.MISSING_PLACEHOLDER, variable,
                        "Template string is missing a reference to " + variable + " referred to in replacements"));
            }
            mangled = mangled.replace(marker, mangledName(variable));
        }
        return mangled;
    }

    /**
     * Recovers the variable name from an identifier that consists of exactly one mangled name.
     *
     * @return the variable name, or {@code null} if the identifier only contains the sentinels
     * as part of a longer name or does not contain them at all
     */
    @Nullable
    static String unmangle(String identifier) {
        int prefixAt = identifier.indexOf(PREFIX);
        if (prefixAt < 0) {
            return null;
        }
        String head = identifier.substring(0, prefixAt);
        String rest = identifier.substring(prefixAt + PREFIX.length());
        int suffixAt = rest.indexOf(SUFFIX);
        if (suffixAt < 0) {
            return null;
        }
        String name = rest.substring(0, suffixAt);
        String tail = rest.substring(suffixAt + SUFFIX.length());
        if (!head.isEmpty() || !tail.isEmpty()) {
            return null;
        }
        return name;
    }
}
