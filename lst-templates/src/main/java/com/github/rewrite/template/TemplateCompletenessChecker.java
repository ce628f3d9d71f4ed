package com.github.rewrite.template;

import org.jspecify.annotations.Nullable;
import org.openrewrite.ExecutionContext;
import org.openrewrite.java.JavaIsoVisitor;
import org.openrewrite.java.tree.J;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Proves that every placeholder of a template was consumed by {@link PlaceholderSubstitution}.
 * <p>
 * A mangled name still present after substitution means the placeholder sat where no expression
 * can go (a method name, a type, a declared name) or inside a literal. Either way the template
 * is malformed.
 * <p>
 * The visitor only records the first leftover placeholder; {@link #check(J, ExecutionContext)}
 * reports it once the traversal is done, since anything thrown from inside a visit reaches the
 * caller wrapped by the tree visitor.
 */
public class TemplateCompletenessChecker extends JavaIsoVisitor<ExecutionContext> {

    private final List<String> variables;

    @Nullable
    private String unreplaced;

    public TemplateCompletenessChecker(Collection<String> variables) {
        this.variables = new ArrayList<>(variables);
    }

    /**
     * @throws TemplateException with {@link TemplateError.Kind#INCOMPLETE_SUBSTITUTION} naming the
     *                           first variable whose placeholder is still in the tree
     */
    public void check(J tree, ExecutionContext ctx) {
        unreplaced = null;
        visit(tree, ctx);
        if (unreplaced != null) {
            throw new TemplateException(TemplateError.of(TemplateError.Kind.INCOMPLETE_SUBSTITUTION, unreplaced,
                    "Template variable " + unreplaced + " was not replaced properly"));
        }
    }

    @Override
    public J.Identifier visitIdentifier(J.Identifier identifier, ExecutionContext ctx) {
        for (String variable : variables) {
            if (identifier.getSimpleName().equals(TemplateSentinels.mangledName(variable))) {
                record(variable);
            }
        }
        return super.visitIdentifier(identifier, ctx);
    }

    @Override
    public J.Literal visitLiteral(J.Literal literal, ExecutionContext ctx) {
        String source = literal.getValueSource();
        if (source != null) {
            for (String variable : variables) {
                if (source.contains(TemplateSentinels.mangledName(variable))) {
                    record(variable);
                }
            }
        }
        return super.visitLiteral(literal, ctx);
    }

    private void record(String variable) {
        if (unreplaced == null) {
            unreplaced = variable;
        }
    }
}
