package com.github.rewrite.template;

import org.jspecify.annotations.Nullable;
import org.openrewrite.Cursor;
import org.openrewrite.ExecutionContext;
import org.openrewrite.java.JavaVisitor;
import org.openrewrite.java.tree.Expression;
import org.openrewrite.java.tree.J;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replaces mangled placeholder identifiers with copies of the nodes bound to them.
 * <p>
 * Only identifiers that stand where an expression may stand are replaced. A placeholder used as
 * a method name, a declared name or a type is left alone here and reported by
 * {@link TemplateCompletenessChecker}. Identifiers that merely contain the sentinels inside a
 * longer name, or that name an unknown variable, are passed through unchanged.
 * <p>
 * The visitor never mutates the tree it is given; like every LST visitor it returns a new tree
 * where something changed.
 */
public class PlaceholderSubstitution extends JavaVisitor<ExecutionContext> {

    private final Map<String, Expression> replacements;

    /**
     * @param replacements the replacement mapping of one render call
     * @throws TemplateException with {@link TemplateError.Kind#UNSUPPORTED_REPLACEMENT} naming the
     *                           first value that is not an expression
     */
    public PlaceholderSubstitution(Map<String, ? extends J> replacements) {
        Map<String, Expression> expressions = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends J> entry : replacements.entrySet()) {
            J value = entry.getValue();
            if (value == null || NodeKind.classify(value) != NodeKind.EXPRESSION) {
                throw new TemplateException(TemplateError.of(TemplateError.Kind.UNSUPPORTED_REPLACEMENT,
                        entry.getKey(),
                        "Template replacement for " + entry.getKey() + " is unsupported" +
                        (value == null ? "" : ": " + NodeKind.describe(value) + " is not an expression")));
            }
            expressions.put(entry.getKey(), (Expression) value);
        }
        this.replacements = Collections.unmodifiableMap(expressions);
    }

    @Override
    public J visitIdentifier(J.Identifier identifier, ExecutionContext ctx) {
        J j = super.visitIdentifier(identifier, ctx);
        if (!(j instanceof J.Identifier)) {
            return j;
        }
        J.Identifier ident = (J.Identifier) j;

        String variable = TemplateSentinels.unmangle(ident.getSimpleName());
        if (variable == null || !replacements.containsKey(variable)) {
            return ident;
        }
        if (!isExpressionSlot(identifier, getCursor())) {
            return ident;
        }
        return TreeCopier.copy(replacements.get(variable)).withPrefix(ident.getPrefix());
    }

    /**
     * Whether the identifier at the cursor occupies a position typed as an expression, as opposed
     * to a name or a type.
     */
    static boolean isExpressionSlot(J.Identifier ident, Cursor cursor) {
        Cursor parentCursor = parentTreeCursor(cursor);
        if (parentCursor == null) {
            return true;
        }
        J parent = parentCursor.getValue();

        if (cursor.firstEnclosing(J.Import.class) != null || cursor.firstEnclosing(J.Package.class) != null) {
            return false;
        }
        if (parent instanceof J.MethodInvocation) {
            J.MethodInvocation method = (J.MethodInvocation) parent;
            if (method.getName() == ident) {
                return false;
            }
            return method.getTypeParameters() == null || method.getTypeParameters().stream().noneMatch(t -> t == ident);
        }
        if (parent instanceof J.FieldAccess) {
            return ((J.FieldAccess) parent).getName() != ident;
        }
        if (parent instanceof J.VariableDeclarations.NamedVariable) {
            return ((J.VariableDeclarations.NamedVariable) parent).getName() != ident;
        }
        if (parent instanceof J.NewClass) {
            return ((J.NewClass) parent).getClazz() != ident;
        }
        if (parent instanceof J.Annotation) {
            return ((J.Annotation) parent).getAnnotationType() != ident;
        }
        if (parent instanceof J.NewArray) {
            return ((J.NewArray) parent).getTypeExpression() != ident;
        }
        if (parent instanceof J.MemberReference) {
            return ((J.MemberReference) parent).getReference() != ident;
        }
        if (parent instanceof J.InstanceOf) {
            return ((J.InstanceOf) parent).getExpression() == ident;
        }
        if (parent instanceof J.ControlParentheses) {
            Cursor grandParent = parentTreeCursor(parentCursor);
            return grandParent == null || !(grandParent.getValue() instanceof J.TypeCast);
        }
        return !(parent instanceof J.VariableDeclarations ||
                 parent instanceof J.MethodDeclaration ||
                 parent instanceof J.ClassDeclaration ||
                 parent instanceof J.EnumValue ||
                 parent instanceof J.ParameterizedType ||
                 parent instanceof J.ArrayType ||
                 parent instanceof J.TypeParameter ||
                 parent instanceof J.Wildcard ||
                 parent instanceof J.MultiCatch ||
                 parent instanceof J.AnnotatedType ||
                 parent instanceof J.Label ||
                 parent instanceof J.Break ||
                 parent instanceof J.Continue ||
                 parent instanceof J.Identifier);
    }

    @Nullable
    private static Cursor parentTreeCursor(Cursor cursor) {
        Cursor parent = cursor.getParent();
        while (parent != null && !(parent.getValue() instanceof J)) {
            parent = parent.getParent();
        }
        return parent;
    }
}
