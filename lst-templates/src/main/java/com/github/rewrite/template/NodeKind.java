package com.github.rewrite.template;

import org.openrewrite.Tree;
import org.openrewrite.java.tree.Expression;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.Statement;

/**
 * Closed classification of tree nodes for template purposes.
 * <p>
 * Many Java nodes are both an {@link Expression} and a {@link Statement} (method invocations,
 * assignments, {@code new} expressions). They classify as {@link #EXPRESSION} because they can
 * stand wherever a value is expected.
 */
public enum NodeKind {
    COMPILATION_UNIT,
    EXPRESSION,
    STATEMENT,
    OTHER;

    public static NodeKind classify(Tree tree) {
        if (tree instanceof J.CompilationUnit) {
            return COMPILATION_UNIT;
        }
        if (tree instanceof Expression) {
            return EXPRESSION;
        }
        if (tree instanceof Statement) {
            return STATEMENT;
        }
        return OTHER;
    }

    static String describe(Tree tree) {
        Class<?> type = tree.getClass();
        return type.getEnclosingClass() != null
                ? type.getEnclosingClass().getSimpleName() + "." + type.getSimpleName()
                : type.getSimpleName();
    }
}
