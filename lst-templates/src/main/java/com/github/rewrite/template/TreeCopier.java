package com.github.rewrite.template;

import org.openrewrite.Tree;
import org.openrewrite.java.JavaVisitor;
import org.openrewrite.java.tree.J;

/**
 * Deep copy of a subtree in which every node receives a fresh id.
 * <p>
 * LST nodes are immutable, but tools key on {@link Tree#getId()}; inserting the same node at two
 * places would make both sites the same node. Each copy is owned by exactly one insertion site.
 */
final class TreeCopier extends JavaVisitor<Integer> {

    private TreeCopier() {
    }

    @SuppressWarnings("unchecked")
    static <T extends J> T copy(T tree) {
        return (T) new TreeCopier().visitNonNull(tree, 0);
    }

    @Override
    public J preVisit(J tree, Integer p) {
        return tree.withId(Tree.randomId());
    }
}
