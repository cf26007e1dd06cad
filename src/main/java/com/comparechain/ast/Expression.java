package com.comparechain.ast;

/**
 * Node of an expression tree.
 * <p>
 * Nodes are immutable values. The rewrite pass never mutates a node, it only builds new ones,
 * and it may share a sub-tree between several parents (the middle operand of a chain).
 */
public interface Expression {

    /**
     * Shape of this node as seen by validation and rewriting.
     */
    NodeKind kind();

    default boolean isComparison() {
        return kind() == NodeKind.COMPARISON;
    }

    default boolean isCombinator() {
        return kind() == NodeKind.COMBINATOR;
    }
}
