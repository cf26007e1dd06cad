package com.comparechain.ast;

import java.util.Objects;

/**
 * Elementary comparison {@code left <op> right}.
 * Operands are arbitrary sub-trees and are never interpreted by the rewrite pass.
 *
 * @param operator Comparison operator
 * @param left     Left operand
 * @param right    Right operand
 */
public record Comparison(ComparisonOperator operator, Expression left, Expression right) implements Expression {

    public Comparison {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public static Comparison of(Expression left, ComparisonOperator operator, Expression right) {
        return new Comparison(operator, left, right);
    }

    /**
     * Same operator, new operands.
     */
    public Comparison withOperands(Expression newLeft, Expression newRight) {
        return new Comparison(operator, newLeft, newRight);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPARISON;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
