package com.comparechain.ast;

import com.comparechain.comparator.ComparatorRef;

import java.util.Objects;

/**
 * Generated call of a comparator on two operands, producing an
 * {@link com.comparechain.comparator.Ordering}.
 * <p>
 * The source operator travels with the call so the runtime helper can raise the notices
 * that depend on it (strict operators under a semantic comparator).
 *
 * @param comparator Comparator to invoke
 * @param operator   Operator of the comparison this call replaced
 * @param left       Left operand
 * @param right      Right operand
 */
public record ComparatorCall(ComparatorRef comparator,
                             ComparisonOperator operator,
                             Expression left,
                             Expression right) implements Expression {

    public ComparatorCall {
        Objects.requireNonNull(comparator, "comparator");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        return comparator.name() + ".compare(" + left + ", " + right + ")";
    }
}
