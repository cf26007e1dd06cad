package com.comparechain.ast;

import java.util.Objects;

/**
 * A request to run the compare rewrite on {@code expression}, as written in source:
 * {@code compare(a < b)} or {@code compare(a < b, temporal)}.
 * <p>
 * Only valid as the outermost request; one appearing inside another request's tree is rejected.
 *
 * @param expression Expression to rewrite
 * @param comparator Comparator name, or {@code null} for natural ordering
 */
public record CompareInvocation(Expression expression, String comparator) implements Expression {

    public CompareInvocation {
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        return comparator == null
                ? "compare(" + expression + ")"
                : "compare(" + expression + ", " + comparator + ")";
    }
}
