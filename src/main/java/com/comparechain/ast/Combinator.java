package com.comparechain.ast;

import java.util.List;
import java.util.Objects;

/**
 * Boolean composition of sub-expressions.
 *
 * @param type     AND, OR or NOT
 * @param operands Two operands for AND/OR, one for NOT
 */
public record Combinator(CombinatorType type, List<Expression> operands) implements Expression {

    public Combinator {
        Objects.requireNonNull(type, "type");
        operands = List.copyOf(operands);
        if (operands.size() != type.arity()) {
            throw new IllegalArgumentException(type + " takes " + type.arity()
                    + " operand(s), got " + operands.size());
        }
    }

    public static Combinator and(Expression left, Expression right) {
        return new Combinator(CombinatorType.AND, List.of(left, right));
    }

    public static Combinator or(Expression left, Expression right) {
        return new Combinator(CombinatorType.OR, List.of(left, right));
    }

    public static Combinator not(Expression operand) {
        return new Combinator(CombinatorType.NOT, List.of(operand));
    }

    /**
     * Same combinator over new operands.
     */
    public Combinator withOperands(List<Expression> newOperands) {
        return new Combinator(type, newOperands);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMBINATOR;
    }

    @Override
    public String toString() {
        return switch (type) {
            case NOT -> "not " + operands.get(0);
            case AND -> "(" + operands.get(0) + " and " + operands.get(1) + ")";
            case OR -> "(" + operands.get(0) + " or " + operands.get(1) + ")";
        };
    }
}
