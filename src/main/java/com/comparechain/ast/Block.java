package com.comparechain.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Statement sequence; evaluates to its last statement.
 * A block with a single statement has no semantic weight and is unwrapped before validation.
 */
public record Block(List<Expression> statements) implements Expression {

    public Block {
        statements = List.copyOf(statements);
        if (statements.isEmpty()) {
            throw new IllegalArgumentException("Block requires at least one statement");
        }
    }

    public static Block of(Expression... statements) {
        return new Block(List.of(statements));
    }

    public boolean isWrapper() {
        return statements.size() == 1;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        return statements.stream()
                .map(String::valueOf)
                .collect(Collectors.joining("; ", "{ ", " }"));
    }
}
