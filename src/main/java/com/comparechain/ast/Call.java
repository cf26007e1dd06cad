package com.comparechain.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Call of a named function. Arguments are carried through untouched by the rewrite pass,
 * even when they contain comparisons.
 */
public record Call(String function, List<Expression> arguments) implements Expression {

    public Call {
        Objects.requireNonNull(function, "function");
        arguments = List.copyOf(arguments);
    }

    public static Call of(String function, Expression... arguments) {
        return new Call(function, List.of(arguments));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        return function + arguments.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(", ", "(", ")"));
    }
}
