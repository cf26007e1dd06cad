package com.comparechain.ast;

import java.util.Objects;

/**
 * Reference to a binding in the evaluation context.
 */
public record Variable(String name) implements Expression {

    public Variable {
        Objects.requireNonNull(name, "name");
    }

    public static Variable of(String name) {
        return new Variable(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        return name;
    }
}
