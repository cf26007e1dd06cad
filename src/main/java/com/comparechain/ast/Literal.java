package com.comparechain.ast;

/**
 * Constant value. {@code null} is allowed.
 */
public record Literal(Object value) implements Expression {

    public static final Literal TRUE = new Literal(Boolean.TRUE);
    public static final Literal FALSE = new Literal(Boolean.FALSE);
    public static final Literal NULL = new Literal(null);

    public static Literal of(Object value) {
        return new Literal(value);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        if (value instanceof String s) {
            return "\"" + s.replace("\"", "\\\"") + "\"";
        }
        return String.valueOf(value);
    }
}
