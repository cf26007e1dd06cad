package com.comparechain.ast;

/**
 * Boolean combinators and their arity.
 */
public enum CombinatorType {
    AND(2),
    OR(2),
    NOT(1);

    private final int arity;

    CombinatorType(int arity) {
        this.arity = arity;
    }

    public int arity() {
        return arity;
    }
}
