package com.comparechain.ast;

/**
 * Shape classes the rewrite pass distinguishes.
 */
public enum NodeKind {
    /** Elementary ordering or equality test between two operands. */
    COMPARISON,
    /** AND / OR / NOT composition. */
    COMBINATOR,
    /** Anything else: literals, variables, calls, blocks, generated calls. */
    OPAQUE
}
