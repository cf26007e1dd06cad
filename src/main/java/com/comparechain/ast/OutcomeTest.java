package com.comparechain.ast;

import com.comparechain.comparator.Ordering;

import java.util.Objects;

/**
 * Generated test of a comparator result against an expected ordering:
 * {@code call == expected} or {@code call != expected}. Always evaluates to a boolean.
 *
 * @param test     IS or IS_NOT
 * @param call     Comparator call producing the ordering
 * @param expected Ordering the test is made against
 */
public record OutcomeTest(Test test, ComparatorCall call, Ordering expected) implements Expression {

    /**
     * Equality test applied to the comparator result.
     */
    public enum Test {
        IS("=="),
        IS_NOT("!=");

        private final String symbol;

        Test(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean holds(Ordering actual, Ordering expected) {
            return (actual == expected) == (this == IS);
        }
    }

    public OutcomeTest {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(call, "call");
        Objects.requireNonNull(expected, "expected");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPAQUE;
    }

    @Override
    public String toString() {
        return "(" + call + " " + test.symbol() + " " + expected + ")";
    }
}
