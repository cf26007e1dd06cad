package com.comparechain.rewrite;

import com.comparechain.ast.ComparisonOperator;
import com.comparechain.ast.OutcomeTest.Test;
import com.comparechain.comparator.Ordering;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Translation of {@code left <op> right} into {@code compare(left, right) <test> <expected>}.
 * <pre>
 *   &lt;    ==  LESS        &gt;=   !=  LESS
 *   &gt;    ==  GREATER     &lt;=   !=  GREATER
 *   ==   ==  EQUAL       !=   !=  EQUAL
 *   ===  ==  EQUAL       !==  !=  EQUAL
 * </pre>
 */
public final class OperatorOutcomes {

    /**
     * Test and expected ordering for one operator.
     */
    public record Outcome(Test test, Ordering expected) {

        public boolean holds(Ordering actual) {
            return test.holds(actual, expected);
        }
    }

    private static final Map<ComparisonOperator, Outcome> OUTCOMES;

    static {
        Map<ComparisonOperator, Outcome> outcomes = new EnumMap<>(ComparisonOperator.class);
        outcomes.put(ComparisonOperator.LESS_THAN, new Outcome(Test.IS, Ordering.LESS));
        outcomes.put(ComparisonOperator.GREATER_THAN, new Outcome(Test.IS, Ordering.GREATER));
        outcomes.put(ComparisonOperator.LESS_THAN_OR_EQUAL, new Outcome(Test.IS_NOT, Ordering.GREATER));
        outcomes.put(ComparisonOperator.GREATER_THAN_OR_EQUAL, new Outcome(Test.IS_NOT, Ordering.LESS));
        outcomes.put(ComparisonOperator.EQUAL, new Outcome(Test.IS, Ordering.EQUAL));
        outcomes.put(ComparisonOperator.NOT_EQUAL, new Outcome(Test.IS_NOT, Ordering.EQUAL));
        outcomes.put(ComparisonOperator.STRICT_EQUAL, new Outcome(Test.IS, Ordering.EQUAL));
        outcomes.put(ComparisonOperator.STRICT_NOT_EQUAL, new Outcome(Test.IS_NOT, Ordering.EQUAL));
        OUTCOMES = Collections.unmodifiableMap(outcomes);
    }

    private OperatorOutcomes() {
    }

    public static Outcome of(ComparisonOperator operator) {
        return OUTCOMES.get(operator);
    }

    public static Map<ComparisonOperator, Outcome> all() {
        return OUTCOMES;
    }
}
