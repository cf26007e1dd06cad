package com.comparechain.expression;

import com.comparechain.ast.ComparisonOperator;
import com.comparechain.comparator.ComparatorRef;
import com.comparechain.comparator.NaturalOrdering;
import com.comparechain.comparator.Ordering;
import com.comparechain.diagnostics.DiagnosticMessages;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.exception.EvaluationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Carries out generated comparator calls and raises their notices.
 * <ul>
 *   <li>Structural (natural) comparisons warn when a record is involved, then compute the natural
 *   ordering. Strict operators additionally require the same type: integral and floating point
 *   numbers are two types, any other value's type is its class.</li>
 *   <li>Semantic comparisons delegate to the comparator domain. Strict operators warn that they
 *   are evaluated as their plain counterparts.</li>
 * </ul>
 * Each call raises at most one notice.
 */
public class ComparisonRuntime {

    private static final String INTEGRAL = "integer";
    private static final String FLOATING = "float";

    private final DiagnosticsSink diagnostics;

    public ComparisonRuntime(DiagnosticsSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Order two operand values for a comparison written with {@code operator}.
     */
    public Ordering compare(ComparatorRef comparator, ComparisonOperator operator, Object left, Object right) {
        if (comparator.isStructural()) {
            return compareStructurally(comparator, operator, left, right);
        }
        if (operator.isStrict()) {
            diagnostics.notice(DiagnosticMessages.strictOperatorReinterpreted(operator, comparator.name()));
        }
        Ordering result = comparator.domain().order(left, right);
        if (result == null) {
            throw new EvaluationException("Comparator '" + comparator.name() + "' returned no ordering for "
                    + left + " and " + right);
        }
        return result;
    }

    private Ordering compareStructurally(ComparatorRef comparator,
                                         ComparisonOperator operator,
                                         Object left,
                                         Object right) {
        if (NaturalOrdering.isComposite(left) || NaturalOrdering.isComposite(right)) {
            diagnostics.notice(DiagnosticMessages.compositeComparison(operator, left, right));
        }
        Ordering natural = comparator.domain().order(left, right);
        if (operator.isStrict() && natural == Ordering.EQUAL && left != null) {
            // 1 === 1.0 is false: equal values of different strict types order by type
            return Ordering.of(strictType(left).compareTo(strictType(right)));
        }
        return natural;
    }

    /**
     * Type that {@code ===} requires to match. Integral and floating point numbers form one
     * type each, whatever their boxed class; other values use their class.
     */
    static String strictType(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger) {
            return INTEGRAL;
        }
        if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
            return FLOATING;
        }
        return value.getClass().getName();
    }
}
