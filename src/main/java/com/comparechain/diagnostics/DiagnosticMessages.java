package com.comparechain.diagnostics;

import com.comparechain.ast.ComparisonOperator;
import com.comparechain.ast.Expression;
import com.comparechain.comparator.NaturalOrdering;

/**
 * Text of validation errors and runtime notices.
 */
public final class DiagnosticMessages {

    private DiagnosticMessages() {
    }

    public static String comparisonRequired() {
        return """
                No comparison operators found.
                Expression must include at least one of `<`, `>`, `<=`, `>=`, `==`, `!=`, `===` or `!==`.""";
    }

    public static String nestedNotAllowed() {
        return "Cannot use `compare` within a call to `compare`.";
    }

    public static String invalidRootShape(Expression root) {
        return "Expression must be a comparison, or comparisons combined with `and`, `or` and `not`. Got: "
                + root;
    }

    public static String incompleteCombinatorBranch(Expression branch) {
        return "Every operand of `and`, `or` and `not` must be a comparison or a combination of comparisons. Got: "
                + branch;
    }

    /**
     * Notice for natural ordering applied to composite values.
     */
    public static String compositeComparison(ComparisonOperator operator, Object left, Object right) {
        if (left != null && right != null && left.getClass() == right.getClass()) {
            return """
                    Performing structural comparison on matching %s values.

                    Did you mean to use a semantic comparator?

                      compare(%s %s %s, <comparator>)
                    """.formatted(typeName(left), left, operator.symbol(), right);
        }
        return """
                Performing structural comparison on one or more mismatched composite values.

                Left%s:

                  %s

                Right%s:

                  %s
                """.formatted(compositeSuffix(left), left, compositeSuffix(right), right);
    }

    /**
     * Notice for a strict operator evaluated against a semantic comparator.
     */
    public static String strictOperatorReinterpreted(ComparisonOperator operator, String comparatorName) {
        String plain = operator == ComparisonOperator.STRICT_EQUAL ? "==" : "!=";
        return "Comparator '" + comparatorName + "' has no notion of strict equality: `"
                + operator.symbol() + "` is evaluated as `" + plain + "`.";
    }

    private static String compositeSuffix(Object value) {
        return NaturalOrdering.isComposite(value) ? " (" + typeName(value) + ")" : "";
    }

    private static String typeName(Object value) {
        return value.getClass().getSimpleName();
    }
}
