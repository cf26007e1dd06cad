package com.comparechain.rewrite;

import com.comparechain.ast.ComparatorCall;
import com.comparechain.ast.Comparison;
import com.comparechain.ast.Expression;
import com.comparechain.ast.ExpressionTrees;
import com.comparechain.ast.OutcomeTest;
import com.comparechain.comparator.ComparatorRef;

import java.util.Objects;

/**
 * Replaces every comparison of a flattened tree with a comparator call tested against the
 * ordering its operator expects, e.g. {@code a <= b} becomes {@code compare(a, b) != GREATER}.
 * <p>
 * Comparisons are rewritten at any depth, including inside call arguments and blocks.
 * Combinators are kept, with rewritten operands. The rewrite itself is pure: the notices a
 * comparator call may raise happen when the rewritten tree is evaluated.
 */
public class ComparatorRewriter {

    /**
     * Rewrite a flattened tree against a comparator.
     *
     * @param tree       Flattened tree
     * @param comparator Comparator the generated calls invoke
     * @return Tree that evaluates to a boolean
     * @throws IllegalArgumentException if a comparison still has a comparison operand
     */
    public Expression rewrite(Expression tree, ComparatorRef comparator) {
        Objects.requireNonNull(comparator, "comparator");
        ExpressionTrees.find(tree, node -> node instanceof Comparison comparison
                        && (comparison.left().isComparison() || comparison.right().isComparison()))
                .ifPresent(chain -> {
                    throw new IllegalArgumentException("Comparison chain was not flattened: " + chain);
                });
        return ExpressionTrees.transformUp(tree, node ->
                node instanceof Comparison comparison ? toOutcomeTest(comparison, comparator) : node);
    }

    private OutcomeTest toOutcomeTest(Comparison comparison, ComparatorRef comparator) {
        OperatorOutcomes.Outcome outcome = OperatorOutcomes.of(comparison.operator());
        ComparatorCall call = new ComparatorCall(
                comparator, comparison.operator(), comparison.left(), comparison.right());
        return new OutcomeTest(outcome.test(), call, outcome.expected());
    }
}
