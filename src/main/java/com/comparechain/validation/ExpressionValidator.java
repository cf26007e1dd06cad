package com.comparechain.validation;

import com.comparechain.ast.Block;
import com.comparechain.ast.Combinator;
import com.comparechain.ast.CompareInvocation;
import com.comparechain.ast.Expression;
import com.comparechain.ast.ExpressionTrees;
import com.comparechain.exception.InvalidExpressionException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Checks that a tree has a shape the rewrite can handle.
 * <p>
 * Rules, in the order they are checked:
 * <ol>
 *   <li>one-statement blocks are unwrapped everywhere first, so {@code { a < b }} is {@code a < b}</li>
 *   <li>no compare request may be nested inside the tree</li>
 *   <li>the tree contains at least one comparison</li>
 *   <li>the root is a comparison or a combinator</li>
 *   <li>every combinator operand is a comparison or a combinator satisfying this rule</li>
 * </ol>
 * Stateless and thread-safe.
 */
public class ExpressionValidator {

    /**
     * Validate a tree.
     *
     * @param root Tree produced by the parser
     * @return The tree with wrapper blocks removed
     * @throws InvalidExpressionException if any rule is violated
     */
    public Expression validate(Expression root) {
        Objects.requireNonNull(root, "root");
        Expression tree = unwrapBlocks(root);

        ExpressionTrees.find(tree, CompareInvocation.class::isInstance)
                .ifPresent(nested -> fail(ValidationErrorKind.NESTED_REWRITE_NOT_ALLOWED, nested));

        if (!ExpressionTrees.contains(tree, Expression::isComparison)) {
            fail(ValidationErrorKind.NO_COMPARISON_FOUND, tree);
        }

        if (!tree.isComparison() && !tree.isCombinator()) {
            fail(ValidationErrorKind.INVALID_ROOT_SHAPE, tree);
        }

        checkCombinatorBranches(tree);
        return tree;
    }

    static Expression unwrapBlocks(Expression root) {
        return ExpressionTrees.transformUp(root, node ->
                node instanceof Block block && block.isWrapper() ? block.statements().get(0) : node);
    }

    private void checkCombinatorBranches(Expression root) {
        if (!root.isCombinator()) {
            return;
        }
        // pre-order, so the leftmost offending operand is reported
        Deque<Expression> pending = new ArrayDeque<>();
        pushOperands(pending, (Combinator) root);
        while (!pending.isEmpty()) {
            Expression operand = pending.pop();
            if (operand.isComparison()) {
                continue;
            }
            if (operand instanceof Combinator nested) {
                pushOperands(pending, nested);
                continue;
            }
            fail(ValidationErrorKind.INCOMPLETE_COMBINATOR_BRANCH, operand);
        }
    }

    private void pushOperands(Deque<Expression> pending, Combinator combinator) {
        List<Expression> operands = combinator.operands();
        for (int i = operands.size() - 1; i >= 0; i--) {
            pending.push(operands.get(i));
        }
    }

    private static void fail(ValidationErrorKind kind, Expression offending) {
        throw new InvalidExpressionException(new ValidationError(kind, offending));
    }
}
