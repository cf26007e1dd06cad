package com.comparechain.rewrite;

import com.comparechain.ast.Combinator;
import com.comparechain.ast.Comparison;
import com.comparechain.ast.ComparisonOperator;
import com.comparechain.ast.Expression;
import com.comparechain.ast.ExpressionTrees;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Expands chained comparisons into conjunctions of pairwise comparisons.
 * <p>
 * {@code a < b < c} arrives as {@code <(<(a, b), c)} and becomes {@code (a < b) and (b < c)}.
 * The middle operand {@code b} is the same node instance in both comparisons.
 * <p>
 * Equality operators bind looser than ordering operators in the source syntax, so
 * {@code a == b < c} arrives as {@code ==(a, <(b, c))}. Such a node is first rotated to
 * {@code <(==(a, b), c)}, which is legal because equality is symmetric, and the rotation is
 * repeated until no comparison in the chain has a comparison as its right operand. Rotation keeps
 * the written left-to-right sequence of operands and operators, which is what the chain means.
 * <p>
 * Chains nested inside operands, such as call arguments, are flattened as well.
 * Stateless and thread-safe.
 */
public class ChainFlattener {

    /**
     * Flatten every chain in a validated tree.
     *
     * @param tree Validated tree
     * @return Tree in which no comparison has a comparison operand
     */
    public Expression flatten(Expression tree) {
        return ExpressionTrees.transformUp(tree, node -> !node.isComparison(), node ->
                node instanceof Comparison comparison ? flattenChain(comparison) : node);
    }

    /**
     * Rotate a chain into left-deep form: {@code eq(c, ord(a, b))} becomes {@code ord(eq(c, a), b)},
     * repeatedly, until only left operands are comparisons.
     */
    public Comparison reorder(Comparison chain) {
        Chain linear = linearize(chain);
        if (linear.operators().size() == 1) {
            return chain;
        }
        Comparison spine = linear.link(0);
        for (int i = 1; i < linear.operators().size(); i++) {
            spine = new Comparison(linear.operators().get(i), spine, linear.operands().get(i + 1));
        }
        return spine;
    }

    private Expression flattenChain(Comparison chain) {
        Chain linear = flattenOperands(linearize(chain));
        if (linear.operators().size() == 1) {
            Expression left = linear.operands().get(0);
            Expression right = linear.operands().get(1);
            return left == chain.left() && right == chain.right() ? chain : chain.withOperands(left, right);
        }
        Expression conjunction = linear.link(0);
        for (int i = 1; i < linear.operators().size(); i++) {
            conjunction = Combinator.and(conjunction, linear.link(i));
        }
        return conjunction;
    }

    // each operand occurs once in the chain, so a shared operand stays shared
    private Chain flattenOperands(Chain chain) {
        List<Expression> operands = new ArrayList<>(chain.operands().size());
        for (Expression operand : chain.operands()) {
            operands.add(flatten(operand));
        }
        return new Chain(operands, chain.operators());
    }

    /**
     * In-order walk of a comparison chain. Leaves are operands, inner nodes are operators.
     */
    private Chain linearize(Comparison root) {
        List<Expression> operands = new ArrayList<>();
        List<ComparisonOperator> operators = new ArrayList<>();
        Deque<Comparison> stack = new ArrayDeque<>();
        Expression current = root;

        while (true) {
            while (current instanceof Comparison comparison) {
                stack.push(comparison);
                current = comparison.left();
            }
            operands.add(current);
            if (stack.isEmpty()) {
                break;
            }
            Comparison comparison = stack.pop();
            operators.add(comparison.operator());
            current = comparison.right();
        }
        return new Chain(operands, operators);
    }

    /**
     * {@code operands[0] operators[0] operands[1] operators[1] ... operands[n]} as written.
     */
    private record Chain(List<Expression> operands, List<ComparisonOperator> operators) {

        Comparison link(int i) {
            return new Comparison(operators.get(i), operands.get(i), operands.get(i + 1));
        }
    }
}
