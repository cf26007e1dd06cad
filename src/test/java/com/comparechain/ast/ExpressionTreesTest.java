package com.comparechain.ast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionTrees.
 */
class ExpressionTreesTest {

    @Test
    @DisplayName("Unchanged children keep the same node instance")
    void withChildrenKeepsInstance() {
        Comparison comparison = Comparison.of(Variable.of("a"), ComparisonOperator.LESS_THAN, Variable.of("b"));

        assertSame(comparison, ExpressionTrees.withChildren(comparison, List.of(comparison.left(), comparison.right())));
    }

    @Test
    @DisplayName("transformUp applies the rule to children before parents")
    void transformUpIsPostOrder() {
        Expression tree = Combinator.and(
                Comparison.of(Variable.of("a"), ComparisonOperator.LESS_THAN, Variable.of("b")),
                Combinator.not(Comparison.of(Variable.of("c"), ComparisonOperator.EQUAL, Literal.of(1L))));

        Expression renamed = ExpressionTrees.transformUp(tree, node ->
                node instanceof Variable v ? Variable.of(v.name().toUpperCase()) : node);

        assertEquals("((A < B) and not (C == 1))", renamed.toString());
    }

    @Test
    @DisplayName("Shared sub-tree is rewritten once and stays shared")
    void transformUpKeepsSharing() {
        Variable shared = Variable.of("b");
        Expression tree = Combinator.and(
                Comparison.of(Variable.of("a"), ComparisonOperator.LESS_THAN, shared),
                Comparison.of(shared, ComparisonOperator.LESS_THAN, Variable.of("c")));
        AtomicInteger visits = new AtomicInteger();

        Combinator result = (Combinator) ExpressionTrees.transformUp(tree, node -> {
            if (node instanceof Variable v && v.name().equals("b")) {
                visits.incrementAndGet();
                return Variable.of("B");
            }
            return node;
        });

        assertEquals(1, visits.get());
        Comparison first = (Comparison) result.operands().get(0);
        Comparison second = (Comparison) result.operands().get(1);
        assertSame(first.right(), second.left());
    }

    @Test
    @DisplayName("transformUp does not descend into rejected nodes")
    void transformUpRespectsDescend() {
        Call call = Call.of("f", Comparison.of(Variable.of("x"), ComparisonOperator.LESS_THAN, Variable.of("y")));
        Expression tree = Comparison.of(call, ComparisonOperator.EQUAL, Literal.TRUE);

        Expression result = ExpressionTrees.transformUp(tree, Expression::isCombinator, node ->
                node instanceof Variable ? Literal.NULL : node);

        assertSame(tree, result);
    }

    @Test
    @DisplayName("find returns the first match in pre-order")
    void findIsPreOrder() {
        Variable left = Variable.of("x");
        Expression tree = Combinator.or(
                Comparison.of(left, ComparisonOperator.LESS_THAN, Variable.of("y")),
                Comparison.of(Variable.of("x"), ComparisonOperator.GREATER_THAN, Variable.of("z")));

        Optional<Expression> found = ExpressionTrees.find(tree, node ->
                node instanceof Variable v && v.name().equals("x"));

        assertTrue(found.isPresent());
        assertSame(left, found.get());
        assertFalse(ExpressionTrees.contains(tree, CompareInvocation.class::isInstance));
    }

    @Test
    @DisplayName("Deep trees do not overflow the call stack")
    void deepTree() {
        Expression tree = Comparison.of(Variable.of("a"), ComparisonOperator.LESS_THAN, Variable.of("b"));
        for (int i = 0; i < 50_000; i++) {
            tree = Combinator.not(tree);
        }

        Expression result = ExpressionTrees.transformUp(tree, node -> node);

        assertSame(tree, result);
        assertTrue(ExpressionTrees.contains(tree, Expression::isComparison));
    }
}
