package com.comparechain.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Structural helpers over expression trees.
 * <p>
 * Traversals keep their own work stack, so tree depth is bounded only by memory,
 * not by the thread's call stack.
 */
public final class ExpressionTrees {

    private ExpressionTrees() {
    }

    /**
     * Direct children of a node, left to right.
     */
    public static List<Expression> children(Expression node) {
        if (node instanceof Comparison c) {
            return List.of(c.left(), c.right());
        }
        if (node instanceof Combinator c) {
            return c.operands();
        }
        if (node instanceof Call c) {
            return c.arguments();
        }
        if (node instanceof Block b) {
            return b.statements();
        }
        if (node instanceof CompareInvocation ci) {
            return List.of(ci.expression());
        }
        if (node instanceof ComparatorCall cc) {
            return List.of(cc.left(), cc.right());
        }
        if (node instanceof OutcomeTest t) {
            return List.of(t.call());
        }
        return List.of();
    }

    /**
     * Copy of {@code node} with its children replaced. Returns {@code node} itself when every
     * child is the same instance, so untouched sub-trees stay shared.
     */
    public static Expression withChildren(Expression node, List<Expression> children) {
        if (sameInstances(children(node), children)) {
            return node;
        }
        if (node instanceof Comparison c) {
            return c.withOperands(children.get(0), children.get(1));
        }
        if (node instanceof Combinator c) {
            return c.withOperands(children);
        }
        if (node instanceof Call c) {
            return new Call(c.function(), children);
        }
        if (node instanceof Block) {
            return new Block(children);
        }
        if (node instanceof CompareInvocation ci) {
            return new CompareInvocation(children.get(0), ci.comparator());
        }
        if (node instanceof ComparatorCall cc) {
            return new ComparatorCall(cc.comparator(), cc.operator(), children.get(0), children.get(1));
        }
        if (node instanceof OutcomeTest t) {
            return new OutcomeTest(t.test(), (ComparatorCall) children.get(0), t.expected());
        }
        throw new IllegalArgumentException("Node has no children: " + node);
    }

    /**
     * Rebuild a tree bottom-up, applying {@code rule} to every node after its children.
     * A sub-tree shared by several parents is rewritten once and stays shared.
     */
    public static Expression transformUp(Expression root, UnaryOperator<Expression> rule) {
        return transformUp(root, node -> true, rule);
    }

    /**
     * Like {@link #transformUp(Expression, UnaryOperator)}, but only descends into nodes accepted by
     * {@code descend}; the children of other nodes are left as they are.
     */
    public static Expression transformUp(Expression root,
                                         Predicate<Expression> descend,
                                         UnaryOperator<Expression> rule) {
        Map<Expression, Expression> done = new IdentityHashMap<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Expression node = stack.peek();
            if (done.containsKey(node)) {
                stack.pop();
                continue;
            }
            List<Expression> children = descend.test(node) ? children(node) : List.of();
            boolean ready = true;
            for (Expression child : children) {
                if (!done.containsKey(child)) {
                    stack.push(child);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }
            stack.pop();
            if (children.isEmpty()) {
                done.put(node, rule.apply(node));
                continue;
            }
            List<Expression> rewritten = new ArrayList<>(children.size());
            for (Expression child : children) {
                rewritten.add(done.get(child));
            }
            done.put(node, rule.apply(withChildren(node, rewritten)));
        }
        return done.get(root);
    }

    /**
     * First node in pre-order (node before children, left before right) matching {@code predicate}.
     */
    public static Optional<Expression> find(Expression root, Predicate<Expression> predicate) {
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Expression node = stack.pop();
            if (predicate.test(node)) {
                return Optional.of(node);
            }
            List<Expression> children = children(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    public static boolean contains(Expression root, Predicate<Expression> predicate) {
        return find(root, predicate).isPresent();
    }

    private static boolean sameInstances(List<Expression> a, List<Expression> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (a.get(i) != b.get(i)) {
                return false;
            }
        }
        return true;
    }
}
