package com.comparechain.expression;

import com.comparechain.ast.Block;
import com.comparechain.ast.Call;
import com.comparechain.ast.Combinator;
import com.comparechain.ast.CombinatorType;
import com.comparechain.ast.ComparatorCall;
import com.comparechain.ast.CompareInvocation;
import com.comparechain.ast.Comparison;
import com.comparechain.ast.Expression;
import com.comparechain.ast.Literal;
import com.comparechain.ast.OutcomeTest;
import com.comparechain.ast.Variable;
import com.comparechain.comparator.Ordering;
import com.comparechain.core.EvaluationContext;
import com.comparechain.core.ExpressionFunction;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.exception.EvaluationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates rewritten expressions to a boolean.
 * <p>
 * Supports:
 * - Generated comparator calls and outcome tests
 * - Logical: and, or (short-circuit), not
 * - Literals, variables, function calls and blocks as operands
 * <p>
 * A comparison that was never rewritten, or a nested compare request, cannot be evaluated.
 * Within one evaluation each operand node is evaluated at most once, so the operand a chain
 * shares between two comparisons is computed a single time.
 */
public class ExpressionEvaluator {

    private final ComparisonRuntime runtime;

    public ExpressionEvaluator(DiagnosticsSink diagnostics) {
        this.runtime = new ComparisonRuntime(diagnostics);
    }

    /**
     * Evaluate a rewritten expression.
     *
     * @param expression Tree produced by the comparator rewriter
     * @param context    Variables and functions
     * @return Boolean result
     */
    public boolean evaluate(Expression expression, EvaluationContext context) {
        return new Evaluation(context).bool(expression);
    }

    /**
     * A combinator whose operands are being evaluated.
     */
    private static final class Branch {
        private final Combinator combinator;
        private boolean secondVisited;

        Branch(Combinator combinator) {
            this.combinator = combinator;
        }
    }

    /**
     * State of a single evaluation.
     */
    private class Evaluation {
        private final EvaluationContext context;
        private final Map<Expression, Object> operandValues = new IdentityHashMap<>();

        Evaluation(EvaluationContext context) {
            this.context = context;
        }

        /**
         * Evaluate to a boolean. Combinators are walked with an explicit stack, so the left-deep
         * conjunction of a long chain does not grow the call stack.
         */
        boolean bool(Expression expression) {
            Deque<Branch> pending = new ArrayDeque<>();
            Expression next = expression;
            boolean result = false;
            while (true) {
                // descend along first operands to a leaf
                while (next instanceof Combinator combinator) {
                    pending.push(new Branch(combinator));
                    next = combinator.operands().get(0);
                }
                if (next != null) {
                    result = leaf(next);
                    next = null;
                }
                if (pending.isEmpty()) {
                    return result;
                }
                Branch branch = pending.peek();
                switch (branch.combinator.type()) {
                    case NOT -> {
                        pending.pop();
                        result = !result;
                    }
                    case AND, OR -> {
                        boolean decided = branch.combinator.type() == CombinatorType.AND ? !result : result;
                        if (decided || branch.secondVisited) {
                            pending.pop();
                        } else {
                            branch.secondVisited = true;
                            next = branch.combinator.operands().get(1);
                        }
                    }
                }
            }
        }

        private boolean leaf(Expression expression) {
            Object value = value(expression);
            if (value instanceof Boolean b) {
                return b;
            }
            throw new EvaluationException("Expected a boolean from " + expression + ", got " + value);
        }

        Object value(Expression expression) {
            if (expression instanceof OutcomeTest test) {
                Ordering actual = compare(test.call());
                return test.test().holds(actual, test.expected());
            }
            if (expression instanceof Combinator combinator) {
                return bool(combinator);
            }
            if (expression instanceof ComparatorCall call) {
                return compare(call);
            }
            if (expression instanceof Literal literal) {
                return literal.value();
            }
            if (expression instanceof Variable variable) {
                return lookup(variable);
            }
            if (expression instanceof Call call) {
                return invoke(call);
            }
            if (expression instanceof Block block) {
                Object last = null;
                for (Expression statement : block.statements()) {
                    last = value(statement);
                }
                return last;
            }
            if (expression instanceof Comparison || expression instanceof CompareInvocation) {
                throw new EvaluationException("Expression was not rewritten: " + expression);
            }
            throw new EvaluationException("Unsupported expression: " + expression);
        }

        private Ordering compare(ComparatorCall call) {
            Object left = operand(call.left());
            Object right = operand(call.right());
            return runtime.compare(call.comparator(), call.operator(), left, right);
        }

        private Object operand(Expression operand) {
            if (operandValues.containsKey(operand)) {
                return operandValues.get(operand);
            }
            Object value = value(operand);
            operandValues.put(operand, value);
            return value;
        }

        private Object lookup(Variable variable) {
            if (!context.hasVariable(variable.name())) {
                throw new EvaluationException("Unbound variable '" + variable.name() + "'");
            }
            return context.getVariable(variable.name()).orElse(null);
        }

        private Object invoke(Call call) {
            ExpressionFunction function = context.getFunction(call.function())
                    .orElseThrow(() -> new EvaluationException("Unknown function '" + call.function() + "'"));
            List<Object> arguments = new ArrayList<>(call.arguments().size());
            for (Expression argument : call.arguments()) {
                arguments.add(value(argument));
            }
            return function.apply(arguments);
        }
    }
}
