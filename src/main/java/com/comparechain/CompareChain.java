package com.comparechain;

import com.comparechain.ast.Expression;
import com.comparechain.comparator.ComparatorDomain;
import com.comparechain.comparator.ComparatorRef;
import com.comparechain.core.EvaluationContext;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.diagnostics.LoggingDiagnosticsSink;
import com.comparechain.expression.ExpressionEvaluator;
import com.comparechain.parser.ExpressionParser;
import com.comparechain.rewrite.ChainFlattener;
import com.comparechain.rewrite.ComparatorRewriter;
import com.comparechain.validation.ExpressionValidator;

/**
 * Entry points of the compare rewrite: validate, flatten chains, rewrite comparisons into
 * comparator calls.
 * <pre>
 *   Expression tree = CompareChain.parse("a &lt; b &lt;= c");
 *   Expression natural = CompareChain.rewriteDefault(tree);
 *   Expression dated = CompareChain.rewriteWith(tree, "temporal", ComparatorDomains.temporal());
 * </pre>
 * All methods are stateless and thread-safe.
 */
public final class CompareChain {

    /** Name given to a domain passed without one. */
    public static final String CUSTOM_COMPARATOR_NAME = "custom";

    private static final ExpressionValidator VALIDATOR = new ExpressionValidator();
    private static final ChainFlattener FLATTENER = new ChainFlattener();
    private static final ComparatorRewriter REWRITER = new ComparatorRewriter();
    private static final ExpressionEvaluator LOGGING_EVALUATOR = new ExpressionEvaluator(new LoggingDiagnosticsSink());

    private CompareChain() {
    }

    /**
     * Rewrite against the natural ordering.
     *
     * @throws com.comparechain.exception.InvalidExpressionException if the tree has an invalid shape
     */
    public static Expression rewriteDefault(Expression tree) {
        return rewriteWith(tree, ComparatorRef.NATURAL);
    }

    /**
     * Rewrite against a caller-supplied comparator domain.
     */
    public static Expression rewriteWith(Expression tree, ComparatorDomain domain) {
        return rewriteWith(tree, CUSTOM_COMPARATOR_NAME, domain);
    }

    /**
     * Rewrite against a caller-supplied comparator domain, named for diagnostics.
     */
    public static Expression rewriteWith(Expression tree, String name, ComparatorDomain domain) {
        return rewriteWith(tree, ComparatorRef.semantic(name, domain));
    }

    /**
     * Rewrite against a comparator reference.
     */
    public static Expression rewriteWith(Expression tree, ComparatorRef comparator) {
        Expression validated = VALIDATOR.validate(tree);
        Expression flattened = FLATTENER.flatten(validated);
        return REWRITER.rewrite(flattened, comparator);
    }

    /**
     * Parse expression text into a tree.
     */
    public static Expression parse(String expression) {
        return ExpressionParser.parse(expression);
    }

    /**
     * Parse, rewrite with natural ordering and evaluate. Notices are logged.
     */
    public static boolean compare(String expression, EvaluationContext context) {
        return LOGGING_EVALUATOR.evaluate(rewriteDefault(parse(expression)), context);
    }

    /**
     * Parse, rewrite with {@code domain} and evaluate. Notices are logged.
     */
    public static boolean compare(String expression, ComparatorDomain domain, EvaluationContext context) {
        return LOGGING_EVALUATOR.evaluate(rewriteWith(parse(expression), domain), context);
    }

    /**
     * Evaluate a rewritten tree, sending notices to {@code diagnostics}.
     */
    public static boolean evaluate(Expression rewritten, EvaluationContext context, DiagnosticsSink diagnostics) {
        return new ExpressionEvaluator(diagnostics).evaluate(rewritten, context);
    }
}
