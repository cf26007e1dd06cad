package com.comparechain.engine;

import com.comparechain.CompareChain;
import com.comparechain.ast.CompareInvocation;
import com.comparechain.ast.Expression;
import com.comparechain.comparator.ComparatorRef;
import com.comparechain.comparator.ComparatorRegistry;
import com.comparechain.config.CompareChainConfig;
import com.comparechain.config.NamedExpressionConfig;
import com.comparechain.core.EvaluationContext;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.exception.ConfigurationException;
import com.comparechain.expression.ExpressionEvaluator;
import com.comparechain.parser.ExpressionParser;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Compiles expression text against registered comparators and evaluates it.
 * Compiled expressions are cached per (text, comparator) pair, up to the configured cache size;
 * the least useful entries are evicted first. Predefined expressions from the configuration are
 * compiled when the engine is created and held outside the cache, so a broken one fails startup.
 * <p>
 * A top-level {@code compare(expr, name)} in the text selects the comparator for that
 * expression; any {@code compare} nested deeper is rejected during validation.
 */
public class CompareChainEngine {

    private static final Logger log = LoggerFactory.getLogger(CompareChainEngine.class);

    private final CompareChainConfig config;
    private final ComparatorRegistry registry;
    private final ExpressionEvaluator evaluator;
    private final Cache<CacheKey, CompiledExpression> cache;
    private final Map<String, CompiledExpression> namedExpressions;

    public CompareChainEngine(CompareChainConfig config, ComparatorRegistry registry, DiagnosticsSink diagnostics) {
        this.config = config;
        this.registry = registry;
        this.evaluator = new ExpressionEvaluator(diagnostics);
        // eviction runs on the calling thread so the bound holds as soon as compile returns
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.cacheSize())
                .executor(Runnable::run)
                .build();
        // Fail fast on a misconfigured default
        registry.resolve(config.defaultComparator());
        this.namedExpressions = compileNamed(config);

        log.info("CompareChainEngine '{}' initialized with comparators {} and {} named expressions",
                config.name(), registry.names(), namedExpressions.size());
    }

    private Map<String, CompiledExpression> compileNamed(CompareChainConfig config) {
        Map<String, CompiledExpression> compiled = new LinkedHashMap<>();
        for (NamedExpressionConfig named : config.expressions()) {
            compiled.put(named.name(), doCompile(new CacheKey(named.expression(), named.comparator())));
            log.debug("Compiled named expression '{}': {}", named.name(), named.expression());
        }
        return Collections.unmodifiableMap(compiled);
    }

    /**
     * Compile with the configured default comparator.
     */
    public CompiledExpression compile(String expression) {
        return compile(expression, null);
    }

    /**
     * Compile against the named comparator, or the configured default when
     * {@code comparatorName} is null.
     *
     * @throws com.comparechain.exception.ExpressionSyntaxException  if the text does not parse
     * @throws com.comparechain.exception.InvalidExpressionException if the tree cannot be rewritten
     * @throws ConfigurationException                                if the comparator is unknown
     */
    public CompiledExpression compile(String expression, String comparatorName) {
        return cache.get(new CacheKey(expression, comparatorName), this::doCompile);
    }

    private CompiledExpression doCompile(CacheKey key) {
        Expression tree = ExpressionParser.parse(key.expression());
        String comparatorName = key.comparator();
        if (tree instanceof CompareInvocation invocation) {
            tree = invocation.expression();
            if (invocation.comparator() != null) {
                if (comparatorName != null && !comparatorName.equals(invocation.comparator())) {
                    throw new ConfigurationException("Expression selects comparator '" + invocation.comparator()
                            + "' but '" + comparatorName + "' was requested: " + key.expression());
                }
                comparatorName = invocation.comparator();
            }
        }
        if (comparatorName == null) {
            comparatorName = config.defaultComparator();
        }
        ComparatorRef comparator = registry.resolve(comparatorName);
        Expression rewritten = CompareChain.rewriteWith(tree, comparator);
        log.debug("Compiled '{}' against '{}': {}", key.expression(), comparator.name(), rewritten);
        return new CompiledExpression(key.expression(), comparator, rewritten);
    }

    /**
     * Compile (or fetch from cache) and evaluate with the default comparator.
     */
    public boolean evaluate(String expression, EvaluationContext context) {
        return evaluate(expression, null, context);
    }

    public boolean evaluate(String expression, String comparatorName, EvaluationContext context) {
        return evaluate(compile(expression, comparatorName), context);
    }

    public boolean evaluate(CompiledExpression compiled, EvaluationContext context) {
        return evaluator.evaluate(compiled.rewritten(), context);
    }

    /**
     * Evaluate a predefined expression.
     *
     * @throws IllegalArgumentException if no expression has that name
     */
    public boolean evaluateNamed(String name, EvaluationContext context) {
        CompiledExpression compiled = namedExpressions.get(name);
        if (compiled == null) {
            throw new IllegalArgumentException("Unknown expression: " + name);
        }
        return evaluate(compiled, context);
    }

    public Set<String> expressionNames() {
        return namedExpressions.keySet();
    }

    public ComparatorRegistry getRegistry() {
        return registry;
    }

    public long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    private record CacheKey(String expression, String comparator) {
    }
}
