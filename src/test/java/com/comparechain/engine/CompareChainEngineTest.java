package com.comparechain.engine;

import com.comparechain.comparator.ComparatorRef;
import com.comparechain.comparator.ComparatorRegistry;
import com.comparechain.config.ConfigLoader;
import com.comparechain.config.CompareChainConfig;
import com.comparechain.config.NamedExpressionConfig;
import com.comparechain.config.DiagnosticsConfig;
import com.comparechain.core.EvaluationContext;
import com.comparechain.diagnostics.DiagnosticsSink;
import com.comparechain.exception.ConfigurationException;
import com.comparechain.exception.ExpressionSyntaxException;
import com.comparechain.exception.InvalidExpressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CompareChainEngine.
 */
class CompareChainEngineTest {

    private CompareChainEngine engine;

    @BeforeEach
    void setUp() {
        engine = CompareChainEngineFactory.create(ConfigLoader.load("classpath:compare-chain-test.yaml"));
    }

    @Test
    @DisplayName("Compiled expressions are cached per text and comparator")
    void cachesCompiledExpressions() {
        CompiledExpression first = engine.compile("a < b < c");
        CompiledExpression second = engine.compile("a < b < c");
        CompiledExpression other = engine.compile("a < b < c", "length");

        assertSame(first, second);
        assertNotSame(first, other);
        assertSame(ComparatorRef.NATURAL, first.comparator());
        assertEquals("length", other.comparator().name());

        long cached = engine.cacheSize();
        engine.clearCache();
        assertEquals(0, engine.cacheSize());
        assertTrue(cached >= 2);
    }

    @Test
    @DisplayName("Cache holds at most the configured number of compiled expressions")
    void cacheIsBounded() {
        CompareChainConfig config = new CompareChainConfig("bounded", "natural", null, null,
                List.of(new NamedExpressionConfig("in-range", "low <= value < high", null)), 2);
        CompareChainEngine bounded = CompareChainEngineFactory.create(config);
        EvaluationContext context = EvaluationContext.of(Map.of("x", 5));

        for (int i = 0; i < 50; i++) {
            assertTrue(bounded.evaluate("x < " + (10 + i), context));
        }

        assertTrue(bounded.cacheSize() <= 2);
        assertTrue(bounded.evaluateNamed("in-range",
                EvaluationContext.of(Map.of("low", 1, "value", 5, "high", 10))));
    }

    @Test
    @DisplayName("Cache size 0 compiles every time")
    void cacheDisabled() {
        CompareChainConfig config = new CompareChainConfig("uncached", "natural", null, null, null, 0);
        CompareChainEngine uncached = CompareChainEngineFactory.create(config);

        assertTrue(uncached.evaluate("1 < 2", EvaluationContext.empty()));
        assertTrue(uncached.evaluate("1 < 2", EvaluationContext.empty()));
        assertEquals(0, uncached.cacheSize());
    }

    @Test
    @DisplayName("Named expressions do not occupy the cache")
    void namedExpressionsOutsideCache() {
        assertEquals(0, engine.cacheSize());

        engine.compile("a < b");
        assertEquals(1, engine.cacheSize());
    }

    @Test
    @DisplayName("Evaluates text with the default and a named comparator")
    void evaluatesText() {
        EvaluationContext context = EvaluationContext.of(Map.of("a", "xx", "b", "y"));

        assertTrue(engine.evaluate("a < b", context));
        assertFalse(engine.evaluate("a < b", "length", context));
        assertTrue(engine.evaluate("a > b", "length", context));
    }

    @Test
    @DisplayName("Named expressions are compiled up front and evaluated by name")
    void namedExpressions() {
        assertEquals(Set.of("in-range", "same-length", "strictly-longer"), engine.expressionNames());

        EvaluationContext numbers = EvaluationContext.of(Map.of("low", 1, "value", 5, "high", 10));
        assertTrue(engine.evaluateNamed("in-range", numbers));

        EvaluationContext words = EvaluationContext.of(Map.of("left", "abc", "right", "xyz"));
        assertTrue(engine.evaluateNamed("same-length", words));
        assertFalse(engine.evaluateNamed("strictly-longer", words));

        assertThrows(IllegalArgumentException.class, () -> engine.evaluateNamed("missing", words));
    }

    @Test
    @DisplayName("Top-level compare selects the comparator")
    void topLevelCompareSelectsComparator() {
        CompiledExpression compiled = engine.compile("compare(start < end, temporal)");

        assertEquals(ComparatorRegistry.TEMPORAL, compiled.comparator().name());
        assertTrue(engine.evaluate(compiled, EvaluationContext.of(Map.of(
                "start", LocalDate.of(2024, 1, 1), "end", LocalDate.of(2024, 1, 2)))));
        assertSame(ComparatorRef.NATURAL, engine.compile("compare(a < b)").comparator());
    }

    @Test
    @DisplayName("Conflicting comparator selection is rejected")
    void conflictingComparator() {
        assertThrows(ConfigurationException.class, () -> engine.compile("compare(a < b, temporal)", "length"));
    }

    @Test
    @DisplayName("Compile errors surface unchanged")
    void compileErrors() {
        long cached = engine.cacheSize();

        assertThrows(ExpressionSyntaxException.class, () -> engine.compile("a <"));
        assertThrows(InvalidExpressionException.class, () -> engine.compile("compare(compare(a < b))"));
        assertThrows(ConfigurationException.class, () -> engine.compile("a < b", "unknown"));
        assertEquals(cached, engine.cacheSize());
    }

    @Test
    @DisplayName("Broken predefined expression fails engine creation")
    void brokenNamedExpression() {
        CompareChainConfig config = new CompareChainConfig("broken", "natural", DiagnosticsConfig.defaults(),
                List.of(), List.of(new NamedExpressionConfig("bad", "a and b", null)));

        assertThrows(InvalidExpressionException.class, () -> CompareChainEngineFactory.create(config));
    }

    @Test
    @DisplayName("Unknown default comparator fails engine creation")
    void unknownDefaultComparator() {
        CompareChainConfig config = new CompareChainConfig("broken", "money", null, null, null);

        assertThrows(ConfigurationException.class, () -> CompareChainEngineFactory.create(config));
    }

    @Test
    @DisplayName("Notices reach the engine's sink; disabled diagnostics drop them")
    void diagnosticsSink() {
        List<String> notices = new ArrayList<>();
        CompareChainEngine recording = new CompareChainEngine(
                CompareChainConfig.defaults(), ComparatorRegistry.withDefaults(), notices::add);

        assertTrue(recording.evaluate("a === b", ComparatorRegistry.CASE_INSENSITIVE,
                EvaluationContext.of(Map.of("a", "X", "b", "x"))));
        assertEquals(1, notices.size());

        CompareChainConfig quiet = new CompareChainConfig("quiet", "natural", new DiagnosticsConfig(false), null, null);
        assertSame(DiagnosticsSink.DISCARD, CompareChainEngineFactory.diagnosticsSink(quiet));
    }
}
