package com.comparechain;

import com.comparechain.ast.Combinator;
import com.comparechain.ast.Expression;
import com.comparechain.ast.ExpressionTrees;
import com.comparechain.ast.OutcomeTest;
import com.comparechain.comparator.ComparatorDomains;
import com.comparechain.comparator.ComparatorRef;
import com.comparechain.core.EvaluationContext;
import com.comparechain.exception.InvalidExpressionException;
import com.comparechain.validation.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of parse, rewrite and evaluate.
 */
class CompareChainTest {

    private static final EvaluationContext NUMBERS = EvaluationContext.of(Map.of(
            "a", 1L, "b", 2L, "c", 3L, "d", 4L, "e", 5L, "f", 6L, "g", 7L, "h", 8L));

    @ParameterizedTest
    @DisplayName("Chains evaluate like the conjunction of their links")
    @CsvSource(delimiter = '|', value = {
            "1 < 2 < 3                        | true",
            "3 < 2 < 1                        | false",
            "1 < 3 > 2                        | true",
            "1 <= 1 < 2 >= 2                  | true",
            "a < b == c < d == e < f != g < h | false",
            "a < b != c < d != e              | true",
            "a == a < b                       | true",
            "b == a < c                       | false",
            "not a < b < c                    | false",
            "not not a < b < c                | true",
            "a > b or b < c < d               | true",
            "{ a < b } and { c < d }          | true",
            "not (1 > 2)                      | true"
    })
    void evaluates(String expression, boolean expected) {
        assertEquals(expected, CompareChain.compare(expression, NUMBERS));
    }

    @ParameterizedTest
    @DisplayName("Negation parity holds")
    @CsvSource({"a < b < c", "c < b < a", "a < c < b", "a == b"})
    void negationParity(String expression) {
        boolean plain = CompareChain.compare(expression, NUMBERS);

        assertEquals(!plain, CompareChain.compare("not " + expression, NUMBERS));
        assertEquals(plain, CompareChain.compare("not not " + expression, NUMBERS));
    }

    @Test
    @DisplayName("Default rewrite targets natural ordering")
    void defaultRewrite() {
        Expression rewritten = CompareChain.rewriteDefault(CompareChain.parse("x < y"));

        OutcomeTest test = assertInstanceOf(OutcomeTest.class, rewritten);
        assertSame(ComparatorRef.NATURAL, test.call().comparator());
    }

    @Test
    @DisplayName("Rewrite with a domain yields only comparator calls")
    void rewriteWithDomain() {
        Expression rewritten = CompareChain.rewriteWith(CompareChain.parse("x <= y < z or not x == z"),
                ComparatorDomains.temporal());

        assertInstanceOf(Combinator.class, rewritten);
        assertFalse(ExpressionTrees.contains(rewritten, Expression::isComparison));
        OutcomeTest any = (OutcomeTest) ExpressionTrees.find(rewritten, OutcomeTest.class::isInstance).orElseThrow();
        assertEquals(CompareChain.CUSTOM_COMPARATOR_NAME, any.call().comparator().name());
    }

    @Test
    @DisplayName("Semantic comparator gives dates chronological meaning")
    void temporalComparison() {
        EvaluationContext context = EvaluationContext.of(Map.of(
                "start", LocalDate.of(2024, 1, 1),
                "day", LocalDate.of(2024, 2, 29),
                "end", LocalDate.of(2024, 12, 31)));

        assertTrue(CompareChain.compare("start <= day < end", ComparatorDomains.temporal(), context));
        assertFalse(CompareChain.compare("end < day", ComparatorDomains.temporal(), context));
    }

    @Test
    @DisplayName("Invalid shapes are rejected before rewriting")
    void rejectsInvalidShape() {
        InvalidExpressionException e = assertThrows(InvalidExpressionException.class,
                () -> CompareChain.rewriteDefault(CompareChain.parse("a < b and c")));

        assertEquals(ValidationErrorKind.INCOMPLETE_COMBINATOR_BRANCH, e.getError().kind());
    }

    @Test
    @DisplayName("Notices go to the supplied sink")
    void evaluateWithSink() {
        List<String> notices = new ArrayList<>();
        Expression rewritten = CompareChain.rewriteWith(CompareChain.parse("x !== y"), "ci",
                ComparatorDomains.caseInsensitive());

        boolean result = CompareChain.evaluate(rewritten,
                EvaluationContext.of(Map.of("x", "Abc", "y", "aBC")), notices::add);

        assertFalse(result);
        assertEquals(1, notices.size());
    }
}
