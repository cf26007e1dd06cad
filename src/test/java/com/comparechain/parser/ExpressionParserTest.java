package com.comparechain.parser;

import com.comparechain.ast.Block;
import com.comparechain.ast.Call;
import com.comparechain.ast.Combinator;
import com.comparechain.ast.CombinatorType;
import com.comparechain.ast.CompareInvocation;
import com.comparechain.ast.Comparison;
import com.comparechain.ast.ComparisonOperator;
import com.comparechain.ast.Expression;
import com.comparechain.ast.Literal;
import com.comparechain.ast.Variable;
import com.comparechain.exception.ExpressionSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionParser.
 */
class ExpressionParserTest {

    @ParameterizedTest
    @DisplayName("Precedence and associativity")
    @CsvSource(delimiter = '|', value = {
            "a < b < c             | ((a < b) < c)",
            "a == b < c            | (a == (b < c))",
            "a < b == c < d        | ((a < b) == (c < d))",
            "a == b != c           | ((a == b) != c)",
            "a < b and c < d or e  | (((a < b) and (c < d)) or e)",
            "a or b and c          | (a or (b and c))",
            "not a < b             | not (a < b)",
            "not not a             | not not a",
            "(a < b) < c           | ((a < b) < c)"
    })
    void precedence(String expression, String expected) {
        assertEquals(expected, ExpressionParser.parse(expression).toString());
    }

    @Test
    @DisplayName("Literal operands keep their types")
    void literals() {
        Comparison comparison = (Comparison) ExpressionParser.parse("1 < 2.5");
        assertEquals(Literal.of(1L), comparison.left());
        assertEquals(Literal.of(2.5), comparison.right());

        comparison = (Comparison) ExpressionParser.parse("'a' == \"x\\\"y\"");
        assertEquals(Literal.of("a"), comparison.left());
        assertEquals(Literal.of("x\"y"), comparison.right());

        comparison = (Comparison) ExpressionParser.parse("true != null");
        assertSame(Literal.TRUE, comparison.left());
        assertSame(Literal.NULL, comparison.right());

        comparison = (Comparison) ExpressionParser.parse("x > -3");
        assertEquals(Literal.of(-3L), comparison.right());
    }

    @Test
    @DisplayName("Dotted identifiers and function calls")
    void identifiersAndCalls() {
        Comparison comparison = (Comparison) ExpressionParser.parse("order.total <= max(limit, 10)");

        assertEquals(Variable.of("order.total"), comparison.left());
        assertEquals(Call.of("max", Variable.of("limit"), Literal.of(10L)), comparison.right());
        assertEquals(Call.of("now"), ExpressionParser.parse("now()"));
    }

    @Test
    @DisplayName("Blocks with one or more statements")
    void blocks() {
        assertEquals(Block.of(ExpressionParser.parse("a < b")), ExpressionParser.parse("{ a < b }"));

        Block block = (Block) ExpressionParser.parse("{ x; a < b }");
        assertEquals(2, block.statements().size());
        assertFalse(block.isWrapper());
    }

    @Test
    @DisplayName("compare with and without a comparator name")
    void compareInvocation() {
        CompareInvocation plain = (CompareInvocation) ExpressionParser.parse("compare(a < b)");
        assertNull(plain.comparator());
        assertEquals(Comparison.of(Variable.of("a"), ComparisonOperator.LESS_THAN, Variable.of("b")), plain.expression());

        CompareInvocation named = (CompareInvocation) ExpressionParser.parse("COMPARE(a <= b < c, temporal)");
        assertEquals("temporal", named.comparator());
    }

    @Test
    @DisplayName("Keywords are case-insensitive")
    void keywordsCaseInsensitive() {
        Expression tree = ExpressionParser.parse("NOT a < b AND c == TRUE Or d != False");

        Combinator or = assertInstanceOf(Combinator.class, tree);
        assertEquals(CombinatorType.OR, or.type());
    }

    @ParameterizedTest
    @DisplayName("Malformed input is rejected")
    @ValueSource(strings = {
            "a <",
            "a < b)",
            "(a < b",
            "a = b",
            "!a",
            "a < 'open",
            "a # b",
            "compare(a < b, 'x')",
            "{ a < b",
            "f(a,)"
    })
    void rejectsMalformed(String expression) {
        assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.parse(expression));
    }

    @ParameterizedTest
    @DisplayName("Blank input is rejected")
    @ValueSource(strings = {"", "   "})
    void rejectsBlank(String expression) {
        assertThrows(ExpressionSyntaxException.class, () -> ExpressionParser.parse(expression));
    }

    @Test
    @DisplayName("Syntax errors carry the position")
    void errorPosition() {
        ExpressionSyntaxException e = assertThrows(ExpressionSyntaxException.class,
                () -> ExpressionParser.parse("a < b c"));

        assertEquals(6, e.getPosition());
        assertTrue(e.getMessage().contains("position 6"));
        assertTrue(e.getMessage().contains("'a < b c'"));
    }
}
