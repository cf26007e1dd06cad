package com.comparechain.parser;

import com.comparechain.ast.ComparisonOperator;

import java.util.List;
import java.util.Map;

/**
 * Keywords and operator symbols of the expression language.
 */
public final class ExpressionSyntax {

    private ExpressionSyntax() {
    }

    /**
     * Keywords mapped to token types. Matched case-insensitively.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "COMPARE", TokenType.COMPARE,
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN,
            "NULL", TokenType.NULL
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "TRUE", true,
            "FALSE", false
    );

    /**
     * Comparison token types mapped to tree operators.
     */
    public static final Map<TokenType, ComparisonOperator> COMPARISON_OPERATORS = Map.of(
            TokenType.LT, ComparisonOperator.LESS_THAN,
            TokenType.GT, ComparisonOperator.GREATER_THAN,
            TokenType.LTE, ComparisonOperator.LESS_THAN_OR_EQUAL,
            TokenType.GTE, ComparisonOperator.GREATER_THAN_OR_EQUAL,
            TokenType.EQ, ComparisonOperator.EQUAL,
            TokenType.NE, ComparisonOperator.NOT_EQUAL,
            TokenType.STRICT_EQ, ComparisonOperator.STRICT_EQUAL,
            TokenType.STRICT_NE, ComparisonOperator.STRICT_NOT_EQUAL
    );

    /**
     * Operator and punctuation symbols mapped to token types, longest symbol first
     * so that {@code ===} is never read as {@code ==} followed by {@code =}.
     */
    public static final List<Map.Entry<String, TokenType>> SYMBOLS = List.of(
            Map.entry("===", TokenType.STRICT_EQ),
            Map.entry("!==", TokenType.STRICT_NE),
            Map.entry("==", TokenType.EQ),
            Map.entry("!=", TokenType.NE),
            Map.entry("<=", TokenType.LTE),
            Map.entry(">=", TokenType.GTE),
            Map.entry("<", TokenType.LT),
            Map.entry(">", TokenType.GT),
            Map.entry("(", TokenType.LPAREN),
            Map.entry(")", TokenType.RPAREN),
            Map.entry("{", TokenType.LBRACE),
            Map.entry("}", TokenType.RBRACE),
            Map.entry(",", TokenType.COMMA),
            Map.entry(";", TokenType.SEMICOLON)
    );
}
