package com.comparechain.parser;

import com.comparechain.ast.Block;
import com.comparechain.ast.Call;
import com.comparechain.ast.Combinator;
import com.comparechain.ast.CompareInvocation;
import com.comparechain.ast.Comparison;
import com.comparechain.ast.Expression;
import com.comparechain.ast.Literal;
import com.comparechain.ast.Variable;
import com.comparechain.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;

import static com.comparechain.parser.ExpressionSyntax.COMPARISON_OPERATORS;

/**
 * Parser for comparison expressions.
 * Converts tokens into an expression tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: ordering > equality > NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('or' and)*
 * and        := not ('and' not)*
 * not        := 'not' not | equality
 * equality   := relational (('==' | '!=' | '===' | '!==') relational)*
 * relational := primary (('&lt;' | '&gt;' | '&lt;=' | '&gt;=') primary)*
 * primary    := '(' expression ')'
 *             | '{' expression (';' expression)* '}'
 *             | 'compare' '(' expression [',' IDENT] ')'
 *             | IDENT '(' [expression (',' expression)*] ')'
 *             | IDENT | NUMBER | STRING | 'true' | 'false' | 'null'
 * </pre>
 * Comparison operators are left-associative, so {@code a < b < c} parses as {@code <(<(a, b), c)}.
 * Because ordering binds tighter, {@code a == b < c} parses as {@code ==(a, <(b, c))}.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse an expression string.
     *
     * @param expression Expression text
     * @return Expression tree
     */
    public static Expression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("Expression cannot be empty", 0);
        }
        List<Token> tokens = new ExpressionTokenizer(expression).tokenize();
        return new ExpressionParser(expression, tokens).parse();
    }

    /**
     * Parse the token stream into an expression tree.
     *
     * @return Root of the tree
     */
    public Expression parse() {
        Expression result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private Expression parseExpression() {
        return parseOr();
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            left = Combinator.or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (match(TokenType.AND)) {
            left = Combinator.and(left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            return Combinator.not(parseNot());
        }
        return parseEquality();
    }

    private Expression parseEquality() {
        Expression left = parseRelational();
        while (match(TokenType.EQ, TokenType.NE, TokenType.STRICT_EQ, TokenType.STRICT_NE)) {
            Token operator = previous();
            left = new Comparison(COMPARISON_OPERATORS.get(operator.type()), left, parseRelational());
        }
        return left;
    }

    private Expression parseRelational() {
        Expression left = parsePrimary();
        while (match(TokenType.LT, TokenType.GT, TokenType.LTE, TokenType.GTE)) {
            Token operator = previous();
            left = new Comparison(COMPARISON_OPERATORS.get(operator.type()), left, parsePrimary());
        }
        return left;
    }

    private Expression parsePrimary() {
        // Parenthesized expression
        if (match(TokenType.LPAREN)) {
            Expression expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }

        if (match(TokenType.LBRACE)) {
            return parseBlock();
        }

        if (match(TokenType.COMPARE)) {
            return parseCompareInvocation();
        }

        if (match(TokenType.IDENT)) {
            String name = previous().text();
            if (match(TokenType.LPAREN)) {
                return new Call(name, parseArguments());
            }
            return new Variable(name);
        }

        if (match(TokenType.NUMBER, TokenType.STRING)) {
            return Literal.of(previous().literal());
        }

        if (match(TokenType.BOOLEAN)) {
            return (boolean) previous().literal() ? Literal.TRUE : Literal.FALSE;
        }

        if (match(TokenType.NULL)) {
            return Literal.NULL;
        }

        throw error("Expected operand");
    }

    private Expression parseBlock() {
        List<Expression> statements = new ArrayList<>();
        statements.add(parseExpression());
        while (match(TokenType.SEMICOLON)) {
            statements.add(parseExpression());
        }
        expect(TokenType.RBRACE);
        return new Block(statements);
    }

    private Expression parseCompareInvocation() {
        expect(TokenType.LPAREN);
        Expression expression = parseExpression();
        String comparator = null;
        if (match(TokenType.COMMA)) {
            comparator = consume(TokenType.IDENT, "Expected comparator name").text();
        }
        expect(TokenType.RPAREN);
        return new CompareInvocation(expression, comparator);
    }

    private List<Expression> parseArguments() {
        List<Expression> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            arguments.add(parseExpression());
            while (match(TokenType.COMMA)) {
                arguments.add(parseExpression());
            }
        }
        expect(TokenType.RPAREN);
        return arguments;
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ExpressionSyntaxException error(String message) {
        int position = peek().position();
        return new ExpressionSyntaxException("Invalid expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
