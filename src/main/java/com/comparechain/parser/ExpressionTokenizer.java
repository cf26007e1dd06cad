package com.comparechain.parser;

import com.comparechain.exception.ExpressionSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

import static com.comparechain.parser.ExpressionSyntax.BOOLEAN_VALUES;
import static com.comparechain.parser.ExpressionSyntax.KEYWORDS;
import static com.comparechain.parser.ExpressionSyntax.SYMBOLS;

/**
 * Splits expression text into tokens. Whitespace separates tokens and is otherwise ignored.
 * Numbers are {@code Long} or {@code Double}; strings take single or double quotes with
 * backslash escapes.
 */
public final class ExpressionTokenizer {

    private static final IntPredicate DIGIT = Character::isDigit;
    private static final IntPredicate WORD_START = c -> Character.isLetter(c) || c == '_' || c == '$';
    private static final IntPredicate WORD_PART = c -> Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';

    private final String input;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * @return the tokens of the whole input, ending with EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (skip(Character::isWhitespace); pos < input.length(); skip(Character::isWhitespace)) {
            tokens.add(next());
        }
        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token next() {
        int start = pos;
        char c = input.charAt(pos);
        if (c == '"' || c == '\'') {
            return quoted(c);
        }
        if (WORD_START.test(c)) {
            return word();
        }
        if (DIGIT.test(c) || (c == '-' && start + 1 < input.length() && DIGIT.test(input.charAt(start + 1)))) {
            return number();
        }
        for (Map.Entry<String, TokenType> symbol : SYMBOLS) {
            if (input.startsWith(symbol.getKey(), start)) {
                pos += symbol.getKey().length();
                return new Token(symbol.getValue(), symbol.getKey(), null, start);
            }
        }
        throw error(switch (c) {
            case '=' -> "Unexpected '=', did you mean '=='?";
            case '!' -> "Unexpected '!', use 'not' for negation";
            default -> "Unexpected character '" + c + "'";
        }, start);
    }

    private Token word() {
        int start = pos;
        skip(WORD_PART);
        String text = input.substring(start, pos);
        String key = text.toUpperCase();
        TokenType keyword = KEYWORDS.get(key);
        if (keyword == null) {
            return new Token(TokenType.IDENT, text, text, start);
        }
        return new Token(keyword, text, BOOLEAN_VALUES.get(key), start);
    }

    private Token number() {
        int start = pos;
        if (input.charAt(pos) == '-') {
            pos++;
        }
        skip(DIGIT);
        boolean fraction = pos < input.length() && input.charAt(pos) == '.';
        if (fraction) {
            pos++;
            skip(DIGIT);
        }
        String text = input.substring(start, pos);
        try {
            Object value = fraction ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, value, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token quoted(char quote) {
        int start = pos++;
        StringBuilder text = new StringBuilder();
        while (pos < input.length() && input.charAt(pos) != quote) {
            char c = input.charAt(pos++);
            if (c != '\\' || pos == input.length()) {
                text.append(c);
                continue;
            }
            char escaped = input.charAt(pos++);
            text.append(switch (escaped) {
                case 'n' -> '\n';
                case 't' -> '\t';
                case 'r' -> '\r';
                default -> escaped;
            });
        }
        if (pos == input.length()) {
            throw error("Unterminated string", start);
        }
        pos++;
        String value = text.toString();
        return new Token(TokenType.STRING, value, value, start);
    }

    private void skip(IntPredicate accept) {
        while (pos < input.length() && accept.test(input.charAt(pos))) {
            pos++;
        }
    }

    private ExpressionSyntaxException error(String message, int position) {
        return new ExpressionSyntaxException("Invalid expression at position "
                + position + ": " + message + " in '" + input + "'", position);
    }
}
