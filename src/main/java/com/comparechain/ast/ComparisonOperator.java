package com.comparechain.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operators allowed in a {@link Comparison}.
 * <p>
 * Ordering operators are asymmetric. Equality operators (including the strict aliases) are
 * symmetric in their operands, which is what makes the chain reordering legal.
 */
public enum ComparisonOperator {
    LESS_THAN("<", Category.ORDERING),
    GREATER_THAN(">", Category.ORDERING),
    LESS_THAN_OR_EQUAL("<=", Category.ORDERING),
    GREATER_THAN_OR_EQUAL(">=", Category.ORDERING),
    EQUAL("==", Category.EQUALITY),
    NOT_EQUAL("!=", Category.EQUALITY),
    STRICT_EQUAL("===", Category.EQUALITY),
    STRICT_NOT_EQUAL("!==", Category.EQUALITY);

    /**
     * Operator classes.
     */
    public enum Category {
        ORDERING,
        EQUALITY
    }

    private static final Map<String, ComparisonOperator> BY_SYMBOL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ComparisonOperator::symbol, Function.identity()));

    private final String symbol;
    private final Category category;

    ComparisonOperator(String symbol, Category category) {
        this.symbol = symbol;
        this.category = category;
    }

    public String symbol() {
        return symbol;
    }

    public Category category() {
        return category;
    }

    public boolean isOrdering() {
        return category == Category.ORDERING;
    }

    public boolean isEquality() {
        return category == Category.EQUALITY;
    }

    public boolean isStrict() {
        return this == STRICT_EQUAL || this == STRICT_NOT_EQUAL;
    }

    /**
     * Look up an operator by its source symbol.
     *
     * @param symbol Symbol such as {@code "<="} or {@code "!=="}
     * @return Matching operator
     * @throws IllegalArgumentException if the symbol is not a comparison operator
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        ComparisonOperator operator = BY_SYMBOL.get(symbol);
        if (operator == null) {
            throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
        }
        return operator;
    }
}
