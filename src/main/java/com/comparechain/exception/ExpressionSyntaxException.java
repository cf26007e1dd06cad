package com.comparechain.exception;

/**
 * Exception thrown when expression text cannot be tokenized or parsed.
 */
public class ExpressionSyntaxException extends CompareChainException {

    private final int position;

    public ExpressionSyntaxException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Offset into the input where the problem was detected.
     */
    public int getPosition() {
        return position;
    }
}
