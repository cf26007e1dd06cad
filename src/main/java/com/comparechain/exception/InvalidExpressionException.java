package com.comparechain.exception;

import com.comparechain.validation.ValidationError;

/**
 * Exception thrown when an expression tree does not have a shape that can be rewritten.
 * Raised before any rewriting happens; there is no partial rewrite.
 */
public class InvalidExpressionException extends CompareChainException {

    private final ValidationError error;

    public InvalidExpressionException(ValidationError error) {
        super(error.message());
        this.error = error;
    }

    public ValidationError getError() {
        return error;
    }
}
