package com.comparechain.exception;

/**
 * Exception thrown when a rewritten expression cannot be evaluated,
 * e.g. an unbound variable or a non-boolean branch.
 */
public class EvaluationException extends CompareChainException {

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
