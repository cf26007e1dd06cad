package com.comparechain.exception;

/**
 * Base exception for Compare Chain.
 */
public class CompareChainException extends RuntimeException {

    public CompareChainException(String message) {
        super(message);
    }

    public CompareChainException(String message, Throwable cause) {
        super(message, cause);
    }
}
