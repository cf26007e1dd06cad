package com.comparechain.exception;

/**
 * Thrown by a comparator domain when it has no ordering for the given pair of values.
 */
public class IncomparableValuesException extends CompareChainException {

    public IncomparableValuesException(String message) {
        super(message);
    }
}
