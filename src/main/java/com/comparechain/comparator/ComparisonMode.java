package com.comparechain.comparator;

/**
 * How a comparator call is carried out at evaluation time.
 */
public enum ComparisonMode {
    /** Natural ordering of the values, with a notice when composite values are compared. */
    STRUCTURAL,
    /** Delegation to a domain supplied by the caller. */
    SEMANTIC
}
