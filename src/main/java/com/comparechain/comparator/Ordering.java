package com.comparechain.comparator;

/**
 * Result of a three-way comparison.
 */
public enum Ordering {
    LESS,
    EQUAL,
    GREATER;

    /**
     * Convert a {@link java.util.Comparator}-style result.
     */
    public static Ordering of(int comparison) {
        if (comparison < 0) {
            return LESS;
        }
        return comparison > 0 ? GREATER : EQUAL;
    }
}
