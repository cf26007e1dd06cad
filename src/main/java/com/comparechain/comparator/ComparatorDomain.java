package com.comparechain.comparator;

/**
 * Total three-way ordering for the kind of values a domain supports.
 * <p>
 * Implementations may throw (typically {@link com.comparechain.exception.IncomparableValuesException})
 * when handed values outside their domain; the exception reaches the caller of the evaluation unchanged.
 */
@FunctionalInterface
public interface ComparatorDomain {

    /**
     * Order two values.
     *
     * @param left  Left operand value
     * @param right Right operand value
     * @return Ordering of {@code left} relative to {@code right}
     */
    Ordering order(Object left, Object right);
}
