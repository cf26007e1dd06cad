package com.comparechain.comparator;

import com.comparechain.exception.IncomparableValuesException;

import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetTime;
import java.time.chrono.ChronoLocalDate;
import java.time.chrono.ChronoLocalDateTime;
import java.time.chrono.ChronoZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;

/**
 * Factory methods for common comparator domains.
 */
public final class ComparatorDomains {

    private ComparatorDomains() {
    }

    /**
     * Adapt a {@link Comparator} restricted to values of {@code type}.
     */
    public static <T> ComparatorDomain fromComparator(Class<T> type, Comparator<? super T> comparator) {
        return (left, right) -> {
            if (!type.isInstance(left) || !type.isInstance(right)) {
                throw new IncomparableValuesException("Expected two " + type.getSimpleName()
                        + " values, got " + NaturalOrdering.describe(left)
                        + " and " + NaturalOrdering.describe(right));
            }
            return Ordering.of(comparator.compare(type.cast(left), type.cast(right)));
        };
    }

    /**
     * Domain over the natural {@link Comparable} order of {@code type}.
     */
    public static <T extends Comparable<? super T>> ComparatorDomain comparable(Class<T> type) {
        return fromComparator(type, Comparator.naturalOrder());
    }

    /**
     * Case-insensitive ordering of character sequences.
     */
    public static ComparatorDomain caseInsensitive() {
        return fromComparator(CharSequence.class,
                (a, b) -> String.CASE_INSENSITIVE_ORDER.compare(a.toString(), b.toString()));
    }

    /**
     * Chronological ordering of {@code java.time} values of the same kind.
     * Dates are compared with dates, times with times; mixing kinds is incomparable.
     */
    public static ComparatorDomain temporal() {
        return ComparatorDomains::compareTemporal;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Ordering compareTemporal(Object left, Object right) {
        if (left instanceof ChronoLocalDate l && right instanceof ChronoLocalDate r) {
            return Ordering.of(l.compareTo(r));
        }
        if (left instanceof ChronoLocalDateTime l && right instanceof ChronoLocalDateTime r) {
            return Ordering.of(l.compareTo(r));
        }
        if (left instanceof ChronoZonedDateTime l && right instanceof ChronoZonedDateTime r) {
            return Ordering.of(l.toInstant().compareTo(r.toInstant()));
        }
        if (left instanceof LocalTime l && right instanceof LocalTime r) {
            return Ordering.of(l.compareTo(r));
        }
        if (left instanceof OffsetTime l && right instanceof OffsetTime r) {
            return Ordering.of(l.compareTo(r));
        }
        if (left instanceof Instant l && right instanceof Instant r) {
            return Ordering.of(l.compareTo(r));
        }
        if (left instanceof Comparable c && left instanceof TemporalAccessor
                && right != null && left.getClass() == right.getClass()) {
            return Ordering.of(c.compareTo(right));
        }
        throw new IncomparableValuesException("No chronological ordering between "
                + NaturalOrdering.describe(left) + " and " + NaturalOrdering.describe(right));
    }
}
