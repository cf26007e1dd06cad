package com.comparechain.config;

import com.comparechain.comparator.ComparatorDomain;
import com.comparechain.comparator.Ordering;

/**
 * Orders strings by length, for configuration tests.
 */
public class StringLengthDomain implements ComparatorDomain {

    @Override
    public Ordering order(Object left, Object right) {
        return Ordering.of(Integer.compare(left.toString().length(), right.toString().length()));
    }
}
