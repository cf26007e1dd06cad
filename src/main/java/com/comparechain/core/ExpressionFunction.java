package com.comparechain.core;

import java.util.List;

/**
 * Function callable from an expression, e.g. {@code len(name) > 3}.
 */
@FunctionalInterface
public interface ExpressionFunction {

    /**
     * Apply the function.
     *
     * @param arguments Evaluated arguments, in call order
     * @return Result value
     */
    Object apply(List<Object> arguments);
}
