package com.comparechain.engine;

import com.comparechain.ast.Expression;
import com.comparechain.comparator.ComparatorRef;

/**
 * An expression parsed and rewritten against one comparator, ready to evaluate.
 *
 * @param source     Expression text as given
 * @param comparator Comparator the comparisons were rewritten against
 * @param rewritten  Rewritten tree
 */
public record CompiledExpression(String source, ComparatorRef comparator, Expression rewritten) {

    @Override
    public String toString() {
        return source + " [" + comparator.name() + "] => " + rewritten;
    }
}
