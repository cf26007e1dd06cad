package com.comparechain.core;

import java.util.Map;
import java.util.Optional;

/**
 * Variables and functions a rewritten expression is evaluated against.
 * Immutable after creation.
 */
public interface EvaluationContext {

    /**
     * Get a variable value.
     *
     * @param name Variable name
     * @return Value, or empty if unbound or bound to null
     */
    Optional<Object> getVariable(String name);

    /**
     * Whether a variable is bound, possibly to null.
     */
    boolean hasVariable(String name);

    /**
     * Get all variables.
     */
    Map<String, Object> getVariables();

    /**
     * Get a function by name.
     */
    Optional<ExpressionFunction> getFunction(String name);

    /**
     * Context with no variables and no functions.
     */
    static EvaluationContext empty() {
        return builder().build();
    }

    /**
     * Context holding the given variables.
     */
    static EvaluationContext of(Map<String, ?> variables) {
        return builder().variables(variables).build();
    }

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultEvaluationContext.Builder();
    }

    /**
     * Builder for EvaluationContext.
     */
    interface Builder {
        Builder variable(String name, Object value);
        Builder variables(Map<String, ?> variables);
        Builder function(String name, ExpressionFunction function);
        EvaluationContext build();
    }
}
