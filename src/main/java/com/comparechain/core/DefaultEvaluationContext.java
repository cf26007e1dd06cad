package com.comparechain.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of EvaluationContext.
 * Immutable after construction.
 */
public final class DefaultEvaluationContext implements EvaluationContext {

    private final Map<String, Object> variables;
    private final Map<String, ExpressionFunction> functions;

    private DefaultEvaluationContext(Builder builder) {
        this.variables = Collections.unmodifiableMap(new HashMap<>(builder.variables));
        this.functions = Collections.unmodifiableMap(new HashMap<>(builder.functions));
    }

    @Override
    public Optional<Object> getVariable(String name) {
        return Optional.ofNullable(variables.get(name));
    }

    @Override
    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    @Override
    public Map<String, Object> getVariables() {
        return variables;
    }

    @Override
    public Optional<ExpressionFunction> getFunction(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "variables=" + variables +
                ", functions=" + functions.keySet() +
                '}';
    }

    /**
     * Builder for DefaultEvaluationContext.
     */
    public static class Builder implements EvaluationContext.Builder {
        private final Map<String, Object> variables = new HashMap<>();
        private final Map<String, ExpressionFunction> functions = new HashMap<>();

        @Override
        public Builder variable(String name, Object value) {
            if (name != null) {
                this.variables.put(name, value);
            }
            return this;
        }

        @Override
        public Builder variables(Map<String, ?> variables) {
            if (variables != null) {
                this.variables.putAll(variables);
            }
            return this;
        }

        @Override
        public Builder function(String name, ExpressionFunction function) {
            if (name != null && function != null) {
                this.functions.put(name, function);
            }
            return this;
        }

        @Override
        public EvaluationContext build() {
            return new DefaultEvaluationContext(this);
        }
    }
}
