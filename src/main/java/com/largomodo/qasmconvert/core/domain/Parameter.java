package com.largomodo.qasmconvert.core.domain;

import java.util.Set;
import java.util.function.DoubleUnaryOperator;

/**
 * Gate parameter: a pure function from a {@link VariableAssignment} to a real number.
 * <p>
 * Parameters compose without being resolved, so a compiler can halve or negate an
 * angle that still depends on a variable. Resolution happens once, at export.
 */
public interface Parameter {

    /**
     * Resolve this parameter.
     *
     * @param variables values for every name in {@link #variables()}
     * @return the numeric value
     * @throws com.largomodo.qasmconvert.qasm.MissingVariablesException if a variable has no value
     */
    double evaluate(VariableAssignment variables);

    /**
     * @return names of the variables this parameter depends on (empty for constants)
     */
    Set<String> variables();

    default boolean isConstant() {
        return variables().isEmpty();
    }

    default Parameter map(DoubleUnaryOperator operator) {
        return new Derived(this, operator);
    }

    default Parameter scale(double factor) {
        return map(value -> value * factor);
    }

    default Parameter negate() {
        return scale(-1.0);
    }

    static Parameter constant(double value) {
        return new Constant(value);
    }

    static Parameter variable(String name) {
        return new Variable(name);
    }

    record Constant(double value) implements Parameter {

        @Override
        public double evaluate(VariableAssignment variables) {
            return value;
        }

        @Override
        public Set<String> variables() {
            return Set.of();
        }
    }

    record Variable(String name) implements Parameter {

        public Variable {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Variable name must not be null or blank");
            }
        }

        @Override
        public double evaluate(VariableAssignment variables) {
            return variables.valueOf(name);
        }

        @Override
        public Set<String> variables() {
            return Set.of(name);
        }
    }

    record Derived(Parameter base, DoubleUnaryOperator operator) implements Parameter {

        @Override
        public double evaluate(VariableAssignment variables) {
            return operator.applyAsDouble(base.evaluate(variables));
        }

        @Override
        public Set<String> variables() {
            return base.variables();
        }
    }
}
