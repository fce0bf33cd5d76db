package com.largomodo.qasmconvert.core.domain;

import com.largomodo.qasmconvert.qasm.MissingVariablesException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable mapping from variable name to a resolved real value.
 * <p>
 * Supplied at export time to resolve parametrized gates into numeric literals.
 *
 * @param values variable name to value (unmodifiable copy)
 */
public record VariableAssignment(Map<String, Double> values) {

    private static final VariableAssignment EMPTY = new VariableAssignment(Map.of());

    /**
     * Compact constructor that copies the mapping and rejects null keys or values.
     */
    public VariableAssignment {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        values = Map.copyOf(values);
    }

    public static VariableAssignment empty() {
        return EMPTY;
    }

    public static VariableAssignment of(Map<String, Double> values) {
        return new VariableAssignment(values);
    }

    public static VariableAssignment of(String name, double value) {
        return new VariableAssignment(Map.of(name, value));
    }

    /**
     * Resolve a single variable.
     *
     * @throws MissingVariablesException if the variable has no value
     */
    public double valueOf(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new MissingVariablesException(Set.of(name));
        }
        return value;
    }

    /**
     * @return the subset of {@code names} this assignment has no value for, sorted
     */
    public Set<String> missing(Set<String> names) {
        Set<String> missing = new TreeSet<>(names);
        missing.removeAll(values.keySet());
        return missing;
    }
}
