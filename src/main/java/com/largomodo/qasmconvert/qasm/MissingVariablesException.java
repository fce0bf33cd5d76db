package com.largomodo.qasmconvert.qasm;

import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when a parametrized circuit is exported without values for all of its variables.
 */
public class MissingVariablesException extends QasmException {

    private final Set<String> variables;

    /**
     * @param variables the unresolved variable names
     */
    public MissingVariablesException(Set<String> variables) {
        super("Circuit is parametrized but no values were given for variables: " + new TreeSet<>(variables));
        this.variables = Set.copyOf(variables);
    }

    public Set<String> getVariables() {
        return variables;
    }
}
