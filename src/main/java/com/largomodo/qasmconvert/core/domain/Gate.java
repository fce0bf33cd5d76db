package com.largomodo.qasmconvert.core.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable quantum gate.
 * <p>
 * Target order is significant for multi-qubit primitives (e.g. SWAP). Control order
 * is preserved only so that serialization is deterministic; semantically the
 * controls form a set.
 *
 * @param name      primitive identifier, matched case-insensitively by {@link #is(String)};
 *                  record equality is case-sensitive
 * @param targets   target qubit indices (non-empty, distinct, in {@code [0, Integer.MAX_VALUE)})
 * @param controls  control qubit indices (distinct, non-negative, disjoint from targets)
 * @param parameter angle or phase, {@code null} for non-parametrized gates
 */
public record Gate(String name, List<Integer> targets, List<Integer> controls, Parameter parameter) {

    public Gate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Gate name must not be null or blank");
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("Gate " + name + " needs at least one target");
        }
        targets = List.copyOf(targets);
        controls = controls == null ? List.of() : List.copyOf(controls);

        requireDistinctNonNegative(name, "target", targets);
        requireDistinctNonNegative(name, "control", controls);
        for (Integer control : controls) {
            if (targets.contains(control)) {
                throw new IllegalArgumentException(
                        "Gate " + name + ": qubit " + control + " is both control and target");
            }
        }
    }

    public Gate(String name, List<Integer> targets) {
        this(name, targets, List.of(), null);
    }

    private static void requireDistinctNonNegative(String name, String role, List<Integer> qubits) {
        Set<Integer> seen = new HashSet<>();
        for (Integer qubit : qubits) {
            if (qubit < 0) {
                throw new IllegalArgumentException("Gate " + name + ": negative " + role + " index " + qubit);
            }
            // index + 1 must still be a valid register size
            if (qubit == Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Gate " + name + ": " + role + " index " + qubit + " is too large");
            }
            if (!seen.add(qubit)) {
                throw new IllegalArgumentException("Gate " + name + ": duplicate " + role + " index " + qubit);
            }
        }
    }

    public boolean is(String primitive) {
        return name.equalsIgnoreCase(primitive);
    }

    public boolean isControlled() {
        return !controls.isEmpty();
    }

    public boolean hasParameter() {
        return parameter != null;
    }

    /**
     * @return controls followed by targets
     */
    public List<Integer> qubits() {
        List<Integer> qubits = new ArrayList<>(controls);
        qubits.addAll(targets);
        return qubits;
    }

    /**
     * @return variable names the parameter depends on (empty when unparametrized)
     */
    public Set<String> variables() {
        return parameter == null ? Set.of() : parameter.variables();
    }

    public Gate withTargets(List<Integer> newTargets) {
        return new Gate(name, newTargets, controls, parameter);
    }

    public Gate withControls(List<Integer> newControls) {
        return new Gate(name, targets, newControls, parameter);
    }

    public Gate withParameter(Parameter newParameter) {
        return new Gate(name, targets, controls, newParameter);
    }
}
