package com.largomodo.qasmconvert.core.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, ordered sequence of gates.
 * <p>
 * Circuits are only ever built by ordered composition: {@link #append(Gate)} and
 * {@link #concat(Circuit)} return new instances and never reorder or deduplicate.
 * <p>
 * {@code declaredWidth} records a register size declared in imported text
 * ({@code qreg q[n];}); it widens {@link #qubitCount()} when the last qubits are idle.
 *
 * @param gates         gates in application order (unmodifiable)
 * @param declaredWidth declared register width, 0 when none was declared
 */
public record Circuit(List<Gate> gates, int declaredWidth) {

    private static final Circuit EMPTY = new Circuit(List.of(), 0);

    public Circuit {
        if (gates == null) {
            throw new IllegalArgumentException("gates must not be null");
        }
        if (declaredWidth < 0) {
            throw new IllegalArgumentException("declaredWidth must not be negative, got: " + declaredWidth);
        }
        gates = List.copyOf(gates);
    }

    public static Circuit empty() {
        return EMPTY;
    }

    public static Circuit of(Gate... gates) {
        return new Circuit(Arrays.asList(gates), 0);
    }

    public static Circuit of(List<Gate> gates) {
        return new Circuit(gates, 0);
    }

    public Circuit append(Gate gate) {
        List<Gate> combined = new ArrayList<>(gates.size() + 1);
        combined.addAll(gates);
        combined.add(gate);
        return new Circuit(combined, declaredWidth);
    }

    public Circuit concat(Circuit other) {
        List<Gate> combined = new ArrayList<>(gates.size() + other.gates.size());
        combined.addAll(gates);
        combined.addAll(other.gates);
        return new Circuit(combined, Math.max(declaredWidth, other.declaredWidth));
    }

    public Circuit withDeclaredWidth(int width) {
        return new Circuit(gates, width);
    }

    /**
     * @return every qubit index referenced by a gate, ascending
     */
    public SortedSet<Integer> qubits() {
        SortedSet<Integer> qubits = new TreeSet<>();
        for (Gate gate : gates) {
            qubits.addAll(gate.qubits());
        }
        return Collections.unmodifiableSortedSet(qubits);
    }

    /**
     * @return highest referenced index + 1, or the declared width if larger
     */
    public int qubitCount() {
        SortedSet<Integer> qubits = qubits();
        int used = qubits.isEmpty() ? 0 : Math.addExact(qubits.last(), 1);
        return Math.max(used, declaredWidth);
    }

    /**
     * @return names of all variables referenced by gate parameters, sorted
     */
    public Set<String> variables() {
        Set<String> variables = new TreeSet<>();
        for (Gate gate : gates) {
            variables.addAll(gate.variables());
        }
        return variables;
    }

    public int size() {
        return gates.size();
    }

    public boolean isEmpty() {
        return gates.isEmpty();
    }
}
