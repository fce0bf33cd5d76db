package com.largomodo.qasmconvert.qasm;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.core.domain.Gate;
import com.largomodo.qasmconvert.core.domain.VariableAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Serializes a basis-compiled circuit as an OpenQASM 2.0 program.
 * <p>
 * Output layout:
 * <pre>
 * OPENQASM 2.0;
 * include "qelib1.inc";
 * qreg q[n];
 * creg c[n];
 * &lt;one statement per gate target&gt;
 * </pre>
 * A gate token is one {@code c} per control followed by the lower-cased gate name and,
 * for parametrized gates, the resolved value in parentheses. Gates with several targets
 * are written as one statement per target, each listing every control and then that target;
 * targets are never grouped.
 * <p>
 * Stateless. Safe for concurrent use.
 */
public class QasmExporter {

    /**
     * Fail unless every variable referenced by {@code circuit} can be resolved.
     *
     * @param circuit   circuit about to be exported
     * @param variables assignment, may be {@code null}
     * @throws MissingVariablesException naming all variables (no assignment) or the missing ones
     */
    public void requireVariables(Circuit circuit, VariableAssignment variables) {
        Set<String> referenced = circuit.variables();
        if (referenced.isEmpty()) {
            return;
        }
        if (variables == null) {
            throw new MissingVariablesException(referenced);
        }
        Set<String> missing = variables.missing(referenced);
        if (!missing.isEmpty()) {
            throw new MissingVariablesException(missing);
        }
    }

    /**
     * Write the program text for an already compiled circuit.
     *
     * @param compiled  circuit restricted to the primitive vocabulary
     * @param variables values for parametrized gates, may be {@code null} for unparametrized circuits
     * @return OpenQASM 2.0 source, newline terminated
     * @throws MissingVariablesException        if a parameter cannot be resolved
     * @throws UnsupportedControlArityException if a gate has more than {@link QasmConstants#MAX_CONTROLS} controls
     */
    public String export(Circuit compiled, VariableAssignment variables) {
        requireVariables(compiled, variables);
        VariableAssignment resolved = variables == null ? VariableAssignment.empty() : variables;

        int width = compiled.qubitCount();
        Map<Integer, String> qubitNames = nameQubits(compiled);

        StringBuilder result = new StringBuilder();
        result.append(QasmConstants.HEADER).append('\n');
        result.append(QasmConstants.STANDARD_INCLUDE).append('\n');
        result.append("qreg ").append(QasmConstants.QUANTUM_REGISTER).append('[').append(width).append("];\n");
        result.append("creg ").append(QasmConstants.CLASSICAL_REGISTER).append('[').append(width).append("];\n");

        for (Gate gate : compiled.gates()) {
            if (gate.controls().size() > QasmConstants.MAX_CONTROLS) {
                throw new UnsupportedControlArityException(gate, QasmConstants.MAX_CONTROLS);
            }

            String token = gateToken(gate, resolved);
            List<String> controlNames = new ArrayList<>(gate.controls().size());
            for (Integer control : gate.controls()) {
                controlNames.add(qubitNames.get(control));
            }

            for (Integer target : gate.targets()) {
                List<String> arguments = new ArrayList<>(controlNames);
                arguments.add(qubitNames.get(target));
                result.append(token).append(' ').append(String.join(",", arguments)).append(";\n");
            }
        }

        return result.toString();
    }

    /**
     * Build {@code c...c<name>[(<value>)]} for a gate.
     */
    String gateToken(Gate gate, VariableAssignment variables) {
        StringBuilder token = new StringBuilder();
        token.append("c".repeat(gate.controls().size()));
        token.append(gate.name().toLowerCase(Locale.ROOT));

        if (gate.hasParameter()) {
            double value = gate.parameter().evaluate(variables);
            if (!Double.isFinite(value)) {
                throw new QasmException("Parameter of gate " + gate.name() + " resolved to " + value);
            }
            token.append('(').append(value).append(')');
        }
        return token.toString();
    }

    private static Map<Integer, String> nameQubits(Circuit circuit) {
        Map<Integer, String> names = new TreeMap<>();
        for (Integer qubit : circuit.qubits()) {
            names.put(qubit, QasmConstants.QUANTUM_REGISTER + "[" + qubit + "]");
        }
        return names;
    }
}
