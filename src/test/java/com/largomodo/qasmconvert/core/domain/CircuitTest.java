package com.largomodo.qasmconvert.core.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CircuitTest {

    @Test
    void testEmptyCircuitHasNoQubits() {
        Circuit circuit = Circuit.empty();
        assertTrue(circuit.isEmpty());
        assertEquals(0, circuit.qubitCount());
        assertTrue(circuit.qubits().isEmpty());
    }

    @Test
    void testAppendKeepsOrderAndDoesNotMutate() {
        Circuit first = Circuit.empty().append(Gates.x(0));
        Circuit second = first.append(Gates.x(0));

        assertEquals(1, first.size());
        assertEquals(List.of(Gates.x(0), Gates.x(0)), second.gates(), "No deduplication");
    }

    @Test
    void testConcatAppendsInOrder() {
        Circuit a = Circuit.of(Gates.x(0), Gates.y(1));
        Circuit b = Circuit.of(Gates.z(2));

        assertEquals(List.of(Gates.x(0), Gates.y(1), Gates.z(2)), a.concat(b).gates());
        assertEquals(List.of(Gates.z(2), Gates.x(0), Gates.y(1)), b.concat(a).gates());
    }

    @Test
    void testQubitCountIsHighestIndexPlusOne() {
        Circuit circuit = Circuit.of(Gates.x(5), Gates.cnot(1, 2));
        assertEquals(Set.of(1, 2, 5), circuit.qubits());
        assertEquals(6, circuit.qubitCount());
    }

    @Test
    void testQubitCountAtLargestIndex() {
        Circuit circuit = Circuit.of(Gates.z(Integer.MAX_VALUE - 1));

        assertEquals(Integer.MAX_VALUE, circuit.qubitCount());
    }

    @Test
    void testDeclaredWidthWidensQubitCount() {
        Circuit circuit = Circuit.of(Gates.x(0)).withDeclaredWidth(4);
        assertEquals(4, circuit.qubitCount());
        assertEquals(Set.of(0), circuit.qubits());

        Circuit narrower = Circuit.of(Gates.x(7)).withDeclaredWidth(2);
        assertEquals(8, narrower.qubitCount());
    }

    @Test
    void testConcatKeepsLargestDeclaredWidth() {
        Circuit a = Circuit.empty().withDeclaredWidth(3);
        Circuit b = Circuit.empty().withDeclaredWidth(5);
        assertEquals(5, a.concat(b).declaredWidth());
        assertEquals(3, a.append(Gates.x(0)).declaredWidth());
    }

    @Test
    void testVariablesAreCollectedSorted() {
        Circuit circuit = Circuit.of(
                Gates.rz(Parameter.variable("b"), 0),
                Gates.rx(Parameter.variable("a").scale(2), 1),
                Gates.rz(Parameter.constant(0.5), 0)
        );
        assertEquals(List.of("a", "b"), List.copyOf(circuit.variables()));
    }

    @Test
    void testRejectsNegativeDeclaredWidth() {
        assertThrows(IllegalArgumentException.class, () -> Circuit.empty().withDeclaredWidth(-1));
    }
}
