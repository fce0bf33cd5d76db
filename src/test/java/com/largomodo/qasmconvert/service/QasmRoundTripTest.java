package com.largomodo.qasmconvert.service;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.core.domain.Gate;
import com.largomodo.qasmconvert.core.domain.generators.CircuitGenerator;
import com.largomodo.qasmconvert.qasm.UnsupportedControlArityException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties tying export and import together.
 */
class QasmRoundTripTest {

    private final QasmCodec codec = new DefaultQasmCodec();

    @Property
    void pauliCircuitsSurviveRoundTrip(@ForAll("pauliCircuits") Circuit circuit) {
        Circuit back = codec.importQasm(codec.exportQasm(circuit));

        assertEquals(circuit.gates(), back.gates());
    }

    @Property
    void qubitCountSurvivesRoundTrip(@ForAll("circuits") Circuit circuit) {
        Circuit back = codec.importQasm(codec.exportQasm(circuit));

        assertEquals(circuit.qubitCount(), back.qubitCount());
    }

    @Property
    void zxExportImportsAsWell(@ForAll("circuits") Circuit circuit) {
        String qasm = codec.exportQasm(circuit, null, QasmCodec.DEFAULT_VERSION, null, true);

        assertEquals(circuit.qubitCount(), codec.importQasm(qasm).qubitCount());
    }

    @Property
    void moreThanTwoControlsNeverExport(@ForAll @IntRange(min = 3, max = 6) int controlCount) {
        List<Integer> controls = new ArrayList<>();
        for (int i = 0; i < controlCount; i++) {
            controls.add(i);
        }
        Gate gate = new Gate("Z", List.of(controlCount), controls, null);

        assertThrows(UnsupportedControlArityException.class, () -> codec.exportQasm(Circuit.of(gate)));
    }

    @Provide
    Arbitrary<Circuit> pauliCircuits() {
        return CircuitGenerator.pauliCircuits(5);
    }

    @Provide
    Arbitrary<Circuit> circuits() {
        return CircuitGenerator.circuits(4, 2);
    }
}
