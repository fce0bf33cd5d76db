package com.largomodo.qasmconvert.service;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.core.domain.VariableAssignment;
import com.largomodo.qasmconvert.qasm.ImportResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry points for OpenQASM interchange.
 * <p>
 * Bridges to other circuit representations go through these methods only; the
 * preprocessor, parser and exporter behind them are implementation details.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Callers receive a complete artifact or a {@link com.largomodo.qasmconvert.qasm.QasmException},
 *       never a partial one</li>
 *   <li>Only OpenQASM {@value #DEFAULT_VERSION} is supported; other versions raise
 *       {@link com.largomodo.qasmconvert.qasm.UnsupportedVersionException}</li>
 *   <li>Inputs are never modified</li>
 * </ul>
 */
public interface QasmCodec {

    String DEFAULT_VERSION = "2.0";

    /**
     * Compile and serialize a circuit.
     *
     * @param circuit     circuit to export
     * @param variables   values for parametrized gates, {@code null} if the circuit has none
     * @param version     OpenQASM version, {@value #DEFAULT_VERSION}
     * @param destination file to write the program to, or {@code null}
     * @param zxCalculus  rewrite Y and Ry gates into X/Z equivalents
     * @return the program text
     * @throws java.io.UncheckedIOException if writing {@code destination} fails
     */
    String exportQasm(Circuit circuit, VariableAssignment variables, String version,
                      Path destination, boolean zxCalculus);

    default String exportQasm(Circuit circuit, VariableAssignment variables) {
        return exportQasm(circuit, variables, DEFAULT_VERSION, null, false);
    }

    default String exportQasm(Circuit circuit) {
        return exportQasm(circuit, null);
    }

    /**
     * Parse program text into a circuit.
     *
     * @param qasm      OpenQASM source
     * @param variables accepted for symmetry with export; imported gates carry no parameters
     * @param version   OpenQASM version, {@value #DEFAULT_VERSION}
     * @param strict    require the version directive and the standard library include
     * @return the circuit
     */
    Circuit importQasm(String qasm, VariableAssignment variables, String version, boolean strict);

    default Circuit importQasm(String qasm, boolean strict) {
        return importQasm(qasm, null, DEFAULT_VERSION, strict);
    }

    default Circuit importQasm(String qasm) {
        return importQasm(qasm, true);
    }

    /**
     * Read a file and parse it as in {@link #importQasm(String, VariableAssignment, String, boolean)}.
     *
     * @throws IOException if the file cannot be read
     */
    Circuit importQasmFile(Path file, VariableAssignment variables, String version, boolean strict)
            throws IOException;

    default Circuit importQasmFile(Path file, boolean strict) throws IOException {
        return importQasmFile(file, null, DEFAULT_VERSION, strict);
    }

    /**
     * Read a file like {@link #importQasmFile(Path, VariableAssignment, String, boolean)}, also
     * reporting the statements that were skipped because they cannot be reconstructed.
     *
     * @throws IOException if the file cannot be read
     */
    ImportResult importQasmFileWithReport(Path file, String version, boolean strict) throws IOException;
}
