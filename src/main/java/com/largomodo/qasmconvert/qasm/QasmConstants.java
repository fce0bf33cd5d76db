package com.largomodo.qasmconvert.qasm;

/**
 * Shared constants for OpenQASM 2.0 text.
 * Centralizes the header directives and register names so export and import agree.
 */
public final class QasmConstants {

    public static final String VERSION = "2.0";

    public static final String VERSION_DIRECTIVE = "OPENQASM";

    public static final String HEADER = VERSION_DIRECTIVE + " " + VERSION + ";";

    public static final String STANDARD_INCLUDE = "include \"qelib1.inc\";";

    public static final String QUANTUM_REGISTER = "q";

    public static final String CLASSICAL_REGISTER = "c";

    public static final String LINE_COMMENT = "//";

    /**
     * OpenQASM 2.0 qelib1 gates carry at most two controls (ccx).
     */
    public static final int MAX_CONTROLS = 2;

    private QasmConstants() {
    }
}
