package com.largomodo.qasmconvert.qasm;

import java.util.Locale;
import java.util.Set;

/**
 * Statement kinds recognized by the importer, keyed by leading keyword.
 * <p>
 * This table is the whole import vocabulary. Export writes a much richer gate set
 * (rotations, phases, controlled gates); anything here marked {@link #UNRECOGNIZED}
 * is read but not reconstructed.
 */
public enum StatementKind {
    /** Produces no gate: {@code barrier}, {@code creg}, {@code measure}, {@code id}, {@code reset}. */
    IGNORED,
    /** {@code qreg name[size]}: sets the declared circuit width. */
    REGISTER,
    /** {@code opaque}, {@code if}: rejected, fatal for the import. */
    REJECTED,
    /** {@code x}, {@code y}, {@code z} on one qubit. */
    SINGLE_QUBIT_GATE,
    /** Invocation of a gate declared by a {@code gate} block. */
    CUSTOM_GATE,
    /** Anything else: skipped. */
    UNRECOGNIZED;

    private static final Set<String> IGNORED_KEYWORDS = Set.of("barrier", "creg", "measure", "id", "reset");
    private static final Set<String> REJECTED_KEYWORDS = Set.of("opaque", "if");
    private static final Set<String> SINGLE_QUBIT_KEYWORDS = Set.of("x", "y", "z");

    /**
     * Classify a statement keyword.
     *
     * @param keyword         leading identifier of the statement
     * @param customGateNames lower-cased names declared by {@code gate} blocks
     */
    public static StatementKind of(String keyword, Set<String> customGateNames) {
        String key = keyword.toLowerCase(Locale.ROOT);
        if (IGNORED_KEYWORDS.contains(key)) {
            return IGNORED;
        }
        if (key.equals("qreg")) {
            return REGISTER;
        }
        if (REJECTED_KEYWORDS.contains(key)) {
            return REJECTED;
        }
        // Custom definitions shadow the builtin x/y/z
        if (customGateNames.contains(key)) {
            return CUSTOM_GATE;
        }
        if (SINGLE_QUBIT_KEYWORDS.contains(key)) {
            return SINGLE_QUBIT_GATE;
        }
        return UNRECOGNIZED;
    }
}
