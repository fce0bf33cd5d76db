package com.largomodo.qasmconvert.qasm;

import com.largomodo.qasmconvert.core.domain.Circuit;

import java.util.List;

/**
 * Circuit read from OpenQASM text together with the statements that produced nothing.
 *
 * @param circuit           the parsed circuit
 * @param skippedStatements unrecognized statements in source order, verbatim (unmodifiable)
 */
public record ImportResult(Circuit circuit, List<String> skippedStatements) {

    public ImportResult {
        if (circuit == null) {
            throw new IllegalArgumentException("circuit must not be null");
        }
        skippedStatements = skippedStatements == null ? List.of() : List.copyOf(skippedStatements);
    }

    /**
     * @return true if every statement was either reconstructed or deliberately ignored
     */
    public boolean isComplete() {
        return skippedStatements.isEmpty();
    }
}
