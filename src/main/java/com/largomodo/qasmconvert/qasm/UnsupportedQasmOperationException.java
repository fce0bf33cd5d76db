package com.largomodo.qasmconvert.qasm;

/**
 * Thrown when an import meets a statement the parser refuses to interpret
 * ({@code opaque}, {@code if}, calls to custom gates, nested gate bodies, ...).
 * <p>
 * Fatal for the whole import.
 */
public class UnsupportedQasmOperationException extends QasmException {

    private final String statement;

    public UnsupportedQasmOperationException(String statement) {
        this("Unsupported operation " + statement, statement);
    }

    public UnsupportedQasmOperationException(String message, String statement) {
        super(message);
        this.statement = statement;
    }

    /**
     * @return the offending statement, verbatim
     */
    public String getStatement() {
        return statement;
    }
}
