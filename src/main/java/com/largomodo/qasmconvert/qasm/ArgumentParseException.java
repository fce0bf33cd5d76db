package com.largomodo.qasmconvert.qasm;

/**
 * Thrown when a gate argument is not a qubit reference of the form {@code reg[index]}.
 */
public class ArgumentParseException extends QasmException {

    private final String argument;

    public ArgumentParseException(String statement, String argument) {
        super("Cannot parse qubit argument '" + argument + "' in statement: " + statement);
        this.argument = argument;
    }

    public String getArgument() {
        return argument;
    }
}
