package com.largomodo.qasmconvert.qasm;

/**
 * Base class for codec failures.
 * <p>
 * RuntimeException enables fail-fast import/export without catch blocks at every call site.
 * Every subclass is surfaced to the caller unchanged; the codec never returns a partially
 * built circuit or program.
 */
public class QasmException extends RuntimeException {

    public QasmException(String message) {
        super(message);
    }

    public QasmException(String message, Throwable cause) {
        super(message, cause);
    }
}
