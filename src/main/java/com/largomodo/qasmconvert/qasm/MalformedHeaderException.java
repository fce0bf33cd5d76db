package com.largomodo.qasmconvert.qasm;

/**
 * Thrown by strict import when the version directive or the standard library include is missing.
 */
public class MalformedHeaderException extends QasmException {

    public MalformedHeaderException(String message) {
        super(message);
    }
}
