package com.largomodo.qasmconvert.qasm;

/**
 * Thrown when import or export is requested for an OpenQASM version other than 2.0.
 */
public class UnsupportedVersionException extends QasmException {

    public UnsupportedVersionException(String version) {
        super("Unsupported OpenQASM version : " + version);
    }
}
