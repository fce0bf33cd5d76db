package com.largomodo.qasmconvert.qasm;

import com.largomodo.qasmconvert.core.domain.Gate;

/**
 * Thrown when a compiled gate has more controls than OpenQASM 2.0 export supports.
 */
public class UnsupportedControlArityException extends QasmException {

    private final transient Gate gate;

    public UnsupportedControlArityException(Gate gate, int maxControls) {
        super("Multi-controls beyond " + maxControls + " are not supported for OpenQASM 2.0. Gate was: " + gate);
        this.gate = gate;
    }

    public Gate getGate() {
        return gate;
    }
}
