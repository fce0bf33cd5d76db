package com.largomodo.qasmconvert.service;

/**
 * Capability flags requested from a {@link BasisCompiler}.
 * <p>
 * Each flag asks the compiler to rewrite one family of composite gates into the
 * primitive vocabulary. The whole policy is one immutable value; export uses
 * {@link #EXPORT} with the ZX-calculus flags applied through {@link #withZxCalculus(boolean)}.
 */
public record CompilerOptions(
        boolean multitarget,
        boolean multicontrol,
        boolean trotterized,
        boolean generalizedRotation,
        boolean exponentialPauli,
        boolean controlledExponentialPauli,
        boolean hadamardPower,
        boolean controlledPower,
        boolean power,
        boolean toffoli,
        boolean controlledPhase,
        boolean phase,
        boolean phaseToZ,
        boolean controlledRotation,
        boolean swap,
        boolean ccMax,
        boolean gradientMode,
        boolean ryGate,
        boolean yGate
) {

    /**
     * Fixed policy for OpenQASM 2.0 export: every composite form enabled except
     * multicontrol decomposition and gradient mode; Y/Ry kept as-is.
     */
    public static final CompilerOptions EXPORT = new CompilerOptions(
            true,   // multitarget
            false,  // multicontrol
            true,   // trotterized
            true,   // generalizedRotation
            true,   // exponentialPauli
            true,   // controlledExponentialPauli
            true,   // hadamardPower
            true,   // controlledPower
            true,   // power
            true,   // toffoli
            true,   // controlledPhase
            true,   // phase
            true,   // phaseToZ
            true,   // controlledRotation
            true,   // swap
            true,   // ccMax
            false,  // gradientMode
            false,  // ryGate
            false   // yGate
    );

    /**
     * Nothing enabled: the compiler returns its input unchanged.
     */
    public static final CompilerOptions NONE = new CompilerOptions(
            false, false, false, false, false, false, false, false, false, false,
            false, false, false, false, false, false, false, false, false
    );

    /**
     * Override the ZX-calculus flags: when enabled, Y and Ry gates are rewritten into
     * X/Z-axis equivalents for consumers without native Y rotations.
     */
    public CompilerOptions withZxCalculus(boolean zxCalculus) {
        return new CompilerOptions(
                multitarget, multicontrol, trotterized, generalizedRotation, exponentialPauli,
                controlledExponentialPauli, hadamardPower, controlledPower, power, toffoli,
                controlledPhase, phase, phaseToZ, controlledRotation, swap, ccMax, gradientMode,
                zxCalculus, zxCalculus
        );
    }
}
