package com.largomodo.qasmconvert.core;

/**
 * Per-run options for {@link QasmProcessor}.
 *
 * @param strict     require OpenQASM header directives on import
 * @param zxCalculus rewrite Y/Ry gates into X/Z equivalents on export
 */
public record ConversionSettings(boolean strict, boolean zxCalculus) {

    public static final ConversionSettings DEFAULT = new ConversionSettings(true, false);
}
