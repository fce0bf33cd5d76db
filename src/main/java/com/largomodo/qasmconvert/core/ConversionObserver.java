package com.largomodo.qasmconvert.core;

import java.nio.file.Path;

/**
 * Observer interface for file conversion lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override
 * only the events they care about.
 * </p>
 * <pre>{@code
 * ConversionObserver observer = new ConversionObserver() {
 *     @Override
 *     public void onSuccess(Path file, int gateCount) {
 *         System.out.println("Normalized " + file + " (" + gateCount + " gates)");
 *     }
 * };
 * }</pre>
 *
 * @see QasmProcessor
 */
public interface ConversionObserver {

    /**
     * Called when conversion of a file begins.
     *
     * @param file the QASM file being processed
     */
    default void onStart(Path file) {}

    /**
     * Called when conversion of a file completes successfully.
     *
     * @param file      the QASM file that was processed
     * @param gateCount number of gates read from the file
     */
    default void onSuccess(Path file, int gateCount) {}

    /**
     * Called when conversion of a file fails.
     *
     * @param file the QASM file that failed to process
     * @param e    the exception that caused the failure
     */
    default void onFailure(Path file, Exception e) {}
}
