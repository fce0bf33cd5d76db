package com.largomodo.qasmconvert.service;

import com.largomodo.qasmconvert.core.domain.Circuit;

/**
 * Rewrites a circuit into an equivalent one over the primitive gate vocabulary.
 * <p>
 * <b>Contract Guarantees:</b>
 * <ul>
 *   <li>Input circuit remains unmodified (circuits are immutable)</li>
 *   <li>Gate order of the result implements the same unitary, up to global phase</li>
 *   <li>Parameters are carried symbolically; nothing is resolved here</li>
 *   <li>Families whose flag is off pass through unchanged</li>
 * </ul>
 */
public interface BasisCompiler {

    /**
     * @param circuit circuit to rewrite
     * @param options capability flags selecting which rewrites apply
     * @return the rewritten circuit
     */
    Circuit compile(Circuit circuit, CompilerOptions options);
}
