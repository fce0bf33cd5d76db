package com.largomodo.qasmconvert.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * OpenQASM source file detection for batch mode.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use when each
 * caller provides independent Path instances.
 */
public class QasmFileMatcher {

    private static final Set<String> EXTENSIONS = Set.of(".qasm", ".qasm2");

    private QasmFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a QASM source file.
     *
     * @param path File path to check (can be null)
     * @return true if path is a regular file with a QASM extension, false otherwise
     */
    public static boolean isQasm(Path path) {
        if (path == null) {
            return false;  // Safe filter predicate semantics (prevents NPE in stream filters)
        }

        if (!Files.isRegularFile(path)) {
            return false;
        }

        String filename = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : EXTENSIONS) {
            if (filename.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
