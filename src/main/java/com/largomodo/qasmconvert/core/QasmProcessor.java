package com.largomodo.qasmconvert.core;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.qasm.ImportResult;
import com.largomodo.qasmconvert.qasm.UnsupportedQasmOperationException;
import com.largomodo.qasmconvert.service.QasmCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Single-file normalization pipeline: import a QASM file, export it again.
 * <p>
 * Output goes to {@code outputDir/<baseName>.qasm}. The output is written by the codec
 * with a scoped writer, so a failed export leaves at most a truncated file and never
 * touches the input.
 * <p>
 * Only files the importer reconstructs completely are rewritten. A file containing any
 * statement the importer would skip fails instead of losing gates.
 */
public class QasmProcessor {

    private static final Logger log = LoggerFactory.getLogger(QasmProcessor.class);

    private final QasmCodec codec;

    public QasmProcessor(QasmCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.codec = codec;
    }

    /**
     * Normalize one file.
     *
     * @param inputFile source QASM file
     * @param outputDir directory receiving the normalized file (created if missing)
     * @param settings  import strictness and export mode
     * @return number of gates read from the input
     * @throws IOException if the input cannot be read, the output cannot be written,
     *                     or the output would overwrite the input
     * @throws UnsupportedQasmOperationException if the input has statements that cannot be reconstructed;
     *                                           nothing is written in that case
     */
    public int processFile(File inputFile, Path outputDir, ConversionSettings settings) throws IOException {
        String baseName = inputFile.getName().replaceFirst("\\.[^.]+$", "");
        if (baseName.isEmpty()) {
            throw new IOException("Cannot extract base name from file: " + inputFile.getName());
        }

        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(baseName + ".qasm");
        if (Files.exists(target) && Files.isSameFile(target, inputFile.toPath())) {
            throw new IOException("Refusing to overwrite input file: " + inputFile);
        }

        log.info("Processing: {}", inputFile.getName());

        ImportResult imported = codec.importQasmFileWithReport(
                inputFile.toPath(), QasmCodec.DEFAULT_VERSION, settings.strict());
        if (!imported.isComplete()) {
            String first = imported.skippedStatements().get(0);
            throw new UnsupportedQasmOperationException(
                    imported.skippedStatements().size() + " statement(s) cannot be reconstructed, first: " + first,
                    first);
        }
        Circuit circuit = imported.circuit();
        log.debug("Read {} gates, {} qubits from {}", circuit.size(), circuit.qubitCount(), inputFile.getName());

        try {
            codec.exportQasm(circuit, null, QasmCodec.DEFAULT_VERSION, target, settings.zxCalculus());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        return circuit.size();
    }
}
