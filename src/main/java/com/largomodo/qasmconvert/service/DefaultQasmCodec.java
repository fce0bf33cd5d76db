package com.largomodo.qasmconvert.service;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.core.domain.VariableAssignment;
import com.largomodo.qasmconvert.qasm.CommandParser;
import com.largomodo.qasmconvert.qasm.ImportResult;
import com.largomodo.qasmconvert.qasm.PreprocessedProgram;
import com.largomodo.qasmconvert.qasm.QasmExporter;
import com.largomodo.qasmconvert.qasm.QasmPreprocessor;
import com.largomodo.qasmconvert.qasm.UnsupportedVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

/**
 * Default {@link QasmCodec} wiring the basis compiler, exporter, preprocessor and parser.
 * <p>
 * Export: variables checked, circuit compiled with {@link CompilerOptions#EXPORT}
 * (ZX flags overridden per call), then serialized. Import: text cleaned, then parsed.
 * <p>
 * Holds only stateless collaborators. Safe for concurrent use.
 */
public class DefaultQasmCodec implements QasmCodec {

    private static final Logger log = LoggerFactory.getLogger(DefaultQasmCodec.class);

    private final BasisCompiler compiler;
    private final QasmExporter exporter;
    private final QasmPreprocessor preprocessor;
    private final CommandParser parser;

    /**
     * Construct codec with service dependencies.
     */
    public DefaultQasmCodec(BasisCompiler compiler, QasmExporter exporter,
                            QasmPreprocessor preprocessor, CommandParser parser) {
        this.compiler = compiler;
        this.exporter = exporter;
        this.preprocessor = preprocessor;
        this.parser = parser;
    }

    /**
     * Codec with the default implementations.
     */
    public DefaultQasmCodec() {
        this(new DefaultBasisCompiler(), new QasmExporter(), new QasmPreprocessor(), new CommandParser());
    }

    @Override
    public String exportQasm(Circuit circuit, VariableAssignment variables, String version,
                             Path destination, boolean zxCalculus) {
        requireSupportedVersion(version);
        exporter.requireVariables(circuit, variables);

        Circuit compiled = compiler.compile(circuit, CompilerOptions.EXPORT.withZxCalculus(zxCalculus));
        String result = exporter.export(compiled, variables);

        if (destination != null) {
            try (BufferedWriter writer = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
                writer.write(result);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write OpenQASM output to " + destination, e);
            }
            log.debug("Wrote {} gates to {}", compiled.size(), destination);
        }

        return result;
    }

    @Override
    public Circuit importQasm(String qasm, VariableAssignment variables, String version, boolean strict) {
        requireSupportedVersion(version);

        PreprocessedProgram program = preprocessor.clean(qasm, strict);
        Circuit circuit = parser.parse(program);
        log.debug("Imported {} gates on {} qubits", circuit.size(), circuit.qubitCount());
        return circuit;
    }

    @Override
    public Circuit importQasmFile(Path file, VariableAssignment variables, String version, boolean strict)
            throws IOException {
        return importQasm(readFile(file), variables, version, strict);
    }

    @Override
    public ImportResult importQasmFileWithReport(Path file, String version, boolean strict) throws IOException {
        String qasm = readFile(file);
        requireSupportedVersion(version);

        ImportResult result = parser.parseWithReport(preprocessor.clean(qasm, strict));
        log.debug("Imported {} gates, skipped {} statements from {}",
                result.circuit().size(), result.skippedStatements().size(), file.getFileName());
        return result;
    }

    private static String readFile(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.lines().collect(Collectors.joining("\n"));
        }
    }

    private static void requireSupportedVersion(String version) {
        String requested = version == null ? DEFAULT_VERSION : version.strip();
        if (!requested.equals(DEFAULT_VERSION)) {
            throw new UnsupportedVersionException(version);
        }
    }
}
