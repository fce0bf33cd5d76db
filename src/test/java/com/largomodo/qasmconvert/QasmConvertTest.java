package com.largomodo.qasmconvert;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParameterException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for QasmConvert CLI argument parsing and end-to-end runs.
 * <p>
 * Tests use CommandLine.parseArgs() to populate QasmConvert fields directly.
 */
class QasmConvertTest {

    private static final String PROGRAM = """
            OPENQASM 2.0;
            include "qelib1.inc";
            qreg q[2];
            creg c[2];
            x q[0];
            y q[1];
            """;

    @TempDir
    Path tempDir;

    @Test
    void testPositionalParameterFile() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("bell.qasm"));

        QasmConvert qasmConvert = new QasmConvert();
        new CommandLine(qasmConvert).parseArgs(testFile.toAbsolutePath().toString());

        assertEquals(testFile.toAbsolutePath().toString(), qasmConvert.inputPath.getAbsolutePath());
        assertFalse(qasmConvert.lenient);
        assertFalse(qasmConvert.zxCalculus);
    }

    @Test
    void testFlagsAreParsed() throws IOException {
        Path testFile = Files.createFile(tempDir.resolve("bell.qasm"));
        Path outDir = tempDir.resolve("out");

        QasmConvert qasmConvert = new QasmConvert();
        new CommandLine(qasmConvert).parseArgs("--lenient", "--zx", "-o", outDir.toString(), testFile.toString());

        assertTrue(qasmConvert.lenient);
        assertTrue(qasmConvert.zxCalculus);
        assertEquals(outDir.toFile().getAbsolutePath(), qasmConvert.outputDir.getAbsolutePath());
    }

    @Test
    void testMissingInputIsUsageError() {
        assertThrows(ParameterException.class, () -> new CommandLine(new QasmConvert()).parseArgs());
    }

    @Test
    void testSmartDefaultOutputForFile() throws IOException {
        // Headerless input fails in strict mode before anything is written
        Path testFile = tempDir.resolve("bad.qasm");
        Files.writeString(testFile, "x q[0];");

        QasmConvert qasmConvert = new QasmConvert();
        new CommandLine(qasmConvert).parseArgs(testFile.toAbsolutePath().toString());

        assertNull(qasmConvert.outputDir, "outputDir should be null until call() computes smart defaults");

        assertThrows(Exception.class, qasmConvert::call);

        assertEquals(new File(".").getCanonicalPath(), qasmConvert.outputDir.getCanonicalPath(),
                "File input should default outputDir to current directory");
    }

    @Test
    void testSmartDefaultOutputForDirectory() throws Exception {
        Path inputDir = Files.createDirectory(tempDir.resolve("circuits"));

        QasmConvert qasmConvert = new QasmConvert();
        new CommandLine(qasmConvert).parseArgs(inputDir.toAbsolutePath().toString());
        qasmConvert.call();

        assertEquals(inputDir.resolve("output").toFile().getCanonicalPath(), qasmConvert.outputDir.getCanonicalPath());
        assertTrue(Files.isDirectory(inputDir.resolve("output")));
    }

    @Test
    void testNonexistentInputExitsWithUsageCode() {
        int exitCode = new CommandLine(new QasmConvert()).execute(tempDir.resolve("missing.qasm").toString());

        assertEquals(2, exitCode);
    }

    @Test
    void testOutputPathThatIsAFileIsRejected() throws IOException {
        Path input = tempDir.resolve("bell.qasm");
        Files.writeString(input, PROGRAM);
        Path notADir = Files.createFile(tempDir.resolve("occupied"));

        int exitCode = new CommandLine(new QasmConvert()).execute(input.toString(), "-o", notADir.toString());

        assertEquals(2, exitCode);
    }

    @Test
    void testSingleFileConversion() throws IOException {
        Path input = tempDir.resolve("bell.qasm");
        Files.writeString(input, PROGRAM);
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute(input.toString(), "-o", outDir.toString());

        assertEquals(0, exitCode);
        assertEquals(PROGRAM, Files.readString(outDir.resolve("bell.qasm")));
    }

    @Test
    void testZxFlagRewritesY() throws IOException {
        Path input = tempDir.resolve("bell.qasm");
        Files.writeString(input, PROGRAM);
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute("--zx", input.toString(), "-o", outDir.toString());

        assertEquals(0, exitCode);
        String output = Files.readString(outDir.resolve("bell.qasm"));
        assertFalse(output.contains("y q[1];"), output);
        assertTrue(output.contains("x q[0];"));
    }

    @Test
    void testStrictFailureExitsWithOne() throws IOException {
        Path input = tempDir.resolve("bare.qasm");
        Files.writeString(input, "qreg q[1];\nx q[0];\n");

        int exitCode = new CommandLine(new QasmConvert()).execute(input.toString(), "-o", tempDir.resolve("out").toString());

        assertEquals(1, exitCode);
    }

    @Test
    void testLenientAcceptsHeaderlessFile() throws IOException {
        Path input = tempDir.resolve("bare.qasm");
        Files.writeString(input, "qreg q[1];\nx q[0];\n");
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute("--lenient", input.toString(), "-o", outDir.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.readString(outDir.resolve("bare.qasm")).startsWith("OPENQASM 2.0;\ninclude \"qelib1.inc\";\n"));
    }

    @Test
    void testFileWithUnsupportedGatesExitsWithOne() throws IOException {
        Path input = tempDir.resolve("circuit.qasm");
        Files.writeString(input, PROGRAM + "h q[0];\ncx q[0],q[1];\n");
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute(input.toString(), "-o", outDir.toString());

        assertEquals(1, exitCode);
        assertFalse(Files.exists(outDir.resolve("circuit.qasm")));
    }

    @Test
    void testBatchFailsFilesWithUnsupportedGates() throws IOException {
        Path inputDir = Files.createDirectory(tempDir.resolve("in"));
        Files.writeString(inputDir.resolve("good.qasm"), PROGRAM);
        Files.writeString(inputDir.resolve("lossy.qasm"), PROGRAM + "rz(0.5) q[1];\n");
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute(inputDir.toString(), "-o", outDir.toString());

        assertEquals(0, exitCode, "Batch mode is fail-soft");
        assertTrue(Files.exists(outDir.resolve("good.qasm")));
        assertFalse(Files.exists(outDir.resolve("lossy.qasm")));
    }

    @Test
    void testBatchPreservesDirectoryStructure() throws IOException {
        Path inputDir = Files.createDirectory(tempDir.resolve("in"));
        Path nested = Files.createDirectories(inputDir.resolve("a").resolve("b"));
        Files.writeString(inputDir.resolve("top.qasm"), PROGRAM);
        Files.writeString(nested.resolve("deep.qasm2"), PROGRAM);
        Files.writeString(nested.resolve("readme.txt"), "not a circuit");
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute(inputDir.toString(), "-o", outDir.toString());

        assertEquals(0, exitCode);
        assertTrue(Files.exists(outDir.resolve("top.qasm")));
        assertTrue(Files.exists(outDir.resolve("a").resolve("b").resolve("deep.qasm")));
        assertFalse(Files.exists(outDir.resolve("a").resolve("b").resolve("readme.txt")));
    }

    @Test
    void testBatchContinuesAfterFailure() throws IOException {
        Path inputDir = Files.createDirectory(tempDir.resolve("in"));
        Files.writeString(inputDir.resolve("good.qasm"), PROGRAM);
        Files.writeString(inputDir.resolve("bad.qasm"), PROGRAM + "if(c==1) x q[0];\n");
        Path outDir = tempDir.resolve("out");

        int exitCode = new CommandLine(new QasmConvert()).execute(inputDir.toString(), "-o", outDir.toString());

        assertEquals(0, exitCode, "Batch mode is fail-soft");
        assertTrue(Files.exists(outDir.resolve("good.qasm")));
        assertFalse(Files.exists(outDir.resolve("bad.qasm")));
    }

    @Test
    void testBatchSkipsItsOwnOutputDirectory() throws Exception {
        Path inputDir = Files.createDirectory(tempDir.resolve("in"));
        Files.writeString(inputDir.resolve("top.qasm"), PROGRAM);

        assertEquals(0, new CommandLine(new QasmConvert()).execute(inputDir.toString()));
        assertEquals(0, new CommandLine(new QasmConvert()).execute(inputDir.toString()));

        assertTrue(Files.exists(inputDir.resolve("output").resolve("top.qasm")));
        assertFalse(Files.exists(inputDir.resolve("output").resolve("output")));
    }
}
