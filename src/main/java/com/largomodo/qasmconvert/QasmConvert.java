package com.largomodo.qasmconvert;

import com.largomodo.qasmconvert.core.ConversionObserver;
import com.largomodo.qasmconvert.core.ConversionSettings;
import com.largomodo.qasmconvert.core.QasmProcessor;
import com.largomodo.qasmconvert.service.DefaultQasmCodec;
import com.largomodo.qasmconvert.util.QasmFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * CLI entry point for OpenQASM 2.0 normalization.
 * <p>
 * Every input file is imported and exported again through the codec, so the output
 * is the canonical form the exporter writes. Files with statements the importer cannot
 * reconstruct fail rather than being rewritten without them. Accepts a single positional input path
 * (file or directory) and determines processing mode via runtime inspection.
 * <p>
 * Smart defaults:
 * - File input without -o: outputs to current working directory
 * - Directory input without -o: outputs to <input>/output subdirectory
 * - Explicit -o flag: overrides all defaults
 */
@Command(
        name = "qasmconvert",
        mixinStandardHelpOptions = true,
        resourceBundle = "qasmconvert.qasmconvert",
        version = "${bundle:application.version}",
        header = "Normalizes OpenQASM 2.0 circuit files.",
        description = {
                "Reads OpenQASM 2.0 programs (.qasm) into circuits and writes them back in canonical form.",
                "",
                "Only x, y and z gates are reconstructed on import. Files containing other gates fail",
                "instead of being rewritten without them.",
                "It supports recursive directory processing and batch conversion."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, malformed program, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Cross et al., Open Quantum Assembly Language, arXiv:1707.03429",
                "",
                "Project home: ${bundle:application.url}"
        }
)
public class QasmConvert implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(QasmConvert.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = {
                    "The source .qasm file to convert, or a directory to process.",
                    "If a directory is provided, the tool scans it recursively for .qasm files and " +
                            "converts them in batch mode, preserving the directory structure."
            })
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory for normalized files.",
                    "If omitted, defaults apply:",
                    "  - Single file input: Defaults to the current directory ('.').",
                    "  - Directory input: Defaults to a folder named 'output' inside the input directory.",
                    "Necessary subdirectories will be created automatically."
            })
    File outputDir;

    @Option(names = "--lenient",
            description = "Accept programs without the OPENQASM directive or the qelib1.inc include.")
    boolean lenient;

    @Option(names = "--zx",
            description = "Rewrite Y and Ry gates into X/Z equivalents for ZX-calculus tools.")
    boolean zxCalculus;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new QasmConvert());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    private static QasmProcessor createProcessor() {
        return new QasmProcessor(new DefaultQasmCodec());
    }

    /**
     * Execute batch processing with concurrent execution and fail-soft error handling.
     * <p>
     * Fixed thread pool sized to CPU cores, bounded queue, CallerRunsPolicy to throttle
     * submission. Files below the output directory are skipped so that repeated runs do
     * not pick up their own output.
     */
    private static void runBatch(Config config) throws IOException {
        Path inputRoot = Paths.get(config.inputDir);
        Path outputRoot = Paths.get(config.outputDir);

        QasmProcessor processor = createProcessor();

        int coreCount = Runtime.getRuntime().availableProcessors();
        ExecutorService executor = new ThreadPoolExecutor(
                coreCount,
                coreCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * coreCount),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        final AtomicInteger successCount = new AtomicInteger(0);
        final AtomicInteger failCount = new AtomicInteger(0);

        ConversionObserver observer = new ConversionObserver() {
            @Override
            public void onSuccess(Path file, int gateCount) {
                successCount.incrementAndGet();
            }

            @Override
            public void onFailure(Path file, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(file), e.getMessage());
            }
        };

        // Shutdown hook for graceful SIGINT handling
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!executor.isShutdown()) {
                log.info("Interrupt received, shutting down gracefully...");
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                }
            }
        }));

        try (Stream<Path> stream = Files.walk(inputRoot)) {
            stream.filter(path -> !path.startsWith(outputRoot))
                    .filter(path -> {
                        try {
                            return QasmFileMatcher.isQasm(path);
                        } catch (UncheckedIOException e) {
                            // File attributes unreadable (broken symlink, permission denied on file)
                            log.warn("WARNING: Cannot access {} - skipping", inputRoot.relativize(path));
                            return false;
                        }
                    })
                    .forEach(qasmPath -> executor.submit(() -> {
                        try {
                            MDC.put("file", qasmPath.getFileName().toString());
                            Path relativePath = inputRoot.relativize(qasmPath.getParent());
                            Path targetDir = outputRoot.resolve(relativePath);

                            observer.onStart(qasmPath);
                            int gateCount = processor.processFile(qasmPath.toFile(), targetDir, config.settings);
                            observer.onSuccess(qasmPath, gateCount);
                        } catch (Exception e) {
                            // Catch all exceptions to prevent worker thread death (batch continues)
                            observer.onFailure(qasmPath, e);
                        } finally {
                            MDC.clear();
                        }
                        return null;
                    }));
        } catch (UncheckedIOException e) {
            log.error("WARNING: Directory traversal interrupted - {}", e.getCause().getMessage());
            log.error("Batch incomplete: {} successful, {} failed, some directories skipped",
                    successCount.get(), failCount.get());
            return;
        } catch (IOException e) {
            log.error("ERROR: Cannot traverse input directory: {}", e.getMessage());
            return;
        } finally {
            // Two-phase shutdown: graceful then forceful
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Batch complete: {} successful, {} failed", successCount.get(), failCount.get());
    }

    /**
     * Execute single-file processing with fail-fast error handling.
     * <p>
     * Exceptions propagate to picocli (exit code 1).
     *
     * @param config     Configuration containing the input file path
     * @param outputBase Directory where output will be written
     * @throws IOException if input file validation fails or processing encounters I/O error
     */
    private static void runSingleFile(Config config, Path outputBase) throws IOException {
        Path inputPath = Paths.get(config.inputFile);

        if (!Files.exists(inputPath)) {
            throw new IOException("Input file does not exist: " + inputPath);
        }

        if (!Files.isRegularFile(inputPath)) {
            throw new IOException("Input path is not a file: " + inputPath);
        }

        int gateCount = createProcessor().processFile(inputPath.toFile(), outputBase, config.settings);

        log.info("Conversion complete: {} ({} gates)", inputPath.getFileName(), gateCount);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }

        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }

        if (outputDir == null) {
            if (inputPath.isFile()) {
                outputDir = new File(".");
            } else {
                outputDir = new File(inputPath, "output");
            }
        }

        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (outputDir.exists() && !outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }

        Files.createDirectories(outputDir.toPath());

        ConversionSettings settings = new ConversionSettings(!lenient, zxCalculus);
        if (inputPath.isFile()) {
            runSingleFile(
                    new Config(null, outputDir.getAbsolutePath(), settings, inputPath.getAbsolutePath()),
                    outputDir.toPath()
            );
        } else {
            runBatch(
                    new Config(inputPath.getAbsolutePath(), outputDir.getAbsolutePath(), settings, null)
            );
        }

        return 0;
    }

    /**
     * Bridges Picocli field-based arguments to runBatch/runSingleFile method signatures.
     */
    private record Config(String inputDir, String outputDir, ConversionSettings settings, String inputFile) {
    }
}
