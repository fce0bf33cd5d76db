package com.largomodo.qasmconvert.qasm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical cleanup of OpenQASM 2.0 source before statement parsing.
 * <p>
 * Steps:
 * <ol>
 *   <li>Truncate every line at the first {@code //}, trim, drop empty lines</li>
 *   <li>Consume the {@code OPENQASM 2.0;} directive, then the {@code include "qelib1.inc";} line</li>
 *   <li>Cut every {@code gate ... { ... }} block out of the statement stream</li>
 * </ol>
 * <p>
 * <b>Strictness:</b> in strict mode a missing or wrong directive is a {@link MalformedHeaderException}.
 * In lenient mode a line that is not the expected directive is left in place and parsing
 * continues from it.
 * <p>
 * <b>Known limitation:</b> a gate block ends at the first {@code }} after its keyword. Blocks
 * containing nested braces are rejected instead of being cut at the wrong place.
 * <p>
 * Stateless. Safe for concurrent use.
 */
public class QasmPreprocessor {

    private static final Logger log = LoggerFactory.getLogger(QasmPreprocessor.class);

    private static final Pattern VERSION_DIRECTIVE =
            Pattern.compile("^" + QasmConstants.VERSION_DIRECTIVE + "\\s+([^;\\s]+)\\s*;");

    // "gate" as a whole word followed by whitespace; excludes identifiers such as "mygate"
    private static final Pattern GATE_KEYWORD = Pattern.compile("(?<![A-Za-z0-9_])gate\\s+([A-Za-z_][A-Za-z0-9_]*)?");

    /**
     * Clean program text.
     *
     * @param text   raw OpenQASM source
     * @param strict require both header directives
     * @return statement text and located custom gate blocks
     * @throws MalformedHeaderException          strict mode only, missing or incorrect directive
     * @throws UnsupportedQasmOperationException for unterminated, body-less or nested gate blocks
     */
    public PreprocessedProgram clean(String text, boolean strict) {
        if (text == null) {
            throw new IllegalArgumentException("QASM text must not be null");
        }

        List<String> lines = stripComments(text);
        consumeVersionDirective(lines, strict);
        consumeStandardInclude(lines, strict);

        return extractCustomGates(String.join("\n", lines));
    }

    private static List<String> stripComments(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            int comment = line.indexOf(QasmConstants.LINE_COMMENT);
            String clean = (comment >= 0 ? line.substring(0, comment) : line).strip();
            if (!clean.isEmpty()) {
                lines.add(clean);
            }
        }
        return lines;
    }

    private static void consumeVersionDirective(List<String> lines, boolean strict) {
        String first = lines.isEmpty() ? "" : lines.get(0);

        if (!first.startsWith(QasmConstants.VERSION_DIRECTIVE)) {
            if (strict) {
                throw new MalformedHeaderException(
                        "File must start with the '" + QasmConstants.VERSION_DIRECTIVE + "' directive");
            }
            log.debug("No {} directive, continuing without it", QasmConstants.VERSION_DIRECTIVE);
            return;
        }

        Matcher matcher = VERSION_DIRECTIVE.matcher(first);
        if (!matcher.find()) {
            if (strict) {
                throw new MalformedHeaderException("Malformed version directive: " + first);
            }
            log.warn("Ignoring malformed version directive: {}", first);
            lines.remove(0);
            return;
        }

        String version = matcher.group(1);
        if (!isSupportedVersion(version)) {
            if (strict) {
                throw new MalformedHeaderException("Unsupported OpenQASM version in directive: " + first);
            }
            log.warn("Reading OpenQASM {} source as {}", version, QasmConstants.VERSION);
        }
        replaceWithRemainder(lines, matcher.end());
    }

    private static void consumeStandardInclude(List<String> lines, boolean strict) {
        String next = lines.isEmpty() ? "" : lines.get(0);

        if (!next.startsWith(QasmConstants.STANDARD_INCLUDE)) {
            if (strict) {
                throw new MalformedHeaderException("File must import standard library");
            }
            log.debug("No standard library include, continuing without it");
            return;
        }
        replaceWithRemainder(lines, QasmConstants.STANDARD_INCLUDE.length());
    }

    /**
     * Drop the consumed directive from the first line, keeping statements that follow it on the same line.
     */
    private static void replaceWithRemainder(List<String> lines, int consumed) {
        String remainder = lines.get(0).substring(consumed).strip();
        if (remainder.isEmpty()) {
            lines.remove(0);
        } else {
            lines.set(0, remainder);
        }
    }

    private static boolean isSupportedVersion(String version) {
        return version.equals(QasmConstants.VERSION) || version.equals("2");
    }

    private static PreprocessedProgram extractCustomGates(String code) {
        List<CustomGateDefinition> definitions = new ArrayList<>();
        StringBuilder body = new StringBuilder(code);

        int from = 0;
        while (true) {
            Matcher matcher = GATE_KEYWORD.matcher(body);
            if (!matcher.find(from)) {
                break;
            }
            int start = matcher.start();
            int close = body.indexOf("}", start);
            if (close < 0) {
                throw new UnsupportedQasmOperationException(
                        "Unterminated gate definition: " + body.substring(start), body.substring(start));
            }

            String block = body.substring(start, close + 1);
            int open = block.indexOf('{');
            if (open < 0) {
                throw new UnsupportedQasmOperationException("Gate definition without body: " + block, block);
            }
            if (block.indexOf('{', open + 1) >= 0) {
                throw new UnsupportedQasmOperationException(
                        "Nested braces in gate definitions are not supported: " + block, block);
            }
            if (matcher.group(1) == null) {
                throw new UnsupportedQasmOperationException("Gate definition without a name: " + block, block);
            }

            CustomGateDefinition definition = new CustomGateDefinition(matcher.group(1), block);
            definitions.add(definition);
            log.debug("Discarding body of custom gate '{}'", definition.name());

            body.delete(start, close + 1);
            from = start;
        }

        return new PreprocessedProgram(body.toString(), definitions);
    }
}
