package com.largomodo.qasmconvert.qasm;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.core.domain.Gate;
import com.largomodo.qasmconvert.core.domain.Gates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns preprocessed OpenQASM statements into a {@link Circuit}.
 * <p>
 * Each {@code ;}-terminated statement is parsed on its own and dispatched on its leading
 * keyword through {@link StatementKind}. Gates are folded into the circuit in statement order.
 * <p>
 * <b>Vocabulary:</b> only {@code x}, {@code y} and {@code z} become gates, and only their
 * target is read: parameters, controls and register names are not reconstructed.
 * Unrecognized statements (including every other qelib1 gate) are skipped with a warning.
 * <p>
 * Stateless. Safe for concurrent use.
 */
public class CommandParser {

    private static final Logger log = LoggerFactory.getLogger(CommandParser.class);

    private static final Pattern KEYWORD = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)");

    // Only the exact shape reg[index] is accepted
    private static final Pattern QUBIT_REFERENCE = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*\\[\\s*([0-9]+)\\s*]$");

    /**
     * Parse all statements of a program.
     *
     * @param program output of {@link QasmPreprocessor#clean(String, boolean)}
     * @return circuit with one gate per recognized gate statement
     * @throws UnsupportedQasmOperationException for {@code opaque}, {@code if}, custom gate calls
     *                                           or a second {@code qreg}
     * @throws ArgumentParseException            if a gate argument is not {@code reg[index]}
     */
    public Circuit parse(PreprocessedProgram program) {
        return parseWithReport(program).circuit();
    }

    /**
     * Parse as {@link #parse(PreprocessedProgram)}, also reporting the unrecognized statements
     * that were skipped.
     */
    public ImportResult parseWithReport(PreprocessedProgram program) {
        Set<String> customGates = program.customGateNames();
        Circuit circuit = Circuit.empty();
        List<String> skipped = new ArrayList<>();
        boolean registerDeclared = false;

        for (String statement : splitStatements(program.body())) {
            String keyword = keyword(statement);
            StatementKind kind = StatementKind.of(keyword, customGates);

            switch (kind) {
                case IGNORED -> log.trace("Ignoring statement: {}", statement);
                case REGISTER -> {
                    if (registerDeclared) {
                        throw new UnsupportedQasmOperationException(
                                "Multiple quantum registers are not supported: " + statement, statement);
                    }
                    registerDeclared = true;
                    circuit = circuit.withDeclaredWidth(parseRegisterSize(statement));
                }
                case REJECTED -> throw new UnsupportedQasmOperationException(statement);
                case CUSTOM_GATE -> throw new UnsupportedQasmOperationException(
                        "Custom gate '" + keyword + "' is declared but custom gates cannot be invoked: " + statement,
                        statement);
                case SINGLE_QUBIT_GATE -> circuit = circuit.append(parseSingleQubitGate(keyword, statement));
                case UNRECOGNIZED -> {
                    log.warn("Skipping unsupported statement: {}", statement);
                    skipped.add(statement);
                }
            }
        }

        return new ImportResult(circuit, skipped);
    }

    static List<String> splitStatements(String body) {
        List<String> statements = new ArrayList<>();
        for (String part : body.split(";")) {
            String statement = part.strip();
            if (!statement.isEmpty()) {
                statements.add(statement);
            }
        }
        return statements;
    }

    /**
     * @return the leading identifier, without any parenthesized parameter list
     */
    static String keyword(String statement) {
        Matcher matcher = KEYWORD.matcher(statement);
        return matcher.find() ? matcher.group(1) : statement.split("\\s+", 2)[0];
    }

    private static Gate parseSingleQubitGate(String keyword, String statement) {
        List<String> args = arguments(keyword, statement);
        if (args.isEmpty()) {
            throw new ArgumentParseException(statement, "");
        }
        int target = parseQubitIndex(statement, args.get(0));
        if (target == Integer.MAX_VALUE) {
            // no register can hold it
            throw new ArgumentParseException(statement, args.get(0));
        }

        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "x" -> Gates.x(target);
            case "y" -> Gates.y(target);
            case "z" -> Gates.z(target);
            default -> throw new IllegalStateException("Not a single-qubit keyword: " + keyword);
        };
    }

    private static int parseRegisterSize(String statement) {
        List<String> args = arguments("qreg", statement);
        if (args.isEmpty()) {
            throw new ArgumentParseException(statement, "");
        }
        return parseQubitIndex(statement, args.get(0));
    }

    /**
     * Comma separated arguments after the keyword and its optional parameter list.
     */
    private static List<String> arguments(String keyword, String statement) {
        String rest = statement.substring(keyword.length()).strip();
        if (rest.startsWith("(")) {
            int close = rest.indexOf(')');
            rest = close < 0 ? "" : rest.substring(close + 1);
        }

        List<String> args = new ArrayList<>();
        for (String arg : rest.split(",")) {
            String trimmed = arg.strip();
            if (!trimmed.isEmpty()) {
                args.add(trimmed);
            }
        }
        return args;
    }

    private static int parseQubitIndex(String statement, String argument) {
        Matcher matcher = QUBIT_REFERENCE.matcher(argument);
        if (!matcher.matches()) {
            throw new ArgumentParseException(statement, argument);
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new ArgumentParseException(statement, argument);
        }
    }
}
