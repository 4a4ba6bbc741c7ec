package io.smartcalc.repl.session;

import io.smartcalc.core.engine.AssignmentHandler;
import io.smartcalc.core.engine.Calculator;
import io.smartcalc.core.engine.ValueResolver;
import io.smartcalc.core.error.AssignmentException;
import io.smartcalc.core.error.CalculatorException;
import io.smartcalc.core.error.ExpressionEvalException;
import io.smartcalc.core.parse.Lexemes;
import io.smartcalc.core.spi.VariableStore;
import io.smartcalc.repl.config.ReplConfig;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One interactive session: dispatches each input line to a command, an assignment, a variable
 * lookup or the calculator, and turns failures into one-line messages.
 *
 * <p>
 * Dispatch order, applied to the trimmed line:
 * <ol>
 * <li>blank line: no output</li>
 * <li>{@code /exit}, {@code /help}; any other {@code /...} is an unknown command</li>
 * <li>a line containing {@code =}: assignment</li>
 * <li>a bare variable name: print its value</li>
 * <li>anything else: evaluate as an expression</li>
 * </ol>
 *
 * <p>
 * No failure ends the session; only {@code /exit} or end of input does.
 */
public final class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);

    static final String UNKNOWN_COMMAND = "Unknown command";
    static final String UNKNOWN_VARIABLE = "Unknown variable";
    static final String INVALID_IDENTIFIER = "Invalid identifier";
    static final String INVALID_ASSIGNMENT = "Invalid assignment";
    static final String INVALID_EXPRESSION = "Invalid expression";
    static final String DIVISION_BY_ZERO = "Division by zero";

    private final Calculator calculator;
    private final VariableStore store;
    private final ReplConfig config;
    private boolean finished;

    public ReplSession(Calculator calculator, VariableStore store, ReplConfig config) {
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Processes one input line.
     *
     * @param rawLine the line as read, untrimmed
     * @return the text to print, or empty if the line produces no output
     */
    public Optional<String> handle(String rawLine) {
        String line = rawLine == null ? "" : rawLine.strip();
        if (line.isEmpty()) {
            return Optional.empty();
        }

        if (Command.looksLikeCommand(line)) {
            return Optional.of(runCommand(line));
        }

        try {
            if (AssignmentHandler.isAssignment(line)) {
                AssignmentHandler.assign(line, store);
                return Optional.empty();
            }
            if (Lexemes.isIdentifier(line)) {
                return Optional.of(Integer.toString(ValueResolver.lookup(line, store)));
            }
            return Optional.of(Integer.toString(calculator.evaluate(line, store)));
        } catch (CalculatorException e) {
            LOG.debug("line.rejected: line={}, phase={}, detail={}", line, e.phase(), e.detail());
            return Optional.of(describe(e));
        }
    }

    /** Returns {@code true} once {@code /exit} has been handled. */
    public boolean isFinished() {
        return finished;
    }

    /**
     * Reads lines until {@code /exit} or end of input, printing every output line.
     *
     * @throws IOException if reading from {@code in} fails
     */
    public void run(BufferedReader in, PrintStream out) throws IOException {
        while (!finished) {
            if (!config.prompt().isEmpty()) {
                out.print(config.prompt());
                out.flush();
            }
            String line = in.readLine();
            if (line == null) {
                LOG.debug("session.eof");
                break;
            }
            handle(line).ifPresent(out::println);
        }
        out.flush();
    }

    private String runCommand(String line) {
        Optional<Command> command = Command.parse(line);
        if (command.isEmpty()) {
            return UNKNOWN_COMMAND;
        }
        switch (command.get()) {
            case EXIT:
                finished = true;
                LOG.debug("session.exit: variables={}", store.snapshot().size());
                return config.exitMessage();
            case HELP:
            default:
                return config.helpText();
        }
    }

    /** Maps a failure to the single line shown to the user. */
    static String describe(CalculatorException e) {
        if (e instanceof ExpressionEvalException eval) {
            return switch (eval.reason()) {
                case UNKNOWN_VARIABLE -> UNKNOWN_VARIABLE;
                case DIVISION_BY_ZERO -> DIVISION_BY_ZERO;
                case MALFORMED_EXPRESSION -> INVALID_EXPRESSION;
            };
        }
        if (e instanceof AssignmentException assignment) {
            return assignment.reason() == AssignmentException.Reason.INVALID_IDENTIFIER
                    ? INVALID_IDENTIFIER
                    : INVALID_ASSIGNMENT;
        }
        return INVALID_EXPRESSION;
    }
}
