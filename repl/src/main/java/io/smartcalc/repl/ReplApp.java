package io.smartcalc.repl;

import io.smartcalc.core.engine.Calculator;
import io.smartcalc.core.store.InMemoryVariableStore;
import io.smartcalc.repl.config.ConfigLoader;
import io.smartcalc.repl.config.ReplConfig;
import io.smartcalc.repl.session.ReplSession;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the shell: load configuration, configure logging, run one session over the
 * given streams until {@code /exit} or end of input.
 *
 * <p>
 * Separate from {@link CalculatorMain} so tests can drive it with in-memory streams.
 */
public final class ReplApp {

    private static final Logger LOG = LoggerFactory.getLogger(ReplApp.class);

    private ReplApp() {
        // utility class
    }

    /**
     * Runs the shell on standard input and output with the process environment.
     *
     * @param args command-line arguments (e.g. {@code --config smart-calc.yaml})
     * @throws IOException if reading standard input fails
     */
    public static void start(String[] args) throws IOException {
        start(args, System.in, System.out, System::getenv);
    }

    /**
     * Runs the shell on the given streams.
     *
     * @throws io.smartcalc.repl.config.ConfigLoadException if the configuration cannot be loaded
     * @throws IOException if reading {@code in} fails
     */
    public static void start(String[] args, InputStream in, PrintStream out, Function<String, String> envLookup)
            throws IOException {
        ReplConfig config = ConfigLoader.load(args, envLookup);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("session.start: logging_format={}, logging_level={}", config.loggingFormat(), config.loggingLevel());

        ReplSession session = new ReplSession(new Calculator(), new InMemoryVariableStore(), config);
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        session.run(reader, out);

        LOG.info("session.end: exit_command={}", session.isFinished());
    }
}
