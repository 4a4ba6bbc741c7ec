package io.smartcalc.repl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launches the calculator shell on standard input and output.
 *
 * <p>A session that ends with {@code /exit} or end of input leaves the JVM with status 0. If the
 * shell cannot start, for example because {@code --config} names an unreadable file, the cause is
 * logged and the process exits with status 1.
 */
public final class CalculatorMain {

    private static final Logger LOG = LoggerFactory.getLogger(CalculatorMain.class);

    private CalculatorMain() {}

    /** @param args optional {@code --config <file>} */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            ReplApp.start(args);
        } catch (Exception e) {
            LOG.error("Calculator shell could not start: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
