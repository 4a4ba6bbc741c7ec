package io.smartcalc.repl.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.smartcalc.core.engine.Calculator;
import io.smartcalc.core.store.InMemoryVariableStore;
import io.smartcalc.repl.config.ReplConfig;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ReplSession")
class ReplSessionTest {

    private InMemoryVariableStore store;
    private ReplSession session;

    @BeforeEach
    void setUp() {
        store = new InMemoryVariableStore();
        session = new ReplSession(new Calculator(), store, ReplConfig.defaults());
    }

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        void exitPrintsFarewellAndFinishes() {
            assertThat(session.handle("/exit")).hasValue("Bye!");
            assertThat(session.isFinished()).isTrue();
        }

        @Test
        void helpPrintsUsage() {
            assertThat(session.handle("  /help ")).hasValue(ReplConfig.DEFAULT_HELP_TEXT);
            assertThat(session.isFinished()).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"/go", "/", "/EXIT", "/help me"})
        void otherSlashLinesAreUnknownCommands(String line) {
            assertThat(session.handle(line)).hasValue("Unknown command");
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        void blankLinesProduceNothing() {
            assertThat(session.handle("")).isEmpty();
            assertThat(session.handle("   ")).isEmpty();
            assertThat(session.handle(null)).isEmpty();
        }

        @Test
        void printsResult() {
            assertThat(session.handle("8 * 3 + 12 * (4 - 2)")).hasValue("48");
            assertThat(session.handle("-10")).hasValue("-10");
        }

        @Test
        void syntaxAndMalformedFailuresAreInvalidExpression() {
            assertThat(session.handle("3 ** 2")).hasValue("Invalid expression");
            assertThat(session.handle("(1 + 2")).hasValue("Invalid expression");
            assertThat(session.handle("1 + 2)")).hasValue("Invalid expression");
            assertThat(session.handle("2 +")).hasValue("Invalid expression");
            assertThat(session.handle("1a + 2")).hasValue("Invalid expression");
        }

        @Test
        void divisionByZeroIsReported() {
            assertThat(session.handle("5 / 0")).hasValue("Division by zero");
        }

        @Test
        void unknownVariableInExpression() {
            assertThat(session.handle("x + 1")).hasValue("Unknown variable");
        }
    }

    @Nested
    @DisplayName("Variables")
    class Variables {

        @Test
        void assignmentIsSilentAndLookupPrintsValue() {
            assertThat(session.handle("x = 5")).isEmpty();
            assertThat(session.handle("x")).hasValue("5");
            assertThat(session.handle("x + 1")).hasValue("6");
        }

        @Test
        void bareUnknownNameIsUnknownVariable() {
            assertThat(session.handle("nothing")).hasValue("Unknown variable");
        }

        @Test
        void chainedAssignment() {
            session.handle("a = 3");
            session.handle("b = a");

            assertThat(session.handle("b")).hasValue("3");
        }

        @Test
        void unboundRightHandSideLeavesTargetUnset() {
            assertThat(session.handle("c = d")).hasValue("Unknown variable");
            assertThat(session.handle("c")).hasValue("Unknown variable");
            assertThat(store.contains("c")).isFalse();
        }

        @Test
        void assignmentErrorsAreDescribed() {
            assertThat(session.handle("a1 = 8")).hasValue("Invalid identifier");
            assertThat(session.handle("n = a2a")).hasValue("Invalid assignment");
            assertThat(session.handle("a = 7 = 8")).hasValue("Invalid assignment");
        }
    }

    @Nested
    @DisplayName("run loop")
    class RunLoop {

        private String run(ReplSession replSession, String input) throws IOException {
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
            replSession.run(new BufferedReader(new StringReader(input)), out);
            return bytes.toString(StandardCharsets.UTF_8);
        }

        @Test
        void stopsAtExitAndIgnoresTheRest() throws IOException {
            String output = run(session, "n = 4\nn * n\n\n/exit\n1 + 1\n");

            assertThat(output.lines()).containsExactly("16", "Bye!");
            assertThat(session.isFinished()).isTrue();
        }

        @Test
        void endOfInputEndsSessionWithoutFarewell() throws IOException {
            String output = run(session, "2 ^ 3 ^ 2\n/unknown");

            assertThat(output.lines()).containsExactly("512", "Unknown command");
            assertThat(session.isFinished()).isFalse();
        }

        @Test
        void printsConfiguredPromptBeforeEachRead() throws IOException {
            ReplConfig config = ReplConfig.builder().prompt("> ").exitMessage("ciao").build();
            ReplSession prompted = new ReplSession(new Calculator(), new InMemoryVariableStore(), config);

            String output = run(prompted, "1 + 1\n/exit\n");

            assertThat(output).isEqualTo("> 2" + System.lineSeparator() + "> ciao" + System.lineSeparator());
        }
    }
}
