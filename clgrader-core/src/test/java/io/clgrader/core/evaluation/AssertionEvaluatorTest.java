package io.clgrader.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import io.clgrader.core.assessment.Expectation;
import io.clgrader.core.assessment.StatusPredicate;
import io.clgrader.core.assessment.TextPredicate;
import io.clgrader.core.process.Outcome;
import io.clgrader.core.process.OutcomeTag;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AssertionEvaluatorTest {

    @TempDir Path workingDirectory;

    private AssertionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new AssertionEvaluator();
    }

    private static Outcome completed(int status, String stdout, String stderr) {
        return Outcome.builder(OutcomeTag.COMPLETED)
                .exitStatus(status)
                .stdout(stdout)
                .stderr(stderr)
                .build();
    }

    @Nested
    class TextPredicates {

        @Test
        void shouldPassOnExactStdout() {
            Expectation expectation = Expectation.builder().stdout(TextPredicate.exact("3\n")).build();

            AssertionResult result =
                    evaluator.evaluate("case", completed(0, "3\n", ""), expectation, workingDirectory);

            assertThat(result.passed()).isTrue();
            assertThat(result.label()).isEqualTo("case");
            assertThat(result.diagnostics())
                    .containsExactly(PredicateDiagnostic.pass("stdout", "3\n", "3\n"));
        }

        @Test
        void shouldReportExpectedAndActualOnMismatch() {
            Expectation expectation = Expectation.builder().stdout(TextPredicate.exact("3\n")).build();

            AssertionResult result =
                    evaluator.evaluate("case", completed(0, "4\n", ""), expectation, workingDirectory);

            assertThat(result.passed()).isFalse();
            assertThat(result.failures())
                    .containsExactly(PredicateDiagnostic.fail("stdout", "3\n", "4\n"));
        }

        @Test
        void shouldNotIgnoreTrailingNewlineWithoutTrim() {
            Expectation expectation = Expectation.builder().stdout(TextPredicate.exact("3")).build();

            assertThat(
                            evaluator
                                    .evaluate("case", completed(0, "3\n", ""), expectation, workingDirectory)
                                    .passed())
                    .isFalse();
        }

        @Test
        void shouldIgnoreSurroundingWhitespaceWhenTrimmed() {
            Expectation expectation = Expectation.builder().stdout(TextPredicate.trimmed(" 3 ")).build();

            assertThat(
                            evaluator
                                    .evaluate("case", completed(0, "\n3\n\n", ""), expectation, workingDirectory)
                                    .passed())
                    .isTrue();
        }

        @Test
        void shouldSearchStderrWithRegex() {
            Expectation expectation =
                    Expectation.builder().stderr(TextPredicate.matches("usage: \\w+")).build();

            AssertionResult result =
                    evaluator.evaluate(
                            "case", completed(2, "", "error\nusage: calc N\n"), expectation, workingDirectory);

            assertThat(result.passed()).isTrue();
            assertThat(result.diagnostics().get(0).expected()).isEqualTo("matches /usage: \\w+/");
        }

        @Test
        void shouldMarkTruncatedOutput() {
            Outcome outcome =
                    Outcome.builder(OutcomeTag.COMPLETED)
                            .exitStatus(0)
                            .stdout("abc".getBytes(), true)
                            .build();
            Expectation expectation = Expectation.builder().stdout(TextPredicate.exact("abcdef")).build();

            AssertionResult result = evaluator.evaluate("case", outcome, expectation, workingDirectory);

            assertThat(result.passed()).isFalse();
            assertThat(result.diagnostics().get(0).actual()).isEqualTo("abc [truncated]");
        }
    }

    @Nested
    class StatusPredicates {

        @Test
        void shouldCheckExactStatus() {
            Expectation expectation = Expectation.builder().status(1).build();

            AssertionResult result =
                    evaluator.evaluate("case", completed(0, "", ""), expectation, workingDirectory);

            assertThat(result.failures()).containsExactly(PredicateDiagnostic.fail("status", "1", "0"));
        }

        @Test
        void shouldCheckStatusRangeInclusive() {
            Expectation expectation =
                    Expectation.builder().status(StatusPredicate.between(1, 3)).build();

            assertThat(evaluator.evaluate("a", completed(3, "", ""), expectation, workingDirectory).passed())
                    .isTrue();
            assertThat(evaluator.evaluate("b", completed(4, "", ""), expectation, workingDirectory).passed())
                    .isFalse();
        }
    }

    @Nested
    class FileExpectations {

        @Test
        void shouldCompareFileContent() throws Exception {
            Files.writeString(workingDirectory.resolve("out.txt"), "hello\n");
            Expectation expectation = Expectation.builder().file("out.txt", "hello\n").build();

            assertThat(
                            evaluator
                                    .evaluate("case", completed(0, "", ""), expectation, workingDirectory)
                                    .passed())
                    .isTrue();
        }

        @Test
        void shouldFailOnMissingFile() {
            Expectation expectation = Expectation.builder().file("out.txt", "hello\n").build();

            AssertionResult result =
                    evaluator.evaluate("case", completed(0, "", ""), expectation, workingDirectory);

            assertThat(result.failures())
                    .containsExactly(PredicateDiagnostic.fail("file out.txt", "hello\n", "<missing>"));
        }

        @Test
        void shouldRefuseFilesOutsideWorkingDirectory() {
            Expectation expectation = Expectation.builder().file("../escape.txt", "x").build();

            AssertionResult result =
                    evaluator.evaluate("case", completed(0, "", ""), expectation, workingDirectory);

            assertThat(result.failures().get(0).actual()).isEqualTo("<outside working directory>");
        }
    }

    @Nested
    class NotCompleted {

        @Test
        void shouldFailEveryPredicateOnTimeout() {
            Outcome outcome =
                    Outcome.builder(OutcomeTag.TIMED_OUT)
                            .stdout("partial")
                            .diagnostic("Timed out after 100 ms")
                            .build();
            Expectation expectation =
                    Expectation.builder().stdout(TextPredicate.matches(".*")).status(0).build();

            AssertionResult result = evaluator.evaluate("case", outcome, expectation, workingDirectory);

            assertThat(result.passed()).isFalse();
            assertThat(result.diagnostics())
                    .containsExactly(
                            PredicateDiagnostic.fail(
                                    "execution", "completed", "timed out: Timed out after 100 ms"),
                            PredicateDiagnostic.fail("status", "0", AssertionEvaluator.NOT_COMPLETED),
                            PredicateDiagnostic.fail("stdout", "matches /.*/", "partial"));
        }

        @Test
        void shouldFailEmptyExpectationWhenLaunchFailed() {
            AssertionResult result =
                    evaluator.evaluate(
                            "case",
                            Outcome.launchFailed("'./calc' does not exist"),
                            Expectation.none(),
                            workingDirectory);

            assertThat(result.passed()).isFalse();
            assertThat(result.failures().get(0).actual())
                    .isEqualTo("launch failed: './calc' does not exist");
        }
    }
}
