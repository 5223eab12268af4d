package io.clgrader.core.evaluation;

import io.clgrader.core.assessment.Expectation;
import io.clgrader.core.assessment.FileExpectation;
import io.clgrader.core.assessment.TextPredicate;
import io.clgrader.core.process.Outcome;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Checks an {@link Outcome} against an {@link Expectation}.
///
/// Every predicate present in the expectation is evaluated and recorded, including the
/// ones that pass, so reports can show expected and actual values side by side. A case
/// passes only if every predicate holds.
///
/// ### Non-completed outcomes
/// A timed-out or unlaunched program fails every predicate. The result carries an extra
/// `execution` diagnostic describing what happened.
///
/// @implNote **Stateless and thread-safe**.
public class AssertionEvaluator {

    static final String NOT_COMPLETED = "<not completed>";

    /// Evaluates an outcome.
    ///
    /// @param label identifies the invocation in the result, not null
    /// @param outcome what the runner observed, not null
    /// @param expectation predicates to check, not null
    /// @param workingDirectory directory file predicates resolve against, not null
    /// @return the assertion result, never null
    public AssertionResult evaluate(
            String label, Outcome outcome, Expectation expectation, Path workingDirectory) {
        List<PredicateDiagnostic> diagnostics = new ArrayList<>();
        boolean completed = outcome.isCompleted();

        if (!completed) {
            diagnostics.add(
                    PredicateDiagnostic.fail(
                            "execution", "completed", describeFailure(outcome)));
        }

        if (expectation.status() != null) {
            String expected = expectation.status().describe();
            if (completed) {
                int actual = outcome.getExitStatus();
                diagnostics.add(
                        new PredicateDiagnostic(
                                "status",
                                expected,
                                Integer.toString(actual),
                                expectation.status().test(actual)));
            } else {
                diagnostics.add(PredicateDiagnostic.fail("status", expected, NOT_COMPLETED));
            }
        }

        if (expectation.stdout() != null) {
            diagnostics.add(
                    text(
                            "stdout",
                            expectation.stdout(),
                            outcome.getStdout(),
                            outcome.isStdoutTruncated(),
                            completed));
        }
        if (expectation.stderr() != null) {
            diagnostics.add(
                    text(
                            "stderr",
                            expectation.stderr(),
                            outcome.getStderr(),
                            outcome.isStderrTruncated(),
                            completed));
        }

        for (FileExpectation file : expectation.files()) {
            diagnostics.add(file(file, workingDirectory, completed));
        }

        return AssertionResult.of(label, diagnostics);
    }

    private static PredicateDiagnostic text(
            String subject,
            TextPredicate predicate,
            byte[] actual,
            boolean truncated,
            boolean completed) {
        String shown = new String(actual, StandardCharsets.UTF_8) + (truncated ? " [truncated]" : "");
        boolean passed = completed && predicate.test(actual);
        return new PredicateDiagnostic(subject, predicate.describe(), shown, passed);
    }

    private static PredicateDiagnostic file(
            FileExpectation expected, Path workingDirectory, boolean completed) {
        String subject = "file " + expected.path();
        if (!completed) {
            return PredicateDiagnostic.fail(subject, expected.content(), NOT_COMPLETED);
        }
        Path root = workingDirectory.toAbsolutePath().normalize();
        Path target;
        try {
            target = root.resolve(expected.path()).normalize();
        } catch (InvalidPathException e) {
            return PredicateDiagnostic.fail(subject, expected.content(), "<invalid path>");
        }
        if (!target.startsWith(root)) {
            return PredicateDiagnostic.fail(subject, expected.content(), "<outside working directory>");
        }
        if (!Files.isRegularFile(target)) {
            return PredicateDiagnostic.fail(subject, expected.content(), "<missing>");
        }
        try {
            byte[] content = Files.readAllBytes(target);
            boolean passed =
                    Arrays.equals(content, expected.content().getBytes(StandardCharsets.UTF_8));
            return new PredicateDiagnostic(
                    subject, expected.content(), new String(content, StandardCharsets.UTF_8), passed);
        } catch (IOException e) {
            return PredicateDiagnostic.fail(
                    subject, expected.content(), "<unreadable: " + e.getMessage() + ">");
        }
    }

    private static String describeFailure(Outcome outcome) {
        String tag =
                switch (outcome.getTag()) {
                    case TIMED_OUT -> "timed out";
                    case LAUNCH_FAILED -> "launch failed";
                    case COMPLETED -> "completed";
                };
        return outcome.getDiagnostic() != null ? tag + ": " + outcome.getDiagnostic() : tag;
    }
}
