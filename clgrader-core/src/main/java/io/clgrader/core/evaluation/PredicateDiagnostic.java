package io.clgrader.core.evaluation;

import java.util.Objects;

/// Expected-versus-actual record for one evaluated predicate.
///
/// @param subject what was checked, e.g. `stdout`, `status` or `file out.txt`, not null
/// @param expected human-readable description of the expectation, not null
/// @param actual human-readable description of what was observed, not null
/// @param passed whether the predicate held
public record PredicateDiagnostic(String subject, String expected, String actual, boolean passed) {

    public PredicateDiagnostic {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(actual, "actual must not be null");
    }

    public static PredicateDiagnostic pass(String subject, String expected, String actual) {
        return new PredicateDiagnostic(subject, expected, actual, true);
    }

    public static PredicateDiagnostic fail(String subject, String expected, String actual) {
        return new PredicateDiagnostic(subject, expected, actual, false);
    }
}
