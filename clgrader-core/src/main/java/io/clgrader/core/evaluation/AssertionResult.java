package io.clgrader.core.evaluation;

import java.util.List;
import java.util.Objects;

/// Result of checking one {@link io.clgrader.core.process.Outcome} against an expectation.
///
/// A test case produces one result per invocation, so a case with argument permutations
/// carries several.
///
/// @param label identifies the invocation, usually its argument vector, not null
/// @param passed `true` only if every diagnostic passed
/// @param diagnostics one entry per evaluated predicate, in evaluation order, not null
public record AssertionResult(String label, boolean passed, List<PredicateDiagnostic> diagnostics) {

    public AssertionResult {
        Objects.requireNonNull(label, "label must not be null");
        diagnostics = List.copyOf(diagnostics);
    }

    /// Builds a result whose pass flag is derived from its diagnostics.
    ///
    /// @param label invocation label, not null
    /// @param diagnostics evaluated predicates, not null
    /// @return the result, never null
    public static AssertionResult of(String label, List<PredicateDiagnostic> diagnostics) {
        boolean passed = diagnostics.stream().allMatch(PredicateDiagnostic::passed);
        return new AssertionResult(label, passed, diagnostics);
    }

    /// Returns the diagnostics that did not hold.
    ///
    /// @return failed predicates, never null, may be empty
    public List<PredicateDiagnostic> failures() {
        return diagnostics.stream().filter(d -> !d.passed()).toList();
    }
}
