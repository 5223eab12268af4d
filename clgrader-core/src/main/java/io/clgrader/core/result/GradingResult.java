package io.clgrader.core.result;

/// Outcome of grading one assessment.
///
/// ### Permitted Subtypes
/// - {@link Completed} - every section was executed and scored
/// - {@link Failure} - the run was aborted before a score could be produced
///
/// @see io.clgrader.core.execution.GradingEngine#grade
public sealed interface GradingResult {

    /// Returns the exit signal matching this result.
    ///
    /// @return the exit status, never null
    GradingExitStatus exitStatus();

    /// Grading finished and produced a sealed result tree.
    ///
    /// @param tree the scored result tree, rooted at the assessment, not null
    /// @param exitStatus {@link GradingExitStatus#SUCCESS} or
    ///        {@link GradingExitStatus#PARTIAL_FAILURE}, not null
    record Completed(ResultNode tree, GradingExitStatus exitStatus) implements GradingResult {}

    /// Grading aborted.
    ///
    /// @param cause the assessment-level mismatch or aggregation error, not null
    record Failure(Exception cause) implements GradingResult {

        @Override
        public GradingExitStatus exitStatus() {
            return GradingExitStatus.TOTAL_FAILURE;
        }
    }
}
