package io.clgrader.core.result;

/// Exit signal of a grading run, for the process embedding the engine.
///
/// @see GradingResult#exitStatus()
public enum GradingExitStatus {

    /// Every group executed; a score was produced.
    SUCCESS,

    /// A score was produced, but at least one node is {@link ResultStatus#ERRORED}.
    PARTIAL_FAILURE,

    /// No score: the assessment does not match the runnable programs, or aggregation failed.
    TOTAL_FAILURE
}
