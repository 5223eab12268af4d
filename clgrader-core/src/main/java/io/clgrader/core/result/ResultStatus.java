package io.clgrader.core.result;

/// Status of a node in the result tree.
///
/// Leaves are either {@link #PASSED}, {@link #FAILED}, {@link #ERRORED} or {@link #SKIPPED}.
/// Interior nodes derive their status from their children during aggregation.
public enum ResultStatus {

    /// Every assertion held, or every child passed.
    PASSED,

    /// An assertion did not hold. Includes timeouts and launch failures of the student program.
    FAILED,

    /// Some, but not all, children passed.
    PARTIALLY_PASSED,

    /// The test could not be carried out: setup failed or the program was not runnable.
    ERRORED,

    /// Not executed because an earlier integration step failed.
    SKIPPED
}
