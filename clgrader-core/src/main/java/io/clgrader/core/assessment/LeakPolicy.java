package io.clgrader.core.assessment;

/// What a detected memory leak does to a benchmark.
public enum LeakPolicy {

    /// Leak detection results are not recorded.
    IGNORE,

    /// Leaks are recorded as diagnostics but do not affect the verdict.
    REPORT,

    /// A detected leak fails the benchmark.
    FAIL_ON_LEAK
}
