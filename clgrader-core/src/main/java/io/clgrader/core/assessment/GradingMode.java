package io.clgrader.core.assessment;

/// How leaf results fold into a score.
public enum GradingMode {

    /// All or nothing: a node scores `1.0` only if every leaf beneath it passed.
    ABSOLUTE,

    /// Earned weight over possible weight.
    WEIGHTED
}
