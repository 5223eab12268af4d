package io.clgrader.core.result;

/// Level of the assessment hierarchy a {@link ResultNode} mirrors.
public enum NodeKind {
    ASSESSMENT,
    SECTION,
    GROUP,
    PROGRAM,
    CASE,
    STEP,
    BENCHMARK;

    /// Returns whether nodes of this kind are scored directly rather than folded from children.
    ///
    /// @return `true` for cases, steps and benchmarks
    public boolean isLeaf() {
        return this == CASE || this == STEP || this == BENCHMARK;
    }
}
