package io.clgrader.core.result;

import io.clgrader.core.assessment.GradingMode;
import io.clgrader.core.evaluation.AssertionResult;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Immutable node of the result tree returned by a grading run.
///
/// The tree mirrors the assessment: assessment, sections, groups, program blocks, and
/// finally test cases, integration steps or benchmarks at the leaves. Executors build
/// leaves carrying a status and a weight; {@link io.clgrader.core.scoring.ScoringAggregator}
/// then returns a copy of the tree with earned weight, possible weight, score and interior
/// statuses filled in.
///
/// ### Equality
/// Two nodes are equal when everything except {@link #getElapsed()} matches, so that
/// repeated runs of the same assessment compare equal regardless of timing.
///
/// @implNote **Thread-safe**. All fields are final and collections are unmodifiable.
///
/// @see io.clgrader.core.scoring.ScoringAggregator
public final class ResultNode {

    private final String name;
    private final NodeKind kind;
    private final ResultStatus status;
    private final int weight;
    private final long earned;
    private final long possible;
    private final double score;
    private final GradingMode gradingMode;
    private final boolean visible;
    private final List<String> diagnostics;
    private final List<AssertionResult> assertions;
    private final List<ResultNode> children;
    private final Duration elapsed;

    private ResultNode(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.kind = Objects.requireNonNull(builder.kind, "kind must not be null");
        this.status = builder.status;
        this.weight = builder.weight;
        this.earned = builder.earned;
        this.possible = builder.possible;
        this.score = builder.score;
        this.gradingMode = builder.gradingMode;
        this.visible = builder.visible;
        this.diagnostics = List.copyOf(builder.diagnostics);
        this.assertions = List.copyOf(builder.assertions);
        this.children = List.copyOf(builder.children);
        this.elapsed = builder.elapsed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a leaf that was never executed.
    ///
    /// @param name leaf name, not null
    /// @param kind leaf kind, not null
    /// @param status {@link ResultStatus#SKIPPED} or {@link ResultStatus#ERRORED}, not null
    /// @param weight declared weight
    /// @param diagnostic reason, may be null
    /// @return the leaf, never null
    public static ResultNode unexecuted(
            String name, NodeKind kind, ResultStatus status, int weight, String diagnostic) {
        Builder builder = builder().name(name).kind(kind).status(status).weight(weight);
        if (diagnostic != null) {
            builder.diagnostic(diagnostic);
        }
        return builder.build();
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    /// Returns the node status.
    ///
    /// @return the status; null only on interior nodes that have not been aggregated yet
    public ResultStatus getStatus() {
        return status;
    }

    /// Returns the declared weight.
    ///
    /// For leaves this is the test weight, for sections the multiplier applied to the
    /// section's sums. Other interior nodes carry `1`.
    ///
    /// @return the declared weight
    public int getWeight() {
        return weight;
    }

    public long getEarned() {
        return earned;
    }

    public long getPossible() {
        return possible;
    }

    /// Returns the fractional score in `[0, 1]` under the node's effective grading mode.
    ///
    /// @return the score, `0.0` before aggregation
    public double getScore() {
        return score;
    }

    /// Returns the effective grading mode for this node.
    ///
    /// On an unaggregated section this is its override, or null when it inherits.
    ///
    /// @return the grading mode, may be null before aggregation
    public GradingMode getGradingMode() {
        return gradingMode;
    }

    /// Returns whether the node is meant to be shown to students.
    ///
    /// @return `false` for nodes under a non-public section
    public boolean isVisible() {
        return visible;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }

    public List<AssertionResult> getAssertions() {
        return assertions;
    }

    public List<ResultNode> getChildren() {
        return children;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isPassed() {
        return status == ResultStatus.PASSED;
    }

    /// Returns whether this node or any descendant is {@link ResultStatus#ERRORED}.
    ///
    /// @return `true` if an errored node exists in this subtree
    public boolean containsErrors() {
        if (status == ResultStatus.ERRORED) {
            return true;
        }
        for (ResultNode child : children) {
            if (child.containsErrors()) {
                return true;
            }
        }
        return false;
    }

    /// Returns a builder initialized with this node's values.
    ///
    /// @return a new builder, never null
    public Builder toBuilder() {
        return builder()
                .name(name)
                .kind(kind)
                .status(status)
                .weight(weight)
                .earned(earned)
                .possible(possible)
                .score(score)
                .gradingMode(gradingMode)
                .visible(visible)
                .diagnostics(diagnostics)
                .assertions(assertions)
                .children(children)
                .elapsed(elapsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResultNode other)) {
            return false;
        }
        return weight == other.weight
                && earned == other.earned
                && possible == other.possible
                && Double.compare(score, other.score) == 0
                && visible == other.visible
                && name.equals(other.name)
                && kind == other.kind
                && status == other.status
                && gradingMode == other.gradingMode
                && diagnostics.equals(other.diagnostics)
                && assertions.equals(other.assertions)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                name, kind, status, weight, earned, possible, score, gradingMode, children);
    }

    @Override
    public String toString() {
        return "ResultNode{"
                + "name='"
                + name
                + '\''
                + ", kind="
                + kind
                + ", status="
                + status
                + ", earned="
                + earned
                + ", possible="
                + possible
                + ", score="
                + score
                + ", children="
                + children.size()
                + '}';
    }

    public static final class Builder {
        private String name;
        private NodeKind kind;
        private ResultStatus status;
        private int weight = 1;
        private long earned;
        private long possible;
        private double score;
        private GradingMode gradingMode;
        private boolean visible = true;
        private final List<String> diagnostics = new ArrayList<>();
        private final List<AssertionResult> assertions = new ArrayList<>();
        private final List<ResultNode> children = new ArrayList<>();
        private Duration elapsed = Duration.ZERO;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(NodeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(ResultStatus status) {
            this.status = status;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder earned(long earned) {
            this.earned = earned;
            return this;
        }

        public Builder possible(long possible) {
            this.possible = possible;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder gradingMode(GradingMode gradingMode) {
            this.gradingMode = gradingMode;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder diagnostic(String diagnostic) {
            this.diagnostics.add(diagnostic);
            return this;
        }

        public Builder diagnostics(List<String> diagnostics) {
            this.diagnostics.clear();
            this.diagnostics.addAll(diagnostics);
            return this;
        }

        public Builder assertion(AssertionResult assertion) {
            this.assertions.add(assertion);
            return this;
        }

        public Builder assertions(List<AssertionResult> assertions) {
            this.assertions.clear();
            this.assertions.addAll(assertions);
            return this;
        }

        public Builder child(ResultNode child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<ResultNode> children) {
            this.children.clear();
            this.children.addAll(children);
            return this;
        }

        public Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed != null ? elapsed : Duration.ZERO;
            return this;
        }

        public ResultNode build() {
            return new ResultNode(this);
        }
    }
}
