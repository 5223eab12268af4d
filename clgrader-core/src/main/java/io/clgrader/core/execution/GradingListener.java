package io.clgrader.core.execution;

import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.assessment.Section;
import io.clgrader.core.assessment.TestGroup;
import io.clgrader.core.result.ResultNode;

/// Callback interface for observing a grading run, for progress display or logging.
///
/// All methods have no-op defaults; implement only the callbacks you need.
///
/// @implNote Groups of a section run concurrently, so group and leaf callbacks may
/// arrive from several threads at once. Implementations must be thread-safe.
/// Leaf nodes passed to {@link #onLeafCompleted} are not yet scored.
public interface GradingListener {

    /// Listener that ignores every event.
    GradingListener NOOP = new GradingListener() {};

    default void onAssessmentStarted(Assessment assessment) {}

    default void onSectionStarted(Section section) {}

    default void onGroupStarted(TestGroup group) {}

    /// Called when a test case, integration step or benchmark has a verdict.
    ///
    /// @param group the group the leaf belongs to, not null
    /// @param leaf the unscored leaf, not null
    default void onLeafCompleted(TestGroup group, ResultNode leaf) {}

    default void onGroupCompleted(TestGroup group, ResultNode result) {}

    default void onSectionCompleted(Section section, ResultNode result) {}

    /// Called once with the scored tree.
    ///
    /// @param assessment the graded assessment, not null
    /// @param result the scored root node, not null
    default void onAssessmentCompleted(Assessment assessment, ResultNode result) {}
}
