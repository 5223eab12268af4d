package io.clgrader.core.execution.executor;

import io.clgrader.core.assessment.TestGroup;
import io.clgrader.core.execution.GradingContext;
import io.clgrader.core.result.ResultNode;

/// Strategy for running one kind of {@link TestGroup}.
///
/// Implementations are stateless; everything they need comes from the
/// {@link GradingContext}. Each returns an unscored group node whose leaves carry a
/// status and weight.
///
/// ### Contracts
/// - **Postcondition**: the returned node has kind {@link io.clgrader.core.result.NodeKind#GROUP}
///   and one leaf per declared case, step or benchmark, in declaration order
/// - **Postcondition**: every process is launched from a unit on the context's worker pool
///
/// @param <T> the group variant handled
/// @see TestGroupExecutorRegistry
public interface TestGroupExecutor<T extends TestGroup> {

    /// Returns the group variant this executor handles.
    ///
    /// @return the group class, never null
    Class<T> getGroupType();

    /// Runs the group.
    ///
    /// @param group the group to run, not null
    /// @param context services and inherited settings, not null
    /// @return the unscored group node, never null
    /// @throws InterruptedException if the run is cancelled
    /// @throws Exception for unexpected failures; the engine records the group as errored
    ResultNode execute(T group, GradingContext context) throws Exception;
}
