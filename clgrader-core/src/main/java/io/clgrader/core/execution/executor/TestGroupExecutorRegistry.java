package io.clgrader.core.execution.executor;

import io.clgrader.core.assessment.TestGroup;
import io.clgrader.core.exception.ExecutorNotFoundException;
import java.util.Optional;

/// Lookup of strategy executors by group variant.
///
/// @see DefaultTestGroupExecutorRegistry
public interface TestGroupExecutorRegistry {

    /// Finds the executor for a group variant.
    ///
    /// @param groupType group class, not null
    /// @return the executor, or empty if none is registered
    <T extends TestGroup> Optional<TestGroupExecutor<T>> getExecutor(Class<T> groupType);

    /// Finds the executor for a group variant or fails.
    ///
    /// @param groupType group class, not null
    /// @return the executor, never null
    /// @throws ExecutorNotFoundException if none is registered
    default <T extends TestGroup> TestGroupExecutor<T> getExecutorOrThrow(Class<T> groupType) {
        return getExecutor(groupType)
                .orElseThrow(
                        () ->
                                new ExecutorNotFoundException(
                                        "No executor registered for " + groupType.getSimpleName()));
    }

    /// Finds the executor for a group instance.
    ///
    /// @param group the group, not null
    /// @return the executor, never null
    /// @throws ExecutorNotFoundException if none is registered for the group's class
    default <T extends TestGroup> TestGroupExecutor<T> getExecutorFor(T group) {
        return (TestGroupExecutor<T>) getExecutorOrThrow(group.getClass());
    }

    /// Registers or replaces the executor for its group variant.
    ///
    /// @param executor the executor, not null
    <T extends TestGroup> void register(TestGroupExecutor<T> executor);
}
