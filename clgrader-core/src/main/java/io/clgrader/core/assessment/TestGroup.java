package io.clgrader.core.assessment;

import java.util.Map;

/// A unit of grading work inside a {@link Section}.
///
/// ### Permitted Subtypes
/// - {@link UnitTestGroup} - independent cases in isolated directories, with setup and teardown
/// - {@link IntegrationTestGroup} - an ordered sequence sharing one directory
/// - {@link PerformanceTestGroup} - benchmarks with time and memory bounds
///
/// Each variant is run by the strategy executor registered for its class in
/// {@link io.clgrader.core.execution.executor.TestGroupExecutorRegistry}.
public sealed interface TestGroup permits UnitTestGroup, IntegrationTestGroup, PerformanceTestGroup {

    String getName();

    /// Returns the environment layer this group adds on top of the section's.
    ///
    /// @return variables, never null, may be empty
    Map<String, String> getEnvironment();

    /// Returns whether invocations start from the grader's own environment.
    ///
    /// @return `false` to start every invocation from an empty environment
    boolean isInheritParentEnvironment();

    /// Returns fixture files written into the group workspace before anything runs.
    ///
    /// @return file name to content, in declaration order, never null
    Map<String, String> getFiles();
}
