package io.clgrader.core;

import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.execution.GradingEngine;
import io.clgrader.core.execution.executor.TestGroupExecutorRegistry;
import io.clgrader.core.process.ProcessRunner;
import io.clgrader.core.process.ProcessTracker;
import io.clgrader.core.process.ProgramResolver;
import io.clgrader.core.result.GradingResult;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Container holding the components of a grading run.
///
/// Owns the worker and coordinator thread pools, the shared {@link ProcessRunner} and the
/// {@link ProcessTracker} of in-flight processes. Closing the environment kills every
/// process still running and stops the pools.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters except `shutdownHook` must be non-null
/// - **Invariant**: Component references are immutable after construction
///
/// @apiNote Create instances via {@link GraderFactory#createEnvironment()} or
/// {@link GraderFactory.Builder} rather than direct construction.
///
/// @see GraderFactory
public final class GraderEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(GraderEnvironment.class.getName());

    private final GraderConfig config;
    private final GradingEngine gradingEngine;
    private final TestGroupExecutorRegistry executorRegistry;
    private final ProcessRunner processRunner;
    private final ProcessTracker processTracker;
    private final ExecutorService workerService;
    private final ExecutorService coordinatorService;
    private final Thread shutdownHook;

    /// Creates an environment.
    ///
    /// @param config configuration the components were built from, not null
    /// @param gradingEngine the engine, not null
    /// @param executorRegistry strategy executors, not null
    /// @param processRunner shared process runner, not null
    /// @param processTracker registry of in-flight processes, not null
    /// @param workerService bounded pool behind the engine's worker pool, not null
    /// @param coordinatorService pool coordinating groups, not null
    /// @param shutdownHook registered JVM shutdown hook, may be null
    public GraderEnvironment(
            GraderConfig config,
            GradingEngine gradingEngine,
            TestGroupExecutorRegistry executorRegistry,
            ProcessRunner processRunner,
            ProcessTracker processTracker,
            ExecutorService workerService,
            ExecutorService coordinatorService,
            Thread shutdownHook) {
        this.config = config;
        this.gradingEngine = gradingEngine;
        this.executorRegistry = executorRegistry;
        this.processRunner = processRunner;
        this.processTracker = processTracker;
        this.workerService = workerService;
        this.coordinatorService = coordinatorService;
        this.shutdownHook = shutdownHook;
    }

    /// Grades an assessment with this environment's engine.
    ///
    /// @param assessment the assessment to grade, not null
    /// @param resolver the submission's programs, not null
    /// @return the result, never null
    /// @throws InterruptedException if interrupted while grading
    /// @see GradingEngine#grade(Assessment, ProgramResolver)
    public GradingResult grade(Assessment assessment, ProgramResolver resolver)
            throws InterruptedException {
        return gradingEngine.grade(assessment, resolver);
    }

    public GraderConfig getConfig() {
        return config;
    }

    /// Returns the grading engine.
    ///
    /// @return the engine, never null
    public GradingEngine getGradingEngine() {
        return gradingEngine;
    }

    /// Returns the registry of strategy executors, for registering custom group types.
    ///
    /// @return the registry, never null
    public TestGroupExecutorRegistry getExecutorRegistry() {
        return executorRegistry;
    }

    public ProcessRunner getProcessRunner() {
        return processRunner;
    }

    public ProcessTracker getProcessTracker() {
        return processTracker;
    }

    /// Kills in-flight processes and shuts down the thread pools.
    ///
    /// @apiNote **Side effects**:
    /// - Every tracked process tree is killed
    /// - Both pools are interrupted and no longer accept work
    /// - The JVM shutdown hook, if any, is removed
    @Override
    public void close() {
        processTracker.destroyAll();
        coordinatorService.shutdownNow();
        workerService.shutdownNow();
        try {
            if (!workerService.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warning("Worker pool did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        processRunner.close();
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                logger.fine("JVM is already shutting down, hook stays registered");
            }
        }
    }
}
