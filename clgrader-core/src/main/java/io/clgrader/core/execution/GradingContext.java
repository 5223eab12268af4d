package io.clgrader.core.execution;

import io.clgrader.core.GraderConfig;
import io.clgrader.core.assessment.ProgramReference;
import io.clgrader.core.assessment.TestGroup;
import io.clgrader.core.evaluation.AssertionEvaluator;
import io.clgrader.core.exception.SpecMismatchException;
import io.clgrader.core.process.CommandTemplate;
import io.clgrader.core.process.Invocation;
import io.clgrader.core.process.ProcessRunner;
import io.clgrader.core.process.ProgramResolver;
import io.clgrader.core.util.EnvironmentLayers;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Services and inherited settings handed to a strategy executor for one test group.
///
/// The engine builds one context per group. It carries the shared services (runner,
/// evaluator, worker pool, workspace) plus everything the group inherits from the
/// assessment and its section: the merged environment, the default timeout and the
/// group's own workspace directory.
///
/// @implNote **Immutable**. Use {@link #builder()} or {@link #toBuilder()}.
///
/// @see io.clgrader.core.execution.executor.TestGroupExecutor
public final class GradingContext {

    private final GraderConfig config;
    private final ProcessRunner processRunner;
    private final AssertionEvaluator assertionEvaluator;
    private final ProgramResolver programResolver;
    private final WorkerPool workerPool;
    private final WorkspaceAllocator workspace;
    private final GradingListener listener;
    private final Path groupDirectory;
    private final Map<String, String> environment;
    private final Duration defaultTimeout;

    private GradingContext(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config must not be null");
        this.processRunner = Objects.requireNonNull(builder.processRunner, "processRunner must not be null");
        this.assertionEvaluator =
                Objects.requireNonNull(builder.assertionEvaluator, "assertionEvaluator must not be null");
        this.programResolver =
                Objects.requireNonNull(builder.programResolver, "programResolver must not be null");
        this.workerPool = Objects.requireNonNull(builder.workerPool, "workerPool must not be null");
        this.workspace = Objects.requireNonNull(builder.workspace, "workspace must not be null");
        this.listener = builder.listener != null ? builder.listener : GradingListener.NOOP;
        this.groupDirectory = builder.groupDirectory;
        this.environment = EnvironmentLayers.merge(builder.environment);
        this.defaultTimeout =
                builder.defaultTimeout != null ? builder.defaultTimeout : config.getDefaultTimeout();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .config(config)
                .processRunner(processRunner)
                .assertionEvaluator(assertionEvaluator)
                .programResolver(programResolver)
                .workerPool(workerPool)
                .workspace(workspace)
                .listener(listener)
                .groupDirectory(groupDirectory)
                .environment(environment)
                .defaultTimeout(defaultTimeout);
    }

    public GraderConfig getConfig() {
        return config;
    }

    public ProcessRunner getProcessRunner() {
        return processRunner;
    }

    public AssertionEvaluator getAssertionEvaluator() {
        return assertionEvaluator;
    }

    public ProgramResolver getProgramResolver() {
        return programResolver;
    }

    public WorkerPool getWorkerPool() {
        return workerPool;
    }

    public WorkspaceAllocator getWorkspace() {
        return workspace;
    }

    public GradingListener getListener() {
        return listener;
    }

    /// Returns the directory reserved for the current group.
    ///
    /// @return the group directory, null on the engine-level context
    public Path getGroupDirectory() {
        return groupDirectory;
    }

    /// Returns the environment inherited from the assessment and section.
    ///
    /// @return merged variables, never null
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    /// Picks the effective timeout.
    ///
    /// @param override case, step or benchmark timeout, may be null
    /// @return `override` if set, otherwise the inherited default
    public Duration timeoutFor(Duration override) {
        return override != null ? override : defaultTimeout;
    }

    /// Resolves a program reference and checks that it can run.
    ///
    /// @param reference program reference, not null
    /// @return the command template, never null
    /// @throws SpecMismatchException if the reference is unknown or its executable is not
    ///     runnable
    public CommandTemplate resolveRunnable(ProgramReference reference) throws SpecMismatchException {
        CommandTemplate template =
                programResolver
                        .resolve(reference)
                        .orElseThrow(
                                () -> new SpecMismatchException("Unknown program reference: " + reference));
        Optional<String> problem = template.checkRunnable();
        if (problem.isPresent()) {
            throw new SpecMismatchException(
                    "Program " + reference + " is not runnable: " + problem.get());
        }
        return template;
    }

    /// Starts an invocation builder carrying the group's environment and defaults.
    ///
    /// @param group the group being executed, not null
    /// @param caseEnvironment innermost environment layer, may be null
    /// @param workingDirectory directory to run in, not null
    /// @param timeout per-invocation override, may be null
    /// @return a builder with environment, working directory and timeout set, never null
    public Invocation.Builder invocation(
            TestGroup group,
            Map<String, String> caseEnvironment,
            Path workingDirectory,
            Duration timeout) {
        return Invocation.builder()
                .environment(
                        EnvironmentLayers.merge(environment, group.getEnvironment(), caseEnvironment))
                .inheritParentEnvironment(group.isInheritParentEnvironment())
                .workingDirectory(workingDirectory)
                .timeout(timeoutFor(timeout));
    }

    /// Encodes stdin text.
    ///
    /// @param stdin text, may be null
    /// @return UTF-8 bytes, empty for null
    public static byte[] stdinBytes(String stdin) {
        return stdin != null ? stdin.getBytes(StandardCharsets.UTF_8) : new byte[0];
    }

    public static final class Builder {
        private GraderConfig config;
        private ProcessRunner processRunner;
        private AssertionEvaluator assertionEvaluator;
        private ProgramResolver programResolver;
        private WorkerPool workerPool;
        private WorkspaceAllocator workspace;
        private GradingListener listener;
        private Path groupDirectory;
        private Map<String, String> environment = Map.of();
        private Duration defaultTimeout;

        private Builder() {}

        public Builder config(GraderConfig config) {
            this.config = config;
            return this;
        }

        public Builder processRunner(ProcessRunner processRunner) {
            this.processRunner = processRunner;
            return this;
        }

        public Builder assertionEvaluator(AssertionEvaluator assertionEvaluator) {
            this.assertionEvaluator = assertionEvaluator;
            return this;
        }

        public Builder programResolver(ProgramResolver programResolver) {
            this.programResolver = programResolver;
            return this;
        }

        public Builder workerPool(WorkerPool workerPool) {
            this.workerPool = workerPool;
            return this;
        }

        public Builder workspace(WorkspaceAllocator workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder listener(GradingListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder groupDirectory(Path groupDirectory) {
            this.groupDirectory = groupDirectory;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public GradingContext build() {
            return new GradingContext(this);
        }
    }
}
