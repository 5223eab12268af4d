package io.clgrader.core;

import io.clgrader.core.execution.GradingEngine;
import io.clgrader.core.execution.GradingListener;
import io.clgrader.core.execution.WorkerPool;
import io.clgrader.core.execution.executor.DefaultTestGroupExecutorRegistry;
import io.clgrader.core.execution.executor.TestGroupExecutor;
import io.clgrader.core.execution.executor.TestGroupExecutorRegistry;
import io.clgrader.core.process.LocalProcessLauncher;
import io.clgrader.core.process.ProcessLauncher;
import io.clgrader.core.process.ProcessRunner;
import io.clgrader.core.process.ProcessTracker;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring grading environments.
///
/// ### Usage Patterns
///
/// **Quick start with environment variables**:
/// {@snippet :
/// try (var env = GraderFactory.createEnvironment()) {
///     GradingResult result = env.grade(assessment, resolver);
/// }
/// }
///
/// **Builder**:
/// {@snippet :
/// var env = GraderFactory.builder()
///     .config(GraderConfig.builder().workerPoolSize(2).build())
///     .listener(progressListener)
///     .build();
/// }
///
/// @see GraderEnvironment
/// @see GraderConfig
public final class GraderFactory {

    private static final Logger logger = Logger.getLogger(GraderFactory.class.getName());

    /// Prefix of environment variables mapped onto `clgrader.*` settings.
    public static final String ENVIRONMENT_PREFIX = "CLGRADER_";

    private GraderFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment configured from `CLGRADER_*` environment variables.
    ///
    /// @apiNote **Side effects**:
    /// - Reads environment variables
    /// - Starts thread pools and, unless disabled, registers a JVM shutdown hook
    ///
    /// @return a fully-configured environment, never null
    /// @see #loadSettingsFromEnvironment()
    public static GraderEnvironment createEnvironment() {
        return createEnvironment(GraderConfig.fromProperties(loadSettingsFromEnvironment()));
    }

    /// Creates an environment that launches processes on this machine.
    ///
    /// @param config configuration, not null
    /// @return a fully-configured environment, never null
    public static GraderEnvironment createEnvironment(GraderConfig config) {
        return createEnvironment(config, new LocalProcessLauncher());
    }

    /// Creates an environment with a custom process launcher.
    ///
    /// @param config configuration, not null
    /// @param launcher process launcher, not null
    /// @return a fully-configured environment, never null
    public static GraderEnvironment createEnvironment(GraderConfig config, ProcessLauncher launcher) {
        return createEnvironment(
                config, launcher, new DefaultTestGroupExecutorRegistry(), GradingListener.NOOP);
    }

    /// Creates an environment with all components supplied.
    ///
    /// This is the method the other overloads delegate to.
    ///
    /// @param config configuration, not null
    /// @param launcher process launcher, not null
    /// @param executorRegistry strategy executors, not null
    /// @param listener progress callbacks, not null
    /// @return a fully-configured environment, never null
    public static GraderEnvironment createEnvironment(
            GraderConfig config,
            ProcessLauncher launcher,
            TestGroupExecutorRegistry executorRegistry,
            GradingListener listener) {
        ProcessTracker tracker = new ProcessTracker();
        ProcessRunner processRunner =
                new ProcessRunner(
                        launcher, tracker, config.getMaxCaptureBytes(), config.getPollInterval());

        ExecutorService workerService =
                Executors.newFixedThreadPool(
                        config.getWorkerPoolSize(), new NamedThreadFactory("clgrader-worker-"));
        ExecutorService coordinatorService =
                Executors.newCachedThreadPool(new NamedThreadFactory("clgrader-coordinator-"));

        GradingEngine engine =
                new GradingEngine(
                        config,
                        executorRegistry,
                        processRunner,
                        new WorkerPool(workerService),
                        coordinatorService,
                        listener);

        Thread shutdownHook = null;
        if (config.isRegisterShutdownHook()) {
            shutdownHook = new Thread(tracker::destroyAll, "clgrader-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        }

        logger.info(
                "Grading environment created: workers="
                        + config.getWorkerPoolSize()
                        + ", defaultTimeout="
                        + config.getDefaultTimeout().toMillis()
                        + "ms");
        return new GraderEnvironment(
                config,
                engine,
                executorRegistry,
                processRunner,
                tracker,
                workerService,
                coordinatorService,
                shutdownHook);
    }

    /// Maps `CLGRADER_*` environment variables onto `clgrader.*` settings.
    ///
    /// `CLGRADER_WORKER_POOL_SIZE` becomes `clgrader.worker-pool-size`.
    ///
    /// @return the settings, never null (may be empty)
    public static Map<String, String> loadSettingsFromEnvironment() {
        return settingsFromEnvironment(System.getenv());
    }

    static Map<String, String> settingsFromEnvironment(Map<String, String> environment) {
        Map<String, String> settings = new HashMap<>();
        environment.forEach(
                (key, value) -> {
                    if (key.startsWith(ENVIRONMENT_PREFIX) && value != null && !value.isEmpty()) {
                        String name =
                                key.substring(ENVIRONMENT_PREFIX.length())
                                        .toLowerCase(Locale.ROOT)
                                        .replace('_', '-');
                        settings.put("clgrader." + name, value);
                    }
                });
        return settings;
    }

    /// Extracts `clgrader.*` settings from properties.
    ///
    /// @param properties the properties, not null
    /// @return the settings, never null (may be empty)
    public static Map<String, String> loadSettingsFromProperties(Properties properties) {
        Map<String, String> settings = new HashMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith("clgrader.")) {
                settings.put(name, properties.getProperty(name));
            }
        }
        return settings;
    }

    /// Loads settings from environment variables and properties.
    ///
    /// Properties take precedence over environment variables when the same key exists in
    /// both sources.
    ///
    /// @param properties the properties to merge, not null
    /// @return merged settings, never null
    public static Map<String, String> loadSettings(Properties properties) {
        Map<String, String> settings = loadSettingsFromEnvironment();
        settings.putAll(loadSettingsFromProperties(properties));
        return settings;
    }

    /// Creates a new builder for configuring a grading environment.
    ///
    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GraderEnvironment}.
    ///
    /// Custom executors added with {@link #executor(TestGroupExecutor)} replace the
    /// built-in executor for the same group type.
    public static final class Builder {
        private GraderConfig config = new GraderConfig();
        private ProcessLauncher launcher = new LocalProcessLauncher();
        private GradingListener listener = GradingListener.NOOP;
        private final List<TestGroupExecutor<?>> executors = new ArrayList<>();

        private Builder() {}

        public Builder config(GraderConfig config) {
            this.config = config;
            return this;
        }

        /// Applies `clgrader.*` settings on top of defaults.
        ///
        /// @param settings the settings, not null
        /// @return this builder
        public Builder settings(Map<String, String> settings) {
            this.config = GraderConfig.fromProperties(settings);
            return this;
        }

        public Builder launcher(ProcessLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder listener(GradingListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder executor(TestGroupExecutor<?> executor) {
            this.executors.add(executor);
            return this;
        }

        /// Builds the environment.
        ///
        /// @return a fully-configured environment, never null
        public GraderEnvironment build() {
            TestGroupExecutorRegistry registry = new DefaultTestGroupExecutorRegistry();
            for (TestGroupExecutor<?> executor : executors) {
                registry.register(executor);
            }
            return createEnvironment(config, launcher, registry, listener);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
