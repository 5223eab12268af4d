package io.clgrader.core;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/// Configuration options for a grading environment.
///
/// Controls the worker pool, process limits and workspace handling. Use the
/// {@link Builder} for fluent configuration, the setters for mutable configuration, or
/// {@link #fromProperties(Map)} to read `clgrader.*` keys.
///
/// ### Default Values
/// - `workerPoolSize`: number of available processors
/// - `defaultTimeout`: 10 seconds per invocation
/// - `maxCaptureBytes`: 1 MiB per stream
/// - `workspaceRoot`: `null` (a fresh temporary directory per run)
/// - `shell`: `/bin/sh -c`
/// - `pollInterval`: 10 ms
/// - `keepWorkspaces`: `false`
/// - `registerShutdownHook`: `true`
///
/// @implNote **Not thread-safe**. Configure before passing to {@link GraderFactory} and
/// do not modify afterwards.
///
/// @see GraderFactory#createEnvironment(GraderConfig)
public class GraderConfig {

    /// Property key for {@link #getWorkerPoolSize()}.
    public static final String WORKER_POOL_SIZE = "clgrader.worker-pool-size";

    /// Property key for {@link #getDefaultTimeout()}, in milliseconds.
    public static final String DEFAULT_TIMEOUT_MS = "clgrader.default-timeout-ms";

    /// Property key for {@link #getMaxCaptureBytes()}.
    public static final String MAX_CAPTURE_BYTES = "clgrader.max-capture-bytes";

    /// Property key for {@link #getWorkspaceRoot()}.
    public static final String WORKSPACE_ROOT = "clgrader.workspace-root";

    /// Property key for {@link #getPollInterval()}, in milliseconds.
    public static final String POLL_INTERVAL_MS = "clgrader.poll-interval-ms";

    /// Property key for {@link #isKeepWorkspaces()}.
    public static final String KEEP_WORKSPACES = "clgrader.keep-workspaces";

    /// Property key for {@link #isRegisterShutdownHook()}.
    public static final String REGISTER_SHUTDOWN_HOOK = "clgrader.register-shutdown-hook";

    private int workerPoolSize = Runtime.getRuntime().availableProcessors();
    private Duration defaultTimeout = Duration.ofSeconds(10);
    private int maxCaptureBytes = 1024 * 1024;
    private Path workspaceRoot;
    private List<String> shell = List.of("/bin/sh", "-c");
    private Duration pollInterval = Duration.ofMillis(10);
    private boolean keepWorkspaces;
    private boolean registerShutdownHook = true;

    /// Creates a configuration with default values.
    public GraderConfig() {}

    /// Creates a configuration from `clgrader.*` settings, using defaults for missing keys.
    ///
    /// @param settings key-value settings, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a numeric setting cannot be parsed
    public static GraderConfig fromProperties(Map<String, String> settings) {
        GraderConfig config = new GraderConfig();
        String value = settings.get(WORKER_POOL_SIZE);
        if (value != null) {
            config.setWorkerPoolSize(parseInt(WORKER_POOL_SIZE, value));
        }
        value = settings.get(DEFAULT_TIMEOUT_MS);
        if (value != null) {
            config.setDefaultTimeout(Duration.ofMillis(parseInt(DEFAULT_TIMEOUT_MS, value)));
        }
        value = settings.get(MAX_CAPTURE_BYTES);
        if (value != null) {
            config.setMaxCaptureBytes(parseInt(MAX_CAPTURE_BYTES, value));
        }
        value = settings.get(WORKSPACE_ROOT);
        if (value != null && !value.isBlank()) {
            config.setWorkspaceRoot(Path.of(value));
        }
        value = settings.get(POLL_INTERVAL_MS);
        if (value != null) {
            config.setPollInterval(Duration.ofMillis(parseInt(POLL_INTERVAL_MS, value)));
        }
        value = settings.get(KEEP_WORKSPACES);
        if (value != null) {
            config.setKeepWorkspaces(Boolean.parseBoolean(value.trim()));
        }
        value = settings.get(REGISTER_SHUTDOWN_HOOK);
        if (value != null) {
            config.setRegisterShutdownHook(Boolean.parseBoolean(value.trim()));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    /// Returns the number of workers allowed to run processes at the same time.
    ///
    /// @return the pool size, positive
    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    /// Sets the worker pool size.
    ///
    /// ### Contracts
    /// - **Precondition**: `workerPoolSize` must be positive
    ///
    /// @param workerPoolSize concurrent process-running units
    public void setWorkerPoolSize(int workerPoolSize) {
        if (workerPoolSize <= 0) {
            throw new IllegalArgumentException("Worker pool size must be positive");
        }
        this.workerPoolSize = workerPoolSize;
    }

    /// Returns the invocation timeout used when neither the case, the section nor the
    /// assessment sets one.
    ///
    /// @return the timeout, never null
    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getMaxCaptureBytes() {
        return maxCaptureBytes;
    }

    public void setMaxCaptureBytes(int maxCaptureBytes) {
        this.maxCaptureBytes = maxCaptureBytes;
    }

    /// Returns the directory under which per-run workspaces are created.
    ///
    /// @return the root, or null for the system temporary directory
    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public void setWorkspaceRoot(Path workspaceRoot) {
        this.workspaceRoot = workspaceRoot;
    }

    /// Returns the shell prefix used for raw integration command lines.
    ///
    /// @return shell executable and options, the command line is appended, never null
    public List<String> getShell() {
        return shell;
    }

    public void setShell(List<String> shell) {
        this.shell = List.copyOf(shell);
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    /// Returns whether workspaces survive the run, for debugging a grading setup.
    ///
    /// @return `true` to keep per-run directories on disk
    public boolean isKeepWorkspaces() {
        return keepWorkspaces;
    }

    public void setKeepWorkspaces(boolean keepWorkspaces) {
        this.keepWorkspaces = keepWorkspaces;
    }

    public boolean isRegisterShutdownHook() {
        return registerShutdownHook;
    }

    public void setRegisterShutdownHook(boolean registerShutdownHook) {
        this.registerShutdownHook = registerShutdownHook;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GraderConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final GraderConfig config = new GraderConfig();

        public Builder workerPoolSize(int workerPoolSize) {
            config.setWorkerPoolSize(workerPoolSize);
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            config.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder maxCaptureBytes(int maxCaptureBytes) {
            config.maxCaptureBytes = maxCaptureBytes;
            return this;
        }

        public Builder workspaceRoot(Path workspaceRoot) {
            config.workspaceRoot = workspaceRoot;
            return this;
        }

        public Builder shell(List<String> shell) {
            config.setShell(shell);
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            config.pollInterval = pollInterval;
            return this;
        }

        public Builder keepWorkspaces(boolean keepWorkspaces) {
            config.keepWorkspaces = keepWorkspaces;
            return this;
        }

        public Builder registerShutdownHook(boolean registerShutdownHook) {
            config.registerShutdownHook = registerShutdownHook;
            return this;
        }

        /// Builds and returns the configured {@link GraderConfig} instance.
        ///
        /// @return the configured instance, never null
        public GraderConfig build() {
            return config;
        }
    }
}
