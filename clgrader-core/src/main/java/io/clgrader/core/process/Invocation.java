package io.clgrader.core.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A fully resolved command ready to hand to the {@link ProcessRunner}.
///
/// @param executable program path or name looked up on `PATH`, not null
/// @param arguments argument vector, not null
/// @param environment variables set on top of the starting environment, not null
/// @param inheritParentEnvironment start from the grader's environment rather than an empty one
/// @param workingDirectory directory the process starts in, not null
/// @param stdin bytes written to standard input before it is closed, never null
/// @param timeout wall-clock limit after which the process tree is killed, positive
/// @param observeResources sample peak memory while the process runs
public record Invocation(
        String executable,
        List<String> arguments,
        Map<String, String> environment,
        boolean inheritParentEnvironment,
        Path workingDirectory,
        byte[] stdin,
        Duration timeout,
        boolean observeResources) {

    public Invocation {
        Objects.requireNonNull(executable, "executable must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        arguments = List.copyOf(arguments);
        environment = Map.copyOf(environment);
        stdin = stdin != null ? stdin : new byte[0];
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the executable followed by its arguments.
    ///
    /// @return the command vector, never null
    public List<String> command() {
        List<String> command = new ArrayList<>(arguments.size() + 1);
        command.add(executable);
        command.addAll(arguments);
        return command;
    }

    public static final class Builder {
        private String executable;
        private final List<String> arguments = new ArrayList<>();
        private final Map<String, String> environment = new LinkedHashMap<>();
        private boolean inheritParentEnvironment = true;
        private Path workingDirectory;
        private byte[] stdin;
        private Duration timeout = Duration.ofSeconds(10);
        private boolean observeResources;

        private Builder() {}

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder arguments(List<String> arguments) {
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder argument(String argument) {
            this.arguments.add(argument);
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment.putAll(environment);
            return this;
        }

        public Builder inheritParentEnvironment(boolean inheritParentEnvironment) {
            this.inheritParentEnvironment = inheritParentEnvironment;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder stdin(byte[] stdin) {
            this.stdin = stdin;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder observeResources(boolean observeResources) {
            this.observeResources = observeResources;
            return this;
        }

        public Invocation build() {
            return new Invocation(
                    executable,
                    arguments,
                    environment,
                    inheritParentEnvironment,
                    workingDirectory,
                    stdin,
                    timeout,
                    observeResources);
        }
    }
}
