package io.clgrader.core.assessment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Independent test cases run as `Setup -> {case in isolation}* -> Teardown`.
///
/// Fixture files are written into a fresh group workspace, setup commands run there,
/// and every case then runs in its own copy of that workspace. Teardown always runs.
///
/// ### Contracts
/// - **Invariant**: at least one {@link ProgramTests} block
/// - **Invariant**: setup and teardown entries are shell-style command lines
///
/// @see io.clgrader.core.execution.executor.UnitTestExecutor
public final class UnitTestGroup implements TestGroup {

    private final String name;
    private final Map<String, String> environment;
    private final boolean inheritParentEnvironment;
    private final Map<String, String> files;
    private final List<String> setup;
    private final List<String> teardown;
    private final boolean abortOnSetupFailure;
    private final List<ProgramTests> programs;

    private UnitTestGroup(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.environment = Map.copyOf(builder.environment);
        this.inheritParentEnvironment = builder.inheritParentEnvironment;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(builder.files));
        this.setup = List.copyOf(builder.setup);
        this.teardown = List.copyOf(builder.teardown);
        this.abortOnSetupFailure = builder.abortOnSetupFailure;
        this.programs = List.copyOf(builder.programs);
        if (programs.isEmpty()) {
            throw new IllegalStateException("Unit test group '" + name + "' has no programs");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Map<String, String> getEnvironment() {
        return environment;
    }

    @Override
    public boolean isInheritParentEnvironment() {
        return inheritParentEnvironment;
    }

    @Override
    public Map<String, String> getFiles() {
        return files;
    }

    public List<String> getSetup() {
        return setup;
    }

    public List<String> getTeardown() {
        return teardown;
    }

    /// Returns whether a failed setup step marks every case of the block as errored.
    ///
    /// @return `true` by default
    public boolean isAbortOnSetupFailure() {
        return abortOnSetupFailure;
    }

    public List<ProgramTests> getPrograms() {
        return programs;
    }

    public static final class Builder {
        private String name;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private boolean inheritParentEnvironment = true;
        private final Map<String, String> files = new LinkedHashMap<>();
        private final List<String> setup = new ArrayList<>();
        private final List<String> teardown = new ArrayList<>();
        private boolean abortOnSetupFailure = true;
        private final List<ProgramTests> programs = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment.putAll(environment);
            return this;
        }

        public Builder env(String key, String value) {
            this.environment.put(key, value);
            return this;
        }

        public Builder inheritParentEnvironment(boolean inheritParentEnvironment) {
            this.inheritParentEnvironment = inheritParentEnvironment;
            return this;
        }

        public Builder file(String fileName, String content) {
            this.files.put(fileName, content);
            return this;
        }

        public Builder files(Map<String, String> files) {
            this.files.putAll(files);
            return this;
        }

        public Builder setup(String commandLine) {
            this.setup.add(commandLine);
            return this;
        }

        public Builder teardown(String commandLine) {
            this.teardown.add(commandLine);
            return this;
        }

        public Builder abortOnSetupFailure(boolean abortOnSetupFailure) {
            this.abortOnSetupFailure = abortOnSetupFailure;
            return this;
        }

        public Builder program(ProgramTests program) {
            this.programs.add(program);
            return this;
        }

        public Builder program(ProgramReference program, List<TestCase> cases) {
            return program(ProgramTests.of(program, cases));
        }

        public UnitTestGroup build() {
            return new UnitTestGroup(this);
        }
    }
}
