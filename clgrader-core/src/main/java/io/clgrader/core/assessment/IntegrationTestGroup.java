package io.clgrader.core.assessment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// An ordered sequence of steps sharing one working directory.
///
/// Steps run strictly in order on a single worker. When {@link #isStopIfFail()} is set,
/// the first failing step halts the sequence and the remaining steps are skipped.
///
/// @see io.clgrader.core.execution.executor.IntegrationTestExecutor
public final class IntegrationTestGroup implements TestGroup {

    private final String name;
    private final Map<String, String> environment;
    private final boolean inheritParentEnvironment;
    private final Map<String, String> files;
    private final boolean stopIfFail;
    private final List<IntegrationStep> steps;

    private IntegrationTestGroup(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.environment = Map.copyOf(builder.environment);
        this.inheritParentEnvironment = builder.inheritParentEnvironment;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(builder.files));
        this.stopIfFail = builder.stopIfFail;
        this.steps = List.copyOf(builder.steps);
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

    public boolean isStopIfFail() {
        return stopIfFail;
    }

    public List<IntegrationStep> getSteps() {
        return steps;
    }

    public static final class Builder {
        private String name;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private boolean inheritParentEnvironment = true;
        private final Map<String, String> files = new LinkedHashMap<>();
        private boolean stopIfFail = true;
        private final List<IntegrationStep> steps = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
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

        public Builder file(String fileName, String content) {
            this.files.put(fileName, content);
            return this;
        }

        public Builder files(Map<String, String> files) {
            this.files.putAll(files);
            return this;
        }

        public Builder stopIfFail(boolean stopIfFail) {
            this.stopIfFail = stopIfFail;
            return this;
        }

        public Builder step(IntegrationStep step) {
            this.steps.add(step);
            return this;
        }

        public IntegrationTestGroup build() {
            return new IntegrationTestGroup(this);
        }
    }
}
