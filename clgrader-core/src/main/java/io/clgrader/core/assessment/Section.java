package io.clgrader.core.assessment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A named, weighted part of an assessment holding ordered test groups.
///
/// The section's weight multiplies its earned and possible sums when the assessment
/// total is folded. A grading-mode override applies to the section's subtree only.
public final class Section {

    private final String name;
    private final int weight;
    private final boolean visible;
    private final GradingMode gradingMode;
    private final Map<String, String> environment;
    private final Duration defaultTimeout;
    private final List<TestGroup> groups;

    private Section(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.weight = builder.weight;
        this.visible = builder.visible;
        this.gradingMode = builder.gradingMode;
        this.environment = Map.copyOf(builder.environment);
        this.defaultTimeout = builder.defaultTimeout;
        this.groups = List.copyOf(builder.groups);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public int getWeight() {
        return weight;
    }

    /// Returns whether the section's results are shown to students.
    ///
    /// @return `true` unless the section was declared private
    public boolean isVisible() {
        return visible;
    }

    /// Returns the grading-mode override.
    ///
    /// @return the override, null to inherit the assessment's mode
    public GradingMode getGradingMode() {
        return gradingMode;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public List<TestGroup> getGroups() {
        return groups;
    }

    public static final class Builder {
        private String name;
        private int weight = 1;
        private boolean visible = true;
        private GradingMode gradingMode;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Duration defaultTimeout;
        private final List<TestGroup> groups = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder gradingMode(GradingMode gradingMode) {
            this.gradingMode = gradingMode;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment.putAll(environment);
            return this;
        }

        public Builder defaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder group(TestGroup group) {
            this.groups.add(group);
            return this;
        }

        public Section build() {
            return new Section(this);
        }
    }
}
