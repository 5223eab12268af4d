package io.clgrader.core.assessment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Benchmarks run one after another on a single worker, each in a fresh directory.
///
/// @see io.clgrader.core.execution.executor.PerformanceTestExecutor
public final class PerformanceTestGroup implements TestGroup {

    private final String name;
    private final Map<String, String> environment;
    private final boolean inheritParentEnvironment;
    private final Map<String, String> files;
    private final List<Benchmark> benchmarks;

    private PerformanceTestGroup(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.environment = Map.copyOf(builder.environment);
        this.inheritParentEnvironment = builder.inheritParentEnvironment;
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(builder.files));
        this.benchmarks = List.copyOf(builder.benchmarks);
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

    public List<Benchmark> getBenchmarks() {
        return benchmarks;
    }

    public static final class Builder {
        private String name;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private boolean inheritParentEnvironment = true;
        private final Map<String, String> files = new LinkedHashMap<>();
        private final List<Benchmark> benchmarks = new ArrayList<>();

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

        public Builder files(Map<String, String> files) {
            this.files.putAll(files);
            return this;
        }

        public Builder benchmark(Benchmark benchmark) {
            this.benchmarks.add(benchmark);
            return this;
        }

        public PerformanceTestGroup build() {
            return new PerformanceTestGroup(this);
        }
    }
}
