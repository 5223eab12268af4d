package io.clgrader.core.assessment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A timed run of a program with optional memory bound, stress test and profiling.
///
/// @see io.clgrader.core.execution.executor.PerformanceTestExecutor
public final class Benchmark {

    private final String name;
    private final int weight;
    private final ProgramReference program;
    private final List<String> arguments;
    private final String stdin;
    private final Duration expectedMaxTime;
    private final Long expectedMaxMemoryBytes;
    private final Duration timeout;
    private final StressTest stressTest;
    private final ProfilingConfig profiling;

    private Benchmark(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name must not be null");
        this.weight = builder.weight;
        this.program = Objects.requireNonNull(builder.program, "program must not be null");
        this.arguments = List.copyOf(builder.arguments);
        this.stdin = builder.stdin;
        this.expectedMaxTime =
                Objects.requireNonNull(builder.expectedMaxTime, "expectedMaxTime must not be null");
        this.expectedMaxMemoryBytes = builder.expectedMaxMemoryBytes;
        this.timeout = builder.timeout;
        this.stressTest = builder.stressTest;
        this.profiling = builder.profiling;
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

    public ProgramReference getProgram() {
        return program;
    }

    public List<String> getArguments() {
        return arguments;
    }

    public String getStdin() {
        return stdin;
    }

    public Duration getExpectedMaxTime() {
        return expectedMaxTime;
    }

    /// Returns the peak memory bound.
    ///
    /// @return bound in bytes, null when memory is not checked
    public Long getExpectedMaxMemoryBytes() {
        return expectedMaxMemoryBytes;
    }

    /// Returns the hard kill timeout for each run.
    ///
    /// @return the timeout, null for the section or global default
    public Duration getTimeout() {
        return timeout;
    }

    public StressTest getStressTest() {
        return stressTest;
    }

    public ProfilingConfig getProfiling() {
        return profiling;
    }

    public static final class Builder {
        private String name;
        private int weight = 1;
        private ProgramReference program;
        private final List<String> arguments = new ArrayList<>();
        private String stdin;
        private Duration expectedMaxTime;
        private Long expectedMaxMemoryBytes;
        private Duration timeout;
        private StressTest stressTest;
        private ProfilingConfig profiling;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder program(ProgramReference program) {
            this.program = program;
            return this;
        }

        public Builder arguments(List<String> arguments) {
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder stdin(String stdin) {
            this.stdin = stdin;
            return this;
        }

        public Builder expectedMaxTime(Duration expectedMaxTime) {
            this.expectedMaxTime = expectedMaxTime;
            return this;
        }

        public Builder expectedMaxMemoryBytes(Long expectedMaxMemoryBytes) {
            this.expectedMaxMemoryBytes = expectedMaxMemoryBytes;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder stressTest(StressTest stressTest) {
            this.stressTest = stressTest;
            return this;
        }

        public Builder profiling(ProfilingConfig profiling) {
            this.profiling = profiling;
            return this;
        }

        public Benchmark build() {
            return new Benchmark(this);
        }
    }
}
