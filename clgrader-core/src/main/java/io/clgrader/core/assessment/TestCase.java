package io.clgrader.core.assessment;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A single unit test: how to invoke the program and what to expect.
///
/// ### Contracts
/// - **Invariant**: `arguments` and `expectation` are never null
/// - **Invariant**: `environment` is unmodifiable
///
/// @implNote **Immutable**. Use {@link #builder()} to construct.
///
/// @see ProgramTests
public final class TestCase {

    private final String name;
    private final ArgumentSpec arguments;
    private final String stdin;
    private final Expectation expectation;
    private final int weight;
    private final Duration timeout;
    private final Map<String, String> environment;

    private TestCase(Builder builder) {
        this.name = builder.name;
        this.arguments = Objects.requireNonNull(builder.arguments, "arguments must not be null");
        this.stdin = builder.stdin;
        this.expectation =
                Objects.requireNonNull(builder.expectation, "expectation must not be null");
        this.weight = builder.weight;
        this.timeout = builder.timeout;
        this.environment = Map.copyOf(builder.environment);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the case name.
    ///
    /// @return the name, null only if none was given and the case is not yet part of a
    ///     {@link ProgramTests} block, which assigns `Test <n>`
    public String getName() {
        return name;
    }

    public ArgumentSpec getArguments() {
        return arguments;
    }

    /// Returns the text fed to standard input.
    ///
    /// @return stdin content, may be null for none
    public String getStdin() {
        return stdin;
    }

    public Expectation getExpectation() {
        return expectation;
    }

    public int getWeight() {
        return weight;
    }

    /// Returns the per-case timeout.
    ///
    /// @return the timeout, null to use the section or global default
    public Duration getTimeout() {
        return timeout;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    /// Returns a copy of this case with a different name.
    ///
    /// @param newName the name, not null
    /// @return the renamed case, never null
    public TestCase withName(String newName) {
        return toBuilder().name(newName).build();
    }

    public Builder toBuilder() {
        return builder()
                .name(name)
                .arguments(arguments)
                .stdin(stdin)
                .expectation(expectation)
                .weight(weight)
                .timeout(timeout)
                .environment(environment);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TestCase other)) {
            return false;
        }
        return weight == other.weight
                && Objects.equals(name, other.name)
                && arguments.equals(other.arguments)
                && Objects.equals(stdin, other.stdin)
                && expectation.equals(other.expectation)
                && Objects.equals(timeout, other.timeout)
                && environment.equals(other.environment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments, stdin, expectation, weight, timeout, environment);
    }

    @Override
    public String toString() {
        return "TestCase{name='" + name + "', arguments=" + arguments + ", weight=" + weight + '}';
    }

    public static final class Builder {
        private String name;
        private ArgumentSpec arguments = ArgumentSpec.none();
        private String stdin;
        private Expectation expectation = Expectation.none();
        private int weight = 1;
        private Duration timeout;
        private final Map<String, String> environment = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder arguments(ArgumentSpec arguments) {
            this.arguments = arguments;
            return this;
        }

        public Builder arguments(String... arguments) {
            this.arguments = ArgumentSpec.single(List.of(arguments));
            return this;
        }

        public Builder stdin(String stdin) {
            this.stdin = stdin;
            return this;
        }

        public Builder expectation(Expectation expectation) {
            this.expectation = expectation;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment.clear();
            this.environment.putAll(environment);
            return this;
        }

        public Builder env(String key, String value) {
            this.environment.put(key, value);
            return this;
        }

        public TestCase build() {
            return new TestCase(this);
        }
    }
}
