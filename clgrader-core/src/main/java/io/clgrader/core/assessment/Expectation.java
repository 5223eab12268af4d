package io.clgrader.core.assessment;

import java.util.ArrayList;
import java.util.List;

/// Predicates a single invocation must satisfy.
///
/// Every component is optional; an absent predicate imposes no constraint.
///
/// @param stdout expectation on standard output, may be null
/// @param stderr expectation on standard error, may be null
/// @param status expectation on the exit status, may be null
/// @param files files that must exist afterwards, never null
public record Expectation(
        TextPredicate stdout, TextPredicate stderr, StatusPredicate status, List<FileExpectation> files) {

    private static final Expectation NONE = new Expectation(null, null, null, List.of());

    public Expectation {
        files = files != null ? List.copyOf(files) : List.of();
    }

    public static Expectation none() {
        return NONE;
    }

    /// Expectation used for commands that only need to succeed.
    ///
    /// @return an expectation of exit status `0`, never null
    public static Expectation successfulExit() {
        return new Expectation(null, null, StatusPredicate.exact(0), List.of());
    }

    public boolean isEmpty() {
        return stdout == null && stderr == null && status == null && files.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TextPredicate stdout;
        private TextPredicate stderr;
        private StatusPredicate status;
        private final List<FileExpectation> files = new ArrayList<>();

        private Builder() {}

        public Builder stdout(TextPredicate stdout) {
            this.stdout = stdout;
            return this;
        }

        public Builder stderr(TextPredicate stderr) {
            this.stderr = stderr;
            return this;
        }

        public Builder status(StatusPredicate status) {
            this.status = status;
            return this;
        }

        public Builder status(int status) {
            this.status = StatusPredicate.exact(status);
            return this;
        }

        public Builder file(String path, String content) {
            this.files.add(new FileExpectation(path, content));
            return this;
        }

        public Expectation build() {
            return new Expectation(stdout, stderr, status, files);
        }
    }
}
