package io.clgrader.core.process;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;

/// Everything observed about one invocation.
///
/// Created only by the {@link ProcessRunner}, exactly once per invocation. A student
/// program that crashes, hangs or cannot be started still yields an outcome; none of
/// these conditions is an exception.
///
/// ### Contracts
/// - **Invariant**: {@link #getExitStatus()} is non-null iff the tag is {@link OutcomeTag#COMPLETED}
/// - **Invariant**: captured output never exceeds the configured capture limit
///
/// @implNote **Immutable**. Byte arrays are defensively copied on the way in and out.
public final class Outcome {

    private final OutcomeTag tag;
    private final Integer exitStatus;
    private final byte[] stdout;
    private final byte[] stderr;
    private final boolean stdoutTruncated;
    private final boolean stderrTruncated;
    private final Duration duration;
    private final long peakMemoryBytes;
    private final String diagnostic;

    private Outcome(Builder builder) {
        this.tag = Objects.requireNonNull(builder.tag, "tag must not be null");
        this.exitStatus = builder.exitStatus;
        this.stdout = builder.stdout.clone();
        this.stderr = builder.stderr.clone();
        this.stdoutTruncated = builder.stdoutTruncated;
        this.stderrTruncated = builder.stderrTruncated;
        this.duration = builder.duration;
        this.peakMemoryBytes = builder.peakMemoryBytes;
        this.diagnostic = builder.diagnostic;
        if ((tag == OutcomeTag.COMPLETED) != (exitStatus != null)) {
            throw new IllegalStateException("Exit status is required exactly for completed outcomes");
        }
    }

    public static Builder builder(OutcomeTag tag) {
        return new Builder(tag);
    }

    /// Creates an outcome for an executable that could not be spawned.
    ///
    /// @param diagnostic why the launch failed, not null
    /// @return the outcome, never null
    public static Outcome launchFailed(String diagnostic) {
        return builder(OutcomeTag.LAUNCH_FAILED).diagnostic(diagnostic).build();
    }

    public OutcomeTag getTag() {
        return tag;
    }

    public boolean isCompleted() {
        return tag == OutcomeTag.COMPLETED;
    }

    /// Returns the exit status.
    ///
    /// For a process terminated by a signal this is `128 + signal`, as reported by the JDK.
    ///
    /// @return the status, null unless completed
    public Integer getExitStatus() {
        return exitStatus;
    }

    public byte[] getStdout() {
        return stdout.clone();
    }

    public byte[] getStderr() {
        return stderr.clone();
    }

    public String getStdoutText() {
        return new String(stdout, StandardCharsets.UTF_8);
    }

    public String getStderrText() {
        return new String(stderr, StandardCharsets.UTF_8);
    }

    public boolean isStdoutTruncated() {
        return stdoutTruncated;
    }

    public boolean isStderrTruncated() {
        return stderrTruncated;
    }

    /// Returns the wall-clock time from launch until exit or kill.
    ///
    /// @return the duration, {@link Duration#ZERO} when the launch failed
    public Duration getDuration() {
        return duration;
    }

    /// Returns the peak resident memory observed.
    ///
    /// @return peak bytes, empty when not observed or not available on this platform
    public OptionalLong getPeakMemoryBytes() {
        return peakMemoryBytes >= 0 ? OptionalLong.of(peakMemoryBytes) : OptionalLong.empty();
    }

    /// Returns the runner's explanation for a non-completed outcome.
    ///
    /// @return diagnostic text, may be null
    public String getDiagnostic() {
        return diagnostic;
    }

    @Override
    public String toString() {
        return "Outcome{tag="
                + tag
                + ", exitStatus="
                + exitStatus
                + ", duration="
                + duration
                + ", stdoutBytes="
                + stdout.length
                + ", stderrBytes="
                + stderr.length
                + '}';
    }

    public static final class Builder {
        private final OutcomeTag tag;
        private Integer exitStatus;
        private byte[] stdout = new byte[0];
        private byte[] stderr = new byte[0];
        private boolean stdoutTruncated;
        private boolean stderrTruncated;
        private Duration duration = Duration.ZERO;
        private long peakMemoryBytes = -1;
        private String diagnostic;

        private Builder(OutcomeTag tag) {
            this.tag = tag;
        }

        public Builder exitStatus(Integer exitStatus) {
            this.exitStatus = exitStatus;
            return this;
        }

        public Builder stdout(byte[] stdout, boolean truncated) {
            this.stdout = stdout;
            this.stdoutTruncated = truncated;
            return this;
        }

        public Builder stderr(byte[] stderr, boolean truncated) {
            this.stderr = stderr;
            this.stderrTruncated = truncated;
            return this;
        }

        public Builder stdout(String stdout) {
            return stdout(stdout.getBytes(StandardCharsets.UTF_8), false);
        }

        public Builder stderr(String stderr) {
            return stderr(stderr.getBytes(StandardCharsets.UTF_8), false);
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public Builder peakMemoryBytes(OptionalLong peakMemoryBytes) {
            this.peakMemoryBytes = peakMemoryBytes.orElse(-1);
            return this;
        }

        public Builder diagnostic(String diagnostic) {
            this.diagnostic = diagnostic;
            return this;
        }

        public Outcome build() {
            return new Outcome(this);
        }
    }
}
