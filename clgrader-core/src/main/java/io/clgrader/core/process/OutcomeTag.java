package io.clgrader.core.process;

/// How an invocation ended.
public enum OutcomeTag {

    /// The process exited on its own; an exit status is available.
    COMPLETED,

    /// The timeout elapsed and the process tree was killed.
    TIMED_OUT,

    /// The executable could not be spawned.
    LAUNCH_FAILED
}
