package io.clgrader.core.assessment;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/// Memory profiling of a benchmark through an external tool such as valgrind.
///
/// The program's command is appended to `toolCommand`. A leak is detected when the tool
/// exits with `leakExitStatus`, or when its stderr contains a match of `leakPattern`.
///
/// @param toolCommand tool executable and its options, not empty
/// @param leakExitStatus exit status signalling a leak, may be null
/// @param leakPattern regex searched in the tool's stderr, may be null
/// @param policy what a detected leak does to the verdict, not null
public record ProfilingConfig(
        List<String> toolCommand, Integer leakExitStatus, String leakPattern, LeakPolicy policy) {

    public ProfilingConfig {
        toolCommand = List.copyOf(toolCommand);
        if (toolCommand.isEmpty()) {
            throw new IllegalArgumentException("Profiling tool command must not be empty");
        }
        Objects.requireNonNull(policy, "policy must not be null");
        if (leakPattern != null) {
            Pattern.compile(leakPattern);
        }
    }
}
