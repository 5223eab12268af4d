package io.clgrader.core.process;

import java.io.IOException;

/// Capability to start an OS process for an {@link Invocation}.
///
/// This is the seam where sandboxes plug in: the {@link ProcessRunner} owns timeouts,
/// capture and reaping, while a launcher only decides how the process is created.
///
/// @see LocalProcessLauncher for the default implementation
@FunctionalInterface
public interface ProcessLauncher {

    /// Starts the process described by `invocation`.
    ///
    /// Implementations apply the executable, arguments, environment and working directory.
    /// Standard input is written by the caller.
    ///
    /// @param invocation the command to start, not null
    /// @return a handle on the running process, never null
    /// @throws IOException if the process cannot be spawned
    LaunchedProcess launch(Invocation invocation) throws IOException;
}
