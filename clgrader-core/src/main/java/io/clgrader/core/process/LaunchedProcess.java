package io.clgrader.core.process;

import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.OptionalLong;

/// Handle on a running process created by a {@link ProcessLauncher}.
public interface LaunchedProcess {

    long pid();

    OutputStream stdin();

    InputStream stdout();

    InputStream stderr();

    /// Waits for the process to exit.
    ///
    /// @param timeout maximum time to wait, not null
    /// @return `true` if the process has exited
    /// @throws InterruptedException if the waiting thread is interrupted
    boolean waitFor(Duration timeout) throws InterruptedException;

    boolean isAlive();

    /// Returns the exit status of an exited process.
    ///
    /// @return the exit status
    /// @throws IllegalThreadStateException if the process has not exited
    int exitValue();

    /// Forcibly kills the process, its process group where the launcher created one, and
    /// every descendant seen so far.
    ///
    /// Safe to call repeatedly and after the process exited.
    void destroyTree();

    /// Records the current descendants so they can be killed after the parent exits.
    default void observeDescendants() {}

    /// Samples memory and returns the peak resident size seen so far.
    ///
    /// @return peak bytes, empty when the platform does not expose it
    default OptionalLong samplePeakMemory() {
        return OptionalLong.empty();
    }
}
