package io.clgrader.core.process;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Turns an {@link Invocation} into exactly one {@link Outcome}.
///
/// ### This runner
/// - launches the process through the configured {@link ProcessLauncher}
/// - writes stdin and drains stdout and stderr on background I/O threads, keeping at
///   most `maxCaptureBytes` of each
/// - polls the process until it exits or the timeout elapses, recording descendants and
///   (when requested) peak memory on every poll
/// - kills the process tree on timeout, on interruption, and after a normal exit so that
///   backgrounded grandchildren never outlive the invocation
///
/// Launch errors become {@link OutcomeTag#LAUNCH_FAILED} outcomes and timeouts become
/// {@link OutcomeTag#TIMED_OUT} outcomes; neither is thrown.
///
/// @implNote **Thread-safe**. One runner is shared by every worker of a grading environment.
/// Each call blocks its calling thread until the process is reaped.
public class ProcessRunner implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ProcessRunner.class.getName());

    /// How long to wait for output readers once the process tree is gone.
    private static final Duration CAPTURE_GRACE = Duration.ofSeconds(2);

    private final ProcessLauncher launcher;
    private final ProcessTracker tracker;
    private final int maxCaptureBytes;
    private final Duration pollInterval;
    private final ExecutorService ioPool;

    /// Creates a runner.
    ///
    /// @param launcher process launcher, not null
    /// @param tracker registry of in-flight processes, not null
    /// @param maxCaptureBytes capture limit per stream, positive
    /// @param pollInterval interval between liveness and memory polls, positive
    public ProcessRunner(
            ProcessLauncher launcher,
            ProcessTracker tracker,
            int maxCaptureBytes,
            Duration pollInterval) {
        this.launcher = launcher;
        this.tracker = tracker;
        this.maxCaptureBytes = maxCaptureBytes;
        this.pollInterval = pollInterval;
        this.ioPool = Executors.newCachedThreadPool(new DaemonThreadFactory());
    }

    /// Runs the invocation to completion, timeout or launch failure.
    ///
    /// @param invocation command to run, not null
    /// @return the outcome, never null
    /// @throws InterruptedException if the calling thread is interrupted; the process tree
    ///     is killed before this is thrown
    public Outcome run(Invocation invocation) throws InterruptedException {
        long start = System.nanoTime();
        LaunchedProcess process;
        try {
            process = launcher.launch(invocation);
        } catch (IOException | RuntimeException e) {
            logger.warning("Launch failed for " + invocation.command() + ": " + e.getMessage());
            return Outcome.launchFailed(
                    "Cannot launch '" + invocation.executable() + "': " + e.getMessage());
        }

        tracker.register(process);
        BoundedCapture stdout = new BoundedCapture(process.stdout(), maxCaptureBytes);
        BoundedCapture stderr = new BoundedCapture(process.stderr(), maxCaptureBytes);
        try {
            Future<?> stdoutReader = ioPool.submit(stdout);
            Future<?> stderrReader = ioPool.submit(stderr);
            Future<?> stdinWriter = ioPool.submit(() -> feedStdin(process, invocation.stdin()));

            OptionalLong peakMemory = OptionalLong.empty();
            boolean exited = false;
            long deadline = start + invocation.timeout().toNanos();
            while (!exited) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                process.observeDescendants();
                if (invocation.observeResources()) {
                    peakMemory = process.samplePeakMemory();
                }
                exited = process.waitFor(Duration.ofNanos(Math.min(remaining, pollInterval.toNanos())));
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            process.destroyTree();
            process.waitFor(CAPTURE_GRACE);
            awaitQuietly(stdinWriter, "stdin");
            awaitQuietly(stdoutReader, "stdout");
            awaitQuietly(stderrReader, "stderr");

            Outcome.Builder outcome;
            if (exited) {
                outcome = Outcome.builder(OutcomeTag.COMPLETED).exitStatus(process.exitValue());
            } else {
                logger.warning(
                        "Timed out after " + invocation.timeout().toMillis() + " ms: " + invocation.command());
                outcome =
                        Outcome.builder(OutcomeTag.TIMED_OUT)
                                .diagnostic(
                                        "Timed out after " + invocation.timeout().toMillis() + " ms");
            }
            return outcome.stdout(stdout.bytes(), stdout.isTruncated())
                    .stderr(stderr.bytes(), stderr.isTruncated())
                    .duration(elapsed)
                    .peakMemoryBytes(peakMemory)
                    .build();
        } catch (InterruptedException e) {
            process.destroyTree();
            throw e;
        } finally {
            if (process.isAlive()) {
                process.destroyTree();
            }
            tracker.unregister(process);
        }
    }

    private static void feedStdin(LaunchedProcess process, byte[] stdin) {
        try (OutputStream out = process.stdin()) {
            if (stdin.length > 0) {
                out.write(stdin);
            }
        } catch (IOException e) {
            // The program exited or closed its stdin without reading everything.
            logger.fine("Stdin not fully consumed by pid " + process.pid() + ": " + e.getMessage());
        }
    }

    private static void awaitQuietly(Future<?> task, String stream) throws InterruptedException {
        try {
            task.get(CAPTURE_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warning("Abandoning " + stream + " pipe still held open after the process tree was killed");
            task.cancel(true);
        } catch (ExecutionException e) {
            logger.warning("I/O on " + stream + " failed: " + e.getCause());
        }
    }

    /// Stops the I/O threads. In-flight invocations should be killed first.
    @Override
    public void close() {
        ioPool.shutdownNow();
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "clgrader-io-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
