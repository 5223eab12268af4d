package io.clgrader.core.process;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Launches invocations as local OS processes through {@link ProcessBuilder}.
///
/// ### Process tree handling
/// Where `setsid` is available every invocation starts as the leader of a new session,
/// so its process group id equals its pid. {@link LaunchedProcess#destroyTree()} sends
/// `SIGKILL` to that whole group, which also reaches grandchildren whose parent already
/// exited. Descendants are additionally recorded through {@link ProcessHandle#descendants()}
/// whenever the runner polls and killed one by one; on platforms without `setsid` this
/// is the only mechanism.
///
/// The executable is checked before launch so that a missing or non-executable program
/// still fails the launch rather than the `setsid` wrapper.
///
/// ### Memory observation
/// On Linux the peak resident set size is read from `VmHWM` in `/proc/<pid>/status`.
/// Other platforms report no value.
public class LocalProcessLauncher implements ProcessLauncher {

    private static final Logger logger = Logger.getLogger(LocalProcessLauncher.class.getName());

    private static final Path SETSID = firstExecutable("/usr/bin/setsid", "/bin/setsid");
    private static final Path KILL = firstExecutable("/usr/bin/kill", "/bin/kill");

    /// How long to wait for the group kill command itself.
    private static final Duration KILL_TIMEOUT = Duration.ofSeconds(1);

    /// Whether invocations are started in their own process group.
    ///
    /// @return `true` when both `setsid` and `kill` were found
    public static boolean isolatesProcessGroups() {
        return SETSID != null && KILL != null;
    }

    @Override
    public LaunchedProcess launch(Invocation invocation) throws IOException {
        boolean isolated = isolatesProcessGroups();
        List<String> command = invocation.command();
        if (isolated) {
            Path executable = locateExecutable(invocation.executable(), invocation.workingDirectory());
            command = new ArrayList<>(command.size() + 1);
            command.add(SETSID.toString());
            command.add(executable.toString());
            command.addAll(invocation.arguments());
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(invocation.workingDirectory().toFile());

        Map<String, String> environment = builder.environment();
        if (!invocation.inheritParentEnvironment()) {
            environment.clear();
        }
        environment.putAll(invocation.environment());

        Process process = builder.start();
        logger.fine("Started pid " + process.pid() + ": " + invocation.command());
        return new LocalProcess(process, isolated);
    }

    /// Resolves the executable the way {@link ProcessBuilder} would.
    ///
    /// Names without a separator are searched on the parent's `PATH`; other paths are
    /// taken relative to the working directory.
    ///
    /// @throws IOException if no executable regular file is found
    static Path locateExecutable(String executable, Path workingDirectory) throws IOException {
        if (executable.indexOf('/') < 0) {
            String path = System.getenv("PATH");
            for (String entry : (path != null ? path : "/bin:/usr/bin").split(File.pathSeparator)) {
                if (entry.isEmpty()) {
                    continue;
                }
                Path candidate = Path.of(entry, executable);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return candidate.toAbsolutePath();
                }
            }
            throw new IOException("No such file or directory: " + executable);
        }
        Path candidate = workingDirectory.resolve(executable).toAbsolutePath();
        if (!Files.exists(candidate)) {
            throw new IOException("No such file or directory: " + executable);
        }
        if (!Files.isRegularFile(candidate) || !Files.isExecutable(candidate)) {
            throw new IOException("Permission denied: " + executable);
        }
        return candidate;
    }

    private static Path firstExecutable(String... candidates) {
        for (String candidate : candidates) {
            Path path = Path.of(candidate);
            if (Files.isExecutable(path)) {
                return path;
            }
        }
        return null;
    }

    static final class LocalProcess implements LaunchedProcess {

        private final Process process;
        private final boolean groupLeader;
        private final Set<ProcessHandle> descendants = ConcurrentHashMap.newKeySet();
        private long peakMemory = -1;

        LocalProcess(Process process, boolean groupLeader) {
            this.process = process;
            this.groupLeader = groupLeader;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public OutputStream stdin() {
            return process.getOutputStream();
        }

        @Override
        public InputStream stdout() {
            return process.getInputStream();
        }

        @Override
        public InputStream stderr() {
            return process.getErrorStream();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toNanos(), TimeUnit.NANOSECONDS);
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public int exitValue() {
            return process.exitValue();
        }

        @Override
        public void observeDescendants() {
            process.descendants().forEach(descendants::add);
        }

        @Override
        public void destroyTree() {
            if (groupLeader) {
                killGroup(process.pid());
            }
            observeDescendants();
            descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        private static void killGroup(long pgid) {
            try {
                Process kill =
                        new ProcessBuilder(KILL.toString(), "-KILL", "--", "-" + pgid)
                                .redirectErrorStream(true)
                                .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                                .start();
                if (!kill.waitFor(KILL_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    kill.destroyForcibly();
                    logger.warning("Group kill of " + pgid + " did not finish");
                }
            } catch (IOException e) {
                logger.warning("Cannot kill process group " + pgid + ": " + e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warning("Interrupted while killing process group " + pgid);
            }
        }

        @Override
        public synchronized OptionalLong samplePeakMemory() {
            long sample = readPeakResident(process.pid());
            if (sample > peakMemory) {
                peakMemory = sample;
            }
            return peakMemory >= 0 ? OptionalLong.of(peakMemory) : OptionalLong.empty();
        }

        private static long readPeakResident(long pid) {
            Path status = Path.of("/proc", Long.toString(pid), "status");
            if (!Files.isReadable(status)) {
                return -1;
            }
            try {
                List<String> lines = Files.readAllLines(status);
                for (String line : lines) {
                    if (line.startsWith("VmHWM:")) {
                        return parseKilobytes(line) * 1024L;
                    }
                }
            } catch (IOException e) {
                // The process may exit between the check and the read.
                logger.finest("Memory sample unavailable for pid " + pid + ": " + e.getMessage());
            }
            return -1;
        }

        private static long parseKilobytes(String line) {
            String digits = line.substring("VmHWM:".length()).replace("kB", "").trim();
            try {
                return Long.parseLong(digits);
            } catch (NumberFormatException e) {
                logger.finest("Unparseable memory line: " + line);
                return -1;
            }
        }
    }
}
