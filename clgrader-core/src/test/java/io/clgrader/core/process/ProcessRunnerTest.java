package io.clgrader.core.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    @TempDir Path workingDirectory;

    private ProcessTracker tracker;
    private ProcessRunner runner;

    @BeforeEach
    void setUp() {
        tracker = new ProcessTracker();
        runner = new ProcessRunner(new LocalProcessLauncher(), tracker, 1024, Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() {
        tracker.destroyAll();
        runner.close();
    }

    private Invocation.Builder shell(String script) {
        return Invocation.builder()
                .executable("/bin/sh")
                .argument("-c")
                .argument(script)
                .workingDirectory(workingDirectory)
                .timeout(Duration.ofSeconds(10));
    }

    @Nested
    class Completed {

        @Test
        void shouldCaptureStdoutStderrAndStatus() throws Exception {
            Outcome outcome = runner.run(shell("echo out; echo err >&2; exit 3").build());

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.COMPLETED);
            assertThat(outcome.getExitStatus()).isEqualTo(3);
            assertThat(outcome.getStdoutText()).isEqualTo("out\n");
            assertThat(outcome.getStderrText()).isEqualTo("err\n");
            assertThat(outcome.getDiagnostic()).isNull();
        }

        @Test
        void shouldFeedStdin() throws Exception {
            Outcome outcome =
                    runner.run(shell("tr a-z A-Z").stdin("hello\n".getBytes(StandardCharsets.UTF_8)).build());

            assertThat(outcome.getStdoutText()).isEqualTo("HELLO\n");
        }

        @Test
        void shouldPassArgumentsVerbatim() throws Exception {
            Outcome outcome =
                    runner.run(
                            shell("printf '%s|' \"$@\"")
                                    .argument("prog")
                                    .argument("a b")
                                    .argument("$HOME")
                                    .build());

            assertThat(outcome.getStdoutText()).isEqualTo("a b|$HOME|");
        }

        @Test
        void shouldStartInWorkingDirectoryWithLayeredEnvironment() throws Exception {
            Outcome outcome =
                    runner.run(
                            shell("echo \"$GREETING\" > out.txt; cat out.txt")
                                    .environment(Map.of("GREETING", "hi"))
                                    .build());

            assertThat(outcome.getStdoutText()).isEqualTo("hi\n");
            assertThat(Files.readString(workingDirectory.resolve("out.txt"))).isEqualTo("hi\n");
        }

        @Test
        void shouldStartFromEmptyEnvironmentWhenNotInheriting() throws Exception {
            Outcome outcome =
                    runner.run(
                            shell("echo \"[$HOME][$ONLY]\"")
                                    .inheritParentEnvironment(false)
                                    .environment(Map.of("ONLY", "me"))
                                    .build());

            assertThat(outcome.getStdoutText()).isEqualTo("[][me]\n");
        }

        @Test
        void shouldFindBareExecutableNameOnPath() throws Exception {
            Outcome outcome =
                    runner.run(
                            Invocation.builder()
                                    .executable("sh")
                                    .argument("-c")
                                    .argument("echo found")
                                    .workingDirectory(workingDirectory)
                                    .inheritParentEnvironment(false)
                                    .build());

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.COMPLETED);
            assertThat(outcome.getStdoutText()).isEqualTo("found\n");
        }

        @Test
        void shouldTruncateOutputBeyondCaptureLimit() throws Exception {
            Outcome outcome =
                    runner.run(shell("i=0; while [ $i -lt 300 ]; do echo 0123456789; i=$((i+1)); done").build());

            assertThat(outcome.getExitStatus()).isZero();
            assertThat(outcome.getStdout()).hasSize(1024);
            assertThat(outcome.isStdoutTruncated()).isTrue();
            assertThat(outcome.isStderrTruncated()).isFalse();
        }
    }

    @Nested
    class NotCompleted {

        @Test
        void shouldKillProgramOnTimeout() throws Exception {
            long start = System.nanoTime();

            Outcome outcome =
                    runner.run(shell("echo started; exec sleep 30").timeout(Duration.ofMillis(300)).build());

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.TIMED_OUT);
            assertThat(outcome.getExitStatus()).isNull();
            assertThat(outcome.getDiagnostic()).isEqualTo("Timed out after 300 ms");
            assertThat(outcome.getStdoutText()).isEqualTo("started\n");
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
            assertThat(tracker.size()).isZero();
        }

        @Test
        void shouldReportLaunchFailureForMissingExecutable() throws Exception {
            Invocation invocation =
                    Invocation.builder()
                            .executable(workingDirectory.resolve("missing").toString())
                            .workingDirectory(workingDirectory)
                            .build();

            Outcome outcome = runner.run(invocation);

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.LAUNCH_FAILED);
            assertThat(outcome.isCompleted()).isFalse();
            assertThat(outcome.getDiagnostic()).startsWith("Cannot launch '");
            assertThat(tracker.size()).isZero();
        }

        @Test
        void shouldReportLaunchFailureForNonExecutableFile() throws Exception {
            Path script = Files.writeString(workingDirectory.resolve("calc"), "#!/bin/sh\necho hi\n");

            Outcome outcome =
                    runner.run(
                            Invocation.builder()
                                    .executable(script.toString())
                                    .workingDirectory(workingDirectory)
                                    .build());

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.LAUNCH_FAILED);
        }
    }

    @Nested
    @EnabledOnOs(OS.LINUX)
    class BackgroundedGrandchild {

        @BeforeEach
        void requireProcessGroups() {
            assumeTrue(LocalProcessLauncher.isolatesProcessGroups());
        }

        @Test
        void shouldKillOrphanedGrandchildOnTimeout() throws Exception {
            Outcome outcome =
                    runner.run(
                            shell("(sleep 37 & echo $! > bg.pid); sleep 37")
                                    .timeout(Duration.ofMillis(500))
                                    .build());

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.TIMED_OUT);
            assertThat(awaitGone(backgroundPid())).isTrue();
        }

        @Test
        void shouldKillOrphanedGrandchildAfterNormalExit() throws Exception {
            Outcome outcome = runner.run(shell("(sleep 38 & echo $! > bg.pid); echo done").build());

            assertThat(outcome.getTag()).isEqualTo(OutcomeTag.COMPLETED);
            assertThat(outcome.getStdoutText()).isEqualTo("done\n");
            assertThat(awaitGone(backgroundPid())).isTrue();
        }

        private long backgroundPid() throws Exception {
            return Long.parseLong(Files.readString(workingDirectory.resolve("bg.pid")).trim());
        }

        /// Zombies count as gone; reaping the reparented child is up to init.
        private boolean awaitGone(long pid) throws Exception {
            long deadline = System.nanoTime() + Duration.ofSeconds(2).toNanos();
            while (System.nanoTime() < deadline) {
                if (isGone(pid)) {
                    return true;
                }
                Thread.sleep(20);
            }
            ProcessHandle.of(pid).ifPresent(ProcessHandle::destroyForcibly);
            return false;
        }

        private boolean isGone(long pid) {
            Path stat = Path.of("/proc", Long.toString(pid), "stat");
            try {
                String content = Files.readString(stat);
                return content.substring(content.lastIndexOf(')') + 2).startsWith("Z");
            } catch (IOException e) {
                return true;
            }
        }
    }

    @Test
    void shouldUnregisterProcessesAfterCompletion() throws Exception {
        runner.run(shell("true").build());

        assertThat(tracker.size()).isZero();
    }
}
