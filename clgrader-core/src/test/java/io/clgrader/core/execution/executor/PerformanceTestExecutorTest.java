package io.clgrader.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.clgrader.core.GraderConfig;
import io.clgrader.core.assessment.Benchmark;
import io.clgrader.core.assessment.LeakPolicy;
import io.clgrader.core.assessment.PerformanceTestGroup;
import io.clgrader.core.assessment.ProfilingConfig;
import io.clgrader.core.assessment.ProgramReference;
import io.clgrader.core.assessment.StressTest;
import io.clgrader.core.evaluation.AssertionEvaluator;
import io.clgrader.core.evaluation.AssertionResult;
import io.clgrader.core.evaluation.PredicateDiagnostic;
import io.clgrader.core.execution.GradingContext;
import io.clgrader.core.execution.WorkerPool;
import io.clgrader.core.execution.WorkspaceAllocator;
import io.clgrader.core.process.CommandTemplate;
import io.clgrader.core.process.Invocation;
import io.clgrader.core.process.Outcome;
import io.clgrader.core.process.OutcomeTag;
import io.clgrader.core.process.ProcessRunner;
import io.clgrader.core.process.StaticProgramResolver;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PerformanceTestExecutorTest {

    private static Outcome run(Duration duration, long peakBytes) {
        return Outcome.builder(OutcomeTag.COMPLETED)
                .exitStatus(0)
                .duration(duration)
                .peakMemoryBytes(peakBytes >= 0 ? OptionalLong.of(peakBytes) : OptionalLong.empty())
                .build();
    }

    private static Benchmark.Builder benchmark() {
        return Benchmark.builder()
                .name("sort 1e6")
                .program(ProgramReference.of("p1"))
                .expectedMaxTime(Duration.ofMillis(100));
    }

    @Nested
    class Bounds {

        @Test
        void shouldPassRunWithinTimeBound() {
            AssertionResult result =
                    PerformanceTestExecutor.checkBounds("run", run(Duration.ofMillis(40), -1), benchmark().build());

            assertThat(result.passed()).isTrue();
            assertThat(result.diagnostics())
                    .containsExactly(PredicateDiagnostic.pass("time", "<= 100 ms", "40 ms"));
        }

        @Test
        void shouldFailRunOverTimeBound() {
            AssertionResult result =
                    PerformanceTestExecutor.checkBounds("run", run(Duration.ofMillis(150), -1), benchmark().build());

            assertThat(result.failures())
                    .containsExactly(PredicateDiagnostic.fail("time", "<= 100 ms", "150 ms"));
        }

        @Test
        void shouldFailRunOverMemoryBound() {
            Benchmark bounded = benchmark().expectedMaxMemoryBytes(2048L * 1024).build();

            AssertionResult result =
                    PerformanceTestExecutor.checkBounds("run", run(Duration.ofMillis(1), 4096L * 1024), bounded);

            assertThat(result.failures())
                    .containsExactly(PredicateDiagnostic.fail("memory", "<= 2048 KiB", "4096 KiB"));
        }

        @Test
        void shouldNotEnforceUnavailableMemory() {
            Benchmark bounded = benchmark().expectedMaxMemoryBytes(1024L).build();

            AssertionResult result =
                    PerformanceTestExecutor.checkBounds("run", run(Duration.ofMillis(1), -1), bounded);

            assertThat(result.passed()).isTrue();
            assertThat(result.diagnostics().get(1).actual()).isEqualTo("unavailable");
        }

        @Test
        void shouldFailTimedOutRun() {
            Outcome timedOut =
                    Outcome.builder(OutcomeTag.TIMED_OUT).duration(Duration.ofMillis(10)).build();

            AssertionResult result = PerformanceTestExecutor.checkBounds("run", timedOut, benchmark().build());

            assertThat(result.passed()).isFalse();
            assertThat(result.failures().get(0).actual()).isEqualTo("timed_out");
        }
    }

    @Nested
    class Execution {

        @TempDir Path tempDir;

        private ProcessRunner processRunner;
        private ExecutorService workers;
        private WorkspaceAllocator workspace;
        private GradingContext context;
        private PerformanceTestExecutor executor;

        @BeforeEach
        void setUp() throws Exception {
            processRunner = mock(ProcessRunner.class);
            workers = Executors.newSingleThreadExecutor();
            workspace = WorkspaceAllocator.create(tempDir, false);
            context =
                    GradingContext.builder()
                            .config(new GraderConfig())
                            .processRunner(processRunner)
                            .assertionEvaluator(new AssertionEvaluator())
                            .programResolver(
                                    StaticProgramResolver.builder()
                                            .program(CommandTemplate.of("/bin/sh", "solve.sh"))
                                            .alias("gen", CommandTemplate.of("/bin/sh", "gen.sh"))
                                            .build())
                            .workerPool(new WorkerPool(workers))
                            .workspace(workspace)
                            .groupDirectory(workspace.allocate(workspace.getRoot(), "g1"))
                            .build();
            executor = new PerformanceTestExecutor();
        }

        @AfterEach
        void tearDown() {
            workers.shutdownNow();
            workspace.close();
        }

        /// Generator runs print an input; the third program run is slow.
        private void stubGeneratorAndSlowThirdRun() throws Exception {
            AtomicInteger programRuns = new AtomicInteger();
            when(processRunner.run(any()))
                    .thenAnswer(
                            call -> {
                                Invocation invocation = call.getArgument(0);
                                if (invocation.arguments().get(0).equals("gen.sh")) {
                                    return Outcome.builder(OutcomeTag.COMPLETED)
                                            .exitStatus(0)
                                            .stdout("5 3 1\n")
                                            .build();
                                }
                                int n = programRuns.incrementAndGet();
                                return run(Duration.ofMillis(n == 3 ? 500 : 5), -1);
                            });
        }

        private PerformanceTestGroup stressed(double threshold) {
            return PerformanceTestGroup.builder()
                    .name("Performance")
                    .benchmark(
                            benchmark()
                                    .stressTest(
                                            new StressTest(4, ProgramReference.of("gen"), List.of("--n", "3"), threshold))
                                    .build())
                    .build();
        }

        @Test
        void shouldPassStressTestAtStabilityThreshold() throws Exception {
            stubGeneratorAndSlowThirdRun();

            ResultNode result = executor.execute(stressed(0.75), context);

            ResultNode leaf = result.getChildren().get(0);
            assertThat(leaf.getKind()).isEqualTo(NodeKind.BENCHMARK);
            assertThat(leaf.getStatus()).isEqualTo(ResultStatus.PASSED);
            assertThat(leaf.getAssertions().get(1).diagnostics())
                    .containsExactly(
                            PredicateDiagnostic.pass(
                                    "stability", ">= 3/4 passing runs", "3/4 passing runs"));
        }

        @Test
        void shouldFailStressTestBelowStabilityThreshold() throws Exception {
            stubGeneratorAndSlowThirdRun();

            ResultNode leaf = executor.execute(stressed(1.0), context).getChildren().get(0);

            assertThat(leaf.getStatus()).isEqualTo(ResultStatus.FAILED);
        }

        private PerformanceTestGroup profiled(LeakPolicy policy) {
            return PerformanceTestGroup.builder()
                    .name("Performance")
                    .benchmark(
                            benchmark()
                                    .profiling(
                                            new ProfilingConfig(
                                                    List.of("valgrind", "--error-exitcode=42"), 42, null, policy))
                                    .build())
                    .build();
        }

        private void stubLeakingProfiler() throws Exception {
            when(processRunner.run(any()))
                    .thenAnswer(
                            call -> {
                                Invocation invocation = call.getArgument(0);
                                if (invocation.executable().equals("valgrind")) {
                                    assertThat(invocation.arguments())
                                            .containsExactly("--error-exitcode=42", "/bin/sh", "solve.sh");
                                    return Outcome.builder(OutcomeTag.COMPLETED).exitStatus(42).build();
                                }
                                return run(Duration.ofMillis(5), -1);
                            });
        }

        @Test
        void shouldFailBenchmarkOnLeakWhenConfigured() throws Exception {
            stubLeakingProfiler();

            ResultNode leaf = executor.execute(profiled(LeakPolicy.FAIL_ON_LEAK), context).getChildren().get(0);

            assertThat(leaf.getStatus()).isEqualTo(ResultStatus.FAILED);
            assertThat(leaf.getAssertions().get(1).failures())
                    .containsExactly(PredicateDiagnostic.fail("memory leaks", "none", "detected"));
        }

        @Test
        void shouldOnlyReportLeakByDefault() throws Exception {
            stubLeakingProfiler();

            ResultNode leaf = executor.execute(profiled(LeakPolicy.REPORT), context).getChildren().get(0);

            assertThat(leaf.getStatus()).isEqualTo(ResultStatus.PASSED);
            assertThat(leaf.getDiagnostics()).containsExactly("Profiling reported a memory problem");
        }

        @Test
        void shouldErrorBenchmarkWithUnknownGenerator() throws Exception {
            PerformanceTestGroup group =
                    PerformanceTestGroup.builder()
                            .name("Performance")
                            .benchmark(
                                    benchmark()
                                            .stressTest(new StressTest(1, ProgramReference.of("nope"), List.of(), 1.0))
                                            .build())
                            .build();

            ResultNode leaf = executor.execute(group, context).getChildren().get(0);

            assertThat(leaf.getStatus()).isEqualTo(ResultStatus.ERRORED);
            assertThat(leaf.getDiagnostics()).containsExactly("Unknown program reference: nope");
        }
    }
}
