package io.clgrader.core.execution.executor;

import io.clgrader.core.assessment.Benchmark;
import io.clgrader.core.assessment.LeakPolicy;
import io.clgrader.core.assessment.PerformanceTestGroup;
import io.clgrader.core.assessment.ProfilingConfig;
import io.clgrader.core.assessment.StressTest;
import io.clgrader.core.evaluation.AssertionResult;
import io.clgrader.core.evaluation.PredicateDiagnostic;
import io.clgrader.core.exception.SpecMismatchException;
import io.clgrader.core.execution.GradingContext;
import io.clgrader.core.process.CommandTemplate;
import io.clgrader.core.process.Invocation;
import io.clgrader.core.process.Outcome;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Runs performance groups: timed benchmarks with optional stress tests and profiling.
///
/// ### Verdict of a benchmark
/// - the base run must complete within `expected_max_time` and, when a bound is set,
///   within `expected_max_memory`
/// - with a stress test, at least `stability_threshold` of the generated runs must meet
///   the same bounds
/// - with profiling under {@link LeakPolicy#FAIL_ON_LEAK}, no leak may be detected
///
/// Benchmarks of a group run one after another in a single worker unit so that sibling
/// benchmarks do not compete for the CPU. When peak memory cannot be observed on the
/// platform the memory bound is reported as unavailable and not enforced.
public class PerformanceTestExecutor implements TestGroupExecutor<PerformanceTestGroup> {

    private static final Logger logger = Logger.getLogger(PerformanceTestExecutor.class.getName());

    @Override
    public Class<PerformanceTestGroup> getGroupType() {
        return PerformanceTestGroup.class;
    }

    @Override
    public ResultNode execute(PerformanceTestGroup group, GradingContext context) throws Exception {
        logger.info(
                "Executing performance group: "
                        + group.getName()
                        + " with "
                        + group.getBenchmarks().size()
                        + " benchmark(s)");
        long start = System.nanoTime();
        List<Benchmark> benchmarks = group.getBenchmarks();
        List<Path> directories = new ArrayList<>(benchmarks.size());
        for (int i = 0; i < benchmarks.size(); i++) {
            directories.add(context.getWorkspace().allocate(context.getGroupDirectory(), "b" + (i + 1)));
        }
        try {
            List<ResultNode> results =
                    context.getWorkerPool()
                            .run(
                                    () -> {
                                        List<ResultNode> leaves = new ArrayList<>(benchmarks.size());
                                        for (int i = 0; i < benchmarks.size(); i++) {
                                            ResultNode leaf =
                                                    runBenchmark(
                                                            group,
                                                            benchmarks.get(i),
                                                            directories.get(i),
                                                            context);
                                            context.getListener().onLeafCompleted(group, leaf);
                                            leaves.add(leaf);
                                        }
                                        return leaves;
                                    });
            return ResultNode.builder()
                    .name(group.getName())
                    .kind(NodeKind.GROUP)
                    .children(results)
                    .elapsed(Duration.ofNanos(System.nanoTime() - start))
                    .build();
        } finally {
            directories.forEach(context.getWorkspace()::discard);
        }
    }

    private ResultNode runBenchmark(
            PerformanceTestGroup group, Benchmark benchmark, Path directory, GradingContext context)
            throws InterruptedException {
        long start = System.nanoTime();
        CommandTemplate command;
        CommandTemplate generator = null;
        try {
            command = context.resolveRunnable(benchmark.getProgram());
            if (benchmark.getStressTest() != null) {
                generator = context.resolveRunnable(benchmark.getStressTest().generator());
            }
            context.getWorkspace().writeFiles(directory, group.getFiles());
        } catch (SpecMismatchException | IOException e) {
            logger.warning("Benchmark '" + benchmark.getName() + "' not run: " + e.getMessage());
            return ResultNode.unexecuted(
                    benchmark.getName(),
                    NodeKind.BENCHMARK,
                    ResultStatus.ERRORED,
                    benchmark.getWeight(),
                    e.getMessage());
        }

        List<AssertionResult> assertions = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();

        byte[] stdin = GradingContext.stdinBytes(benchmark.getStdin());
        Outcome base =
                context.getProcessRunner()
                        .run(targetInvocation(group, benchmark, command, directory, context, stdin));
        AssertionResult baseResult = checkBounds("run", base, benchmark);
        assertions.add(baseResult);
        boolean passed = baseResult.passed();

        if (benchmark.getStressTest() != null) {
            AssertionResult stress =
                    stressTest(group, benchmark, command, generator, directory, context);
            assertions.add(stress);
            passed &= stress.passed();
        }

        ProfilingConfig profiling = benchmark.getProfiling();
        if (profiling != null && profiling.policy() != LeakPolicy.IGNORE) {
            AssertionResult leaks = profile(group, benchmark, command, directory, context);
            assertions.add(leaks);
            if (!leaks.passed()) {
                diagnostics.add("Profiling reported a memory problem");
                passed &= profiling.policy() != LeakPolicy.FAIL_ON_LEAK;
            }
        }

        return ResultNode.builder()
                .name(benchmark.getName())
                .kind(NodeKind.BENCHMARK)
                .status(passed ? ResultStatus.PASSED : ResultStatus.FAILED)
                .weight(benchmark.getWeight())
                .assertions(assertions)
                .diagnostics(diagnostics)
                .elapsed(Duration.ofNanos(System.nanoTime() - start))
                .build();
    }

    private AssertionResult stressTest(
            PerformanceTestGroup group,
            Benchmark benchmark,
            CommandTemplate command,
            CommandTemplate generator,
            Path directory,
            GradingContext context)
            throws InterruptedException {
        StressTest stress = benchmark.getStressTest();
        int passes = 0;
        for (int iteration = 1; iteration <= stress.iterations(); iteration++) {
            Invocation generate =
                    context.invocation(group, null, directory, benchmark.getTimeout())
                            .executable(generator.executable())
                            .arguments(generator.argumentsWith(stress.generatorArguments()))
                            .build();
            Outcome input = context.getProcessRunner().run(generate);
            if (!input.isCompleted() || input.getExitStatus() != 0) {
                logger.warning(
                        "Generator for '" + benchmark.getName() + "' failed on iteration " + iteration);
                continue;
            }
            Outcome run =
                    context.getProcessRunner()
                            .run(
                                    targetInvocation(
                                            group,
                                            benchmark,
                                            command,
                                            directory,
                                            context,
                                            input.getStdout()));
            if (checkBounds("iteration " + iteration, run, benchmark).passed()) {
                passes++;
            }
        }
        int required = stress.requiredPasses();
        return AssertionResult.of(
                "stress test",
                List.of(
                        new PredicateDiagnostic(
                                "stability",
                                ">= " + required + "/" + stress.iterations() + " passing runs",
                                passes + "/" + stress.iterations() + " passing runs",
                                passes >= required)));
    }

    private AssertionResult profile(
            PerformanceTestGroup group,
            Benchmark benchmark,
            CommandTemplate command,
            Path directory,
            GradingContext context)
            throws InterruptedException {
        ProfilingConfig profiling = benchmark.getProfiling();
        List<String> tool = profiling.toolCommand();
        List<String> arguments = new ArrayList<>(tool.subList(1, tool.size()));
        arguments.add(command.executable());
        arguments.addAll(command.argumentsWith(benchmark.getArguments()));
        Invocation invocation =
                context.invocation(group, null, directory, benchmark.getTimeout())
                        .executable(tool.get(0))
                        .arguments(arguments)
                        .stdin(GradingContext.stdinBytes(benchmark.getStdin()))
                        .build();
        Outcome outcome = context.getProcessRunner().run(invocation);
        if (!outcome.isCompleted()) {
            return AssertionResult.of(
                    "profiling",
                    List.of(
                            PredicateDiagnostic.fail(
                                    "profiler",
                                    "completed",
                                    outcome.getTag().name().toLowerCase(Locale.ROOT))));
        }
        boolean leak =
                (profiling.leakExitStatus() != null
                                && profiling.leakExitStatus().equals(outcome.getExitStatus()))
                        || (profiling.leakPattern() != null
                                && Pattern.compile(profiling.leakPattern())
                                        .matcher(outcome.getStderrText())
                                        .find());
        return AssertionResult.of(
                "profiling",
                List.of(
                        new PredicateDiagnostic(
                                "memory leaks", "none", leak ? "detected" : "none", !leak)));
    }

    private static Invocation targetInvocation(
            PerformanceTestGroup group,
            Benchmark benchmark,
            CommandTemplate command,
            Path directory,
            GradingContext context,
            byte[] stdin) {
        return context.invocation(group, null, directory, benchmark.getTimeout())
                .executable(command.executable())
                .arguments(command.argumentsWith(benchmark.getArguments()))
                .stdin(stdin)
                .observeResources(true)
                .build();
    }

    /// Checks the time and memory bounds of one run.
    static AssertionResult checkBounds(String label, Outcome outcome, Benchmark benchmark) {
        List<PredicateDiagnostic> diagnostics = new ArrayList<>();
        boolean completed = outcome.isCompleted();
        if (!completed) {
            diagnostics.add(
                    PredicateDiagnostic.fail(
                            "execution", "completed", outcome.getTag().name().toLowerCase(Locale.ROOT)));
        }

        long maxMillis = benchmark.getExpectedMaxTime().toMillis();
        long tookMillis = outcome.getDuration().toMillis();
        diagnostics.add(
                new PredicateDiagnostic(
                        "time",
                        "<= " + maxMillis + " ms",
                        tookMillis + " ms",
                        completed && outcome.getDuration().compareTo(benchmark.getExpectedMaxTime()) <= 0));

        Long maxMemory = benchmark.getExpectedMaxMemoryBytes();
        if (maxMemory != null) {
            OptionalLong peak = outcome.getPeakMemoryBytes();
            String expected = "<= " + maxMemory / 1024 + " KiB";
            if (peak.isPresent()) {
                diagnostics.add(
                        new PredicateDiagnostic(
                                "memory",
                                expected,
                                peak.getAsLong() / 1024 + " KiB",
                                completed && peak.getAsLong() <= maxMemory));
            } else {
                diagnostics.add(new PredicateDiagnostic("memory", expected, "unavailable", completed));
            }
        }
        return AssertionResult.of(label, diagnostics);
    }
}
