package io.clgrader.core.execution;

import io.clgrader.core.GraderConfig;
import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.assessment.Benchmark;
import io.clgrader.core.assessment.IntegrationStep;
import io.clgrader.core.assessment.IntegrationTestGroup;
import io.clgrader.core.assessment.PerformanceTestGroup;
import io.clgrader.core.assessment.ProgramReference;
import io.clgrader.core.assessment.ProgramTests;
import io.clgrader.core.assessment.Section;
import io.clgrader.core.assessment.StepAction;
import io.clgrader.core.assessment.TestGroup;
import io.clgrader.core.assessment.UnitTestGroup;
import io.clgrader.core.evaluation.AssertionEvaluator;
import io.clgrader.core.exception.AggregationException;
import io.clgrader.core.exception.SpecMismatchException;
import io.clgrader.core.execution.executor.TestGroupExecutor;
import io.clgrader.core.execution.executor.TestGroupExecutorRegistry;
import io.clgrader.core.process.ProcessRunner;
import io.clgrader.core.process.ProgramResolver;
import io.clgrader.core.result.GradingExitStatus;
import io.clgrader.core.result.GradingResult;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import io.clgrader.core.scoring.ScoringAggregator;
import io.clgrader.core.util.EnvironmentLayers;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/// Grades an {@link Assessment} against the programs of one submission.
///
/// ### Run
/// 1. Structural checks: section names must be unique and every program reference must
///    be known to the {@link ProgramResolver}. A violation aborts the run with
///    {@link GradingResult.Failure} before anything is launched.
/// 2. Sections run in order. The groups of a section are coordinated concurrently; every
///    process they launch runs on the bounded {@link WorkerPool}.
/// 3. Group results are collected by index, so the tree follows declaration order
///    whatever the completion order.
/// 4. The {@link ScoringAggregator} scores the tree.
///
/// A group whose executor throws is recorded as an errored node; other groups are not
/// affected.
///
/// @implNote **Thread-safe**. Each call to {@link #grade} uses its own workspace.
///
/// @see io.clgrader.core.GraderEnvironment
public class GradingEngine {

    private static final Logger logger = Logger.getLogger(GradingEngine.class.getName());

    private final GraderConfig config;
    private final TestGroupExecutorRegistry executorRegistry;
    private final ProcessRunner processRunner;
    private final AssertionEvaluator assertionEvaluator;
    private final ScoringAggregator scoringAggregator;
    private final WorkerPool workerPool;
    private final ExecutorService coordinatorService;
    private final GradingListener listener;

    /// Creates an engine.
    ///
    /// @param config grader configuration, not null
    /// @param executorRegistry strategy executors by group variant, not null
    /// @param processRunner shared process runner, not null
    /// @param workerPool bounded pool for process-launching units, not null
    /// @param coordinatorService unbounded pool for group coordination, not null
    /// @param listener progress callbacks, not null
    public GradingEngine(
            GraderConfig config,
            TestGroupExecutorRegistry executorRegistry,
            ProcessRunner processRunner,
            WorkerPool workerPool,
            ExecutorService coordinatorService,
            GradingListener listener) {
        this.config = config;
        this.executorRegistry = executorRegistry;
        this.processRunner = processRunner;
        this.assertionEvaluator = new AssertionEvaluator();
        this.scoringAggregator = new ScoringAggregator();
        this.workerPool = workerPool;
        this.coordinatorService = coordinatorService;
        this.listener = listener;
    }

    /// Grades an assessment.
    ///
    /// @param assessment the assessment to grade, not null
    /// @param resolver maps program references to the submission's commands, not null
    /// @return the scored result tree or the reason the run was aborted, never null
    /// @throws InterruptedException if the grading thread is interrupted; in-flight
    ///     processes are killed
    public GradingResult grade(Assessment assessment, ProgramResolver resolver)
            throws InterruptedException {
        logger.info("Grading assessment: " + assessment.getTitle());
        try {
            verifyStructure(assessment, resolver);
        } catch (SpecMismatchException e) {
            logger.severe("Assessment does not match the submission: " + e.getMessage());
            return new GradingResult.Failure(e);
        }

        WorkspaceAllocator workspace;
        try {
            workspace = WorkspaceAllocator.create(config.getWorkspaceRoot(), config.isKeepWorkspaces());
        } catch (IOException e) {
            logger.severe("Cannot create workspace: " + e.getMessage());
            return new GradingResult.Failure(e);
        }

        listener.onAssessmentStarted(assessment);
        long start = System.nanoTime();
        try (workspace) {
            GradingContext base =
                    GradingContext.builder()
                            .config(config)
                            .processRunner(processRunner)
                            .assertionEvaluator(assertionEvaluator)
                            .programResolver(resolver)
                            .workerPool(workerPool)
                            .workspace(workspace)
                            .listener(listener)
                            .environment(assessment.getEnvironment())
                            .defaultTimeout(assessment.getDefaultTimeout())
                            .build();

            ResultNode.Builder root =
                    ResultNode.builder().name(assessment.getTitle()).kind(NodeKind.ASSESSMENT);
            List<Section> sections = assessment.getSections();
            for (int i = 0; i < sections.size(); i++) {
                root.child(gradeSection(sections.get(i), i + 1, base));
            }
            root.elapsed(Duration.ofNanos(System.nanoTime() - start));

            ResultNode scored = scoringAggregator.aggregate(root.build(), assessment.getGradingMode());
            listener.onAssessmentCompleted(assessment, scored);

            GradingExitStatus exitStatus =
                    scored.containsErrors()
                            ? GradingExitStatus.PARTIAL_FAILURE
                            : GradingExitStatus.SUCCESS;
            logger.info(
                    "Graded '"
                            + assessment.getTitle()
                            + "': score="
                            + scored.getScore()
                            + ", earned="
                            + scored.getEarned()
                            + "/"
                            + scored.getPossible()
                            + ", status="
                            + exitStatus);
            return new GradingResult.Completed(scored, exitStatus);
        } catch (AggregationException e) {
            logger.severe("Aggregation failed: " + e.getMessage());
            return new GradingResult.Failure(e);
        } catch (IOException e) {
            logger.severe("Cannot allocate section workspace: " + e.getMessage());
            return new GradingResult.Failure(e);
        }
    }

    private ResultNode gradeSection(Section section, int number, GradingContext base)
            throws InterruptedException, IOException {
        logger.info("Grading section: " + section.getName());
        listener.onSectionStarted(section);
        long start = System.nanoTime();

        WorkspaceAllocator workspace = base.getWorkspace();
        Path sectionDirectory = workspace.allocate(workspace.getRoot(), "s" + number);
        GradingContext sectionContext =
                base.toBuilder()
                        .environment(EnvironmentLayers.merge(base.getEnvironment(), section.getEnvironment()))
                        .defaultTimeout(
                                section.getDefaultTimeout() != null
                                        ? section.getDefaultTimeout()
                                        : base.getDefaultTimeout())
                        .build();

        List<TestGroup> groups = section.getGroups();
        List<Future<ResultNode>> futures = new ArrayList<>(groups.size());
        List<ResultNode> results = new ArrayList<>(groups.size());
        try {
            for (int i = 0; i < groups.size(); i++) {
                TestGroup group = groups.get(i);
                Path groupDirectory = workspace.allocate(sectionDirectory, "g" + (i + 1));
                GradingContext groupContext =
                        sectionContext.toBuilder().groupDirectory(groupDirectory).build();
                futures.add(coordinatorService.submit(() -> gradeGroup(group, groupContext)));
            }
            for (int i = 0; i < futures.size(); i++) {
                results.add(collect(futures.get(i), groups.get(i)));
            }
        } catch (InterruptedException | IOException e) {
            futures.forEach(future -> future.cancel(true));
            throw e;
        }

        ResultNode node =
                ResultNode.builder()
                        .name(section.getName())
                        .kind(NodeKind.SECTION)
                        .weight(section.getWeight())
                        .gradingMode(section.getGradingMode())
                        .visible(section.isVisible())
                        .children(results)
                        .elapsed(Duration.ofNanos(System.nanoTime() - start))
                        .build();
        listener.onSectionCompleted(section, node);
        return node;
    }

    private static ResultNode collect(Future<ResultNode> future, TestGroup group)
            throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            logger.severe("Coordinator for group '" + group.getName() + "' failed: " + e.getCause());
            return erroredGroup(group, e.getCause());
        }
    }

    private ResultNode gradeGroup(TestGroup group, GradingContext context) throws InterruptedException {
        listener.onGroupStarted(group);
        ResultNode result;
        try {
            result = dispatch(group, context);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            logger.severe("Group '" + group.getName() + "' failed: " + e);
            result = erroredGroup(group, e);
        }
        listener.onGroupCompleted(group, result);
        return result;
    }

    private ResultNode dispatch(TestGroup group, GradingContext context) throws Exception {
        TestGroupExecutor<TestGroup> executor = executorRegistry.getExecutorFor(group);
        return executor.execute(group, context);
    }

    /// Builds the node of a group whose executor failed.
    ///
    /// The leaves of a built-in group type are kept as errored leaves with their declared
    /// weight, so the failure still counts against the score. Other group types get a
    /// childless node.
    static ResultNode erroredGroup(TestGroup group, Throwable cause) {
        Throwable reason = cause instanceof ExecutionException && cause.getCause() != null ? cause.getCause() : cause;
        String diagnostic = "Group could not be executed: " + reason;
        return ResultNode.builder()
                .name(group.getName())
                .kind(NodeKind.GROUP)
                .status(ResultStatus.ERRORED)
                .diagnostic(diagnostic)
                .children(erroredLeaves(group, diagnostic))
                .build();
    }

    private static List<ResultNode> erroredLeaves(TestGroup group, String diagnostic) {
        List<ResultNode> leaves = new ArrayList<>();
        if (group instanceof UnitTestGroup unit) {
            for (ProgramTests block : unit.getPrograms()) {
                ResultNode.Builder program =
                        ResultNode.builder().name(block.getName()).kind(NodeKind.PROGRAM);
                block.getCases()
                        .forEach(
                                testCase ->
                                        program.child(
                                                ResultNode.unexecuted(
                                                        testCase.getName(),
                                                        NodeKind.CASE,
                                                        ResultStatus.ERRORED,
                                                        testCase.getWeight(),
                                                        diagnostic)));
                leaves.add(program.build());
            }
        } else if (group instanceof IntegrationTestGroup integration) {
            for (IntegrationStep step : integration.getSteps()) {
                leaves.add(
                        ResultNode.unexecuted(
                                step.name(), NodeKind.STEP, ResultStatus.ERRORED, step.weight(), diagnostic));
            }
        } else if (group instanceof PerformanceTestGroup performance) {
            for (Benchmark benchmark : performance.getBenchmarks()) {
                leaves.add(
                        ResultNode.unexecuted(
                                benchmark.getName(),
                                NodeKind.BENCHMARK,
                                ResultStatus.ERRORED,
                                benchmark.getWeight(),
                                diagnostic));
            }
        }
        return leaves;
    }

    /// Checks section-name uniqueness and that every program reference resolves.
    ///
    /// @throws SpecMismatchException on the first violation
    static void verifyStructure(Assessment assessment, ProgramResolver resolver)
            throws SpecMismatchException {
        Optional<String> duplicate = assessment.findDuplicateSectionName();
        if (duplicate.isPresent()) {
            throw new SpecMismatchException("Duplicate section name: " + duplicate.get());
        }
        for (ProgramReference reference : programReferences(assessment)) {
            if (resolver.resolve(reference).isEmpty()) {
                throw new SpecMismatchException("Unknown program reference: " + reference);
            }
        }
    }

    static Set<ProgramReference> programReferences(Assessment assessment) {
        Set<ProgramReference> references = new LinkedHashSet<>();
        for (Section section : assessment.getSections()) {
            for (TestGroup group : section.getGroups()) {
                if (group instanceof UnitTestGroup unit) {
                    unit.getPrograms().stream().map(ProgramTests::getProgram).forEach(references::add);
                } else if (group instanceof IntegrationTestGroup integration) {
                    for (IntegrationStep step : integration.getSteps()) {
                        if (step.action() instanceof StepAction.Run run) {
                            references.add(run.program());
                        }
                    }
                } else if (group instanceof PerformanceTestGroup performance) {
                    for (Benchmark benchmark : performance.getBenchmarks()) {
                        references.add(benchmark.getProgram());
                        if (benchmark.getStressTest() != null) {
                            references.add(benchmark.getStressTest().generator());
                        }
                    }
                }
            }
        }
        return references;
    }
}
