package io.clgrader.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.clgrader.core.GraderConfig;
import io.clgrader.core.GraderEnvironment;
import io.clgrader.core.GraderFactory;
import io.clgrader.core.assessment.Assessment;
import io.clgrader.core.assessment.Benchmark;
import io.clgrader.core.assessment.Expectation;
import io.clgrader.core.assessment.GradingMode;
import io.clgrader.core.assessment.IntegrationStep;
import io.clgrader.core.assessment.IntegrationTestGroup;
import io.clgrader.core.assessment.PerformanceTestGroup;
import io.clgrader.core.assessment.ProgramReference;
import io.clgrader.core.assessment.Section;
import io.clgrader.core.assessment.StepAction;
import io.clgrader.core.assessment.StressTest;
import io.clgrader.core.assessment.TestCase;
import io.clgrader.core.assessment.TextPredicate;
import io.clgrader.core.assessment.UnitTestGroup;
import io.clgrader.core.exception.SpecMismatchException;
import io.clgrader.core.execution.executor.TestGroupExecutor;
import io.clgrader.core.process.CommandTemplate;
import io.clgrader.core.process.ProgramResolver;
import io.clgrader.core.process.StaticProgramResolver;
import io.clgrader.core.result.GradingExitStatus;
import io.clgrader.core.result.GradingResult;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class GradingEngineTest {

    private static final String ADDER = "echo $(($1 + $2))";

    @TempDir Path tempDir;

    private GraderEnvironment environment(int poolSize, GradingListener listener) {
        GraderConfig config =
                GraderConfig.builder()
                        .workerPoolSize(poolSize)
                        .defaultTimeout(Duration.ofSeconds(5))
                        .workspaceRoot(tempDir)
                        .registerShutdownHook(false)
                        .build();
        return GraderFactory.builder().config(config).listener(listener).build();
    }

    private static ProgramResolver shellPrograms(String... scripts) {
        StaticProgramResolver.Builder resolver = StaticProgramResolver.builder();
        for (String script : scripts) {
            resolver.program(CommandTemplate.of("/bin/sh", "-c", script, "prog"));
        }
        return resolver.build();
    }

    private static TestCase addition(String name, int weight, String expected, String... arguments) {
        return TestCase.builder()
                .name(name)
                .weight(weight)
                .arguments(arguments)
                .expectation(Expectation.builder().stdout(TextPredicate.exact(expected)).build())
                .build();
    }

    private static Assessment additionAssessment() {
        return Assessment.builder()
                .title("Calculator")
                .section(
                        Section.builder()
                                .name("Basics")
                                .group(
                                        UnitTestGroup.builder()
                                                .name("Unit tests")
                                                .program(
                                                        ProgramReference.of("p1"),
                                                        List.of(
                                                                addition("wrong", 1, "5\n", "2", "2"),
                                                                addition("adds", 3, "3\n", "1", "2")))
                                                .build())
                                .build())
                .build();
    }

    @Nested
    class Completed {

        @Test
        void shouldScoreWeightedCases() throws Exception {
            try (GraderEnvironment env = environment(2, GradingListener.NOOP)) {
                GradingResult result = env.grade(additionAssessment(), shellPrograms(ADDER));

                assertThat(result).isInstanceOf(GradingResult.Completed.class);
                GradingResult.Completed completed = (GradingResult.Completed) result;
                ResultNode tree = completed.tree();
                assertThat(completed.exitStatus()).isEqualTo(GradingExitStatus.SUCCESS);
                assertThat(tree.getKind()).isEqualTo(NodeKind.ASSESSMENT);
                assertThat(tree.getName()).isEqualTo("Calculator");
                assertThat(tree.getScore()).isEqualTo(0.75);
                assertThat(tree.getStatus()).isEqualTo(ResultStatus.PARTIALLY_PASSED);
                assertThat(tree.getGradingMode()).isEqualTo(GradingMode.WEIGHTED);
            }
        }

        @Test
        void shouldMergeEnvironmentLayersAndHonorSectionTimeout() throws Exception {
            TestCase fast =
                    TestCase.builder()
                            .name("env")
                            .env("C", "3")
                            .expectation(Expectation.builder().stdout(TextPredicate.exact("123\n")).build())
                            .build();
            Assessment assessment =
                    Assessment.builder()
                            .title("Layers")
                            .environment(Map.of("A", "1", "B", "x", "C", "x"))
                            .section(
                                    Section.builder()
                                            .name("Env")
                                            .environment(Map.of("B", "2"))
                                            .defaultTimeout(Duration.ofMillis(200))
                                            .group(
                                                    UnitTestGroup.builder()
                                                            .name("Unit tests")
                                                            .program(ProgramReference.of("p1"), List.of(fast))
                                                            .program(
                                                                    ProgramReference.of("p2"),
                                                                    List.of(
                                                                            TestCase.builder()
                                                                                    .name("slow")
                                                                                    .expectation(Expectation.successfulExit())
                                                                                    .build()))
                                                            .build())
                                            .build())
                            .build();

            try (GraderEnvironment env = environment(2, GradingListener.NOOP)) {
                ResultNode tree =
                        ((GradingResult.Completed)
                                        env.grade(assessment, shellPrograms("echo \"$A$B$C\"", "exec sleep 30")))
                                .tree();

                ResultNode group = tree.getChildren().get(0).getChildren().get(0);
                assertThat(group.getChildren().get(0).getChildren().get(0).getStatus())
                        .isEqualTo(ResultStatus.PASSED);
                assertThat(group.getChildren().get(1).getChildren().get(0).getStatus())
                        .isEqualTo(ResultStatus.FAILED);
            }
        }

        @Test
        void shouldProduceSameTreeForAnyPoolSize() throws Exception {
            Assessment assessment =
                    Assessment.builder()
                            .title("Mixed")
                            .section(
                                    Section.builder()
                                            .name("Units")
                                            .weight(2)
                                            .group(
                                                    UnitTestGroup.builder()
                                                            .name("Unit tests")
                                                            .program(
                                                                    ProgramReference.of("p1"),
                                                                    List.of(
                                                                            addition("a", 1, "2\n", "1", "1"),
                                                                            addition("b", 2, "9\n", "4", "4"),
                                                                            addition("c", 1, "8\n", "4", "4"),
                                                                            addition("d", 1, "0\n", "0", "0")))
                                                            .build())
                                            .group(
                                                    IntegrationTestGroup.builder()
                                                            .name("Integration tests")
                                                            .step(IntegrationStep.shell("write", "echo hi > f.txt"))
                                                            .step(
                                                                    new IntegrationStep(
                                                                            "read",
                                                                            new StepAction.Shell("cat f.txt"),
                                                                            Expectation.builder()
                                                                                    .stdout(TextPredicate.exact("hi\n"))
                                                                                    .build(),
                                                                            2,
                                                                            null))
                                                            .build())
                                            .build())
                            .section(
                                    Section.builder()
                                            .name("Strict")
                                            .gradingMode(GradingMode.ABSOLUTE)
                                            .visible(false)
                                            .group(
                                                    UnitTestGroup.builder()
                                                            .name("Unit tests")
                                                            .program(
                                                                    ProgramReference.of("p1"),
                                                                    List.of(addition("e", 1, "3\n", "1", "2")))
                                                            .build())
                                            .build())
                            .build();

            ResultNode sequential;
            try (GraderEnvironment env = environment(1, GradingListener.NOOP)) {
                sequential = ((GradingResult.Completed) env.grade(assessment, shellPrograms(ADDER))).tree();
            }
            ResultNode parallel;
            try (GraderEnvironment env = environment(8, GradingListener.NOOP)) {
                parallel = ((GradingResult.Completed) env.grade(assessment, shellPrograms(ADDER))).tree();
            }

            assertThat(parallel).isEqualTo(sequential);
            assertThat(sequential.getChildren().get(0).getEarned()).isEqualTo(2 * (1 + 1 + 1 + 1 + 2));
            assertThat(sequential.getChildren().get(1).isVisible()).isFalse();
            assertThat(sequential.getChildren().get(1).getScore()).isEqualTo(1.0);
        }

        @Test
        void shouldRemoveWorkspaceAfterRun() throws Exception {
            try (GraderEnvironment env = environment(2, GradingListener.NOOP)) {
                env.grade(additionAssessment(), shellPrograms(ADDER));
            }

            try (Stream<Path> leftovers = Files.list(tempDir)) {
                assertThat(leftovers).isEmpty();
            }
        }

        @Test
        void shouldNotifyListener() throws Exception {
            GradingListener listener = mock(GradingListener.class);
            Assessment assessment = additionAssessment();

            try (GraderEnvironment env = environment(2, listener)) {
                env.grade(assessment, shellPrograms(ADDER));
            }

            verify(listener).onAssessmentStarted(assessment);
            verify(listener).onSectionStarted(assessment.getSections().get(0));
            verify(listener).onGroupStarted(assessment.getSections().get(0).getGroups().get(0));
            verify(listener, times(2)).onLeafCompleted(any(), any());
            verify(listener).onAssessmentCompleted(any(), any());
        }

        @Test
        void shouldReportPartialFailureWhenGroupCrashes() throws Exception {
            TestGroupExecutor<UnitTestGroup> crashing =
                    new TestGroupExecutor<>() {
                        @Override
                        public Class<UnitTestGroup> getGroupType() {
                            return UnitTestGroup.class;
                        }

                        @Override
                        public ResultNode execute(UnitTestGroup group, GradingContext context) {
                            throw new IllegalStateException("boom");
                        }
                    };
            GraderConfig config =
                    GraderConfig.builder().workspaceRoot(tempDir).registerShutdownHook(false).build();

            try (GraderEnvironment env = GraderFactory.builder().config(config).executor(crashing).build()) {
                GradingResult result = env.grade(additionAssessment(), shellPrograms(ADDER));

                assertThat(result.exitStatus()).isEqualTo(GradingExitStatus.PARTIAL_FAILURE);
                ResultNode group =
                        ((GradingResult.Completed) result).tree().getChildren().get(0).getChildren().get(0);
                assertThat(group.getStatus()).isEqualTo(ResultStatus.ERRORED);
                assertThat(group.getDiagnostics())
                        .containsExactly("Group could not be executed: java.lang.IllegalStateException: boom");
                assertThat(group.getScore()).isZero();
                assertThat(group.getPossible()).isEqualTo(4);
                assertThat(group.getChildren().get(0).getChildren())
                        .extracting(ResultNode::getName, ResultNode::getStatus)
                        .containsExactly(
                                tuple("wrong", ResultStatus.ERRORED), tuple("adds", ResultStatus.ERRORED));
            }
        }

        @Test
        void shouldKeepWeightOfGroupWhoseFixtureEscapesItsDirectory() throws Exception {
            IntegrationStep first =
                    new IntegrationStep(
                            "first", new StepAction.Shell("true"), Expectation.builder().build(), 5, null);
            IntegrationStep second =
                    new IntegrationStep(
                            "second", new StepAction.Shell("true"), Expectation.builder().build(), 5, null);
            Assessment assessment =
                    Assessment.builder()
                            .title("Escape")
                            .section(
                                    Section.builder()
                                            .name("Mixed")
                                            .group(
                                                    UnitTestGroup.builder()
                                                            .name("Unit tests")
                                                            .program(
                                                                    ProgramReference.of("p1"),
                                                                    List.of(addition("adds", 1, "3\n", "1", "2")))
                                                            .build())
                                            .group(
                                                    IntegrationTestGroup.builder()
                                                            .name("Integration tests")
                                                            .file("../../escape.txt", "outside")
                                                            .step(first)
                                                            .step(second)
                                                            .build())
                                            .build())
                            .build();

            try (GraderEnvironment env = environment(2, GradingListener.NOOP)) {
                GradingResult result = env.grade(assessment, shellPrograms(ADDER));

                assertThat(result.exitStatus()).isEqualTo(GradingExitStatus.PARTIAL_FAILURE);
                ResultNode tree = ((GradingResult.Completed) result).tree();
                assertThat(tree.getEarned()).isEqualTo(1);
                assertThat(tree.getPossible()).isEqualTo(11);
                assertThat(tree.getScore()).isEqualTo(1.0 / 11);
                ResultNode integration = tree.getChildren().get(0).getChildren().get(1);
                assertThat(integration.getStatus()).isEqualTo(ResultStatus.ERRORED);
                assertThat(integration.getChildren())
                        .extracting(ResultNode::getName, ResultNode::getStatus, ResultNode::getPossible)
                        .containsExactly(
                                tuple("first", ResultStatus.ERRORED, 5L),
                                tuple("second", ResultStatus.ERRORED, 5L));
                assertThat(integration.getDiagnostics())
                        .containsExactly("Fixture file escapes its directory: ../../escape.txt");
            }
            assertThat(tempDir.resolveSibling("escape.txt")).doesNotExist();
        }
    }

    @Test
    void shouldTurnEveryBenchmarkOfCrashedGroupIntoWeightedError() {
        PerformanceTestGroup group =
                PerformanceTestGroup.builder()
                        .name("Performance tests")
                        .benchmark(
                                Benchmark.builder()
                                        .name("fast")
                                        .weight(4)
                                        .program(ProgramReference.of("p1"))
                                        .expectedMaxTime(Duration.ofSeconds(1))
                                        .build())
                        .build();

        ResultNode node =
                GradingEngine.erroredGroup(
                        group, new ExecutionException(new IllegalStateException("worker lost")));

        assertThat(node.getStatus()).isEqualTo(ResultStatus.ERRORED);
        assertThat(node.getDiagnostics())
                .containsExactly("Group could not be executed: java.lang.IllegalStateException: worker lost");
        assertThat(node.getChildren())
                .extracting(ResultNode::getName, ResultNode::getKind, ResultNode::getStatus, ResultNode::getWeight)
                .containsExactly(tuple("fast", NodeKind.BENCHMARK, ResultStatus.ERRORED, 4));
    }

    @Nested
    class Aborted {

        @Test
        void shouldFailOnDuplicateSectionNames() throws Exception {
            Section section = additionAssessment().getSections().get(0);
            Assessment assessment =
                    Assessment.builder().title("Twice").section(section).section(section).build();

            try (GraderEnvironment env = environment(1, GradingListener.NOOP)) {
                GradingResult result = env.grade(assessment, shellPrograms(ADDER));

                assertThat(result.exitStatus()).isEqualTo(GradingExitStatus.TOTAL_FAILURE);
                assertThat(((GradingResult.Failure) result).cause())
                        .isInstanceOf(SpecMismatchException.class)
                        .hasMessage("Duplicate section name: Basics");
            }
        }

        @Test
        void shouldFailOnUnknownProgramReferenceBeforeRunningAnything() throws Exception {
            GradingListener listener = mock(GradingListener.class);

            try (GraderEnvironment env = environment(1, listener)) {
                GradingResult result = env.grade(additionAssessment(), StaticProgramResolver.of(List.of()));

                assertThat(((GradingResult.Failure) result).cause())
                        .hasMessage("Unknown program reference: p1");
            }
            verify(listener, never()).onAssessmentStarted(any());
        }
    }

    @Test
    void shouldCollectEveryProgramReference() {
        Assessment assessment =
                Assessment.builder()
                        .title("Refs")
                        .section(
                                Section.builder()
                                        .name("All")
                                        .group(additionAssessment().getSections().get(0).getGroups().get(0))
                                        .group(
                                                IntegrationTestGroup.builder()
                                                        .name("Integration tests")
                                                        .step(
                                                                IntegrationStep.run(
                                                                        "call", ProgramReference.of("p2"), List.of(), null))
                                                        .build())
                                        .group(
                                                PerformanceTestGroup.builder()
                                                        .name("Performance tests")
                                                        .benchmark(
                                                                Benchmark.builder()
                                                                        .name("bench")
                                                                        .program(ProgramReference.of("p3"))
                                                                        .expectedMaxTime(Duration.ofSeconds(1))
                                                                        .stressTest(
                                                                                new StressTest(
                                                                                        1,
                                                                                        ProgramReference.of("gen"),
                                                                                        List.of(),
                                                                                        1.0))
                                                                        .build())
                                                        .build())
                                        .build())
                        .build();

        assertThat(GradingEngine.programReferences(assessment))
                .extracting(ProgramReference::name)
                .containsExactly("p1", "p2", "p3", "gen");
    }
}
