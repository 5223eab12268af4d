package io.clgrader.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.clgrader.core.GraderConfig;
import io.clgrader.core.assessment.Expectation;
import io.clgrader.core.assessment.IntegrationStep;
import io.clgrader.core.assessment.IntegrationTestGroup;
import io.clgrader.core.assessment.ProgramReference;
import io.clgrader.core.assessment.TextPredicate;
import io.clgrader.core.evaluation.AssertionEvaluator;
import io.clgrader.core.execution.GradingContext;
import io.clgrader.core.execution.GradingListener;
import io.clgrader.core.execution.WorkerPool;
import io.clgrader.core.execution.WorkspaceAllocator;
import io.clgrader.core.process.CommandTemplate;
import io.clgrader.core.process.Invocation;
import io.clgrader.core.process.Outcome;
import io.clgrader.core.process.OutcomeTag;
import io.clgrader.core.process.ProcessRunner;
import io.clgrader.core.process.StaticProgramResolver;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class IntegrationTestExecutorTest {

    @TempDir Path tempDir;

    private ProcessRunner processRunner;
    private GradingListener listener;
    private ExecutorService workers;
    private WorkspaceAllocator workspace;
    private GradingContext context;
    private IntegrationTestExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        processRunner = mock(ProcessRunner.class);
        listener = mock(GradingListener.class);
        workers = Executors.newSingleThreadExecutor();
        workspace = WorkspaceAllocator.create(tempDir, false);
        context =
                GradingContext.builder()
                        .config(new GraderConfig())
                        .processRunner(processRunner)
                        .assertionEvaluator(new AssertionEvaluator())
                        .programResolver(
                                StaticProgramResolver.builder()
                                        .program(CommandTemplate.of("/bin/sh", "cli.sh"))
                                        .build())
                        .workerPool(new WorkerPool(workers))
                        .workspace(workspace)
                        .listener(listener)
                        .groupDirectory(workspace.allocate(workspace.getRoot(), "g1"))
                        .build();
        executor = new IntegrationTestExecutor();
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
        workspace.close();
    }

    private static Outcome exited(int status) {
        return Outcome.builder(OutcomeTag.COMPLETED).exitStatus(status).build();
    }

    private static IntegrationTestGroup fourSteps(boolean stopIfFail) {
        return IntegrationTestGroup.builder()
                .name("Build and run")
                .stopIfFail(stopIfFail)
                .step(IntegrationStep.shell("configure", "./configure"))
                .step(IntegrationStep.shell("make", "make"))
                .step(IntegrationStep.shell("test", "make test").withWeight(2))
                .step(IntegrationStep.shell("install", "make install"))
                .build();
    }

    @Test
    void shouldSkipRemainingStepsAfterFailure() throws Exception {
        when(processRunner.run(any())).thenReturn(exited(0), exited(2));

        ResultNode result = executor.execute(fourSteps(true), context);

        assertThat(result.getChildren())
                .extracting(ResultNode::getStatus)
                .containsExactly(
                        ResultStatus.PASSED, ResultStatus.FAILED, ResultStatus.SKIPPED, ResultStatus.SKIPPED);
        assertThat(result.getChildren().get(2).getWeight()).isEqualTo(2);
        assertThat(result.getChildren().get(3).getDiagnostics())
                .containsExactly("Skipped after failure of 'make'");
        verify(processRunner, times(2)).run(any());
        verify(listener, times(4)).onLeafCompleted(any(), any());
    }

    @Test
    void shouldRunEveryStepWithoutStopIfFail() throws Exception {
        when(processRunner.run(any())).thenReturn(exited(0), exited(2), exited(0), exited(0));

        ResultNode result = executor.execute(fourSteps(false), context);

        assertThat(result.getChildren())
                .extracting(ResultNode::getStatus)
                .containsExactly(
                        ResultStatus.PASSED, ResultStatus.FAILED, ResultStatus.PASSED, ResultStatus.PASSED);
        verify(processRunner, times(4)).run(any());
    }

    @Test
    void shouldRunShellStepsThroughConfiguredShellInSharedDirectory() throws Exception {
        when(processRunner.run(any())).thenReturn(exited(0));
        IntegrationTestGroup group =
                IntegrationTestGroup.builder()
                        .name("Shell")
                        .step(IntegrationStep.shell("one", "echo 1 > a"))
                        .step(IntegrationStep.shell("two", "cat a"))
                        .build();

        executor.execute(group, context);

        ArgumentCaptor<Invocation> captor = ArgumentCaptor.forClass(Invocation.class);
        verify(processRunner, times(2)).run(captor.capture());
        List<Invocation> invocations = captor.getAllValues();
        assertThat(invocations.get(0).command()).containsExactly("/bin/sh", "-c", "echo 1 > a");
        assertThat(invocations.get(1).workingDirectory()).isEqualTo(invocations.get(0).workingDirectory());
        assertThat(invocations.get(0).workingDirectory().getFileName().toString()).isEqualTo("sequence");
    }

    @Test
    void shouldRunProgramStepsWithTemplateAndExpectation() throws Exception {
        when(processRunner.run(any()))
                .thenReturn(Outcome.builder(OutcomeTag.COMPLETED).exitStatus(0).stdout("ok\n").build());
        IntegrationTestGroup group =
                IntegrationTestGroup.builder()
                        .name("Program")
                        .step(
                                IntegrationStep.run(
                                        "query",
                                        ProgramReference.of("p1"),
                                        List.of("--get", "x"),
                                        Expectation.builder().stdout(TextPredicate.exact("ko\n")).build()))
                        .build();

        ResultNode step = executor.execute(group, context).getChildren().get(0);

        ArgumentCaptor<Invocation> captor = ArgumentCaptor.forClass(Invocation.class);
        verify(processRunner).run(captor.capture());
        assertThat(captor.getValue().command()).containsExactly("/bin/sh", "cli.sh", "--get", "x");
        assertThat(step.getStatus()).isEqualTo(ResultStatus.FAILED);
        assertThat(step.getAssertions().get(0).label()).isEqualTo("p1 --get x");
    }

    @Test
    void shouldErrorEveryStepWhenProgramCannotRun() throws Exception {
        IntegrationTestGroup group =
                IntegrationTestGroup.builder()
                        .name("Broken")
                        .step(IntegrationStep.shell("setup", "true"))
                        .step(IntegrationStep.run("call", ProgramReference.of("p7"), List.of(), null))
                        .build();

        ResultNode result = executor.execute(group, context);

        assertThat(result.getChildren()).allMatch(step -> step.getStatus() == ResultStatus.ERRORED);
        assertThat(result.getDiagnostics()).containsExactly("Unknown program reference: p7");
        verify(processRunner, never()).run(any());
    }

    @Test
    void shouldFailShellStepThatDoesNotComplete() throws Exception {
        when(processRunner.run(any()))
                .thenReturn(Outcome.builder(OutcomeTag.TIMED_OUT).diagnostic("Timed out after 10 ms").build());
        IntegrationTestGroup group =
                IntegrationTestGroup.builder().name("Slow").step(IntegrationStep.shell("hang", "sleep 60")).build();

        ResultNode step = executor.execute(group, context).getChildren().get(0);

        assertThat(step.getStatus()).isEqualTo(ResultStatus.FAILED);
    }
}
