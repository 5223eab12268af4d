package io.clgrader.core.execution.executor;

import io.clgrader.core.assessment.IntegrationStep;
import io.clgrader.core.assessment.IntegrationTestGroup;
import io.clgrader.core.assessment.StepAction;
import io.clgrader.core.evaluation.AssertionResult;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Runs integration groups as one linear sequence in a shared directory.
///
/// The whole sequence is a single unit on the worker pool, so steps never overlap.
/// With {@link IntegrationTestGroup#isStopIfFail()} the first failing step halts the
/// sequence: later steps are recorded as {@link ResultStatus#SKIPPED} without launching
/// anything, and keep their declared weight as possible weight.
///
/// Programs referenced by structured steps are resolved before anything runs; if one
/// cannot run, every step is errored.
public class IntegrationTestExecutor implements TestGroupExecutor<IntegrationTestGroup> {

    private static final Logger logger = Logger.getLogger(IntegrationTestExecutor.class.getName());

    @Override
    public Class<IntegrationTestGroup> getGroupType() {
        return IntegrationTestGroup.class;
    }

    @Override
    public ResultNode execute(IntegrationTestGroup group, GradingContext context) throws Exception {
        logger.info(
                "Executing integration group: "
                        + group.getName()
                        + " with "
                        + group.getSteps().size()
                        + " step(s)");
        long start = System.nanoTime();
        ResultNode.Builder node = ResultNode.builder().name(group.getName()).kind(NodeKind.GROUP);

        Map<String, CommandTemplate> commands = new HashMap<>();
        try {
            for (IntegrationStep step : group.getSteps()) {
                if (step.action() instanceof StepAction.Run run) {
                    commands.put(run.program().name(), context.resolveRunnable(run.program()));
                }
            }
        } catch (SpecMismatchException e) {
            logger.warning("Integration group '" + group.getName() + "' not run: " + e.getMessage());
            return node.diagnostic(e.getMessage()).children(erroredSteps(group, e.getMessage())).build();
        }

        Path directory;
        try {
            directory = context.getWorkspace().allocate(context.getGroupDirectory(), "sequence");
        } catch (IOException e) {
            logger.warning("Integration group '" + group.getName() + "' has no workspace: " + e.getMessage());
            return node.diagnostic(e.getMessage()).children(erroredSteps(group, e.getMessage())).build();
        }
        try {
            context.getWorkspace().writeFiles(directory, group.getFiles());
            List<ResultNode> steps =
                    context.getWorkerPool().run(() -> runSequence(group, commands, directory, context));
            node.children(steps);
        } catch (IOException e) {
            logger.warning("Integration group '" + group.getName() + "' fixtures not written: " + e.getMessage());
            node.diagnostic(e.getMessage()).children(erroredSteps(group, e.getMessage()));
        } finally {
            context.getWorkspace().discard(directory);
        }
        return node.elapsed(Duration.ofNanos(System.nanoTime() - start)).build();
    }

    /// Every step of the group as an errored leaf that keeps its weight.
    static List<ResultNode> erroredSteps(IntegrationTestGroup group, String reason) {
        return group.getSteps().stream()
                .map(
                        step ->
                                ResultNode.unexecuted(
                                        step.name(),
                                        NodeKind.STEP,
                                        ResultStatus.ERRORED,
                                        step.weight(),
                                        reason))
                .toList();
    }

    private List<ResultNode> runSequence(
            IntegrationTestGroup group,
            Map<String, CommandTemplate> commands,
            Path directory,
            GradingContext context)
            throws InterruptedException {
        List<ResultNode> results = new ArrayList<>(group.getSteps().size());
        String haltedBy = null;

        for (IntegrationStep step : group.getSteps()) {
            if (haltedBy != null) {
                ResultNode skipped =
                        ResultNode.unexecuted(
                                step.name(),
                                NodeKind.STEP,
                                ResultStatus.SKIPPED,
                                step.weight(),
                                "Skipped after failure of '" + haltedBy + "'");
                context.getListener().onLeafCompleted(group, skipped);
                results.add(skipped);
                continue;
            }

            ResultNode result = runStep(group, step, commands, directory, context);
            context.getListener().onLeafCompleted(group, result);
            results.add(result);
            if (!result.isPassed() && group.isStopIfFail()) {
                logger.info("Integration group '" + group.getName() + "' halted at step: " + step.name());
                haltedBy = step.name();
            }
        }
        return results;
    }

    private ResultNode runStep(
            IntegrationTestGroup group,
            IntegrationStep step,
            Map<String, CommandTemplate> commands,
            Path directory,
            GradingContext context)
            throws InterruptedException {
        long start = System.nanoTime();
        Invocation.Builder invocation = context.invocation(group, null, directory, step.timeout());
        String label;

        if (step.action() instanceof StepAction.Shell shell) {
            List<String> shellCommand = context.getConfig().getShell();
            invocation
                    .executable(shellCommand.get(0))
                    .arguments(shellCommand.subList(1, shellCommand.size()))
                    .argument(shell.commandLine());
            label = shell.commandLine();
        } else {
            StepAction.Run run = (StepAction.Run) step.action();
            CommandTemplate command = commands.get(run.program().name());
            invocation
                    .executable(command.executable())
                    .arguments(command.argumentsWith(run.arguments()))
                    .stdin(GradingContext.stdinBytes(run.stdin()));
            label = run.program() + " " + UnitTestExecutor.label(run.arguments());
        }

        Outcome outcome = context.getProcessRunner().run(invocation.build());
        AssertionResult assertion =
                context.getAssertionEvaluator()
                        .evaluate(label, outcome, step.effectiveExpectation(), directory);
        boolean passed = assertion.passed() && outcome.isCompleted();

        return ResultNode.builder()
                .name(step.name())
                .kind(NodeKind.STEP)
                .status(passed ? ResultStatus.PASSED : ResultStatus.FAILED)
                .weight(step.weight())
                .assertion(assertion)
                .elapsed(Duration.ofNanos(System.nanoTime() - start))
                .build();
    }
}
