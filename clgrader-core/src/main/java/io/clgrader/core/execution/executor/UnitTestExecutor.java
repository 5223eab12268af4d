package io.clgrader.core.execution.executor;

import io.clgrader.core.assessment.ProgramTests;
import io.clgrader.core.assessment.TestCase;
import io.clgrader.core.assessment.UnitTestGroup;
import io.clgrader.core.evaluation.AssertionResult;
import io.clgrader.core.exception.SpecMismatchException;
import io.clgrader.core.execution.GradingContext;
import io.clgrader.core.execution.WorkspaceAllocator;
import io.clgrader.core.process.CommandTemplate;
import io.clgrader.core.process.Invocation;
import io.clgrader.core.process.Outcome;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import io.clgrader.core.util.ArgumentTokenizer;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/// Runs unit test groups: `Setup -> {case in isolation}* -> Teardown` per program.
///
/// ### Directory layout
/// For the n-th program block the executor reserves `p<n>/template` and writes the
/// group's fixture files into it; setup and teardown run there. Each case variant gets
/// its own `p<n>/c<case>-<variant>` directory, reserved before dispatch, filled by
/// copying the template when the unit starts and deleted when it ends.
///
/// ### Failure handling
/// - a program that cannot be resolved or run errors every case of its block
/// - a failing setup command errors every case of the block when
///   {@link UnitTestGroup#isAbortOnSetupFailure()} is set; otherwise it is only recorded
/// - teardown always runs; its failures are recorded on the block node
///
/// Cases of a block run concurrently on the worker pool; results keep declaration order.
public class UnitTestExecutor implements TestGroupExecutor<UnitTestGroup> {

    private static final Logger logger = Logger.getLogger(UnitTestExecutor.class.getName());

    @Override
    public Class<UnitTestGroup> getGroupType() {
        return UnitTestGroup.class;
    }

    @Override
    public ResultNode execute(UnitTestGroup group, GradingContext context) throws Exception {
        logger.info(
                "Executing unit test group: "
                        + group.getName()
                        + " with "
                        + group.getPrograms().size()
                        + " program block(s)");
        long start = System.nanoTime();
        ResultNode.Builder node = ResultNode.builder().name(group.getName()).kind(NodeKind.GROUP);
        List<ProgramTests> programs = group.getPrograms();
        for (int i = 0; i < programs.size(); i++) {
            node.child(executeProgram(group, programs.get(i), i + 1, context));
        }
        return node.elapsed(Duration.ofNanos(System.nanoTime() - start)).build();
    }

    private ResultNode executeProgram(
            UnitTestGroup group, ProgramTests block, int blockNumber, GradingContext context)
            throws Exception {
        ResultNode.Builder node = ResultNode.builder().name(block.getName()).kind(NodeKind.PROGRAM);

        CommandTemplate resolved;
        try {
            resolved = context.resolveRunnable(block.getProgram());
        } catch (SpecMismatchException e) {
            logger.warning("Unit test block '" + block.getName() + "' not run: " + e.getMessage());
            return node.diagnostic(e.getMessage())
                    .children(erroredCases(block, e.getMessage()))
                    .build();
        }

        CommandTemplate command = resolved;
        WorkspaceAllocator workspace = context.getWorkspace();
        Path blockDirectory;
        try {
            blockDirectory = workspace.allocate(context.getGroupDirectory(), "p" + blockNumber);
        } catch (IOException e) {
            logger.warning("Unit test block '" + block.getName() + "' has no workspace: " + e.getMessage());
            return node.diagnostic(e.getMessage())
                    .children(erroredCases(block, e.getMessage()))
                    .build();
        }
        try {
            Path template = workspace.allocate(blockDirectory, "template");
            workspace.writeFiles(template, group.getFiles());

            List<String> setupFailures =
                    context.getWorkerPool()
                            .run(() -> runCommands("setup", group.getSetup(), true, group, template, context));
            setupFailures.forEach(node::diagnostic);

            if (!setupFailures.isEmpty() && group.isAbortOnSetupFailure()) {
                logger.warning("Setup failed for '" + block.getName() + "', cases not run");
                node.children(erroredCases(block, "Setup failed: " + setupFailures.get(0)));
            } else {
                List<Callable<ResultNode>> units = new ArrayList<>();
                List<TestCase> cases = block.getCases();
                for (int c = 0; c < cases.size(); c++) {
                    TestCase testCase = cases.get(c);
                    List<Path> directories = new ArrayList<>();
                    for (int v = 0; v < testCase.getArguments().getVariants().size(); v++) {
                        directories.add(
                                workspace.allocate(blockDirectory, "c" + (c + 1) + "-" + (v + 1)));
                    }
                    units.add(() -> runCase(group, testCase, command, template, directories, context));
                }
                node.children(context.getWorkerPool().runAll(units));
            }

            List<String> teardownFailures =
                    context.getWorkerPool()
                            .run(
                                    () ->
                                            runCommands(
                                                    "teardown",
                                                    group.getTeardown(),
                                                    false,
                                                    group,
                                                    template,
                                                    context));
            teardownFailures.forEach(node::diagnostic);
        } catch (IOException e) {
            logger.warning("Unit test block '" + block.getName() + "' not prepared: " + e.getMessage());
            node.diagnostic(e.getMessage()).children(erroredCases(block, e.getMessage()));
        } finally {
            workspace.discard(blockDirectory);
        }
        return node.build();
    }

    private ResultNode runCase(
            UnitTestGroup group,
            TestCase testCase,
            CommandTemplate command,
            Path template,
            List<Path> directories,
            GradingContext context)
            throws InterruptedException {
        long start = System.nanoTime();
        WorkspaceAllocator workspace = context.getWorkspace();
        List<List<String>> variants = testCase.getArguments().getVariants();
        List<AssertionResult> results = new ArrayList<>(variants.size());
        List<Boolean> passes = new ArrayList<>(variants.size());

        for (int v = 0; v < variants.size(); v++) {
            List<String> arguments = variants.get(v);
            Path directory = directories.get(v);
            try {
                workspace.copyContents(template, directory);
                Invocation invocation =
                        context.invocation(
                                        group,
                                        testCase.getEnvironment(),
                                        directory,
                                        testCase.getTimeout())
                                .executable(command.executable())
                                .arguments(command.argumentsWith(arguments))
                                .stdin(GradingContext.stdinBytes(testCase.getStdin()))
                                .build();
                Outcome outcome = context.getProcessRunner().run(invocation);
                AssertionResult result =
                        context.getAssertionEvaluator()
                                .evaluate(
                                        label(arguments), outcome, testCase.getExpectation(), directory);
                results.add(result);
                passes.add(result.passed());
            } catch (IOException e) {
                logger.warning(
                        "Cannot prepare directory for '" + testCase.getName() + "': " + e.getMessage());
                ResultNode errored =
                        ResultNode.unexecuted(
                                testCase.getName(),
                                NodeKind.CASE,
                                ResultStatus.ERRORED,
                                testCase.getWeight(),
                                "Cannot prepare working directory: " + e.getMessage());
                context.getListener().onLeafCompleted(group, errored);
                return errored;
            } finally {
                workspace.discard(directory);
            }
        }

        boolean passed = testCase.getArguments().combine(passes);
        ResultNode leaf =
                ResultNode.builder()
                        .name(testCase.getName())
                        .kind(NodeKind.CASE)
                        .status(passed ? ResultStatus.PASSED : ResultStatus.FAILED)
                        .weight(testCase.getWeight())
                        .assertions(results)
                        .elapsed(Duration.ofNanos(System.nanoTime() - start))
                        .build();
        context.getListener().onLeafCompleted(group, leaf);
        return leaf;
    }

    /// Runs setup or teardown command lines in order.
    ///
    /// @return one message per failed command; setup stops at the first failure
    static List<String> runCommands(
            String phase,
            List<String> commandLines,
            boolean stopAtFirstFailure,
            UnitTestGroup group,
            Path directory,
            GradingContext context)
            throws InterruptedException {
        List<String> failures = new ArrayList<>();
        for (String commandLine : commandLines) {
            String failure = runCommand(phase, commandLine, group, directory, context);
            if (failure != null) {
                failures.add(failure);
                if (stopAtFirstFailure) {
                    break;
                }
            }
        }
        return failures;
    }

    private static String runCommand(
            String phase, String commandLine, UnitTestGroup group, Path directory, GradingContext context)
            throws InterruptedException {
        List<String> tokens;
        try {
            tokens = ArgumentTokenizer.split(commandLine);
        } catch (IllegalArgumentException e) {
            return phase + " command '" + commandLine + "' is malformed: " + e.getMessage();
        }
        if (tokens.isEmpty()) {
            return null;
        }
        Invocation invocation =
                context.invocation(group, null, directory, null)
                        .executable(tokens.get(0))
                        .arguments(tokens.subList(1, tokens.size()))
                        .build();
        Outcome outcome = context.getProcessRunner().run(invocation);
        if (!outcome.isCompleted()) {
            return phase
                    + " command '"
                    + commandLine
                    + "' did not complete: "
                    + outcome.getTag().name().toLowerCase(Locale.ROOT)
                    + (outcome.getDiagnostic() != null ? " (" + outcome.getDiagnostic() + ")" : "");
        }
        if (outcome.getExitStatus() != 0) {
            return phase
                    + " command '"
                    + commandLine
                    + "' exited with status "
                    + outcome.getExitStatus()
                    + stderrSuffix(outcome);
        }
        return null;
    }

    private static String stderrSuffix(Outcome outcome) {
        String stderr = outcome.getStderrText().strip();
        return stderr.isEmpty() ? "" : ": " + stderr;
    }

    /// Every case of the block as an errored leaf that keeps its weight.
    static List<ResultNode> erroredCases(ProgramTests block, String reason) {
        return block.getCases().stream()
                .map(
                        testCase ->
                                ResultNode.unexecuted(
                                        testCase.getName(),
                                        NodeKind.CASE,
                                        ResultStatus.ERRORED,
                                        testCase.getWeight(),
                                        reason))
                .toList();
    }

    static String label(List<String> arguments) {
        return arguments.isEmpty() ? "(no arguments)" : String.join(" ", arguments);
    }
}
