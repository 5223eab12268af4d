package io.clgrader.core.assessment;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/// One step of an integration sequence.
///
/// A {@link StepAction.Shell} step without an explicit expectation passes when it
/// completes with exit status `0`. A {@link StepAction.Run} step without one passes when
/// the program completes.
///
/// @param name step name, not null
/// @param action what to run, not null
/// @param expectation predicates on the step's outcome, null for the defaults above
/// @param weight declared weight
/// @param timeout per-step timeout, null for the section or global default
public record IntegrationStep(
        String name, StepAction action, Expectation expectation, int weight, Duration timeout) {

    public IntegrationStep {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(action, "action must not be null");
    }

    public static IntegrationStep shell(String name, String commandLine) {
        return new IntegrationStep(name, new StepAction.Shell(commandLine), null, 1, null);
    }

    public static IntegrationStep run(
            String name, ProgramReference program, List<String> arguments, Expectation expectation) {
        return new IntegrationStep(
                name, new StepAction.Run(program, arguments, null), expectation, 1, null);
    }

    public IntegrationStep withWeight(int newWeight) {
        return new IntegrationStep(name, action, expectation, newWeight, timeout);
    }

    /// Returns the expectation actually applied to this step.
    ///
    /// @return the declared expectation or the action's default, never null
    public Expectation effectiveExpectation() {
        if (expectation != null) {
            return expectation;
        }
        return action instanceof StepAction.Shell ? Expectation.successfulExit() : Expectation.none();
    }
}
