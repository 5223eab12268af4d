package io.clgrader.core.assessment;

import java.util.List;
import java.util.Objects;

/// What an {@link IntegrationStep} runs.
///
/// ### Permitted Subtypes
/// - {@link Shell} - a raw command line interpreted by the configured shell
/// - {@link Run} - a structured invocation of a program under test
public sealed interface StepAction {

    /// @param commandLine passed verbatim to the shell, not null
    record Shell(String commandLine) implements StepAction {

        public Shell {
            Objects.requireNonNull(commandLine, "commandLine must not be null");
        }
    }

    /// @param program program to run, not null
    /// @param arguments argument vector appended to the program's command, not null
    /// @param stdin text fed to standard input, may be null
    record Run(ProgramReference program, List<String> arguments, String stdin)
            implements StepAction {

        public Run {
            Objects.requireNonNull(program, "program must not be null");
            arguments = List.copyOf(arguments);
        }
    }
}
