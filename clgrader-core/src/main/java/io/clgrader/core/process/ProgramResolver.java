package io.clgrader.core.process;

import io.clgrader.core.assessment.ProgramReference;
import java.util.Optional;

/// Maps the program references of an assessment to runnable commands.
///
/// Supplied per grading run by whatever prepared the submission (compiling it, picking an
/// interpreter, and so on).
@FunctionalInterface
public interface ProgramResolver {

    /// Resolves a program reference.
    ///
    /// @param reference reference from the assessment, not null
    /// @return the command template, or empty if the reference is unknown
    Optional<CommandTemplate> resolve(ProgramReference reference);
}
