package io.clgrader.core.assessment;

import java.util.Objects;

/// Symbolic name of a program under test, resolved to a command by a
/// {@link io.clgrader.core.process.ProgramResolver}.
///
/// @param name alias such as `p1`, `program2` or a registered name, not blank
public record ProgramReference(String name) {

    public ProgramReference {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Program reference must not be blank");
        }
    }

    public static ProgramReference of(String name) {
        return new ProgramReference(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
