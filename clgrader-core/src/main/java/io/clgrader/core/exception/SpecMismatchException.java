package io.clgrader.core.exception;

import java.io.Serial;

/// Signals that a program or file named by an assessment cannot be resolved at grading time.
///
/// Raised for an unknown program reference (fatal to the whole run) and for a known
/// reference whose executable is missing or not runnable (fatal to the affected group only).
public class SpecMismatchException extends Exception {
    @Serial private static final long serialVersionUID = 4127795310641150262L;

    public SpecMismatchException(String message) {
        super(message);
    }
}
