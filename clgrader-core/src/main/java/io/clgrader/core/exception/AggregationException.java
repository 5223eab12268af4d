package io.clgrader.core.exception;

import java.io.Serial;

/// Internal invariant violation detected while folding scores, such as a negative weight.
///
/// Always fatal to the grading run.
public class AggregationException extends Exception {
    @Serial private static final long serialVersionUID = -2286311945906358617L;

    public AggregationException(String message) {
        super(message);
    }
}
