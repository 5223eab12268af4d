package io.clgrader.core.exception;

import java.io.Serial;

public class ExecutorNotFoundException extends RuntimeException {
    @Serial private static final long serialVersionUID = 7390456028850931274L;

    public ExecutorNotFoundException(String message) {
        super(message);
    }
}
