package io.clgrader.core.assessment;

import java.util.Objects;

/// A file the program must leave behind in its working directory.
///
/// @param path path relative to the working directory, not null
/// @param content exact expected content, compared as UTF-8 bytes, not null
public record FileExpectation(String path, String content) {

    public FileExpectation {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
