package io.clgrader.core.process;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// How to start a program under test: an executable plus fixed leading arguments.
///
/// An interpreted submission resolves to, for example, `python3` with the script path as
/// its prefix argument. Test case arguments are appended after the prefix.
///
/// @param executable absolute or relative path, or a bare name looked up on `PATH`, not null
/// @param prefixArguments arguments placed before every case's own arguments, not null
public record CommandTemplate(String executable, List<String> prefixArguments) {

    public CommandTemplate {
        Objects.requireNonNull(executable, "executable must not be null");
        prefixArguments = List.copyOf(prefixArguments);
    }

    public static CommandTemplate of(String executable, String... prefixArguments) {
        return new CommandTemplate(executable, List.of(prefixArguments));
    }

    /// Returns the prefix arguments followed by `arguments`.
    ///
    /// @param arguments case arguments, not null
    /// @return the complete argument vector, never null
    public List<String> argumentsWith(List<String> arguments) {
        List<String> all = new ArrayList<>(prefixArguments.size() + arguments.size());
        all.addAll(prefixArguments);
        all.addAll(arguments);
        return all;
    }

    /// Checks that the executable exists and may be executed.
    ///
    /// @return a reason the program cannot run, or empty when it looks runnable
    public Optional<String> checkRunnable() {
        if (executable.contains(File.separator)) {
            return checkPath(executable);
        }
        String searchPath = System.getenv("PATH");
        if (searchPath != null) {
            for (String directory : searchPath.split(File.pathSeparator)) {
                if (!directory.isEmpty() && checkPath(directory + File.separator + executable).isEmpty()) {
                    return Optional.empty();
                }
            }
        }
        return Optional.of("'" + executable + "' was not found on PATH");
    }

    private static Optional<String> checkPath(String candidate) {
        Path path;
        try {
            path = Path.of(candidate);
        } catch (InvalidPathException e) {
            return Optional.of("'" + candidate + "' is not a valid path");
        }
        if (!Files.exists(path)) {
            return Optional.of("'" + candidate + "' does not exist");
        }
        if (Files.isDirectory(path) || !Files.isExecutable(path)) {
            return Optional.of("'" + candidate + "' is not executable");
        }
        return Optional.empty();
    }
}
