package io.clgrader.core.execution;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.logging.Logger;

/// Owns the directory tree of one grading run.
///
/// Directories are addressed by declaration position (`s1/g2/p1/c3-1`), created
/// exclusively, and never handed out twice: creating an existing path fails with
/// {@link java.nio.file.FileAlreadyExistsException}. The coordinating thread allocates a
/// directory before dispatching the unit that uses it.
///
/// @implNote **Thread-safe**. Allocation relies on the atomicity of
/// {@link Files#createDirectory}.
public class WorkspaceAllocator implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(WorkspaceAllocator.class.getName());

    private final Path root;
    private final boolean keep;

    private WorkspaceAllocator(Path root, boolean keep) {
        this.root = root;
        this.keep = keep;
    }

    /// Creates a fresh run directory.
    ///
    /// @param parent directory to create it in, or null for the system temporary directory
    /// @param keep leave the directory on disk when closed
    /// @return the allocator, never null
    /// @throws IOException if the directory cannot be created
    public static WorkspaceAllocator create(Path parent, boolean keep) throws IOException {
        Path root;
        if (parent != null) {
            Files.createDirectories(parent);
            root = Files.createTempDirectory(parent, "clgrader-");
        } else {
            root = Files.createTempDirectory("clgrader-");
        }
        logger.fine("Workspace root: " + root);
        return new WorkspaceAllocator(root.toAbsolutePath().normalize(), keep);
    }

    public Path getRoot() {
        return root;
    }

    /// Creates a new, empty directory.
    ///
    /// @param parent existing directory inside this workspace, not null
    /// @param name child name, not null
    /// @return the created directory, never null
    /// @throws IOException if it exists already or cannot be created
    public Path allocate(Path parent, String name) throws IOException {
        Path directory = parent.resolve(name);
        if (!directory.toAbsolutePath().normalize().startsWith(root)) {
            throw new IOException("Refusing to allocate outside the workspace: " + directory);
        }
        return Files.createDirectory(directory);
    }

    /// Writes fixture files into a directory, creating parent directories as needed.
    ///
    /// @param directory target directory, not null
    /// @param files relative file name to UTF-8 content, not null
    /// @throws IOException if a file escapes the directory or cannot be written
    public void writeFiles(Path directory, Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> file : files.entrySet()) {
            Path target = directory.resolve(file.getKey()).normalize();
            if (!target.startsWith(directory.normalize())) {
                throw new IOException("Fixture file escapes its directory: " + file.getKey());
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, file.getValue());
        }
    }

    /// Copies the contents of `source` into the existing directory `target`.
    ///
    /// File permissions are preserved so copied scripts stay executable.
    ///
    /// @param source directory to copy from, not null
    /// @param target empty directory to copy into, not null
    /// @throws IOException if copying fails
    public void copyContents(Path source, Path target) throws IOException {
        Files.walkFileTree(
                source,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                            throws IOException {
                        Files.createDirectories(target.resolve(source.relativize(dir)));
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.copy(
                                file,
                                target.resolve(source.relativize(file)),
                                StandardCopyOption.COPY_ATTRIBUTES);
                        return FileVisitResult.CONTINUE;
                    }
                });
    }

    /// Deletes a directory tree unless workspaces are kept.
    ///
    /// Failures are logged: a leftover directory never affects a verdict.
    ///
    /// @param directory directory to delete, not null
    public void discard(Path directory) {
        if (keep || !Files.exists(directory)) {
            return;
        }
        try {
            Files.walkFileTree(
                    directory,
                    new SimpleFileVisitor<>() {
                        @Override
                        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                                throws IOException {
                            Files.delete(file);
                            return FileVisitResult.CONTINUE;
                        }

                        @Override
                        public FileVisitResult postVisitDirectory(Path dir, IOException e)
                                throws IOException {
                            if (e != null) {
                                throw e;
                            }
                            Files.delete(dir);
                            return FileVisitResult.CONTINUE;
                        }
                    });
        } catch (IOException e) {
            logger.warning("Could not delete workspace " + directory + ": " + e.getMessage());
        }
    }

    /// Deletes the run directory unless workspaces are kept.
    @Override
    public void close() {
        discard(root);
    }
}
