package com.lsemantica.core.pipeline.snapshot;

import com.lsemantica.core.pipeline.PathGlobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * Read-only walk of a workspace. Symbolic links are never followed and ignored paths are
 * pruned before descending. Used by the snapshot and intent mapping stages.
 */
public final class WorkspaceScanner {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceScanner.class);

    private WorkspaceScanner() {}

    public record ScannedFile(String path, Path absolutePath, long sizeBytes) {}

    /** Raised for a root that does not exist, cannot be read or is not a directory. */
    public static final class InvalidRootException extends IOException {

        private final boolean notDirectory;
        private final String resolvedRoot;

        InvalidRootException(String message, boolean notDirectory, String resolvedRoot, Throwable cause) {
            super(message, cause);
            this.notDirectory = notDirectory;
            this.resolvedRoot = resolvedRoot;
        }

        public boolean notDirectory() {
            return notDirectory;
        }

        public String resolvedRoot() {
            return resolvedRoot;
        }
    }

    /** Raised when a directory listing or file size cannot be read mid-walk. */
    public static final class UnreadableEntryException extends IOException {

        private final boolean directory;

        UnreadableEntryException(Path entry, boolean directory, Throwable cause) {
            super("Unreadable " + (directory ? "directory" : "file") + " entry " + entry, cause);
            this.directory = directory;
        }

        public boolean directory() {
            return directory;
        }
    }

    /** Resolves {@code rawRoot} to its real path and checks that it is a directory. */
    public static Path resolveRoot(String rawRoot) throws InvalidRootException {
        Path real;
        try {
            real = Path.of(rawRoot).toAbsolutePath().toRealPath();
        } catch (IOException | RuntimeException e) {
            throw new InvalidRootException("Workspace root is unreadable: " + rawRoot, false, rawRoot, e);
        }
        if (!Files.isDirectory(real)) {
            throw new InvalidRootException("Workspace root is not a directory: " + real, true, real.toString(), null);
        }
        return real;
    }

    /**
     * Lists every regular file under {@code root} that is not ignored, sorted by relative path.
     * Relative paths always use {@code /} separators.
     */
    public static List<ScannedFile> scan(Path root, Collection<String> ignoredPaths) throws UnreadableEntryException {
        List<ScannedFile> files = new ArrayList<>();
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Path directory = pending.pop();
            List<Path> entries;
            try (Stream<Path> listing = Files.list(directory)) {
                entries = listing.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
            } catch (IOException | RuntimeException e) {
                throw new UnreadableEntryException(directory, true, e);
            }
            for (Path entry : entries) {
                String relative = relativize(root, entry);
                if (relative.isEmpty() || PathGlobs.isIgnored(relative, ignoredPaths)) {
                    continue;
                }
                if (Files.isSymbolicLink(entry)) {
                    continue;
                }
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    pending.push(entry);
                    continue;
                }
                if (!Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    continue;
                }
                try {
                    files.add(new ScannedFile(relative, entry, Files.size(entry)));
                } catch (IOException e) {
                    throw new UnreadableEntryException(entry, false, e);
                }
            }
        }
        files.sort(Comparator.comparing(ScannedFile::path));
        log.debug("Scanned {} file(s) under {}", files.size(), root);
        return files;
    }

    private static String relativize(Path root, Path entry) {
        return root.relativize(entry).toString().replace('\\', '/');
    }
}
