package eu.virtualparadox.docscan.scan;

import eu.virtualparadox.docscan.ingest.model.DocumentKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates the files of an archive that the scanner can read.
 * <ul>
 *   <li>Walks the root recursively; unreadable directories are skipped.</li>
 *   <li>Keeps only files whose extension maps to a {@link DocumentKind}.</li>
 *   <li>Never returns the running program's own file.</li>
 * </ul>
 */
@Slf4j
public class CandidateFileCollector {

    private final Path excludedPath;

    /**
     * @param excludedPath path of the running program, or {@code null} when unknown
     */
    public CandidateFileCollector(final Path excludedPath) {
        this.excludedPath = excludedPath == null ? null : excludedPath.toAbsolutePath().normalize();
    }

    /**
     * @param root archive root directory
     * @return absolute paths of candidate files, sorted
     * @throws IllegalArgumentException if {@code root} is not a directory
     */
    public List<Path> collect(final Path root) {
        Objects.requireNonNull(root, "root must not be null");
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Not a directory: " + root);
        }

        final List<Path> files = new ArrayList<>();
        try {
            Files.walkFileTree(root.toAbsolutePath().normalize(), new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && DocumentKind.isSupported(file) && !isSelf(file)) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                    log.debug("Skipping unreadable entry {}", file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            // visitFileFailed continues on every entry, so only the root itself can end up here
            log.warn("Unable to walk {}", root, e);
        }

        Collections.sort(files);
        log.info("Found {} candidate files under {}", files.size(), root);
        return files;
    }

    private boolean isSelf(final Path file) {
        return excludedPath != null && excludedPath.equals(file.toAbsolutePath().normalize());
    }
}
