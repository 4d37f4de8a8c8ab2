package eu.virtualparadox.docscan.ingest.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of document formats the scanner understands, resolved once from the file extension.
 */
public enum DocumentKind {

    PDF(".pdf"),
    WORD(".docx", ".doc"),
    PLAIN_TEXT(".txt", ".py", ".c", ".cpp", ".h", ".java", ".md", ".json", ".xml", ".csv");

    private final List<String> extensions;

    DocumentKind(final String... extensions) {
        this.extensions = List.of(extensions);
    }

    /**
     * Resolves the kind of {@code path} from its extension, ignoring case.
     *
     * @param path file path
     * @return the kind, or empty when the extension is not recognized
     */
    public static Optional<DocumentKind> of(final Path path) {
        final String ext = extensionOf(path);
        if (ext.isEmpty()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(kind -> kind.extensions.contains(ext))
                .findFirst();
    }

    public static boolean isSupported(final Path path) {
        return of(path).isPresent();
    }

    /**
     * @return lower-cased extension including the dot (e.g. {@code ".pdf"}), or {@code ""}
     */
    static String extensionOf(final Path path) {
        final Path fileName = path == null ? null : path.getFileName();
        if (fileName == null) {
            return "";
        }
        final String name = fileName.toString();
        final int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
