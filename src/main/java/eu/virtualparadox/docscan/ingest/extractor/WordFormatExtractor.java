package eu.virtualparadox.docscan.ingest.extractor;

import eu.virtualparadox.docscan.ingest.model.DocumentKind;
import eu.virtualparadox.docscan.ingest.model.Page;
import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word-processor documents through Apache POI: OOXML ({@code .docx}) via XWPF and the
 * legacy binary format ({@code .doc}) via HWPF.
 * <p>Word files carry no usable pagination, so the whole body becomes page {@code "1"},
 * paragraphs joined by newline in document order.</p>
 */
@Component
public final class WordFormatExtractor implements FormatExtractor {

    private static final Pattern TRAILING_BREAKS = Pattern.compile("[\\r\\n]+$");

    @Override
    public DocumentKind kind() {
        return DocumentKind.WORD;
    }

    @Override
    public List<Page> extractPages(final Path path) throws IOException {
        final List<String> paragraphs = isLegacy(path) ? readLegacy(path) : readOoxml(path);
        return List.of(Page.single(String.join("\n", paragraphs)));
    }

    private List<String> readOoxml(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path);
             XWPFDocument doc = new XWPFDocument(in)) {
            final List<String> paragraphs = new ArrayList<>();
            for (final XWPFParagraph p : doc.getParagraphs()) {
                paragraphs.add(p.getText());
            }
            return paragraphs;
        }
    }

    private List<String> readLegacy(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path);
             WordExtractor extractor = new WordExtractor(in)) {
            final List<String> paragraphs = new ArrayList<>();
            for (final String p : extractor.getParagraphText()) {
                paragraphs.add(cleanLegacyParagraph(p));
            }
            return paragraphs;
        }
    }

    /**
     * Drops embedded field codes, keeping their displayed result, and the paragraph mark
     * and line breaks HWPF leaves at the end of each paragraph.
     */
    static String cleanLegacyParagraph(final String raw) {
        return TRAILING_BREAKS.matcher(WordExtractor.stripFields(raw)).replaceAll("");
    }

    private static boolean isLegacy(final Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".doc");
    }
}
