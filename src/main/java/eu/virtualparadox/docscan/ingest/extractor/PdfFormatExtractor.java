package eu.virtualparadox.docscan.ingest.extractor;

import eu.virtualparadox.docscan.ingest.cleaner.TextNormalizer;
import eu.virtualparadox.docscan.ingest.model.DocumentKind;
import eu.virtualparadox.docscan.ingest.model.Page;
import lombok.RequiredArgsConstructor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the text layer of a PDF with Apache PDFBox, one {@link Page} per physical page.
 * <p>No OCR: scanned pages without a text layer produce empty page text.
 * A new {@link PDFTextStripper} is created per call since it is not safe to share.</p>
 */
@Component
@RequiredArgsConstructor
public final class PdfFormatExtractor implements FormatExtractor {

    private final TextNormalizer textNormalizer;

    @Override
    public DocumentKind kind() {
        return DocumentKind.PDF;
    }

    @Override
    public List<Page> extractPages(final Path path) throws IOException {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            final List<Page> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = textNormalizer.normalizeExtracted(stripper.getText(pdf));
                pages.add(new Page(String.valueOf(page), pageText));
            }
            return pages;
        }
    }
}
