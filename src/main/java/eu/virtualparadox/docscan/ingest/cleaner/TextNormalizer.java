package eu.virtualparadox.docscan.ingest.cleaner;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Text normalization shared by extraction, keyword matching and chunk comparison.
 * <p>Stateless and thread-safe.</p>
 */
@Component
public class TextNormalizer {

    /**
     * Unicode NFC normalization applied to extracted page text, so that composed and
     * decomposed forms of the same character compare equal.
     *
     * @param input raw text, may be {@code null}
     * @return normalized text, {@code ""} for {@code null}
     */
    public String normalizeExtracted(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        return Normalizer.normalize(input, Normalizer.Form.NFC);
    }

    /**
     * Locale-independent case folding.
     */
    public String fold(final String input) {
        return input.toLowerCase(Locale.ROOT);
    }

    /**
     * Removes space, tab, newline and carriage return. Other whitespace is kept.
     *
     * @param input text to compress
     * @return {@code input} without the four stripped characters
     */
    public String stripWhitespace(final String input) {
        final StringBuilder sb = new StringBuilder(input.length());
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Case-folded, whitespace-stripped form used for literal matching and sequence comparison.
     */
    public String compress(final String input) {
        return stripWhitespace(fold(input));
    }

    /**
     * Replaces every newline with a single space (no other collapsing).
     */
    public String flattenLines(final String input) {
        return input.replace('\n', ' ');
    }
}
