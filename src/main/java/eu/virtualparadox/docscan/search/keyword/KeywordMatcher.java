package eu.virtualparadox.docscan.search.keyword;

import eu.virtualparadox.docscan.ingest.cleaner.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a text satisfies a {@link KeywordQuery} and builds a context snippet.
 *
 * <h2>Literal mode</h2>
 * The text is case-folded and stripped of spaces, tabs and line breaks; the query term (stripped
 * the same way) must occur in that compressed form. Failing that, the reversed term is tried,
 * which catches text that upstream formatting stored mirrored. This is a heuristic only.
 *
 * <h2>Regex mode</h2>
 * The pattern is applied verbatim to the case-folded text. An invalid pattern, or one that fails
 * while matching, never matches.
 *
 * <h2>Snippet</h2>
 * The first occurrence of the matched term is looked up in the case-folded (uncompressed) text,
 * and the original-case text from {@value #CONTEXT_CHARS} characters before to
 * {@value #CONTEXT_CHARS} characters after that offset is returned with newlines flattened,
 * as {@code ...snippet...}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KeywordMatcher {

    static final int CONTEXT_CHARS = 40;

    /**
     * Snippet used when a literal term only exists in the whitespace-stripped text.
     */
    static final String GENERIC_SNIPPET = "Match found";

    private final TextNormalizer textNormalizer;

    /**
     * Normalizes and, in regex mode, compiles a raw query once for a whole search.
     *
     * @param raw   query text (non-null)
     * @param regex whether {@code raw} is a regular expression
     * @return prepared query; an invalid pattern yields a query that matches nothing
     */
    public KeywordQuery prepare(final String raw, final boolean regex) {
        Objects.requireNonNull(raw, "query must not be null");

        if (regex) {
            Pattern pattern = null;
            try {
                pattern = Pattern.compile(raw);
            } catch (PatternSyntaxException e) {
                log.warn("Invalid search pattern '{}': {}", raw, e.getDescription());
            }
            return new KeywordQuery(raw, raw, null, true, pattern);
        }

        final String term = textNormalizer.compress(raw);
        final String reversed = StringUtils.reverse(term);
        return new KeywordQuery(raw, term, reversed, false, null);
    }

    /**
     * @param text  extracted document text, may be {@code null} or empty
     * @param query prepared query
     * @return outcome with snippet; never {@code null}
     */
    public MatchOutcome match(final String text, final KeywordQuery query) {
        if (text == null || text.isEmpty()) {
            return MatchOutcome.NO_MATCH;
        }
        final String folded = textNormalizer.fold(text);
        return query.regex()
                ? matchPattern(text, folded, query)
                : matchLiteral(text, folded, query);
    }

    private MatchOutcome matchPattern(final String text, final String folded, final KeywordQuery query) {
        if (query.isInvalidPattern()) {
            return MatchOutcome.NO_MATCH;
        }

        final String matchedTerm;
        try {
            final Matcher matcher = query.pattern().matcher(folded);
            if (!matcher.find()) {
                return MatchOutcome.NO_MATCH;
            }
            matchedTerm = matcher.group();
        } catch (RuntimeException | StackOverflowError e) {
            log.debug("Pattern '{}' failed while matching", query.raw(), e);
            return MatchOutcome.NO_MATCH;
        }

        final int start = folded.indexOf(matchedTerm);
        return MatchOutcome.found(snippet(text, folded, Math.max(start, 0)));
    }

    private MatchOutcome matchLiteral(final String text, final String folded, final KeywordQuery query) {
        if (query.term().isEmpty()) {
            return MatchOutcome.NO_MATCH;
        }

        final String compressed = textNormalizer.stripWhitespace(folded);
        final String matchedTerm;
        if (compressed.contains(query.term())) {
            matchedTerm = query.term();
        } else if (query.reversedTerm() != null && compressed.contains(query.reversedTerm())) {
            matchedTerm = query.reversedTerm();
        } else {
            return MatchOutcome.NO_MATCH;
        }

        final int start = folded.indexOf(matchedTerm);
        if (start < 0) {
            return MatchOutcome.found(GENERIC_SNIPPET);
        }
        return MatchOutcome.found(snippet(text, folded, start));
    }

    private String snippet(final String text, final String folded, final int start) {
        // case folding may change length for a few code points; stay inside the original text
        final int from = Math.min(Math.max(0, start - CONTEXT_CHARS), text.length());
        final int to = Math.min(Math.min(folded.length(), start + CONTEXT_CHARS), text.length());
        final String window = textNormalizer.flattenLines(text.substring(from, Math.max(from, to))).strip();
        return "..." + window + "...";
    }
}
