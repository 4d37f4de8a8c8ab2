package eu.virtualparadox.docscan.search.keyword;

import java.util.regex.Pattern;

/**
 * Prepared keyword query, shared read-only by all scan jobs of one search.
 *
 * @param raw          query as typed by the user
 * @param term         literal mode: case-folded, whitespace-stripped query; regex mode: the pattern verbatim
 * @param reversedTerm literal mode: {@code term} reversed; {@code null} in regex mode
 * @param regex        whether {@code term} is a regular expression
 * @param pattern      compiled pattern in regex mode, {@code null} when literal or when the pattern is invalid
 */
public record KeywordQuery(String raw, String term, String reversedTerm, boolean regex, Pattern pattern) {

    /**
     * @return {@code true} for a regex query whose pattern failed to compile
     */
    public boolean isInvalidPattern() {
        return regex && pattern == null;
    }
}
