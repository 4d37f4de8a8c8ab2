package eu.virtualparadox.docscan.search.keyword;

/**
 * @param found   whether the text satisfies the query
 * @param snippet context around the first hit, {@code ""} when not found
 */
public record MatchOutcome(boolean found, String snippet) {

    public static final MatchOutcome NO_MATCH = new MatchOutcome(false, "");

    public static MatchOutcome found(final String snippet) {
        return new MatchOutcome(true, snippet);
    }
}
