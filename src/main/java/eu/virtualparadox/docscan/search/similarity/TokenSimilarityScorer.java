package eu.virtualparadox.docscan.search.similarity;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document-level overlap as the Jaccard index of word-token sets.
 * <p>Tokens are word-character runs of the case-folded text longer than
 * {@value #MIN_TOKEN_LENGTH} characters; duplicates collapse into a set.</p>
 */
@Component
public class TokenSimilarityScorer {

    public static final int MIN_TOKEN_LENGTH = 3;

    /**
     * Scores at or below this percentage are noise and not reported.
     */
    public static final double REPORT_THRESHOLD = 5.0;

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    public Set<String> tokenize(final String text) {
        final Set<String> tokens = new HashSet<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        final Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            final String word = matcher.group();
            if (word.length() > MIN_TOKEN_LENGTH) {
                tokens.add(word);
            }
        }
        return tokens;
    }

    /**
     * Jaccard similarity {@code |A ∩ B| / |A ∪ B| * 100}, unrounded.
     *
     * @return the score, or empty when either set is empty (the pair is not comparable)
     */
    public OptionalDouble score(final Set<String> reference, final Set<String> target) {
        if (reference.isEmpty() || target.isEmpty()) {
            return OptionalDouble.empty();
        }
        final Set<String> smaller = reference.size() <= target.size() ? reference : target;
        final Set<String> larger = smaller == reference ? target : reference;

        int intersection = 0;
        for (final String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        final int union = reference.size() + target.size() - intersection;
        return OptionalDouble.of((intersection * 100.0) / union);
    }

    /**
     * @param score unrounded score from {@link #score(Set, Set)}
     * @return {@code true} when {@code score} is high enough to be reported
     */
    public boolean isReportable(final double score) {
        return score > REPORT_THRESHOLD;
    }
}
