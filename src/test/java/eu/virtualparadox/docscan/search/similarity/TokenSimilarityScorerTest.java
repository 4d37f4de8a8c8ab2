package eu.virtualparadox.docscan.search.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TokenSimilarityScorerTest {

    private final TokenSimilarityScorer scorer = new TokenSimilarityScorer();

    @Test
    @DisplayName("Tokens are folded word runs longer than three characters")
    void tokenize_filtersShortWords() {
        assertThat(scorer.tokenize("The quick brown FOX jumps, the QUICK one"))
                .containsExactlyInAnyOrder("quick", "brown", "jumps");
    }

    @Test
    @DisplayName("Non-ASCII letters belong to words")
    void tokenize_unicodeWords() {
        assertThat(scorer.tokenize("Größe über Straße")).containsExactlyInAnyOrder("größe", "über", "straße");
    }

    @Test
    @DisplayName("Two of five shared tokens score 40 percent")
    void score_jaccard() {
        final Set<String> reference = scorer.tokenize("alpha beta gamma delta");
        final Set<String> target = scorer.tokenize("alpha beta epsilon");

        assertThat(scorer.score(reference, target)).hasValue(40.0);
    }

    @Test
    @DisplayName("Score is symmetric")
    void score_symmetric() {
        final Set<String> a = scorer.tokenize("contract signed by both parties today");
        final Set<String> b = scorer.tokenize("both parties signed nothing");

        assertThat(scorer.score(a, b)).isEqualTo(scorer.score(b, a));
    }

    @Test
    @DisplayName("A document scores 100 against itself")
    void score_self() {
        final Set<String> tokens = scorer.tokenize("identical words everywhere");

        assertThat(scorer.score(tokens, tokens)).hasValue(100.0);
    }

    @Test
    @DisplayName("Score keeps full precision")
    void score_unrounded() {
        assertThat(scorer.score(Set.of("aaaa", "bbbb", "cccc"), Set.of("aaaa"))).hasValue(100.0 / 3);
    }

    @Test
    @DisplayName("Overlap just above five percent is reportable even though it displays as 5.0")
    void isReportable_appliedBeforeRounding() {
        final Set<String> reference = new HashSet<>(shared(6));
        reference.addAll(words("ref", 100));
        final Set<String> target = new HashSet<>(shared(6));
        target.addAll(words("tgt", 13));

        final double score = scorer.score(reference, target).orElseThrow();

        assertThat(score).isEqualTo(600.0 / 119);
        assertThat(scorer.isReportable(score)).isTrue();
    }

    private static Set<String> shared(final int count) {
        return words("common", count);
    }

    private static Set<String> words(final String prefix, final int count) {
        final Set<String> words = new HashSet<>();
        for (int i = 0; i < count; i++) {
            words.add(prefix + "word" + i);
        }
        return words;
    }

    @Test
    @DisplayName("An empty token set is not comparable")
    void score_emptySet() {
        assertThat(scorer.score(Set.of(), Set.of("word"))).isEmpty();
        assertThat(scorer.score(Set.of("word"), Set.of())).isEmpty();
    }

    @Test
    @DisplayName("Only scores above five percent are reportable")
    void isReportable_threshold() {
        assertThat(scorer.isReportable(5.0)).isFalse();
        assertThat(scorer.isReportable(5.1)).isTrue();
        assertThat(scorer.isReportable(0.0)).isFalse();
    }
}
