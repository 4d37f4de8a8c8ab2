package eu.virtualparadox.docscan.search.keyword;

import eu.virtualparadox.docscan.ingest.cleaner.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordMatcherTest {

    private KeywordMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new KeywordMatcher(new TextNormalizer());
    }

    @Test
    @DisplayName("Literal hit returns the surrounding text as snippet")
    void literal_snippet() {
        final MatchOutcome outcome = matcher.match("hello world", matcher.prepare("hello", false));

        assertThat(outcome.found()).isTrue();
        assertThat(outcome.snippet()).isEqualTo("...hello world...");
    }

    @Test
    @DisplayName("Literal matching ignores case")
    void literal_caseInsensitive() {
        final MatchOutcome outcome = matcher.match("Say HELLO to everyone", matcher.prepare("hello", false));

        assertThat(outcome.found()).isTrue();
        assertThat(outcome.snippet()).isEqualTo("...Say HELLO to everyone...");
    }

    @Test
    @DisplayName("Literal matching ignores whitespace and line breaks")
    void literal_whitespaceInsensitive() {
        final KeywordQuery query = matcher.prepare("Hello World", false);

        assertThat(query.term()).isEqualTo("helloworld");
        assertThat(matcher.match("greeting:\nhello\n\tworld!", query).found()).isTrue();
    }

    @Test
    @DisplayName("Term found only in compressed text yields the generic snippet")
    void literal_genericSnippet() {
        final MatchOutcome outcome = matcher.match("the word hel lo is split", matcher.prepare("hello", false));

        assertThat(outcome.found()).isTrue();
        assertThat(outcome.snippet()).isEqualTo(KeywordMatcher.GENERIC_SNIPPET);
    }

    @Test
    @DisplayName("Mirrored text is found through the reversed term")
    void literal_reversedTerm() {
        final KeywordQuery query = matcher.prepare("abc", false);

        assertThat(query.reversedTerm()).isEqualTo("cba");
        final MatchOutcome outcome = matcher.match("xx cba yy", query);
        assertThat(outcome.found()).isTrue();
        assertThat(outcome.snippet()).isEqualTo("...xx cba yy...");
    }

    @Test
    @DisplayName("Snippet spans forty characters on each side of the hit")
    void snippet_window() {
        final String text = "x".repeat(100) + "needle" + "y".repeat(100);

        final MatchOutcome outcome = matcher.match(text, matcher.prepare("needle", false));

        assertThat(outcome.snippet()).isEqualTo("..." + "x".repeat(40) + "needle" + "y".repeat(34) + "...");
    }

    @Test
    @DisplayName("Snippet is flattened to a single line")
    void snippet_flattened() {
        final MatchOutcome outcome = matcher.match("first\nsecond target\nthird", matcher.prepare("target", false));

        assertThat(outcome.snippet()).isEqualTo("...first second target third...");
    }

    @Test
    @DisplayName("No hit yields no match")
    void literal_noMatch() {
        assertThat(matcher.match("nothing here", matcher.prepare("absent", false)))
                .isEqualTo(MatchOutcome.NO_MATCH);
    }

    @Test
    @DisplayName("Empty text never matches")
    void emptyText_noMatch() {
        assertThat(matcher.match("", matcher.prepare("a", false)).found()).isFalse();
        assertThat(matcher.match(null, matcher.prepare("a", true)).found()).isFalse();
    }

    @Test
    @DisplayName("Whitespace-only literal query matches nothing")
    void literal_whitespaceQuery() {
        assertThat(matcher.match("some text", matcher.prepare(" \t", false)).found()).isFalse();
    }

    @Test
    @DisplayName("Regex is applied to the case-folded text")
    void regex_match() {
        final MatchOutcome outcome = matcher.match("Invoice 2024-117 PAID", matcher.prepare("\\d{4}-\\d+", true));

        assertThat(outcome.found()).isTrue();
        assertThat(outcome.snippet()).isEqualTo("...Invoice 2024-117 PAID...");
        assertThat(matcher.match("HELLO there", matcher.prepare("h.llo", true)).found()).isTrue();
    }

    @Test
    @DisplayName("Empty regex match anchors the snippet at the start of the text")
    void regex_emptyMatchUsesOffsetZero() {
        final String text = "hello world, " + "z".repeat(60);

        final MatchOutcome outcome = matcher.match(text, matcher.prepare("x*", true));

        assertThat(outcome.found()).isTrue();
        assertThat(outcome.snippet()).isEqualTo("..." + text.substring(0, 40) + "...");
    }

    @Test
    @DisplayName("Regex snippet starts at the first occurrence of the matched text")
    void regex_snippetAtFirstOccurrence() {
        final String text = "b" + ".".repeat(60) + "bc";

        final MatchOutcome outcome = matcher.match(text, matcher.prepare("b(?=c)", true));

        assertThat(outcome.snippet()).isEqualTo("...b" + ".".repeat(39) + "...");
    }

    @Test
    @DisplayName("Upper-case regex literals cannot match folded text")
    void regex_upperCaseLiteral() {
        assertThat(matcher.match("HELLO", matcher.prepare("HELLO", true)).found()).isFalse();
    }

    @Test
    @DisplayName("Invalid regex compiles to a query that never matches")
    void regex_invalid() {
        final KeywordQuery query = matcher.prepare("[unclosed", true);

        assertThat(query.isInvalidPattern()).isTrue();
        assertThat(matcher.match("[unclosed", query)).isEqualTo(MatchOutcome.NO_MATCH);
    }

    @Test
    @DisplayName("Null query is rejected")
    void nullQuery_rejected() {
        assertThatThrownBy(() -> matcher.prepare(null, false)).isInstanceOf(NullPointerException.class);
    }
}
