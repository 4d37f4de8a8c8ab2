package eu.virtualparadox.docscan.ingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionResultTest {

    @Test
    @DisplayName("A failed result is empty and carries its reason")
    void failed() {
        final ExtractionResult result = ExtractionResult.failed("boom");

        assertThat(result.isFailed()).isTrue();
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.failureReason()).isEqualTo("boom");
    }

    @Test
    @DisplayName("Pages without text count as empty")
    void blankPages() {
        assertThat(ExtractionResult.of(List.of(new Page("1", ""), new Page("2", ""))).isEmpty()).isTrue();
        assertThat(ExtractionResult.of(List.of(new Page("1", ""), new Page("2", "x"))).isEmpty()).isFalse();
    }

    @Test
    @DisplayName("Full text joins pages with a newline")
    void fullText() {
        final ExtractionResult result = ExtractionResult.of(List.of(new Page("1", "a"), new Page("2", "b")));

        assertThat(result.fullText()).isEqualTo("a\nb");
        assertThat(ExtractionResult.of(null).pages()).isEmpty();
    }
}
