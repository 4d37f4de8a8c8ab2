package eu.virtualparadox.docscan.scan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScanProgressTrackerTest {

    private final List<String> reports = new ArrayList<>();

    private final ScanCallbacks callbacks = new ScanCallbacks() {
        @Override
        public void onProgress(final int percent, final String fileName) {
            reports.add(percent + ":" + fileName);
        }
    };

    @Test
    @DisplayName("Reports on every fifth step and on the last one")
    void reportsEveryFifthAndLast() {
        final ScanProgressTracker tracker = new ScanProgressTracker(7, callbacks);

        for (int i = 1; i <= 7; i++) {
            tracker.step("f" + i);
        }

        assertEquals(List.of("71:f5", "100:f7"), reports);
        assertEquals(7, tracker.getProcessed());
    }

    @Test
    @DisplayName("Steps beyond the total are ignored")
    void ignoresExtraSteps() {
        final ScanProgressTracker tracker = new ScanProgressTracker(1, callbacks);

        tracker.step("a");
        tracker.step("b");

        assertEquals(List.of("100:a"), reports);
        assertEquals(100, tracker.percent());
    }

    @Test
    @DisplayName("Negative totals are rejected")
    void rejectsNegativeTotal() {
        assertThrows(IllegalArgumentException.class, () -> new ScanProgressTracker(-1, callbacks));
    }
}
