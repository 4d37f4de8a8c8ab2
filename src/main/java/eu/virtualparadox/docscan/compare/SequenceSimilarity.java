package eu.virtualparadox.docscan.compare;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Order-sensitive similarity of two character sequences using Ratcliff/Obershelp
 * "gestalt pattern matching".
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Find the longest common contiguous block of {@code a} and {@code b}.</li>
 *   <li>Recurse on the unmatched regions to the left and to the right of that block.</li>
 *   <li>With {@code M} the total size of all matched blocks, the ratio is
 *       {@code 2 * M / (|a| + |b|)}; two empty sequences are identical (ratio 1).</li>
 * </ol>
 *
 * <h2>Popular characters</h2>
 * When {@code b} has {@value #AUTOJUNK_MIN_LENGTH} or more characters, characters occurring more
 * than {@code |b| / 100 + 1} times in it cannot start a block. They are still absorbed when a
 * block is extended to its maximal size. This keeps long comparisons from being dominated by
 * frequent characters and bounds the running time.
 *
 * <p>Stateless; each call allocates its own working buffers.</p>
 */
public final class SequenceSimilarity {

    static final int AUTOJUNK_MIN_LENGTH = 200;

    private SequenceSimilarity() {
        // prevent instantiation
    }

    /**
     * @return similarity in {@code [0, 1]}
     */
    public static double ratio(final String a, final String b) {
        final int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * matchedCharacters(a, b) / total;
    }

    /**
     * @return total size of the matching blocks of {@code a} and {@code b}
     */
    static int matchedCharacters(final String a, final String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        final BlockFinder finder = new BlockFinder(a, b);
        int matched = 0;

        final Deque<int[]> pending = new ArrayDeque<>();
        pending.push(new int[]{0, a.length(), 0, b.length()});
        while (!pending.isEmpty()) {
            final int[] region = pending.pop();
            final int aLo = region[0];
            final int aHi = region[1];
            final int bLo = region[2];
            final int bHi = region[3];

            final int[] block = finder.longestMatch(aLo, aHi, bLo, bHi);
            final int i = block[0];
            final int j = block[1];
            final int size = block[2];
            if (size == 0) {
                continue;
            }
            matched += size;
            if (aLo < i && bLo < j) {
                pending.push(new int[]{aLo, i, bLo, j});
            }
            if (i + size < aHi && j + size < bHi) {
                pending.push(new int[]{i + size, aHi, j + size, bHi});
            }
        }
        return matched;
    }

    /**
     * Longest-common-block search over an index of the positions of each character of {@code b}.
     */
    private static final class BlockFinder {

        private static final int[] NONE = new int[0];

        private final String a;
        private final String b;
        private final Map<Character, int[]> positions;

        // run lengths keyed by (j + 1) so that the predecessor of j = 0 reads slot 0, always zero
        private int[] previous;
        private int[] current;
        private int[] previousTouched;
        private int[] currentTouched;

        BlockFinder(final String a, final String b) {
            this.a = a;
            this.b = b;
            this.positions = indexPositions(b);
            this.previous = new int[b.length() + 1];
            this.current = new int[b.length() + 1];
            this.previousTouched = new int[b.length()];
            this.currentTouched = new int[b.length()];
        }

        private static Map<Character, int[]> indexPositions(final String b) {
            final Map<Character, List<Integer>> byChar = new HashMap<>();
            for (int j = 0; j < b.length(); j++) {
                byChar.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
            }

            final int n = b.length();
            final int popularLimit = n / 100 + 1;
            final Map<Character, int[]> result = new HashMap<>();
            for (final Map.Entry<Character, List<Integer>> entry : byChar.entrySet()) {
                final List<Integer> list = entry.getValue();
                if (n >= AUTOJUNK_MIN_LENGTH && list.size() > popularLimit) {
                    continue;
                }
                result.put(entry.getKey(), list.stream().mapToInt(Integer::intValue).toArray());
            }
            return result;
        }

        /**
         * @return {@code {i, j, size}} of the longest block {@code a[i, i+size) == b[j, j+size)}
         * within the given region; the earliest such block in {@code a}, then in {@code b}, wins
         */
        int[] longestMatch(final int aLo, final int aHi, final int bLo, final int bHi) {
            int bestI = aLo;
            int bestJ = bLo;
            int bestSize = 0;
            int previousCount = 0;

            for (int i = aLo; i < aHi; i++) {
                final int[] js = positions.getOrDefault(a.charAt(i), NONE);
                int currentCount = 0;
                for (final int j : js) {
                    if (j < bLo) {
                        continue;
                    }
                    if (j >= bHi) {
                        break;
                    }
                    final int k = previous[j] + 1;
                    current[j + 1] = k;
                    currentTouched[currentCount++] = j + 1;
                    if (k > bestSize) {
                        bestI = i - k + 1;
                        bestJ = j - k + 1;
                        bestSize = k;
                    }
                }
                clear(previous, previousTouched, previousCount);
                swap();
                previousCount = currentCount;
            }
            clear(previous, previousTouched, previousCount);

            // popular characters never seed a block but may extend one
            while (bestI > aLo && bestJ > bLo && a.charAt(bestI - 1) == b.charAt(bestJ - 1)) {
                bestI--;
                bestJ--;
                bestSize++;
            }
            while (bestI + bestSize < aHi && bestJ + bestSize < bHi
                    && a.charAt(bestI + bestSize) == b.charAt(bestJ + bestSize)) {
                bestSize++;
            }
            return new int[]{bestI, bestJ, bestSize};
        }

        private void swap() {
            final int[] runs = previous;
            previous = current;
            current = runs;

            final int[] touched = previousTouched;
            previousTouched = currentTouched;
            currentTouched = touched;
        }

        private static void clear(final int[] runs, final int[] touched, final int count) {
            for (int t = 0; t < count; t++) {
                runs[touched[t]] = 0;
            }
        }
    }
}
