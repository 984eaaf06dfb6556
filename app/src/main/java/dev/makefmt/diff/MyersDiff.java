package dev.makefmt.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shortest edit script between two sequences, after E. Myers, "An O(ND) Difference Algorithm and
 * Its Variations" (1986).
 *
 * <p>The forward search keeps a copy of the furthest-reaching vector for every edit distance
 * {@code d}, so backtracking needs O(D²) extra space. Elements are compared with
 * {@link Object#equals(Object)}.
 */
public final class MyersDiff {

    private MyersDiff() {
    }

    /**
     * Returns the edits turning {@code a} into {@code b} in document order. Equal inputs yield only
     * {@link EditKind#EQUAL} edits; two empty inputs yield an empty list.
     */
    public static <T> List<Edit> diff(List<T> a, List<T> b) {
        int n = a.size();
        int m = b.size();
        int max = n + m;
        if (max == 0) {
            return List.of();
        }

        // v[k + max] is the furthest x reached on diagonal k = x - y
        int[] v = new int[2 * max + 1];
        List<int[]> trace = new ArrayList<>();

        for (int d = 0; d <= max; d++) {
            trace.add(v.clone());
            for (int k = -d; k <= d; k += 2) {
                int x;
                if (movesDown(v, k, d, max)) {
                    x = v[k + 1 + max];
                } else {
                    x = v[k - 1 + max] + 1;
                }
                int y = x - k;
                while (x < n && y < m && a.get(x).equals(b.get(y))) {
                    x++;
                    y++;
                }
                v[k + max] = x;
                if (x >= n && y >= m) {
                    return backtrack(trace, n, m, d, max);
                }
            }
        }
        throw new IllegalStateException("edit graph end point not reached");
    }

    private static boolean movesDown(int[] v, int k, int d, int offset) {
        return k == -d || (k != d && v[k - 1 + offset] < v[k + 1 + offset]);
    }

    private static List<Edit> backtrack(List<int[]> trace, int n, int m, int d, int offset) {
        List<Edit> edits = new ArrayList<>();
        int x = n;
        int y = m;

        for (int step = d; step > 0; step--) {
            int[] v = trace.get(step);
            int k = x - y;
            boolean down = movesDown(v, k, step, offset);
            int previousK = down ? k + 1 : k - 1;
            int previousX = v[previousK + offset];
            int previousY = previousX - previousK;

            while (x > previousX && y > previousY) {
                x--;
                y--;
                edits.add(Edit.equal(x, y));
            }
            if (down) {
                y--;
                edits.add(Edit.insert(y));
            } else {
                x--;
                edits.add(Edit.delete(x));
            }
        }
        while (x > 0 && y > 0) {
            x--;
            y--;
            edits.add(Edit.equal(x, y));
        }

        Collections.reverse(edits);
        return edits;
    }
}
