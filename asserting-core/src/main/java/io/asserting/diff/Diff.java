/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.asserting.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes the alignment of two sequences using the O(ND) algorithm of
 * Eugene W. Myers, "An O(ND) Difference Algorithm and Its Variations" (1986).
 * <p>
 * The result is a list of maximal runs in left-to-right order. Within every gap
 * between two common runs the {@link DiffSegment.Kind#ONLY_LEFT} run comes before
 * the {@link DiffSegment.Kind#ONLY_RIGHT} run, so the same inputs always produce
 * the same segments.
 */
public final class Diff {

    private static final Logger logger = LoggerFactory.getLogger(Diff.class);

    /**
     * Upper bound for the number of edits the search explores before the middle
     * part of the inputs is reported as one replaced block. The trace kept for
     * back-tracking grows with the square of this number.
     * Can be configured via system property "asserting.diff.maxEditDistance".
     */
    public static final int MAX_EDIT_DISTANCE = Integer.parseInt(
            System.getProperty("asserting.diff.maxEditDistance", "2048"));

    /**
     * Element comparison by position, so that any indexed sequence can be diffed
     * without copying it into a common representation.
     */
    @FunctionalInterface
    public interface Equality {

        boolean equal(int leftIndex, int rightIndex);

    }

    private Diff() {
        // only static methods
    }

    /**
     * Diffs two strings by unicode code points. Indices and lengths of the
     * returned segments count code points, not UTF-16 chars.
     */
    public static List<DiffSegment> diff(String left, String right) {
        int[] l = left.codePoints().toArray();
        int[] r = right.codePoints().toArray();
        return diff(l.length, r.length, (i, j) -> l[i] == r[j]);
    }

    public static <T> List<DiffSegment> diff(List<T> left, List<T> right) {
        return diff(left.size(), right.size(), (i, j) -> Objects.equals(left.get(i), right.get(j)));
    }

    public static List<DiffSegment> diff(int leftLength, int rightLength, Equality equality) {
        int prefix = 0;
        while (prefix < leftLength && prefix < rightLength && equality.equal(prefix, prefix)) {
            prefix++;
        }
        int suffix = 0;
        while (suffix < leftLength - prefix && suffix < rightLength - prefix
                && equality.equal(leftLength - 1 - suffix, rightLength - 1 - suffix)) {
            suffix++;
        }
        Segments segments = new Segments();
        segments.common(0, 0, prefix);
        middle(prefix, leftLength - suffix, prefix, rightLength - suffix, equality, segments);
        segments.common(leftLength - suffix, rightLength - suffix, suffix);
        return segments.build();
    }

    private static void middle(int leftStart, int leftEnd, int rightStart, int rightEnd, Equality equality, Segments segments) {
        int n = leftEnd - leftStart;
        int m = rightEnd - rightStart;
        if (n == 0 || m == 0) {
            segments.onlyLeft(leftStart, n);
            segments.onlyRight(rightStart, m);
            return;
        }
        int max = n + m;
        int offset = max;
        int[] v = new int[2 * max + 2];
        List<int[]> trace = new ArrayList<>();
        boolean done = false;
        for (int d = 0; d <= max && !done; d++) {
            if (d > MAX_EDIT_DISTANCE) {
                logger.debug("edit distance exceeds {}, reporting {} vs {} elements as replaced", MAX_EDIT_DISTANCE, n, m);
                segments.onlyLeft(leftStart, n);
                segments.onlyRight(rightStart, m);
                return;
            }
            // only diagonals -(d-1)..(d-1) are read when back-tracking from round d
            trace.add(Arrays.copyOfRange(v, offset - d, offset + d + 1));
            for (int k = -d; k <= d; k += 2) {
                int x;
                if (k == -d || (k != d && v[offset + k - 1] < v[offset + k + 1])) {
                    x = v[offset + k + 1];
                } else {
                    x = v[offset + k - 1] + 1;
                }
                int y = x - k;
                while (x < n && y < m && equality.equal(leftStart + x, rightStart + y)) {
                    x++;
                    y++;
                }
                v[offset + k] = x;
                if (x >= n && y >= m) {
                    done = true;
                    break;
                }
            }
        }
        List<int[]> edits = backtrack(trace, n, m);
        for (int i = edits.size() - 1; i >= 0; i--) {
            int[] edit = edits.get(i);
            switch (edit[0]) {
                case COMMON -> segments.common(leftStart + edit[1], rightStart + edit[2], 1);
                case LEFT -> segments.onlyLeft(leftStart + edit[1], 1);
                default -> segments.onlyRight(rightStart + edit[2], 1);
            }
        }
    }

    private static final int COMMON = 0;
    private static final int LEFT = 1;
    private static final int RIGHT = 2;

    // edits in reverse order, each {type, leftIndex, rightIndex}
    private static List<int[]> backtrack(List<int[]> trace, int n, int m) {
        List<int[]> edits = new ArrayList<>();
        int x = n;
        int y = m;
        for (int d = trace.size() - 1; d > 0; d--) {
            int[] v = trace.get(d); // window starts at diagonal -d
            int k = x - y;
            int prevK;
            if (k == -d || (k != d && v[k - 1 + d] < v[k + 1 + d])) {
                prevK = k + 1;
            } else {
                prevK = k - 1;
            }
            int prevX = v[prevK + d];
            int prevY = prevX - prevK;
            while (x > prevX && y > prevY) {
                edits.add(new int[]{COMMON, x - 1, y - 1});
                x--;
                y--;
            }
            if (x == prevX) {
                edits.add(new int[]{RIGHT, -1, y - 1});
            } else {
                edits.add(new int[]{LEFT, x - 1, -1});
            }
            x = prevX;
            y = prevY;
        }
        while (x > 0 && y > 0) {
            edits.add(new int[]{COMMON, x - 1, y - 1});
            x--;
            y--;
        }
        return edits;
    }

    /**
     * Coalesces single edits into maximal runs.
     */
    private static class Segments {

        final List<DiffSegment> list = new ArrayList<>();

        int commonLeft;
        int commonRight;
        int commonLength;

        int leftStart;
        int leftLength;
        int rightStart;
        int rightLength;

        void common(int leftIndex, int rightIndex, int length) {
            if (length == 0) {
                return;
            }
            flushGap();
            if (commonLength > 0 && commonLeft + commonLength == leftIndex && commonRight + commonLength == rightIndex) {
                commonLength += length;
            } else {
                flushCommon();
                commonLeft = leftIndex;
                commonRight = rightIndex;
                commonLength = length;
            }
        }

        void onlyLeft(int index, int length) {
            if (length == 0) {
                return;
            }
            flushCommon();
            if (leftLength == 0) {
                leftStart = index;
            }
            leftLength += length;
        }

        void onlyRight(int index, int length) {
            if (length == 0) {
                return;
            }
            flushCommon();
            if (rightLength == 0) {
                rightStart = index;
            }
            rightLength += length;
        }

        void flushCommon() {
            if (commonLength > 0) {
                list.add(DiffSegment.common(commonLeft, commonRight, commonLength));
                commonLength = 0;
            }
        }

        void flushGap() {
            if (leftLength > 0) {
                list.add(DiffSegment.onlyLeft(leftStart, leftLength));
                leftLength = 0;
            }
            if (rightLength > 0) {
                list.add(DiffSegment.onlyRight(rightStart, rightLength));
                rightLength = 0;
            }
        }

        List<DiffSegment> build() {
            flushCommon();
            flushGap();
            return List.copyOf(list);
        }

    }

}
