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
package io.asserting.output;

import io.asserting.diff.Diff;
import io.asserting.diff.DiffSegment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntPredicate;

/**
 * Builds the highlighted renderings of actual and expected values used in
 * failure messages.
 */
public final class Marker {

    /**
     * The rendered actual and expected value with highlighted differences.
     */
    public record Marked(String actual, String expected) {

    }

    private Marker() {
        // only static methods
    }

    /**
     * Renders both values with {@link Debug#format(Object)}, diffs the two
     * renderings and wraps every part found only in the actual rendering with the
     * actual highlight, and every part found only in the expected rendering with
     * the expected highlight.
     */
    public static Marked markDiff(Object actual, Object expected, DiffFormat format) {
        String actualText = Debug.format(actual);
        String expectedText = Debug.format(expected);
        if (format.isNoHighlight()) {
            return new Marked(actualText, expectedText);
        }
        int[] left = actualText.codePoints().toArray();
        int[] right = expectedText.codePoints().toArray();
        List<DiffSegment> segments = Diff.diff(left.length, right.length, (i, j) -> left[i] == right[j]);
        StringBuilder markedActual = new StringBuilder(actualText.length() + 16);
        StringBuilder markedExpected = new StringBuilder(expectedText.length() + 16);
        for (DiffSegment segment : segments) {
            switch (segment.kind()) {
                case ONLY_LEFT -> format.actual().wrap(markedActual, new String(left, segment.leftIndex(), segment.length()));
                case COMMON -> {
                    markedActual.append(new String(left, segment.leftIndex(), segment.length()));
                    markedExpected.append(new String(right, segment.rightIndex(), segment.length()));
                }
                case ONLY_RIGHT -> format.expected().wrap(markedExpected, new String(right, segment.rightIndex(), segment.length()));
            }
        }
        return new Marked(markedActual.toString(), markedExpected.toString());
    }

    public static String markUnexpected(Object value, DiffFormat format) {
        return format.actual().wrap(Debug.format(value));
    }

    public static String markMissing(Object value, DiffFormat format) {
        return format.expected().wrap(Debug.format(value));
    }

    public static String markUnexpectedSubstr(String substr, DiffFormat format) {
        return format.actual().wrap(substr);
    }

    public static String markMissingSubstr(String substr, DiffFormat format) {
        return format.expected().wrap(substr);
    }

    public static String markUnexpectedChar(int codePoint, DiffFormat format) {
        return format.actual().wrap(Character.toString(codePoint));
    }

    public static String markMissingChar(int codePoint, DiffFormat format) {
        return format.expected().wrap(Character.toString(codePoint));
    }

    /**
     * Renders an {@link Iterable} or array as {@code [a, b, c]} and highlights the
     * items at the selected positions. Consecutive selected items share one
     * highlight.
     */
    public static String markSelectedItems(Object collection, Set<Integer> selected, Highlight highlight) {
        return markRuns(itemParts(collection), selected::contains, highlight, "[", ", ", "]");
    }

    public static String markAllItems(Object collection, Highlight highlight) {
        return markRuns(itemParts(collection), i -> true, highlight, "[", ", ", "]");
    }

    private static List<String> itemParts(Object collection) {
        List<Object> items = Debug.toList(collection);
        if (items == null) {
            throw new IllegalArgumentException("not an iterable or array: " + collection);
        }
        List<String> parts = new ArrayList<>(items.size());
        for (Object item : items) {
            parts.add(Debug.format(item));
        }
        return parts;
    }

    /**
     * Renders a map as {@code {k: v, ...}} in iteration order and highlights the
     * entries at the selected positions.
     */
    public static String markSelectedEntries(Map<?, ?> map, Set<Integer> selected, Highlight highlight) {
        return markRuns(entryParts(map), selected::contains, highlight, "{", ", ", "}");
    }

    public static String markAllEntries(Map<?, ?> map, Highlight highlight) {
        return markRuns(entryParts(map), i -> true, highlight, "{", ", ", "}");
    }

    private static List<String> entryParts(Map<?, ?> map) {
        List<String> parts = new ArrayList<>(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            StringBuilder sb = new StringBuilder();
            Debug.appendEntry(sb, entry);
            parts.add(sb.toString());
        }
        return parts;
    }

    /**
     * Highlights the characters at the selected code point positions of a string.
     * The result is not quoted.
     */
    public static String markSelectedChars(String text, Set<Integer> selected, Highlight highlight) {
        if (highlight.isEmpty() || selected.isEmpty()) {
            return text;
        }
        List<String> parts = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> parts.add(Character.toString(cp)));
        return markRuns(parts, selected::contains, highlight, "", "", "");
    }

    private static String markRuns(List<String> parts, IntPredicate selected, Highlight highlight,
                                   String open, String separator, String close) {
        boolean plain = highlight.isEmpty();
        StringBuilder sb = new StringBuilder(open);
        boolean inRun = false;
        for (int i = 0; i < parts.size(); i++) {
            boolean marked = !plain && selected.test(i);
            if (i > 0) {
                if (inRun && !marked) {
                    sb.append(highlight.end());
                    inRun = false;
                }
                sb.append(separator);
            }
            if (marked && !inRun) {
                sb.append(highlight.start());
                inRun = true;
            }
            sb.append(parts.get(i));
        }
        if (inRun) {
            sb.append(highlight.end());
        }
        return sb.append(close).toString();
    }

}
