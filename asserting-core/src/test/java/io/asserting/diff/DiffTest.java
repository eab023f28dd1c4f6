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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffTest {

    static String left(String left, List<DiffSegment> segments) {
        int[] cps = left.codePoints().toArray();
        StringBuilder sb = new StringBuilder();
        for (DiffSegment segment : segments) {
            if (!segment.isOnlyRight()) {
                sb.append(new String(cps, segment.leftIndex(), segment.length()));
            }
        }
        return sb.toString();
    }

    static String right(String right, List<DiffSegment> segments) {
        int[] cps = right.codePoints().toArray();
        StringBuilder sb = new StringBuilder();
        for (DiffSegment segment : segments) {
            if (!segment.isOnlyLeft()) {
                sb.append(new String(cps, segment.rightIndex(), segment.length()));
            }
        }
        return sb.toString();
    }

    @ParameterizedTest
    @CsvSource(value = {
            "Hello Welt!;Hello World!",
            "abcabba;cbabac",
            "kitten;sitting",
            "the quick brown fox;the lazy dog",
            "aaaa;aa",
            "a;b",
            "x;xyz",
            "xyz;z",
            "Grüße ✓;Grüsse ✓✓"}, delimiter = ';')
    void testRoundTrip(String a, String b) {
        List<DiffSegment> segments = Diff.diff(a, b);
        assertEquals(a, left(a, segments));
        assertEquals(b, right(b, segments));
    }

    @ParameterizedTest
    @CsvSource(value = {
            "Hello Welt!;Hello World!",
            "abcabba;cbabac",
            "kitten;sitting"}, delimiter = ';')
    void testNoAdjacentSegmentsOfSameKind(String a, String b) {
        List<DiffSegment> segments = Diff.diff(a, b);
        for (int i = 1; i < segments.size(); i++) {
            assertNotEquals(segments.get(i - 1).kind(), segments.get(i).kind(), segments.toString());
        }
    }

    @Test
    void testIdentity() {
        assertEquals(List.of(DiffSegment.common(0, 0, 11)), Diff.diff("hello world", "hello world"));
    }

    @Test
    void testEmpty() {
        assertEquals(List.of(), Diff.diff("", ""));
        assertEquals(List.of(DiffSegment.onlyRight(0, 3)), Diff.diff("", "abc"));
        assertEquals(List.of(DiffSegment.onlyLeft(0, 3)), Diff.diff("abc", ""));
    }

    @Test
    void testDisjoint() {
        assertEquals(List.of(DiffSegment.onlyLeft(0, 3), DiffSegment.onlyRight(0, 2)), Diff.diff("abc", "xy"));
    }

    @Test
    void testHelloWelt() {
        List<DiffSegment> segments = Diff.diff("Hello Welt!", "Hello World!");
        assertEquals(List.of(
                DiffSegment.common(0, 0, 7),
                DiffSegment.onlyLeft(7, 1),
                DiffSegment.onlyRight(7, 2),
                DiffSegment.common(8, 9, 1),
                DiffSegment.onlyLeft(9, 1),
                DiffSegment.onlyRight(10, 1),
                DiffSegment.common(10, 11, 1)), segments);
    }

    @Test
    void testDeterministic() {
        assertEquals(Diff.diff("abcabba", "cbabac"), Diff.diff("abcabba", "cbabac"));
    }

    @Test
    void testCodePoints() {
        // the emoji is one code point but two chars
        List<DiffSegment> segments = Diff.diff("a\uD83D\uDE00b", "ab");
        assertEquals(List.of(
                DiffSegment.common(0, 0, 1),
                DiffSegment.onlyLeft(1, 1),
                DiffSegment.common(2, 1, 1)), segments);
    }

    @Test
    void testLists() {
        List<DiffSegment> segments = Diff.diff(List.of(1, 2, 3, 4), List.of(1, 3, 4, 5));
        assertEquals(List.of(
                DiffSegment.common(0, 0, 1),
                DiffSegment.onlyLeft(1, 1),
                DiffSegment.common(2, 1, 2),
                DiffSegment.onlyRight(3, 1)), segments);
    }

    @Test
    void testSegmentToString() {
        assertEquals("OnlyLeft{index=1, length=2}", DiffSegment.onlyLeft(1, 2).toString());
        assertEquals("Common{leftIndex=0, rightIndex=3, length=4}", DiffSegment.common(0, 3, 4).toString());
        assertEquals("OnlyRight{index=5, length=1}", DiffSegment.onlyRight(5, 1).toString());
    }

}
