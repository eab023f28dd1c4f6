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
package io.asserting.expectation;

import io.asserting.output.Debug;
import io.asserting.output.DiffFormat;
import io.asserting.output.Marker;
import io.asserting.spec.Expectation;
import io.asserting.spec.Expression;
import io.asserting.spec.Invertible;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Substring check. When inverted the message highlights every occurrence of the
 * unexpected substring.
 */
public class StringContains implements Expectation<CharSequence>, Invertible {

    private final String expected;

    public StringContains(String expected) {
        this.expected = Objects.requireNonNull(expected, "expected");
    }

    @Override
    public boolean test(CharSequence subject) {
        return subject != null && subject.toString().contains(expected);
    }

    @Override
    public String message(Expression expression, CharSequence actual, boolean inverted, DiffFormat format) {
        String text = String.valueOf(actual);
        String not = inverted ? "not " : "";
        String markedActual = inverted
                ? Marker.markSelectedChars(text, occurrences(text), format.actual())
                : Marker.markUnexpectedSubstr(text, format);
        return "expected " + expression + " to " + not + "contain " + Debug.format(expected)
                + "\n   but was: \"" + markedActual + "\""
                + "\n  expected: " + not + "\"" + Marker.markMissingSubstr(expected, format) + "\"";
    }

    // code point positions covered by non-overlapping occurrences
    private Set<Integer> occurrences(String text) {
        Set<Integer> positions = new TreeSet<>();
        if (expected.isEmpty()) {
            return positions;
        }
        int length = expected.codePointCount(0, expected.length());
        int from = 0;
        int index;
        while ((index = text.indexOf(expected, from)) >= 0) {
            int start = text.codePointCount(0, index);
            for (int i = 0; i < length; i++) {
                positions.add(start + i);
            }
            from = index + expected.length();
        }
        return positions;
    }

}
